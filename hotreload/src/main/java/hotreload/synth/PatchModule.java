package hotreload.synth;

import hotreload.module.MethodKey;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A synthesized patch module: class files ready to be defined in the live
 * process plus the metadata the hook applier needs.
 *
 * <p>Class files are keyed by internal name. Every class is defined through
 * a lookup on its host, a loaded type of the same package.
 */
public final class PatchModule {

    private final PatchNaming naming;
    private final Map<String, byte[]> classes;
    private final Map<String, String> hosts;
    private final List<PatchedMethod> methods;
    private final Set<String> newTypes;
    private final List<FieldInitializer> initializers;
    private final List<SynthesisFailure> failures;
    private final Set<Path> requires;

    public PatchModule(PatchNaming naming,
                       Map<String, byte[]> classes,
                       Map<String, String> hosts,
                       List<PatchedMethod> methods,
                       Set<String> newTypes,
                       List<FieldInitializer> initializers,
                       List<SynthesisFailure> failures,
                       Set<Path> requires) {
        this.naming = naming;
        this.classes = Collections.unmodifiableMap(new TreeMap<>(classes));
        this.hosts = Collections.unmodifiableMap(new TreeMap<>(hosts));
        this.methods = List.copyOf(methods);
        this.newTypes = Collections.unmodifiableSet(new TreeSet<>(newTypes));
        this.initializers = List.copyOf(initializers);
        this.failures = List.copyOf(failures);
        this.requires = Collections.unmodifiableSet(new LinkedHashSet<>(requires));
    }

    public PatchNaming naming() {
        return naming;
    }

    public String module() {
        return naming.module();
    }

    public long sequence() {
        return naming.sequence();
    }

    public Path jarPath() {
        return naming.jarPath();
    }

    public Map<String, byte[]> classes() {
        return classes;
    }

    /** Loaded type through which each class is defined. */
    public Map<String, String> hosts() {
        return hosts;
    }

    public List<PatchedMethod> methods() {
        return methods;
    }

    public Optional<PatchedMethod> method(MethodKey original) {
        return methods.stream().filter(m -> m.original().equals(original)).findFirst();
    }

    /** Types the live process has not loaded before, defined under their own names. */
    public Set<String> newTypes() {
        return newTypes;
    }

    public Map<String, byte[]> newTypeClasses() {
        Map<String, byte[]> result = new TreeMap<>();
        for (String name : newTypes) {
            byte[] bytes = classes.get(name);
            if (bytes != null) result.put(name, bytes);
        }
        return result;
    }

    public List<FieldInitializer> initializers() {
        return initializers;
    }

    public List<SynthesisFailure> failures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /** Earlier patch jars whose wrappers this module calls. */
    public Set<Path> requires() {
        return requires;
    }

    public boolean isEmpty() {
        return classes.isEmpty();
    }

    @Override
    public String toString() {
        List<String> names = new ArrayList<>(classes.keySet());
        return "PatchModule{" + naming.module() + "#" + naming.sequence() +
                ", classes=" + names +
                ", methods=" + methods.size() +
                ", failures=" + failures.size() +
                '}';
    }
}
