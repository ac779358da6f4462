package hotreload.hook;

import hotreload.exceptions.HookException;
import hotreload.synth.PatchArchive;
import hotreload.synth.PatchModule;
import org.objectweb.asm.ClassReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.instrument.Instrumentation;
import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Defines patch classes through a private lookup on a loaded type of the
 * same package, which places them in that type's class loader and runtime
 * package.
 */
public class LookupPatchLoader implements PatchLoader {

    private static final Logger log = LoggerFactory.getLogger(LookupPatchLoader.class);

    private final ClassLocator classes;
    private final ClassBytesLocator classBytes;
    private final Instrumentation instrumentation;
    private final Map<Path, LoadedPatch> loaded = new ConcurrentHashMap<>();

    /**
     * @param classes finds the host types of the live process
     * @param classBytes receives the bytes of defined classes, so they can be redirected later
     * @param instrumentation used to open packages of named modules; may be null
     */
    public LookupPatchLoader(ClassLocator classes, ClassBytesLocator classBytes, Instrumentation instrumentation) {
        this.classes = classes;
        this.classBytes = classBytes;
        this.instrumentation = instrumentation;
    }

    @Override
    public synchronized LoadedPatch load(Path jarPath) throws HookException {
        LoadedPatch known = loaded.get(jarPath);
        if (known != null) return known;
        PatchArchive archive;
        try {
            archive = PatchArchive.read(jarPath);
        } catch (IOException e) {
            throw new HookException("Cannot read patch " + jarPath + ": " + e.getMessage(), e);
        }
        return load(archive.toPatchModule());
    }

    @Override
    public synchronized LoadedPatch load(PatchModule patch) throws HookException {
        LoadedPatch known = loaded.get(patch.jarPath());
        if (known != null) return known;

        for (Path required : patch.requires()) {
            load(required);
        }

        Map<String, Class<?>> defined = new TreeMap<>();
        for (String name : definitionOrder(patch.classes())) {
            String hostName = patch.hosts().get(name);
            if (hostName == null) {
                throw new HookException("Patch class " + name + " has no host type", name, null);
            }
            Class<?> host = classes.find(hostName.replace('/', '.'))
                    .orElseThrow(() -> new HookException("Host type " + hostName.replace('/', '.')
                            + " of " + name + " is not loaded", name, null));
            defined.put(name, define(name, patch.classes().get(name), host));
        }

        // run registrations of added field initializers
        for (var entry : defined.entrySet()) {
            String hostName = patch.hosts().get(entry.getKey());
            if (entry.getKey().equals(patch.naming().patchClassName(hostName))) {
                initialize(entry.getValue());
            }
        }

        LoadedPatch result = new LoadedPatch(patch.module(), patch.sequence(), patch.jarPath(), defined);
        loaded.put(patch.jarPath(), result);
        log.info("Loaded patch {} ({} classes)", patch.jarPath().getFileName(), defined.size());
        return result;
    }

    public Optional<LoadedPatch> loaded(Path jarPath) {
        return Optional.ofNullable(loaded.get(jarPath));
    }

    private Class<?> define(String name, byte[] bytes, Class<?> host) throws HookException {
        String binaryName = name.replace('/', '.');
        Optional<Class<?>> existing = sameLoader(binaryName, host);
        if (existing.isPresent()) {
            log.debug("{} is already defined; reusing it", binaryName);
            classBytes.update(existing.get(), bytes);
            return existing.get();
        }
        openPackage(host);
        try {
            MethodHandles.Lookup lookup = MethodHandles.privateLookupIn(host, MethodHandles.lookup());
            Class<?> type = lookup.defineClass(bytes);
            classBytes.update(type, bytes);
            return type;
        } catch (IllegalAccessException | LinkageError | RuntimeException e) {
            throw new HookException("Cannot define " + binaryName + " through " + host.getName() + ": " + e, name, e);
        }
    }

    private static Optional<Class<?>> sameLoader(String binaryName, Class<?> host) {
        try {
            return Optional.of(Class.forName(binaryName, false, host.getClassLoader()));
        } catch (ClassNotFoundException e) {
            return Optional.empty();
        }
    }

    private void initialize(Class<?> type) throws HookException {
        try {
            Class.forName(type.getName(), true, type.getClassLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            throw new HookException("Cannot initialize " + type.getName() + ": " + e, type.getName(), e);
        }
    }

    /**
     * Opens the host's package to this loader when the host lives in a named
     * module.
     */
    private void openPackage(Class<?> host) {
        Module hostModule = host.getModule();
        Module self = LookupPatchLoader.class.getModule();
        if (!hostModule.isNamed() || hostModule.isOpen(host.getPackageName(), self)) return;
        if (instrumentation == null || !instrumentation.isModifiableModule(hostModule)) {
            log.warn("Package {} of {} is not open and cannot be opened", host.getPackageName(), hostModule);
            return;
        }
        instrumentation.redefineModule(hostModule, Set.of(), Map.of(),
                Map.of(host.getPackageName(), Set.of(self)), Set.of(), Map.of());
        log.debug("Opened {} of {}", host.getPackageName(), hostModule);
    }

    /**
     * Orders classes so that superclasses and superinterfaces defined by the
     * same patch come first.
     */
    static List<String> definitionOrder(Map<String, byte[]> classes) {
        Map<String, List<String>> supers = new LinkedHashMap<>();
        for (var entry : new TreeMap<>(classes).entrySet()) {
            ClassReader reader = new ClassReader(entry.getValue());
            List<String> deps = new ArrayList<>();
            if (reader.getSuperName() != null) deps.add(reader.getSuperName());
            deps.addAll(List.of(reader.getInterfaces()));
            deps.removeIf(d -> !classes.containsKey(d));
            supers.put(entry.getKey(), deps);
        }
        List<String> order = new ArrayList<>();
        Set<String> done = new HashSet<>();
        for (String name : supers.keySet()) {
            visit(name, supers, done, new HashSet<>(), order);
        }
        return order;
    }

    private static void visit(String name, Map<String, List<String>> supers, Set<String> done,
                              Set<String> inProgress, List<String> order) {
        if (done.contains(name) || !inProgress.add(name)) return;
        for (String dep : supers.get(name)) {
            visit(dep, supers, done, inProgress, order);
        }
        done.add(name);
        order.add(name);
    }
}
