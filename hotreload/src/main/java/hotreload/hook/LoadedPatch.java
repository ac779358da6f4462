package hotreload.hook;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A patch module defined in the live process.
 */
public final class LoadedPatch {

    private final String module;
    private final long sequence;
    private final Path jarPath;
    private final Map<String, Class<?>> classes;

    public LoadedPatch(String module, long sequence, Path jarPath, Map<String, Class<?>> classes) {
        this.module = module;
        this.sequence = sequence;
        this.jarPath = jarPath;
        this.classes = Collections.unmodifiableMap(new TreeMap<>(classes));
    }

    public String module() {
        return module;
    }

    public long sequence() {
        return sequence;
    }

    public Path jarPath() {
        return jarPath;
    }

    /** Defined classes keyed by internal name. */
    public Map<String, Class<?>> classes() {
        return classes;
    }

    public Class<?> classFor(String internalName) {
        return classes.get(internalName);
    }
}
