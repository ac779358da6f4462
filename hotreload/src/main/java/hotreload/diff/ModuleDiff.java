package hotreload.diff;

import hotreload.module.CompiledModule;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Result of diffing a candidate module against its snapshot: one
 * {@link TypeDiff} per type with work to do, plus the candidate itself
 * (synthesis needs its nested types, lambda bodies and initializers).
 */
public final class ModuleDiff {

    private final String module;
    private final CompiledModule candidate;
    private final Map<String, TypeDiff> types;

    ModuleDiff(String module, CompiledModule candidate, Map<String, TypeDiff> types) {
        this.module = module;
        this.candidate = candidate;
        Map<String, TypeDiff> nonEmpty = new TreeMap<>();
        types.forEach((name, diff) -> {
            if (!diff.isEmpty()) nonEmpty.put(name, diff);
        });
        this.types = Collections.unmodifiableMap(nonEmpty);
    }

    static ModuleDiff empty(String module, CompiledModule candidate) {
        return new ModuleDiff(module, candidate, Map.of());
    }

    public String module() {
        return module;
    }

    public CompiledModule candidate() {
        return candidate;
    }

    /** Type diffs keyed by internal name, in name order. */
    public Map<String, TypeDiff> types() {
        return types;
    }

    public TypeDiff type(String internalName) {
        return types.get(internalName);
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    public Set<String> newTypes() {
        Set<String> result = new TreeSet<>();
        types.forEach((name, diff) -> {
            if (diff.isNewType()) result.add(name);
        });
        return result;
    }

    public int memberCount() {
        return types.values().stream().mapToInt(TypeDiff::memberCount).sum();
    }

    @Override
    public String toString() {
        return "ModuleDiff{" + module + ", types=" + types.values() + '}';
    }
}
