package hotreload.snapshot;

import hotreload.module.CompiledModule;
import hotreload.module.TypeSourceIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds, per module, the last snapshot and the baseline.
 *
 * <p>The snapshot is what the next candidate is diffed against. The baseline
 * is what the live process has loaded: the original classes plus every new
 * type a patch has defined since. Members are classified as added relative
 * to the baseline, since only those lack a real slot in the running types.
 *
 * <p>Both are replaced wholesale, never mutated. Each module has its own
 * lock; callers hold it for a whole compile, diff and synthesize cycle so
 * that cycles of one module never interleave.
 */
public final class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private static final class ModuleState {
        final ReentrantLock lock = new ReentrantLock();
        volatile ModuleSnapshot snapshot;
        volatile ModuleSnapshot replaced;
        volatile CompiledModule baseline;
    }

    private final Map<String, ModuleState> modules = new ConcurrentHashMap<>();

    /**
     * Establishes the baseline of a module and its first snapshot.
     *
     * @param baseline the classes loaded by the live process
     * @param initial the module version later candidates are diffed against,
     *                usually the baseline itself
     */
    public void initialize(CompiledModule baseline, CompiledModule initial) {
        ModuleState state = modules.computeIfAbsent(baseline.name(), k -> new ModuleState());
        state.lock.lock();
        try {
            state.baseline = baseline;
            state.snapshot = ModuleSnapshot.initial(initial);
            state.replaced = null;
            log.debug("Initialized snapshot of {} with {} classes", baseline.name(), initial.classNames().size());
        } finally {
            state.lock.unlock();
        }
    }

    public boolean contains(String module) {
        ModuleState state = modules.get(module);
        return state != null && state.snapshot != null;
    }

    public Optional<ModuleSnapshot> current(String module) {
        ModuleState state = modules.get(module);
        return state != null ? Optional.ofNullable(state.snapshot) : Optional.empty();
    }

    public Optional<CompiledModule> baseline(String module) {
        ModuleState state = modules.get(module);
        return state != null ? Optional.ofNullable(state.baseline) : Optional.empty();
    }

    /**
     * Replaces the snapshot after a successful cycle.
     */
    public ModuleSnapshot replace(String module, CompiledModule candidate) {
        ModuleState state = require(module);
        ModuleSnapshot next = state.snapshot.next(candidate);
        state.replaced = state.snapshot;
        state.snapshot = next;
        log.debug("Snapshot of {} advanced to cycle {}", module, next.cycle());
        return next;
    }

    /**
     * Puts types of the current snapshot back to their version in the
     * snapshot it replaced, so their members are diffed again next cycle.
     * Types that version lacks keep their current state.
     *
     * @param types internal names of the types to hold back
     * @return the names actually held back
     */
    public Set<String> holdBack(String module, Set<String> types) {
        ModuleState state = require(module);
        ModuleSnapshot earlier = state.replaced;
        if (earlier == null || types.isEmpty()) return Set.of();
        Map<String, byte[]> restored = new TreeMap<>();
        for (String type : types) {
            byte[] bytes = earlier.compiled().classBytes(type);
            if (bytes != null) restored.put(type, bytes);
        }
        if (restored.isEmpty()) return Set.of();
        ModuleSnapshot current = state.snapshot;
        CompiledModule compiled = current.compiled().withClasses(restored);
        state.snapshot = new ModuleSnapshot(module, compiled, TypeSourceIndex.of(compiled), current.cycle());
        log.debug("Held back {} type(s) of {} at their earlier version", restored.size(), module);
        return restored.keySet();
    }

    /**
     * Adds classes a patch defined in the live process to the baseline.
     *
     * @param classes class files keyed by internal name
     */
    public void promoteToBaseline(String module, Map<String, byte[]> classes) {
        if (classes.isEmpty()) return;
        ModuleState state = require(module);
        state.baseline = state.baseline.withClasses(classes);
        log.debug("Promoted {} new type(s) to the baseline of {}", classes.size(), module);
    }

    /**
     * Lock serializing cycles of one module. Different modules use different
     * locks and may proceed concurrently.
     */
    public ReentrantLock lockFor(String module) {
        return modules.computeIfAbsent(module, k -> new ModuleState()).lock;
    }

    public Set<String> modules() {
        return new TreeSet<>(modules.keySet());
    }

    public void clear(String module) {
        modules.remove(module);
    }

    public void clearAll() {
        modules.clear();
    }

    private ModuleState require(String module) {
        ModuleState state = modules.get(module);
        if (state == null || state.snapshot == null) {
            throw new IllegalStateException("Module not initialized: " + module);
        }
        return state;
    }
}
