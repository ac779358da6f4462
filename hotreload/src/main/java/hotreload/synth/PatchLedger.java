package hotreload.synth;

import hotreload.module.MethodKey;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest wrapper of every added method of one module.
 *
 * <p>Added methods only exist as wrappers. Code synthesized in a later cycle
 * that calls an added method it does not itself re-synthesize calls the
 * wrapper recorded here.
 */
public final class PatchLedger {

    private final Map<MethodKey, WrapperRef> latest = new ConcurrentHashMap<>();

    public Optional<WrapperRef> latest(MethodKey method) {
        return Optional.ofNullable(latest.get(method));
    }

    /**
     * Records a wrapper unless a newer one is known.
     */
    public void record(MethodKey method, WrapperRef wrapper) {
        latest.merge(method, wrapper, (old, candidate) -> candidate.sequence() >= old.sequence() ? candidate : old);
    }

    /** Records every added-method wrapper of a patch module. */
    public void recordAll(PatchModule patch) {
        for (PatchedMethod m : patch.methods()) {
            if (m.kind() == WrapperKind.ADDED) {
                record(m.original(), m.wrapper());
            }
        }
    }

    public Map<MethodKey, WrapperRef> entries() {
        return new TreeMap<>(latest);
    }

    public int size() {
        return latest.size();
    }

    public void clear() {
        latest.clear();
    }
}
