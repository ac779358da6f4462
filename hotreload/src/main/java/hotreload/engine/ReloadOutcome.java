package hotreload.engine;

import hotreload.hook.HookReport;
import hotreload.metrics.ReloadMetrics;

/**
 * Result of one full reload cycle.
 *
 * @param module module name
 * @param reloadId id of the cycle
 * @param status overall result
 * @param patch the synthesized patch, or null when there was nothing to patch
 * @param hooks the hook report, or null when no hooks were applied
 * @param metrics timing and counts of the cycle
 */
public record ReloadOutcome(String module, long reloadId, Status status, PatchResult patch, HookReport hooks,
                            ReloadMetrics metrics) {

    public enum Status {
        /** No declared member changed. */
        NOTHING_TO_PATCH,
        /** Every changed member was synthesized and hooked. */
        APPLIED,
        /** Some members failed to synthesize or hook; the rest are live. */
        PARTIAL
    }
}
