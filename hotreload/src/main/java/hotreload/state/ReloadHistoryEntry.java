package hotreload.state;

import hotreload.metrics.ReloadMetrics;

import java.time.Instant;

/**
 * Immutable record of a single reload cycle in history.
 *
 * @param reloadId unique identifier for the cycle
 * @param module the module that was reloaded
 * @param timestamp when the cycle completed (or failed)
 * @param status final status of the cycle
 * @param metrics metrics from the cycle (may be null if it failed early)
 * @param errorMessage error message if the cycle failed (null on success)
 * @see ReloadState
 */
public record ReloadHistoryEntry(
        long reloadId,
        String module,
        Instant timestamp,
        ReloadState.Status status,
        ReloadMetrics metrics,
        String errorMessage
) {
    public static ReloadHistoryEntry success(long reloadId, String module, ReloadMetrics metrics) {
        return new ReloadHistoryEntry(reloadId, module, Instant.now(), ReloadState.Status.SUCCESS, metrics, null);
    }

    public static ReloadHistoryEntry failure(long reloadId, String module, String errorMessage, ReloadMetrics partialMetrics) {
        return new ReloadHistoryEntry(reloadId, module, Instant.now(), ReloadState.Status.FAILED, partialMetrics, errorMessage);
    }
}
