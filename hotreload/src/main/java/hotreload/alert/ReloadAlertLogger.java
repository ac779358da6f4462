package hotreload.alert;

import hotreload.config.AlertLevel;
import hotreload.metrics.ReloadMetrics;
import hotreload.metrics.ReloadMetrics.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for reload events.
 *
 * <p>Entries use markers like RELOAD_STARTED, HOOK_FAILED, RELOAD_COMPLETED
 * with key=value pairs so they can be grepped and alerted on.
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  hotreload - RELOAD_STARTED id=7 module=app
 * 12:00:00.300 INFO  hotreload - PHASE_COMPLETED id=7 phase=COMPILE duration_ms=300
 * 12:00:00.320 WARN  hotreload - HOOK_FAILED member=app.Cart::total()I reason="class not modifiable"
 * 12:00:00.400 INFO  hotreload - RELOAD_COMPLETED id=7 module=app duration_ms=400 hooks_applied=3 hooks_failed=1
 * </pre>
 */
public final class ReloadAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("hotreload");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private ReloadAlertLogger() {}

    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void reloadStarted(long reloadId, String module) {
        if (shouldLogInfo()) {
            log.info("RELOAD_STARTED id={} module={}", reloadId, module);
        }
    }

    public static void phaseCompleted(long reloadId, Phase phase, long durationMs) {
        if (shouldLogInfo()) {
            log.info("PHASE_COMPLETED id={} phase={} duration_ms={}", reloadId, phase.name(), durationMs);
        }
    }

    public static void nothingToPatch(long reloadId, String module) {
        if (shouldLogInfo()) {
            log.info("NOTHING_TO_PATCH id={} module={}", reloadId, module);
        }
    }

    public static void reloadCompleted(long reloadId, ReloadMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("RELOAD_COMPLETED id={} module={} duration_ms={} types_changed={} hooks_applied={} hooks_failed={}",
                    reloadId,
                    metrics.module(),
                    metrics.totalDurationMs(),
                    metrics.typesChanged(),
                    metrics.hooksApplied(),
                    metrics.hooksFailed());
        }
    }

    /**
     * Log a member that could not be synthesized.
     *
     * @param member the member full name
     * @param reason why synthesis failed
     */
    public static void synthesisFailed(String member, String reason) {
        if (shouldLogWarn()) {
            log.warn("SYNTHESIS_FAILED member={} reason=\"{}\"", member, reason);
        }
    }

    /**
     * Log a member whose entry point could not be redirected.
     *
     * @param member the member full name
     * @param reason the reason reported by the redirector
     */
    public static void hookFailed(String member, String reason) {
        if (shouldLogWarn()) {
            log.warn("HOOK_FAILED member={} reason=\"{}\"", member, reason);
        }
    }

    /**
     * Log an edit that compiled but cannot take effect in the running process,
     * such as a constructor body change.
     */
    public static void unhookableChange(String type, String detail) {
        if (shouldLogWarn()) {
            log.warn("UNHOOKABLE_CHANGE type={} detail=\"{}\"", type, detail);
        }
    }

    public static void reloadFailed(long reloadId, String module, Throwable error, Phase currentPhase) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        String phaseName = currentPhase != null ? currentPhase.name() : "UNKNOWN";
        log.error("RELOAD_FAILED id={} module={} phase={} error=\"{}\"", reloadId, module, phaseName, errorMsg);
    }

    public static void reloadTimeout(long reloadId, long timeoutMs, Phase currentPhase) {
        String phaseName = currentPhase != null ? currentPhase.name() : "UNKNOWN";
        log.error("RELOAD_TIMEOUT id={} timeout_ms={} phase={}", reloadId, timeoutMs, phaseName);
    }
}
