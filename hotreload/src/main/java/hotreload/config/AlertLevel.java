package hotreload.config;

/**
 * Alert level for reload logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link hotreload.alert.ReloadAlertLogger}. Configured through the
 * {@code hotreload.alert.level} property.
 *
 * @see HotReloadConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log all events: reload started, phase timings, completion, warnings and errors. */
    DEBUG,

    /** Log warnings (per-member synthesis or hook failures) and errors. The default. */
    WARNING,

    /** Log errors only (failed reload cycles, timeouts). */
    ERROR
}
