package hotreload.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during one reload cycle.
 *
 * <p>Use {@link #summary()} for a human-readable line, or {@link #toMap()}
 * for structured output.
 *
 * @see ReloadMetricsCollector
 */
public record ReloadMetrics(
        long reloadId,
        String module,
        Instant startTime,
        Instant endTime,
        long heapUsedBefore,
        long heapUsedAfter,
        Map<Phase, Long> phaseDurations,
        long totalDurationMs,
        int typesChanged,
        int membersSynthesized,
        int synthesisFailures,
        int hooksApplied,
        int hooksFailed
) {
    /**
     * Reload pipeline phases for timing breakdown.
     */
    public enum Phase {
        /** Front-end compilation of the candidate module */
        COMPILE,
        /** Structural diff and generic cascade */
        DIFF,
        /** Patch synthesis and patch module write */
        SYNTHESIZE,
        /** Patch load and entry-point redirection */
        APPLY
    }

    /**
     * Returns the change in heap usage across the cycle.
     *
     * @return heap delta in bytes (positive means increase)
     */
    public long heapDelta() {
        return heapUsedAfter - heapUsedBefore;
    }

    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the duration of a specific phase.
     *
     * @param phase the phase to query
     * @return duration in milliseconds, or 0 if phase not recorded
     */
    public long phaseDuration(Phase phase) {
        return phaseDurations.getOrDefault(phase, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Reload #%d of %s in %dms | types: %d | synthesized: %d (%d failed) | hooks: %d (%d failed) | heap delta: %s",
                reloadId, module, totalDurationMs, typesChanged, membersSynthesized, synthesisFailures,
                hooksApplied, hooksFailed, formatBytes(heapDelta()));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("reloadId", reloadId);
        map.put("module", module);
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("heapDelta", heapDelta());
        map.put("typesChanged", typesChanged);
        map.put("membersSynthesized", membersSynthesized);
        map.put("synthesisFailures", synthesisFailures);
        map.put("hooksApplied", hooksApplied);
        map.put("hooksFailed", hooksFailed);
        phaseDurations.forEach((phase, duration) ->
                map.put(phase.name().toLowerCase(Locale.ROOT) + "DurationMs", duration));
        return map;
    }

    private static String formatBytes(long bytes) {
        long abs = Math.abs(bytes);
        if (abs < 1024) return bytes + "B";
        if (abs < 1024 * 1024) return String.format(Locale.ROOT, "%.1fKB", bytes / 1024.0);
        return String.format(Locale.ROOT, "%.1fMB", bytes / (1024.0 * 1024));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing {@link ReloadMetrics} instances.
     */
    public static class Builder {
        private long reloadId;
        private String module;
        private Instant startTime;
        private Instant endTime;
        private long heapUsedBefore;
        private long heapUsedAfter;
        private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);
        private long totalDurationMs;
        private int typesChanged, membersSynthesized, synthesisFailures, hooksApplied, hooksFailed;

        public Builder reloadId(long id) { this.reloadId = id; return this; }
        public Builder module(String m) { this.module = m; return this; }
        public Builder startTime(Instant t) { this.startTime = t; return this; }
        public Builder endTime(Instant t) { this.endTime = t; return this; }
        public Builder heapUsedBefore(long v) { this.heapUsedBefore = v; return this; }
        public Builder heapUsedAfter(long v) { this.heapUsedAfter = v; return this; }

        public Builder phaseDurations(Map<Phase, Long> durations) {
            this.phaseDurations.putAll(durations);
            return this;
        }

        public Builder totalDurationMs(long v) { this.totalDurationMs = v; return this; }
        public Builder typesChanged(int v) { this.typesChanged = v; return this; }
        public Builder membersSynthesized(int v) { this.membersSynthesized = v; return this; }
        public Builder synthesisFailures(int v) { this.synthesisFailures = v; return this; }
        public Builder hooksApplied(int v) { this.hooksApplied = v; return this; }
        public Builder hooksFailed(int v) { this.hooksFailed = v; return this; }

        public ReloadMetrics build() {
            return new ReloadMetrics(reloadId, module, startTime, endTime,
                    heapUsedBefore, heapUsedAfter, new EnumMap<>(phaseDurations), totalDurationMs,
                    typesChanged, membersSynthesized, synthesisFailures, hooksApplied, hooksFailed);
        }
    }
}
