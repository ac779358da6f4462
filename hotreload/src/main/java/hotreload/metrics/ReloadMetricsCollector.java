package hotreload.metrics;

import hotreload.metrics.ReloadMetrics.Phase;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects timing and heap metrics for one reload cycle.
 *
 * <h2>Usage:</h2>
 * <pre>
 * ReloadMetricsCollector collector = new ReloadMetricsCollector().start(reloadId, "app");
 * ModuleDiff diff = collector.timed(Phase.COMPILE, () -&gt; engine.compileAndDiff("app", files));
 * ReloadMetrics metrics = collector.finish();
 * </pre>
 */
public final class ReloadMetricsCollector {

    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

    private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);
    private ReloadMetrics.Builder builder;
    private Instant startTime;

    /**
     * Starts metrics collection for a new reload cycle.
     *
     * @param reloadId the unique reload identifier
     * @param module the module being reloaded
     * @return this collector for method chaining
     */
    public ReloadMetricsCollector start(long reloadId, String module) {
        this.startTime = Instant.now();
        this.phaseDurations.clear();
        this.builder = ReloadMetrics.builder()
                .reloadId(reloadId)
                .module(module)
                .startTime(startTime)
                .heapUsedBefore(memoryBean.getHeapMemoryUsage().getUsed());
        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a phase and run the action (can throw checked exceptions).
     */
    public <E extends Exception> void timed(Phase phase, ThrowingRunnable<E> action) throws E {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            phaseDurations.put(phase, Duration.ofNanos(System.nanoTime() - start).toMillis());
        }
    }

    /**
     * Time a phase and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(Phase phase, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            phaseDurations.put(phase, Duration.ofNanos(System.nanoTime() - start).toMillis());
        }
    }

    public long phaseDuration(Phase phase) {
        return phaseDurations.getOrDefault(phase, 0L);
    }

    public ReloadMetricsCollector typesChanged(int count) {
        builder.typesChanged(count);
        return this;
    }

    public ReloadMetricsCollector membersSynthesized(int count) {
        builder.membersSynthesized(count);
        return this;
    }

    public ReloadMetricsCollector synthesisFailures(int count) {
        builder.synthesisFailures(count);
        return this;
    }

    public ReloadMetricsCollector hooks(int applied, int failed) {
        builder.hooksApplied(applied).hooksFailed(failed);
        return this;
    }

    /**
     * Finishes metrics collection and returns the final metrics.
     *
     * @return the collected reload metrics
     */
    public ReloadMetrics finish() {
        Instant endTime = Instant.now();
        return builder
                .endTime(endTime)
                .heapUsedAfter(memoryBean.getHeapMemoryUsage().getUsed())
                .phaseDurations(phaseDurations)
                .totalDurationMs(Duration.between(startTime, endTime).toMillis())
                .build();
    }
}
