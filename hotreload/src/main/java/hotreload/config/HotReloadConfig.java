package hotreload.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Central configuration for the reload engine.
 *
 * <p>Covers the working directory for patch modules and hook records, phase
 * timeouts, whether generic-method modifications cascade to their callers,
 * history size and alert level.
 *
 * <p>Configuration can be loaded from {@code hotreload.properties} or
 * {@code hotreload.yml} using {@link HotReloadConfigLoader}.
 */
public final class HotReloadConfig {

    public static final HotReloadConfig DEFAULTS = builder().build();

    private final Path workDir;
    private final Duration compileTimeout;
    private final Duration synthesizeTimeout;
    private final Duration applyTimeout;
    private final boolean cascadeGenerics;
    private final boolean persistHooks;
    private final int historySize;
    private final AlertLevel alertLevel;

    private HotReloadConfig(Builder b) {
        this.workDir = b.workDir;
        this.compileTimeout = b.compileTimeout;
        this.synthesizeTimeout = b.synthesizeTimeout;
        this.applyTimeout = b.applyTimeout;
        this.cascadeGenerics = b.cascadeGenerics;
        this.persistHooks = b.persistHooks;
        this.historySize = b.historySize;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the root directory under which per-project patch state is written. */
    public Path workDir() { return workDir; }

    /** Returns the timeout for compiling a candidate module. */
    public Duration compileTimeout() { return compileTimeout; }

    /** Returns the timeout for synthesizing and writing a patch module. */
    public Duration synthesizeTimeout() { return synthesizeTimeout; }

    /** Returns the timeout for applying hooks. */
    public Duration applyTimeout() { return applyTimeout; }

    /** Returns true if callers of modified generic methods are re-marked as modified. */
    public boolean cascadeGenerics() { return cascadeGenerics; }

    /** Returns true if hook records are written to disk after each apply. */
    public boolean persistHooks() { return persistHooks; }

    /** Returns the maximum number of reload history entries to keep. */
    public int historySize() { return historySize; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "HotReloadConfig{" +
                "workDir=" + workDir +
                ", compileTimeout=" + compileTimeout.toSeconds() + "s" +
                ", synthesizeTimeout=" + synthesizeTimeout.toSeconds() + "s" +
                ", applyTimeout=" + applyTimeout.toSeconds() + "s" +
                ", cascadeGenerics=" + cascadeGenerics +
                ", persistHooks=" + persistHooks +
                ", historySize=" + historySize +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link HotReloadConfig} instances.
     */
    public static final class Builder {
        private Path workDir = Path.of(System.getProperty("java.io.tmpdir"), "hotreload");
        private Duration compileTimeout = Duration.ZERO;
        private Duration synthesizeTimeout = Duration.ZERO;
        private Duration applyTimeout = Duration.ZERO;
        private boolean cascadeGenerics = true;
        private boolean persistHooks = true;
        private int historySize = 10;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder workDir(Path dir) {
            if (dir == null) throw new IllegalArgumentException("workDir must not be null");
            this.workDir = dir;
            return this;
        }

        public Builder compileTimeout(Duration timeout) {
            this.compileTimeout = timeout;
            return this;
        }

        public Builder compileTimeoutSeconds(long seconds) {
            return compileTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder synthesizeTimeout(Duration timeout) {
            this.synthesizeTimeout = timeout;
            return this;
        }

        public Builder synthesizeTimeoutSeconds(long seconds) {
            return synthesizeTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder applyTimeout(Duration timeout) {
            this.applyTimeout = timeout;
            return this;
        }

        public Builder applyTimeoutSeconds(long seconds) {
            return applyTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder cascadeGenerics(boolean cascade) {
            this.cascadeGenerics = cascade;
            return this;
        }

        public Builder persistHooks(boolean persist) {
            this.persistHooks = persist;
            return this;
        }

        public Builder historySize(int size) {
            if (size <= 0) throw new IllegalArgumentException("historySize must be positive");
            this.historySize = size;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public HotReloadConfig build() {
            return new HotReloadConfig(this);
        }
    }
}
