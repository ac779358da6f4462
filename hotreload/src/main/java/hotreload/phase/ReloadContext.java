package hotreload.phase;

import java.nio.file.Path;

/**
 * Context information delivered to {@link ReloadPhaseListener} callbacks.
 */
public final class ReloadContext {

    private final String module;
    private final long reloadId;
    private final Path patchPath;
    private final long startedAtNanos;

    public ReloadContext(String module, long reloadId, Path patchPath) {
        this.module = module;
        this.reloadId = reloadId;
        this.patchPath = patchPath;
        this.startedAtNanos = System.nanoTime();
    }

    /** The module whose patch is being applied. */
    public String module() {
        return module;
    }

    /** Unique identifier of the reload cycle, or 0 for a standalone apply. */
    public long reloadId() {
        return reloadId;
    }

    /** The patch module being applied, or null when re-applying persisted hooks. */
    public Path patchPath() {
        return patchPath;
    }

    /** Timestamp (in nanos) when this context was created. */
    public long startedAtNanos() {
        return startedAtNanos;
    }
}
