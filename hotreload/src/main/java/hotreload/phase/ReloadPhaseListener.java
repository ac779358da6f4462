package hotreload.phase;

import hotreload.exceptions.HotReloadException;

/**
 * Listener signalled around hook application, the only phase that touches
 * the running program's dispatch.
 *
 * <p>These methods are signals, not commands: the engine does not pause the
 * application. Implementations may quiesce work before hooks land and resume
 * afterwards.
 */
public interface ReloadPhaseListener {

    /**
     * Called before hooks are applied. Throwing refuses the apply; no hook of
     * the batch is installed.
     *
     * @param ctx reload context
     * @throws HotReloadException if hooks should not be applied
     */
    void onBeforeApply(ReloadContext ctx) throws HotReloadException;

    /**
     * Called after hooks were applied. Always called if
     * {@link #onBeforeApply} returned normally, even when some hooks failed.
     *
     * @param ctx reload context
     * @throws HotReloadException if resuming fails
     */
    void onAfterApply(ReloadContext ctx) throws HotReloadException;
}
