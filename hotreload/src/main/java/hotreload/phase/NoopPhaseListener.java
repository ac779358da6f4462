package hotreload.phase;

/**
 * Default listener used when the application does not supply one.
 */
public enum NoopPhaseListener implements ReloadPhaseListener {
    INSTANCE;

    @Override
    public void onBeforeApply(ReloadContext ctx) { /* no-op */ }

    @Override
    public void onAfterApply(ReloadContext ctx) { /* no-op */ }
}
