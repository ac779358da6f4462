package hotreload.engine;

import hotreload.hook.HookRecordSnapshot;

import java.util.List;

/**
 * Outcome of {@link HotReloadEngine#initialize}.
 *
 * @param success whether every module was initialized
 * @param message summary, or the first failure
 * @param modules names of the initialized modules
 * @param persistedRecords hook records persisted by an earlier process, or null when there are none
 */
public record InitializeResult(boolean success, String message, List<String> modules,
                               HookRecordSnapshot persistedRecords) {

    public InitializeResult {
        modules = List.copyOf(modules);
    }

    public static InitializeResult success(List<String> modules, HookRecordSnapshot persisted) {
        String message = "Initialized " + modules.size() + " module(s)"
                + (persisted != null ? " with " + persisted.size() + " persisted hook record(s)" : "");
        return new InitializeResult(true, message, modules, persisted);
    }

    public static InitializeResult failure(String message, List<String> modules) {
        return new InitializeResult(false, message, modules, null);
    }

    public boolean hasPersistedRecords() {
        return persistedRecords != null && !persistedRecords.isEmpty();
    }
}
