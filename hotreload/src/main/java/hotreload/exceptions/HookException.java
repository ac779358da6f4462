package hotreload.exceptions;

/**
 * Thrown when a patch cannot be loaded into the live process or when hooks
 * cannot be applied at all (for example, no instrumentation is available).
 *
 * <p>Failures of individual redirections are reported per method through
 * {@link hotreload.hook.HookReport}, not through this exception.
 */
public class HookException extends HotReloadException {

    public HookException(String message) {
        super(message, null, null, null, "apply", null);
    }

    public HookException(String message, Throwable cause) {
        super(message, null, null, null, "apply", cause);
    }

    public HookException(String message, String typeName, Throwable cause) {
        super(message, null, typeName, null, "apply", cause);
    }
}
