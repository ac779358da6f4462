package hotreload.exceptions;

import java.util.List;

/**
 * Thrown when the front-end compiler cannot produce a candidate module.
 *
 * <p>No diff is attempted and the module snapshot is left untouched.
 */
public class CompileException extends HotReloadException {

    private final List<String> diagnostics;

    public CompileException(String module, List<String> diagnostics) {
        super(formatMessage(diagnostics), module, null, null, "compile", null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public CompileException(String module, String message, Throwable cause) {
        super(message, module, null, null, "compile", cause);
        this.diagnostics = List.of(message);
    }

    /**
     * Returns the compiler diagnostics, one formatted entry per error.
     *
     * @return the diagnostics, never null
     */
    public List<String> getDiagnostics() {
        return diagnostics;
    }

    private static String formatMessage(List<String> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "Compilation failed";
        }
        return "Compilation failed with " + diagnostics.size() + " error(s): " + diagnostics.get(0);
    }
}
