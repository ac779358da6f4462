package hotreload.exceptions;

/**
 * Thrown when a single member cannot be synthesized into a patch.
 *
 * <p>The synthesizer catches this per member, records the failure and keeps
 * processing the rest of the diff.
 */
public class SynthesisException extends HotReloadException {

    public SynthesisException(String message, String typeName, String memberName) {
        super(message, null, typeName, memberName, "synthesize", null);
    }

    public SynthesisException(String message, String typeName, String memberName, Throwable cause) {
        super(message, null, typeName, memberName, "synthesize", cause);
    }
}
