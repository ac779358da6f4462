package hotreload.exceptions;

/**
 * Exception thrown when a reload operation fails.
 *
 * <p>Carries enough identity to locate the offending source edit:
 * <ul>
 *   <li>the module being reloaded</li>
 *   <li>the type and member involved, when the failure is member-specific</li>
 *   <li>the pipeline stage where the failure occurred</li>
 * </ul>
 *
 * <p>All diagnostic fields are plain strings so the exception never pins
 * classes of the patched process.
 *
 * @see hotreload.engine.HotReloadEngine
 */
public class HotReloadException extends Exception {

    private final String module;
    private final String typeName;
    private final String memberName;
    private final String stage;

    /**
     * Creates a new reload exception with a message.
     *
     * @param message the error message
     */
    public HotReloadException(String message) {
        this(message, null, null, null, null, null);
    }

    /**
     * Creates a new reload exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public HotReloadException(String message, Throwable cause) {
        this(message, null, null, null, null, cause);
    }

    /**
     * Creates a new reload exception with full diagnostic context.
     *
     * @param message the error message
     * @param module the module being reloaded
     * @param typeName the type involved (internal or binary name)
     * @param memberName the member involved (name plus descriptor)
     * @param stage the pipeline stage where the failure occurred
     * @param cause the underlying cause, may be null
     */
    public HotReloadException(String message,
                              String module,
                              String typeName,
                              String memberName,
                              String stage,
                              Throwable cause) {
        super(message, cause);
        this.module = module;
        this.typeName = typeName;
        this.memberName = memberName;
        this.stage = stage;
    }

    /** Returns the module being reloaded, or null if not set. */
    public String getModule() {
        return module;
    }

    /** Returns the type involved, or null if not set. */
    public String getTypeName() {
        return typeName;
    }

    /** Returns the member involved, or null if not set. */
    public String getMemberName() {
        return memberName;
    }

    /** Returns the stage where the failure occurred, or null if not set. */
    public String getStage() {
        return stage;
    }

    /** Returns the message without the diagnostic suffix. */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (module != null) sb.append(" [module=").append(module).append("]");
        if (typeName != null) sb.append(" [type=").append(typeName).append("]");
        if (memberName != null) sb.append(" [member=").append(memberName).append("]");

        return sb.toString();
    }
}
