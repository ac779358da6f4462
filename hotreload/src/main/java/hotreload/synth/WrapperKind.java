package hotreload.synth;

/**
 * How a wrapper takes effect in the live process.
 */
public enum WrapperKind {
    /** Replaces the body of a method the loaded type declares. */
    MODIFIED,
    /** Implements a method the loaded type lacks; earlier wrappers of it are chained to the newest. */
    ADDED
}
