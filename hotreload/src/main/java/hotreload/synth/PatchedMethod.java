package hotreload.synth;

import hotreload.module.MethodKey;

/**
 * A method of the module and the wrapper synthesized for it.
 */
public record PatchedMethod(MethodKey original, WrapperKind kind, WrapperRef wrapper) {
}
