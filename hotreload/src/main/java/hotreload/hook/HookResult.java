package hotreload.hook;

import hotreload.module.MethodKey;
import hotreload.synth.WrapperKind;

/**
 * Outcome of hooking one method.
 *
 * @param method the method
 * @param kind modified or added
 * @param status what happened
 * @param reason failure detail, or null when applied
 */
public record HookResult(MethodKey method, WrapperKind kind, Status status, String reason) {

    public enum Status {
        APPLIED,
        /** The patch does not define the wrapper it lists. */
        MISSING_WRAPPER,
        /** The live process does not have the method to detour. */
        MISSING_ORIGINAL,
        REDIRECT_FAILED
    }

    public static HookResult applied(MethodKey method, WrapperKind kind) {
        return new HookResult(method, kind, Status.APPLIED, null);
    }

    public static HookResult failed(MethodKey method, WrapperKind kind, Status status, String reason) {
        return new HookResult(method, kind, status, reason);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
