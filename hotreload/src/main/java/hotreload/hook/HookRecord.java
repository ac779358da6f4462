package hotreload.hook;

import hotreload.module.MethodKey;
import hotreload.synth.WrapperKind;
import hotreload.synth.WrapperRef;

import java.util.ArrayList;
import java.util.List;

/**
 * What a method of a module is currently hooked to.
 *
 * <p>For a modified method calls of the original run the current wrapper.
 * An added method exists only as wrappers; every earlier wrapper is
 * redirected to the current one so that code compiled against it follows.
 * Modified methods chain the same way, since patch code may call a
 * wrapper directly.
 *
 * @param module module the method belongs to
 * @param method the method as the module declares it
 * @param kind whether the live process has the method
 * @param current the wrapper calls end up in
 * @param history earlier wrappers, oldest first
 * @param lastError the last hook failure for this method, or null
 */
public record HookRecord(String module, MethodKey method, WrapperKind kind, WrapperRef current,
                         List<WrapperRef> history, String lastError) {

    public HookRecord {
        history = List.copyOf(history);
    }

    public static HookRecord first(String module, MethodKey method, WrapperKind kind, WrapperRef wrapper) {
        return new HookRecord(module, method, kind, wrapper, List.of(), null);
    }

    /**
     * The record after hooking a newer wrapper; the current one moves to history.
     */
    public HookRecord chain(WrapperRef wrapper) {
        if (wrapper.equals(current)) return withError(null);
        List<WrapperRef> earlier = new ArrayList<>(history);
        earlier.add(current);
        return new HookRecord(module, method, kind, wrapper, earlier, null);
    }

    public HookRecord withError(String error) {
        return new HookRecord(module, method, kind, current, history, error);
    }

    /** Every wrapper ever hooked for this method, oldest first. */
    public List<WrapperRef> wrappers() {
        List<WrapperRef> all = new ArrayList<>(history);
        all.add(current);
        return all;
    }
}
