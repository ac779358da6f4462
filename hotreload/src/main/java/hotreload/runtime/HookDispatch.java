package hotreload.runtime;

import java.lang.invoke.CallSite;
import java.lang.invoke.ConstantCallSite;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.invoke.MutableCallSite;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatch slots that redirected method bodies jump through.
 *
 * <p>A redirected method's body is replaced by a trampoline that passes its
 * receiver and arguments to an {@code invokedynamic} bound to one slot. The
 * slot is a {@link MutableCallSite}; redirecting the method again only
 * retargets it, so the class is redefined once.
 */
public final class HookDispatch {

    private static final Map<Integer, MutableCallSite> SLOTS = new ConcurrentHashMap<>();
    private static final AtomicInteger NEXT_SLOT = new AtomicInteger(1);

    private HookDispatch() {}

    /**
     * Creates a slot with an initial target.
     *
     * @param type the exact type trampolines link with: receiver (for instance
     *             methods) followed by the parameters
     * @return the slot id, embedded as a bootstrap argument in the trampoline
     */
    public static int allocate(MethodType type, MethodHandle target) {
        int slot = NEXT_SLOT.getAndIncrement();
        SLOTS.put(slot, new MutableCallSite(target.asType(type)));
        return slot;
    }

    /**
     * Points a slot at a new target. Threads already running the old target
     * finish it; {@link #sync(int...)} publishes the change.
     */
    public static void retarget(int slot, MethodHandle target) {
        MutableCallSite site = require(slot);
        site.setTarget(target.asType(site.type()));
    }

    public static MethodHandle target(int slot) {
        return require(slot).getTarget();
    }

    public static void sync(int... slots) {
        MutableCallSite[] sites = new MutableCallSite[slots.length];
        for (int i = 0; i < slots.length; i++) {
            sites[i] = require(slots[i]);
        }
        MutableCallSite.syncAll(sites);
    }

    /**
     * Drops a slot no trampoline links to, such as one whose class could not
     * be redefined.
     */
    public static void release(int slot) {
        SLOTS.remove(slot);
    }

    public static int slotCount() {
        return SLOTS.size();
    }

    /**
     * Bootstrap of trampoline call sites.
     */
    public static CallSite bootstrap(MethodHandles.Lookup caller, String name, MethodType type, int slot) {
        MutableCallSite site = SLOTS.get(slot);
        if (site == null) {
            throw new IllegalStateException("Unknown dispatch slot " + slot + " for "
                    + caller.lookupClass().getName() + "." + name);
        }
        if (site.type().equals(type)) {
            return site;
        }
        return new ConstantCallSite(site.dynamicInvoker().asType(type));
    }

    private static MutableCallSite require(int slot) {
        MutableCallSite site = SLOTS.get(slot);
        if (site == null) {
            throw new IllegalArgumentException("Unknown dispatch slot " + slot);
        }
        return site;
    }
}
