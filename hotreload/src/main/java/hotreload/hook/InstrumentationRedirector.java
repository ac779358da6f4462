package hotreload.hook;

import hotreload.runtime.HookDispatch;
import org.objectweb.asm.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.instrument.ClassDefinition;
import java.lang.instrument.Instrumentation;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redirects methods by redefining their class once with a dispatch
 * trampoline, then retargeting the trampoline's slot.
 *
 * <p>Redefinition also deoptimizes every compiled frame that inlined the old
 * body, so inlined copies never outlive a redirect.
 */
public class InstrumentationRedirector implements MethodRedirector {

    private static final Logger log = LoggerFactory.getLogger(InstrumentationRedirector.class);

    private final Instrumentation instrumentation;
    private final ClassBytesLocator classBytes;
    private final Map<Method, Integer> slots = new ConcurrentHashMap<>();
    private final List<Integer> pending = new ArrayList<>();

    public InstrumentationRedirector(Instrumentation instrumentation, ClassBytesLocator classBytes) {
        if (!instrumentation.isRedefineClassesSupported()) {
            throw new IllegalArgumentException("Instrumentation does not support class redefinition");
        }
        this.instrumentation = instrumentation;
        this.classBytes = classBytes;
    }

    @Override
    public synchronized RedirectResult redirect(Method original, Method replacement) {
        if (!Modifier.isStatic(replacement.getModifiers())) {
            return RedirectResult.failed("Replacement " + replacement + " is not static");
        }
        Class<?> owner = original.getDeclaringClass();
        boolean isStatic = Modifier.isStatic(original.getModifiers());
        MethodType type = MethodType.methodType(original.getReturnType(), original.getParameterTypes());
        if (!isStatic) type = type.insertParameterTypes(0, owner);

        MethodHandle target;
        try {
            target = MethodHandles.publicLookup().unreflect(replacement).asType(type);
        } catch (IllegalAccessException | RuntimeException e) {
            return RedirectResult.failed("Replacement " + replacement + " cannot stand in for " + original + ": " + e);
        }

        Integer slot = slots.get(original);
        if (slot != null) {
            HookDispatch.retarget(slot, target);
            pending.add(slot);
            log.debug("Retargeted slot {} of {} to {}", slot, original, replacement);
            return RedirectResult.ok();
        }

        int newSlot = HookDispatch.allocate(type, target);
        try {
            byte[] current = classBytes.locate(owner);
            byte[] redefined = DispatchTrampolines.install(current, original.getName(),
                    Type.getMethodDescriptor(original), newSlot);
            instrumentation.redefineClasses(new ClassDefinition(owner, redefined));
            classBytes.update(owner, redefined);
        } catch (Exception | LinkageError e) {
            HookDispatch.release(newSlot);
            log.debug("Failed to install trampoline for {}", original, e);
            return RedirectResult.failed("Cannot redefine " + owner.getName() + ": " + e);
        }
        slots.put(original, newSlot);
        log.debug("Installed trampoline for {} on slot {}", original, newSlot);
        return RedirectResult.ok();
    }

    @Override
    public synchronized void commit() {
        if (pending.isEmpty()) return;
        HookDispatch.sync(pending.stream().mapToInt(Integer::intValue).toArray());
        pending.clear();
    }

    /** Number of methods that carry a trampoline. */
    public int redirectedCount() {
        return slots.size();
    }
}
