package hotreload.hook;

import hotreload.alert.ReloadAlertLogger;
import hotreload.exceptions.HookException;
import hotreload.module.MethodKey;
import hotreload.synth.PatchModule;
import hotreload.synth.PatchedMethod;
import hotreload.synth.WrapperKind;
import hotreload.synth.WrapperRef;
import org.objectweb.asm.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hooks the wrappers of a patch module into the live process and keeps the
 * record of what every patched method is hooked to.
 *
 * <p>Methods are hooked one by one. A failure is reported in the
 * {@link HookReport} and does not undo methods hooked before it. Batches
 * never interleave.
 */
public class HookApplier {

    private static final Logger log = LoggerFactory.getLogger(HookApplier.class);

    private final MethodRedirector redirector;
    private final PatchLoader loader;
    private final ClassLocator classes;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<MethodKey, HookRecord> records = new TreeMap<>();

    public HookApplier(MethodRedirector redirector, PatchLoader loader, ClassLocator classes) {
        this.redirector = redirector;
        this.loader = loader;
        this.classes = classes;
    }

    /**
     * Defines the patch classes and hooks every wrapper of the patch.
     *
     * @throws HookException if the patch classes cannot be defined at all
     */
    public HookReport apply(PatchModule patch) throws HookException {
        lock.lock();
        try {
            LoadedPatch loaded = loader.load(patch);
            List<HookResult> results = new ArrayList<>();
            for (PatchedMethod method : patch.methods()) {
                HookRecord previous = records.get(method.original());
                List<WrapperRef> earlier = previous != null ? previous.wrappers() : List.of();
                HookResult result = hook(patch.module(), method.original(), method.kind(), method.wrapper(),
                        earlier, loaded);
                results.add(result);
            }
            redirector.commit();
            HookReport report = new HookReport(patch.module(), results);
            log.info("Hooked patch {} of {}: {} applied, {} failed", patch.sequence(), patch.module(),
                    report.appliedCount(), report.failures().size());
            return report;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hooks persisted records again, loading every patch jar they name.
     * Used after a restart, before any new patch is applied.
     */
    public HookReport apply(HookRecordSnapshot snapshot) {
        lock.lock();
        try {
            List<HookResult> results = new ArrayList<>();
            for (HookRecord record : snapshot.records().values()) {
                HookResult result = hook(record.module(), record.method(), record.kind(), record.current(),
                        record.history(), null);
                if (!result.isApplied() && !records.containsKey(record.method())) {
                    records.put(record.method(), record.withError(result.reason()));
                }
                results.add(result);
            }
            redirector.commit();
            log.info("Restored {} of {} hook record(s)",
                    results.stream().filter(HookResult::isApplied).count(), results.size());
            return new HookReport("*", results);
        } finally {
            lock.unlock();
        }
    }

    private HookResult hook(String module, MethodKey method, WrapperKind kind, WrapperRef wrapperRef,
                            List<WrapperRef> earlier, LoadedPatch loaded) {
        HookRecord previous = records.get(method);
        Method wrapper;
        try {
            wrapper = resolveWrapper(wrapperRef, loaded);
        } catch (HookException e) {
            return fail(method, kind, previous, HookResult.Status.MISSING_WRAPPER, e.getReason());
        }
        if (wrapper == null) {
            return fail(method, kind, previous, HookResult.Status.MISSING_WRAPPER,
                    "wrapper " + wrapperRef.fullName() + " is not defined");
        }

        if (kind == WrapperKind.MODIFIED) {
            Optional<Method> original = classes.find(binaryName(method.owner()))
                    .map(type -> findMethod(type, method.name(), method.descriptor()));
            if (original.isEmpty()) {
                return fail(method, kind, previous, HookResult.Status.MISSING_ORIGINAL,
                        method.fullName() + " is not loaded");
            }
            RedirectResult result = redirector.redirect(original.get(), wrapper);
            if (!result.success()) {
                return fail(method, kind, previous, HookResult.Status.REDIRECT_FAILED, result.reason());
            }
        }

        // code of earlier patches may call an earlier wrapper directly
        List<String> errors = new ArrayList<>();
        for (WrapperRef old : earlier) {
            if (old.equals(wrapperRef)) continue;
            try {
                Method oldWrapper = resolveWrapper(old, loaded);
                if (oldWrapper == null) {
                    errors.add("earlier wrapper " + old.fullName() + " is not defined");
                    continue;
                }
                RedirectResult result = redirector.redirect(oldWrapper, wrapper);
                if (!result.success()) errors.add(result.reason());
            } catch (HookException e) {
                errors.add(e.getReason());
            }
        }

        HookRecord next = previous != null
                ? previous.chain(wrapperRef)
                : new HookRecord(module, method, kind, wrapperRef, without(earlier, wrapperRef), null);
        if (!errors.isEmpty()) {
            String reason = String.join("; ", errors);
            records.put(method, next.withError(reason));
            ReloadAlertLogger.hookFailed(method.fullName(), reason);
            return HookResult.failed(method, kind, HookResult.Status.REDIRECT_FAILED, reason);
        }
        records.put(method, next);
        log.debug("Hooked {} to {}", method, wrapperRef);
        return HookResult.applied(method, kind);
    }

    private static List<WrapperRef> without(List<WrapperRef> wrappers, WrapperRef current) {
        List<WrapperRef> history = new ArrayList<>(wrappers);
        history.remove(current);
        return history;
    }

    private HookResult fail(MethodKey method, WrapperKind kind, HookRecord previous,
                            HookResult.Status status, String reason) {
        if (previous != null) {
            records.put(method, previous.withError(reason));
        }
        ReloadAlertLogger.hookFailed(method.fullName(), reason);
        return HookResult.failed(method, kind, status, reason);
    }

    private Method resolveWrapper(WrapperRef ref, LoadedPatch loaded) throws HookException {
        LoadedPatch patch = loaded != null && loaded.jarPath().equals(ref.patchJar())
                ? loaded
                : loader.load(ref.patchJar());
        Class<?> owner = patch.classFor(ref.owner());
        return owner != null ? findMethod(owner, ref.name(), ref.descriptor()) : null;
    }

    private static Method findMethod(Class<?> type, String name, String descriptor) {
        try {
            for (Method method : type.getDeclaredMethods()) {
                if (method.getName().equals(name) && Type.getMethodDescriptor(method).equals(descriptor)) {
                    return method;
                }
            }
        } catch (LinkageError e) {
            log.warn("Cannot list methods of {}: {}", type.getName(), e.toString());
        }
        return null;
    }

    private static String binaryName(String internalName) {
        return internalName.replace('/', '.');
    }

    public Optional<HookRecord> record(MethodKey method) {
        lock.lock();
        try {
            return Optional.ofNullable(records.get(method));
        } finally {
            lock.unlock();
        }
    }

    public HookRecordSnapshot snapshot() {
        lock.lock();
        try {
            return HookRecordSnapshot.of(records.values());
        } finally {
            lock.unlock();
        }
    }

    /** Forgets the records of a module; hooked methods stay hooked. */
    public void clear(String module) {
        lock.lock();
        try {
            records.values().removeIf(r -> r.module().equals(module));
        } finally {
            lock.unlock();
        }
    }
}
