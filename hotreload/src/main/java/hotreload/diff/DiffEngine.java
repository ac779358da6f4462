package hotreload.diff;

import hotreload.alert.ReloadAlertLogger;
import hotreload.module.ClassNodes;
import hotreload.module.CompiledModule;
import hotreload.module.FieldKey;
import hotreload.module.MethodKey;
import hotreload.module.TypeSourceIndex;
import hotreload.snapshot.ModuleSnapshot;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.MethodNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compares a freshly compiled module against its snapshot.
 *
 * <p>Change detection is relative to the snapshot: a method is reported when
 * its body differs from the last diffed version. Classification is relative
 * to the baseline, the classes the live process actually loaded: a method
 * the running type does not declare is <em>added</em> (it has no entry point
 * to redirect) no matter how many cycles ago it first appeared.
 */
public final class DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    private final boolean cascadeGenerics;

    public DiffEngine(boolean cascadeGenerics) {
        this.cascadeGenerics = cascadeGenerics;
    }

    /**
     * Diffs the types declared in the changed files.
     *
     * @param previous the snapshot of the last successful cycle
     * @param baseline the module as loaded by the live process
     * @param candidate the newly compiled module
     * @param changedFiles source files that changed since the snapshot
     * @param callGraph the module's call graph, updated with every changed body
     * @return the diff; empty when no declared member changed
     */
    public ModuleDiff diff(ModuleSnapshot previous, CompiledModule baseline, CompiledModule candidate,
                           Collection<Path> changedFiles, CallGraphIndex callGraph) {
        Set<String> touched = touchedTypes(previous.sourceIndex(), TypeSourceIndex.of(candidate), changedFiles);
        if (touched.isEmpty()) {
            log.debug("Changed files of {} declare no types", candidate.name());
            return ModuleDiff.empty(candidate.name(), candidate);
        }

        MethodBodyComparator comparator = new MethodBodyComparator(previous.compiled(), candidate);
        Map<String, TypeDiff> types = new TreeMap<>();
        Map<MethodKey, MethodNode> changedBodies = new TreeMap<>();

        for (String typeName : touched) {
            ClassNode current = candidate.classNode(typeName);
            if (current == null) {
                log.info("Type {} was removed from {}; the loaded version stays live", typeName, candidate.name());
                continue;
            }
            ClassNode loaded = baseline.classNode(typeName);
            ClassNode last = previous.compiled().classNode(typeName);
            TypeDiff typeDiff = loaded == null
                    ? diffNewType(current)
                    : diffExistingType(comparator, loaded, last, current);
            types.put(typeName, typeDiff);
            collectChangedBodies(comparator, last, current, changedBodies);
        }

        callGraph.update(candidate, changedBodies);
        if (cascadeGenerics) {
            cascade(types, baseline, candidate, callGraph);
        }

        for (TypeDiff typeDiff : types.values()) {
            for (String detail : typeDiff.unhookableChanges()) {
                ReloadAlertLogger.unhookableChange(typeDiff.typeName().replace('/', '.'), detail);
            }
        }
        ModuleDiff result = new ModuleDiff(candidate.name(), candidate, types);
        log.debug("Diff of {}: {}", candidate.name(), result);
        return result;
    }

    private static Set<String> touchedTypes(TypeSourceIndex previous, TypeSourceIndex current,
                                            Collection<Path> changedFiles) {
        Set<String> touched = new TreeSet<>();
        for (Path file : changedFiles) {
            touched.addAll(current.typesDeclaredIn(file));
            touched.addAll(previous.typesDeclaredIn(file));
        }
        return touched;
    }

    private static TypeDiff diffNewType(ClassNode current) {
        TypeDiff typeDiff = new TypeDiff(current.name, true);
        for (MethodNode method : current.methods) {
            if (ClassNodes.isHookable(method)) {
                typeDiff.addMethod(MethodKey.of(current, method), method);
            }
        }
        for (FieldNode field : current.fields) {
            typeDiff.addField(new FieldKey(current.name, field.name, field.desc));
        }
        return typeDiff;
    }

    private static TypeDiff diffExistingType(MethodBodyComparator comparator, ClassNode loaded,
                                             ClassNode last, ClassNode current) {
        TypeDiff typeDiff = new TypeDiff(current.name, false);
        for (MethodNode method : current.methods) {
            MethodKey key = MethodKey.of(current, method);
            MethodNode before = ClassNodes.findMethod(last, method.name, method.desc);
            boolean changed = before == null || !comparator.bodiesEqual(before, method);

            if (ClassNodes.isConstructor(method) || ClassNodes.isStaticInitializer(method)) {
                if (changed) {
                    typeDiff.noteUnhookable(key.member() + (before == null ? " added" : " changed")
                            + "; existing instances keep the loaded initializer");
                }
                continue;
            }
            if (!ClassNodes.isHookable(method) || !changed) {
                continue;
            }

            MethodNode original = ClassNodes.findMethod(loaded, method.name, method.desc);
            if (original == null) {
                typeDiff.addMethod(key, method);
            } else if ((original.access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0) {
                typeDiff.noteUnhookable(key.member() + " has no loaded body to redirect");
            } else if (ClassNodes.isStatic(original.access) != ClassNodes.isStatic(method.access)) {
                typeDiff.noteUnhookable(key.member() + " changed between static and instance");
            } else {
                typeDiff.modifyMethod(key, method);
            }
        }

        for (FieldNode field : current.fields) {
            if (ClassNodes.findField(loaded, field.name, field.desc) == null
                    && ClassNodes.findField(last, field.name, field.desc) == null) {
                typeDiff.addField(new FieldKey(current.name, field.name, field.desc));
            }
        }

        if (last != null) {
            for (MethodNode method : last.methods) {
                if (ClassNodes.findMethod(current, method.name, method.desc) == null && ClassNodes.isHookable(method)) {
                    log.info("Method {} was removed; its last hooked body stays live",
                            MethodKey.of(last, method).fullName());
                }
            }
            for (FieldNode field : last.fields) {
                if (ClassNodes.findField(current, field.name, field.desc) == null) {
                    log.info("Field {} was removed; it stays in the loaded layout",
                            new FieldKey(last.name, field.name, field.desc).fullName());
                }
            }
        }
        return typeDiff;
    }

    private static void collectChangedBodies(MethodBodyComparator comparator, ClassNode last, ClassNode current,
                                             Map<MethodKey, MethodNode> changedBodies) {
        for (MethodNode method : current.methods) {
            MethodNode before = ClassNodes.findMethod(last, method.name, method.desc);
            // a signature change can make an unchanged body generic
            if (before == null || !comparator.bodiesEqual(before, method)
                    || !Objects.equals(before.signature, method.signature)) {
                changedBodies.put(MethodKey.of(current, method), method);
            }
        }
    }

    /**
     * Re-marks callers of modified generic methods, transitively through
     * callers that are generic themselves.
     */
    private static void cascade(Map<String, TypeDiff> types, CompiledModule baseline, CompiledModule candidate,
                                CallGraphIndex callGraph) {
        Deque<MethodKey> worklist = new ArrayDeque<>();
        for (TypeDiff typeDiff : types.values()) {
            if (typeDiff.isNewType()) continue;
            for (MethodKey key : typeDiff.modifiedMethods().keySet()) {
                if (callGraph.isGeneric(key)) worklist.add(key);
            }
        }
        Set<MethodKey> visited = new HashSet<>(worklist);
        while (!worklist.isEmpty()) {
            MethodKey callee = worklist.poll();
            for (var entry : callGraph.callersOf(callee).entrySet()) {
                MethodKey caller = entry.getKey();
                ClassNode owner = candidate.classNode(caller.owner());
                MethodNode body = ClassNodes.findMethod(owner, caller.name(), caller.descriptor());
                if (body == null) {
                    body = entry.getValue();
                }
                if (!ClassNodes.isHookable(body) || owner == null || ClassNodes.isCompilerGenerated(owner)) {
                    log.debug("Skipping cascade to {} (not hookable), caller of {}", caller, callee);
                    continue;
                }
                ClassNode loaded = baseline.classNode(caller.owner());
                if (loaded == null) {
                    // a new type is defined whole from the candidate anyway
                    continue;
                }
                TypeDiff typeDiff = types.computeIfAbsent(caller.owner(), name -> new TypeDiff(name, false));
                if (typeDiff.touches(caller)) {
                    continue;
                }
                if (ClassNodes.findMethod(loaded, caller.name(), caller.descriptor()) == null) {
                    typeDiff.addMethod(caller, body);
                } else {
                    typeDiff.modifyMethod(caller, body);
                }
                log.debug("Cascaded {} to caller {}", callee, caller);
                if (ClassNodes.isGeneric(body) && visited.add(caller)) {
                    worklist.add(caller);
                }
            }
        }
    }
}
