package hotreload.synth;

import hotreload.diff.ModuleDiff;
import hotreload.diff.TypeDiff;
import hotreload.exceptions.SynthesisException;
import hotreload.module.ClassHierarchy;
import hotreload.module.ClassNodes;
import hotreload.module.CompiledModule;
import hotreload.module.MethodKey;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.ClassRemapper;
import org.objectweb.asm.commons.MethodRemapper;
import org.objectweb.asm.commons.Remapper;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * One attempt at synthesizing a patch module from a diff.
 *
 * <p>Rewriting happens in two steps. The first rewrites references
 * semantically while every class still carries its original name: calls to
 * added methods go to wrappers, inaccessible members go through access call
 * sites, added fields through the indirection table, and referenced
 * compiler-generated classes are extracted. The second renames the
 * extracted classes in every class of the patch and writes class files.
 *
 * <p>Members and new types listed as excluded are left out; references to
 * them fail the referencing member.
 */
final class SynthesisRun {

    private static final Logger log = LoggerFactory.getLogger(SynthesisRun.class);

    /** The class a wrapper or copy is placed in, and its bookkeeping. */
    static final class PatchClass {
        final String host;
        final ClassNode node;
        final Set<String> signatures = new HashSet<>();
        final Map<MethodKey, MethodKey> syntheticCopies = new HashMap<>();
        final Map<Handle, Handle> bridges = new HashMap<>();
        final List<FieldInitializer> initializers = new ArrayList<>();
        int bridgeCount;

        PatchClass(String host, ClassNode node) {
            this.host = host;
            this.node = node;
        }

        String name() {
            return node.name;
        }

        /**
         * Claims a method name for a descriptor, suffixing it when another
         * method already uses the same name and descriptor.
         */
        String reserve(String name, String desc) {
            String candidate = name;
            int n = 1;
            while (!signatures.add(candidate + desc)) {
                candidate = name + "$" + n++;
            }
            return candidate;
        }
    }

    /** Where rewritten code lives and whose access rights it had. */
    static final class Site {
        final String codeClass;
        final String host;
        final PatchClass patchClass;
        final boolean movedOut;

        private Site(String codeClass, String host, PatchClass patchClass, boolean movedOut) {
            this.codeClass = codeClass;
            this.host = host;
            this.patchClass = patchClass;
            this.movedOut = movedOut;
        }

        /** Code moved out of {@code host} into static methods of a patch class. */
        static Site moved(PatchClass patchClass, String host) {
            return new Site(patchClass.name(), host, patchClass, true);
        }

        /** Code that stays in a copy of its own class. */
        static Site inPlace(String codeClass, String host, PatchClass patchClass) {
            return new Site(codeClass, host, patchClass, false);
        }
    }

    final ModuleDiff diff;
    final CompiledModule candidate;
    final CompiledModule baseline;
    final PatchLedger ledger;
    final PatchNaming naming;
    final ClassHierarchy hierarchy;
    final ClassLoader referenceLoader;
    final Set<MethodKey> excludedMethods;
    final Set<String> excludedTypes;

    final Map<MethodKey, WrapperRef> planned = new TreeMap<>();
    private final Map<String, PatchClass> patchClasses = new TreeMap<>();
    private final Map<String, ClassNode> newTypes = new TreeMap<>();
    private final List<PatchedMethod> methods = new ArrayList<>();
    private final List<SynthesisFailure> failures = new ArrayList<>();
    private final Set<Path> requires = new LinkedHashSet<>();
    private final List<FieldInitializer> initializers = new ArrayList<>();
    final NestedTypeExtractor extractor;
    final ReferenceRewriter rewriter;

    SynthesisRun(ModuleDiff diff, CompiledModule baseline, PatchLedger ledger, PatchNaming naming,
                 ClassLoader referenceLoader, Set<MethodKey> excludedMethods, Set<String> excludedTypes) {
        this.diff = diff;
        this.candidate = diff.candidate();
        this.baseline = baseline;
        this.ledger = ledger;
        this.naming = naming;
        this.referenceLoader = referenceLoader;
        this.excludedMethods = excludedMethods;
        this.excludedTypes = excludedTypes;
        this.hierarchy = new ClassHierarchy(List.of(candidate::classNode, baseline::classNode), referenceLoader);
        this.extractor = new NestedTypeExtractor(this);
        this.rewriter = new ReferenceRewriter(this);
    }

    List<SynthesisFailure> failures() {
        return failures;
    }

    PatchModule execute() {
        plan();
        for (TypeDiff typeDiff : diff.types().values()) {
            if (typeDiff.isNewType() && !excludedTypes.contains(typeDiff.typeName())) {
                synthesizeNewType(typeDiff);
            }
        }
        for (TypeDiff typeDiff : diff.types().values()) {
            if (!typeDiff.isNewType()) {
                synthesizeType(typeDiff);
            }
        }
        return assemble();
    }

    private void plan() {
        for (TypeDiff typeDiff : diff.types().values()) {
            if (typeDiff.isNewType()) continue;
            PatchClass patchClass = patchClassFor(typeDiff.typeName());
            for (var entry : members(typeDiff).entrySet()) {
                MethodKey key = entry.getKey();
                if (excludedMethods.contains(key)) continue;
                MethodNode body = sourceOf(key, typeDiff);
                String desc = ClassNodes.isStatic(body.access)
                        ? body.desc
                        : AccessIndy.withReceiver(typeDiff.typeName(), body.desc);
                String name = patchClass.reserve(body.name, desc);
                planned.put(key, new WrapperRef(patchClass.name(), name, desc, naming.sequence(), naming.jarPath()));
            }
        }
    }

    private static Map<MethodKey, WrapperKind> members(TypeDiff typeDiff) {
        Map<MethodKey, WrapperKind> members = new TreeMap<>();
        typeDiff.addedMethods().keySet().forEach(k -> members.put(k, WrapperKind.ADDED));
        typeDiff.modifiedMethods().keySet().forEach(k -> members.put(k, WrapperKind.MODIFIED));
        return members;
    }

    private MethodNode sourceOf(MethodKey key, TypeDiff typeDiff) {
        MethodNode body = candidate.method(key);
        if (body != null) return body;
        body = typeDiff.addedMethods().get(key);
        return body != null ? body : typeDiff.modifiedMethods().get(key);
    }

    PatchClass patchClassFor(String host) {
        return patchClasses.computeIfAbsent(host, h -> {
            ClassNode hostNode = baseline.classNode(h);
            ClassNode node = new ClassNode(Opcodes.ASM9);
            int version = hostNode != null ? hostNode.version & 0xFFFF : Opcodes.V11;
            node.version = Math.max(version, Opcodes.V1_8);
            node.access = Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL | Opcodes.ACC_SUPER | Opcodes.ACC_SYNTHETIC;
            node.name = naming.patchClassName(h);
            node.superName = "java/lang/Object";
            node.sourceFile = hostNode != null ? hostNode.sourceFile : null;
            return new PatchClass(h, node);
        });
    }

    private void synthesizeType(TypeDiff typeDiff) {
        String host = typeDiff.typeName();
        PatchClass patchClass = patchClassFor(host);
        for (var entry : members(typeDiff).entrySet()) {
            MethodKey key = entry.getKey();
            if (excludedMethods.contains(key)) continue;
            WrapperRef ref = planned.get(key);
            int before = patchClass.node.methods.size();
            try {
                patchClass.node.methods.add(buildWrapper(key, sourceOf(key, typeDiff), ref, patchClass));
                methods.add(new PatchedMethod(key, entry.getValue(), ref));
            } catch (SynthesisException e) {
                // copies made for the failed member stay only if another member already used them
                while (patchClass.node.methods.size() > before) {
                    MethodNode dropped = patchClass.node.methods.remove(patchClass.node.methods.size() - 1);
                    patchClass.syntheticCopies.values().removeIf(k -> k.name().equals(dropped.name) && k.descriptor().equals(dropped.desc));
                    patchClass.bridges.values().removeIf(h -> h.getName().equals(dropped.name) && h.getDesc().equals(dropped.desc));
                }
                failures.add(new SynthesisFailure(host, key.fullName(), e.getReason()));
                log.debug("Failed to synthesize {}: {}", key, e.getReason());
            }
        }
        ClassNode current = candidate.classNode(host);
        if (current != null && !typeDiff.addedFields().isEmpty()) {
            List<FieldInitializer> found = FieldIndirection.initializers(current, typeDiff.addedFields());
            patchClass.initializers.addAll(found);
            initializers.addAll(found);
        }
    }

    private MethodNode buildWrapper(MethodKey key, MethodNode source, WrapperRef ref, PatchClass patchClass)
            throws SynthesisException {
        if ((source.access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0) {
            throw new SynthesisException("Method has no bytecode body", key.owner(), key.member());
        }
        boolean isStatic = ClassNodes.isStatic(source.access);
        if ((source.access & Opcodes.ACC_SYNCHRONIZED) != 0) {
            log.debug("{} is synchronized; the detoured entry point keeps the monitor", key);
        }
        String[] exceptions = source.exceptions.toArray(new String[0]);
        MethodNode wrapper = new MethodNode(Opcodes.ASM9,
                Opcodes.ACC_PUBLIC | Opcodes.ACC_STATIC | (source.access & Opcodes.ACC_VARARGS),
                ref.name(), ref.descriptor(), isStatic ? source.signature : null, exceptions);
        MethodCopier.copyBody(source, wrapper);
        Site site = Site.moved(patchClass, key.owner());
        rewriter.rewrite(wrapper, site);
        checkReferences(wrapper, site);
        return wrapper;
    }

    private void synthesizeNewType(TypeDiff typeDiff) {
        String name = typeDiff.typeName();
        if (lookupHost(name) == null) {
            failures.add(new SynthesisFailure(name, null,
                    "package " + ClassNodes.packageOf(name).replace('/', '.') + " has no loaded type to define it through"));
            return;
        }
        ClassNode copy = ClassNodes.read(candidate.classBytes(name));
        NestedTypeExtractor.stripBookkeeping(copy);
        NestedTypeExtractor.openPrivates(copy);
        Site site = Site.inPlace(name, name, null);
        try {
            for (MethodNode method : copy.methods) {
                rewriter.rewrite(method, site);
            }
            checkReferences(copy, site);
            newTypes.put(name, copy);
        } catch (SynthesisException e) {
            failures.add(new SynthesisFailure(name, null, e.getReason()));
        }
    }

    /**
     * Copies a synthetic method of a loaded type (a lambda body or an
     * accessor) into the patch class as a static method.
     *
     * @return the copy's owner, name and descriptor
     */
    MethodKey syntheticCopy(Site site, MethodKey original, MethodNode source) throws SynthesisException {
        if (site.patchClass == null) {
            throw new SynthesisException("Cannot relocate synthetic method " + original.fullName()
                    + " referenced from a new type", site.host, null);
        }
        PatchClass patchClass = site.patchClass;
        MethodKey known = patchClass.syntheticCopies.get(original);
        if (known != null) return known;

        boolean isStatic = ClassNodes.isStatic(source.access);
        String desc = isStatic ? source.desc : AccessIndy.withReceiver(original.owner(), source.desc);
        String name = patchClass.reserve(source.name, desc);
        MethodKey copyKey = new MethodKey(patchClass.name(), name, desc);
        patchClass.syntheticCopies.put(original, copyKey);

        MethodNode copy = new MethodNode(Opcodes.ASM9,
                Opcodes.ACC_PUBLIC | Opcodes.ACC_STATIC | Opcodes.ACC_SYNTHETIC | (source.access & Opcodes.ACC_VARARGS),
                name, desc, null, null);
        MethodCopier.copyBody(source, copy);
        patchClass.node.methods.add(copy);
        try {
            Site copySite = Site.moved(patchClass, original.owner());
            rewriter.rewrite(copy, copySite);
            checkReferences(copy, copySite);
        } catch (SynthesisException e) {
            patchClass.syntheticCopies.remove(original);
            patchClass.node.methods.remove(copy);
            throw e;
        }
        return copyKey;
    }

    /**
     * A static method in the patch class that invokes what a method handle
     * refers to, using access call sites where needed.
     */
    Handle bridge(Site site, Handle handle) throws SynthesisException {
        if (site.patchClass == null) {
            throw new SynthesisException("Cannot bridge inaccessible method reference " + handle.getOwner() + "."
                    + handle.getName() + " from a new type", site.host, null);
        }
        PatchClass patchClass = site.patchClass;
        Handle known = patchClass.bridges.get(handle);
        if (known != null) return known;

        int tag = handle.getTag();
        String desc;
        if (tag == Opcodes.H_INVOKESTATIC) {
            desc = handle.getDesc();
        } else if (tag == Opcodes.H_NEWINVOKESPECIAL) {
            desc = Type.getMethodDescriptor(Type.getObjectType(handle.getOwner()), Type.getArgumentTypes(handle.getDesc()));
        } else {
            desc = AccessIndy.withReceiver(handle.getOwner(), handle.getDesc());
        }
        String name = patchClass.reserve("access$hr" + patchClass.bridgeCount++, desc);
        MethodNode bridge = new MethodNode(Opcodes.ASM9, Opcodes.ACC_PUBLIC | Opcodes.ACC_STATIC | Opcodes.ACC_SYNTHETIC,
                name, desc, null, null);

        InsnList code = bridge.instructions;
        if (tag == Opcodes.H_NEWINVOKESPECIAL) {
            code.add(new TypeInsnNode(Opcodes.NEW, handle.getOwner()));
            code.add(new InsnNode(Opcodes.DUP));
        }
        int slot = 0;
        for (Type arg : Type.getArgumentTypes(desc)) {
            code.add(new VarInsnNode(arg.getOpcode(Opcodes.ILOAD), slot));
            slot += arg.getSize();
        }
        code.add(new MethodInsnNode(invokeOpcode(tag), handle.getOwner(), handle.getName(), handle.getDesc(),
                handle.isInterface()));
        code.add(new InsnNode(Type.getReturnType(desc).getOpcode(Opcodes.IRETURN)));
        bridge.maxLocals = slot;

        Handle result = new Handle(Opcodes.H_INVOKESTATIC, patchClass.name(), name, desc, false);
        patchClass.bridges.put(handle, result);
        patchClass.node.methods.add(bridge);
        try {
            Site bridgeSite = Site.moved(patchClass, site.host);
            rewriter.rewrite(bridge, bridgeSite);
            checkReferences(bridge, bridgeSite);
        } catch (SynthesisException e) {
            patchClass.bridges.remove(handle);
            patchClass.node.methods.remove(bridge);
            throw e;
        }
        return result;
    }

    private static int invokeOpcode(int tag) {
        switch (tag) {
            case Opcodes.H_INVOKESTATIC: return Opcodes.INVOKESTATIC;
            case Opcodes.H_INVOKEINTERFACE: return Opcodes.INVOKEINTERFACE;
            case Opcodes.H_INVOKESPECIAL:
            case Opcodes.H_NEWINVOKESPECIAL:
                return Opcodes.INVOKESPECIAL;
            default:
                return Opcodes.INVOKEVIRTUAL;
        }
    }

    /**
     * The wrapper a call to an added method goes to: this cycle's, or the
     * latest one an earlier cycle loaded.
     */
    WrapperRef wrapperOf(MethodKey method, Site site) throws SynthesisException {
        WrapperRef own = planned.get(method);
        if (own != null) return own;
        if (excludedMethods.contains(method)) {
            throw new SynthesisException("Calls " + method.fullName() + " which failed to synthesize", site.host, null);
        }
        Optional<WrapperRef> earlier = ledger.latest(method);
        if (earlier.isPresent()) {
            requires.add(earlier.get().patchJar());
            return earlier.get();
        }
        throw new SynthesisException("Calls " + method.fullName()
                + " which the running type lacks and no patch provides", site.host, null);
    }

    /** True for classes the patch defines itself: compiler-generated classes and new types. */
    boolean isRelocated(String internalName) {
        return candidate.isCompilerGenerated(internalName) || diff.newTypes().contains(internalName);
    }

    /**
     * Validates the classes rewritten code names, extracting compiler-generated
     * ones on first reference.
     */
    void checkReferences(MethodNode method, Site site) throws SynthesisException {
        NameCollector collector = new NameCollector();
        method.accept(new MethodRemapper(new MethodNode(Opcodes.ASM9), collector));
        checkNames(collector.names, site);
    }

    void checkReferences(ClassNode node, Site site) throws SynthesisException {
        NameCollector collector = new NameCollector();
        node.accept(new ClassRemapper(new ClassNode(Opcodes.ASM9), collector));
        checkNames(collector.names, site);
    }

    private void checkNames(Set<String> names, Site site) throws SynthesisException {
        for (String name : names) {
            if (candidate.isCompilerGenerated(name)) {
                extractor.request(name, site);
            } else if (excludedTypes.contains(name)) {
                throw new SynthesisException("Refers to type " + name.replace('/', '.')
                        + " which failed to synthesize", site.host, null);
            } else if (candidate.contains(name) && !baseline.contains(name) && !diff.newTypes().contains(name)) {
                throw new SynthesisException("Refers to type " + name.replace('/', '.')
                        + " which is not loaded in the running process", site.host, null);
            }
        }
    }

    private static final class NameCollector extends Remapper {
        final Set<String> names = new TreeSet<>();

        @Override
        public String map(String internalName) {
            names.add(internalName);
            return internalName;
        }
    }

    /**
     * The loaded type whose lookup defines a class of the patch: the type
     * itself when loaded, else the first loaded declared type of its package.
     */
    String lookupHost(String type) {
        if (baseline.contains(type) && !baseline.isCompilerGenerated(type)) return type;
        String pkg = ClassNodes.packageOf(type);
        return baseline.declaredTypes().stream()
                .map(n -> n.name)
                .filter(n -> ClassNodes.packageOf(n).equals(pkg))
                .sorted()
                .findFirst()
                .orElse(null);
    }

    private PatchModule assemble() {
        Map<String, ClassNode> output = new TreeMap<>();
        Map<String, String> hosts = new TreeMap<>();
        for (PatchClass patchClass : patchClasses.values()) {
            if (patchClass.node.methods.isEmpty() && patchClass.initializers.isEmpty()) {
                continue;
            }
            if (!patchClass.initializers.isEmpty()) {
                MethodNode clinit = new MethodNode(Opcodes.ASM9, Opcodes.ACC_STATIC, "<clinit>", "()V", null, null);
                for (FieldInitializer init : patchClass.initializers) {
                    clinit.instructions.add(FieldIndirection.registration(init));
                }
                clinit.instructions.add(new InsnNode(Opcodes.RETURN));
                patchClass.node.methods.add(clinit);
            }
            patchClass.node.methods.sort(Comparator.comparing((MethodNode m) -> m.name).thenComparing(m -> m.desc));
            output.put(patchClass.name(), patchClass.node);
            hosts.put(patchClass.name(), patchClass.host);
        }
        for (var entry : newTypes.entrySet()) {
            output.put(entry.getKey(), entry.getValue());
            hosts.put(entry.getKey(), lookupHost(entry.getKey()));
        }
        for (var entry : extractor.extracted().entrySet()) {
            output.put(entry.getKey(), entry.getValue());
            hosts.put(entry.getKey(), lookupHost(extractor.hostOf(entry.getKey())));
        }

        Remapper renamer = new Remapper() {
            @Override
            public String map(String internalName) {
                String mapped = extractor.mappedName(internalName);
                return mapped != null ? mapped : internalName;
            }
        };
        Map<String, ClassNode> renamed = new TreeMap<>();
        Map<String, String> renamedHosts = new TreeMap<>();
        for (var entry : output.entrySet()) {
            ClassNode out = new ClassNode(Opcodes.ASM9);
            entry.getValue().accept(new ClassRemapper(out, renamer));
            renamed.put(out.name, out);
            renamedHosts.put(out.name, hosts.get(entry.getKey()));
        }

        ClassHierarchy writerHierarchy = new ClassHierarchy(
                List.of(renamed::get, candidate::classNode, baseline::classNode), referenceLoader);
        Map<String, byte[]> classes = new TreeMap<>();
        Set<String> failedClasses = new TreeSet<>();
        for (ClassNode node : renamed.values()) {
            try {
                ClassWriter writer = new HierarchyClassWriter(ClassWriter.COMPUTE_FRAMES, writerHierarchy);
                node.accept(writer);
                classes.put(node.name, writer.toByteArray());
            } catch (RuntimeException e) {
                failedClasses.add(node.name);
                String reason = "Cannot write " + node.name.replace('/', '.') + ": " + e;
                List<PatchedMethod> affected = methods.stream()
                        .filter(m -> m.wrapper().owner().equals(node.name))
                        .collect(Collectors.toList());
                if (affected.isEmpty()) {
                    String type = newTypes.containsKey(node.name) ? node.name : renamedHosts.get(node.name);
                    failures.add(new SynthesisFailure(type, null, reason));
                }
                for (PatchedMethod m : affected) {
                    failures.add(new SynthesisFailure(m.original().owner(), m.original().fullName(), reason));
                }
                log.debug("Failed to write patch class {}", node.name, e);
            }
        }
        if (!failedClasses.isEmpty()) {
            methods.removeIf(m -> failedClasses.contains(m.wrapper().owner()));
            renamedHosts.keySet().removeAll(failedClasses);
        }

        Set<String> definedNewTypes = new TreeSet<>(newTypes.keySet());
        definedNewTypes.removeAll(failedClasses);
        return new PatchModule(naming, classes, renamedHosts, methods, definedNewTypes, initializers,
                failures, requires);
    }
}
