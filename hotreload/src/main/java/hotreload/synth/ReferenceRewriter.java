package hotreload.synth;

import hotreload.exceptions.SynthesisException;
import hotreload.module.ClassHierarchy.ResolvedMember;
import hotreload.module.ClassNodes;
import hotreload.module.MethodKey;
import hotreload.synth.SynthesisRun.Site;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TypeInsnNode;

import java.util.Optional;

/**
 * Rewrites the member references of copied code so they link from where the
 * code now lives.
 *
 * <p>Code moved into a patch class loses the access rights of its original
 * class: private members, protected members of foreign supertypes and
 * {@code super} calls go through {@code invokedynamic} call sites that link
 * with the original class's lookup. Methods the running class lacks are
 * called through their wrappers and fields it lacks through the added field
 * table. Synthetic methods of loaded classes are copied next to the code.
 */
final class ReferenceRewriter {

    private final SynthesisRun run;

    ReferenceRewriter(SynthesisRun run) {
        this.run = run;
    }

    void rewrite(MethodNode method, Site site) throws SynthesisException {
        InsnList instructions = method.instructions;
        for (AbstractInsnNode insn : instructions.toArray()) {
            if (insn instanceof MethodInsnNode call) {
                rewriteCall(instructions, call, site);
            } else if (insn instanceof FieldInsnNode field) {
                rewriteField(instructions, field, site);
            } else if (insn instanceof InvokeDynamicInsnNode indy) {
                for (int i = 0; i < indy.bsmArgs.length; i++) {
                    if (indy.bsmArgs[i] instanceof Handle handle) {
                        indy.bsmArgs[i] = rewriteHandle(handle, site);
                    }
                }
            } else if (insn instanceof LdcInsnNode ldc && ldc.cst instanceof Handle handle) {
                ldc.cst = rewriteHandle(handle, site);
            }
        }
    }

    private void rewriteCall(InsnList instructions, MethodInsnNode call, Site site) throws SynthesisException {
        if (call.owner.startsWith("[") || PatchNaming.isPatchClass(call.owner)) return;
        if (call.name.equals("<init>")) {
            rewriteConstructorCall(instructions, call, site);
            return;
        }
        ResolvedMember member = resolveMethod(call.owner, call.name, call.desc, site);
        String declaring = member.owner().name;
        if (run.isRelocated(declaring)) return;

        MethodKey key = new MethodKey(declaring, call.name, call.desc);
        if (run.baseline.contains(declaring)) {
            if (isCopyableSynthetic(member.access())) {
                MethodKey copy = run.syntheticCopy(site, key, ClassNodes.findMethod(member.owner(), call.name, call.desc));
                instructions.set(call, new MethodInsnNode(Opcodes.INVOKESTATIC, copy.owner(), copy.name(), copy.descriptor(), false));
                return;
            }
            MethodNode loaded = run.baseline.method(key);
            if (loaded == null) {
                instructions.set(call, callTo(run.wrapperOf(key, site)));
                return;
            }
            WrapperRef planned = run.planned.get(key);
            if (planned != null && (call.getOpcode() == Opcodes.INVOKESTATIC || ClassNodes.isPrivate(loaded.access))) {
                instructions.set(call, callTo(planned));
                return;
            }
            if (ClassNodes.isPrivate(loaded.access)) {
                if (!isOwnCode(declaring, site)) {
                    instructions.set(call, AccessIndy.invoke(call.getOpcode(), call.owner, call.name, call.desc,
                            declaring, declaring));
                }
                return;
            }
        }
        if (call.getOpcode() == Opcodes.INVOKESPECIAL && site.movedOut) {
            instructions.set(call, AccessIndy.special(call.owner, call.name, call.desc, site.host));
        } else if (needsProtectedBridge(member.access(), declaring, site)) {
            instructions.set(call, AccessIndy.invoke(call.getOpcode(), call.owner, call.name, call.desc,
                    declaring, site.host));
        }
    }

    /**
     * Private constructors of loaded classes are invoked through an access
     * call site; the {@code NEW} and {@code DUP} of the instance creation go away.
     */
    private void rewriteConstructorCall(InsnList instructions, MethodInsnNode call, Site site)
            throws SynthesisException {
        String owner = call.owner;
        if (run.isRelocated(owner) || !run.baseline.contains(owner)) return;
        MethodNode loaded = ClassNodes.findMethod(run.baseline.classNode(owner), "<init>", call.desc);
        if (loaded == null) {
            throw new SynthesisException("Calls constructor " + owner.replace('/', '.') + call.desc
                    + " which the running type lacks", site.host, null);
        }
        if (!ClassNodes.isPrivate(loaded.access) || isOwnCode(owner, site)) return;

        TypeInsnNode creation = findCreation(call);
        if (creation == null || creation.getNext() == null || creation.getNext().getOpcode() != Opcodes.DUP) {
            throw new SynthesisException("Private constructor " + owner.replace('/', '.') + call.desc
                    + " is not invoked as an instance creation", site.host, null);
        }
        instructions.remove(creation.getNext());
        instructions.remove(creation);
        instructions.set(call, AccessIndy.construct(owner, call.desc, owner));
    }

    /** The {@code NEW} matching a constructor call, skipping nested creations. */
    private static TypeInsnNode findCreation(MethodInsnNode call) {
        int pending = 0;
        for (AbstractInsnNode insn = call.getPrevious(); insn != null; insn = insn.getPrevious()) {
            if (insn.getOpcode() == Opcodes.INVOKESPECIAL && ((MethodInsnNode) insn).name.equals("<init>")) {
                pending++;
            } else if (insn.getOpcode() == Opcodes.NEW) {
                if (pending == 0) {
                    TypeInsnNode creation = (TypeInsnNode) insn;
                    return creation.desc.equals(call.owner) ? creation : null;
                }
                pending--;
            }
        }
        return null;
    }

    private void rewriteField(InsnList instructions, FieldInsnNode insn, Site site) throws SynthesisException {
        if (PatchNaming.isPatchClass(insn.owner)) return;
        Optional<ResolvedMember> resolved = run.hierarchy.resolveField(insn.owner, insn.name, insn.desc);
        if (resolved.isEmpty()) {
            throw new SynthesisException("Cannot resolve field " + insn.owner.replace('/', '.') + "." + insn.name,
                    site.host, null);
        }
        String declaring = resolved.get().owner().name;
        if (run.isRelocated(declaring)) return;
        int access = resolved.get().access();
        if (run.baseline.contains(declaring)) {
            FieldNode loaded = ClassNodes.findField(run.baseline.classNode(declaring), insn.name, insn.desc);
            if (loaded == null) {
                FieldIndirection.rewrite(instructions, insn, declaring);
                return;
            }
            access = loaded.access;
            if (ClassNodes.isPrivate(access)) {
                if (!isOwnCode(declaring, site)) {
                    instructions.set(insn, AccessIndy.field(insn.getOpcode(), insn.owner, insn.name, insn.desc,
                            declaring, declaring));
                }
                return;
            }
        }
        if (needsProtectedBridge(access, declaring, site)) {
            instructions.set(insn, AccessIndy.field(insn.getOpcode(), insn.owner, insn.name, insn.desc,
                    declaring, site.host));
        }
    }

    /**
     * Method handle constants follow the same rules as the instructions they
     * stand for; inaccessible targets get a bridge method.
     */
    private Handle rewriteHandle(Handle handle, Site site) throws SynthesisException {
        String owner = handle.getOwner();
        if (owner.startsWith("[") || PatchNaming.isPatchClass(owner)) return handle;
        int tag = handle.getTag();

        if (tag <= Opcodes.H_PUTSTATIC) {
            Optional<ResolvedMember> field = run.hierarchy.resolveField(owner, handle.getName(), handle.getDesc());
            String declaring = field.map(f -> f.owner().name).orElse(owner);
            if (run.isRelocated(declaring)) return handle;
            FieldNode loaded = run.baseline.contains(declaring)
                    ? ClassNodes.findField(run.baseline.classNode(declaring), handle.getName(), handle.getDesc())
                    : null;
            if (run.baseline.contains(declaring) && loaded == null) {
                throw new SynthesisException("Method handle to field " + handle.getName()
                        + " which the running type lacks", site.host, null);
            }
            int access = loaded != null ? loaded.access : field.map(ResolvedMember::access).orElse(0);
            if ((ClassNodes.isPrivate(access) && !isOwnCode(declaring, site))
                    || needsProtectedBridge(access, declaring, site)) {
                throw new SynthesisException("Method handle to inaccessible field " + handle.getName(),
                        site.host, null);
            }
            return handle;
        }

        if (tag == Opcodes.H_NEWINVOKESPECIAL) {
            if (run.isRelocated(owner) || !run.baseline.contains(owner)) return handle;
            MethodNode loaded = ClassNodes.findMethod(run.baseline.classNode(owner), "<init>", handle.getDesc());
            if (loaded == null) {
                throw new SynthesisException("Refers to constructor " + owner.replace('/', '.') + handle.getDesc()
                        + " which the running type lacks", site.host, null);
            }
            return ClassNodes.isPrivate(loaded.access) && !isOwnCode(owner, site) ? run.bridge(site, handle) : handle;
        }

        ResolvedMember member = resolveMethod(owner, handle.getName(), handle.getDesc(), site);
        String declaring = member.owner().name;
        if (run.isRelocated(declaring)) {
            if (tag == Opcodes.H_INVOKESPECIAL && ClassNodes.isPrivate(member.access())
                    && !ClassNodes.isStatic(member.access())) {
                boolean itf = run.hierarchy.isInterface(declaring);
                return new Handle(itf ? Opcodes.H_INVOKEINTERFACE : Opcodes.H_INVOKEVIRTUAL,
                        owner, handle.getName(), handle.getDesc(), itf);
            }
            return handle;
        }
        MethodKey key = new MethodKey(declaring, handle.getName(), handle.getDesc());
        int access = member.access();
        if (run.baseline.contains(declaring)) {
            if (isCopyableSynthetic(member.access())) {
                MethodKey copy = run.syntheticCopy(site, key,
                        ClassNodes.findMethod(member.owner(), handle.getName(), handle.getDesc()));
                return new Handle(Opcodes.H_INVOKESTATIC, copy.owner(), copy.name(), copy.descriptor(), false);
            }
            MethodNode loaded = run.baseline.method(key);
            if (loaded == null) {
                return handleTo(run.wrapperOf(key, site));
            }
            WrapperRef planned = run.planned.get(key);
            if (planned != null && ClassNodes.isPrivate(loaded.access)) {
                return handleTo(planned);
            }
            access = loaded.access;
            if (ClassNodes.isPrivate(access)) {
                return isOwnCode(declaring, site) ? handle : run.bridge(site, handle);
            }
        }
        if ((tag == Opcodes.H_INVOKESPECIAL && site.movedOut) || needsProtectedBridge(access, declaring, site)) {
            return run.bridge(site, handle);
        }
        return handle;
    }

    private ResolvedMember resolveMethod(String owner, String name, String desc, Site site)
            throws SynthesisException {
        return run.hierarchy.resolveMethod(owner, name, desc)
                .orElseThrow(() -> new SynthesisException("Cannot resolve method " + owner.replace('/', '.')
                        + "." + name + desc, site.host, null));
    }

    private static boolean isCopyableSynthetic(int access) {
        return (access & Opcodes.ACC_SYNTHETIC) != 0 && (access & Opcodes.ACC_BRIDGE) == 0;
    }

    /** Code that still lives in (a copy of) the class declaring the member. */
    private static boolean isOwnCode(String declaring, Site site) {
        return !site.movedOut && declaring.equals(site.codeClass);
    }

    /**
     * Protected members declared in another package are only accessible to
     * code of a subclass; moved code is not.
     */
    private boolean needsProtectedBridge(int access, String declaring, Site site) {
        if ((access & Opcodes.ACC_PROTECTED) == 0) return false;
        if (ClassNodes.packageOf(declaring).equals(ClassNodes.packageOf(site.host))) return false;
        return site.movedOut || !run.hierarchy.isSubclassOf(site.codeClass, declaring);
    }

    private static MethodInsnNode callTo(WrapperRef wrapper) {
        return new MethodInsnNode(Opcodes.INVOKESTATIC, wrapper.owner(), wrapper.name(), wrapper.descriptor(), false);
    }

    private static Handle handleTo(WrapperRef wrapper) {
        return new Handle(Opcodes.H_INVOKESTATIC, wrapper.owner(), wrapper.name(), wrapper.descriptor(), false);
    }
}
