package hotreload.synth;

import hotreload.exceptions.SynthesisException;
import hotreload.module.ClassNodes;
import hotreload.synth.SynthesisRun.Site;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Copies compiler-generated classes (anonymous and local classes) that patch
 * code refers to, under fresh names next to the patch class.
 *
 * <p>A loaded class of the same original name may exist already, compiled
 * from the old source; the copy never collides with it.
 */
final class NestedTypeExtractor {

    private final SynthesisRun run;
    private final Map<String, String> names = new LinkedHashMap<>();
    private final Map<String, ClassNode> extracted = new TreeMap<>();
    private final Map<String, String> hosts = new HashMap<>();
    private final Map<String, Integer> counters = new HashMap<>();

    NestedTypeExtractor(SynthesisRun run) {
        this.run = run;
    }

    /**
     * Extracts {@code original} unless already extracted. The name is
     * assigned before the copy is rewritten so that mutually referring
     * classes terminate.
     */
    void request(String original, Site site) throws SynthesisException {
        if (names.containsKey(original)) return;
        String prefix = site.patchClass != null ? site.patchClass.name() : run.naming.patchClassName(site.host);
        int index = counters.merge(prefix, 1, Integer::sum);
        String target = run.naming.extractedName(prefix, index);
        List<String> before = new ArrayList<>(names.keySet());
        names.put(original, target);
        try {
            ClassNode copy = ClassNodes.read(run.candidate.classBytes(original));
            stripBookkeeping(copy);
            openPrivates(copy);
            Site inner = Site.inPlace(original, site.host, site.patchClass);
            for (MethodNode method : copy.methods) {
                run.rewriter.rewrite(method, inner);
            }
            extracted.put(target, copy);
            hosts.put(target, site.host);
            run.checkReferences(copy, inner);
        } catch (SynthesisException | RuntimeException e) {
            // drop this class and whatever it pulled in
            List<String> added = new ArrayList<>(names.keySet());
            added.removeAll(before);
            for (String name : added) {
                String dropped = names.remove(name);
                extracted.remove(dropped);
                hosts.remove(dropped);
            }
            throw e;
        }
    }

    /** Extracted classes by new name; the nodes still carry their original names. */
    Map<String, ClassNode> extracted() {
        return extracted;
    }

    String mappedName(String original) {
        return names.get(original);
    }

    String hostOf(String extractedName) {
        return hosts.get(extractedName);
    }

    /**
     * Removes attributes that tie a class to its nest and enclosing class.
     */
    static void stripBookkeeping(ClassNode node) {
        node.nestHostClass = null;
        node.nestMembers = null;
        node.permittedSubclasses = null;
        node.innerClasses = new ArrayList<>();
        node.outerClass = null;
        node.outerMethod = null;
        node.outerMethodDesc = null;
        node.sourceDebug = null;
    }

    /**
     * Widens private members to package access; nestmates are now separate
     * classes of the same package.
     */
    static void openPrivates(ClassNode node) {
        boolean itf = ClassNodes.isInterface(node);
        node.access &= ~Opcodes.ACC_PRIVATE;
        for (FieldNode field : node.fields) {
            field.access &= ~Opcodes.ACC_PRIVATE;
        }
        for (MethodNode method : node.methods) {
            if (!ClassNodes.isPrivate(method.access)) continue;
            method.access &= ~Opcodes.ACC_PRIVATE;
            if (itf) method.access |= Opcodes.ACC_PUBLIC;
        }
        for (MethodNode method : node.methods) {
            for (AbstractInsnNode insn : method.instructions.toArray()) {
                if (insn instanceof InvokeDynamicInsnNode indy) {
                    for (int i = 0; i < indy.bsmArgs.length; i++) {
                        if (indy.bsmArgs[i] instanceof Handle handle) {
                            indy.bsmArgs[i] = unspecial(node.name, itf, handle);
                        }
                    }
                } else if (insn instanceof LdcInsnNode ldc && ldc.cst instanceof Handle handle) {
                    ldc.cst = unspecial(node.name, itf, handle);
                }
            }
        }
    }

    private static Handle unspecial(String self, boolean itf, Handle handle) {
        if (handle.getTag() != Opcodes.H_INVOKESPECIAL || !handle.getOwner().equals(self)) return handle;
        return new Handle(itf ? Opcodes.H_INVOKEINTERFACE : Opcodes.H_INVOKEVIRTUAL,
                self, handle.getName(), handle.getDesc(), itf);
    }
}
