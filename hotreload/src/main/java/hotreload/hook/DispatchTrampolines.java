package hotreload.hook;

import hotreload.runtime.HookDispatch;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.VarInsnNode;

import java.util.ArrayList;

/**
 * Rewrites method bodies into trampolines that jump through a
 * {@link HookDispatch} slot.
 */
final class DispatchTrampolines {

    static final String INDY_NAME = "dispatch";

    private static final Handle BOOTSTRAP = new Handle(Opcodes.H_INVOKESTATIC,
            Type.getInternalName(HookDispatch.class), "bootstrap",
            "(Ljava/lang/invoke/MethodHandles$Lookup;Ljava/lang/String;Ljava/lang/invoke/MethodType;I)"
                    + "Ljava/lang/invoke/CallSite;", false);

    private DispatchTrampolines() {}

    /**
     * Replaces the body of one method.
     *
     * @param classBytes current class file of the declaring class
     * @param name method name
     * @param desc method descriptor
     * @param slot dispatch slot the trampoline links to
     * @return the rewritten class file
     * @throws IllegalArgumentException when the class lacks the method, the
     *         method has no body, or the class file predates {@code invokedynamic}
     */
    static byte[] install(byte[] classBytes, String name, String desc, int slot) {
        ClassNode node = new ClassNode(Opcodes.ASM9);
        new ClassReader(classBytes).accept(node, 0);
        if ((node.version & 0xFFFF) < Opcodes.V1_7) {
            throw new IllegalArgumentException(node.name + " has class file version " + (node.version & 0xFFFF)
                    + ", which cannot hold invokedynamic");
        }
        MethodNode method = node.methods.stream()
                .filter(m -> m.name.equals(name) && m.desc.equals(desc))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(node.name + " has no method " + name + desc));
        if ((method.access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0) {
            throw new IllegalArgumentException(node.name + "." + name + desc + " has no body");
        }

        boolean isStatic = (method.access & Opcodes.ACC_STATIC) != 0;
        String indyDesc = dispatchDescriptor(node.name, desc, isStatic);
        InsnList body = new InsnList();
        int local = 0;
        for (Type arg : Type.getArgumentTypes(indyDesc)) {
            body.add(new VarInsnNode(arg.getOpcode(Opcodes.ILOAD), local));
            local += arg.getSize();
        }
        body.add(new InvokeDynamicInsnNode(INDY_NAME, indyDesc, BOOTSTRAP, slot));
        body.add(new InsnNode(Type.getReturnType(desc).getOpcode(Opcodes.IRETURN)));

        method.instructions = body;
        method.tryCatchBlocks = new ArrayList<>();
        method.localVariables = null;
        method.visibleLocalVariableAnnotations = null;
        method.invisibleLocalVariableAnnotations = null;
        method.visibleTypeAnnotations = null;
        method.invisibleTypeAnnotations = null;

        // other methods keep their frames; the trampoline has no branches
        ClassWriter writer = new ClassWriter(ClassWriter.COMPUTE_MAXS);
        node.accept(writer);
        return writer.toByteArray();
    }

    /**
     * The type a trampoline's dispatch site has: the receiver of an instance
     * method followed by its parameters.
     */
    static String dispatchDescriptor(String owner, String desc, boolean isStatic) {
        return isStatic ? desc : "(L" + owner + ";" + desc.substring(1);
    }
}
