package hotreload.module;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.MethodNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers over the ASM tree model shared by the diff and synthesis stages.
 */
public final class ClassNodes {

    private static final String[] RUNTIME_PREFIXES = {"java/", "javax/", "jdk/", "sun/", "com/sun/"};

    private ClassNodes() {}

    public static ClassNode read(byte[] bytes) {
        ClassNode node = new ClassNode(Opcodes.ASM9);
        new ClassReader(bytes).accept(node, 0);
        return node;
    }

    /**
     * Anonymous and local classes (they carry an EnclosingMethod attribute)
     * and synthetic classes such as enum switch maps. Such types have no
     * stable name across compilations.
     */
    public static boolean isCompilerGenerated(ClassNode node) {
        return node.outerClass != null || (node.access & Opcodes.ACC_SYNTHETIC) != 0;
    }

    public static boolean isLambdaBody(MethodNode method) {
        return (method.access & Opcodes.ACC_SYNTHETIC) != 0 && method.name.startsWith("lambda$");
    }

    public static boolean isConstructor(MethodNode method) {
        return "<init>".equals(method.name);
    }

    public static boolean isStaticInitializer(MethodNode method) {
        return "<clinit>".equals(method.name);
    }

    /**
     * Methods that can be diffed and hooked: everything with a body that the
     * developer wrote, excluding initializers and compiler bridges.
     */
    public static boolean isHookable(MethodNode method) {
        if (isConstructor(method) || isStaticInitializer(method)) return false;
        if ((method.access & (Opcodes.ACC_SYNTHETIC | Opcodes.ACC_BRIDGE)) != 0) return false;
        return (method.access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) == 0;
    }

    public static boolean isStatic(int access) {
        return (access & Opcodes.ACC_STATIC) != 0;
    }

    public static boolean isPrivate(int access) {
        return (access & Opcodes.ACC_PRIVATE) != 0;
    }

    public static boolean isInterface(ClassNode node) {
        return (node.access & Opcodes.ACC_INTERFACE) != 0;
    }

    /**
     * A method whose generic signature declares its own type parameters.
     */
    public static boolean isGeneric(MethodNode method) {
        return method.signature != null && method.signature.startsWith("<");
    }

    public static boolean isRuntimeLibrary(String internalName) {
        for (String prefix : RUNTIME_PREFIXES) {
            if (internalName.startsWith(prefix)) return true;
        }
        return false;
    }

    public static String packageOf(String internalName) {
        int idx = internalName.lastIndexOf('/');
        return idx < 0 ? "" : internalName.substring(0, idx);
    }

    public static MethodNode findMethod(ClassNode node, String name, String desc) {
        if (node == null) return null;
        for (MethodNode m : node.methods) {
            if (m.name.equals(name) && m.desc.equals(desc)) return m;
        }
        return null;
    }

    public static FieldNode findField(ClassNode node, String name, String desc) {
        if (node == null) return null;
        for (FieldNode f : node.fields) {
            if (f.name.equals(name) && f.desc.equals(desc)) return f;
        }
        return null;
    }

    /**
     * Instructions that execute: labels, line numbers and frames are dropped.
     */
    public static List<AbstractInsnNode> realInstructions(InsnList instructions) {
        List<AbstractInsnNode> result = new ArrayList<>(instructions.size());
        for (AbstractInsnNode insn = instructions.getFirst(); insn != null; insn = insn.getNext()) {
            if (insn.getOpcode() >= 0) result.add(insn);
        }
        return result;
    }
}
