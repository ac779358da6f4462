package hotreload.synth;

import hotreload.module.ClassNodes;
import hotreload.module.FieldKey;
import hotreload.runtime.AddedFields;
import hotreload.runtime.FieldSlot;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rewrites accesses to added fields into calls on {@link AddedFields}, and
 * harvests literal initializers of added fields.
 */
final class FieldIndirection {

    private static final String TABLE = Type.getInternalName(AddedFields.class);
    private static final String SLOT = Type.getInternalName(FieldSlot.class);

    private FieldIndirection() {}

    /**
     * Replaces a field instruction with the equivalent table access. The
     * operand stack effect is unchanged.
     *
     * @param declaringOwner the type that declares the field in source
     */
    static void rewrite(InsnList instructions, FieldInsnNode insn, String declaringOwner) {
        Type type = Type.getType(insn.desc);
        InsnList replacement = new InsnList();
        switch (insn.getOpcode()) {
            case Opcodes.GETFIELD:
                pushIdentity(replacement, declaringOwner, insn);
                replacement.add(new MethodInsnNode(Opcodes.INVOKESTATIC, TABLE, "slot",
                        "(Ljava/lang/Object;Ljava/lang/Class;Ljava/lang/String;Ljava/lang/String;)L" + SLOT + ";", false));
                replacement.add(new MethodInsnNode(Opcodes.INVOKEVIRTUAL, SLOT, "get", "()Ljava/lang/Object;", false));
                unbox(replacement, type);
                break;
            case Opcodes.PUTFIELD:
                box(replacement, type);
                pushIdentity(replacement, declaringOwner, insn);
                replacement.add(new MethodInsnNode(Opcodes.INVOKESTATIC, TABLE, "store",
                        "(Ljava/lang/Object;Ljava/lang/Object;Ljava/lang/Class;Ljava/lang/String;Ljava/lang/String;)V", false));
                break;
            case Opcodes.GETSTATIC:
                pushIdentity(replacement, declaringOwner, insn);
                replacement.add(new MethodInsnNode(Opcodes.INVOKESTATIC, TABLE, "staticSlot",
                        "(Ljava/lang/Class;Ljava/lang/String;Ljava/lang/String;)L" + SLOT + ";", false));
                replacement.add(new MethodInsnNode(Opcodes.INVOKEVIRTUAL, SLOT, "get", "()Ljava/lang/Object;", false));
                unbox(replacement, type);
                break;
            case Opcodes.PUTSTATIC:
                box(replacement, type);
                pushIdentity(replacement, declaringOwner, insn);
                replacement.add(new MethodInsnNode(Opcodes.INVOKESTATIC, TABLE, "storeStatic",
                        "(Ljava/lang/Object;Ljava/lang/Class;Ljava/lang/String;Ljava/lang/String;)V", false));
                break;
            default:
                throw new IllegalArgumentException("Not a field opcode: " + insn.getOpcode());
        }
        instructions.insertBefore(insn, replacement);
        instructions.remove(insn);
    }

    private static void pushIdentity(InsnList list, String owner, FieldInsnNode insn) {
        list.add(new LdcInsnNode(Type.getObjectType(owner)));
        list.add(new LdcInsnNode(insn.name));
        list.add(new LdcInsnNode(insn.desc));
    }

    /**
     * Literal initial values of the given added fields of a type.
     *
     * <p>Instance fields: the first constructor (in descriptor order) storing a
     * literal into {@code this.field}. Static fields: a {@code ConstantValue}
     * attribute, else a literal store in the static initializer.
     */
    static List<FieldInitializer> initializers(ClassNode type, Set<FieldKey> addedFields) {
        List<FieldInitializer> result = new ArrayList<>();
        List<MethodNode> constructors = new ArrayList<>();
        MethodNode staticInit = null;
        for (MethodNode m : type.methods) {
            if (ClassNodes.isConstructor(m)) constructors.add(m);
            if (ClassNodes.isStaticInitializer(m)) staticInit = m;
        }
        constructors.sort((a, b) -> a.desc.compareTo(b.desc));

        for (FieldKey key : addedFields) {
            FieldNode field = ClassNodes.findField(type, key.name(), key.descriptor());
            if (field == null) continue;
            Object value = null;
            if (ClassNodes.isStatic(field.access)) {
                value = field.value != null ? field.value : literalStore(staticInit, Opcodes.PUTSTATIC, type.name, field);
            } else {
                for (MethodNode ctor : constructors) {
                    value = literalStore(ctor, Opcodes.PUTFIELD, type.name, field);
                    if (value != null) break;
                }
            }
            Object coerced = value != null ? coerce(value, field.desc) : null;
            if (coerced != null) {
                result.add(new FieldInitializer(key, coerced));
            }
        }
        return result;
    }

    /**
     * Finds {@code [ALOAD 0] <literal> PUTFIELD|PUTSTATIC owner.field}.
     */
    private static Object literalStore(MethodNode method, int opcode, String owner, FieldNode field) {
        if (method == null) return null;
        List<AbstractInsnNode> insns = ClassNodes.realInstructions(method.instructions);
        for (int i = 1; i < insns.size(); i++) {
            if (!(insns.get(i) instanceof FieldInsnNode store) || store.getOpcode() != opcode) continue;
            if (!store.owner.equals(owner) || !store.name.equals(field.name) || !store.desc.equals(field.desc)) continue;
            if (opcode == Opcodes.PUTFIELD) {
                if (i < 2 || !(insns.get(i - 2) instanceof VarInsnNode load)
                        || load.getOpcode() != Opcodes.ALOAD || load.var != 0) {
                    continue;
                }
            }
            Object literal = literal(insns.get(i - 1));
            if (literal != null) return literal;
        }
        return null;
    }

    private static Object literal(AbstractInsnNode insn) {
        int op = insn.getOpcode();
        if (op >= Opcodes.ICONST_M1 && op <= Opcodes.ICONST_5) return op - Opcodes.ICONST_0;
        switch (op) {
            case Opcodes.LCONST_0: return 0L;
            case Opcodes.LCONST_1: return 1L;
            case Opcodes.FCONST_0: return 0f;
            case Opcodes.FCONST_1: return 1f;
            case Opcodes.FCONST_2: return 2f;
            case Opcodes.DCONST_0: return 0d;
            case Opcodes.DCONST_1: return 1d;
            case Opcodes.BIPUSH:
            case Opcodes.SIPUSH:
                return ((IntInsnNode) insn).operand;
            case Opcodes.LDC: {
                Object cst = ((LdcInsnNode) insn).cst;
                return cst instanceof Number || cst instanceof String ? cst : null;
            }
            default:
                return null;
        }
    }

    /**
     * Boxes a raw literal as the field descriptor requires.
     */
    static Object coerce(Object value, String desc) {
        switch (desc) {
            case "Z": return value instanceof Integer i ? i != 0 : null;
            case "B": return value instanceof Integer i ? i.byteValue() : null;
            case "C": return value instanceof Integer i ? (char) i.intValue() : null;
            case "S": return value instanceof Integer i ? i.shortValue() : null;
            case "I": return value instanceof Integer ? value : null;
            case "J": return value instanceof Long ? value : null;
            case "F": return value instanceof Float ? value : null;
            case "D": return value instanceof Double ? value : null;
            case "Ljava/lang/String;": return value instanceof String ? value : null;
            default: return null;
        }
    }

    /**
     * Instructions registering an initializer, for the patch class initializer.
     */
    static InsnList registration(FieldInitializer init) {
        InsnList list = new InsnList();
        Object value = init.value();
        Type type = Type.getType(init.field().descriptor());
        if (value instanceof Boolean b) {
            list.add(new InsnNode(b ? Opcodes.ICONST_1 : Opcodes.ICONST_0));
        } else if (value instanceof Character c) {
            list.add(new LdcInsnNode((int) c));
        } else if (value instanceof Byte || value instanceof Short) {
            list.add(new LdcInsnNode(((Number) value).intValue()));
        } else {
            list.add(new LdcInsnNode(value));
        }
        box(list, type);
        list.add(new LdcInsnNode(Type.getObjectType(init.field().owner())));
        list.add(new LdcInsnNode(init.field().name()));
        list.add(new LdcInsnNode(init.field().descriptor()));
        list.add(new MethodInsnNode(Opcodes.INVOKESTATIC, TABLE, "registerInitializer",
                "(Ljava/lang/Object;Ljava/lang/Class;Ljava/lang/String;Ljava/lang/String;)V", false));
        return list;
    }

    static void box(InsnList list, Type type) {
        String wrapper = wrapperOf(type);
        if (wrapper == null) return;
        list.add(new MethodInsnNode(Opcodes.INVOKESTATIC, wrapper, "valueOf",
                "(" + type.getDescriptor() + ")L" + wrapper + ";", false));
    }

    static void unbox(InsnList list, Type type) {
        String wrapper = wrapperOf(type);
        if (wrapper != null) {
            list.add(new TypeInsnNode(Opcodes.CHECKCAST, wrapper));
            list.add(new MethodInsnNode(Opcodes.INVOKEVIRTUAL, wrapper, type.getClassName() + "Value",
                    "()" + type.getDescriptor(), false));
        } else if (!"java/lang/Object".equals(type.getInternalName())) {
            list.add(new TypeInsnNode(Opcodes.CHECKCAST, type.getInternalName()));
        }
    }

    private static String wrapperOf(Type type) {
        switch (type.getSort()) {
            case Type.BOOLEAN: return "java/lang/Boolean";
            case Type.BYTE: return "java/lang/Byte";
            case Type.CHAR: return "java/lang/Character";
            case Type.SHORT: return "java/lang/Short";
            case Type.INT: return "java/lang/Integer";
            case Type.LONG: return "java/lang/Long";
            case Type.FLOAT: return "java/lang/Float";
            case Type.DOUBLE: return "java/lang/Double";
            default: return null;
        }
    }
}
