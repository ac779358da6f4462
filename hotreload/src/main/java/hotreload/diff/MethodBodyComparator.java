package hotreload.diff;

import hotreload.module.ClassNodes;
import hotreload.module.CompiledModule;
import org.objectweb.asm.ConstantDynamic;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.IincInsnNode;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.MultiANewArrayInsnNode;
import org.objectweb.asm.tree.TableSwitchInsnNode;
import org.objectweb.asm.tree.TryCatchBlockNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural equality of method bodies from two independently compiled
 * versions of a module.
 *
 * <p>Compares local count, handler count and types, instruction count, then
 * opcodes and operands. Constant-pool layout, labels, line numbers and frames
 * never take part. Branch targets are equal whenever the opcodes are.
 * Numeric constants compare by exact value of their kind, so {@code 1.0f}
 * equals {@code 1.0f} but not {@code 1.0000001f}.
 *
 * <p>References to anonymous and local classes, and to synthetic lambda
 * bodies, are compared by structure rather than name: their names are
 * assigned by the compiler and shift when siblings are added. The recursion
 * is memoized and a pair under comparison is assumed equal when met again.
 *
 * <p>Instances carry memo state and are not thread-safe; use one per diff.
 */
public final class MethodBodyComparator {

    private final CompiledModule left;
    private final CompiledModule right;
    private final Map<String, Boolean> memo = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    public MethodBodyComparator(CompiledModule left, CompiledModule right) {
        this.left = left;
        this.right = right;
    }

    public boolean bodiesEqual(MethodNode a, MethodNode b) {
        boolean aHasCode = a.instructions.size() > 0;
        boolean bHasCode = b.instructions.size() > 0;
        if (!aHasCode || !bHasCode) {
            return aHasCode == bHasCode;
        }
        if (a.maxLocals != b.maxLocals) return false;
        if (a.tryCatchBlocks.size() != b.tryCatchBlocks.size()) return false;
        for (int i = 0; i < a.tryCatchBlocks.size(); i++) {
            TryCatchBlockNode ta = a.tryCatchBlocks.get(i);
            TryCatchBlockNode tb = b.tryCatchBlocks.get(i);
            if (ta.type == null || tb.type == null) {
                if (ta.type != tb.type) return false;
            } else if (!sameType(ta.type, tb.type)) {
                return false;
            }
        }

        List<AbstractInsnNode> ia = ClassNodes.realInstructions(a.instructions);
        List<AbstractInsnNode> ib = ClassNodes.realInstructions(b.instructions);
        if (ia.size() != ib.size()) return false;
        for (int i = 0; i < ia.size(); i++) {
            AbstractInsnNode x = ia.get(i);
            AbstractInsnNode y = ib.get(i);
            if (x.getOpcode() != y.getOpcode()) return false;
            if (!sameOperands(x, y)) return false;
        }
        return true;
    }

    private boolean sameOperands(AbstractInsnNode x, AbstractInsnNode y) {
        switch (x.getType()) {
            case AbstractInsnNode.INT_INSN:
                return ((IntInsnNode) x).operand == ((IntInsnNode) y).operand;
            case AbstractInsnNode.VAR_INSN:
                return ((VarInsnNode) x).var == ((VarInsnNode) y).var;
            case AbstractInsnNode.TYPE_INSN:
                return sameType(((TypeInsnNode) x).desc, ((TypeInsnNode) y).desc);
            case AbstractInsnNode.FIELD_INSN: {
                FieldInsnNode fx = (FieldInsnNode) x;
                FieldInsnNode fy = (FieldInsnNode) y;
                return fx.name.equals(fy.name) && sameType(fx.owner, fy.owner) && sameDescriptor(fx.desc, fy.desc);
            }
            case AbstractInsnNode.METHOD_INSN: {
                MethodInsnNode mx = (MethodInsnNode) x;
                MethodInsnNode my = (MethodInsnNode) y;
                return mx.name.equals(my.name) && mx.itf == my.itf
                        && sameType(mx.owner, my.owner) && sameDescriptor(mx.desc, my.desc);
            }
            case AbstractInsnNode.INVOKE_DYNAMIC_INSN: {
                InvokeDynamicInsnNode dx = (InvokeDynamicInsnNode) x;
                InvokeDynamicInsnNode dy = (InvokeDynamicInsnNode) y;
                if (!dx.name.equals(dy.name) || !sameDescriptor(dx.desc, dy.desc)) return false;
                if (!sameHandle(dx.bsm, dy.bsm)) return false;
                return sameConstants(dx.bsmArgs, dy.bsmArgs);
            }
            case AbstractInsnNode.LDC_INSN:
                return sameConstant(((LdcInsnNode) x).cst, ((LdcInsnNode) y).cst);
            case AbstractInsnNode.IINC_INSN: {
                IincInsnNode ix = (IincInsnNode) x;
                IincInsnNode iy = (IincInsnNode) y;
                return ix.var == iy.var && ix.incr == iy.incr;
            }
            case AbstractInsnNode.TABLESWITCH_INSN: {
                TableSwitchInsnNode sx = (TableSwitchInsnNode) x;
                TableSwitchInsnNode sy = (TableSwitchInsnNode) y;
                return sx.min == sy.min && sx.max == sy.max && sx.labels.size() == sy.labels.size();
            }
            case AbstractInsnNode.LOOKUPSWITCH_INSN:
                return ((LookupSwitchInsnNode) x).keys.equals(((LookupSwitchInsnNode) y).keys);
            case AbstractInsnNode.MULTIANEWARRAY_INSN: {
                MultiANewArrayInsnNode ax = (MultiANewArrayInsnNode) x;
                MultiANewArrayInsnNode ay = (MultiANewArrayInsnNode) y;
                return ax.dims == ay.dims && sameDescriptor(ax.desc, ay.desc);
            }
            default:
                // plain opcodes and jumps: the opcode already matched
                return true;
        }
    }

    private boolean sameConstants(Object[] a, Object[] b) {
        if (a.length != b.length) return false;
        for (int i = 0; i < a.length; i++) {
            if (!sameConstant(a[i], b[i])) return false;
        }
        return true;
    }

    boolean sameConstant(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Type ta && b instanceof Type tb) return sameType(ta, tb);
        if (a instanceof Handle ha && b instanceof Handle hb) return sameHandle(ha, hb);
        if (a instanceof ConstantDynamic ca && b instanceof ConstantDynamic cb) {
            if (!ca.getName().equals(cb.getName()) || !sameDescriptor(ca.getDescriptor(), cb.getDescriptor())) {
                return false;
            }
            if (!sameHandle(ca.getBootstrapMethod(), cb.getBootstrapMethod())) return false;
            if (ca.getBootstrapMethodArgumentCount() != cb.getBootstrapMethodArgumentCount()) return false;
            for (int i = 0; i < ca.getBootstrapMethodArgumentCount(); i++) {
                if (!sameConstant(ca.getBootstrapMethodArgument(i), cb.getBootstrapMethodArgument(i))) return false;
            }
            return true;
        }
        // Float.equals and Double.equals compare exact bit patterns
        return a.getClass() == b.getClass() && a.equals(b);
    }

    private boolean sameHandle(Handle a, Handle b) {
        if (a.getTag() != b.getTag() || a.isInterface() != b.isInterface()) return false;
        MethodNode lambdaA = lambdaBody(left, a);
        MethodNode lambdaB = lambdaBody(right, b);
        if (lambdaA != null && lambdaB != null) {
            return sameType(a.getOwner(), b.getOwner())
                    && sameDescriptor(a.getDesc(), b.getDesc())
                    && sameRecursively("lambda:" + a.getOwner() + "." + a.getName() + a.getDesc()
                            + "|" + b.getOwner() + "." + b.getName() + b.getDesc(),
                    () -> bodiesEqual(lambdaA, lambdaB));
        }
        if (lambdaA != null || lambdaB != null) return false;
        return a.getName().equals(b.getName())
                && sameType(a.getOwner(), b.getOwner())
                && sameDescriptor(a.getDesc(), b.getDesc());
    }

    private static MethodNode lambdaBody(CompiledModule module, Handle handle) {
        MethodNode method = ClassNodes.findMethod(module.classNode(handle.getOwner()), handle.getName(), handle.getDesc());
        return method != null && ClassNodes.isLambdaBody(method) ? method : null;
    }

    private boolean sameDescriptor(String a, String b) {
        if (a.equals(b)) return true;
        return sameType(Type.getType(a), Type.getType(b));
    }

    private boolean sameType(Type a, Type b) {
        if (a.getSort() != b.getSort()) return false;
        switch (a.getSort()) {
            case Type.OBJECT:
                return sameType(a.getInternalName(), b.getInternalName());
            case Type.ARRAY:
                return a.getDimensions() == b.getDimensions() && sameType(a.getElementType(), b.getElementType());
            case Type.METHOD: {
                Type[] argsA = a.getArgumentTypes();
                Type[] argsB = b.getArgumentTypes();
                if (argsA.length != argsB.length) return false;
                for (int i = 0; i < argsA.length; i++) {
                    if (!sameType(argsA[i], argsB[i])) return false;
                }
                return sameType(a.getReturnType(), b.getReturnType());
            }
            default:
                return a.equals(b);
        }
    }

    /**
     * Compares internal names (or array descriptors). Two compiler-generated
     * classes compare by structure, whatever their names.
     */
    boolean sameType(String a, String b) {
        if (a.startsWith("[") || b.startsWith("[")) {
            return sameType(Type.getType(a), Type.getType(b));
        }
        boolean generatedA = left.isCompilerGenerated(a);
        boolean generatedB = right.isCompilerGenerated(b);
        if (generatedA && generatedB) {
            return sameRecursively("type:" + a + "|" + b, () -> sameNestedType(a, b));
        }
        if (generatedA || generatedB) return false;
        return a.equals(b);
    }

    private boolean sameNestedType(String a, String b) {
        ClassNode ca = left.classNode(a);
        ClassNode cb = right.classNode(b);
        if (ca.access != cb.access) return false;
        if ((ca.superName == null) != (cb.superName == null)) return false;
        if (ca.superName != null && !sameType(ca.superName, cb.superName)) return false;
        if (ca.interfaces.size() != cb.interfaces.size()) return false;
        for (int i = 0; i < ca.interfaces.size(); i++) {
            if (!sameType(ca.interfaces.get(i), cb.interfaces.get(i))) return false;
        }
        if (ca.fields.size() != cb.fields.size()) return false;
        for (int i = 0; i < ca.fields.size(); i++) {
            FieldNode fa = ca.fields.get(i);
            FieldNode fb = cb.fields.get(i);
            if (!fa.name.equals(fb.name) || !sameDescriptor(fa.desc, fb.desc)) return false;
            if (!sameConstant(fa.value, fb.value)) return false;
        }
        if (ca.methods.size() != cb.methods.size()) return false;
        for (int i = 0; i < ca.methods.size(); i++) {
            MethodNode ma = ca.methods.get(i);
            MethodNode mb = cb.methods.get(i);
            if (!ma.name.equals(mb.name) || !sameDescriptor(ma.desc, mb.desc)) return false;
            if (!bodiesEqual(ma, mb)) return false;
        }
        return true;
    }

    private boolean sameRecursively(String key, java.util.function.BooleanSupplier comparison) {
        Boolean known = memo.get(key);
        if (known != null) return known;
        if (!inProgress.add(key)) {
            // cycle: the outer comparison decides
            return true;
        }
        try {
            boolean result = comparison.getAsBoolean();
            memo.put(key, result);
            return result;
        } finally {
            inProgress.remove(key);
        }
    }
}
