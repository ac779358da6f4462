package hotreload.synth;

import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TryCatchBlockNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Copies method bodies between tree nodes with fresh labels, so a source
 * body can be copied any number of times without sharing nodes.
 *
 * <p>Stack map frames and local variable tables are dropped: frames are
 * recomputed when the patch class is written, and local variable types may
 * name classes the patch renames.
 */
final class MethodCopier {

    private MethodCopier() {}

    static void copyBody(MethodNode source, MethodNode target) {
        Map<LabelNode, LabelNode> labels = new HashMap<>();
        for (AbstractInsnNode insn = source.instructions.getFirst(); insn != null; insn = insn.getNext()) {
            if (insn instanceof LabelNode label) {
                labels.put(label, new LabelNode());
            }
        }
        for (AbstractInsnNode insn = source.instructions.getFirst(); insn != null; insn = insn.getNext()) {
            if (insn.getType() == AbstractInsnNode.FRAME) continue;
            target.instructions.add(insn.clone(labels));
        }
        for (TryCatchBlockNode block : source.tryCatchBlocks) {
            target.tryCatchBlocks.add(new TryCatchBlockNode(labels.get(block.start), labels.get(block.end),
                    labels.get(block.handler), block.type));
        }
        target.maxLocals = source.maxLocals;
        target.maxStack = source.maxStack;
    }
}
