package hotreload.module;

import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;

/**
 * Identity of a method across independently compiled module versions:
 * declaring type internal name, method name and descriptor.
 *
 * @param owner internal name of the declaring type
 * @param name method name
 * @param descriptor JVM method descriptor
 */
public record MethodKey(String owner, String name, String descriptor) implements Comparable<MethodKey> {

    public static MethodKey of(ClassNode owner, MethodNode method) {
        return new MethodKey(owner.name, method.name, method.desc);
    }

    public static MethodKey of(MethodInsnNode insn) {
        return new MethodKey(insn.owner, insn.name, insn.desc);
    }

    /**
     * Parses the form produced by {@link #fullName()}.
     */
    public static MethodKey parse(String fullName) {
        int sep = fullName.indexOf("::");
        int paren = fullName.indexOf('(', sep);
        if (sep < 0 || paren < 0) {
            throw new IllegalArgumentException("Not a method full name: " + fullName);
        }
        return new MethodKey(fullName.substring(0, sep).replace('.', '/'),
                fullName.substring(sep + 2, paren), fullName.substring(paren));
    }

    /** Member name plus descriptor, e.g. {@code total(I)J}. */
    public String member() {
        return name + descriptor;
    }

    /** Human-readable full name, e.g. {@code app.Cart::total(I)J}. */
    public String fullName() {
        return owner.replace('/', '.') + "::" + name + descriptor;
    }

    @Override
    public int compareTo(MethodKey o) {
        int c = owner.compareTo(o.owner);
        if (c != 0) return c;
        c = name.compareTo(o.name);
        return c != 0 ? c : descriptor.compareTo(o.descriptor);
    }

    @Override
    public String toString() {
        return fullName();
    }
}
