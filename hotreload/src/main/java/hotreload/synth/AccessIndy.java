package hotreload.synth;

import hotreload.runtime.AccessBootstrap;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;

/**
 * Builds {@code invokedynamic} instructions linked by {@link AccessBootstrap}.
 */
final class AccessIndy {

    private static final String BOOTSTRAP_OWNER = Type.getInternalName(AccessBootstrap.class);

    static final Handle MEMBER = new Handle(Opcodes.H_INVOKESTATIC, BOOTSTRAP_OWNER, "member",
            "(Ljava/lang/invoke/MethodHandles$Lookup;Ljava/lang/String;Ljava/lang/invoke/MethodType;"
                    + "ILjava/lang/Class;Ljava/lang/Class;)Ljava/lang/invoke/CallSite;", false);

    static final Handle SPECIAL = new Handle(Opcodes.H_INVOKESTATIC, BOOTSTRAP_OWNER, "special",
            "(Ljava/lang/invoke/MethodHandles$Lookup;Ljava/lang/String;Ljava/lang/invoke/MethodType;"
                    + "Ljava/lang/Class;Ljava/lang/Class;)Ljava/lang/invoke/CallSite;", false);

    private AccessIndy() {}

    /**
     * Replacement for a field instruction; the call site type matches the
     * instruction's stack effect.
     */
    static InvokeDynamicInsnNode field(int opcode, String receiverType, String name, String desc,
                                       String owner, String host) {
        int kind;
        String type;
        switch (opcode) {
            case Opcodes.GETFIELD:
                kind = AccessBootstrap.GET_FIELD;
                type = "(L" + receiverType + ";)" + desc;
                break;
            case Opcodes.PUTFIELD:
                kind = AccessBootstrap.PUT_FIELD;
                type = "(L" + receiverType + ";" + desc + ")V";
                break;
            case Opcodes.GETSTATIC:
                kind = AccessBootstrap.GET_STATIC;
                type = "()" + desc;
                break;
            case Opcodes.PUTSTATIC:
                kind = AccessBootstrap.PUT_STATIC;
                type = "(" + desc + ")V";
                break;
            default:
                throw new IllegalArgumentException("Not a field opcode: " + opcode);
        }
        return new InvokeDynamicInsnNode(name, type, MEMBER, kind, Type.getObjectType(owner), Type.getObjectType(host));
    }

    /**
     * Replacement for a method invocation.
     *
     * @param opcode the replaced invoke opcode; {@code INVOKESPECIAL} of a private method links virtually
     */
    static InvokeDynamicInsnNode invoke(int opcode, String receiverType, String name, String desc,
                                        String owner, String host) {
        int kind;
        String type;
        switch (opcode) {
            case Opcodes.INVOKESTATIC:
                kind = AccessBootstrap.INVOKE_STATIC;
                type = desc;
                break;
            case Opcodes.INVOKEINTERFACE:
                kind = AccessBootstrap.INVOKE_INTERFACE;
                type = withReceiver(receiverType, desc);
                break;
            case Opcodes.INVOKEVIRTUAL:
            case Opcodes.INVOKESPECIAL:
                kind = AccessBootstrap.INVOKE_VIRTUAL;
                type = withReceiver(receiverType, desc);
                break;
            default:
                throw new IllegalArgumentException("Not an invoke opcode: " + opcode);
        }
        return new InvokeDynamicInsnNode(name, type, MEMBER, kind, Type.getObjectType(owner), Type.getObjectType(host));
    }

    /**
     * Replacement for {@code NEW}, {@code DUP}, arguments, {@code INVOKESPECIAL <init>}
     * once the first two are removed.
     */
    static InvokeDynamicInsnNode construct(String owner, String ctorDesc, String host) {
        String type = Type.getMethodDescriptor(Type.getObjectType(owner), Type.getArgumentTypes(ctorDesc));
        return new InvokeDynamicInsnNode(AccessBootstrap.CONSTRUCTOR_NAME, type, MEMBER, AccessBootstrap.NEW,
                Type.getObjectType(owner), Type.getObjectType(host));
    }

    /**
     * Replacement for a non-virtual call to a supertype method made on behalf of {@code host}.
     */
    static InvokeDynamicInsnNode special(String owner, String name, String desc, String host) {
        return new InvokeDynamicInsnNode(name, withReceiver(host, desc), SPECIAL,
                Type.getObjectType(owner), Type.getObjectType(host));
    }

    static String withReceiver(String receiverType, String desc) {
        return "(L" + receiverType + ";" + desc.substring(1);
    }
}
