package hotreload.runtime;

import java.lang.invoke.CallSite;
import java.lang.invoke.ConstantCallSite;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;

/**
 * Links patch code to members its own class may not access directly:
 * private members of the host type, protected members of supertypes in
 * other packages, and {@code super} calls.
 *
 * <p>The call site's declared type matches the operand stack of the
 * instruction it replaces. Resolution uses a private lookup on the host
 * type, derived from the patch class which shares the host's package and
 * class loader. The host's nestmates and supertypes are reachable from it.
 */
public final class AccessBootstrap {

    public static final int GET_FIELD = 1;
    public static final int PUT_FIELD = 2;
    public static final int GET_STATIC = 3;
    public static final int PUT_STATIC = 4;
    public static final int INVOKE_VIRTUAL = 5;
    public static final int INVOKE_STATIC = 6;
    public static final int INVOKE_INTERFACE = 7;
    public static final int NEW = 8;

    /** Name of constructor call sites, {@code <init>} not being a valid call site name. */
    public static final String CONSTRUCTOR_NAME = "new";

    private AccessBootstrap() {}

    /**
     * Bootstrap for field access, method invocation and construction.
     *
     * @param kind one of the constants of this class
     * @param owner the class declaring (or inheriting) the member
     * @param host the patched type, whose access rights the member is resolved with
     */
    public static CallSite member(MethodHandles.Lookup caller, String name, MethodType type, int kind,
                                  Class<?> owner, Class<?> host) throws ReflectiveOperationException {
        MethodHandles.Lookup lookup = MethodHandles.privateLookupIn(host, caller);
        MethodHandle handle;
        switch (kind) {
            case GET_FIELD:
                handle = lookup.findGetter(owner, name, type.returnType());
                break;
            case PUT_FIELD:
                handle = lookup.findSetter(owner, name, type.parameterType(1));
                break;
            case GET_STATIC:
                handle = lookup.findStaticGetter(owner, name, type.returnType());
                break;
            case PUT_STATIC:
                handle = lookup.findStaticSetter(owner, name, type.parameterType(0));
                break;
            case INVOKE_VIRTUAL:
            case INVOKE_INTERFACE:
                handle = lookup.findVirtual(owner, name, type.dropParameterTypes(0, 1));
                break;
            case INVOKE_STATIC:
                handle = lookup.findStatic(owner, name, type);
                break;
            case NEW:
                handle = lookup.findConstructor(owner, type.changeReturnType(void.class));
                break;
            default:
                throw new IllegalArgumentException("Unknown member access kind " + kind + " for " + owner.getName() + "." + name);
        }
        return new ConstantCallSite(handle.asType(type));
    }

    /**
     * Bootstrap for {@code invokespecial}: a superclass or superinterface
     * method invoked without virtual dispatch, on behalf of {@code host}.
     */
    public static CallSite special(MethodHandles.Lookup caller, String name, MethodType type, Class<?> owner, Class<?> host)
            throws ReflectiveOperationException {
        MethodHandles.Lookup lookup = MethodHandles.privateLookupIn(host, caller);
        MethodHandle handle = lookup.findSpecial(owner, name, type.dropParameterTypes(0, 1), host);
        return new ConstantCallSite(handle.asType(type));
    }
}
