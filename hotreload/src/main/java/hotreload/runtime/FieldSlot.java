package hotreload.runtime;

/**
 * Storage for one added field of one instance (or of a type, for static
 * fields).
 *
 * <p>Holds the boxed value. Patched code reads and writes through the slot;
 * a slot handed out once stays valid for the lifetime of its instance, so a
 * reference to it behaves like the field's address.
 */
public final class FieldSlot {

    private final String descriptor;
    private Object value;

    FieldSlot(String descriptor, Object initialValue) {
        this.descriptor = descriptor;
        this.value = initialValue != null ? initialValue : zeroValue(descriptor);
    }

    public synchronized Object get() {
        return value;
    }

    public synchronized void set(Object newValue) {
        this.value = newValue;
    }

    /** Field descriptor, e.g. {@code I} or {@code Ljava/lang/String;}. */
    public String descriptor() {
        return descriptor;
    }

    /**
     * The value a field of the given descriptor holds before any store.
     */
    static Object zeroValue(String descriptor) {
        switch (descriptor.charAt(0)) {
            case 'Z': return Boolean.FALSE;
            case 'B': return (byte) 0;
            case 'C': return (char) 0;
            case 'S': return (short) 0;
            case 'I': return 0;
            case 'J': return 0L;
            case 'F': return 0f;
            case 'D': return 0d;
            default: return null;
        }
    }

    @Override
    public String toString() {
        return "FieldSlot{" + descriptor + "=" + get() + '}';
    }
}
