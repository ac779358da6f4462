package hotreload.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Storage for fields that exist in source but not in the layout of the
 * loaded type.
 *
 * <p>Patched code replaces every access to such a field with a call into
 * this table. Instance fields are keyed by instance identity through weak
 * references, so an entry lives as long as its instance. Static fields live
 * as long as the process.
 *
 * <p>Slot creation is exactly-once per instance and field under concurrent
 * first access. Reads and writes synchronize on the slot only.
 *
 * <p>A slot starts with the initializer registered for its field (a literal
 * the constructor or static initializer assigned), or the zero value of its
 * descriptor.
 */
public final class AddedFields {

    private static final Logger log = LoggerFactory.getLogger(AddedFields.class);

    private static final class IdentityWeakRef extends WeakReference<Object> {
        private final int hash;

        IdentityWeakRef(Object referent, ReferenceQueue<Object> q) {
            super(referent, q);
            this.hash = System.identityHashCode(referent);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof IdentityWeakRef other)) return false;
            Object a = this.get();
            Object b = other.get();
            // a cleared referent never matches
            if (a == null || b == null) {
                return false;
            }
            return a == b;
        }
    }

    /**
     * Table sizes, for diagnostics.
     *
     * @param instances instances holding at least one added field
     * @param instanceSlots added instance field slots
     * @param staticSlots added static field slots
     * @param initializers registered initializers
     */
    public record Statistics(int instances, int instanceSlots, int staticSlots, int initializers) {
    }

    private static final ReferenceQueue<Object> QUEUE = new ReferenceQueue<>();
    private static final ConcurrentMap<IdentityWeakRef, ConcurrentMap<String, FieldSlot>> INSTANCES =
            new ConcurrentHashMap<>();
    private static final ConcurrentMap<String, FieldSlot> STATICS = new ConcurrentHashMap<>();
    private static final ConcurrentMap<String, Object> INITIALIZERS = new ConcurrentHashMap<>();

    private AddedFields() {}

    /**
     * Returns the slot of an added instance field, creating it on first access.
     *
     * @param instance the object the field belongs to
     * @param owner the type that declares the field
     * @param name field name
     * @param descriptor field descriptor
     */
    public static FieldSlot slot(Object instance, Class<?> owner, String name, String descriptor) {
        if (instance == null) {
            throw new NullPointerException("Cannot read added field '" + name + "' of a null " + owner.getName());
        }
        cleanup();
        ConcurrentMap<String, FieldSlot> fields = INSTANCES.get(new IdentityWeakRef(instance, null));
        if (fields == null) {
            fields = INSTANCES.computeIfAbsent(new IdentityWeakRef(instance, QUEUE), k -> new ConcurrentHashMap<>());
        }
        return slotIn(fields, key(owner, name), descriptor);
    }

    /**
     * Returns the slot of an added static field, creating it on first access.
     */
    public static FieldSlot staticSlot(Class<?> owner, String name, String descriptor) {
        return slotIn(STATICS, key(owner, name), descriptor);
    }

    /**
     * Stores into an added instance field. The argument order matches the
     * operand stack of a field store followed by the field's identity.
     */
    public static void store(Object instance, Object value, Class<?> owner, String name, String descriptor) {
        slot(instance, owner, name, descriptor).set(value);
    }

    public static void storeStatic(Object value, Class<?> owner, String name, String descriptor) {
        staticSlot(owner, name, descriptor).set(value);
    }

    /**
     * Registers the value slots of a field start with. Slots created before
     * the registration keep their value.
     */
    public static void registerInitializer(Object value, Class<?> owner, String name, String descriptor) {
        if (value == null) {
            return;
        }
        Object previous = INITIALIZERS.put(key(owner, name), value);
        if (previous != null && !previous.equals(value)) {
            log.debug("Initializer of {}.{}:{} changed from {} to {}", owner.getName(), name, descriptor, previous, value);
        }
    }

    public static boolean hasAddedFields(Object instance) {
        cleanup();
        Map<String, FieldSlot> fields = INSTANCES.get(new IdentityWeakRef(instance, null));
        return fields != null && !fields.isEmpty();
    }

    /**
     * Names of the added fields an instance holds, as {@code Owner.name}.
     */
    public static Set<String> fieldNames(Object instance) {
        cleanup();
        Map<String, FieldSlot> fields = INSTANCES.get(new IdentityWeakRef(instance, null));
        return fields == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(fields.keySet()));
    }

    /**
     * Drops the added fields of one instance; the next access recreates them
     * from their initializers.
     */
    public static void clear(Object instance) {
        INSTANCES.remove(new IdentityWeakRef(instance, null));
    }

    /** Drops every slot and initializer. */
    public static void clearAll() {
        INSTANCES.clear();
        STATICS.clear();
        INITIALIZERS.clear();
    }

    public static Statistics statistics() {
        cleanup();
        int slots = 0;
        for (Map<String, FieldSlot> fields : INSTANCES.values()) {
            slots += fields.size();
        }
        return new Statistics(INSTANCES.size(), slots, STATICS.size(), INITIALIZERS.size());
    }

    private static FieldSlot slotIn(ConcurrentMap<String, FieldSlot> fields, String key, String descriptor) {
        FieldSlot slot = fields.get(key);
        if (slot != null && slot.descriptor().equals(descriptor)) {
            return slot;
        }
        return fields.compute(key, (k, existing) -> {
            if (existing != null && existing.descriptor().equals(descriptor)) {
                return existing;
            }
            if (existing != null) {
                log.warn("Added field {} changed type from {} to {}; its value is reset",
                        k, existing.descriptor(), descriptor);
            }
            Object initial = INITIALIZERS.get(k);
            return new FieldSlot(descriptor, initial != null && matches(initial, descriptor) ? initial : null);
        });
    }

    private static boolean matches(Object value, String descriptor) {
        Object zero = FieldSlot.zeroValue(descriptor);
        return zero == null || zero.getClass() == value.getClass();
    }

    private static String key(Class<?> owner, String name) {
        return owner.getName() + "." + name;
    }

    private static void cleanup() {
        IdentityWeakRef ref;
        while ((ref = (IdentityWeakRef) QUEUE.poll()) != null) {
            INSTANCES.remove(ref);
        }
    }
}
