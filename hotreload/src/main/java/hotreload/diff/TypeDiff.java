package hotreload.diff;

import hotreload.module.FieldKey;
import hotreload.module.MethodKey;
import org.objectweb.asm.tree.MethodNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Member diff of one declared type.
 *
 * <p>Built by the {@link DiffEngine}; the cascade step may still append
 * callers. Consumers only see read-only views.
 */
public final class TypeDiff {

    private final String typeName;
    private final boolean newType;
    private final Set<FieldKey> addedFields = new TreeSet<>();
    private final Map<MethodKey, MethodNode> addedMethods = new TreeMap<>();
    private final Map<MethodKey, MethodNode> modifiedMethods = new TreeMap<>();
    private final List<String> unhookableChanges = new ArrayList<>();

    TypeDiff(String typeName, boolean newType) {
        this.typeName = typeName;
        this.newType = newType;
    }

    void addField(FieldKey key) {
        addedFields.add(key);
    }

    void addMethod(MethodKey key, MethodNode body) {
        addedMethods.put(key, body);
    }

    void modifyMethod(MethodKey key, MethodNode body) {
        modifiedMethods.put(key, body);
    }

    void noteUnhookable(String detail) {
        unhookableChanges.add(detail);
    }

    /** Internal name of the type. */
    public String typeName() {
        return typeName;
    }

    /** True if the live process has never loaded this type. */
    public boolean isNewType() {
        return newType;
    }

    public Set<FieldKey> addedFields() {
        return Collections.unmodifiableSet(addedFields);
    }

    public Map<MethodKey, MethodNode> addedMethods() {
        return Collections.unmodifiableMap(addedMethods);
    }

    public Map<MethodKey, MethodNode> modifiedMethods() {
        return Collections.unmodifiableMap(modifiedMethods);
    }

    /**
     * Edits that compiled but cannot take effect in the running process,
     * such as constructor changes.
     */
    public List<String> unhookableChanges() {
        return Collections.unmodifiableList(unhookableChanges);
    }

    public boolean touches(MethodKey key) {
        return addedMethods.containsKey(key) || modifiedMethods.containsKey(key);
    }

    /**
     * A new type always carries work (it must be defined); an existing type
     * only when some member was added or modified.
     */
    public boolean isEmpty() {
        return !newType && addedFields.isEmpty() && addedMethods.isEmpty() && modifiedMethods.isEmpty();
    }

    public int memberCount() {
        return addedFields.size() + addedMethods.size() + modifiedMethods.size();
    }

    @Override
    public String toString() {
        return "TypeDiff{" + typeName +
                (newType ? ", new" : "") +
                ", addedFields=" + addedFields.size() +
                ", addedMethods=" + addedMethods.keySet() +
                ", modifiedMethods=" + modifiedMethods.keySet() +
                '}';
    }
}
