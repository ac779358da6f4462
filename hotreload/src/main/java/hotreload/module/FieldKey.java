package hotreload.module;

/**
 * Identity of a field: declaring type internal name, field name and descriptor.
 */
public record FieldKey(String owner, String name, String descriptor) implements Comparable<FieldKey> {

    public String fullName() {
        return owner.replace('/', '.') + "::" + name + ":" + descriptor;
    }

    @Override
    public int compareTo(FieldKey o) {
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
