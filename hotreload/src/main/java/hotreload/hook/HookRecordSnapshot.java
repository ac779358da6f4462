package hotreload.hook;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable view of all hook records, keyed by method full name.
 */
public final class HookRecordSnapshot {

    private static final HookRecordSnapshot EMPTY = new HookRecordSnapshot(Map.of());

    private final Map<String, HookRecord> records;

    public HookRecordSnapshot(Map<String, HookRecord> records) {
        this.records = Collections.unmodifiableMap(new TreeMap<>(records));
    }

    public static HookRecordSnapshot empty() {
        return EMPTY;
    }

    public static HookRecordSnapshot of(Collection<HookRecord> records) {
        Map<String, HookRecord> byName = new TreeMap<>();
        for (HookRecord record : records) {
            byName.put(record.method().fullName(), record);
        }
        return new HookRecordSnapshot(byName);
    }

    public Map<String, HookRecord> records() {
        return records;
    }

    public List<HookRecord> forModule(String module) {
        return records.values().stream().filter(r -> r.module().equals(module)).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
