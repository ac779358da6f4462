package hotreload.hook;

import hotreload.module.MethodKey;
import hotreload.synth.WrapperKind;
import hotreload.synth.WrapperRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persists hook records as YAML so that a restarted process can hook every
 * patched method again.
 *
 * <pre>
 * com.acme.Order::total()J:
 *   module: app
 *   kind: MODIFIED
 *   current: {owner: ..., name: ..., descriptor: ..., sequence: 3, jar: ...}
 *   history: [...]
 * </pre>
 */
public final class HookRecordStore {

    private static final Logger log = LoggerFactory.getLogger(HookRecordStore.class);

    public static final String FILE_NAME = "hook-records.yml";

    private final Path file;

    public HookRecordStore(Path directory) {
        this.file = directory.resolve(FILE_NAME);
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return Files.isRegularFile(file);
    }

    public void save(HookRecordSnapshot snapshot) throws IOException {
        Map<String, Object> root = new LinkedHashMap<>();
        for (HookRecord record : snapshot.records().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("module", record.module());
            entry.put("kind", record.kind().name());
            entry.put("current", wrapperToMap(record.current()));
            List<Map<String, Object>> history = new ArrayList<>();
            for (WrapperRef ref : record.history()) history.add(wrapperToMap(ref));
            entry.put("history", history);
            if (record.lastError() != null) entry.put("lastError", record.lastError());
            root.put(record.method().fullName(), entry);
        }
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        String yaml = new Yaml(options).dump(root);

        Files.createDirectories(file.getParent());
        Path tmp = file.resolveSibling(FILE_NAME + ".tmp");
        Files.writeString(tmp, yaml, StandardCharsets.UTF_8);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Saved {} hook record(s) to {}", snapshot.size(), file);
    }

    /**
     * Reads the persisted records; an absent file yields an empty snapshot.
     *
     * @throws IOException if the file cannot be read or is malformed
     */
    @SuppressWarnings("unchecked")
    public HookRecordSnapshot load() throws IOException {
        if (!exists()) return HookRecordSnapshot.empty();
        String yaml = Files.readString(file, StandardCharsets.UTF_8);
        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(yaml);
        } catch (YAMLException e) {
            throw new IOException("Malformed hook records in " + file + ": " + e.getMessage(), e);
        }
        if (loaded == null) return HookRecordSnapshot.empty();
        if (!(loaded instanceof Map)) {
            throw new IOException("Hook records in " + file + " are not a mapping");
        }
        Map<String, HookRecord> records = new TreeMap<>();
        try {
            for (var entry : ((Map<Object, Object>) loaded).entrySet()) {
                String fullName = String.valueOf(entry.getKey());
                if (!(entry.getValue() instanceof Map)) {
                    throw new IllegalArgumentException("record " + fullName + " is not a mapping");
                }
                Map<String, Object> map = (Map<String, Object>) entry.getValue();
                List<WrapperRef> history = new ArrayList<>();
                Object rawHistory = map.get("history");
                if (rawHistory instanceof List) {
                    for (Object item : (List<Object>) rawHistory) history.add(wrapperFromMap(item, fullName));
                }
                Object error = map.get("lastError");
                records.put(fullName, new HookRecord(
                        String.valueOf(required(map, "module", fullName)),
                        MethodKey.parse(fullName),
                        WrapperKind.valueOf(String.valueOf(required(map, "kind", fullName))),
                        wrapperFromMap(required(map, "current", fullName), fullName),
                        history,
                        error != null ? error.toString() : null));
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed hook records in " + file + ": " + e.getMessage(), e);
        }
        log.debug("Loaded {} hook record(s) from {}", records.size(), file);
        return new HookRecordSnapshot(records);
    }

    public void delete() throws IOException {
        Files.deleteIfExists(file);
    }

    private static Map<String, Object> wrapperToMap(WrapperRef ref) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("owner", ref.owner());
        map.put("name", ref.name());
        map.put("descriptor", ref.descriptor());
        map.put("sequence", ref.sequence());
        map.put("jar", ref.patchJar().toString());
        return map;
    }

    @SuppressWarnings("unchecked")
    private static WrapperRef wrapperFromMap(Object raw, String fullName) {
        if (!(raw instanceof Map)) {
            throw new IllegalArgumentException("wrapper of " + fullName + " is not a mapping");
        }
        Map<String, Object> map = (Map<String, Object>) raw;
        return new WrapperRef(
                String.valueOf(required(map, "owner", fullName)),
                String.valueOf(required(map, "name", fullName)),
                String.valueOf(required(map, "descriptor", fullName)),
                Long.parseLong(String.valueOf(required(map, "sequence", fullName))),
                Path.of(String.valueOf(required(map, "jar", fullName))));
    }

    private static Object required(Map<String, Object> map, String key, String fullName) {
        Object value = map.get(key);
        if (value == null) {
            throw new IllegalArgumentException("record " + fullName + " lacks '" + key + "'");
        }
        return value;
    }
}
