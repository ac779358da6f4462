package hotreload.synth;

import hotreload.module.FieldKey;
import hotreload.module.MethodKey;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Metadata stored in a patch jar as {@value #ENTRY}.
 *
 * <pre>
 * module: app
 * sequence: 3
 * classes:
 *   app/Cart$$HotPatch$3: app/Cart
 * methods:
 * - kind: MODIFIED
 *   owner: app/Cart
 *   name: total
 *   descriptor: ()I
 *   wrapperClass: app/Cart$$HotPatch$3
 *   wrapperName: total
 *   wrapperDescriptor: (Lapp/Cart;)I
 * newTypes: []
 * initializers:
 * - field: app/Cart.discount:I
 *   value: '5'
 * failures: []
 * requires: []
 * </pre>
 */
public final class PatchManifest {

    public static final String ENTRY = "META-INF/hotreload/patch.yml";

    private final String module;
    private final long sequence;
    private final Map<String, String> classes;
    private final List<PatchedMethod> methods;
    private final Set<String> newTypes;
    private final List<FieldInitializer> initializers;
    private final List<SynthesisFailure> failures;
    private final Set<Path> requires;

    private PatchManifest(String module, long sequence, Map<String, String> classes, List<PatchedMethod> methods,
                          Set<String> newTypes, List<FieldInitializer> initializers,
                          List<SynthesisFailure> failures, Set<Path> requires) {
        this.module = module;
        this.sequence = sequence;
        this.classes = classes;
        this.methods = methods;
        this.newTypes = newTypes;
        this.initializers = initializers;
        this.failures = failures;
        this.requires = requires;
    }

    public static PatchManifest of(PatchModule patch) {
        return new PatchManifest(patch.module(), patch.sequence(), patch.hosts(), patch.methods(),
                patch.newTypes(), patch.initializers(), patch.failures(), patch.requires());
    }

    public String module() {
        return module;
    }

    public long sequence() {
        return sequence;
    }

    /** Patch class internal name to host type internal name. */
    public Map<String, String> classes() {
        return classes;
    }

    public List<PatchedMethod> methods() {
        return methods;
    }

    public Set<String> newTypes() {
        return newTypes;
    }

    public List<FieldInitializer> initializers() {
        return initializers;
    }

    public List<SynthesisFailure> failures() {
        return failures;
    }

    public Set<Path> requires() {
        return requires;
    }

    public String toYaml() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("module", module);
        root.put("sequence", sequence);
        root.put("classes", new TreeMap<>(classes));

        List<Map<String, Object>> methodList = new ArrayList<>();
        for (PatchedMethod m : methods) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", m.kind().name());
            entry.put("owner", m.original().owner());
            entry.put("name", m.original().name());
            entry.put("descriptor", m.original().descriptor());
            entry.put("wrapperClass", m.wrapper().owner());
            entry.put("wrapperName", m.wrapper().name());
            entry.put("wrapperDescriptor", m.wrapper().descriptor());
            methodList.add(entry);
        }
        root.put("methods", methodList);
        root.put("newTypes", new ArrayList<>(newTypes));

        List<Map<String, Object>> initList = new ArrayList<>();
        for (FieldInitializer init : initializers) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("field", init.field().owner() + "." + init.field().name() + ":" + init.field().descriptor());
            entry.put("value", String.valueOf(init.value()));
            initList.add(entry);
        }
        root.put("initializers", initList);

        List<Map<String, Object>> failureList = new ArrayList<>();
        for (SynthesisFailure f : failures) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", f.typeName());
            if (f.member() != null) entry.put("member", f.member());
            entry.put("reason", f.reason());
            failureList.add(entry);
        }
        root.put("failures", failureList);

        List<String> requireList = new ArrayList<>();
        for (Path p : requires) requireList.add(p.toString());
        root.put("requires", requireList);

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(root);
    }

    /**
     * Parses a manifest.
     *
     * @param jarPath the jar the manifest was read from; stamped on every wrapper
     * @throws IllegalArgumentException if the document is not a patch manifest
     */
    @SuppressWarnings("unchecked")
    public static PatchManifest fromYaml(String yaml, Path jarPath) {
        Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(yaml);
        if (!(loaded instanceof Map)) {
            throw new IllegalArgumentException("Patch manifest of " + jarPath + " is not a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;
        String module = required(root, "module", jarPath);
        long sequence = Long.parseLong(required(root, "sequence", jarPath));

        Map<String, String> classes = new TreeMap<>();
        Object classMap = root.get("classes");
        if (classMap instanceof Map) {
            ((Map<Object, Object>) classMap).forEach((k, v) -> classes.put(String.valueOf(k), String.valueOf(v)));
        }

        List<PatchedMethod> methods = new ArrayList<>();
        for (Map<String, Object> entry : listOfMaps(root.get("methods"))) {
            MethodKey original = new MethodKey(required(entry, "owner", jarPath), required(entry, "name", jarPath),
                    required(entry, "descriptor", jarPath));
            WrapperRef wrapper = new WrapperRef(required(entry, "wrapperClass", jarPath),
                    required(entry, "wrapperName", jarPath), required(entry, "wrapperDescriptor", jarPath),
                    sequence, jarPath);
            methods.add(new PatchedMethod(original, WrapperKind.valueOf(required(entry, "kind", jarPath)), wrapper));
        }

        Set<String> newTypes = new LinkedHashSet<>();
        Object types = root.get("newTypes");
        if (types instanceof List) {
            for (Object t : (List<Object>) types) newTypes.add(String.valueOf(t));
        }

        List<FieldInitializer> initializers = new ArrayList<>();
        for (Map<String, Object> entry : listOfMaps(root.get("initializers"))) {
            String field = required(entry, "field", jarPath);
            int dot = field.lastIndexOf('.');
            int colon = field.indexOf(':', dot);
            if (dot < 0 || colon < 0) {
                throw new IllegalArgumentException("Malformed field '" + field + "' in " + jarPath);
            }
            FieldKey key = new FieldKey(field.substring(0, dot), field.substring(dot + 1, colon), field.substring(colon + 1));
            initializers.add(new FieldInitializer(key, entry.get("value")));
        }

        List<SynthesisFailure> failures = new ArrayList<>();
        for (Map<String, Object> entry : listOfMaps(root.get("failures"))) {
            Object member = entry.get("member");
            failures.add(new SynthesisFailure(required(entry, "type", jarPath),
                    member != null ? member.toString() : null, String.valueOf(entry.get("reason"))));
        }

        Set<Path> requires = new LinkedHashSet<>();
        Object req = root.get("requires");
        if (req instanceof List) {
            for (Object r : (List<Object>) req) requires.add(Path.of(String.valueOf(r)));
        }

        return new PatchManifest(module, sequence, classes, methods, newTypes, initializers, failures, requires);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOfMaps(Object value) {
        List<Map<String, Object>> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<Object>) value) {
                if (item instanceof Map) result.add((Map<String, Object>) item);
            }
        }
        return result;
    }

    private static String required(Map<String, Object> map, String key, Path jarPath) {
        Object value = map.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Patch manifest of " + jarPath + " lacks '" + key + "'");
        }
        return value.toString();
    }
}
