package hotreload.module;

import org.objectweb.asm.tree.ClassNode;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maps declared types to the source file that declares them and back.
 *
 * <p>Source locations come from the class file {@code SourceFile} attribute
 * qualified with the package directory, e.g. {@code app/model/Cart.java}.
 * A changed file is matched by path suffix, so absolute and project-relative
 * paths both resolve.
 */
public final class TypeSourceIndex {

    private final Map<String, String> typeToSource;
    private final Map<String, Set<String>> sourceToTypes;

    private TypeSourceIndex(Map<String, String> typeToSource, Map<String, Set<String>> sourceToTypes) {
        this.typeToSource = typeToSource;
        this.sourceToTypes = sourceToTypes;
    }

    public static TypeSourceIndex of(CompiledModule module) {
        Map<String, String> typeToSource = new TreeMap<>();
        Map<String, Set<String>> sourceToTypes = new TreeMap<>();
        for (ClassNode node : module.declaredTypes()) {
            if (node.sourceFile == null) {
                continue;
            }
            String pkg = ClassNodes.packageOf(node.name);
            String source = pkg.isEmpty() ? node.sourceFile : pkg + "/" + node.sourceFile;
            typeToSource.put(node.name, source);
            sourceToTypes.computeIfAbsent(source, k -> new TreeSet<>()).add(node.name);
        }
        return new TypeSourceIndex(Collections.unmodifiableMap(typeToSource), sourceToTypes);
    }

    public Optional<String> sourceOf(String internalName) {
        return Optional.ofNullable(typeToSource.get(internalName));
    }

    /**
     * Declared types whose source is the given file. Empty for files that
     * declare no types (resources, build files).
     */
    public Set<String> typesDeclaredIn(Path file) {
        String normalized = file.toString().replace('\\', '/');
        Set<String> result = new TreeSet<>();
        for (var e : sourceToTypes.entrySet()) {
            String source = e.getKey();
            if (normalized.equals(source) || normalized.endsWith("/" + source)) {
                result.addAll(e.getValue());
            }
        }
        return result;
    }

    public Set<String> sourceFiles() {
        return Collections.unmodifiableSet(sourceToTypes.keySet());
    }

    public int size() {
        return typeToSource.size();
    }
}
