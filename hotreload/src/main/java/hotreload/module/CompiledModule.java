package hotreload.module;

import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.MethodNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

/**
 * One compiled version of a module: class files keyed by internal name, with
 * their parsed tree form.
 *
 * <p>Instances are values. The parsed {@link ClassNode}s are shared and must
 * not be mutated; code that rewrites a method copies it first.
 */
public final class CompiledModule {

    private final String name;
    private final Map<String, byte[]> classFiles;
    private final Map<String, ClassNode> classes;

    private CompiledModule(String name, Map<String, byte[]> classFiles, Map<String, ClassNode> classes) {
        this.name = name;
        this.classFiles = Collections.unmodifiableMap(classFiles);
        this.classes = Collections.unmodifiableMap(classes);
    }

    /**
     * Builds a module from class file bytes keyed by internal name.
     */
    public static CompiledModule fromBytes(String name, Map<String, byte[]> classFiles) {
        Map<String, byte[]> files = new TreeMap<>();
        Map<String, ClassNode> nodes = new TreeMap<>();
        for (var e : classFiles.entrySet()) {
            ClassNode node = ClassNodes.read(e.getValue());
            files.put(node.name, e.getValue());
            nodes.put(node.name, node);
        }
        return new CompiledModule(name, files, nodes);
    }

    /**
     * Reads every class file under a classes directory or inside a jar.
     *
     * @throws IOException if the path cannot be read
     */
    public static CompiledModule fromPath(String name, Path path) throws IOException {
        Map<String, byte[]> files = new TreeMap<>();
        if (Files.isDirectory(path)) {
            try (Stream<Path> walk = Files.walk(path)) {
                List<Path> classFiles = walk.filter(p -> p.toString().endsWith(".class")).sorted().toList();
                for (Path p : classFiles) {
                    files.put(p.toString(), Files.readAllBytes(p));
                }
            }
        } else if (Files.isRegularFile(path)) {
            try (JarFile jar = new JarFile(path.toFile())) {
                for (JarEntry entry : Collections.list(jar.entries())) {
                    if (entry.isDirectory() || !entry.getName().endsWith(".class")
                            || entry.getName().startsWith("META-INF/")) {
                        continue;
                    }
                    try (InputStream in = jar.getInputStream(entry)) {
                        files.put(entry.getName(), in.readAllBytes());
                    }
                }
            }
        } else {
            throw new IOException("Module output path does not exist: " + path);
        }
        return fromBytes(name, files);
    }

    /**
     * Returns a new module with the given classes added or replaced.
     */
    public CompiledModule withClasses(Map<String, byte[]> extra) {
        if (extra.isEmpty()) return this;
        Map<String, byte[]> files = new TreeMap<>(classFiles);
        Map<String, ClassNode> nodes = new TreeMap<>(classes);
        for (var e : extra.entrySet()) {
            ClassNode node = ClassNodes.read(e.getValue());
            files.put(node.name, e.getValue());
            nodes.put(node.name, node);
        }
        return new CompiledModule(name, files, nodes);
    }

    /**
     * Writes the class files below a classes directory.
     */
    public void writeTo(Path dir) throws IOException {
        for (var e : classFiles.entrySet()) {
            Path target = dir.resolve(e.getKey() + ".class");
            Files.createDirectories(target.getParent());
            Files.write(target, e.getValue());
        }
    }

    public String name() {
        return name;
    }

    public Set<String> classNames() {
        return classes.keySet();
    }

    public Collection<ClassNode> classes() {
        return classes.values();
    }

    public boolean contains(String internalName) {
        return classes.containsKey(internalName);
    }

    public ClassNode classNode(String internalName) {
        return classes.get(internalName);
    }

    public byte[] classBytes(String internalName) {
        byte[] bytes = classFiles.get(internalName);
        return bytes != null ? bytes.clone() : null;
    }

    public MethodNode method(MethodKey key) {
        return ClassNodes.findMethod(classes.get(key.owner()), key.name(), key.descriptor());
    }

    public FieldNode field(FieldKey key) {
        return ClassNodes.findField(classes.get(key.owner()), key.name(), key.descriptor());
    }

    /**
     * True if the class exists and was invented by the compiler.
     */
    public boolean isCompilerGenerated(String internalName) {
        ClassNode node = classes.get(internalName);
        return node != null && ClassNodes.isCompilerGenerated(node);
    }

    /**
     * Types with a stable, source-level name.
     */
    public List<ClassNode> declaredTypes() {
        List<ClassNode> result = new ArrayList<>();
        for (ClassNode node : classes.values()) {
            if (!ClassNodes.isCompilerGenerated(node)) result.add(node);
        }
        return result;
    }

    @Override
    public String toString() {
        return "CompiledModule{" + name + ", classes=" + classes.size() + '}';
    }
}
