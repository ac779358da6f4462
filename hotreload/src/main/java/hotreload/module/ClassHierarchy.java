package hotreload.module;

import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.MethodNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Resolves class structure by internal name across module versions and
 * library classes.
 *
 * <p>Sources are consulted in order; the first one that knows a name wins.
 * Names no source knows are read from class file resources of the fallback
 * class loader (the JDK and the module's references).
 */
public final class ClassHierarchy {

    private static final Logger log = LoggerFactory.getLogger(ClassHierarchy.class);

    /**
     * A member found by walking the type hierarchy.
     *
     * @param owner the type that declares the member
     * @param access the member's access flags
     * @param name member name
     * @param descriptor member descriptor
     */
    public record ResolvedMember(ClassNode owner, int access, String name, String descriptor) {
    }

    private final List<Function<String, ClassNode>> sources;
    private final ClassLoader resourceLoader;
    private final Map<String, Optional<ClassNode>> libraryCache = new ConcurrentHashMap<>();

    public ClassHierarchy(List<Function<String, ClassNode>> sources, ClassLoader resourceLoader) {
        this.sources = List.copyOf(sources);
        this.resourceLoader = resourceLoader != null ? resourceLoader : ClassHierarchy.class.getClassLoader();
    }

    public Optional<ClassNode> find(String internalName) {
        for (Function<String, ClassNode> source : sources) {
            ClassNode node = source.apply(internalName);
            if (node != null) return Optional.of(node);
        }
        return libraryCache.computeIfAbsent(internalName, this::readLibraryClass);
    }

    private Optional<ClassNode> readLibraryClass(String internalName) {
        try (InputStream in = resourceLoader.getResourceAsStream(internalName + ".class")) {
            if (in == null) {
                log.debug("Class file not found for {}", internalName);
                return Optional.empty();
            }
            return Optional.of(ClassNodes.read(in.readAllBytes()));
        } catch (IOException e) {
            log.debug("Failed to read class file for {}: {}", internalName, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Finds the method a symbolic reference resolves to: the class chain
     * first, then superinterfaces.
     */
    public Optional<ResolvedMember> resolveMethod(String owner, String name, String desc) {
        Set<String> interfaces = new LinkedHashSet<>();
        String current = owner;
        while (current != null) {
            Optional<ClassNode> node = find(current);
            if (node.isEmpty()) break;
            MethodNode m = ClassNodes.findMethod(node.get(), name, desc);
            if (m != null) return Optional.of(new ResolvedMember(node.get(), m.access, m.name, m.desc));
            interfaces.addAll(node.get().interfaces);
            current = node.get().superName;
        }
        Deque<String> queue = new ArrayDeque<>(interfaces);
        Set<String> seen = new HashSet<>();
        while (!queue.isEmpty()) {
            String itf = queue.poll();
            if (!seen.add(itf)) continue;
            Optional<ClassNode> node = find(itf);
            if (node.isEmpty()) continue;
            MethodNode m = ClassNodes.findMethod(node.get(), name, desc);
            if (m != null) return Optional.of(new ResolvedMember(node.get(), m.access, m.name, m.desc));
            queue.addAll(node.get().interfaces);
        }
        return Optional.empty();
    }

    /**
     * Finds the field a symbolic reference resolves to: the class itself,
     * its superinterfaces, then its superclass, recursively.
     */
    public Optional<ResolvedMember> resolveField(String owner, String name, String desc) {
        if (owner == null) return Optional.empty();
        Optional<ClassNode> node = find(owner);
        if (node.isEmpty()) return Optional.empty();
        FieldNode f = ClassNodes.findField(node.get(), name, desc);
        if (f != null) return Optional.of(new ResolvedMember(node.get(), f.access, f.name, f.desc));
        for (String itf : node.get().interfaces) {
            Optional<ResolvedMember> found = resolveField(itf, name, desc);
            if (found.isPresent()) return found;
        }
        return resolveField(node.get().superName, name, desc);
    }

    public boolean isInterface(String internalName) {
        return find(internalName).map(ClassNodes::isInterface).orElse(false);
    }

    /**
     * Superclass chain starting with the type itself and ending with
     * {@code java/lang/Object} (when resolvable).
     */
    public List<String> superChain(String internalName) {
        List<String> chain = new ArrayList<>();
        String current = internalName;
        while (current != null) {
            chain.add(current);
            current = find(current).map(n -> n.superName).orElse(null);
        }
        return chain;
    }

    public boolean isSubclassOf(String type, String candidateSuper) {
        return superChain(type).contains(candidateSuper);
    }

    /**
     * Nearest common superclass, as needed for stack map frame computation.
     * Interfaces and unresolvable types widen to {@code java/lang/Object}.
     */
    public String commonSuperClass(String type1, String type2) {
        if (type1.equals(type2)) return type1;
        if (isInterface(type1) || isInterface(type2)) return "java/lang/Object";
        List<String> chain1 = superChain(type1);
        for (String candidate : superChain(type2)) {
            if (chain1.contains(candidate)) return candidate;
        }
        return "java/lang/Object";
    }
}
