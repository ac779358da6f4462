package hotreload.diff;

import hotreload.module.ClassNodes;
import hotreload.module.CompiledModule;
import hotreload.module.MethodKey;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Callee to callers index answering for call sites of generic methods.
 *
 * <p>Erasure compiles a call to {@code <T> T first(List<T>)} into an ordinary
 * call plus casts chosen for the instantiation, so callers of a generic
 * method have to be regenerated when its definition changes. Calls to other
 * methods keep working once the callee's entry point is redirected, so
 * {@link #callersOf} and {@link #calleesOf} only report generic callees.
 * Edges to every module method are kept anyway: a method that turns generic
 * later already has its unchanged callers on record. Callees owned by runtime
 * library packages are never indexed.
 *
 * <p>A call site names the static type of its receiver, which may inherit the
 * method. Edges are keyed by the type that declares it, found by walking the
 * module's superclasses and then its superinterfaces.
 *
 * <p>The index always reflects the latest body seen for each caller:
 * {@link #update(Map)} drops every outgoing edge of a changed method before
 * rescanning its new body.
 */
public final class CallGraphIndex {

    private static final Logger log = LoggerFactory.getLogger(CallGraphIndex.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<MethodKey, Map<MethodKey, MethodNode>> callers = new HashMap<>();
    private final Map<MethodKey, Set<MethodKey>> callees = new HashMap<>();
    private final Set<MethodKey> generics = new HashSet<>();
    private final Map<String, TypeShape> types = new HashMap<>();

    /** What member resolution needs to know of a module type. */
    private record TypeShape(String superName, List<String> interfaces, Set<String> methods) {

        static TypeShape of(ClassNode node) {
            Set<String> methods = new HashSet<>();
            for (MethodNode method : node.methods) methods.add(method.name + method.desc);
            return new TypeShape(node.superName, List.copyOf(node.interfaces), methods);
        }
    }

    /**
     * Rebuilds the index from every method of the module.
     */
    public void index(CompiledModule module) {
        lock.writeLock().lock();
        try {
            callers.clear();
            callees.clear();
            generics.clear();
            types.clear();
            for (ClassNode node : module.classes()) {
                types.put(node.name, TypeShape.of(node));
                for (MethodNode method : node.methods) {
                    if (ClassNodes.isGeneric(method)) generics.add(MethodKey.of(node, method));
                }
            }
            int edges = 0;
            for (ClassNode node : module.classes()) {
                for (MethodNode method : node.methods) {
                    edges += scan(MethodKey.of(node, method), method);
                }
            }
            log.debug("Indexed {} generic method(s) and {} call edge(s) in {}", generics.size(), edges, module.name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Refreshes the type structure from a newly compiled module version, then
     * replaces the edges of its changed methods.
     */
    public void update(CompiledModule candidate, Map<MethodKey, MethodNode> changed) {
        lock.writeLock().lock();
        try {
            for (ClassNode node : candidate.classes()) {
                types.put(node.name, TypeShape.of(node));
            }
            update(changed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the edges of changed methods with the edges of their new
     * bodies. Methods not seen before are added.
     */
    public void update(Map<MethodKey, MethodNode> changed) {
        if (changed.isEmpty()) return;
        lock.writeLock().lock();
        try {
            for (var e : changed.entrySet()) {
                MethodKey key = e.getKey();
                types.computeIfPresent(key.owner(), (owner, shape) -> {
                    Set<String> methods = new HashSet<>(shape.methods());
                    methods.add(key.name() + key.descriptor());
                    return new TypeShape(shape.superName(), shape.interfaces(), methods);
                });
                if (ClassNodes.isGeneric(e.getValue())) {
                    generics.add(e.getKey());
                } else {
                    generics.remove(e.getKey());
                }
            }
            for (MethodKey caller : changed.keySet()) {
                removeOutgoing(caller);
            }
            for (var e : changed.entrySet()) {
                scan(e.getKey(), e.getValue());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Methods whose latest body calls the given generic method, with that body.
     */
    public Map<MethodKey, MethodNode> callersOf(MethodKey callee) {
        lock.readLock().lock();
        try {
            Map<MethodKey, MethodNode> found = callers.get(callee);
            if (found == null || !generics.contains(callee)) return Map.of();
            return Collections.unmodifiableMap(new TreeMap<>(found));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isGeneric(MethodKey method) {
        lock.readLock().lock();
        try {
            return generics.contains(method);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Generic callees currently recorded for a caller. */
    public Set<MethodKey> calleesOf(MethodKey caller) {
        lock.readLock().lock();
        try {
            Set<MethodKey> found = callees.get(caller);
            if (found == null) return Set.of();
            Set<MethodKey> generic = new TreeSet<>();
            for (MethodKey callee : found) {
                if (generics.contains(callee)) generic.add(callee);
            }
            return Collections.unmodifiableSet(generic);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            callers.clear();
            callees.clear();
            generics.clear();
            types.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void removeOutgoing(MethodKey caller) {
        Set<MethodKey> targets = callees.remove(caller);
        if (targets == null) return;
        for (MethodKey target : targets) {
            Map<MethodKey, MethodNode> sites = callers.get(target);
            if (sites == null) continue;
            sites.remove(caller);
            if (sites.isEmpty()) callers.remove(target);
        }
    }

    private int scan(MethodKey caller, MethodNode body) {
        int added = 0;
        for (AbstractInsnNode insn = body.instructions.getFirst(); insn != null; insn = insn.getNext()) {
            if (!(insn instanceof MethodInsnNode call)) continue;
            if (ClassNodes.isRuntimeLibrary(call.owner)) continue;
            MethodKey callee = declaring(call.owner, call.name, call.desc);
            if (callee == null) continue;
            callers.computeIfAbsent(callee, k -> new HashMap<>()).put(caller, body);
            if (callees.computeIfAbsent(caller, k -> new HashSet<>()).add(callee)) added++;
        }
        return added;
    }

    /**
     * The method a call site resolves to among module types, or null when no
     * module type declares it.
     */
    private MethodKey declaring(String owner, String name, String desc) {
        String member = name + desc;
        for (String type = owner; type != null; ) {
            TypeShape shape = types.get(type);
            if (shape == null) break;
            if (shape.methods().contains(member)) return new MethodKey(type, name, desc);
            type = shape.superName();
        }
        Deque<String> pending = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        for (String type = owner; type != null; ) {
            TypeShape shape = types.get(type);
            if (shape == null) break;
            pending.addAll(shape.interfaces());
            type = shape.superName();
        }
        while (!pending.isEmpty()) {
            String type = pending.poll();
            TypeShape shape = types.get(type);
            if (shape == null || !seen.add(type)) continue;
            if (shape.methods().contains(member)) return new MethodKey(type, name, desc);
            pending.addAll(shape.interfaces());
        }
        return null;
    }
}
