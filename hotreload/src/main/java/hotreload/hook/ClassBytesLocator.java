package hotreload.hook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;
import java.util.WeakHashMap;

/**
 * Tracks the current class file of every class the hook applier may
 * redefine.
 *
 * <p>Redefinition replaces a whole class, so each redefinition must start
 * from the bytes of the previous one. Classes the applier never touched
 * are read from their class loader's resources.
 */
public final class ClassBytesLocator {

    private static final Logger log = LoggerFactory.getLogger(ClassBytesLocator.class);

    private final Map<Class<?>, byte[]> current = Collections.synchronizedMap(new WeakHashMap<>());

    /**
     * Returns the class file the JVM currently runs for {@code type}.
     *
     * @throws IOException when no class file can be found
     */
    public byte[] locate(Class<?> type) throws IOException {
        byte[] bytes = current.get(type);
        if (bytes != null) return bytes;

        String resource = type.getName().replace('.', '/') + ".class";
        ClassLoader loader = type.getClassLoader();
        try (InputStream in = loader != null
                ? loader.getResourceAsStream(resource)
                : ClassLoader.getSystemResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("No class file found for " + type.getName());
            }
            log.debug("Read class file of {} from its class loader", type.getName());
            return in.readAllBytes();
        }
    }

    /**
     * Records the bytes a class was defined or redefined with.
     */
    public void update(Class<?> type, byte[] bytes) {
        current.put(type, bytes);
    }

    public boolean isTracked(Class<?> type) {
        return current.containsKey(type);
    }

    public void clear() {
        current.clear();
    }
}
