package hotreload.hook;

import java.lang.instrument.Instrumentation;
import java.util.Optional;

/**
 * Finds loaded classes of the live process by name.
 */
@FunctionalInterface
public interface ClassLocator {

    /**
     * @param binaryName binary class name, e.g. {@code com.acme.Order$Line}
     * @return the loaded class, or empty when no class of that name is loaded
     */
    Optional<Class<?>> find(String binaryName);

    /**
     * Resolves names through one class loader without initializing.
     */
    static ClassLocator forLoader(ClassLoader loader) {
        return name -> {
            try {
                return Optional.of(Class.forName(name, false, loader));
            } catch (ClassNotFoundException | LinkageError e) {
                return Optional.empty();
            }
        };
    }

    /**
     * Searches every class the JVM has loaded; the first match wins.
     */
    static ClassLocator forInstrumentation(Instrumentation instrumentation) {
        return name -> {
            for (Class<?> type : instrumentation.getAllLoadedClasses()) {
                if (type.getName().equals(name)) return Optional.of(type);
            }
            return Optional.empty();
        };
    }
}
