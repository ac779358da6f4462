package hotreload.load;

import hotreload.exceptions.HotReloadException;

/**
 * Loads the reload agent into a JVM so that the engine obtains an
 * {@link java.lang.instrument.Instrumentation} handle on the live process.
 */
public interface AgentLoader {

    /**
     * Load the agent into the target JVM.
     *
     * @param pid the process ID of the target JVM
     * @param agentJarPath the path to the agent JAR file
     * @return result of the loading operation
     * @throws HotReloadException if attachment or loading fails
     */
    LoaderResult load(String pid, String agentJarPath) throws HotReloadException;

    /**
     * Load the agent into the target JVM with arguments.
     *
     * @param pid the process ID of the target JVM
     * @param agentJarPath the path to the agent JAR file
     * @param agentArgs arguments passed to {@code agentmain}
     * @return result of the loading operation
     * @throws HotReloadException if attachment or loading fails
     */
    LoaderResult load(String pid, String agentJarPath, String agentArgs) throws HotReloadException;
}
