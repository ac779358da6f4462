package hotreload.load;

import com.sun.tools.attach.VirtualMachine;
import hotreload.exceptions.HotReloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Agent loader implementation using the Java Attach API.
 *
 * <p>Attaching to the current process requires
 * {@code -Djdk.attach.allowAttachSelf=true}.
 *
 * @see AgentLoader
 * @see HotReloadAgent
 */
public class VirtualMachineAgentLoader implements AgentLoader {

    private static final Logger log = LoggerFactory.getLogger(VirtualMachineAgentLoader.class);

    @Override
    public LoaderResult load(String pid, String agentJarPath) throws HotReloadException {
        return load(pid, agentJarPath, null);
    }

    @Override
    public LoaderResult load(String pid, String agentJarPath, String agentArgs) throws HotReloadException {
        if (pid == null || pid.isBlank()) {
            throw new HotReloadException("PID cannot be null or empty");
        }
        if (agentJarPath == null || agentJarPath.isBlank()) {
            throw new HotReloadException("Agent JAR path cannot be null or empty");
        }

        log.info("Attaching to JVM {} to load {}", pid, agentJarPath);

        VirtualMachine vm = null;
        try {
            vm = VirtualMachine.attach(pid);
            vm.loadAgent(agentJarPath, agentArgs);
            log.info("Agent loaded successfully into JVM {}", pid);
            return LoaderResult.success(pid, agentJarPath);
        } catch (Exception e) {
            String message = "Failed to attach and load agent: " + e.getMessage();
            log.error(message, e);
            throw new HotReloadException(message, e);
        } finally {
            if (vm != null) {
                try {
                    vm.detach();
                    log.debug("Detached from JVM {}", pid);
                } catch (Exception e) {
                    log.warn("Failed to detach from JVM {}: {}", pid, e.getMessage());
                }
            }
        }
    }

    /**
     * Loads the agent into the current process. A failure is returned, not
     * thrown, since the engine can still synthesize patches without it.
     *
     * @param agentJar the jar carrying {@link HotReloadAgent} as its {@code Agent-Class}
     */
    public LoaderResult attachSelf(Path agentJar) {
        String pid = String.valueOf(ProcessHandle.current().pid());
        if (HotReloadAgent.instrumentation().isPresent()) {
            return new LoaderResult(true, pid, String.valueOf(agentJar), "Agent already loaded");
        }
        try {
            return load(pid, agentJar.toAbsolutePath().toString());
        } catch (HotReloadException e) {
            return LoaderResult.failure(pid, String.valueOf(agentJar), e.getMessage());
        }
    }
}
