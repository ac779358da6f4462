package hotreload.load;

import java.lang.instrument.Instrumentation;
import java.util.Optional;

/**
 * Outcome of attaching the reload agent to a JVM.
 *
 * @param success whether the agent was loaded
 * @param pid the process the agent was attached to
 * @param agentJarPath the agent jar
 * @param message what happened, or why it failed
 */
public record LoaderResult(boolean success, String pid, String agentJarPath, String message) {

    public static LoaderResult success(String pid, String agentJarPath) {
        return new LoaderResult(true, pid, agentJarPath, "Agent loaded into " + pid);
    }

    public static LoaderResult failure(String pid, String agentJarPath, String message) {
        return new LoaderResult(false, pid, agentJarPath, message);
    }

    /** Whether the agent went into this very process. */
    public boolean isSelf() {
        return String.valueOf(ProcessHandle.current().pid()).equals(pid);
    }

    /**
     * The instrumentation the agent captured, available only after a
     * successful attach to this process.
     */
    public Optional<Instrumentation> instrumentation() {
        return success && isSelf() ? HotReloadAgent.instrumentation() : Optional.empty();
    }
}
