package hotreload.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.instrument.Instrumentation;
import java.util.Optional;

/**
 * Java agent entry point. Captures the {@link Instrumentation} handle the
 * hook applier needs to redefine method bodies in the live process.
 *
 * <p>Usable both at startup ({@code -javaagent:hotreload.jar}) and through the
 * Attach API ({@link VirtualMachineAgentLoader}).
 */
public final class HotReloadAgent {

    private static final Logger log = LoggerFactory.getLogger(HotReloadAgent.class);

    private static volatile Instrumentation instrumentation;

    private HotReloadAgent() {}

    public static void premain(String agentArgs, Instrumentation inst) {
        install(inst);
        log.info("Reload agent loaded at startup");
    }

    public static void agentmain(String agentArgs, Instrumentation inst) {
        install(inst);
        log.info("Reload agent attached");
    }

    /**
     * Registers an instrumentation handle obtained elsewhere (for example by
     * an embedding agent).
     */
    public static void install(Instrumentation inst) {
        if (!inst.isRedefineClassesSupported()) {
            log.warn("Instrumentation does not support class redefinition; hooks cannot be applied");
        }
        instrumentation = inst;
    }

    /**
     * Returns the captured instrumentation, if the agent has been loaded.
     */
    public static Optional<Instrumentation> instrumentation() {
        return Optional.ofNullable(instrumentation);
    }
}
