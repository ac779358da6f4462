package hotreload.hook;

import hotreload.exceptions.HookException;
import hotreload.synth.PatchModule;

import java.nio.file.Path;

/**
 * Defines the classes of a patch module in the live process.
 *
 * <p>Loading is idempotent per patch jar: a patch already defined is
 * returned as is.
 */
public interface PatchLoader {

    LoadedPatch load(PatchModule patch) throws HookException;

    /**
     * Loads a patch jar written by an earlier cycle, for example when hook
     * records are restored after a restart.
     */
    LoadedPatch load(Path jarPath) throws HookException;
}
