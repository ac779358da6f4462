package hotreload.engine;

import hotreload.synth.PatchModule;
import hotreload.synth.PatchedMethod;
import hotreload.synth.SynthesisFailure;

import java.nio.file.Path;
import java.util.List;

/**
 * A synthesized and written patch module.
 *
 * @param module module name
 * @param patchPath the written jar, or null when no member could be synthesized
 * @param patch the patch module
 */
public record PatchResult(String module, Path patchPath, PatchModule patch) {

    public boolean isWritten() {
        return patchPath != null;
    }

    /** Patched members, each stamped with the jar holding its wrapper. */
    public List<PatchedMethod> methods() {
        return patch.methods();
    }

    public List<SynthesisFailure> failures() {
        return patch.failures();
    }
}
