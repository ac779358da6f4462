package hotreload.snapshot;

import hotreload.module.CompiledModule;
import hotreload.module.TypeSourceIndex;

/**
 * The last successfully diffed version of a module.
 *
 * @param module module name
 * @param compiled the compiled module
 * @param sourceIndex declared type to source file mapping of {@code compiled}
 * @param cycle number of successful cycles this snapshot is the result of (0 = initial)
 */
public record ModuleSnapshot(String module, CompiledModule compiled, TypeSourceIndex sourceIndex, long cycle) {

    public static ModuleSnapshot initial(CompiledModule compiled) {
        return new ModuleSnapshot(compiled.name(), compiled, TypeSourceIndex.of(compiled), 0);
    }

    /**
     * Returns the snapshot that succeeds this one.
     */
    public ModuleSnapshot next(CompiledModule candidate) {
        return new ModuleSnapshot(module, candidate, TypeSourceIndex.of(candidate), cycle + 1);
    }
}
