package hotreload.compile;

import hotreload.exceptions.CompileException;
import hotreload.module.CompiledModule;
import hotreload.module.ModuleContext;

import java.util.List;

/**
 * The front-end compiler boundary: turns a module's current sources into a
 * candidate module. The engine never parses source text itself.
 */
public interface ModuleCompiler {

    /**
     * Compiles every source file of the module.
     *
     * @param context the module to compile
     * @param options project-wide options, applied before the module's own
     * @return the candidate module
     * @throws CompileException with diagnostic text if compilation fails
     */
    CompiledModule compile(ModuleContext context, List<String> options) throws CompileException;
}
