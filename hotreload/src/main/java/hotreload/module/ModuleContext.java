package hotreload.module;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * What the engine knows about one compilation unit of the host process.
 *
 * @param name module name, unique within a project
 * @param sourceFiles every source file of the module
 * @param references classpath entries the module compiles against
 * @param outputPath directory or jar holding the classes the live process loaded
 * @param compilerOptions extra front-end compiler options for this module
 */
public record ModuleContext(
        String name,
        List<Path> sourceFiles,
        List<Path> references,
        Path outputPath,
        List<String> compilerOptions
) {
    public ModuleContext {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(outputPath, "outputPath");
        sourceFiles = List.copyOf(sourceFiles);
        references = references != null ? List.copyOf(references) : List.of();
        compilerOptions = compilerOptions != null ? List.copyOf(compilerOptions) : List.of();
    }

    public ModuleContext(String name, List<Path> sourceFiles, List<Path> references, Path outputPath) {
        this(name, sourceFiles, references, outputPath, List.of());
    }
}
