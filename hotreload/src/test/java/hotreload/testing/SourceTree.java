package hotreload.testing;

import hotreload.compile.JavacModuleCompiler;
import hotreload.exceptions.CompileException;
import hotreload.module.CompiledModule;
import hotreload.module.ModuleContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * A throwaway module on disk: sources under {@code src}, the classes the
 * "live process" loads under {@code out}.
 */
public final class SourceTree {

    private final String module;
    private final Path src;
    private final Path out;

    public SourceTree(Path root, String module) {
        this.module = module;
        this.src = root.resolve("src");
        this.out = root.resolve("out");
    }

    /** Writes (or overwrites) a source file and returns its path. */
    public Path write(String relativePath, String code) {
        try {
            Path file = src.resolve(relativePath);
            Files.createDirectories(file.getParent());
            Files.writeString(file, code);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ModuleContext context() {
        try (Stream<Path> files = Files.walk(src)) {
            List<Path> sources = new ArrayList<>(files.filter(p -> p.toString().endsWith(".java")).sorted().toList());
            return new ModuleContext(module, sources, List.of(), out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public CompiledModule compile() throws CompileException {
        return new JavacModuleCompiler().compile(context(), List.of());
    }

    /** Compiles the current sources into the output directory. */
    public CompiledModule build() throws CompileException, IOException {
        CompiledModule compiled = compile();
        compiled.writeTo(out);
        return compiled;
    }

    /** A fresh loader over the output directory, parented to the test's loader. */
    public URLClassLoader newLoader() {
        try {
            return new URLClassLoader(new URL[]{out.toUri().toURL()}, SourceTree.class.getClassLoader());
        } catch (MalformedURLException e) {
            throw new IllegalStateException(e);
        }
    }

    public String module() {
        return module;
    }

    public Path out() {
        return out;
    }
}
