package hotreload.compile;

import hotreload.exceptions.CompileException;
import hotreload.module.CompiledModule;
import hotreload.module.ModuleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * {@link ModuleCompiler} backed by the JDK's {@code javax.tools} compiler.
 * Class files are kept in memory; the module's output path on disk, which
 * the live process loaded from, is never overwritten.
 */
public final class JavacModuleCompiler implements ModuleCompiler {

    private static final Logger log = LoggerFactory.getLogger(JavacModuleCompiler.class);

    private final JavaCompiler compiler;

    public JavacModuleCompiler() {
        this(ToolProvider.getSystemJavaCompiler());
    }

    public JavacModuleCompiler(JavaCompiler compiler) {
        this.compiler = compiler;
    }

    @Override
    public CompiledModule compile(ModuleContext context, List<String> options) throws CompileException {
        if (compiler == null) {
            throw new CompileException(context.name(), "No system Java compiler available", null);
        }
        if (context.sourceFiles().isEmpty()) {
            log.debug("Module {} has no source files", context.name());
            return CompiledModule.fromBytes(context.name(), Map.of());
        }

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        StandardJavaFileManager standard =
                compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8);

        try (InMemoryClassOutput output = new InMemoryClassOutput(standard)) {
            Iterable<? extends JavaFileObject> units = standard.getJavaFileObjectsFromPaths(context.sourceFiles());

            List<String> args = new ArrayList<>(List.of("-g", "-proc:none", "-encoding", "UTF-8"));
            if (!context.references().isEmpty()) {
                args.add("-classpath");
                args.add(context.references().stream()
                        .map(Path::toString)
                        .collect(Collectors.joining(File.pathSeparator)));
            }
            args.addAll(options);
            args.addAll(context.compilerOptions());

            long start = System.nanoTime();
            Boolean ok = compiler.getTask(null, output, diagnostics, args, null, units).call();
            if (!Boolean.TRUE.equals(ok)) {
                List<String> errors = diagnostics.getDiagnostics().stream()
                        .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                        .map(JavacModuleCompiler::format)
                        .toList();
                log.debug("Compilation of {} failed with {} error(s)", context.name(), errors.size());
                throw new CompileException(context.name(), errors);
            }
            log.debug("Compiled {} ({} sources) in {} ms", context.name(), context.sourceFiles().size(),
                    (System.nanoTime() - start) / 1_000_000);
            return CompiledModule.fromBytes(context.name(), output.classFiles());
        } catch (IOException e) {
            throw new CompileException(context.name(), "Compiler I/O failure: " + e.getMessage(), e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new CompileException(context.name(), "Compiler rejected the module: " + e.getMessage(), e);
        }
    }

    private static String format(Diagnostic<? extends JavaFileObject> d) {
        String location = d.getSource() != null
                ? d.getSource().getName() + ":" + d.getLineNumber() + ": "
                : "";
        return location + d.getMessage(Locale.ROOT);
    }

    private static final class InMemoryClassOutput extends ForwardingJavaFileManager<StandardJavaFileManager> {

        private final Map<String, byte[]> classFiles = new TreeMap<>();

        InMemoryClassOutput(StandardJavaFileManager delegate) {
            super(delegate);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(Location location, String className,
                                                   JavaFileObject.Kind kind, FileObject sibling) throws IOException {
            if (kind != JavaFileObject.Kind.CLASS) {
                return super.getJavaFileForOutput(location, className, kind, sibling);
            }
            String internalName = className.replace('.', '/');
            return new SimpleJavaFileObject(URI.create("mem:///" + internalName + kind.extension), kind) {
                @Override
                public OutputStream openOutputStream() {
                    return new ByteArrayOutputStream() {
                        @Override
                        public void close() throws IOException {
                            super.close();
                            synchronized (classFiles) {
                                classFiles.put(internalName, toByteArray());
                            }
                        }
                    };
                }
            };
        }

        Map<String, byte[]> classFiles() {
            synchronized (classFiles) {
                return new TreeMap<>(classFiles);
            }
        }
    }
}
