package hotreload.engine;

import hotreload.alert.ReloadAlertLogger;
import hotreload.compile.JavacModuleCompiler;
import hotreload.compile.ModuleCompiler;
import hotreload.config.HotReloadConfig;
import hotreload.config.HotReloadConfigLoader;
import hotreload.diff.CallGraphIndex;
import hotreload.diff.DiffEngine;
import hotreload.diff.ModuleDiff;
import hotreload.exceptions.HookException;
import hotreload.exceptions.HotReloadException;
import hotreload.exceptions.ReloadTimeoutException;
import hotreload.hook.ClassBytesLocator;
import hotreload.hook.ClassLocator;
import hotreload.hook.HookApplier;
import hotreload.hook.HookRecord;
import hotreload.hook.HookRecordSnapshot;
import hotreload.hook.HookRecordStore;
import hotreload.hook.HookReport;
import hotreload.hook.HookResult;
import hotreload.hook.InstrumentationRedirector;
import hotreload.hook.LookupPatchLoader;
import hotreload.load.HotReloadAgent;
import hotreload.load.LoaderResult;
import hotreload.load.VirtualMachineAgentLoader;
import hotreload.metrics.ReloadMetrics;
import hotreload.metrics.ReloadMetrics.Phase;
import hotreload.metrics.ReloadMetricsCollector;
import hotreload.module.CompiledModule;
import hotreload.module.ModuleContext;
import hotreload.phase.NoopPhaseListener;
import hotreload.phase.ReloadContext;
import hotreload.phase.ReloadPhaseListener;
import hotreload.snapshot.ModuleSnapshot;
import hotreload.snapshot.SnapshotStore;
import hotreload.state.ReloadState;
import hotreload.synth.PatchArchive;
import hotreload.synth.PatchLedger;
import hotreload.synth.PatchModule;
import hotreload.synth.PatchNaming;
import hotreload.synth.PatchSynthesizer;
import hotreload.synth.PatchWriter;
import hotreload.synth.SynthesisFailure;
import hotreload.synth.WrapperKind;
import hotreload.synth.WrapperRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.instrument.Instrumentation;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Hot reload engine: compiles edited modules, diffs them against what the
 * live process runs, synthesizes patch modules and hooks them in.
 *
 * <p>Cycles of one module are serialized; different modules may proceed
 * concurrently. {@link #reload} queues a full cycle on the module's own
 * worker thread.
 *
 * <h2>Example:</h2>
 * <pre>
 * HotReloadEngine engine = HotReloadEngine.builder()
 *     .instrumentation(inst)
 *     .build();
 * engine.initialize(List.of(appModule), List.of());
 * engine.reload("app", List.of(changedFile)).join();
 * </pre>
 */
public final class HotReloadEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HotReloadEngine.class);

    private static final Pattern SEQUENCE = Pattern.compile("-patch-(\\d+)\\.jar$");

    private final HotReloadConfig config;
    private final ModuleCompiler compiler;
    private final HookApplier hookApplier;
    private final ReloadPhaseListener phaseListener;
    private final SnapshotStore snapshots = new SnapshotStore();
    private final DiffEngine diffEngine;
    private final PatchSynthesizer synthesizer;
    private final PatchWriter patchWriter = new PatchWriter();

    private final Map<String, ModuleContext> modules = new ConcurrentHashMap<>();
    private final Map<String, CallGraphIndex> callGraphs = new ConcurrentHashMap<>();
    private final Map<String, PatchLedger> ledgers = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final Map<String, ExecutorService> workers = new ConcurrentHashMap<>();

    private volatile List<String> compilerOptions = List.of();
    private volatile Path workRoot;
    private volatile HookRecordStore recordStore;

    private HotReloadEngine(Builder b) {
        this.config = b.config != null ? b.config : HotReloadConfigLoader.loadOrDefaults();
        this.compiler = b.compiler != null ? b.compiler : new JavacModuleCompiler();
        this.phaseListener = b.phaseListener != null ? b.phaseListener : NoopPhaseListener.INSTANCE;
        this.diffEngine = new DiffEngine(config.cascadeGenerics());
        ClassLoader referenceLoader = b.referenceLoader != null ? b.referenceLoader : HotReloadEngine.class.getClassLoader();
        this.synthesizer = new PatchSynthesizer(referenceLoader);
        this.hookApplier = b.hookApplier != null ? b.hookApplier : defaultApplier(b);

        ReloadState.getInstance().setMaxHistorySize(config.historySize());
        ReloadAlertLogger.setAlertLevel(config.alertLevel());
        log.debug("Engine created with {}", config);
    }

    private static HookApplier defaultApplier(Builder b) {
        Instrumentation inst = b.instrumentation != null ? b.instrumentation : HotReloadAgent.instrumentation().orElse(null);
        if (inst == null && b.agentJar != null) {
            LoaderResult attached = b.agentLoader.attachSelf(b.agentJar);
            if (!attached.success()) {
                log.warn("Could not attach the reload agent: {}", attached.message());
            }
            inst = attached.instrumentation().orElse(null);
        }
        if (inst == null) {
            log.info("No instrumentation available; patches can be synthesized but not applied");
            return null;
        }
        ClassBytesLocator classBytes = new ClassBytesLocator();
        ClassLocator locator = b.classLocator != null ? b.classLocator : ClassLocator.forInstrumentation(inst);
        return new HookApplier(new InstrumentationRedirector(inst, classBytes),
                new LookupPatchLoader(locator, classBytes, inst), locator);
    }

    public static Builder builder() {
        return new Builder();
    }

    public HotReloadConfig config() {
        return config;
    }

    /**
     * Establishes the snapshot, call graph and baseline of every module the
     * live process has loaded.
     *
     * <p>When hook records persisted by an earlier process exist, the
     * snapshot is compiled from the current sources (the persisted hooks
     * carry the edits made since the output was built) and the records are
     * returned for {@link #applyHooks(HookRecordSnapshot)}.
     *
     * @param contexts modules of the live process
     * @param compilerOptions options applied to every compilation
     */
    public InitializeResult initialize(List<ModuleContext> contexts, List<String> compilerOptions) {
        Objects.requireNonNull(contexts, "contexts");
        this.compilerOptions = compilerOptions != null ? List.copyOf(compilerOptions) : List.of();
        this.workRoot = config.workDir().resolve(projectHash(contexts));
        this.recordStore = new HookRecordStore(workRoot);

        HookRecordSnapshot persisted = null;
        if (config.persistHooks()) {
            try {
                persisted = recordStore.load();
            } catch (IOException e) {
                log.warn("Ignoring unreadable hook records {}: {}", recordStore.file(), e.getMessage());
            }
        }
        boolean restore = persisted != null && !persisted.isEmpty();

        List<String> initialized = new ArrayList<>();
        for (ModuleContext context : contexts) {
            ReentrantLock lock = snapshots.lockFor(context.name());
            lock.lock();
            try {
                CompiledModule baseline = CompiledModule.fromPath(context.name(), context.outputPath());
                List<HookRecord> records = restore ? persisted.forModule(context.name()) : List.of();
                baseline = withRestoredTypes(baseline, records);
                CompiledModule initial = records.isEmpty() ? baseline : compiler.compile(context, this.compilerOptions);

                modules.put(context.name(), context);
                snapshots.initialize(baseline, initial);
                CallGraphIndex callGraph = callGraphs.computeIfAbsent(context.name(), k -> new CallGraphIndex());
                callGraph.index(initial);
                PatchLedger ledger = ledgers.computeIfAbsent(context.name(), k -> new PatchLedger());
                for (HookRecord record : records) {
                    if (record.kind() == WrapperKind.ADDED) ledger.record(record.method(), record.current());
                }
                sequences.put(context.name(), new AtomicLong(lastSequence(context.name())));
                initialized.add(context.name());
                log.info("Initialized module {} ({} classes)", context.name(), baseline.classNames().size());
            } catch (IOException | HotReloadException e) {
                log.error("Failed to initialize module {}", context.name(), e);
                return InitializeResult.failure("Failed to initialize " + context.name() + ": " + e.getMessage(),
                        initialized);
            } finally {
                lock.unlock();
            }
        }
        return InitializeResult.success(initialized, restore ? persisted : null);
    }

    /**
     * New types defined by persisted patches are loaded again with them, so
     * they belong to the baseline.
     */
    private static CompiledModule withRestoredTypes(CompiledModule baseline, List<HookRecord> records)
            throws IOException {
        Set<Path> jars = new LinkedHashSet<>();
        for (HookRecord record : records) {
            for (WrapperRef ref : record.wrappers()) jars.add(ref.patchJar());
        }
        CompiledModule result = baseline;
        for (Path jar : jars) {
            if (!Files.isRegularFile(jar)) {
                log.warn("Persisted patch {} is missing", jar);
                continue;
            }
            PatchModule patch = PatchArchive.read(jar).toPatchModule();
            if (!patch.newTypeClasses().isEmpty()) {
                result = result.withClasses(patch.newTypeClasses());
            }
        }
        return result;
    }

    /**
     * Compiles the module and diffs it against its snapshot.
     *
     * @return the diff, or null when no declared member changed
     * @throws hotreload.exceptions.CompileException on compiler errors; the snapshot is untouched
     */
    public ModuleDiff compileAndDiff(String module, Collection<Path> changedFiles) throws HotReloadException {
        ModuleContext context = requireModule(module);
        ReentrantLock lock = snapshots.lockFor(module);
        lock.lock();
        try {
            CompiledModule candidate = callWithTimeout("compile", config.compileTimeout(),
                    () -> compiler.compile(context, compilerOptions));
            return diff(module, candidate, changedFiles);
        } finally {
            lock.unlock();
        }
    }

    private ModuleDiff diff(String module, CompiledModule candidate, Collection<Path> changedFiles) {
        ModuleSnapshot previous = snapshots.current(module).orElseThrow();
        CompiledModule baseline = snapshots.baseline(module).orElseThrow();
        ModuleDiff diff = diffEngine.diff(previous, baseline, candidate, changedFiles, callGraphs.get(module));
        if (diff.isEmpty()) {
            snapshots.replace(module, candidate);
            return null;
        }
        return diff;
    }

    /**
     * Synthesizes the patch module of a diff and writes it under the work
     * directory.
     *
     * <p>Wrappers of added methods go to the module's ledger and new types
     * join the baseline. The snapshot advances only when every member was
     * synthesized, so failed members are diffed again next cycle. Types whose
     * members then fail to hook are held back by {@link #applyHooks(PatchResult)}.
     */
    public PatchResult synthesizeAndWritePatch(String module, ModuleDiff diff) throws HotReloadException {
        requireModule(module);
        Objects.requireNonNull(diff, "diff");
        ReentrantLock lock = snapshots.lockFor(module);
        lock.lock();
        try {
            long sequence = sequences.get(module).incrementAndGet();
            Path jar = patchDir(module).resolve(PatchNaming.jarFileName(module, sequence));
            PatchNaming naming = new PatchNaming(module, sequence, jar);
            CompiledModule baseline = snapshots.baseline(module).orElseThrow();
            PatchLedger ledger = ledgers.get(module);

            PatchModule patch = callWithTimeout("synthesize", config.synthesizeTimeout(),
                    () -> synthesizer.synthesize(diff, baseline, ledger, naming));
            for (SynthesisFailure failure : patch.failures()) {
                ReloadAlertLogger.synthesisFailed(failure.target(), failure.reason());
            }

            Path written = null;
            if (!patch.isEmpty()) {
                try {
                    written = patchWriter.write(patch);
                } catch (IOException e) {
                    throw new HotReloadException("Cannot write patch " + jar + ": " + e.getMessage(),
                            module, null, null, "synthesize", e);
                }
                ledger.recordAll(patch);
                snapshots.promoteToBaseline(module, patch.newTypeClasses());
            }
            if (!patch.hasFailures()) {
                snapshots.replace(module, diff.candidate());
            }
            log.info("Synthesized {} member(s) of {} into {} ({} failure(s))", patch.methods().size(), module,
                    written != null ? written.getFileName() : "nothing", patch.failures().size());
            return new PatchResult(module, written, patch);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Loads a written patch into the live process and hooks its wrappers.
     * Types with a member that failed to hook go back to their earlier
     * version in the snapshot, so the next cycle touching their source
     * diffs those members again.
     *
     * @throws HookException when no hook applier is available or the patch cannot be loaded
     */
    public HookReport applyHooks(PatchResult result) throws HotReloadException {
        HookApplier applier = requireApplier();
        if (!result.isWritten()) {
            return new HookReport(result.module(), List.of());
        }
        ReloadContext ctx = new ReloadContext(result.module(), 0, result.patchPath());
        phaseListener.onBeforeApply(ctx);
        HookReport report;
        try {
            report = callWithTimeout("apply", config.applyTimeout(), () -> applier.apply(result.patch()));
        } finally {
            phaseListener.onAfterApply(ctx);
        }
        if (!report.success() && !result.patch().hasFailures()) {
            holdBackUnhooked(result.module(), report);
        }
        persistRecords();
        return report;
    }

    // the snapshot advanced at synthesis; types with an unhooked member go back
    private void holdBackUnhooked(String module, HookReport report) {
        Set<String> types = new TreeSet<>();
        for (HookResult failure : report.failures()) {
            types.add(failure.method().owner());
        }
        ReentrantLock lock = snapshots.lockFor(module);
        lock.lock();
        try {
            Set<String> held = snapshots.holdBack(module, types);
            if (!held.isEmpty()) {
                log.info("Members of {} that failed to hook are diffed again next cycle", held);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-hooks records persisted by an earlier process.
     */
    public HookReport applyHooks(HookRecordSnapshot records) throws HotReloadException {
        HookApplier applier = requireApplier();
        ReloadContext ctx = new ReloadContext("*", 0, null);
        phaseListener.onBeforeApply(ctx);
        HookReport report;
        try {
            report = callWithTimeout("apply", config.applyTimeout(), () -> applier.apply(records));
        } finally {
            phaseListener.onAfterApply(ctx);
        }
        persistRecords();
        return report;
    }

    /**
     * Queues a full cycle on the module's worker thread. Cycles of the same
     * module run one after another.
     */
    public CompletableFuture<ReloadOutcome> reload(String module, Collection<Path> changedFiles) {
        List<Path> files = List.copyOf(changedFiles);
        ExecutorService worker = workers.computeIfAbsent(module, m -> Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "hotreload-" + m);
            t.setDaemon(true);
            return t;
        }));
        return CompletableFuture.supplyAsync(() -> {
            try {
                return reloadNow(module, files);
            } catch (HotReloadException e) {
                throw new CompletionException(e);
            }
        }, worker);
    }

    /**
     * Runs a full cycle on the calling thread.
     */
    public ReloadOutcome reloadNow(String module, Collection<Path> changedFiles) throws HotReloadException {
        ModuleContext context = requireModule(module);
        long reloadId = ReloadState.getInstance().reloadStarted();
        ReloadAlertLogger.reloadStarted(reloadId, module);
        ReloadMetricsCollector metrics = new ReloadMetricsCollector().start(reloadId, module);
        Phase[] current = {Phase.COMPILE};

        ReentrantLock lock = snapshots.lockFor(module);
        lock.lock();
        try {
            CompiledModule candidate = metrics.timed(Phase.COMPILE, () -> {
                return callWithTimeout("compile", config.compileTimeout(),
                        () -> compiler.compile(context, compilerOptions));
            });
            logPhase(reloadId, metrics, Phase.COMPILE);

            current[0] = Phase.DIFF;
            ModuleDiff diff = metrics.timed(Phase.DIFF, () -> {
                return diff(module, candidate, changedFiles);
            });
            logPhase(reloadId, metrics, Phase.DIFF);
            if (diff == null) {
                ReloadAlertLogger.nothingToPatch(reloadId, module);
                ReloadMetrics result = metrics.finish();
                ReloadState.getInstance().reloadCompleted(reloadId, module, result);
                return new ReloadOutcome(module, reloadId, ReloadOutcome.Status.NOTHING_TO_PATCH, null, null, result);
            }
            metrics.typesChanged(diff.types().size());

            current[0] = Phase.SYNTHESIZE;
            PatchResult patch = metrics.timed(Phase.SYNTHESIZE, () -> {
                return synthesizeAndWritePatch(module, diff);
            });
            logPhase(reloadId, metrics, Phase.SYNTHESIZE);
            metrics.membersSynthesized(patch.methods().size()).synthesisFailures(patch.failures().size());

            HookReport hooks = null;
            if (hookApplier != null && patch.isWritten()) {
                current[0] = Phase.APPLY;
                hooks = metrics.timed(Phase.APPLY, () -> {
                    return applyHooks(patch);
                });
                logPhase(reloadId, metrics, Phase.APPLY);
                metrics.hooks(hooks.appliedCount(), hooks.failures().size());
            }

            ReloadMetrics result = metrics.finish();
            ReloadState.getInstance().reloadCompleted(reloadId, module, result);
            ReloadAlertLogger.reloadCompleted(reloadId, result);
            boolean complete = patch.failures().isEmpty() && (hooks == null || hooks.success());
            return new ReloadOutcome(module, reloadId,
                    complete ? ReloadOutcome.Status.APPLIED : ReloadOutcome.Status.PARTIAL, patch, hooks, result);
        } catch (ReloadTimeoutException e) {
            ReloadAlertLogger.reloadTimeout(reloadId, e.getTimeout().toMillis(), current[0]);
            ReloadState.getInstance().reloadFailed(reloadId, module, e, metrics.finish());
            throw new HotReloadException(e.getMessage(), module, null, null, current[0].name().toLowerCase(), e);
        } catch (HotReloadException | RuntimeException e) {
            ReloadAlertLogger.reloadFailed(reloadId, module, e, current[0]);
            ReloadState.getInstance().reloadFailed(reloadId, module, e, metrics.finish());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private static void logPhase(long reloadId, ReloadMetricsCollector metrics, Phase phase) {
        ReloadAlertLogger.phaseCompleted(reloadId, phase, metrics.phaseDuration(phase));
    }

    /**
     * Drops the snapshot, call graph, ledger and hook records of a module.
     * Hooks already applied stay live.
     */
    public void clear(String module) {
        ReentrantLock lock = snapshots.lockFor(module);
        lock.lock();
        try {
            snapshots.clear(module);
            CallGraphIndex callGraph = callGraphs.remove(module);
            if (callGraph != null) callGraph.clear();
            ledgers.remove(module);
            sequences.remove(module);
            modules.remove(module);
            if (hookApplier != null) hookApplier.clear(module);
            log.info("Cleared module {}", module);
        } finally {
            lock.unlock();
        }
        ExecutorService worker = workers.remove(module);
        if (worker != null) worker.shutdown();
    }

    @Override
    public void close() {
        for (String module : Set.copyOf(modules.keySet())) {
            clear(module);
        }
        snapshots.clearAll();
        workers.values().forEach(ExecutorService::shutdown);
        workers.clear();
    }

    public Set<String> modules() {
        return Set.copyOf(modules.keySet());
    }

    public Path workRoot() {
        return workRoot;
    }

    public Path patchDir(String module) {
        return requireWorkRoot().resolve("patches").resolve(module);
    }

    public SnapshotStore snapshots() {
        return snapshots;
    }

    public PatchLedger ledger(String module) {
        return ledgers.get(module);
    }

    public CallGraphIndex callGraph(String module) {
        return callGraphs.get(module);
    }

    public HookApplier hookApplier() {
        return hookApplier;
    }

    private void persistRecords() {
        if (!config.persistHooks() || recordStore == null) return;
        try {
            recordStore.save(hookApplier.snapshot());
        } catch (IOException e) {
            log.warn("Failed to persist hook records to {}: {}", recordStore.file(), e.getMessage());
        }
    }

    private long lastSequence(String module) throws IOException {
        Path dir = patchDir(module);
        if (!Files.isDirectory(dir)) return 0;
        long max = 0;
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Matcher m = SEQUENCE.matcher(file.getFileName().toString());
                if (m.find()) max = Math.max(max, Long.parseLong(m.group(1)));
            }
        }
        return max;
    }

    private ModuleContext requireModule(String module) throws HotReloadException {
        ModuleContext context = modules.get(module);
        if (context == null) {
            throw new HotReloadException("Module not initialized: " + module, module, null, null, null, null);
        }
        return context;
    }

    private HookApplier requireApplier() throws HookException {
        if (hookApplier == null) {
            throw new HookException("No hook applier: the engine runs without instrumentation");
        }
        return hookApplier;
    }

    private Path requireWorkRoot() {
        if (workRoot == null) {
            throw new IllegalStateException("Engine not initialized");
        }
        return workRoot;
    }

    /**
     * Names the work directory after the modules' output paths, so distinct
     * projects never share patches or hook records.
     */
    static String projectHash(List<ModuleContext> contexts) {
        StringBuilder key = new StringBuilder();
        contexts.stream()
                .map(c -> c.name() + "=" + c.outputPath().toAbsolutePath().normalize())
                .sorted()
                .forEach(s -> key.append(s).append('\n'));
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 6);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static <T> T callWithTimeout(String operation, Duration timeout,
                                         Callable<T> action) throws HotReloadException {
        try {
            return TimeoutExecutor.executeWithTimeout(operation, timeout, action);
        } catch (HotReloadException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new HotReloadException("Operation '" + operation + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Builder for {@link HotReloadEngine}.
     */
    public static final class Builder {
        private HotReloadConfig config;
        private ModuleCompiler compiler;
        private Instrumentation instrumentation;
        private ClassLocator classLocator;
        private HookApplier hookApplier;
        private ReloadPhaseListener phaseListener;
        private ClassLoader referenceLoader;
        private Path agentJar;
        private VirtualMachineAgentLoader agentLoader = new VirtualMachineAgentLoader();

        private Builder() {}

        /** Configuration; defaults to the one found on the classpath. */
        public Builder config(HotReloadConfig config) {
            this.config = config;
            return this;
        }

        public Builder compiler(ModuleCompiler compiler) {
            this.compiler = compiler;
            return this;
        }

        /** Instrumentation for the default hook applier; defaults to the agent's. */
        public Builder instrumentation(Instrumentation instrumentation) {
            this.instrumentation = instrumentation;
            return this;
        }

        /**
         * Agent jar to attach to this process when no instrumentation was
         * given and the agent was not loaded at startup.
         */
        public Builder agentJar(Path agentJar) {
            this.agentJar = agentJar;
            return this;
        }

        Builder agentLoader(VirtualMachineAgentLoader agentLoader) {
            this.agentLoader = agentLoader;
            return this;
        }

        /** How the default hook applier finds loaded classes. */
        public Builder classLocator(ClassLocator classLocator) {
            this.classLocator = classLocator;
            return this;
        }

        public Builder hookApplier(HookApplier hookApplier) {
            this.hookApplier = hookApplier;
            return this;
        }

        public Builder phaseListener(ReloadPhaseListener phaseListener) {
            this.phaseListener = phaseListener;
            return this;
        }

        /** Loader whose resources describe library classes the modules reference. */
        public Builder referenceLoader(ClassLoader referenceLoader) {
            this.referenceLoader = referenceLoader;
            return this;
        }

        public HotReloadEngine build() {
            return new HotReloadEngine(this);
        }
    }
}
