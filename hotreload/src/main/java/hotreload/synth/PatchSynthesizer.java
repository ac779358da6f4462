package hotreload.synth;

import hotreload.diff.ModuleDiff;
import hotreload.module.CompiledModule;
import hotreload.module.MethodKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a module diff into a patch module.
 *
 * <p>A member that cannot be synthesized is reported and left out; members
 * whose code refers to it are left out in turn. Synthesis is repeated with
 * the failed members excluded until no new failure appears, so the
 * resulting patch never refers to anything it does not contain.
 *
 * <p>The output is a pure function of the diff, the baseline, the ledger
 * and the naming: the same inputs give byte-identical class files.
 */
public final class PatchSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(PatchSynthesizer.class);

    private final ClassLoader referenceLoader;

    /**
     * @param referenceLoader loader whose class file resources describe library types
     */
    public PatchSynthesizer(ClassLoader referenceLoader) {
        this.referenceLoader = referenceLoader;
    }

    public PatchModule synthesize(ModuleDiff diff, CompiledModule baseline, PatchLedger ledger, PatchNaming naming) {
        Set<MethodKey> excludedMethods = new TreeSet<>();
        Set<String> excludedTypes = new TreeSet<>();
        Map<String, SynthesisFailure> failures = new LinkedHashMap<>();
        int round = 0;
        while (true) {
            round++;
            SynthesisRun run = new SynthesisRun(diff, baseline, ledger, naming, referenceLoader,
                    Set.copyOf(excludedMethods), Set.copyOf(excludedTypes));
            PatchModule patch = run.execute();

            boolean excludedMore = false;
            for (SynthesisFailure failure : patch.failures()) {
                failures.putIfAbsent(failure.target(), failure);
                if (failure.member() != null) {
                    excludedMore |= excludedMethods.add(MethodKey.parse(failure.member()));
                } else if (diff.newTypes().contains(failure.typeName())) {
                    excludedMore |= excludedTypes.add(failure.typeName());
                }
            }
            if (!excludedMore) {
                log.debug("Synthesized {} after {} round(s): {} classes, {} methods, {} failures",
                        naming.jarPath().getFileName(), round, patch.classes().size(),
                        patch.methods().size(), failures.size());
                List<SynthesisFailure> all = new ArrayList<>(failures.values());
                return new PatchModule(naming, patch.classes(), patch.hosts(), patch.methods(), patch.newTypes(),
                        patch.initializers(), all, patch.requires());
            }
        }
    }
}
