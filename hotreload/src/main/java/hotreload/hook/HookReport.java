package hotreload.hook;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Results of one hook batch. A batch is never rolled back: applied methods
 * stay hooked when others fail.
 */
public final class HookReport {

    private final String module;
    private final List<HookResult> results;

    public HookReport(String module, List<HookResult> results) {
        this.module = module;
        this.results = List.copyOf(results);
    }

    public String module() {
        return module;
    }

    public List<HookResult> results() {
        return results;
    }

    public boolean success() {
        return results.stream().allMatch(HookResult::isApplied);
    }

    public int appliedCount() {
        return (int) results.stream().filter(HookResult::isApplied).count();
    }

    public List<HookResult> failures() {
        return results.stream().filter(r -> !r.isApplied()).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "HookReport{module=" + module + ", applied=" + appliedCount() + ", failed=" + failures().size() + "}";
    }
}
