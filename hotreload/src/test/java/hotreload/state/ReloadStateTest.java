package hotreload.state;

import hotreload.metrics.ReloadMetrics;
import hotreload.metrics.ReloadMetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReloadState")
class ReloadStateTest {

    private final ReloadState state = ReloadState.getInstance();

    @BeforeEach
    void setUp() {
        state.reset();
        state.setMaxHistorySize(10);
    }

    @AfterEach
    void tearDown() {
        state.reset();
    }

    private static ReloadMetrics metrics(long id) {
        return new ReloadMetricsCollector().start(id, "app").finish();
    }

    @Test
    @DisplayName("starts idle")
    void startsIdle() {
        assertThat(state.getStatus()).isEqualTo(ReloadState.Status.IDLE);
        assertThat(state.getHistory()).isEmpty();
    }

    @Test
    @DisplayName("is in progress while any cycle runs")
    void inProgressWhileRunning() {
        long first = state.reloadStarted();
        long second = state.reloadStarted();
        assertThat(second).isGreaterThan(first);

        state.reloadCompleted(first, "app", metrics(first));
        assertThat(state.getStatus()).isEqualTo(ReloadState.Status.IN_PROGRESS);

        state.reloadCompleted(second, "app", metrics(second));
        assertThat(state.getStatus()).isEqualTo(ReloadState.Status.SUCCESS);
    }

    @Test
    @DisplayName("records failures with their message")
    void recordsFailure() {
        long id = state.reloadStarted();

        state.reloadFailed(id, "app", new IllegalStateException("compile broke"), null);

        assertThat(state.getStatus()).isEqualTo(ReloadState.Status.FAILED);
        assertThat(state.getLastError()).isEqualTo("compile broke");
        ReloadHistoryEntry entry = state.getHistory().get(0);
        assertThat(entry.reloadId()).isEqualTo(id);
        assertThat(entry.status()).isEqualTo(ReloadState.Status.FAILED);
        assertThat(entry.errorMessage()).isEqualTo("compile broke");
    }

    @Test
    @DisplayName("keeps the most recent entries first, bounded by history size")
    void boundedHistory() {
        state.setMaxHistorySize(3);
        for (int i = 0; i < 5; i++) {
            long id = state.reloadStarted();
            state.reloadCompleted(id, "m" + i, metrics(id));
        }

        assertThat(state.getHistory()).hasSize(3);
        assertThat(state.getHistory().get(0).module()).isEqualTo("m4");
        assertThat(state.getHistory().get(2).module()).isEqualTo("m2");
    }

    @Test
    @DisplayName("shrinking history drops the oldest entries")
    void shrinkHistory() {
        for (int i = 0; i < 4; i++) {
            long id = state.reloadStarted();
            state.reloadCompleted(id, "m" + i, metrics(id));
        }

        state.setMaxHistorySize(1);

        assertThat(state.getHistory()).extracting(ReloadHistoryEntry::module).containsExactly("m3");
    }

    @Test
    @DisplayName("rejects a non-positive history size")
    void rejectsNonPositiveHistorySize() {
        assertThatThrownBy(() -> state.setMaxHistorySize(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("exposes its state as a map")
    void toMap() {
        long id = state.reloadStarted();
        state.reloadCompleted(id, "app", metrics(id));

        assertThat(state.toMap())
                .containsEntry("status", "SUCCESS")
                .containsKey("lastReload");
    }
}
