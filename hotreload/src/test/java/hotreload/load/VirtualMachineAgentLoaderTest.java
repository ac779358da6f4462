package hotreload.load;

import hotreload.exceptions.HotReloadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VirtualMachineAgentLoader")
class VirtualMachineAgentLoaderTest {

    private final VirtualMachineAgentLoader loader = new VirtualMachineAgentLoader();

    @Nested
    @DisplayName("load")
    class Load {

        @Test
        @DisplayName("rejects a blank pid")
        void blankPid() {
            assertThatThrownBy(() -> loader.load(" ", "agent.jar"))
                    .isInstanceOf(HotReloadException.class)
                    .hasMessageContaining("PID");
        }

        @Test
        @DisplayName("rejects a missing jar path")
        void missingJarPath() {
            assertThatThrownBy(() -> loader.load("1", null))
                    .isInstanceOf(HotReloadException.class)
                    .hasMessageContaining("JAR");
        }
    }

    @Nested
    @DisplayName("attachSelf")
    class AttachSelf {

        @Test
        @DisplayName("reports a jar that does not exist as a failure")
        void missingJar(@TempDir Path dir) {
            LoaderResult result = loader.attachSelf(dir.resolve("absent.jar"));

            assertThat(result.isSelf()).isTrue();
            if (HotReloadAgent.instrumentation().isEmpty()) {
                assertThat(result.success()).isFalse();
                assertThat(result.message()).isNotBlank();
                assertThat(result.instrumentation()).isEmpty();
            }
        }
    }

    @Test
    @DisplayName("a result for another process carries no instrumentation")
    void otherProcess() {
        LoaderResult result = LoaderResult.success("-1", "agent.jar");

        assertThat(result.isSelf()).isFalse();
        assertThat(result.instrumentation()).isEmpty();
        assertThat(result.message()).contains("-1");
    }
}
