package hotreload.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HotReloadConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty("hotreload.alert.level");
    }

    @Test
    void loadFromPropertiesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                hotreload.work.dir=/var/tmp/patches
                hotreload.timeout.compile=60
                hotreload.timeout.synthesize=30
                hotreload.timeout.apply=5
                hotreload.cascade.generics=false
                hotreload.persist.hooks=false
                hotreload.history.size=25
                hotreload.alert.level=ERROR
                """);

        HotReloadConfig c = HotReloadConfigLoader.loadFromFile(f);

        assertEquals(Path.of("/var/tmp/patches"), c.workDir());
        assertEquals(Duration.ofSeconds(60), c.compileTimeout());
        assertEquals(Duration.ofSeconds(30), c.synthesizeTimeout());
        assertEquals(Duration.ofSeconds(5), c.applyTimeout());
        assertFalse(c.cascadeGenerics());
        assertFalse(c.persistHooks());
        assertEquals(25, c.historySize());
        assertEquals(AlertLevel.ERROR, c.alertLevel());
    }

    @Test
    void loadFromYamlFile() throws IOException {
        Path f = tempDir.resolve("test.yml");
        Files.writeString(f, """
                hotreload:
                  timeout:
                    compile: 90
                    synthesize: 45
                    apply: 10
                  cascade:
                    generics: true
                  history:
                    size: 30
                  alert:
                    level: DEBUG
                """);

        HotReloadConfig c = HotReloadConfigLoader.loadFromFile(f);

        assertEquals(Duration.ofSeconds(90), c.compileTimeout());
        assertEquals(Duration.ofSeconds(45), c.synthesizeTimeout());
        assertEquals(Duration.ofSeconds(10), c.applyTimeout());
        assertTrue(c.cascadeGenerics());
        assertTrue(c.persistHooks());
        assertEquals(30, c.historySize());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
    }

    @Test
    void emptyYamlGivesDefaults() throws IOException {
        Path f = tempDir.resolve("empty.yml");
        Files.writeString(f, "");

        HotReloadConfig c = HotReloadConfigLoader.loadFromFile(f);

        assertEquals(HotReloadConfig.DEFAULTS.historySize(), c.historySize());
        assertEquals(Duration.ZERO, c.compileTimeout());
    }

    @Test
    void caseInsensitiveEnums() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, "hotreload.alert.level=debug\n");

        HotReloadConfig c = HotReloadConfigLoader.loadFromFile(f);

        assertEquals(AlertLevel.DEBUG, c.alertLevel());
    }

    @Test
    void invalidValuesUseDefaults() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                hotreload.alert.level=INVALID
                hotreload.timeout.compile=not-a-number
                hotreload.cascade.generics=maybe
                hotreload.history.size=-3
                """);

        HotReloadConfig c = HotReloadConfigLoader.loadFromFile(f);

        assertEquals(AlertLevel.WARNING, c.alertLevel());
        assertEquals(Duration.ZERO, c.compileTimeout());
        assertTrue(c.cascadeGenerics());
        assertEquals(10, c.historySize());
    }

    @Test
    void systemPropertyOverridesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, "hotreload.alert.level=ERROR\n");
        System.setProperty("hotreload.alert.level", "DEBUG");

        HotReloadConfig c = HotReloadConfigLoader.loadFromFile(f);

        assertEquals(AlertLevel.DEBUG, c.alertLevel());
    }

    @Test
    void invalidYamlThrows() throws IOException {
        Path f = tempDir.resolve("broken.yml");
        Files.writeString(f, "hotreload: [unclosed\n");

        assertThrows(HotReloadConfigException.class, () -> HotReloadConfigLoader.loadFromFile(f));
    }

    @Test
    void nonexistentFileThrows() {
        Path f = tempDir.resolve("nonexistent.properties");
        assertThrows(IOException.class, () -> HotReloadConfigLoader.loadFromFile(f));
    }

    @Test
    void classpathDefaultsMatchBuiltInDefaults() {
        HotReloadConfig c = HotReloadConfigLoader.loadOrDefaults();

        assertEquals(HotReloadConfig.DEFAULTS.compileTimeout(), c.compileTimeout());
        assertEquals(HotReloadConfig.DEFAULTS.historySize(), c.historySize());
        assertEquals(HotReloadConfig.DEFAULTS.persistHooks(), c.persistHooks());
    }
}
