package hotreload.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads reload configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code hotreload.properties} on the classpath</li>
 *   <li>{@code hotreload.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based configuration, using the same
 * keys (e.g., {@code -Dhotreload.alert.level=DEBUG}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code hotreload.work.dir} - root directory for patch modules and hook records</li>
 *   <li>{@code hotreload.timeout.compile} - timeout in seconds</li>
 *   <li>{@code hotreload.timeout.synthesize} - timeout in seconds</li>
 *   <li>{@code hotreload.timeout.apply} - timeout in seconds</li>
 *   <li>{@code hotreload.cascade.generics} - true or false</li>
 *   <li>{@code hotreload.persist.hooks} - true or false</li>
 *   <li>{@code hotreload.history.size} - number of history entries</li>
 *   <li>{@code hotreload.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 */
public final class HotReloadConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(HotReloadConfigLoader.class);

    private HotReloadConfigLoader() {}

    /**
     * Load from classpath (hotreload.properties or hotreload.yml).
     * @throws HotReloadConfigException if no config file found
     */
    public static HotReloadConfig load() {
        InputStream is = getResource("hotreload.properties");
        if (is != null) {
            return loadProperties(is, "hotreload.properties");
        }

        is = getResource("hotreload.yml");
        if (is != null) {
            return loadYaml(is, "hotreload.yml");
        }

        throw new HotReloadConfigException(
                "Config file required: hotreload.properties or hotreload.yml");
    }

    /**
     * Load from classpath, falling back to {@link HotReloadConfig#DEFAULTS}
     * (with system property overrides) when no file is present.
     */
    public static HotReloadConfig loadOrDefaults() {
        InputStream is = getResource("hotreload.properties");
        if (is != null) {
            return loadProperties(is, "hotreload.properties");
        }
        is = getResource("hotreload.yml");
        if (is != null) {
            return loadYaml(is, "hotreload.yml");
        }
        log.debug("No hotreload config file on classpath, using defaults");
        return parse(new Properties());
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws HotReloadConfigException if the configuration is invalid
     */
    public static HotReloadConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return HotReloadConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static HotReloadConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new HotReloadConfigException("Failed to load " + source, e);
        }
    }

    private static HotReloadConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException e) {
            throw new HotReloadConfigException("Failed to load " + source, e);
        } catch (RuntimeException e) {
            throw new HotReloadConfigException("Invalid YAML in " + source, e);
        }
        if (root == null) {
            return HotReloadConfig.DEFAULTS;
        }
        Properties props = new Properties();
        flatten("", root, props);
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static HotReloadConfig parse(Properties props) {
        HotReloadConfig.Builder b = HotReloadConfig.builder();

        getString(props, "hotreload.work.dir").ifPresent(v -> b.workDir(Path.of(v)));

        getLong(props, "hotreload.timeout.compile").ifPresent(b::compileTimeoutSeconds);
        getLong(props, "hotreload.timeout.synthesize").ifPresent(b::synthesizeTimeoutSeconds);
        getLong(props, "hotreload.timeout.apply").ifPresent(b::applyTimeoutSeconds);

        getBoolean(props, "hotreload.cascade.generics").ifPresent(b::cascadeGenerics);
        getBoolean(props, "hotreload.persist.hooks").ifPresent(b::persistHooks);

        getInt(props, "hotreload.history.size").ifPresent(v -> {
            if (v > 0) b.historySize(v);
        });

        getString(props, "hotreload.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null && !val.isBlank() ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Boolean> getBoolean(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false")) {
                return Optional.of(Boolean.parseBoolean(v));
            }
            log.warn("Invalid boolean for {}: {}", key, v);
            return Optional.empty();
        });
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
