package partitions.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads partitions configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code partitions.properties} on the classpath</li>
 *   <li>{@code partitions.yml} on the classpath</li>
 * </ol>
 * When neither exists, {@link PartitionsConfig#DEFAULTS} is used.
 *
 * <p>System properties override file-based configuration
 * (e.g., {@code -Dpartitions.scheme.packages=com.example.schemes}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code partitions.scheme.packages} - comma-separated packages to scan for schemes</li>
 *   <li>{@code partitions.scheme.scan.enabled} - true or false</li>
 * </ul>
 *
 * @see PartitionsConfig
 */
public final class PartitionsConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PartitionsConfigLoader.class);

    static final String SCHEME_PACKAGES = "partitions.scheme.packages";
    static final String SCHEME_SCAN_ENABLED = "partitions.scheme.scan.enabled";

    private PartitionsConfigLoader() {}

    /**
     * Load from classpath (partitions.properties or partitions.yml), falling back to defaults.
     *
     * @return the loaded configuration
     * @throws PartitionsConfigException if a config file exists but cannot be read
     */
    public static PartitionsConfig load() {
        InputStream is = getResource("partitions.properties");
        if (is != null) {
            return withStream(is, "partitions.properties", false);
        }

        is = getResource("partitions.yml");
        if (is != null) {
            return withStream(is, "partitions.yml", true);
        }

        log.info("No partitions.properties or partitions.yml found, using defaults");
        return parse(new Properties());
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws PartitionsConfigException if the file cannot be parsed
     */
    public static PartitionsConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return PartitionsConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static PartitionsConfig withStream(InputStream is, String source, boolean yaml) {
        try (is) {
            return yaml ? loadYaml(is, source) : loadProperties(is, source);
        } catch (IOException e) {
            throw new PartitionsConfigException("Failed to close " + source, e);
        }
    }

    private static PartitionsConfig loadProperties(InputStream is, String source) {
        try {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new PartitionsConfigException("Failed to load " + source, e);
        }
    }

    private static PartitionsConfig loadYaml(InputStream is, String source) {
        Object root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new PartitionsConfigException("Failed to parse " + source, e);
        }
        Properties props = new Properties();
        if (root instanceof Map<?, ?> map) {
            flatten("", map, props);
        } else if (root != null) {
            throw new PartitionsConfigException(source + " must contain a mapping at the top level");
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    private static void flatten(String prefix, Map<?, ?> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map<?, ?> nested) {
                flatten(key, nested, props);
            } else if (val instanceof List<?> list) {
                props.setProperty(key, String.join(",", list.stream().map(String::valueOf).toList()));
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static PartitionsConfig parse(Properties props) {
        PartitionsConfig.Builder b = PartitionsConfig.builder();

        getString(props, SCHEME_PACKAGES).ifPresent(v -> {
            try {
                b.schemePackages(v);
            } catch (IllegalArgumentException e) {
                log.warn("Invalid scheme.packages: '{}'", v);
            }
        });

        getString(props, SCHEME_SCAN_ENABLED).ifPresent(v -> {
            if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false")) {
                b.schemeScanEnabled(Boolean.parseBoolean(v));
            } else {
                log.warn("Invalid scheme.scan.enabled: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }
}
