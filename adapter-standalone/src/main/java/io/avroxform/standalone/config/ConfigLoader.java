package io.avroxform.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.avroxform.core.spec.ConfigParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link StandaloneConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code avro-xform.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * The {@code transform} section is flattened into plugin properties: {@code schema-url} becomes
 * {@code schema_url}, the {@code columns} list becomes {@code value_N}/{@code type_N} pairs and
 * {@code column_number} is derived from the list length unless given. A {@code properties} block
 * is copied through verbatim first, so structured keys win over raw ones.
 *
 * <p>
 * Environment overlay: {@code XFORM_SCHEMA_URL}, {@code XFORM_SCHEMA_FILE}, {@code
 * XFORM_TIME_ZONE}, {@code XFORM_WORKERS}, {@code LOG_FORMAT}, {@code LOG_LEVEL}. An env var is
 * "set" if and only if it is defined AND its trimmed value is non-empty. Setting either schema
 * variable replaces the schema source from YAML.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "avro-xform.yaml";
    private static final String CONFIG_FLAG = "--config";
    private static final String DEFAULT_COLUMN_TYPE = "string";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link StandaloneConfig} from the given YAML file path, applying environment variable
     * overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the loaded configuration with defaults applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static StandaloneConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link StandaloneConfig} from the given YAML file path, applying environment variable
     * overrides from the supplied lookup function.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup; {@code null} means not defined
     * @return the loaded configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static StandaloneConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new ConfigLoadException("Configuration file is empty: " + configPath);
            }
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if (CONFIG_FLAG.equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    /**
     * Returns the payload file arguments: everything except {@code --config} and its value, in
     * order.
     */
    public static List<Path> resolvePayloadPaths(String[] args) {
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if (CONFIG_FLAG.equals(args[i])) {
                i++;
                continue;
            }
            paths.add(Path.of(args[i]));
        }
        return paths;
    }

    private static StandaloneConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        StandaloneConfig.Builder builder = StandaloneConfig.builder();

        // --- YAML mapping ---

        // Raw properties pass through first
        JsonNode raw = root.path("properties");
        if (!raw.isMissingNode() && !raw.isNull()) {
            if (!raw.isObject()) {
                throw new ConfigLoadException("'properties' must be a mapping of key to scalar value");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isValueNode()) {
                    throw new ConfigLoadException("'properties." + field.getKey() + "' must be a scalar value");
                }
                builder.property(field.getKey(), field.getValue().asText());
            }
        }

        // Transform section
        JsonNode transform = root.path("transform");
        text(transform, "name", value -> builder.property(ConfigParser.NAME, value));
        text(transform, "schema-file", value -> builder.property(ConfigParser.SCHEMA_FILE, value));
        text(transform, "schema-url", value -> builder.property(ConfigParser.SCHEMA_URL, value));
        text(transform, "dynamic-csv", value -> builder.property(ConfigParser.DYNAMIC_CSV, value));
        text(transform, "time-zone", value -> builder.property(ConfigParser.TIME_ZONE, value));
        text(transform, "registry-connect-timeout-ms",
                value -> builder.property(ConfigParser.REGISTRY_CONNECT_TIMEOUT_MS, value));
        text(transform, "registry-timeout-ms", value -> builder.property(ConfigParser.REGISTRY_TIMEOUT_MS, value));
        mapColumns(transform, builder);

        // Runner section
        JsonNode runner = root.path("runner");
        if (runner.has("workers")) builder.workers(runner.get("workers").asInt());

        // Logging section
        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---
        applyEnvOverrides(builder, envLookup);

        return builder.build();
    }

    private static void mapColumns(JsonNode transform, StandaloneConfig.Builder builder) {
        JsonNode columns = transform.path("columns");
        if (columns.isMissingNode() || columns.isNull()) {
            text(transform, "column-number", value -> builder.property(ConfigParser.COLUMN_NUMBER, value));
            return;
        }
        if (!columns.isArray()) {
            throw new ConfigLoadException("'transform.columns' must be a list");
        }
        for (int i = 0; i < columns.size(); i++) {
            JsonNode column = columns.get(i);
            if (!column.hasNonNull("value")) {
                throw new ConfigLoadException("'transform.columns[" + i + "]' is missing 'value'");
            }
            int n = i + 1;
            builder.property(ConfigParser.VALUE_PREFIX + n, column.get("value").asText());
            builder.property(
                    ConfigParser.TYPE_PREFIX + n,
                    column.hasNonNull("type") ? column.get("type").asText() : DEFAULT_COLUMN_TYPE);
        }
        builder.property(
                ConfigParser.COLUMN_NUMBER,
                transform.hasNonNull("column-number")
                        ? transform.get("column-number").asText()
                        : Integer.toString(columns.size()));
    }

    /**
     * Applies environment variable overrides to the builder. An env var is "set" if {@code
     * envLookup.apply(name)} returns a non-null, non-empty (after trim) string.
     */
    private static void applyEnvOverrides(StandaloneConfig.Builder builder, Function<String, String> envLookup) {
        // --- Schema source (replaces the YAML one) ---
        envString(envLookup, "XFORM_SCHEMA_URL", value -> builder.removeProperty(ConfigParser.SCHEMA_FILE)
                .property(ConfigParser.SCHEMA_URL, value));
        envString(envLookup, "XFORM_SCHEMA_FILE", value -> builder.removeProperty(ConfigParser.SCHEMA_URL)
                .property(ConfigParser.SCHEMA_FILE, value));

        envString(envLookup, "XFORM_TIME_ZONE", value -> builder.property(ConfigParser.TIME_ZONE, value));
        envInt(envLookup, "XFORM_WORKERS", builder::workers);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    // --- YAML helpers ---

    private static void text(JsonNode node, String field, Consumer<String> setter) {
        if (node.hasNonNull(field)) {
            setter.accept(node.get(field).asText());
        }
    }
}
