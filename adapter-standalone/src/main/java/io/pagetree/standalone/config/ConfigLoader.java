package io.pagetree.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link StandaloneConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * The file defaults to {@code page-tree.yaml} in the working directory; {@code --config <path>}
 * selects another one. When the default file does not exist the documented defaults are used, an
 * explicitly named file must exist.
 *
 * <p>
 * Every key can be overridden by an environment variable, which wins over the YAML value. A
 * variable is "set" only when it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "page-tree.yaml";

    private ConfigLoader() {
        // utility class
    }

    /** Loads the given file with overrides from {@link System#getenv}. */
    public static StandaloneConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the given file, applying overrides from {@code envLookup} (returning {@code null} for
     * undefined variables).
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds a bad value
     */
    public static StandaloneConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return mapToConfig(root, envLookup, configPath.toString());
    }

    /** Builds a configuration from defaults and environment variables alone. */
    public static StandaloneConfig defaults(Function<String, String> envLookup) {
        return mapToConfig(null, envLookup, "defaults");
    }

    /**
     * Resolves the configuration from CLI arguments: an explicit {@code --config} file, else
     * {@code page-tree.yaml} when it exists, else defaults.
     */
    public static StandaloneConfig resolve(String[] args, Function<String, String> envLookup) {
        Path explicit = explicitConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.exists(fallback) ? load(fallback, envLookup) : defaults(envLookup);
    }

    /**
     * Returns the path following {@code --config}, or {@code null} when the flag is absent.
     *
     * @throws IllegalArgumentException when the flag has no value
     */
    public static Path explicitConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    private static StandaloneConfig mapToConfig(JsonNode root, Function<String, String> envLookup, String source) {
        StandaloneConfig.Builder builder = StandaloneConfig.builder();
        try {
            if (root != null && !root.isMissingNode() && !root.isNull()) {
                applyYaml(root, builder);
            }
            applyEnvOverrides(builder, envLookup);
            return builder.build();
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw new ConfigLoadException("Invalid configuration (" + source + "): " + e.getMessage(), e);
        }
    }

    private static void applyYaml(JsonNode root, StandaloneConfig.Builder builder) {
        JsonNode builderSection = root.path("builder");
        if (builderSection.has("mode")) builder.builderMode(builderSection.get("mode").asText());

        JsonNode storage = root.path("storage");
        if (storage.has("dir")) builder.storageDir(storage.get("dir").asText());

        JsonNode cache = root.path("cache");
        if (cache.has("dir")) builder.cacheDir(cache.get("dir").asText());

        JsonNode validation = root.path("validation");
        if (validation.has("max-depth")) builder.maxDepth(intValue(validation, "max-depth"));
        if (validation.has("max-elements")) builder.maxElements(intValue(validation, "max-elements"));
        if (validation.has("canonical-check"))
            builder.canonicalCheck(validation.get("canonical-check").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.logFormat(logging.get("format").asText());
        if (logging.has("level")) builder.logLevel(logging.get("level").asText());
    }

    private static void applyEnvOverrides(StandaloneConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "BUILDER_MODE", builder::builderMode);
        envString(envLookup, "STORAGE_DIR", builder::storageDir);
        envString(envLookup, "CACHE_DIR", builder::cacheDir);
        envString(envLookup, "CANONICAL_CHECK", builder::canonicalCheck);
        envString(envLookup, "LOG_FORMAT", builder::logFormat);
        envString(envLookup, "LOG_LEVEL", builder::logLevel);

        envInt(envLookup, "VALIDATION_MAX_DEPTH", builder::maxDepth);
        envInt(envLookup, "VALIDATION_MAX_ELEMENTS", builder::maxElements);
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(envVar + " must be an integer, got '" + raw + "'", e);
            }
        }
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException(field + " must be an integer, got '" + value.asText() + "'");
        }
        return value.intValue();
    }
}
