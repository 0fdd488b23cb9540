package io.exprtree.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.exprtree.core.engine.EvaluationMode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Loads {@link DemoConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: no file, built-in defaults plus the environment overlay</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Environment variables take precedence over YAML values. An env var is
 * considered "set" if and only if it is defined AND its trimmed value is
 * non-empty; empty or whitespace-only values are treated as "unset" and the
 * YAML value is used.
 */
public final class ConfigLoader {

    static final String ENV_ENGINE_MODE = "EXPRTREE_ENGINE_MODE";
    static final String ENV_ENGINE_MAX_DEPTH = "EXPRTREE_ENGINE_MAX_DEPTH";
    static final String ENV_DEMO_VARIABLE_VALUE = "EXPRTREE_DEMO_VARIABLE_VALUE";
    static final String ENV_LOGGING_FORMAT = "EXPRTREE_LOGGING_FORMAT";
    static final String ENV_LOGGING_LEVEL = "EXPRTREE_LOGGING_LEVEL";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link DemoConfig} from the given YAML file path, applying
     * environment variable overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return a fully constructed {@link DemoConfig} with defaults applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static DemoConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link DemoConfig} from the given YAML file path, applying
     * environment variable overrides from the supplied lookup function.
     *
     * <p>
     * The {@code envLookup} function maps environment variable names to their
     * values. Returning {@code null} means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return a fully constructed {@link DemoConfig} with env overrides applied
     * @throws ConfigLoadException if the file is missing, contains invalid YAML,
     *                             or holds a value that cannot be converted
     */
    public static DemoConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? MissingNode.getInstance() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Builds a {@link DemoConfig} from the built-in defaults and the
     * environment overlay, without reading any file.
     *
     * @param envLookup environment variable lookup function
     * @return the resulting configuration
     * @throws ConfigLoadException if an env var holds a value that cannot be
     *                             converted
     */
    public static DemoConfig defaults(Function<String, String> envLookup) {
        return mapToConfig(MissingNode.getInstance(), envLookup);
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the path given with {@code --config}, or empty if absent
     */
    public static Optional<Path> resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Optional.of(Path.of(args[i + 1]));
            }
        }
        return Optional.empty();
    }

    /**
     * Maps a parsed YAML tree to a {@link DemoConfig} via the builder, then
     * overlays environment variable overrides.
     */
    private static DemoConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        DemoConfig.Builder builder = DemoConfig.builder();

        // --- YAML mapping ---

        JsonNode engine = root.path("engine");
        if (engine.has("mode")) builder.engineMode(parseMode(engine.get("mode").asText(), "engine.mode"));
        if (engine.has("max-depth")) builder.maxDepth(requireInt(engine.get("max-depth"), "engine.max-depth"));

        JsonNode demo = root.path("demo");
        if (demo.has("variable-value"))
            builder.variableValue(requireDouble(demo.get("variable-value"), "demo.variable-value"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(parseFormat(logging.get("format").asText(), "logging.format"));
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        if (isSet(envLookup, ENV_ENGINE_MODE)) {
            builder.engineMode(parseMode(envValue(envLookup, ENV_ENGINE_MODE), ENV_ENGINE_MODE));
        }
        if (isSet(envLookup, ENV_ENGINE_MAX_DEPTH)) {
            builder.maxDepth(parseInt(envValue(envLookup, ENV_ENGINE_MAX_DEPTH), ENV_ENGINE_MAX_DEPTH));
        }
        if (isSet(envLookup, ENV_DEMO_VARIABLE_VALUE)) {
            builder.variableValue(parseDouble(envValue(envLookup, ENV_DEMO_VARIABLE_VALUE), ENV_DEMO_VARIABLE_VALUE));
        }
        if (isSet(envLookup, ENV_LOGGING_FORMAT)) {
            builder.loggingFormat(parseFormat(envValue(envLookup, ENV_LOGGING_FORMAT), ENV_LOGGING_FORMAT));
        }
        if (isSet(envLookup, ENV_LOGGING_LEVEL)) {
            builder.loggingLevel(envValue(envLookup, ENV_LOGGING_LEVEL));
        }

        DemoConfig config = builder.build();
        if (config.maxDepth() <= 0) {
            throw new ConfigLoadException("engine.max-depth must be positive, got: " + config.maxDepth());
        }
        return config;
    }

    // --- Env helpers ---

    /**
     * Returns {@code true} if the env var is defined and non-empty after
     * trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static String envValue(Function<String, String> envLookup, String envVar) {
        return envLookup.apply(envVar).trim();
    }

    // --- Value conversion ---

    private static EvaluationMode parseMode(String value, String key) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "lenient" -> EvaluationMode.LENIENT;
            case "strict" -> EvaluationMode.STRICT;
            default ->
                throw new ConfigLoadException(
                        "Invalid " + key + ": '" + value + "'. Expected 'lenient' or 'strict'");
        };
    }

    private static String parseFormat(String value, String key) {
        String format = value.trim().toLowerCase(Locale.ROOT);
        if (!format.equals("text") && !format.equals("json")) {
            throw new ConfigLoadException("Invalid " + key + ": '" + value + "'. Expected 'text' or 'json'");
        }
        return format;
    }

    private static int requireInt(JsonNode node, String key) {
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ConfigLoadException("Invalid " + key + ": '" + node.asText() + "'. Expected an integer");
        }
        return node.asInt();
    }

    private static double requireDouble(JsonNode node, String key) {
        if (!node.isNumber()) {
            throw new ConfigLoadException("Invalid " + key + ": '" + node.asText() + "'. Expected a number");
        }
        return node.asDouble();
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid " + key + ": '" + value + "'. Expected an integer", e);
        }
    }

    private static double parseDouble(String value, String key) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid " + key + ": '" + value + "'. Expected a number", e);
        }
    }
}
