package io.automock.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.automock.core.engine.CompressionMode;
import io.automock.core.engine.ResponseFeature;
import io.automock.core.error.InputValidationException;
import io.automock.core.export.PriorityOrder;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link ExportConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * The file is {@code automock.yaml} in the working directory unless
 * {@code --config <path>} is given. Relative {@code input} and {@code output}
 * paths resolve against the directory holding the configuration file.
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts
 * as set only if it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "automock.yaml";

    private ConfigLoader() {
        // utility class
    }

    /** Loads the configuration, overlaying {@link System#getenv}. */
    public static ExportConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, overlaying variables from {@code envLookup}
     * ({@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing, unparsable or a
     *                             setting is missing or invalid
     */
    public static ExportConfig load(Path configPath, Function<String, String> envLookup) {
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
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }

        Path baseDir = configPath.toAbsolutePath().getParent();
        try {
            ExportConfig config = mapToConfig(root, envLookup, baseDir);
            validate(config);
            return config;
        } catch (InputValidationException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ExportConfig mapToConfig(JsonNode root, Function<String, String> envLookup, Path baseDir) {
        ExportConfig.Builder builder = ExportConfig.builder();

        // --- YAML mapping ---

        if (root.hasNonNull("input")) builder.input(resolve(baseDir, root.get("input").asText()));
        if (root.hasNonNull("output")) builder.output(resolve(baseDir, root.get("output").asText()));

        JsonNode progressive = root.path("progressive");
        if (progressive.has("enabled")) builder.progressiveEnabled(progressive.get("enabled").asBoolean());

        JsonNode compression = root.path("compression");
        if (compression.hasNonNull("algorithm"))
            builder.compressionAlgorithm(compression.get("algorithm").asText());
        if (compression.hasNonNull("mode"))
            builder.compressionMode(CompressionMode.fromName(compression.get("mode").asText()));

        JsonNode export = root.path("export");
        if (export.has("pretty")) builder.pretty(export.get("pretty").asBoolean());
        if (export.hasNonNull("priority-order"))
            builder.priorityOrder(PriorityOrder.fromName(export.get("priority-order").asText()));

        Iterator<Map.Entry<String, JsonNode>> features = root.path("features").fields();
        while (features.hasNext()) {
            Map.Entry<String, JsonNode> feature = features.next();
            ResponseFeature.fromKey(feature.getKey());
            builder.feature(feature.getKey(), feature.getValue().isNull() ? "" : feature.getValue().asText());
        }

        JsonNode logging = root.path("logging");
        if (logging.hasNonNull("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.hasNonNull("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "AUTOMOCK_INPUT", value -> builder.input(resolve(baseDir, value)));
        envString(envLookup, "AUTOMOCK_OUTPUT", value -> builder.output(resolve(baseDir, value)));
        envBool(envLookup, "AUTOMOCK_PROGRESSIVE_ENABLED", builder::progressiveEnabled);
        envString(envLookup, "AUTOMOCK_COMPRESSION_ALGORITHM", builder::compressionAlgorithm);
        envString(
                envLookup,
                "AUTOMOCK_COMPRESSION_MODE",
                value -> builder.compressionMode(CompressionMode.fromName(value)));
        envBool(envLookup, "AUTOMOCK_EXPORT_PRETTY", builder::pretty);
        envString(envLookup, "AUTOMOCK_PRIORITY_ORDER", value -> builder.priorityOrder(PriorityOrder.fromName(value)));
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    private static void validate(ExportConfig config) {
        if (config.input() == null) {
            throw new ConfigLoadException("Missing required setting 'input' (or AUTOMOCK_INPUT)");
        }
        if (config.output() == null) {
            throw new ConfigLoadException("Missing required setting 'output' (or AUTOMOCK_OUTPUT)");
        }
        String format = config.loggingFormat();
        if (!"text".equalsIgnoreCase(format) && !"json".equalsIgnoreCase(format)) {
            throw new ConfigLoadException("Invalid logging.format '" + format + "' (expected: text or json)");
        }
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value.trim());
        return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path).normalize();
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

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
