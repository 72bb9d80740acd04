package io.surveylogic.cli.config;

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
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * The file is {@code survey-logic.yaml} in the working directory unless {@code --config <path>}
 * names another one. The default file is optional; an explicitly named file must exist.
 *
 * <pre>
 * logging:
 *   format: json
 *   level: INFO
 * engine:
 *   max-condition-depth: 16
 *   max-pattern-length: 500
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts as set only if it
 * is defined and its trimmed value is non-empty.
 */
public final class ConfigLoader {

    static final String DEFAULT_CONFIG_FILE = "survey-logic.yaml";
    static final String ENV_LOG_FORMAT = "SURVEYLOGIC_LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "SURVEYLOGIC_LOG_LEVEL";
    static final String ENV_MAX_CONDITION_DEPTH = "SURVEYLOGIC_MAX_CONDITION_DEPTH";
    static final String ENV_MAX_PATTERN_LENGTH = "SURVEYLOGIC_MAX_PATTERN_LENGTH";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration named by the arguments, applying overrides from {@link System#getenv}.
     */
    public static CliConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Loads the configuration named by the arguments.
     *
     * @param args      command-line arguments, scanned for {@code --config}
     * @param envLookup environment variable lookup; {@code null} means undefined
     * @throws ConfigLoadException if an explicit file is missing or any file is invalid
     */
    public static CliConfig load(String[] args, Function<String, String> envLookup) {
        Path explicit = resolveConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        CliConfig.Builder builder = CliConfig.builder();
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    /**
     * Loads a configuration file.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML or values
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Returns the path following {@code --config}, or {@code null} if the option is absent.
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
        return null;
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode engine = root.path("engine");
        if (engine.has("max-condition-depth"))
            builder.maxConditionDepth(engine.get("max-condition-depth").asInt());
        if (engine.has("max-pattern-length"))
            builder.maxPatternLength(engine.get("max-pattern-length").asInt());

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(CliConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, ENV_LOG_FORMAT, builder::loggingFormat);
        envString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);
        envInt(envLookup, ENV_MAX_CONDITION_DEPTH, builder::maxConditionDepth);
        envInt(envLookup, ENV_MAX_PATTERN_LENGTH, builder::maxPatternLength);
    }

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
                throw new ConfigLoadException(envVar + " must be an integer, got '" + raw + "'", e);
            }
        }
    }
}
