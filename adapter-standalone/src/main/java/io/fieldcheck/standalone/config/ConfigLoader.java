package io.fieldcheck.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fieldcheck.standalone.config.StandaloneConfig.LogFormat;
import io.fieldcheck.standalone.config.StandaloneConfig.ReportFormat;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link StandaloneConfig} from a YAML file with an environment
 * variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@value #DEFAULT_CONFIG_FILE} from the current
 * directory if it exists, otherwise starts from {@link StandaloneConfig#DEFAULT}</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path,
 * which must exist</li>
 * </ul>
 *
 * <p>
 * Every key can be overridden by an environment variable, which takes
 * precedence over the YAML value. An env var is considered "set" if and
 * only if it is defined AND its trimmed value is non-empty.
 *
 * <pre>{@code
 * logging.format     FIELDCHECK_LOGGING_FORMAT     text | json
 * logging.level      FIELDCHECK_LOGGING_LEVEL      TRACE..ERROR, OFF
 * report.format      FIELDCHECK_REPORT_FORMAT      json | text
 * report.fail-fast   FIELDCHECK_REPORT_FAIL_FAST   true | false
 * }</pre>
 */
public final class ConfigLoader {

    /** Config file picked up from the working directory when no {@code --config} is given. */
    public static final String DEFAULT_CONFIG_FILE = "fieldcheck.yaml";

    static final String ENV_LOGGING_FORMAT = "FIELDCHECK_LOGGING_FORMAT";
    static final String ENV_LOGGING_LEVEL = "FIELDCHECK_LOGGING_LEVEL";
    static final String ENV_REPORT_FORMAT = "FIELDCHECK_REPORT_FORMAT";
    static final String ENV_REPORT_FAIL_FAST = "FIELDCHECK_REPORT_FAIL_FAST";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link StandaloneConfig} from the given YAML file, applying
     * environment variable overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or
     *                             holds an invalid value
     */
    public static StandaloneConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link StandaloneConfig} from the given YAML file, applying
     * environment variable overrides from the supplied lookup function.
     * Returning {@code null} from {@code envLookup} means the variable is not
     * defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or
     *                             holds an invalid value
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
        if (root == null || root.isMissingNode() || root.isNull()) {
            return fromEnvironment(envLookup);
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return mapToConfig(root, envLookup);
    }

    /**
     * Resolves the configuration for a run: the explicit file if one is given,
     * else {@value #DEFAULT_CONFIG_FILE} if it exists in {@code workingDir},
     * else the defaults. The env overlay applies in every case.
     *
     * @param explicitPath value of {@code --config}, or {@code null}
     * @param workingDir   directory searched for the default file
     * @param envLookup    environment variable lookup function
     * @return the resolved configuration
     * @throws ConfigLoadException if loading fails
     */
    public static StandaloneConfig resolve(Path explicitPath, Path workingDir, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(explicitPath, envLookup);
        }
        Path defaultPath = workingDir.resolve(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(defaultPath)) {
            return load(defaultPath, envLookup);
        }
        return fromEnvironment(envLookup);
    }

    /**
     * Builds a configuration from the defaults and the env overlay alone.
     *
     * @param envLookup environment variable lookup function
     * @return the resolved configuration
     * @throws ConfigLoadException if an env var holds an invalid value
     */
    public static StandaloneConfig fromEnvironment(Function<String, String> envLookup) {
        StandaloneConfig.Builder builder = StandaloneConfig.builder();
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static StandaloneConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        StandaloneConfig.Builder builder = StandaloneConfig.builder();

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(LogFormat.parse(logging.get("format").asText()));
        if (logging.has("level")) builder.loggingLevel(level("logging.level", logging.get("level").asText()));

        JsonNode report = root.path("report");
        if (report.has("format")) builder.reportFormat(ReportFormat.parse(report.get("format").asText()));
        if (report.has("fail-fast")) {
            JsonNode failFast = report.get("fail-fast");
            if (!failFast.isBoolean()) {
                throw new ConfigLoadException("Invalid value for report.fail-fast: '" + failFast.asText() + "'");
            }
            builder.failFast(failFast.booleanValue());
        }

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(StandaloneConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, ENV_LOGGING_FORMAT, v -> builder.loggingFormat(LogFormat.parse(v)));
        envString(envLookup, ENV_LOGGING_LEVEL, v -> builder.loggingLevel(level(ENV_LOGGING_LEVEL, v)));
        envString(envLookup, ENV_REPORT_FORMAT, v -> builder.reportFormat(ReportFormat.parse(v)));
        envString(envLookup, ENV_REPORT_FAIL_FAST, v -> builder.failFast(bool(ENV_REPORT_FAIL_FAST, v)));
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after
     * trimming.
     */
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

    // --- Value checks ---

    private static String level(String key, String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (!LEVELS.contains(normalized)) {
            throw new ConfigLoadException("Invalid value for " + key + ": '" + value + "'");
        }
        return normalized;
    }

    private static boolean bool(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigLoadException("Invalid value for " + key + ": '" + value + "'");
    }
}
