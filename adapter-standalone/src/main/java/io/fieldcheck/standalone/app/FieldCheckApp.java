package io.fieldcheck.standalone.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fieldcheck.standalone.config.ConfigLoadException;
import io.fieldcheck.standalone.config.ConfigLoader;
import io.fieldcheck.standalone.config.StandaloneConfig;
import io.fieldcheck.standalone.report.ReportRenderer;
import io.fieldcheck.standalone.report.ValidationReport;
import io.fieldcheck.standalone.rules.RuleSet;
import io.fieldcheck.standalone.rules.RuleSetLoadException;
import io.fieldcheck.standalone.rules.RuleSetLoader;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one validation: loads configuration, the rule set and the input
 * document, validates, and prints the report.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Parse {@code --rules}, {@code --input} and {@code --config}</li>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback from {@code logging.format} and {@code logging.level}</li>
 * <li>Load and parse the rule set</li>
 * <li>Read the input document ({@code .yaml}/{@code .yml} as YAML, anything
 * else as JSON)</li>
 * <li>Validate and print the report in {@code report.format}</li>
 * </ol>
 *
 * <p>
 * Exit codes: {@value #EXIT_VALID} valid, {@value #EXIT_INVALID} invalid
 * document, {@value #EXIT_ERROR} usage, configuration or load error, or a
 * rule misapplied to a field (bad parameter, unsupported type).
 *
 * <p>
 * This class is separate from {@link io.fieldcheck.standalone.StandaloneMain}
 * to allow testing without going through {@code main()}.
 */
public final class FieldCheckApp {

    private static final Logger LOG = LoggerFactory.getLogger(FieldCheckApp.class);

    public static final int EXIT_VALID = 0;
    public static final int EXIT_INVALID = 1;
    public static final int EXIT_ERROR = 2;

    static final String USAGE = "usage: fieldcheck --rules <rules.yaml> --input <document> [--config <config.yaml>]";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Function<String, String> envLookup;
    private final Path workingDir;
    private final boolean configureLogging;

    /** An app reading the process environment and working directory. */
    public FieldCheckApp() {
        this(System::getenv, Path.of("").toAbsolutePath(), true);
    }

    FieldCheckApp(Function<String, String> envLookup, Path workingDir, boolean configureLogging) {
        this.envLookup = envLookup;
        this.workingDir = workingDir;
        this.configureLogging = configureLogging;
    }

    /**
     * Runs with the process environment, printing the report to {@code out}
     * and errors to {@code System.err}.
     *
     * @param args command-line arguments
     * @param out  destination of the report
     * @return the exit code
     */
    public static int run(String[] args, PrintStream out) {
        return new FieldCheckApp().execute(args, out, System.err);
    }

    /**
     * Runs one validation.
     *
     * @param args command-line arguments
     * @param out  destination of the report
     * @param err  destination of usage and error messages
     * @return the exit code
     */
    public int execute(String[] args, PrintStream out, PrintStream err) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args, workingDir);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_ERROR;
        }

        StandaloneConfig config;
        try {
            config = ConfigLoader.resolve(arguments.config(), workingDir, envLookup);
        } catch (ConfigLoadException e) {
            LOG.error("Configuration failed: {}", e.getMessage());
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        }
        if (configureLogging) {
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        }

        RuleSet ruleSet;
        try {
            ruleSet = new RuleSetLoader().load(arguments.rules());
        } catch (RuleSetLoadException e) {
            LOG.error("Rule set failed to load: {}", e.getMessage());
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        }

        JsonNode document;
        try {
            document = readDocument(arguments.input());
        } catch (IOException e) {
            LOG.error("Input document could not be read: {}", arguments.input(), e);
            err.println("error: cannot read input document " + arguments.input() + ": " + e.getMessage());
            return EXIT_ERROR;
        }

        ValidationReport report = ruleSet.validate(document, config.failFast());
        out.print(render(report, config.reportFormat()));
        out.flush();

        LOG.info(
                "Validated {} against rule set '{}': {} error(s) in {} field(s)",
                arguments.input(),
                ruleSet.id(),
                report.errorCount(),
                report.failedFieldCount());

        if (report.hasConfigurationErrors()) {
            LOG.warn("Rule set '{}' misapplies rules to some fields; see the report", ruleSet.id());
            return EXIT_ERROR;
        }
        return report.isValid() ? EXIT_VALID : EXIT_INVALID;
    }

    /** Parses {@code path} as YAML or JSON by extension; an empty file yields {@code null}. */
    static JsonNode readDocument(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("file not found");
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode node = mapper.readTree(in);
            return node == null || node.isMissingNode() ? null : node;
        }
    }

    private static String render(ValidationReport report, StandaloneConfig.ReportFormat format) {
        return switch (format) {
            case JSON -> ReportRenderer.toJsonString(report) + System.lineSeparator();
            case TEXT -> ReportRenderer.toText(report);
        };
    }

    /** Parsed command line; relative paths are resolved against the working directory. */
    record Arguments(Path rules, Path input, Path config) {

        static Arguments parse(String[] args, Path workingDir) {
            Path rules = null;
            Path input = null;
            Path config = null;
            for (int i = 0; i < args.length; i++) {
                String option = args[i];
                if (!option.equals("--rules") && !option.equals("--input") && !option.equals("--config")) {
                    throw new IllegalArgumentException("unknown argument '" + option + "'");
                }
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException(option + " requires a file path argument");
                }
                Path value = workingDir.resolve(args[++i]);
                switch (option) {
                    case "--rules" -> rules = value;
                    case "--input" -> input = value;
                    default -> config = value;
                }
            }
            if (rules == null) {
                throw new IllegalArgumentException("--rules is required");
            }
            if (input == null) {
                throw new IllegalArgumentException("--input is required");
            }
            return new Arguments(rules, input, config);
        }
    }
}
