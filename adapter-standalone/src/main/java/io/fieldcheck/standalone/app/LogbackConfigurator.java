package io.fieldcheck.standalone.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.fieldcheck.standalone.config.StandaloneConfig;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback configuration for structured JSON vs. text logging.
 *
 * <p>
 * Called once the configuration is loaded. Replaces the root logger's
 * appender with a console appender on {@code System.err}, so log output
 * never mixes with the report written to stdout.
 *
 * <p>
 * JSON mode uses Logback 1.5's built-in {@link JsonEncoder}. Text mode uses
 * a human-readable pattern.
 */
public final class LogbackConfigurator {

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Configures the Logback root logger.
     *
     * @param format text pattern or JSON events
     * @param level  log level (TRACE, DEBUG, INFO, WARN, ERROR, OFF)
     */
    public static void configure(StandaloneConfig.LogFormat format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.INFO));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(format, context));
        appender.start();
        rootLogger.addAppender(appender);
    }

    private static Encoder<ILoggingEvent> encoder(StandaloneConfig.LogFormat format, LoggerContext context) {
        if (format == StandaloneConfig.LogFormat.JSON) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            return encoder;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
