package io.fieldcheck.standalone.app;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.util.ContextInitializer;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import io.fieldcheck.standalone.config.StandaloneConfig.LogFormat;
import java.util.Iterator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreTestConfiguration() throws Exception {
        context.reset();
        new ContextInitializer(context).autoConfig();
    }

    @SuppressWarnings("unchecked")
    private ConsoleAppender<ILoggingEvent> rootAppender() {
        Appender<ILoggingEvent> appender =
                context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(LogbackConfigurator.APPENDER_NAME);
        assertThat(appender).isInstanceOf(ConsoleAppender.class);
        return (ConsoleAppender<ILoggingEvent>) appender;
    }

    @Test
    void jsonFormatUsesJsonEncoderOnStderr() {
        LogbackConfigurator.configure(LogFormat.JSON, "DEBUG");

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);
        ConsoleAppender<ILoggingEvent> appender = rootAppender();
        assertThat(appender.getTarget()).isEqualTo("System.err");
        assertThat(appender.getEncoder()).isInstanceOf(JsonEncoder.class);
        assertThat(appender.isStarted()).isTrue();
    }

    @Test
    void textFormatUsesPattern() {
        LogbackConfigurator.configure(LogFormat.TEXT, "WARN");

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(rootAppender().getEncoder())
                .isInstanceOfSatisfying(PatternLayoutEncoder.class, encoder -> assertThat(encoder.getPattern())
                        .isEqualTo(LogbackConfigurator.TEXT_PATTERN));
    }

    @Test
    void replacesExistingAppenders() {
        LogbackConfigurator.configure(LogFormat.TEXT, "INFO");
        LogbackConfigurator.configure(LogFormat.JSON, "INFO");

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        int count = 0;
        for (Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders(); it.hasNext(); it.next()) {
            count++;
        }
        assertThat(count).isEqualTo(1);
        assertThat(rootAppender().getEncoder()).isInstanceOf(JsonEncoder.class);
    }
}
