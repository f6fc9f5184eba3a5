package io.luascript.standalone.cli;

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
import ch.qos.logback.core.joran.spi.JoranException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreTestConfiguration() throws JoranException {
        context.reset();
        new ContextInitializer(context).autoConfig();
    }

    @SuppressWarnings("unchecked")
    private ConsoleAppender<ILoggingEvent> stderrAppender() {
        Appender<ILoggingEvent> appender =
                context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(LogbackConfigurator.APPENDER_NAME);
        assertThat(appender).isInstanceOf(ConsoleAppender.class);
        return (ConsoleAppender<ILoggingEvent>) appender;
    }

    @Test
    void textFormatUsesPatternOnStderr() {
        LogbackConfigurator.configure("text", "DEBUG");

        ConsoleAppender<ILoggingEvent> appender = stderrAppender();
        assertThat(appender.getTarget()).isEqualTo("System.err");
        assertThat(appender.getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern())
                .isEqualTo(LogbackConfigurator.TEXT_PATTERN);
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void jsonFormatUsesJsonEncoder() {
        LogbackConfigurator.configure("JSON", "warn");

        assertThat(stderrAppender().getEncoder()).isInstanceOf(JsonEncoder.class);
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void unknownLevelFallsBackToInfo() {
        LogbackConfigurator.configure("text", "chatty");

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
        assertThat(context.getLogger("com.networknt").getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void reconfiguringReplacesTheAppender() {
        LogbackConfigurator.configure("text", "INFO");
        LogbackConfigurator.configure("json", "INFO");

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        int count = 0;
        for (var it = root.iteratorForAppenders(); it.hasNext(); it.next()) {
            count++;
        }
        assertThat(count).isEqualTo(1);
    }
}
