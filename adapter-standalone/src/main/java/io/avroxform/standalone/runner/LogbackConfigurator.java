package io.avroxform.standalone.runner;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.avroxform.core.engine.TransformEngine;
import io.avroxform.standalone.config.StandaloneConfig;
import java.util.Locale;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section of a {@link StandaloneConfig} to Logback.
 *
 * <p>
 * The runner writes rows to stdout, so every log line goes to a single stderr appender on the root
 * logger. {@code json} selects Logback's {@link JsonEncoder} (MDC included, so each line carries
 * the instance name); anything else gets a text pattern that prints the instance name from the
 * MDC next to the logger.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";

    static final String TEXT_PATTERN =
            "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} %X{" + TransformEngine.MDC_NAME + "} - %msg%n";

    /** Libraries that log below WARN only about their own internals. */
    static final String[] QUIET_LOGGERS = {"org.apache.avro"};

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root appender and level according to {@code config}.
     *
     * @return the level applied to the root logger; unknown names fall back to INFO
     */
    public static Level configure(StandaloneConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

        Level level = Level.toLevel(config.loggingLevel(), Level.INFO);
        root.setLevel(level);
        root.detachAndStopAllAppenders();
        root.addAppender(stderrAppender(context, encoder(context, config.loggingFormat())));

        for (String name : QUIET_LOGGERS) {
            context.getLogger(name).setLevel(Level.WARN);
        }
        return level;
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        String normalized =
                format == null ? StandaloneConfig.DEFAULT_LOGGING_FORMAT : format.toLowerCase(Locale.ROOT);
        Encoder<ILoggingEvent> encoder;
        if ("json".equals(normalized)) {
            encoder = new JsonEncoder();
        } else {
            PatternLayoutEncoder pattern = new PatternLayoutEncoder();
            pattern.setPattern(TEXT_PATTERN);
            encoder = pattern;
        }
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender(
            LoggerContext context, Encoder<ILoggingEvent> encoder) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }
}
