package io.pagetree.standalone.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback setup, applied once the configuration is loaded.
 *
 * <p>
 * Logs go to stderr so that stdout carries only the command's JSON result. {@code json} uses
 * Logback's {@link JsonEncoder} (timestamp, level, logger, message, MDC); {@code text} uses
 * {@link #TEXT_PATTERN}.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";

    /** Human-readable pattern for text mode; shows the document id from the MDC when set. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} [%X{documentId}] - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root logger's appenders with a single stderr appender.
     *
     * @param format {@code json} or {@code text}
     * @param level  root level name, INFO when unrecognised
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.INFO));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");

        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            appender.setEncoder(encoder);
        } else {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(TEXT_PATTERN);
            encoder.start();
            appender.setEncoder(encoder);
        }

        appender.start();
        rootLogger.addAppender(appender);

        // schema library logs every resolution at debug
        context.getLogger("com.networknt").setLevel(Level.WARN);
    }
}
