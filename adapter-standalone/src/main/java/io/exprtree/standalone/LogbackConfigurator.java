package io.exprtree.standalone;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback configuration for structured JSON vs. text logging.
 *
 * <p>
 * Called during startup after config is loaded. Reconfigures the root
 * logger's appender and level based on {@code logging.format} and
 * {@code logging.level} from
 * {@link io.exprtree.standalone.config.DemoConfig}.
 *
 * <p>
 * JSON mode uses Logback 1.5's built-in {@link JsonEncoder}. Text mode uses a
 * human-readable pattern. Log output goes to stderr so that stdout carries
 * only the demo results.
 */
public final class LogbackConfigurator {

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Configures the Logback root logger.
     *
     * @param format "json" for structured JSON output, "text" for
     *               human-readable pattern
     * @param level  log level (TRACE, DEBUG, INFO, WARN, ERROR); unknown
     *               values fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.INFO));

        // Replace root appender
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("STDERR");
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
    }
}
