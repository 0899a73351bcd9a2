package io.metarouter.standalone.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.function.Function;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback configuration for structured JSON vs. text logging.
 *
 * <p>
 * Called by the CLI before any command runs. Reads {@code LOG_FORMAT} ({@code text} or
 * {@code json}) and {@code LOG_LEVEL} and reconfigures the root logger. Log output goes to
 * stderr so that command output on stdout stays machine-readable.
 *
 * <p>
 * JSON mode uses Logback 1.5's built-in {@link JsonEncoder}. Text mode uses a short
 * human-readable pattern.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";
    static final String DEFAULT_LEVEL = "WARN";

    private LogbackConfigurator() {
        // utility class
    }

    /** Configures logging from {@code LOG_FORMAT} and {@code LOG_LEVEL} in the environment. */
    public static void configureFromEnvironment(Function<String, String> envLookup) {
        String format = envLookup.apply("LOG_FORMAT");
        String level = envLookup.apply("LOG_LEVEL");
        configure(
                format == null || format.isBlank() ? "text" : format.trim(),
                level == null || level.isBlank() ? DEFAULT_LEVEL : level.trim());
    }

    /**
     * Configures the Logback root logger.
     *
     * @param format "json" for structured JSON output, anything else for text
     * @param level  log level (TRACE, DEBUG, INFO, WARN, ERROR); unknown values fall back to WARN
     */
    public static void configure(String format, String level) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.toLevel(level, Level.WARN));
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
