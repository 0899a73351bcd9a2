package io.metarouter.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Settings for the routing decision logger.
 *
 * @param enabled   master switch
 * @param output    where entries go
 * @param logFile   target file for {@link Output#FILE}
 * @param debugMode when true, entries carry the full evaluation trace
 */
public record RoutingLoggerSettings(boolean enabled, Output output, String logFile, boolean debugMode) {

    public static final String DEFAULT_LOG_FILE = "routing.log";

    public static final RoutingLoggerSettings DEFAULT =
            new RoutingLoggerSettings(true, Output.CONSOLE, DEFAULT_LOG_FILE, false);

    public RoutingLoggerSettings {
        Objects.requireNonNull(output, "output must not be null");
        if (logFile == null || logFile.isBlank()) {
            logFile = DEFAULT_LOG_FILE;
        }
    }

    /** Logger destinations. */
    public enum Output {
        CONSOLE,
        FILE,
        DISABLED;

        /**
         * Parses a configuration value ({@code console}, {@code file}, {@code disabled}),
         * case-insensitively.
         *
         * @throws IllegalArgumentException for any other value
         */
        public static Output fromString(String value) {
            Objects.requireNonNull(value, "value must not be null");
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "console" -> CONSOLE;
                case "file" -> FILE;
                case "disabled" -> DISABLED;
                default -> throw new IllegalArgumentException("Unknown routing logger output: '" + value + "'");
            };
        }
    }

    public RoutingLoggerSettings withOutput(Output newOutput) {
        return new RoutingLoggerSettings(enabled, newOutput, logFile, debugMode);
    }

    public RoutingLoggerSettings withLogFile(String newLogFile) {
        return new RoutingLoggerSettings(enabled, output, newLogFile, debugMode);
    }

    public RoutingLoggerSettings withDebugMode(boolean newDebugMode) {
        return new RoutingLoggerSettings(enabled, output, logFile, newDebugMode);
    }
}
