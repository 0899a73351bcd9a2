package io.metarouter.core.error;

/** Thrown when a configuration file is unreadable, has invalid syntax, or misses required fields. */
public final class ConfigParseException extends RouterLoadException {

    private static final long serialVersionUID = 1L;

    public ConfigParseException(String message, String agentName, String source) {
        super(message, agentName, source);
    }

    public ConfigParseException(String message, Throwable cause, String agentName, String source) {
        super(message, cause, agentName, source);
    }
}
