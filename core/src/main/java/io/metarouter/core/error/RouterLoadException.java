package io.metarouter.core.error;

/**
 * Abstract parent for load-time configuration errors. Thrown while a configuration is parsed,
 * schema-checked or semantically validated. Carries an additional {@code source} field
 * identifying the file or resource that caused the error.
 */
public abstract class RouterLoadException extends RouterException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected RouterLoadException(String message, String agentName, String source) {
        super(message, agentName, Phase.LOAD);
        this.source = source;
    }

    protected RouterLoadException(String message, Throwable cause, String agentName, String source) {
        super(message, cause, agentName, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
