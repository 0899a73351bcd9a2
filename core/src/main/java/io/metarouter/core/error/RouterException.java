package io.metarouter.core.error;

/**
 * Abstract base for all meta-router exceptions. Never thrown directly; use the concrete
 * subclasses under {@link RouterLoadException} or {@link RouterEvalException}.
 */
public abstract class RouterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final String agentName;
    private final Phase phase;

    protected RouterException(String message, String agentName, Phase phase) {
        super(message);
        this.agentName = agentName;
        this.phase = phase;
    }

    protected RouterException(String message, Throwable cause, String agentName, Phase phase) {
        super(message, cause);
        this.agentName = agentName;
        this.phase = phase;
    }

    /** The meta-agent that triggered the error, or {@code null} if not tied to one. */
    public String agentName() {
        return agentName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
