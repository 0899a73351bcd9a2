package io.metarouter.core.error;

/**
 * Thrown when a resolution is requested for a meta-agent name that has no registered
 * definition. This is a programming error on the caller's side, distinct from a configuration
 * error.
 */
public final class UnregisteredAgentException extends RouterEvalException {

    private static final long serialVersionUID = 1L;

    public UnregisteredAgentException(String agentName) {
        super("Meta-agent \"" + agentName + "\" is not registered", agentName);
    }
}
