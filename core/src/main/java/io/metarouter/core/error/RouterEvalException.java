package io.metarouter.core.error;

/**
 * Abstract parent for errors raised while resolving a prompt. These indicate a caller bug
 * rather than a bad configuration; malformed matchers never surface here.
 */
public abstract class RouterEvalException extends RouterException {

    private static final long serialVersionUID = 1L;

    protected RouterEvalException(String message, String agentName) {
        super(message, agentName, Phase.EVALUATION);
    }

    protected RouterEvalException(String message, Throwable cause, String agentName) {
        super(message, cause, agentName, Phase.EVALUATION);
    }
}
