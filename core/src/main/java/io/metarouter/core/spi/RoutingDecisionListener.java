package io.metarouter.core.spi;

/**
 * Diagnostics hook notified once per successful resolution.
 *
 * <p>
 * Exceptions thrown by implementations are caught by the resolver and logged. They never
 * affect the routing outcome.
 */
public interface RoutingDecisionListener {

    /** Returns false to skip notification entirely. */
    boolean isEnabled();

    /**
     * Returns true to request the full evaluation trace. In debug mode the resolver evaluates
     * every rule (the winner is still the first match).
     */
    boolean isDebugMode();

    /**
     * Called after a rule matched.
     *
     * @param decision the decision, including the trace when {@link #isDebugMode()} is true
     */
    void onRouteResolved(RoutingDecision decision);
}
