package io.metarouter.core.spi;

/**
 * SPI for routing analytics.
 *
 * <p>
 * Implementations bridge to whatever store or metrics system the host uses. All methods
 * receive immutable event objects. Implementations MUST be thread-safe. Exceptions thrown by a
 * sink are caught by the engine and logged; they do NOT affect routing.
 */
public interface RoutingEventSink {

    /**
     * Called when a meta-agent resolved to a delegate.
     *
     * @param event contains metaAgent, targetAgent, matcherKind, matchedContent
     */
    void onRoutingDecision(RoutingDecisionEvent event);

    /**
     * Called when no rule of a meta-agent matched.
     *
     * @param event contains metaAgent, prompt preview, number of rules evaluated
     */
    void onUnmatchedRequest(UnmatchedRequestEvent event);

    // --- Event records ---

    /** Event emitted for every successful resolution. */
    record RoutingDecisionEvent(
            String metaAgent, String targetAgent, String matcherKind, String matchedContent, long timestampMillis) {}

    /** Event emitted when a resolution found no matching rule. */
    record UnmatchedRequestEvent(String metaAgent, String promptPreview, int rulesEvaluated, long timestampMillis) {}
}
