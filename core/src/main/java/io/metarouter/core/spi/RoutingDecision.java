package io.metarouter.core.spi;

import io.metarouter.core.model.ConfigOverrides;
import io.metarouter.core.model.MatcherEvaluation;
import java.util.List;

/**
 * Immutable record of one successful routing decision, handed to a
 * {@link RoutingDecisionListener}.
 *
 * @param metaAgent      the meta-agent that was resolved
 * @param targetAgent    the chosen delegate
 * @param matcherKind    kind of the winning matcher
 * @param matchedContent description of what matched
 * @param overrides      the winning rule's overrides, or null
 * @param evaluations    full evaluation trace, empty unless the listener is in debug mode
 */
public record RoutingDecision(
        String metaAgent,
        String targetAgent,
        String matcherKind,
        String matchedContent,
        ConfigOverrides overrides,
        List<MatcherEvaluation> evaluations) {

    public RoutingDecision {
        evaluations = evaluations == null ? List.of() : List.copyOf(evaluations);
    }
}
