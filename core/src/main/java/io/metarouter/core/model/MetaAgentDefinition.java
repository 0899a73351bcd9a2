package io.metarouter.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Definition of a meta-agent: a routing identity with its declared delegates and ordered rule
 * set.
 *
 * <p>
 * Immutable and thread-safe. Created once at configuration load time and replaced, never
 * patched, on re-registration.
 *
 * @param baseModel      model used for the delegated call unless a rule overrides it
 * @param delegatesTo    agents this meta-agent may delegate to, in declared order
 * @param routingRules   rules in priority order; an empty list never matches
 * @param promptTemplate optional system prompt for the meta-agent itself, or null
 * @param temperature    optional sampling temperature, or null
 * @param description    optional human-readable description, or null
 */
public record MetaAgentDefinition(
        String baseModel,
        List<String> delegatesTo,
        List<RoutingRule> routingRules,
        String promptTemplate,
        Double temperature,
        String description) {

    /** Validates required fields and copies lists. */
    public MetaAgentDefinition {
        Objects.requireNonNull(baseModel, "baseModel must not be null");
        delegatesTo = delegatesTo == null ? List.of() : List.copyOf(delegatesTo);
        routingRules = routingRules == null ? List.of() : List.copyOf(routingRules);
    }

    /** Definition without prompt template, temperature or description. */
    public MetaAgentDefinition(String baseModel, List<String> delegatesTo, List<RoutingRule> routingRules) {
        this(baseModel, delegatesTo, routingRules, null, null, null);
    }
}
