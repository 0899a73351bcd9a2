package io.metarouter.core.model;

import java.util.Objects;

/**
 * A single conditional routing rule. Position within the owning list is its priority: the
 * first rule whose matcher is satisfied wins.
 *
 * @param matcher     the condition
 * @param targetAgent the agent to delegate to when the condition holds
 * @param overrides   optional configuration overrides, or null
 */
public record RoutingRule(Matcher matcher, String targetAgent, ConfigOverrides overrides) {

    public RoutingRule {
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(targetAgent, "targetAgent must not be null");
    }

    /** Convenience constructor for a rule without overrides. */
    public RoutingRule(Matcher matcher, String targetAgent) {
        this(matcher, targetAgent, null);
    }
}
