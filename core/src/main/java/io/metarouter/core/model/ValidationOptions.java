package io.metarouter.core.model;

/**
 * Toggles for the individual semantic checks run at load time. Every check is enabled by
 * default.
 */
public record ValidationOptions(
        boolean circularDependencies,
        boolean agentReferences,
        boolean regexFlags,
        boolean regexPerformance,
        boolean emptyRoutingRules) {

    public static final ValidationOptions DEFAULT = new ValidationOptions(true, true, true, true, true);
}
