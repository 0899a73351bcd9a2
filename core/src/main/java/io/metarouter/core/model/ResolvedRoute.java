package io.metarouter.core.model;

import java.util.Objects;

/**
 * Outcome of a successful resolution.
 *
 * @param targetAgent    the agent chosen by the winning rule
 * @param matcherKind    kind of the winning rule's matcher
 * @param matchedContent human-readable description of what matched (diagnostics only)
 * @param overrides      the winning rule's overrides, or null
 */
public record ResolvedRoute(String targetAgent, String matcherKind, String matchedContent, ConfigOverrides overrides) {

    public ResolvedRoute {
        Objects.requireNonNull(targetAgent, "targetAgent must not be null");
        Objects.requireNonNull(matcherKind, "matcherKind must not be null");
    }
}
