package io.metarouter.core.model;

/**
 * One entry of a resolution trace: a rule's matcher and whether it was satisfied.
 *
 * @param matcherKind the matcher kind
 * @param matcher     the evaluated matcher
 * @param matched     the evaluation outcome
 */
public record MatcherEvaluation(String matcherKind, Matcher matcher, boolean matched) {}
