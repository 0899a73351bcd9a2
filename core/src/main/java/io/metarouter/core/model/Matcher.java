package io.metarouter.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A condition evaluated against a prompt and its project context to decide whether a
 * {@link RoutingRule} applies.
 *
 * <p>
 * Implementations are a sealed hierarchy and all variants are known at compile time. Consumers
 * that need per-variant behaviour implement {@link Visitor}; adding a variant breaks every
 * visitor at compile time, so no consumer can silently ignore it.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Matcher {

    /** Wire name of the matcher kind, as it appears in configuration ({@code keyword}, ...). */
    String kind();

    /** Dispatches to the visitor method for this variant. */
    <R> R accept(Visitor<R> visitor);

    /** One method per matcher variant. */
    interface Visitor<R> {

        R visitKeyword(Keyword matcher);

        R visitComplexity(Complexity matcher);

        R visitRegex(Regex matcher);

        R visitProjectContext(ProjectContext matcher);

        R visitAlways(Always matcher);
    }

    // ── Implementations ──

    /**
     * Case-insensitive substring match of keywords against the prompt.
     *
     * @param keywords the keywords (must not be empty)
     * @param mode     ANY (at least one) or ALL (every keyword)
     */
    record Keyword(List<String> keywords, KeywordMode mode) implements Matcher {
        public Keyword {
            Objects.requireNonNull(keywords, "keywords must not be null");
            Objects.requireNonNull(mode, "mode must not be null");
            if (keywords.isEmpty()) {
                throw new IllegalArgumentException("Keyword matcher requires at least one keyword");
            }
            keywords = List.copyOf(keywords);
        }

        @Override
        public String kind() {
            return "keyword";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitKeyword(this);
        }
    }

    /**
     * Heuristic prompt-complexity threshold. See
     * {@link io.metarouter.core.engine.ComplexityScorer} for the scoring rule.
     *
     * @param threshold the minimum complexity level
     */
    record Complexity(ComplexityThreshold threshold) implements Matcher {
        public Complexity {
            Objects.requireNonNull(threshold, "threshold must not be null");
        }

        @Override
        public String kind() {
            return "complexity";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComplexity(this);
        }
    }

    /**
     * Regular-expression search against the prompt.
     *
     * @param pattern the pattern source (must not be blank)
     * @param flags   modifier letters, or null for the default (case-insensitive)
     */
    record Regex(String pattern, String flags) implements Matcher {
        public Regex {
            Objects.requireNonNull(pattern, "pattern must not be null");
            if (pattern.isEmpty()) {
                throw new IllegalArgumentException("Regex matcher requires a non-empty pattern");
            }
        }

        @Override
        public String kind() {
            return "regex";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRegex(this);
        }
    }

    /**
     * Requires files and/or dependencies to be present in the project. Both lists use ALL
     * semantics; when both are empty the matcher is trivially satisfied.
     *
     * @param hasFiles paths relative to the project directory (empty if unset)
     * @param hasDeps  dependency names (empty if unset)
     */
    record ProjectContext(List<String> hasFiles, List<String> hasDeps) implements Matcher {
        public ProjectContext {
            hasFiles = hasFiles == null ? List.of() : List.copyOf(hasFiles);
            hasDeps = hasDeps == null ? List.of() : List.copyOf(hasDeps);
        }

        @Override
        public String kind() {
            return "project_context";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProjectContext(this);
        }
    }

    /** Unconditional match. Intended as the terminal fallback rule. */
    record Always() implements Matcher {

        @Override
        public String kind() {
            return "always";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAlways(this);
        }
    }
}
