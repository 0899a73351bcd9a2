package io.metarouter.core.model;

/**
 * Complexity levels for {@link Matcher.Complexity}, each mapped to the minimum heuristic score
 * that satisfies it.
 */
public enum ComplexityThreshold {
    LOW(2),
    MEDIUM(5),
    HIGH(10);

    private final int minimumScore;

    ComplexityThreshold(int minimumScore) {
        this.minimumScore = minimumScore;
    }

    /** The score a prompt must reach (inclusive) to satisfy this threshold. */
    public int minimumScore() {
        return minimumScore;
    }

    /** Wire name used in configuration and diagnostics ({@code low}, {@code medium}, {@code high}). */
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
