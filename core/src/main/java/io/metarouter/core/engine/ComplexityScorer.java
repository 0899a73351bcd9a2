package io.metarouter.core.engine;

import io.metarouter.core.model.ComplexityThreshold;
import java.util.List;
import java.util.Locale;

/**
 * Heuristic prompt complexity score.
 *
 * <p>
 * {@code score = ceil(lines / 10) + distinct technical terms present}, where {@code lines} is
 * the number of newline-separated segments (a trailing empty segment counts) and each term of
 * {@link #TECHNICAL_TERMS} contributes at most once, matched as a case-insensitive substring.
 * This is a textual heuristic, not an understanding of the prompt.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class ComplexityScorer {

    /** Vocabulary of technical terms counted by the score. */
    public static final List<String> TECHNICAL_TERMS = List.of(
            "architecture",
            "performance",
            "optimization",
            "database",
            "async",
            "concurrent",
            "algorithm",
            "data structure",
            "api",
            "integration",
            "security",
            "encryption",
            "authentication",
            "deployment",
            "infrastructure",
            "testing",
            "refactor",
            "debug",
            "trace",
            "profile");

    private ComplexityScorer() {}

    /**
     * Computes the complexity score of a prompt.
     *
     * @param prompt the prompt, never null
     * @return the non-negative score
     */
    public static int score(String prompt) {
        int lines = prompt.split("\n", -1).length;
        int score = (lines + 9) / 10;
        String lower = prompt.toLowerCase(Locale.ROOT);
        for (String term : TECHNICAL_TERMS) {
            if (lower.contains(term)) {
                score++;
            }
        }
        return score;
    }

    /** Returns true if the prompt's score reaches the threshold's minimum. */
    public static boolean meets(String prompt, ComplexityThreshold threshold) {
        return score(prompt) >= threshold.minimumScore();
    }
}
