package io.metarouter.core.validation;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Static heuristics flagging regex patterns that are likely to backtrack badly. Heuristics are
 * checked in a fixed order and only the first hit is reported.
 */
public final class RegexPatternAnalyzer {

    private record Heuristic(Pattern detector, String reason) {}

    private static final List<Heuristic> HEURISTICS = List.of(
            new Heuristic(
                    Pattern.compile("\\(\\?[=!][^)]*[+*?]\\)|\\(\\?<[=!][^)]*[+*?]\\)"),
                    "Complex lookaheads/lookbehinds with quantifiers can be slow"),
            new Heuristic(
                    Pattern.compile("(\\([^)]*[+*?][^)]*\\)[+*?]|([+*?][+*?]))"),
                    "Nested quantifiers can cause catastrophic backtracking"),
            new Heuristic(
                    Pattern.compile("(\\w+)\\|\\1"), "Overlapping alternation can cause inefficient backtracking"),
            new Heuristic(
                    Pattern.compile("\\^\\.\\*|\\.\\*\\$|\\.\\*$|\\.\\*\\.\\*"),
                    "Unbounded .* patterns can match excessively and cause performance issues"),
            new Heuristic(
                    Pattern.compile("\\[[^\\]]+\\][+*?]*\\{\\d{2,}"),
                    "Large repetition quantifiers can cause excessive backtracking"),
            new Heuristic(
                    Pattern.compile("\\\\\\d"), "Backreferences prevent efficient regex compilation and can be slow"));

    private static final int MAX_ALTERNATIONS = 8;

    private RegexPatternAnalyzer() {}

    /**
     * Returns the reason of the first heuristic the pattern trips, or empty if none.
     *
     * @param pattern the pattern source
     */
    public static Optional<String> analyze(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return Optional.empty();
        }
        for (Heuristic heuristic : HEURISTICS) {
            if (heuristic.detector().matcher(pattern).find()) {
                return Optional.of(heuristic.reason());
            }
        }
        if (pattern.chars().filter(c -> c == '|').count() > MAX_ALTERNATIONS) {
            return Optional.of("Many alternations can cause the regex engine to try many paths");
        }
        return Optional.empty();
    }
}
