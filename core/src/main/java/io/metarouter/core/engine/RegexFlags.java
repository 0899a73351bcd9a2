package io.metarouter.core.engine;

import java.util.regex.Pattern;

/**
 * Translation of regex modifier letters ({@code dgimsuvy}) to {@link Pattern} compile flags.
 *
 * <p>
 * {@code i} maps to case-insensitive (Unicode-aware) matching, {@code m} to multiline,
 * {@code s} to dot-all and {@code u}/{@code v} to Unicode case folding. {@code g} and
 * {@code d} have no effect on a boolean search. {@code y} (sticky) anchors the match at the
 * start of the input. Absent or empty flags mean {@code i}.
 */
public record RegexFlags(int patternFlags, boolean sticky) {

    /** Every modifier letter accepted in configuration. */
    public static final String ALLOWED = "dgimsuvy";

    /** Flags applied when a matcher declares none. */
    public static final String DEFAULT_FLAGS = "i";

    /** Returns true if every character of {@code flags} is an allowed modifier. */
    public static boolean isValid(String flags) {
        if (flags == null) {
            return true;
        }
        for (int i = 0; i < flags.length(); i++) {
            if (ALLOWED.indexOf(flags.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Parses modifier letters. Duplicates are accepted.
     *
     * @param flags the letters, or null/empty for the default
     * @throws IllegalArgumentException on a letter outside {@link #ALLOWED}
     */
    public static RegexFlags parse(String flags) {
        String effective = flags == null || flags.isEmpty() ? DEFAULT_FLAGS : flags;
        int compileFlags = 0;
        boolean sticky = false;
        for (int i = 0; i < effective.length(); i++) {
            char c = effective.charAt(i);
            switch (c) {
                case 'i' -> compileFlags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                case 'm' -> compileFlags |= Pattern.MULTILINE;
                case 's' -> compileFlags |= Pattern.DOTALL;
                case 'u', 'v' -> compileFlags |= Pattern.UNICODE_CASE;
                case 'y' -> sticky = true;
                case 'g', 'd' -> {
                    // no effect on a boolean test
                }
                default -> throw new IllegalArgumentException("Unsupported regex flag '" + c + "' in '" + flags + "'");
            }
        }
        return new RegexFlags(compileFlags, sticky);
    }

    /** The effective flag string for diagnostics. */
    public static String effective(String flags) {
        return flags == null || flags.isEmpty() ? DEFAULT_FLAGS : flags;
    }
}
