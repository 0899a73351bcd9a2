package io.metarouter.core.model;

/** How a {@link Matcher.Keyword} combines its keywords. */
public enum KeywordMode {
    /** At least one keyword must occur in the prompt. */
    ANY,
    /** Every keyword must occur in the prompt. */
    ALL
}
