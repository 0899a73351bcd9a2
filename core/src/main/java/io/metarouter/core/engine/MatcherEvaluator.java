package io.metarouter.core.engine;

import io.metarouter.core.model.KeywordMode;
import io.metarouter.core.model.Matcher;
import io.metarouter.core.model.RoutingContext;
import io.metarouter.core.spi.ProjectFileProbe;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a {@link Matcher} against a {@link RoutingContext}.
 *
 * <p>
 * Evaluation never throws for a malformed matcher: an uncompilable pattern, an unknown regex
 * flag, or a failing file probe is logged at WARN and counts as "no match".
 *
 * <p>
 * Thread-safe: the only state is the immutable file probe.
 */
public final class MatcherEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(MatcherEvaluator.class);

    private final ProjectFileProbe fileProbe;

    /** Creates an evaluator probing the real file system. */
    public MatcherEvaluator() {
        this(ProjectFileProbe.fileSystem());
    }

    public MatcherEvaluator(ProjectFileProbe fileProbe) {
        this.fileProbe = Objects.requireNonNull(fileProbe, "fileProbe must not be null");
    }

    /**
     * Returns true if the matcher is satisfied by the context.
     *
     * @param matcher the matcher
     * @param context the request context
     */
    public boolean evaluate(Matcher matcher, RoutingContext context) {
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(context, "context must not be null");
        return matcher.accept(new Matcher.Visitor<Boolean>() {
            @Override
            public Boolean visitKeyword(Matcher.Keyword m) {
                return matchesKeywords(m, context.prompt());
            }

            @Override
            public Boolean visitComplexity(Matcher.Complexity m) {
                return ComplexityScorer.meets(context.prompt(), m.threshold());
            }

            @Override
            public Boolean visitRegex(Matcher.Regex m) {
                return matchesRegex(m, context.prompt());
            }

            @Override
            public Boolean visitProjectContext(Matcher.ProjectContext m) {
                return matchesProject(m, context);
            }

            @Override
            public Boolean visitAlways(Matcher.Always m) {
                return true;
            }
        });
    }

    /**
     * Describes what a matcher matched, for diagnostics. Intended to be called after
     * {@link #evaluate} returned true.
     */
    public String describe(Matcher matcher, RoutingContext context) {
        return matcher.accept(new Matcher.Visitor<String>() {
            @Override
            public String visitKeyword(Matcher.Keyword m) {
                String prompt = context.prompt().toLowerCase(Locale.ROOT);
                List<String> hits = m.keywords().stream()
                        .filter(k -> prompt.contains(k.toLowerCase(Locale.ROOT)))
                        .collect(Collectors.toList());
                return "matched keywords: " + String.join(", ", hits);
            }

            @Override
            public String visitComplexity(Matcher.Complexity m) {
                return "complexity score >= " + m.threshold().wireName();
            }

            @Override
            public String visitRegex(Matcher.Regex m) {
                return "matched pattern: /" + m.pattern() + "/" + RegexFlags.effective(m.flags());
            }

            @Override
            public String visitProjectContext(Matcher.ProjectContext m) {
                List<String> parts = new ArrayList<>();
                if (!m.hasFiles().isEmpty()) {
                    parts.add("files: " + String.join(", ", m.hasFiles()));
                }
                if (!m.hasDeps().isEmpty()) {
                    parts.add("deps: " + String.join(", ", m.hasDeps()));
                }
                return parts.isEmpty() ? "project context match" : String.join("; ", parts);
            }

            @Override
            public String visitAlways(Matcher.Always m) {
                return "always match";
            }
        });
    }

    private static boolean matchesKeywords(Matcher.Keyword matcher, String prompt) {
        String lower = prompt.toLowerCase(Locale.ROOT);
        if (matcher.mode() == KeywordMode.ALL) {
            return matcher.keywords().stream().allMatch(k -> lower.contains(k.toLowerCase(Locale.ROOT)));
        }
        return matcher.keywords().stream().anyMatch(k -> lower.contains(k.toLowerCase(Locale.ROOT)));
    }

    private static boolean matchesRegex(Matcher.Regex matcher, String prompt) {
        try {
            RegexFlags flags = RegexFlags.parse(matcher.flags());
            java.util.regex.Matcher m = Pattern.compile(matcher.pattern(), flags.patternFlags())
                    .matcher(prompt);
            return flags.sticky() ? m.lookingAt() : m.find();
        } catch (IllegalArgumentException e) {
            // PatternSyntaxException or an unsupported flag
            LOG.warn(
                    "matcher.regex_invalid pattern={} flags={}: {}", matcher.pattern(), matcher.flags(), e.getMessage());
            return false;
        }
    }

    private boolean matchesProject(Matcher.ProjectContext matcher, RoutingContext context) {
        for (String file : matcher.hasFiles()) {
            if (!fileExists(file, context)) {
                return false;
            }
        }
        return context.projectDependencies().containsAll(matcher.hasDeps());
    }

    private boolean fileExists(String file, RoutingContext context) {
        if (context.projectFiles().contains(file)) {
            return true;
        }
        if (context.projectDirectory() == null) {
            return false;
        }
        try {
            return fileProbe.exists(context.projectDirectory(), file);
        } catch (RuntimeException e) {
            LOG.warn("matcher.file_probe_failed dir={} file={}", context.projectDirectory(), file, e);
            return false;
        }
    }
}
