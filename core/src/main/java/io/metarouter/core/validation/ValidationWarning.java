package io.metarouter.core.validation;

import java.util.List;
import java.util.Objects;

/** A finding that does not block publication. */
public sealed interface ValidationWarning {

    String type();

    String message();

    /** Location in the configuration, one segment per key or list index. */
    List<String> path();

    /** The path joined with dots. */
    default String dottedPath() {
        return String.join(".", path());
    }

    /**
     * A regex pattern matching one of the known slow-pattern heuristics.
     *
     * @param path    location of the pattern field
     * @param pattern the pattern source
     * @param reason  the first heuristic that matched
     */
    record RegexPerformance(List<String> path, String pattern, String reason) implements ValidationWarning {
        public RegexPerformance {
            path = List.copyOf(path);
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public String type() {
            return "regex_performance";
        }

        @Override
        public String message() {
            return "Regex pattern may cause performance issues: " + reason;
        }
    }

    /** A meta-agent with no routing rules; it can never resolve. */
    record EmptyRoutingRules(List<String> path) implements ValidationWarning {
        public EmptyRoutingRules {
            path = List.copyOf(path);
        }

        @Override
        public String type() {
            return "empty_routing_rules";
        }

        @Override
        public String message() {
            return "Meta-agent has no routing rules and will never match";
        }
    }
}
