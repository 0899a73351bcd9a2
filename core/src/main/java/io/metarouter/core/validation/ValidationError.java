package io.metarouter.core.validation;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A semantic error that prevents a configuration from being published.
 *
 * <p>
 * Every variant carries a stable {@link #type()} code, a human-readable {@link #message()}
 * and the configuration {@link #path()} it refers to, one segment per key or list index.
 */
public sealed interface ValidationError {

    String type();

    String message();

    List<String> path();

    /** The path joined with dots, e.g. {@code meta-agents.triage.routing-rules.0.target-agent}. */
    default String dottedPath() {
        return String.join(".", path());
    }

    /**
     * A delegation path that leads back to its origin within the depth bound.
     *
     * @param path           location of the origin ({@code meta-agents, <name>})
     * @param cycle          agent sequence, starting and ending with the origin
     * @param involvedAgents the origin and the first hop
     */
    record CircularDependency(List<String> path, List<String> cycle, Set<String> involvedAgents)
            implements ValidationError {
        public CircularDependency {
            path = List.copyOf(path);
            cycle = List.copyOf(cycle);
            involvedAgents = Set.copyOf(involvedAgents);
        }

        @Override
        public String type() {
            return "circular_dependency";
        }

        @Override
        public String message() {
            return "Circular dependency detected: " + String.join(" -> ", cycle);
        }
    }

    /**
     * A delegate or rule target that names neither a built-in agent nor a declared meta-agent.
     *
     * @param path      location of the offending reference
     * @param reference the unknown agent name
     */
    record InvalidReference(List<String> path, String reference) implements ValidationError {
        public InvalidReference {
            path = List.copyOf(path);
            Objects.requireNonNull(reference, "reference must not be null");
        }

        @Override
        public String type() {
            return "invalid_agent_reference";
        }

        @Override
        public String message() {
            return "Invalid agent reference: \"" + reference + "\" is not a recognized agent. Valid agents are: "
                    + String.join(", ", BuiltinAgents.NAMES);
        }
    }

    /**
     * A regex matcher whose flags contain a character outside the allowed set.
     *
     * @param path  location of the flags field
     * @param flags the full flags string as configured
     */
    record InvalidRegexFlags(List<String> path, String flags) implements ValidationError {
        public InvalidRegexFlags {
            path = List.copyOf(path);
            Objects.requireNonNull(flags, "flags must not be null");
        }

        @Override
        public String type() {
            return "invalid_regex_flags";
        }

        @Override
        public String message() {
            return "Invalid regex flags: \"" + flags + "\". Allowed flags are: d, g, i, m, s, u, v, y";
        }
    }
}
