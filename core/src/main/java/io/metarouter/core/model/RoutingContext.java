package io.metarouter.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Per-request input to a resolution. Immutable for the duration of one resolution.
 *
 * @param prompt              the natural-language task prompt
 * @param projectDirectory    project root used for file-existence probes, or null
 * @param projectFiles        project-relative paths known to exist (may be empty)
 * @param projectDependencies dependency names declared by the project (may be empty)
 */
public record RoutingContext(
        String prompt, String projectDirectory, List<String> projectFiles, List<String> projectDependencies) {

    public RoutingContext {
        Objects.requireNonNull(prompt, "prompt must not be null");
        projectFiles = projectFiles == null ? List.of() : List.copyOf(projectFiles);
        projectDependencies = projectDependencies == null ? List.of() : List.copyOf(projectDependencies);
    }

    /** A context carrying only a prompt. */
    public static RoutingContext ofPrompt(String prompt) {
        return new RoutingContext(prompt, null, List.of(), List.of());
    }
}
