package io.metarouter.core.spi;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File-system collaborator used by project-context matchers to test whether a project file
 * exists.
 *
 * <p>
 * Implementations may throw; callers treat any failure as "absent".
 */
@FunctionalInterface
public interface ProjectFileProbe {

    /**
     * Returns true if {@code relativePath} exists under {@code directory}.
     *
     * @param directory    the project root, never null
     * @param relativePath a path relative to the project root
     */
    boolean exists(String directory, String relativePath);

    /** Probe backed by {@link Files#exists}. */
    static ProjectFileProbe fileSystem() {
        return (directory, relativePath) -> Files.exists(Path.of(directory).resolve(relativePath));
    }

    /** Probe that never finds anything. */
    static ProjectFileProbe none() {
        return (directory, relativePath) -> false;
    }
}
