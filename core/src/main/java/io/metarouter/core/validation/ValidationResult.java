package io.metarouter.core.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of semantic validation. {@link #valid()} is true iff there are no errors; warnings
 * never affect validity.
 */
public record ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    /** One-line summary, e.g. {@code invalid (2 errors, 1 warning)}. */
    public String summary() {
        return (valid() ? "valid" : "invalid")
                + " (" + plural(errors.size(), "error") + ", " + plural(warnings.size(), "warning") + ")";
    }

    /** One {@code [ERROR] path: message} line per error. */
    public List<String> formatErrors() {
        return errors.stream()
                .map(e -> "[ERROR] " + e.dottedPath() + ": " + e.message())
                .collect(Collectors.toList());
    }

    /** One {@code [WARN] path: message} line per warning. */
    public List<String> formatWarnings() {
        return warnings.stream()
                .map(w -> "[WARN] " + w.dottedPath() + ": " + w.message())
                .collect(Collectors.toList());
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
