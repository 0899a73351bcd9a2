package io.metarouter.core.error;

import java.util.List;

/** Thrown when a configuration document violates the bundled JSON Schema. */
public final class SchemaValidationException extends RouterLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public SchemaValidationException(String message, List<String> violations, String source) {
        super(message, null, source);
        this.violations = List.copyOf(violations);
    }

    /** Every schema violation found, in the validator's reporting order. */
    public List<String> violations() {
        return violations;
    }
}
