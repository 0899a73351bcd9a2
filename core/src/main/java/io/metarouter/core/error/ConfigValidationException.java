package io.metarouter.core.error;

import io.metarouter.core.validation.ValidationResult;

/**
 * Thrown when a configuration fails semantic validation (circular delegation, unknown agent
 * references, illegal regex flags). Carries the complete {@link ValidationResult} so the host
 * can report every error, not just the first.
 */
public final class ConfigValidationException extends RouterLoadException {

    private static final long serialVersionUID = 1L;

    private final transient ValidationResult result;

    public ConfigValidationException(ValidationResult result, String source) {
        super(buildMessage(result), null, source);
        this.result = result;
    }

    /** The full validation outcome, including warnings. */
    public ValidationResult result() {
        return result;
    }

    private static String buildMessage(ValidationResult result) {
        StringBuilder sb = new StringBuilder("Configuration rejected: ").append(result.summary());
        for (String line : result.formatErrors()) {
            sb.append(System.lineSeparator()).append("  ").append(line);
        }
        return sb.toString();
    }
}
