package io.metarouter.standalone.config;

/**
 * Thrown when an environment variable override carries a value that cannot be applied,
 * such as a non-numeric delegation depth or an unknown logger output.
 */
public class EnvOverlayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EnvOverlayException(String message) {
        super(message);
    }

    public EnvOverlayException(String message, Throwable cause) {
        super(message, cause);
    }
}
