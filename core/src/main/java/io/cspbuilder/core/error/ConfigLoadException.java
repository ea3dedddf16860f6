package io.cspbuilder.core.error;

/**
 * Abstract parent for policy settings load errors. Thrown by {@code PolicyConfigLoader}. Carries
 * a {@code source} field identifying the file or resource that caused the error.
 */
public abstract class ConfigLoadException extends CspException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ConfigLoadException(String message, String source) {
        super(message);
        this.source = source;
    }

    protected ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
