package io.cspbuilder.core.error;

/**
 * Abstract base for all csp-builder exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ConfigLoadException}.
 *
 * <p>
 * Policy assembly and script tag rendering never throw these: malformed directive values are
 * coerced, not rejected. Only loading settings from an external source can fail.
 */
public abstract class CspException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected CspException(String message) {
        super(message);
    }

    protected CspException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
