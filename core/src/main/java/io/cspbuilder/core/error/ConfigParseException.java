package io.cspbuilder.core.error;

/** Thrown when a settings file is missing, is not valid YAML, or an env override is malformed. */
public final class ConfigParseException extends ConfigLoadException {

    private static final long serialVersionUID = 1L;

    public ConfigParseException(String message, String source) {
        super(message, source);
    }

    public ConfigParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
