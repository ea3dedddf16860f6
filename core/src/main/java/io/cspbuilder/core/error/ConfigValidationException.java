package io.cspbuilder.core.error;

import java.util.List;

/** Thrown when a settings document does not match the policy settings JSON Schema. */
public final class ConfigValidationException extends ConfigLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public ConfigValidationException(String message, List<String> violations, String source) {
        super(message, source);
        this.violations = violations != null ? List.copyOf(violations) : List.of();
    }

    /** Schema violation messages, in validator order. */
    public List<String> violations() {
        return violations;
    }
}
