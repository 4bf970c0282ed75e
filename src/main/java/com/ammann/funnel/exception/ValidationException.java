/* (C)2026 */
package com.ammann.funnel.exception;

/**
 * Exception indicating that a funnel definition or query parameter does not meet the
 * required constraints. Always raised before any computation starts.
 *
 * <p>Provides factory methods for common validation failure patterns. The offending
 * parameter, when known, is available through {@link #getParameter()}.
 */
public class ValidationException extends FunnelException {

    private final String parameter;

    public ValidationException(String message) {
        this(message, (String) null);
    }

    public ValidationException(String message, String parameter) {
        super(message);
        this.parameter = parameter;
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.parameter = null;
    }

    /**
     * Name of the rejected parameter, or null when the failure concerns the definition as a whole.
     */
    public String getParameter() {
        return parameter;
    }

    /**
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(String resourceType, int required, int actual) {
        return new ValidationException(
                String.format("Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual),
                resourceType);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected),
                paramName);
    }

    /**
     * Creates validation exception for a signed actor-selection step outside {@code [-steps, steps]}
     * or equal to zero.
     */
    public static ValidationException funnelStepOutOfRange(int funnelStep, int stepCount) {
        return new ValidationException(
                String.format("Invalid funnel step %d: expected a non-zero value between -%d and %d",
                        funnelStep, stepCount, stepCount),
                "funnelStep");
    }
}
