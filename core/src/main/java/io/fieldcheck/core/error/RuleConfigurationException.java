package io.fieldcheck.core.error;

/**
 * Thrown when a rule cannot be evaluated: its parameter is malformed ({@link
 * SentinelError#BAD_PARAMETER}) or it does not apply to the value's kind ({@link
 * SentinelError#UNSUPPORTED_TYPE}). Indicates a bug in rule setup, not an invalid value.
 */
public final class RuleConfigurationException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public RuleConfigurationException(ValidationError error, String message) {
        super(requireConfiguration(error), message);
    }

    public RuleConfigurationException(ValidationError error, String message, Throwable cause) {
        super(requireConfiguration(error), message, cause);
    }

    /** A {@link SentinelError#BAD_PARAMETER} failure with a detail message. */
    public static RuleConfigurationException badParameter(String message) {
        return new RuleConfigurationException(SentinelError.BAD_PARAMETER, message);
    }

    /** A {@link SentinelError#BAD_PARAMETER} failure caused by {@code cause}. */
    public static RuleConfigurationException badParameter(String message, Throwable cause) {
        return new RuleConfigurationException(SentinelError.BAD_PARAMETER, message, cause);
    }

    private static ValidationError requireConfiguration(ValidationError error) {
        if (error != null && error.category() != ValidationError.Category.CONFIGURATION) {
            throw new IllegalArgumentException("not a configuration error: " + error.code());
        }
        return error;
    }
}
