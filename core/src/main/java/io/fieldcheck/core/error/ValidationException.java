package io.fieldcheck.core.error;

import java.util.Objects;

/**
 * Abstract base for fieldcheck exceptions. Validators never throw these for ordinary outcomes; they
 * are raised by {@code ValidationResult.orThrow()} for callers that prefer exceptions, and by
 * parameter coercion before a validator converts them into a result.
 *
 * <p>Never thrown directly. Use {@link RuleConfigurationException} or {@link ValueRejectedException},
 * or {@link #of(ValidationError)} to pick the one matching an error's category.
 */
public abstract class ValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ValidationError error;

    protected ValidationException(ValidationError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    protected ValidationException(ValidationError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    /** Wraps {@code error} in the exception type matching its category. */
    public static ValidationException of(ValidationError error) {
        Objects.requireNonNull(error, "error must not be null");
        return switch (error.category()) {
            case CONFIGURATION -> new RuleConfigurationException(error, error.message());
            case VALUE -> new ValueRejectedException(error);
        };
    }

    /** The validation error carried by this exception. */
    public ValidationError error() {
        return error;
    }

    /** Shortcut for {@code error().category()}. */
    public ValidationError.Category category() {
        return error.category();
    }
}
