package io.fieldcheck.core.error;

/** Thrown by {@code ValidationResult.orThrow()} when the value itself fails a rule. */
public final class ValueRejectedException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public ValueRejectedException(ValidationError error) {
        super(requireValue(error), error.message());
    }

    private static ValidationError requireValue(ValidationError error) {
        if (error != null && error.category() != ValidationError.Category.VALUE) {
            throw new IllegalArgumentException("not a value error: " + error.code());
        }
        return error;
    }
}
