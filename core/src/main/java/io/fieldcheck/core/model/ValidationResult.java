package io.fieldcheck.core.model;

import io.fieldcheck.core.error.ValidationError;
import io.fieldcheck.core.error.ValidationException;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one validator invocation. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#VALID}: the value satisfies the rule; {@link #error()} is {@code null}.
 * <li>{@link Type#INVALID}: {@link #error()} holds the single error explaining why.
 * </ul>
 *
 * <p>Immutable. The valid outcome is a shared instance.
 */
public final class ValidationResult {

    /** The type of validation outcome. */
    public enum Type {
        VALID,
        INVALID
    }

    private static final ValidationResult VALID = new ValidationResult(Type.VALID, null);

    private final Type type;
    private final ValidationError error;

    private ValidationResult(Type type, ValidationError error) {
        this.type = type;
        this.error = error;
    }

    /** The shared VALID result. */
    public static ValidationResult valid() {
        return VALID;
    }

    /** Creates an INVALID result carrying {@code error}. */
    public static ValidationResult invalid(ValidationError error) {
        Objects.requireNonNull(error, "error must not be null for INVALID");
        return new ValidationResult(Type.INVALID, error);
    }

    public Type type() {
        return type;
    }

    /** Returns the error. Only non-null when {@code type() == INVALID}. */
    public ValidationError error() {
        return error;
    }

    public Optional<ValidationError> findError() {
        return Optional.ofNullable(error);
    }

    public boolean isValid() {
        return type == Type.VALID;
    }

    public boolean isInvalid() {
        return type == Type.INVALID;
    }

    /**
     * Throws the exception matching the error's category if this result is INVALID.
     *
     * @throws io.fieldcheck.core.error.RuleConfigurationException for bad parameters and
     *     unsupported types
     * @throws io.fieldcheck.core.error.ValueRejectedException for every other error
     */
    public void orThrow() {
        if (error != null) {
            throw ValidationException.of(error);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationResult that)) return false;
        return type == that.type && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, error);
    }

    @Override
    public String toString() {
        return switch (type) {
            case VALID -> "ValidationResult[VALID]";
            case INVALID -> "ValidationResult[INVALID, " + error.code() + ": " + error.message() + "]";
        };
    }
}
