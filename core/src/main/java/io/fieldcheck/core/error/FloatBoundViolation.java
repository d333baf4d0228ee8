package io.fieldcheck.core.error;

import io.fieldcheck.core.error.BoundViolation.Bound;
import java.util.Objects;

/**
 * Bound violation for floating-point values.
 *
 * @param bound    the violated check
 * @param expected the bound from the rule parameter
 * @param actual   the value
 */
public record FloatBoundViolation(Bound bound, double expected, double actual) implements BoundViolation {

    public FloatBoundViolation {
        Objects.requireNonNull(bound, "bound must not be null");
    }

    @Override
    public Domain domain() {
        return Domain.FLOAT;
    }

    @Override
    public String message() {
        return switch (bound) {
            case LENGTH -> "value mismatch: expected " + expected + ", got " + actual;
            case MIN -> "less than min: expected at least " + expected + ", got " + actual;
            case MAX -> "greater than max: expected at most " + expected + ", got " + actual;
        };
    }
}
