package io.fieldcheck.core.error;

import io.fieldcheck.core.error.BoundViolation.Bound;
import io.fieldcheck.core.error.BoundViolation.Domain;
import java.util.Objects;

/**
 * Bound violation with integer operands: a string's code-point count, a collection's element
 * count, or an integer value. Unsigned values are reported widened to their signed 64-bit
 * representation, so an unsigned value above {@link Long#MAX_VALUE} reads as negative.
 *
 * @param bound    the violated check
 * @param domain   one of {@code STRING}, {@code COLLECTION}, {@code INTEGER}, {@code UNSIGNED}
 * @param expected the bound from the rule parameter
 * @param actual   the measured size or value
 */
public record IntegerBoundViolation(Bound bound, Domain domain, long expected, long actual)
        implements BoundViolation {

    public IntegerBoundViolation {
        Objects.requireNonNull(bound, "bound must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
        if (domain == Domain.FLOAT) {
            throw new IllegalArgumentException("FLOAT domain requires a FloatBoundViolation");
        }
    }

    @Override
    public String message() {
        String unit =
                switch (domain) {
                    case STRING -> " characters";
                    case COLLECTION -> " elements";
                    default -> "";
                };
        return switch (bound) {
            case LENGTH -> (domain == Domain.STRING || domain == Domain.COLLECTION
                            ? "invalid length: expected "
                            : "value mismatch: expected ")
                    + expected + unit + ", got " + actual;
            case MIN -> "less than min: expected at least " + expected + unit + ", got " + actual;
            case MAX -> "greater than max: expected at most " + expected + unit + ", got " + actual;
        };
    }
}
