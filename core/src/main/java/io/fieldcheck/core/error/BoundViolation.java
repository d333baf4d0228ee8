package io.fieldcheck.core.error;

/**
 * A value (or its size) failed a length, minimum or maximum check. Callers classifying errors
 * should match on this interface; the two implementations only differ in the numeric type of the
 * operands they report.
 *
 * <ul>
 * <li>{@link IntegerBoundViolation}: string and collection sizes, signed integers, and unsigned
 * integers widened to their signed 64-bit representation.
 * <li>{@link FloatBoundViolation}: floating-point values.
 * </ul>
 */
public sealed interface BoundViolation extends ValidationError permits IntegerBoundViolation, FloatBoundViolation {

    /** Which check was violated. */
    enum Bound {
        LENGTH("length-mismatch"),
        MIN("below-minimum"),
        MAX("above-maximum");

        private final String code;

        Bound(String code) {
            this.code = code;
        }

        /** The error code reported for violations of this bound. */
        public String code() {
            return code;
        }

        /** {@code true} if {@code actual} violates this bound against {@code expected}. */
        public boolean violatedBy(long actual, long expected) {
            return switch (this) {
                case LENGTH -> actual != expected;
                case MIN -> actual < expected;
                case MAX -> actual > expected;
            };
        }

        /** Unsigned-space variant of {@link #violatedBy(long, long)}. Both operands hold 64 unsigned bits. */
        public boolean violatedByUnsigned(long actual, long expected) {
            int cmp = Long.compareUnsigned(actual, expected);
            return switch (this) {
                case LENGTH -> cmp != 0;
                case MIN -> cmp < 0;
                case MAX -> cmp > 0;
            };
        }

        /** IEEE 754 variant: a NaN operand only ever violates {@link #LENGTH}. */
        public boolean violatedBy(double actual, double expected) {
            return switch (this) {
                case LENGTH -> actual != expected;
                case MIN -> actual < expected;
                case MAX -> actual > expected;
            };
        }
    }

    /** The kind of value that was measured. Only affects message rendering. */
    enum Domain {
        STRING,
        COLLECTION,
        INTEGER,
        UNSIGNED,
        FLOAT
    }

    Bound bound();

    Domain domain();

    @Override
    default String code() {
        return bound().code();
    }

    @Override
    default Category category() {
        return Category.VALUE;
    }
}
