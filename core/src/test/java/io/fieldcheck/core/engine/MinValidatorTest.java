package io.fieldcheck.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.fieldcheck.core.error.BoundViolation;
import io.fieldcheck.core.error.BoundViolation.Bound;
import io.fieldcheck.core.error.BoundViolation.Domain;
import io.fieldcheck.core.error.FloatBoundViolation;
import io.fieldcheck.core.error.IntegerBoundViolation;
import io.fieldcheck.core.error.SentinelError;
import io.fieldcheck.core.model.Values;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link MinValidator}. */
@DisplayName("min")
class MinValidatorTest {

    private final MinValidator validator = new MinValidator();

    @Test
    void integerBelowMinimumFails() {
        assertThat(validator.validateObject(5, "10").error())
                .isEqualTo(new IntegerBoundViolation(Bound.MIN, Domain.INTEGER, 10, 5));
    }

    @Test
    void integerAtOrAboveMinimumPasses() {
        assertThat(validator.validateObject(15, "10").isValid()).isTrue();
        assertThat(validator.validateObject(10, "10").isValid()).isTrue();
    }

    @Test
    void stringsCompareCodePointCount() {
        assertThat(validator.validateObject("ab", "3").error())
                .isEqualTo(new IntegerBoundViolation(Bound.MIN, Domain.STRING, 3, 2));
        assertThat(validator.validateObject("😀😀😀", "3").isValid()).isTrue();
    }

    @Test
    void collectionsCompareElementCount() {
        assertThat(validator.validateObject(List.of(), "1").error())
                .isEqualTo(new IntegerBoundViolation(Bound.MIN, Domain.COLLECTION, 1, 0));
        assertThat(validator.validateObject(new int[3], "-1").isValid()).isTrue();
    }

    @Test
    void unsignedMaxIsAboveZero() {
        assertThat(validator.validate(Values.unsigned(-1L), "0").isValid()).isTrue();
        assertThat(validator.validate(Values.unsigned(1), "0xFFFFFFFFFFFFFFFF").error())
                .isEqualTo(new IntegerBoundViolation(Bound.MIN, Domain.UNSIGNED, -1L, 1));
    }

    @Test
    void floats() {
        assertThat(validator.validateObject(0.5, "1").error()).isEqualTo(new FloatBoundViolation(Bound.MIN, 1.0, 0.5));
        assertThat(validator.validateObject(1.0f, "1e0").isValid()).isTrue();
        assertThat(validator.validateObject(Double.NEGATIVE_INFINITY, "-Infinity").isValid()).isTrue();
    }

    @Test
    void violationIsABoundViolation() {
        assertThat(validator.validateObject(1, "2").error()).isInstanceOf(BoundViolation.class);
    }

    @Test
    void referencesPassRegardlessOfParameter() {
        assertThat(validator.validateObject(Optional.empty(), "100").isValid()).isTrue();
        assertThat(validator.validateObject(Optional.of(1), "not-a-number").isValid()).isTrue();
    }

    @Test
    void badParameterForEveryCoercingKind() {
        for (Object value : List.of("text", List.of(1), 3, 2.5)) {
            assertThat(validator.validateObject(value, "ten").error())
                    .as("value %s", value)
                    .isSameAs(SentinelError.BAD_PARAMETER);
        }
        assertThat(validator.validate(Values.unsigned(3), "ten").error()).isSameAs(SentinelError.BAD_PARAMETER);
    }
}
