package io.fieldcheck.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.fieldcheck.core.error.BoundViolation.Bound;
import io.fieldcheck.core.error.BoundViolation.Domain;
import io.fieldcheck.core.error.FloatBoundViolation;
import io.fieldcheck.core.error.IntegerBoundViolation;
import io.fieldcheck.core.error.SentinelError;
import io.fieldcheck.core.model.Values;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link MaxValidator}. */
@DisplayName("max")
class MaxValidatorTest {

    private final MaxValidator validator = new MaxValidator();

    @Test
    void integerAboveMaximumFails() {
        assertThat(validator.validateObject(11, "10").error())
                .isEqualTo(new IntegerBoundViolation(Bound.MAX, Domain.INTEGER, 10, 11));
        assertThat(validator.validateObject(10, "10").isValid()).isTrue();
        assertThat(validator.validateObject(Long.MIN_VALUE, "0").isValid()).isTrue();
    }

    @Test
    void stringsCompareCodePointCount() {
        assertThat(validator.validateObject("héllo", "5").isValid()).isTrue();
        assertThat(validator.validateObject("héllo!", "5").error())
                .isEqualTo(new IntegerBoundViolation(Bound.MAX, Domain.STRING, 5, 6));
    }

    @Test
    void mappingsCompareEntryCount() {
        assertThat(validator.validateObject(Map.of("a", 1, "b", 2), "1").error())
                .isEqualTo(new IntegerBoundViolation(Bound.MAX, Domain.COLLECTION, 1, 2));
    }

    @Test
    void unsignedMaxIsAboveZero() {
        assertThat(validator.validate(Values.unsigned(-1L), "0").error())
                .isEqualTo(new IntegerBoundViolation(Bound.MAX, Domain.UNSIGNED, 0, -1L));
        assertThat(validator.validate(Values.unsigned(-1L), "18446744073709551615").isValid())
                .isTrue();
    }

    @Test
    void floats() {
        assertThat(validator.validateObject(2.5, "2").error()).isEqualTo(new FloatBoundViolation(Bound.MAX, 2.0, 2.5));
        assertThat(validator.validateObject(Double.NaN, "0").isValid()).isTrue();
    }

    @Test
    void referencesPass() {
        assertThat(validator.validateObject(Optional.of("a long string"), "0").isValid()).isTrue();
    }

    @Test
    void unsupportedAndBadParameter() {
        assertThat(validator.validateObject(false, "1").error()).isSameAs(SentinelError.UNSUPPORTED_TYPE);
        assertThat(validator.validateObject("abc", "").error()).isSameAs(SentinelError.BAD_PARAMETER);
        assertThat(validator.validateObject("abc", null).error()).isSameAs(SentinelError.BAD_PARAMETER);
    }
}
