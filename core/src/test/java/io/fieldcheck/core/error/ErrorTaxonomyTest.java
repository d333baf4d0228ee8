package io.fieldcheck.core.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fieldcheck.core.error.BoundViolation.Bound;
import io.fieldcheck.core.error.BoundViolation.Domain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the closed error taxonomy: codes, categories, URNs and rendered messages. */
@DisplayName("Error taxonomy")
class ErrorTaxonomyTest {

    @Nested
    @DisplayName("Sentinel errors")
    class Sentinels {

        @Test
        void configurationSentinelsAreBadParameterAndUnsupportedType() {
            assertThat(SentinelError.BAD_PARAMETER.category()).isEqualTo(ValidationError.Category.CONFIGURATION);
            assertThat(SentinelError.UNSUPPORTED_TYPE.category()).isEqualTo(ValidationError.Category.CONFIGURATION);
            assertThat(SentinelError.BAD_PARAMETER.isConfigurationError()).isTrue();
        }

        @Test
        void zeroValueVariantsAreValueErrors() {
            assertThat(SentinelError.ZERO_VALUE.category()).isEqualTo(ValidationError.Category.VALUE);
            assertThat(SentinelError.ZERO_VALUE_EMPTY.category()).isEqualTo(ValidationError.Category.VALUE);
            assertThat(SentinelError.ZERO_VALUE_NUMBER.category()).isEqualTo(ValidationError.Category.VALUE);
            assertThat(SentinelError.ZERO_VALUE_BOOLEAN.category()).isEqualTo(ValidationError.Category.VALUE);
        }

        @Test
        void zeroValueVariantsAreDistinct() {
            assertThat(SentinelError.ZERO_VALUE_NUMBER).isNotEqualTo(SentinelError.ZERO_VALUE_BOOLEAN);
            assertThat(SentinelError.ZERO_VALUE_EMPTY.code()).isEqualTo("zero-value-empty");
            assertThat(SentinelError.ZERO_VALUE_NUMBER.code()).isEqualTo("zero-value-number");
        }

        @Test
        void urnIsPrefixedCode() {
            assertThat(SentinelError.BAD_PARAMETER.urn()).isEqualTo("urn:fieldcheck:error:bad-parameter");
            assertThat(SentinelError.UNSUPPORTED_TYPE.message()).isEqualTo("unsupported type");
        }
    }

    @Nested
    @DisplayName("Bound violations")
    class BoundViolations {

        @Test
        void codeFollowsBound() {
            assertThat(new IntegerBoundViolation(Bound.LENGTH, Domain.COLLECTION, 2, 3).code())
                    .isEqualTo("length-mismatch");
            assertThat(new IntegerBoundViolation(Bound.MIN, Domain.INTEGER, 10, 5).code())
                    .isEqualTo("below-minimum");
            assertThat(new FloatBoundViolation(Bound.MAX, 1.5, 2.5).code()).isEqualTo("above-maximum");
        }

        @Test
        void allDomainsShareTheGeneralClass() {
            ValidationError string = new IntegerBoundViolation(Bound.MIN, Domain.STRING, 3, 1);
            ValidationError floating = new FloatBoundViolation(Bound.MIN, 3.0, 1.0);

            assertThat(string).isInstanceOf(BoundViolation.class);
            assertThat(floating).isInstanceOf(BoundViolation.class);
            assertThat(string.category()).isEqualTo(ValidationError.Category.VALUE);
            assertThat(((BoundViolation) floating).domain()).isEqualTo(Domain.FLOAT);
        }

        @Test
        void messagesCarryExpectedAndActual() {
            assertThat(new IntegerBoundViolation(Bound.LENGTH, Domain.STRING, 5, 3).message())
                    .isEqualTo("invalid length: expected 5 characters, got 3");
            assertThat(new IntegerBoundViolation(Bound.LENGTH, Domain.COLLECTION, 2, 3).message())
                    .isEqualTo("invalid length: expected 2 elements, got 3");
            assertThat(new IntegerBoundViolation(Bound.MIN, Domain.INTEGER, 10, 5).message())
                    .isEqualTo("less than min: expected at least 10, got 5");
            assertThat(new FloatBoundViolation(Bound.MAX, 1.5, 2.25).message())
                    .isEqualTo("greater than max: expected at most 1.5, got 2.25");
        }

        @Test
        void unsignedOperandsAreReportedWidenedToSigned() {
            var error = new IntegerBoundViolation(Bound.MAX, Domain.UNSIGNED, 0, -1L);

            assertThat(error.actual()).isEqualTo(-1L);
            assertThat(error.message()).isEqualTo("greater than max: expected at most 0, got -1");
        }

        @Test
        void integerViolationRejectsFloatDomain() {
            assertThatThrownBy(() -> new IntegerBoundViolation(Bound.MIN, Domain.FLOAT, 1, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void equalViolationsAreEqual() {
            assertThat(new IntegerBoundViolation(Bound.LENGTH, Domain.COLLECTION, 2, 3))
                    .isEqualTo(new IntegerBoundViolation(Bound.LENGTH, Domain.COLLECTION, 2, 3));
        }
    }

    @Nested
    @DisplayName("Bound comparisons")
    class BoundComparisons {

        @Test
        void boundaryEqualitySatisfiesEveryBound() {
            for (Bound bound : Bound.values()) {
                assertThat(bound.violatedBy(7L, 7L)).as("%s with equal operands", bound).isFalse();
                assertThat(bound.violatedByUnsigned(-1L, -1L)).isFalse();
                assertThat(bound.violatedBy(1.5, 1.5)).isFalse();
            }
        }

        @Test
        void unsignedComparisonDoesNotOverflow() {
            // -1L holds 2^64-1
            assertThat(Bound.MIN.violatedByUnsigned(-1L, 0L)).isFalse();
            assertThat(Bound.MAX.violatedByUnsigned(-1L, 0L)).isTrue();
            assertThat(Bound.MIN.violatedBy(-1L, 0L)).isTrue();
        }

        @Test
        void nanOnlyViolatesLength() {
            assertThat(Bound.LENGTH.violatedBy(Double.NaN, 1.0)).isTrue();
            assertThat(Bound.MIN.violatedBy(Double.NaN, 1.0)).isFalse();
            assertThat(Bound.MAX.violatedBy(Double.NaN, 1.0)).isFalse();
        }
    }

    @Test
    void patternMismatchCarriesPattern() {
        var error = new PatternMismatch("^[a-z]+$");

        assertThat(error.pattern()).isEqualTo("^[a-z]+$");
        assertThat(error.code()).isEqualTo("pattern-mismatch");
        assertThat(error.message()).contains("^[a-z]+$");
        assertThat(error.category()).isEqualTo(ValidationError.Category.VALUE);
    }
}
