package io.fieldcheck.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fieldcheck.core.error.RuleConfigurationException;
import io.fieldcheck.core.error.SentinelError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link ParameterCoercion}. */
@DisplayName("ParameterCoercion")
class ParameterCoercionTest {

    @Nested
    @DisplayName("Signed integers")
    class Signed {

        @ParameterizedTest(name = "\"{0}\" → {1}")
        @CsvSource({
            "0, 0",
            "42, 42",
            "+42, 42",
            "-42, -42",
            "0x1F, 31",
            "0X1f, 31",
            "-0x10, -16",
            "'#ff', 255",
            "0b101, 5",
            "0o17, 15",
            "017, 15",
            "1_000_000, 1000000",
            "0x_ff, 255",
            "9223372036854775807, 9223372036854775807",
            "-9223372036854775808, -9223372036854775808"
        })
        void parsesLiterals(String literal, long expected) {
            assertThat(ParameterCoercion.toSigned(literal)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "\"{0}\" is rejected")
        @ValueSource(
                strings = {
                    "",
                    " 1",
                    "1 ",
                    "abc",
                    "1.5",
                    "1e3",
                    "0x",
                    "0xg",
                    "09",
                    "0b12",
                    "_1",
                    "1_",
                    "1__0",
                    "--1",
                    "9223372036854775808",
                    "-9223372036854775809"
                })
        void rejectsMalformedLiterals(String literal) {
            assertThatThrownBy(() -> ParameterCoercion.toSigned(literal))
                    .isInstanceOf(RuleConfigurationException.class)
                    .satisfies(e -> assertThat(((RuleConfigurationException) e).error())
                            .isSameAs(SentinelError.BAD_PARAMETER));
        }

        @Test
        void rejectsNull() {
            assertThatThrownBy(() -> ParameterCoercion.toSigned(null)).isInstanceOf(RuleConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Unsigned integers")
    class Unsigned {

        @Test
        void parsesFullUnsignedRange() {
            assertThat(ParameterCoercion.toUnsigned("0")).isZero();
            assertThat(ParameterCoercion.toUnsigned("18446744073709551615")).isEqualTo(-1L);
            assertThat(ParameterCoercion.toUnsigned("0xFFFFFFFFFFFFFFFF")).isEqualTo(-1L);
            assertThat(ParameterCoercion.toUnsigned("9223372036854775808")).isEqualTo(Long.MIN_VALUE);
        }

        @ParameterizedTest(name = "\"{0}\" is rejected")
        @ValueSource(strings = {"-1", "+1", "18446744073709551616", "1.0", "x"})
        void rejectsSignsAndOverflow(String literal) {
            assertThatThrownBy(() -> ParameterCoercion.toUnsigned(literal))
                    .isInstanceOf(RuleConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Floats")
    class Floats {

        @ParameterizedTest(name = "\"{0}\" → {1}")
        @CsvSource({
            "1, 1.0",
            "-2.5, -2.5",
            ".5, 0.5",
            "5., 5.0",
            "1e3, 1000.0",
            "1.5E-3, 0.0015",
            "1_000.25, 1000.25",
            "0x1.8p1, 3.0",
            "0x1p-2, 0.25"
        })
        void parsesLiterals(String literal, double expected) {
            assertThat(ParameterCoercion.toFloating(literal)).isEqualTo(expected);
        }

        @Test
        void parsesSpecialValues() {
            assertThat(ParameterCoercion.toFloating("Infinity")).isEqualTo(Double.POSITIVE_INFINITY);
            assertThat(ParameterCoercion.toFloating("-inf")).isEqualTo(Double.NEGATIVE_INFINITY);
            assertThat(ParameterCoercion.toFloating("NaN")).isNaN();
        }

        @ParameterizedTest(name = "\"{0}\" is rejected")
        @ValueSource(strings = {"", "abc", "1.5d", "2f", " 1", "1e", "0x1.8", "1e400", "1..2", "."})
        void rejectsMalformedLiterals(String literal) {
            assertThatThrownBy(() -> ParameterCoercion.toFloating(literal))
                    .isInstanceOf(RuleConfigurationException.class);
        }
    }
}
