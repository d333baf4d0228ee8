package io.fieldcheck.core.engine;

import io.fieldcheck.core.error.SentinelError;
import io.fieldcheck.core.model.ValidationResult;
import io.fieldcheck.core.model.Value;
import io.fieldcheck.core.spi.Validator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code nonzero} rule: the value must not be the zero value of its kind.
 *
 * <ul>
 * <li>empty text, empty collection or array, null reference → {@code ZERO_VALUE_EMPTY}
 * <li>numeric zero (signed, unsigned or floating, including {@code -0.0}) → {@code
 * ZERO_VALUE_NUMBER}
 * <li>{@code false} → {@code ZERO_VALUE_BOOLEAN}
 * <li>absent → {@code ZERO_VALUE}
 * <li>records always pass; unsupported values → {@code UNSUPPORTED_TYPE}
 * </ul>
 *
 * <p>The parameter is ignored.
 */
public final class NonZeroValidator implements Validator {

    private static final Logger LOG = LoggerFactory.getLogger(NonZeroValidator.class);

    @Override
    public ValidationResult validate(Value value, String parameter) {
        Objects.requireNonNull(value, "value must not be null");
        return switch (value.kind()) {
            case TEXT -> failIf(((Value.Text) value).text().isEmpty(), SentinelError.ZERO_VALUE_EMPTY);
            case SEQUENCE -> failIf(((Value.Sequence) value).size() == 0, SentinelError.ZERO_VALUE_EMPTY);
            case MAPPING -> failIf(((Value.Mapping) value).size() == 0, SentinelError.ZERO_VALUE_EMPTY);
            case ARRAY -> failIf(((Value.FixedArray) value).size() == 0, SentinelError.ZERO_VALUE_EMPTY);
            case REFERENCE -> failIf(((Value.Reference) value).isNull(), SentinelError.ZERO_VALUE_EMPTY);
            case SIGNED -> failIf(((Value.Signed) value).value() == 0L, SentinelError.ZERO_VALUE_NUMBER);
            case UNSIGNED -> failIf(((Value.Unsigned) value).bits() == 0L, SentinelError.ZERO_VALUE_NUMBER);
            case FLOATING -> failIf(((Value.Floating) value).value() == 0.0, SentinelError.ZERO_VALUE_NUMBER);
            case BOOLEAN -> failIf(!((Value.Bool) value).value(), SentinelError.ZERO_VALUE_BOOLEAN);
            case ABSENT -> ValidationResult.invalid(SentinelError.ZERO_VALUE);
            case RECORD -> ValidationResult.valid();
            case UNSUPPORTED -> {
                LOG.debug("Rule '{}' does not apply to {} values", BuiltinValidators.NONZERO, value.kind());
                yield ValidationResult.invalid(SentinelError.UNSUPPORTED_TYPE);
            }
        };
    }

    private static ValidationResult failIf(boolean zero, SentinelError error) {
        return zero ? ValidationResult.invalid(error) : ValidationResult.valid();
    }

    @Override
    public String toString() {
        return "NonZeroValidator[" + BuiltinValidators.NONZERO + "]";
    }
}
