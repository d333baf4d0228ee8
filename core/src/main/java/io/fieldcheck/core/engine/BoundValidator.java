package io.fieldcheck.core.engine;

import io.fieldcheck.core.error.BoundViolation.Bound;
import io.fieldcheck.core.error.BoundViolation.Domain;
import io.fieldcheck.core.error.FloatBoundViolation;
import io.fieldcheck.core.error.IntegerBoundViolation;
import io.fieldcheck.core.error.RuleConfigurationException;
import io.fieldcheck.core.error.SentinelError;
import io.fieldcheck.core.model.ValidationResult;
import io.fieldcheck.core.model.Value;
import io.fieldcheck.core.spi.Validator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared evaluation for the size and bound rules ({@code len}, {@code min}, {@code max}). A value's
 * measure depends on its kind:
 *
 * <ul>
 * <li>text: its code-point count, parameter read as a signed integer
 * <li>sequence, mapping, array: its element count, parameter read as a signed integer
 * <li>signed integer: the value itself, parameter read as a signed integer
 * <li>unsigned integer: the value itself, parameter read as an unsigned integer and compared in
 * unsigned space
 * <li>floating point: the value itself, parameter read as a float
 * </ul>
 *
 * <p>References always pass: these rules never dereference. Booleans, records, absent and
 * unsupported values fail with {@code UNSUPPORTED_TYPE} without reading the parameter.
 */
public abstract class BoundValidator implements Validator {

    private static final Logger LOG = LoggerFactory.getLogger(BoundValidator.class);

    private final Bound bound;
    private final String ruleName;

    protected BoundValidator(Bound bound, String ruleName) {
        this.bound = Objects.requireNonNull(bound, "bound must not be null");
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName must not be null");
    }

    /** The check this validator applies. */
    public final Bound bound() {
        return bound;
    }

    @Override
    public final ValidationResult validate(Value value, String parameter) {
        Objects.requireNonNull(value, "value must not be null");
        try {
            return switch (value.kind()) {
                case TEXT -> checkSize(Domain.STRING, ((Value.Text) value).codePointCount(), parameter);
                case SEQUENCE -> checkSize(Domain.COLLECTION, ((Value.Sequence) value).size(), parameter);
                case MAPPING -> checkSize(Domain.COLLECTION, ((Value.Mapping) value).size(), parameter);
                case ARRAY -> checkSize(Domain.COLLECTION, ((Value.FixedArray) value).size(), parameter);
                case SIGNED -> checkSigned(((Value.Signed) value).value(), parameter);
                case UNSIGNED -> checkUnsigned(((Value.Unsigned) value).bits(), parameter);
                case FLOATING -> checkFloating(((Value.Floating) value).value(), parameter);
                case REFERENCE -> ValidationResult.valid();
                case BOOLEAN, RECORD, ABSENT, UNSUPPORTED -> unsupported(value);
            };
        } catch (RuleConfigurationException e) {
            LOG.debug("Rule '{}' rejected its parameter for a {} value: {}", ruleName, value.kind(), e.getMessage());
            return ValidationResult.invalid(e.error());
        }
    }

    private ValidationResult checkSize(Domain domain, int size, String parameter) {
        long expected = ParameterCoercion.toSigned(parameter);
        if (bound.violatedBy(size, expected)) {
            return ValidationResult.invalid(new IntegerBoundViolation(bound, domain, expected, size));
        }
        return ValidationResult.valid();
    }

    private ValidationResult checkSigned(long actual, String parameter) {
        long expected = ParameterCoercion.toSigned(parameter);
        if (bound.violatedBy(actual, expected)) {
            return ValidationResult.invalid(new IntegerBoundViolation(bound, Domain.INTEGER, expected, actual));
        }
        return ValidationResult.valid();
    }

    private ValidationResult checkUnsigned(long actualBits, String parameter) {
        long expectedBits = ParameterCoercion.toUnsigned(parameter);
        if (bound.violatedByUnsigned(actualBits, expectedBits)) {
            return ValidationResult.invalid(
                    new IntegerBoundViolation(bound, Domain.UNSIGNED, expectedBits, actualBits));
        }
        return ValidationResult.valid();
    }

    private ValidationResult checkFloating(double actual, String parameter) {
        double expected = ParameterCoercion.toFloating(parameter);
        if (bound.violatedBy(actual, expected)) {
            return ValidationResult.invalid(new FloatBoundViolation(bound, expected, actual));
        }
        return ValidationResult.valid();
    }

    private ValidationResult unsupported(Value value) {
        LOG.debug("Rule '{}' does not apply to {} values", ruleName, value.kind());
        return ValidationResult.invalid(SentinelError.UNSUPPORTED_TYPE);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + ruleName + "]";
    }
}
