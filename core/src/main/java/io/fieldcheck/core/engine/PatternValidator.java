package io.fieldcheck.core.engine;

import io.fieldcheck.core.error.PatternMismatch;
import io.fieldcheck.core.error.SentinelError;
import io.fieldcheck.core.model.ValidationResult;
import io.fieldcheck.core.model.Value;
import io.fieldcheck.core.spi.Validator;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code regexp} rule: a string value must contain a match of the parameter, compiled as a
 * {@link Pattern}. Use {@code ^...$} anchors to require a full match.
 *
 * <p>Non-text values fail with {@code UNSUPPORTED_TYPE} before the pattern is compiled; a pattern
 * that does not compile fails with {@code BAD_PARAMETER}. The pattern is compiled on every call;
 * callers validating many values against one pattern may cache a {@link Pattern} themselves.
 */
public final class PatternValidator implements Validator {

    private static final Logger LOG = LoggerFactory.getLogger(PatternValidator.class);

    @Override
    public ValidationResult validate(Value value, String parameter) {
        Objects.requireNonNull(value, "value must not be null");
        if (!(value instanceof Value.Text text)) {
            LOG.debug("Rule '{}' does not apply to {} values", BuiltinValidators.REGEXP, value.kind());
            return ValidationResult.invalid(SentinelError.UNSUPPORTED_TYPE);
        }
        if (parameter == null) {
            LOG.debug("Rule '{}' has no pattern", BuiltinValidators.REGEXP);
            return ValidationResult.invalid(SentinelError.BAD_PARAMETER);
        }

        Pattern pattern;
        try {
            pattern = Pattern.compile(parameter);
        } catch (PatternSyntaxException e) {
            LOG.debug("Rule '{}' has an invalid pattern: {}", BuiltinValidators.REGEXP, e.getDescription());
            return ValidationResult.invalid(SentinelError.BAD_PARAMETER);
        }

        if (!pattern.matcher(text.text()).find()) {
            return ValidationResult.invalid(new PatternMismatch(parameter));
        }
        return ValidationResult.valid();
    }

    @Override
    public String toString() {
        return "PatternValidator[" + BuiltinValidators.REGEXP + "]";
    }
}
