package io.fieldcheck.standalone.rules;

import io.fieldcheck.core.model.ValidationResult;
import io.fieldcheck.core.model.Value;
import io.fieldcheck.core.spi.Validator;
import java.util.Objects;

/**
 * One parsed rule: a name bound to its validator and parameter.
 *
 * @param name      rule name as registered, e.g. {@code "min"}
 * @param parameter text after the first {@code '='}, or {@code null} if the
 *                  rule was written without one
 * @param validator the validator the name resolved to
 */
public record Rule(String name, String parameter, Validator validator) {

    public Rule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(validator, "validator must not be null");
    }

    /** Runs the validator against {@code value} with this rule's parameter. */
    public ValidationResult apply(Value value) {
        return validator.validate(value, parameter);
    }

    /** The rule as it would be written in an expression, without escaping. */
    @Override
    public String toString() {
        return parameter == null ? name : name + "=" + parameter;
    }
}
