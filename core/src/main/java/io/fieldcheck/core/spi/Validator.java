package io.fieldcheck.core.spi;

import io.fieldcheck.core.model.ValidationResult;
import io.fieldcheck.core.model.Value;
import io.fieldcheck.core.model.Values;

/**
 * Uniform contract implemented by every validation rule. Callers hold validators in a lookup table
 * keyed by rule name (see {@code BuiltinValidators}) and invoke them once per (value, rule) pair.
 *
 * <p>Implementations MUST be stateless and thread-safe, MUST NOT mutate the value, and MUST report
 * every failure as an INVALID result rather than throwing.
 */
@FunctionalInterface
public interface Validator {

    /**
     * Evaluates the rule against {@code value}.
     *
     * @param value     the classified value, never {@code null}
     * @param parameter the rule parameter as written, e.g. {@code "10"} for {@code min=10}; may be
     *                  empty or {@code null} for rules that take none
     * @return VALID, or INVALID with exactly one error
     */
    ValidationResult validate(Value value, String parameter);

    /** Classifies {@code raw} with {@link Values#of(Object)} and validates it. */
    default ValidationResult validateObject(Object raw, String parameter) {
        return validate(Values.of(raw), parameter);
    }
}
