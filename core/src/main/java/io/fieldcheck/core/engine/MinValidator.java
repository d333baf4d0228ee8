package io.fieldcheck.core.engine;

import io.fieldcheck.core.error.BoundViolation.Bound;

/**
 * The {@code min} rule: a number must be at least the parameter, and a string or collection must
 * have at least that many code points or elements. A violation yields a {@code below-minimum}
 * error.
 */
public final class MinValidator extends BoundValidator {

    public MinValidator() {
        super(Bound.MIN, BuiltinValidators.MIN);
    }
}
