package io.fieldcheck.core.engine;

import io.fieldcheck.core.error.BoundViolation.Bound;

/**
 * The {@code len} rule: a value's size must equal the parameter exactly. For strings the size is
 * the number of code points, for collections the number of elements, and for numbers the value
 * itself. A mismatch yields a {@code length-mismatch} error.
 */
public final class LengthValidator extends BoundValidator {

    public LengthValidator() {
        super(Bound.LENGTH, BuiltinValidators.LEN);
    }
}
