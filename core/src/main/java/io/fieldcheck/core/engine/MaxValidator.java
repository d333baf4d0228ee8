package io.fieldcheck.core.engine;

import io.fieldcheck.core.error.BoundViolation.Bound;

/** The {@code max} rule, symmetric to {@link MinValidator}. Violations yield {@code above-maximum}. */
public final class MaxValidator extends BoundValidator {

    public MaxValidator() {
        super(Bound.MAX, BuiltinValidators.MAX);
    }
}
