package io.fieldcheck.core.error;

import java.util.Objects;

/**
 * A string value did not match a regular expression.
 *
 * @param pattern the pattern text as given in the rule parameter
 */
public record PatternMismatch(String pattern) implements ValidationError {

    public static final String CODE = "pattern-mismatch";

    public PatternMismatch {
        Objects.requireNonNull(pattern, "pattern must not be null");
    }

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public String message() {
        return "regular expression mismatch: value does not match /" + pattern + "/";
    }

    @Override
    public Category category() {
        return Category.VALUE;
    }
}
