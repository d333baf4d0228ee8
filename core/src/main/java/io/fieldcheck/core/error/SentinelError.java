package io.fieldcheck.core.error;

/** Payload-free validation errors. Each constant is a shared singleton. */
public enum SentinelError implements ValidationError {

    /** An absent value (Java {@code null}, JSON null or a missing field). */
    ZERO_VALUE("zero-value", "zero value", Category.VALUE),

    /** An empty string, collection, array or a null reference. */
    ZERO_VALUE_EMPTY("zero-value-empty", "empty value", Category.VALUE),

    /** A numeric value equal to zero. */
    ZERO_VALUE_NUMBER("zero-value-number", "zero numeric value", Category.VALUE),

    /** A boolean value equal to {@code false}. */
    ZERO_VALUE_BOOLEAN("zero-value-boolean", "boolean value is false", Category.VALUE),

    /** The rule parameter could not be coerced to the type the rule needs. */
    BAD_PARAMETER("bad-parameter", "bad parameter", Category.CONFIGURATION),

    /** The rule does not apply to values of this kind. */
    UNSUPPORTED_TYPE("unsupported-type", "unsupported type", Category.CONFIGURATION);

    private final String code;
    private final String message;
    private final Category category;

    SentinelError(String code, String message, Category category) {
        this.code = code;
        this.message = message;
        this.category = category;
    }

    @Override
    public String code() {
        return code;
    }

    @Override
    public String message() {
        return message;
    }

    @Override
    public Category category() {
        return category;
    }
}
