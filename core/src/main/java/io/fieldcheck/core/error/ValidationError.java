package io.fieldcheck.core.error;

/**
 * A single validation failure. The set of implementations is closed: sentinel errors without a
 * payload ({@link SentinelError}), bound and length violations carrying the expected and actual
 * values ({@link BoundViolation}), and regular-expression mismatches ({@link PatternMismatch}).
 *
 * <p>All implementations are immutable and safe to share between threads.
 */
public sealed interface ValidationError permits SentinelError, BoundViolation, PatternMismatch {

    /** Prefix of every error URN. */
    String URN_PREFIX = "urn:fieldcheck:error:";

    /** Who is at fault when this error is produced. */
    enum Category {
        /** The rule is misapplied to the value or its parameter is malformed. */
        CONFIGURATION,
        /** The value itself does not satisfy the rule. */
        VALUE
    }

    /** Stable kebab-case code, e.g. {@code "below-minimum"}. */
    String code();

    /** Human-readable description of the failure. */
    String message();

    /** Whether this error reports a rule setup problem or an invalid value. */
    Category category();

    /** The error type URN, e.g. {@code urn:fieldcheck:error:below-minimum}. */
    default String urn() {
        return URN_PREFIX + code();
    }

    /** {@code true} if this error signals a rule setup problem rather than an invalid value. */
    default boolean isConfigurationError() {
        return category() == Category.CONFIGURATION;
    }
}
