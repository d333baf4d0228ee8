package io.fieldcheck.standalone.report;

import io.fieldcheck.core.error.ValidationError;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of validating one document against a rule set: the failing fields,
 * in rule-set order, each with its errors in rule order. Fields that passed
 * are not listed.
 *
 * <p>
 * Immutable.
 */
public final class ValidationReport {

    private final String ruleSetId;
    private final Map<String, List<ValidationError>> failures;

    private ValidationReport(String ruleSetId, Map<String, List<ValidationError>> failures) {
        this.ruleSetId = ruleSetId;
        this.failures = failures;
    }

    public static Builder builder(String ruleSetId) {
        return new Builder(ruleSetId);
    }

    /** Id of the rule set that produced this report. */
    public String ruleSetId() {
        return ruleSetId;
    }

    /** Failing field path to its errors, in rule-set order. */
    public Map<String, List<ValidationError>> failures() {
        return failures;
    }

    /** Errors recorded for {@code field}; empty if it passed or is not in the rule set. */
    public List<ValidationError> errorsFor(String field) {
        return failures.getOrDefault(field, List.of());
    }

    public boolean isValid() {
        return failures.isEmpty();
    }

    /** Number of fields with at least one error. */
    public int failedFieldCount() {
        return failures.size();
    }

    /** Total number of errors across all fields. */
    public int errorCount() {
        return failures.values().stream().mapToInt(List::size).sum();
    }

    /**
     * {@code true} if any error is a rule misapplication (bad parameter or
     * unsupported type) rather than a rejected value.
     */
    public boolean hasConfigurationErrors() {
        return failures.values().stream()
                .flatMap(List::stream)
                .anyMatch(ValidationError::isConfigurationError);
    }

    @Override
    public String toString() {
        return "ValidationReport[ruleSet=" + ruleSetId + ", failedFields=" + failures.keySet() + "]";
    }

    /** Accumulates failures in insertion order. */
    public static final class Builder {
        private final String ruleSetId;
        private final Map<String, List<ValidationError>> failures = new LinkedHashMap<>();

        Builder(String ruleSetId) {
            this.ruleSetId = Objects.requireNonNull(ruleSetId, "ruleSetId must not be null");
        }

        /** Records the errors of one field; an empty list is ignored. */
        public Builder field(String field, List<ValidationError> errors) {
            Objects.requireNonNull(field, "field must not be null");
            if (!errors.isEmpty()) {
                failures.put(field, List.copyOf(errors));
            }
            return this;
        }

        public ValidationReport build() {
            return new ValidationReport(ruleSetId, Collections.unmodifiableMap(new LinkedHashMap<>(failures)));
        }
    }
}
