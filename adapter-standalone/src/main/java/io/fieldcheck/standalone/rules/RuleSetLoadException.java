package io.fieldcheck.standalone.rules;

import java.nio.file.Path;

/**
 * Thrown when a rule-set file cannot be loaded. Carries the file and, where
 * the failure is tied to one entry, the field path.
 */
public class RuleSetLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path source;
    private final String field;

    public RuleSetLoadException(String message, Path source, String field) {
        super(message);
        this.source = source;
        this.field = field;
    }

    public RuleSetLoadException(String message, Path source, String field, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.field = field;
    }

    /** The rule-set file being loaded. */
    public Path source() {
        return source;
    }

    /** The field path at fault, or {@code null} for file-level failures. */
    public String field() {
        return field;
    }
}
