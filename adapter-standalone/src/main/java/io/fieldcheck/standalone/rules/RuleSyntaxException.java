package io.fieldcheck.standalone.rules;

/**
 * Thrown when a rule expression cannot be parsed: an empty rule name, or a
 * name with no registered validator.
 */
public class RuleSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String expression;
    private final String rule;

    public RuleSyntaxException(String message, String expression, String rule) {
        super(message);
        this.expression = expression;
        this.rule = rule;
    }

    /** The full expression being parsed. */
    public String expression() {
        return expression;
    }

    /** The offending rule segment as written. */
    public String rule() {
        return rule;
    }
}
