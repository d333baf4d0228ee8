package io.fieldcheck.standalone.rules;

import io.fieldcheck.core.engine.BuiltinValidators;
import io.fieldcheck.core.error.ValidationError;
import io.fieldcheck.core.model.ValidationResult;
import io.fieldcheck.core.model.Value;
import io.fieldcheck.core.spi.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered list of rules parsed from an expression such as
 * {@code nonzero,min=3,max=40,regexp=^[a-z]+$}.
 *
 * <p>
 * Grammar:
 * <ul>
 * <li>rules are separated by unescaped commas; {@code \,} is a literal comma
 * and {@code \\} a literal backslash. Any other backslash is kept as written,
 * so regular-expression escapes such as {@code \d} need no doubling</li>
 * <li>each rule is {@code name} or {@code name=parameter}, split at the first
 * {@code '='}</li>
 * <li>whitespace around the name is trimmed; the parameter is kept verbatim</li>
 * </ul>
 *
 * <p>
 * Immutable and thread-safe once parsed.
 */
public final class RuleChain {

    private static final RuleChain EMPTY = new RuleChain("", List.of());

    private final String expression;
    private final List<Rule> rules;

    private RuleChain(String expression, List<Rule> rules) {
        this.expression = expression;
        this.rules = rules;
    }

    /**
     * Parses an expression against the built-in rule catalog.
     *
     * @param expression the rule expression; blank yields an empty chain
     * @return the parsed chain
     * @throws RuleSyntaxException if a rule name is empty or unknown
     */
    public static RuleChain parse(String expression) {
        return parse(expression, BuiltinValidators.asMap());
    }

    /**
     * Parses an expression against a caller-supplied rule table.
     *
     * @param expression the rule expression; blank yields an empty chain
     * @param registry   rule name to validator
     * @return the parsed chain
     * @throws RuleSyntaxException if a rule name is empty or not in {@code registry}
     */
    public static RuleChain parse(String expression, Map<String, Validator> registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        if (expression == null || expression.isBlank()) {
            return EMPTY;
        }

        List<Rule> rules = new ArrayList<>();
        for (String segment : split(expression)) {
            int eq = segment.indexOf('=');
            String name = (eq < 0 ? segment : segment.substring(0, eq)).trim();
            String parameter = eq < 0 ? null : segment.substring(eq + 1);
            if (name.isEmpty()) {
                throw new RuleSyntaxException(
                        "Empty rule name in expression '" + expression + "'", expression, segment);
            }
            Validator validator = registry.get(name);
            if (validator == null) {
                throw new RuleSyntaxException(
                        "Unknown rule '" + name + "' in expression '" + expression + "'", expression, segment);
            }
            rules.add(new Rule(name, parameter, validator));
        }
        return new RuleChain(expression, List.copyOf(rules));
    }

    /** Splits at unescaped commas, resolving {@code \,} and {@code \\}. */
    private static List<String> split(String expression) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '\\' && i + 1 < expression.length()) {
                char next = expression.charAt(i + 1);
                if (next == ',' || next == '\\') {
                    current.append(next);
                    i++;
                    continue;
                }
            }
            if (c == ',') {
                segments.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        segments.add(current.toString());
        return segments;
    }

    /** Runs every rule and collects all errors. */
    public List<ValidationError> validate(Value value) {
        return validate(value, false);
    }

    /**
     * Runs the rules in order against {@code value}.
     *
     * @param value    the classified value
     * @param failFast stop after the first failing rule
     * @return the errors in rule order; empty if every rule passed
     */
    public List<ValidationError> validate(Value value, boolean failFast) {
        Objects.requireNonNull(value, "value must not be null");
        List<ValidationError> errors = new ArrayList<>();
        for (Rule rule : rules) {
            ValidationResult result = rule.apply(value);
            if (result.isInvalid()) {
                errors.add(result.error());
                if (failFast) {
                    break;
                }
            }
        }
        return errors;
    }

    /** The rules in evaluation order. */
    public List<Rule> rules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /** The expression this chain was parsed from. */
    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return "RuleChain[" + expression + "]";
    }
}
