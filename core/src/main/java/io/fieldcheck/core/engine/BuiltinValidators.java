package io.fieldcheck.core.engine;

import io.fieldcheck.core.spi.Validator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed catalog of built-in rules, keyed by rule name. Each name maps to exactly one shared,
 * stateless validator instance.
 *
 * <table>
 * <caption>Built-in rules</caption>
 * <tr><th>Name</th><th>Validator</th></tr>
 * <tr><td>{@value #NONZERO}</td><td>{@link NonZeroValidator}</td></tr>
 * <tr><td>{@value #LEN}</td><td>{@link LengthValidator}</td></tr>
 * <tr><td>{@value #MIN}</td><td>{@link MinValidator}</td></tr>
 * <tr><td>{@value #MAX}</td><td>{@link MaxValidator}</td></tr>
 * <tr><td>{@value #REGEXP}</td><td>{@link PatternValidator}</td></tr>
 * </table>
 *
 * <p>The catalog is immutable; callers needing extra rules keep their own table.
 */
public final class BuiltinValidators {

    public static final String NONZERO = "nonzero";
    public static final String LEN = "len";
    public static final String MIN = "min";
    public static final String MAX = "max";
    public static final String REGEXP = "regexp";

    private static final Map<String, Validator> VALIDATORS;

    static {
        Map<String, Validator> validators = new LinkedHashMap<>();
        validators.put(NONZERO, new NonZeroValidator());
        validators.put(LEN, new LengthValidator());
        validators.put(MIN, new MinValidator());
        validators.put(MAX, new MaxValidator());
        validators.put(REGEXP, new PatternValidator());
        VALIDATORS = Collections.unmodifiableMap(validators);
    }

    private BuiltinValidators() {
        // utility class
    }

    /**
     * Looks up a validator by rule name.
     *
     * @param name the rule name (e.g. "min")
     * @return the validator, or empty if no built-in rule has this name
     */
    public static Optional<Validator> lookup(String name) {
        return Optional.ofNullable(name == null ? null : VALIDATORS.get(name));
    }

    /**
     * Looks up a validator by rule name, throwing if not found.
     *
     * @param name the rule name
     * @return the validator
     * @throws IllegalArgumentException if no built-in rule has this name
     */
    public static Validator require(String name) {
        return lookup(name)
                .orElseThrow(() -> new IllegalArgumentException("No built-in validation rule named: '" + name + "'"));
    }

    /** Returns {@code true} if a built-in rule has this name. */
    public static boolean has(String name) {
        return name != null && VALIDATORS.containsKey(name);
    }

    /** The rule names in catalog order. */
    public static Set<String> names() {
        return VALIDATORS.keySet();
    }

    /** An unmodifiable name → validator view in catalog order. */
    public static Map<String, Validator> asMap() {
        return VALIDATORS;
    }

    public static Validator nonzero() {
        return VALIDATORS.get(NONZERO);
    }

    public static Validator len() {
        return VALIDATORS.get(LEN);
    }

    public static Validator min() {
        return VALIDATORS.get(MIN);
    }

    public static Validator max() {
        return VALIDATORS.get(MAX);
    }

    public static Validator regexp() {
        return VALIDATORS.get(REGEXP);
    }
}
