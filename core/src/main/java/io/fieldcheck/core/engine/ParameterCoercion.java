package io.fieldcheck.core.engine;

import io.fieldcheck.core.error.RuleConfigurationException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts textual rule parameters into numbers.
 *
 * <p>Integer literals accept an optional sign (signed only), decimal digits, and the base prefixes
 * {@code 0x}/{@code 0X}/{@code #} (hex), {@code 0b}/{@code 0B} (binary), {@code 0o}/{@code 0O}
 * (octal) and a bare leading {@code 0} (octal). Underscores may separate digits, or follow a base
 * prefix, as in Java source literals.
 *
 * <p>Float literals accept decimal notation with optional exponent, hexadecimal notation with a
 * mandatory binary exponent ({@code 0x1.8p1}), and {@code Infinity}/{@code Inf}/{@code NaN} in any
 * case. A finite literal too large for a {@code double} is rejected.
 *
 * <p>Every malformed or out-of-range input fails with a {@link RuleConfigurationException}
 * carrying {@code BAD_PARAMETER}. Stateless; all methods are static.
 */
public final class ParameterCoercion {

    /** Sign, optional base prefix, digits with single underscores between them. */
    private static final Pattern INTEGER_LITERAL =
            Pattern.compile("^([+-]?)(0[xX]_?|#|0[bB]_?|0[oO]_?|0_?(?=[0-9_]*[0-9]$))?([0-9a-zA-Z]+(?:_[0-9a-zA-Z]+)*)$");

    private static final String DIGITS = "[0-9]+(?:_[0-9]+)*";
    private static final String HEX_DIGITS = "[0-9a-fA-F]+(?:_[0-9a-fA-F]+)*";

    private static final Pattern DECIMAL_FLOAT = Pattern.compile(
            "^[+-]?(?:" + DIGITS + "(?:\\.(?:" + DIGITS + ")?)?|\\." + DIGITS + ")(?:[eE][+-]?" + DIGITS + ")?$");

    private static final Pattern HEX_FLOAT = Pattern.compile("^[+-]?0[xX]_?(?:" + HEX_DIGITS + "(?:\\.(?:"
            + HEX_DIGITS + ")?)?|\\." + HEX_DIGITS + ")[pP][+-]?" + DIGITS + "$");

    private static final Pattern SPECIAL_FLOAT = Pattern.compile("^([+-]?)(inf|infinity|nan)$", Pattern.CASE_INSENSITIVE);

    private ParameterCoercion() {}

    /**
     * Parses a signed 64-bit integer.
     *
     * @throws RuleConfigurationException if {@code parameter} is not a signed integer literal in
     *     {@code long} range
     */
    public static long toSigned(String parameter) {
        Literal literal = parseInteger(parameter, true);
        try {
            return Long.parseLong(literal.negative ? "-" + literal.digits : literal.digits, literal.radix);
        } catch (NumberFormatException e) {
            throw RuleConfigurationException.badParameter(
                    "parameter '" + parameter + "' is not a signed 64-bit integer", e);
        }
    }

    /**
     * Parses an unsigned 64-bit integer.
     *
     * @return the value's 64 bits; values above {@link Long#MAX_VALUE} come back negative
     * @throws RuleConfigurationException if {@code parameter} is signed, malformed, or above
     *     2<sup>64</sup>-1
     */
    public static long toUnsigned(String parameter) {
        Literal literal = parseInteger(parameter, false);
        try {
            return Long.parseUnsignedLong(literal.digits, literal.radix);
        } catch (NumberFormatException e) {
            throw RuleConfigurationException.badParameter(
                    "parameter '" + parameter + "' is not an unsigned 64-bit integer", e);
        }
    }

    /**
     * Parses a 64-bit floating-point number.
     *
     * @throws RuleConfigurationException if {@code parameter} is not a float literal, or is a finite
     *     literal that overflows to infinity
     */
    public static double toFloating(String parameter) {
        if (parameter == null) {
            throw RuleConfigurationException.badParameter("parameter is missing; a number is required");
        }
        Matcher special = SPECIAL_FLOAT.matcher(parameter);
        if (special.matches()) {
            if (special.group(2).toLowerCase(Locale.ROOT).equals("nan")) {
                return Double.NaN;
            }
            return "-".equals(special.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (!DECIMAL_FLOAT.matcher(parameter).matches() && !HEX_FLOAT.matcher(parameter).matches()) {
            throw RuleConfigurationException.badParameter("parameter '" + parameter + "' is not a number");
        }
        double value;
        try {
            value = Double.parseDouble(parameter.replace("_", ""));
        } catch (NumberFormatException e) {
            throw RuleConfigurationException.badParameter("parameter '" + parameter + "' is not a number", e);
        }
        if (Double.isInfinite(value)) {
            throw RuleConfigurationException.badParameter(
                    "parameter '" + parameter + "' is out of range for a 64-bit float");
        }
        return value;
    }

    private static Literal parseInteger(String parameter, boolean signAllowed) {
        if (parameter == null) {
            throw RuleConfigurationException.badParameter("parameter is missing; an integer is required");
        }
        Matcher m = INTEGER_LITERAL.matcher(parameter);
        if (!m.matches()) {
            throw RuleConfigurationException.badParameter("parameter '" + parameter + "' is not an integer");
        }
        String sign = m.group(1);
        if (!signAllowed && !sign.isEmpty()) {
            throw RuleConfigurationException.badParameter(
                    "parameter '" + parameter + "' must not carry a sign for an unsigned value");
        }
        String prefix = m.group(2) == null ? "" : m.group(2).replace("_", "").toLowerCase(Locale.ROOT);
        int radix =
                switch (prefix) {
                    case "0x", "#" -> 16;
                    case "0b" -> 2;
                    case "0o", "0" -> 8;
                    default -> 10;
                };
        // Long.parseLong rejects any digit outside the radix, so "0b12" and "09" fail there.
        return new Literal("-".equals(sign), m.group(3).replace("_", ""), radix);
    }

    private record Literal(boolean negative, String digits, int radix) {}
}
