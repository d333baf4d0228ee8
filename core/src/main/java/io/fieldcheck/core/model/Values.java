package io.fieldcheck.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Classifies arbitrary runtime objects into {@link Value}s.
 *
 * <p>Mapping:
 * <ul>
 * <li>{@code null} → {@link Value.Absent}
 * <li>{@link CharSequence} → {@link Value.Text}
 * <li>{@code Byte}, {@code Short}, {@code Integer}, {@code Long}, {@code AtomicInteger}, {@code
 * AtomicLong}, {@code Character} (as its code point) → {@link Value.Signed}
 * <li>{@link BigInteger}: long range → signed, up to 2<sup>64</sup>-1 → {@link Value.Unsigned},
 * otherwise unsupported
 * <li>{@code Float}, {@code Double}, {@link BigDecimal} → {@link Value.Floating}
 * <li>{@code Boolean}, {@code AtomicBoolean} → {@link Value.Bool}
 * <li>{@link Collection} → {@link Value.Sequence}; {@link Map} → {@link Value.Mapping}; any Java
 * array → {@link Value.FixedArray}
 * <li>{@link Optional}, {@link AtomicReference} → {@link Value.Reference}
 * <li>{@link Record} → {@link Value.Structured}
 * <li>Jackson {@link JsonNode} → by node type (see {@link #ofJson(JsonNode)})
 * <li>anything else → {@link Value.Unsupported}
 * </ul>
 *
 * <p>Java has no unsigned integer, pointer or plain-struct types, so {@link #unsigned(long)},
 * {@link #reference(Object)} and {@link #record(Object)} build those kinds explicitly.
 *
 * <p>Stateless; all methods are static.
 */
public final class Values {

    /** The shared absent value. */
    public static final Value ABSENT = new Value.Absent();

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Values() {
        // utility class
    }

    /**
     * Classifies {@code raw}. An existing {@link Value} is returned unchanged.
     *
     * @param raw any object, may be {@code null}
     * @return the classified value, never {@code null}
     */
    public static Value of(Object raw) {
        if (raw == null) {
            return ABSENT;
        }
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof JsonNode node) {
            return ofJson(node);
        }
        if (raw instanceof CharSequence chars) {
            return text(chars.toString());
        }
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long) {
            return signed(((Number) raw).longValue());
        }
        if (raw instanceof AtomicInteger || raw instanceof AtomicLong) {
            return signed(((Number) raw).longValue());
        }
        if (raw instanceof Character c) {
            return signed(c.charValue());
        }
        if (raw instanceof BigInteger big) {
            return ofBigInteger(big);
        }
        if (raw instanceof Float || raw instanceof Double || raw instanceof BigDecimal) {
            return floating(((Number) raw).doubleValue());
        }
        if (raw instanceof Boolean b) {
            return bool(b);
        }
        if (raw instanceof AtomicBoolean b) {
            return bool(b.get());
        }
        if (raw instanceof Collection<?> collection) {
            return new Value.Sequence(collection, collection.size());
        }
        if (raw instanceof Map<?, ?> map) {
            return new Value.Mapping(map, map.size());
        }
        if (raw.getClass().isArray()) {
            return new Value.FixedArray(raw, Array.getLength(raw));
        }
        if (raw instanceof Optional<?> optional) {
            return reference(optional.orElse(null));
        }
        if (raw instanceof AtomicReference<?> ref) {
            return reference(ref.get());
        }
        if (raw instanceof Record) {
            return record(raw);
        }
        return new Value.Unsupported(raw);
    }

    /**
     * Classifies a Jackson tree node. Text, integral, floating-point, boolean, array and object
     * nodes map to the corresponding kinds; {@code null} and missing nodes are absent; binary and
     * POJO nodes are unsupported.
     */
    public static Value ofJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ABSENT;
        }
        if (node.isTextual()) {
            return text(node.textValue());
        }
        if (node.isBigInteger()) {
            return ofBigInteger(node.bigIntegerValue());
        }
        if (node.isIntegralNumber()) {
            return signed(node.longValue());
        }
        if (node.isNumber()) {
            return floating(node.doubleValue());
        }
        if (node.isBoolean()) {
            return bool(node.booleanValue());
        }
        if (node.isArray()) {
            return new Value.Sequence(node, node.size());
        }
        if (node.isObject()) {
            return new Value.Mapping(node, node.size());
        }
        return new Value.Unsupported(node);
    }

    public static Value text(String text) {
        return new Value.Text(text);
    }

    public static Value signed(long value) {
        return new Value.Signed(value);
    }

    /** An unsigned value from its 64 raw bits, e.g. {@code unsigned(-1L)} is 2<sup>64</sup>-1. */
    public static Value unsigned(long bits) {
        return new Value.Unsigned(bits);
    }

    public static Value floating(double value) {
        return new Value.Floating(value);
    }

    public static Value bool(boolean value) {
        return new Value.Bool(value);
    }

    /** A nullable reference to {@code target}. */
    public static Value reference(Object target) {
        return new Value.Reference(target);
    }

    /** Treats {@code source} as a structured record regardless of its class. */
    public static Value record(Object source) {
        return new Value.Structured(source);
    }

    private static Value ofBigInteger(BigInteger big) {
        if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
            return signed(big.longValue());
        }
        if (big.signum() > 0 && big.bitLength() <= Long.SIZE) {
            return unsigned(big.longValue());
        }
        return new Value.Unsupported(big);
    }
}
