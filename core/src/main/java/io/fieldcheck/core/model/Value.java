package io.fieldcheck.core.model;

import java.util.Objects;

/**
 * A runtime value classified into one of the kinds the validators understand (see {@link Kind}).
 * Numeric widths are already collapsed: every signed integer is a {@code long}, every unsigned
 * integer is the 64 raw bits of a {@code long}, and every floating-point number is a {@code double}.
 *
 * <p>Implementations are a sealed hierarchy of records. Validators switch over {@link #kind()}
 * with switch expressions that have no {@code default} arm, so adding a kind here fails compilation
 * until every validator handles it.
 *
 * <p>Use {@link Values#of(Object)} to classify arbitrary objects. Instances are immutable; wrapped
 * containers are never modified.
 */
public sealed interface Value {

    /** The value shapes a validator may encounter. */
    enum Kind {
        TEXT,
        SIGNED,
        UNSIGNED,
        FLOATING,
        BOOLEAN,
        SEQUENCE,
        MAPPING,
        ARRAY,
        REFERENCE,
        RECORD,
        ABSENT,
        UNSUPPORTED
    }

    /** Returns the kind of this value. Never mutates the value. */
    Kind kind();

    // ── Implementations ──

    /** A character string. Its size is the number of Unicode code points. */
    record Text(String text) implements Value {
        public Text {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        /** Number of code points; an unpaired surrogate counts as one. */
        public int codePointCount() {
            return text.codePointCount(0, text.length());
        }
    }

    /** A signed integer of any width. */
    record Signed(long value) implements Value {
        @Override
        public Kind kind() {
            return Kind.SIGNED;
        }
    }

    /**
     * An unsigned integer of any width.
     *
     * @param bits the value's 64 bits, to be read with {@link Long#compareUnsigned} and friends
     */
    record Unsigned(long bits) implements Value {
        @Override
        public Kind kind() {
            return Kind.UNSIGNED;
        }

        @Override
        public String toString() {
            return "Unsigned[" + Long.toUnsignedString(bits) + "]";
        }
    }

    /** A 32 or 64-bit floating-point number. */
    record Floating(double value) implements Value {
        @Override
        public Kind kind() {
            return Kind.FLOATING;
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }
    }

    /**
     * An ordered collection (list, set, JSON array).
     *
     * @param source the wrapped collection
     * @param size   its element count, captured at classification time
     */
    record Sequence(Object source, int size) implements Value {
        public Sequence {
            requireSize(size);
        }

        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }
    }

    /**
     * A key/value container (map, JSON object).
     *
     * @param source the wrapped mapping
     * @param size   its entry count, captured at classification time
     */
    record Mapping(Object source, int size) implements Value {
        public Mapping {
            requireSize(size);
        }

        @Override
        public Kind kind() {
            return Kind.MAPPING;
        }
    }

    /**
     * A fixed-size Java array, object or primitive.
     *
     * @param source the wrapped array
     * @param size   its length
     */
    record FixedArray(Object source, int size) implements Value {
        public FixedArray {
            requireSize(size);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }

    /**
     * A nullable reference such as an {@link java.util.Optional}. The target is never inspected
     * by length or bound checks.
     *
     * @param target the referenced object, or {@code null}
     */
    record Reference(Object target) implements Value {
        @Override
        public Kind kind() {
            return Kind.REFERENCE;
        }

        public boolean isNull() {
            return target == null;
        }
    }

    /** A structured record. No zero-value or size semantics apply at this layer. */
    record Structured(Object source) implements Value {
        public Structured {
            Objects.requireNonNull(source, "source must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.RECORD;
        }
    }

    /** No value at all: Java {@code null}, JSON {@code null}, or a missing field. */
    record Absent() implements Value {
        @Override
        public Kind kind() {
            return Kind.ABSENT;
        }
    }

    /** A value outside the supported set. */
    record Unsupported(Object source) implements Value {
        @Override
        public Kind kind() {
            return Kind.UNSUPPORTED;
        }
    }

    private static void requireSize(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative, got: " + size);
        }
    }
}
