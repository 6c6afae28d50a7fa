package com.questrail.tao.api;

import java.util.Objects;

/**
 * Typed value of a single field in a structured engine response.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code DecodedValue} is the closed set of value shapes that the engine's
 * kind tags ({@code STR}, {@code INT}, {@code REAL}, {@code LOGIC}, {@code ENUM})
 * decode into. Callers reason about these values, never about the raw wire text.
 * </p>
 *
 * <p>
 * Enumerations are carried as {@link EnumValue} with their raw text. Resolving
 * engine-specific enumerations is left to the caller.
 * </p>
 */
public sealed interface DecodedValue
        permits DecodedValue.StringValue,
                DecodedValue.IntegerValue,
                DecodedValue.RealValue,
                DecodedValue.LogicalValue,
                DecodedValue.EnumValue {

    /**
     * Returns the boxed Java value ({@link String}, {@link Long}, {@link Double}
     * or {@link Boolean}).
     */
    Object raw();

    default String asString() {
        if (this instanceof StringValue v) {
            return v.value();
        }
        if (this instanceof EnumValue v) {
            return v.value();
        }
        throw new IllegalStateException("Not a textual value: " + this);
    }

    default long asLong() {
        if (this instanceof IntegerValue v) {
            return v.value();
        }
        throw new IllegalStateException("Not an integer value: " + this);
    }

    /**
     * Returns this value as a double. Integers are widened.
     */
    default double asDouble() {
        if (this instanceof RealValue v) {
            return v.value();
        }
        if (this instanceof IntegerValue v) {
            return v.value();
        }
        throw new IllegalStateException("Not a numeric value: " + this);
    }

    default boolean asBoolean() {
        if (this instanceof LogicalValue v) {
            return v.value();
        }
        throw new IllegalStateException("Not a logical value: " + this);
    }

    /** {@code STR} field, or the kind tag of an unrecognized field. */
    record StringValue(String value) implements DecodedValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    /** {@code INT} field. */
    record IntegerValue(long value) implements DecodedValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    /** {@code REAL} field. */
    record RealValue(double value) implements DecodedValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    /** {@code LOGIC} field. */
    record LogicalValue(boolean value) implements DecodedValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    /** {@code ENUM} field, left undecoded. */
    record EnumValue(String value) implements DecodedValue {
        public EnumValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object raw() {
            return value;
        }
    }
}
