package io.github.cyfko.celldl.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Value of an attribute or property.
 */
public sealed interface AttributeValue
        permits AttributeValue.StringValue, AttributeValue.NumberValue,
        AttributeValue.BooleanValue, AttributeValue.ListValue {

    /** Plain Java value: {@link String}, {@link Long}, {@link Double}, {@link Boolean} or {@code List<String>}. */
    Object raw();

    static AttributeValue of(String value) {
        return new StringValue(value);
    }

    static AttributeValue of(long value) {
        return new NumberValue(value);
    }

    static AttributeValue of(boolean value) {
        return new BooleanValue(value);
    }

    static AttributeValue of(List<String> values) {
        return new ListValue(values);
    }

    record StringValue(String value) implements AttributeValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    /**
     * Numeric value, a {@link Long} for integer literals and a {@link Double} otherwise.
     */
    record NumberValue(Number value) implements AttributeValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
            if (!(value instanceof Long) && !(value instanceof Double)) {
                throw new IllegalArgumentException("Number must be a Long or a Double, got " + value.getClass().getName());
            }
        }

        public boolean isInteger() {
            return value instanceof Long;
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements AttributeValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    record ListValue(List<String> values) implements AttributeValue {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public Object raw() {
            return values;
        }
    }
}
