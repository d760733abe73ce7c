/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.row;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import dev.pancake.metadata.DataType;

/**
 * One decoded value of a column: a typed scalar, a (possibly nested) list, or null.
 * <p>
 * Values are immutable. Use {@link #asObject()} to obtain a plain Java representation.
 * </p>
 */
public sealed interface FieldValue permits FieldValue.NullValue, FieldValue.StringValue, FieldValue.Int64Value,
        FieldValue.BoolValue, FieldValue.BytesValue, FieldValue.Float32Value, FieldValue.Float64Value,
        FieldValue.TimestampValue, FieldValue.ListValue {

    FieldValue NULL = NullValue.INSTANCE;

    default boolean isNull() {
        return false;
    }

    /**
     * Plain Java form of this value: {@code null}, {@link String}, {@link Long}, {@link Boolean},
     * {@code byte[]}, {@link Float}, {@link Double}, {@link Instant} or a {@link List} of these.
     */
    Object asObject();

    static FieldValue string(String value) {
        return new StringValue(value);
    }

    static FieldValue int64(long value) {
        return new Int64Value(value);
    }

    static FieldValue bool(boolean value) {
        return new BoolValue(value);
    }

    static FieldValue bytes(byte[] value) {
        return new BytesValue(value);
    }

    static FieldValue float32(float value) {
        return new Float32Value(value);
    }

    static FieldValue float64(double value) {
        return new Float64Value(value);
    }

    static FieldValue timestampMicros(long micros) {
        return new TimestampValue(micros);
    }

    static FieldValue timestamp(Instant instant) {
        return TimestampValue.of(instant);
    }

    static FieldValue list(List<FieldValue> values) {
        return new ListValue(values);
    }

    static FieldValue list(FieldValue... values) {
        return new ListValue(List.of(values));
    }

    enum NullValue implements FieldValue {
        INSTANCE;

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public Object asObject() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record StringValue(String value) implements FieldValue {

        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object asObject() {
            return value;
        }
    }

    record Int64Value(long value) implements FieldValue {

        @Override
        public Object asObject() {
            return value;
        }
    }

    record BoolValue(boolean value) implements FieldValue {

        @Override
        public Object asObject() {
            return value;
        }
    }

    record BytesValue(byte[] value) implements FieldValue {

        public BytesValue {
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public Object asObject() {
            return value.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[length=" + value.length + "]";
        }
    }

    record Float32Value(float value) implements FieldValue {

        @Override
        public Object asObject() {
            return value;
        }
    }

    record Float64Value(double value) implements FieldValue {

        @Override
        public Object asObject() {
            return value;
        }
    }

    /**
     * A point in time with microsecond precision.
     */
    record TimestampValue(long micros) implements FieldValue {

        private static final long MICROS_PER_SECOND = 1_000_000L;

        static TimestampValue of(Instant instant) {
            long micros = Math.addExact(Math.multiplyExact(instant.getEpochSecond(), MICROS_PER_SECOND),
                    instant.getNano() / 1_000);
            return new TimestampValue(micros);
        }

        public Instant instant() {
            return Instant.ofEpochSecond(Math.floorDiv(micros, MICROS_PER_SECOND),
                    Math.floorMod(micros, MICROS_PER_SECOND) * 1_000L);
        }

        @Override
        public Object asObject() {
            return instant();
        }

        @Override
        public String toString() {
            return instant().toString();
        }
    }

    record ListValue(List<FieldValue> values) implements FieldValue {

        public ListValue {
            values = List.copyOf(values);
        }

        public int size() {
            return values.size();
        }

        public FieldValue get(int index) {
            return values.get(index);
        }

        @Override
        public Object asObject() {
            List<Object> result = new ArrayList<>(values.size());
            for (FieldValue value : values) {
                result.add(value.asObject());
            }
            return result;
        }
    }

    /**
     * The leaf type a scalar value belongs to, or null for null values and lists.
     */
    static DataType typeOf(FieldValue value) {
        if (value instanceof StringValue) {
            return DataType.STRING;
        }
        if (value instanceof Int64Value) {
            return DataType.INT64;
        }
        if (value instanceof BoolValue) {
            return DataType.BOOL;
        }
        if (value instanceof BytesValue) {
            return DataType.BYTES;
        }
        if (value instanceof Float32Value) {
            return DataType.FLOAT32;
        }
        if (value instanceof Float64Value) {
            return DataType.FLOAT64;
        }
        if (value instanceof TimestampValue) {
            return DataType.TIMESTAMP_MICROS;
        }
        return null;
    }
}
