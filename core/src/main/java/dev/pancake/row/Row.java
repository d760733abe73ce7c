/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.row;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

import dev.pancake.metadata.DataType;

/**
 * One logical record of a segment: the values of all requested columns at the same row index.
 * <p>
 * Fields iterate in the order the columns were requested and can be looked up by name.
 * The typed accessors follow JDBC conventions: primitive getters throw on null values,
 * object getters return null.
 * </p>
 *
 * <pre>{@code
 * for (Row row : reader.decodeSegment(segment, columns)) {
 *     long id = row.getLong("id");
 *     String name = row.getString("name");
 *     List<FieldValue> tags = row.getList("tags");
 * }
 * }</pre>
 */
public final class Row {

    private final RowLayout layout;
    private final FieldValue[] values;

    Row(RowLayout layout, FieldValue[] values) {
        this.layout = layout;
        this.values = values;
    }

    public RowLayout getLayout() {
        return layout;
    }

    public int getFieldCount() {
        return values.length;
    }

    public String getFieldName(int index) {
        return layout.name(index);
    }

    public List<String> getFieldNames() {
        return layout.names();
    }

    public FieldValue getValue(int index) {
        return values[index];
    }

    /**
     * @throws IllegalArgumentException if the row has no field with this name
     */
    public FieldValue getValue(String name) {
        int index = layout.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Field not found: " + name);
        }
        return values[index];
    }

    public boolean hasField(String name) {
        return layout.indexOf(name) >= 0;
    }

    public boolean isNull(String name) {
        return getValue(name).isNull();
    }

    public long getLong(String name) {
        return ((FieldValue.Int64Value) nonNull(name, DataType.INT64)).value();
    }

    public boolean getBoolean(String name) {
        return ((FieldValue.BoolValue) nonNull(name, DataType.BOOL)).value();
    }

    public float getFloat(String name) {
        return ((FieldValue.Float32Value) nonNull(name, DataType.FLOAT32)).value();
    }

    public double getDouble(String name) {
        return ((FieldValue.Float64Value) nonNull(name, DataType.FLOAT64)).value();
    }

    public String getString(String name) {
        FieldValue value = nullable(name, DataType.STRING);
        return value == null ? null : ((FieldValue.StringValue) value).value();
    }

    public byte[] getBinary(String name) {
        FieldValue value = nullable(name, DataType.BYTES);
        return value == null ? null : ((FieldValue.BytesValue) value).value();
    }

    public Instant getTimestamp(String name) {
        FieldValue value = nullable(name, DataType.TIMESTAMP_MICROS);
        return value == null ? null : ((FieldValue.TimestampValue) value).instant();
    }

    /**
     * Get the elements of a list column, or null if the value is null.
     *
     * @throws IllegalArgumentException if the field is not a list
     */
    public List<FieldValue> getList(String name) {
        FieldValue value = getValue(name);
        if (value.isNull()) {
            return null;
        }
        if (!(value instanceof FieldValue.ListValue)) {
            throw new IllegalArgumentException("Field '" + name + "' is not a list: " + value);
        }
        return ((FieldValue.ListValue) value).values();
    }

    private FieldValue nonNull(String name, DataType expected) {
        FieldValue value = nullable(name, expected);
        if (value == null) {
            throw new NullPointerException("Field '" + name + "' is null");
        }
        return value;
    }

    private FieldValue nullable(String name, DataType expected) {
        FieldValue value = getValue(name);
        if (value.isNull()) {
            return null;
        }
        DataType actual = FieldValue.typeOf(value);
        if (actual != expected) {
            throw new IllegalArgumentException("Field '" + name + "' is not " + expected + ": " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Row)) {
            return false;
        }
        Row other = (Row) o;
        return layout.equals(other.layout) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * layout.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (int i = 0; i < values.length; i++) {
            joiner.add(layout.name(i) + "=" + values[i]);
        }
        return joiner.toString();
    }
}
