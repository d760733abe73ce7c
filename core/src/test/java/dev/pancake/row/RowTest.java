/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.row;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowTest {

    private static final RowLayout LAYOUT = RowLayout.of("id", "name", "score", "ratio", "active", "payload", "seen",
            "tags");

    private static final Instant SEEN = Instant.parse("2022-03-04T05:06:07.000008Z");

    private final Row row = LAYOUT.row(
            FieldValue.int64(42),
            FieldValue.string("ada"),
            FieldValue.float32(0.5f),
            FieldValue.float64(2.25),
            FieldValue.bool(true),
            FieldValue.bytes(new byte[]{ 7, 8 }),
            FieldValue.timestamp(SEEN),
            FieldValue.list(FieldValue.string("a"), FieldValue.string("b")));

    private final Row nulls = LAYOUT.row(FieldValue.NULL, FieldValue.NULL, FieldValue.NULL, FieldValue.NULL,
            FieldValue.NULL, FieldValue.NULL, FieldValue.NULL, FieldValue.NULL);

    @Test
    void testTypedGetters() {
        assertThat(row.getLong("id")).isEqualTo(42);
        assertThat(row.getString("name")).isEqualTo("ada");
        assertThat(row.getFloat("score")).isEqualTo(0.5f);
        assertThat(row.getDouble("ratio")).isEqualTo(2.25);
        assertThat(row.getBoolean("active")).isTrue();
        assertThat(row.getBinary("payload")).containsExactly(7, 8);
        assertThat(row.getTimestamp("seen")).isEqualTo(SEEN);
        assertThat(row.getList("tags")).containsExactly(FieldValue.string("a"), FieldValue.string("b"));
    }

    @Test
    void testFieldsInLayoutOrder() {
        assertThat(row.getFieldCount()).isEqualTo(8);
        assertThat(row.getFieldNames()).containsExactly("id", "name", "score", "ratio", "active", "payload", "seen",
                "tags");
        assertThat(row.getFieldName(1)).isEqualTo("name");
        assertThat(row.getValue(0)).isEqualTo(FieldValue.int64(42));
        assertThat(row.getValue("id")).isEqualTo(row.getValue(0));
        assertThat(row.hasField("name")).isTrue();
        assertThat(row.hasField("missing")).isFalse();
    }

    @Test
    void testNullValues() {
        assertThat(nulls.isNull("id")).isTrue();
        assertThat(nulls.getString("name")).isNull();
        assertThat(nulls.getBinary("payload")).isNull();
        assertThat(nulls.getTimestamp("seen")).isNull();
        assertThat(nulls.getList("tags")).isNull();

        assertThatThrownBy(() -> nulls.getLong("id"))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("Field 'id' is null");
        assertThatThrownBy(() -> nulls.getBoolean("active")).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testWrongType() {
        assertThatThrownBy(() -> row.getLong("name"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'name' is not INT64");
        assertThatThrownBy(() -> row.getList("id"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a list");
    }

    @Test
    void testUnknownField() {
        assertThatThrownBy(() -> row.getValue("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Field not found: missing");
    }

    @Test
    void testEquality() {
        Row same = LAYOUT.row(
                FieldValue.int64(42),
                FieldValue.string("ada"),
                FieldValue.float32(0.5f),
                FieldValue.float64(2.25),
                FieldValue.bool(true),
                FieldValue.bytes(new byte[]{ 7, 8 }),
                FieldValue.timestampMicros(((FieldValue.TimestampValue) row.getValue("seen")).micros()),
                FieldValue.list(FieldValue.string("a"), FieldValue.string("b")));

        assertThat(same).isEqualTo(row).hasSameHashCodeAs(row);
        assertThat(nulls).isNotEqualTo(row);
    }

    @Test
    void testBinaryIsCopied() {
        byte[] payload = row.getBinary("payload");
        payload[0] = 99;

        assertThat(row.getBinary("payload")).containsExactly(7, 8);
    }
}
