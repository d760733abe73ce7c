/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.metadata;

/**
 * Leaf value types a column can hold.
 * Each type has a one-byte tag identifying it on the wire and the name the server
 * uses for it in schema metadata.
 */
public enum DataType {
    STRING(1),
    INT64(2),
    BOOL(3),
    BYTES(4),
    FLOAT32(5),
    FLOAT64(6),
    TIMESTAMP_MICROS(7);

    private static final DataType[] BY_TAG = new DataType[8];

    static {
        for (DataType type : values()) {
            BY_TAG[type.tag] = type;
        }
    }

    private final byte tag;

    DataType(int tag) {
        this.tag = (byte) tag;
    }

    public byte getTag() {
        return tag;
    }

    /**
     * Look up the type for a wire tag.
     *
     * @param tag the tag byte read from a page
     * @return the matching type, or null if the tag does not denote a leaf type
     */
    public static DataType forTag(byte tag) {
        int index = tag & 0xFF;
        if (index >= BY_TAG.length) {
            return null;
        }
        return BY_TAG[index];
    }

    public static DataType fromWireName(String name) {
        for (DataType type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + name);
    }
}
