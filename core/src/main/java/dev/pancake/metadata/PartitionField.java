/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.metadata;

import java.time.Instant;
import java.util.Objects;

/**
 * One dimension of a partition: a partition column name and its value.
 * <p>
 * Values are limited to the types the server allows for partitioning:
 * {@link String}, {@link Long}, {@link Boolean} and {@link Instant}.
 * </p>
 */
public record PartitionField(String name, Object value) {

    public PartitionField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (!(value instanceof String || value instanceof Long || value instanceof Boolean || value instanceof Instant)) {
            throw new IllegalArgumentException("Unsupported partition value type for '" + name + "': "
                    + value.getClass().getName());
        }
    }

    public static PartitionField of(String name, String value) {
        return new PartitionField(name, value);
    }

    public static PartitionField of(String name, long value) {
        return new PartitionField(name, value);
    }

    public static PartitionField of(String name, boolean value) {
        return new PartitionField(name, value);
    }

    public static PartitionField of(String name, Instant value) {
        return new PartitionField(name, value);
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
