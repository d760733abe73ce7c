/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.metadata;

import java.util.Objects;

/**
 * Identifies one column to read: its name, leaf type and how many levels of list
 * nesting wrap the leaf values.
 *
 * @param name column name, unique within a table
 * @param dataType leaf value type
 * @param nestedListDepth 0 for scalar columns, n for n nested levels of lists
 */
public record ColumnDescriptor(String name, DataType dataType, int nestedListDepth) {

    public static final int MAX_NESTED_LIST_DEPTH = 255;

    public ColumnDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(dataType, "dataType");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
        if (nestedListDepth < 0 || nestedListDepth > MAX_NESTED_LIST_DEPTH) {
            throw new IllegalArgumentException("Nested list depth must be between 0 and " + MAX_NESTED_LIST_DEPTH
                    + ", got " + nestedListDepth + " for column '" + name + "'");
        }
    }

    public static ColumnDescriptor of(String name, DataType dataType) {
        return new ColumnDescriptor(name, dataType, 0);
    }

    public static ColumnDescriptor listOf(String name, DataType dataType, int nestedListDepth) {
        return new ColumnDescriptor(name, dataType, nestedListDepth);
    }

    public boolean isList() {
        return nestedListDepth > 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(" ");
        for (int i = 0; i < nestedListDepth; i++) {
            sb.append("list<");
        }
        sb.append(dataType.name().toLowerCase());
        for (int i = 0; i < nestedListDepth; i++) {
            sb.append(">");
        }
        return sb.toString();
    }
}
