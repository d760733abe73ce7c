/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.row;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Field names of the rows produced by one read, shared by all of them.
 * <p>
 * Keeps the names in request order together with an open-addressed name index
 * (linear probing, load factor below 0.75), so rows themselves only hold their values.
 * </p>
 */
public final class RowLayout {

    private static final int ABSENT = -1;

    private final String[] names;
    private final String[] slotKeys;
    private final int[] slotPositions;
    private final int mask;

    private RowLayout(String[] names) {
        this.names = names;
        int capacity = tableSizeFor(names.length + (names.length >> 1) + 1);
        this.slotKeys = new String[capacity];
        this.slotPositions = new int[capacity];
        this.mask = capacity - 1;

        for (int position = 0; position < names.length; position++) {
            insert(names[position], position);
        }
    }

    /**
     * Create a layout for the given field names.
     *
     * @throws IllegalArgumentException if the list is empty or contains a name twice
     */
    public static RowLayout of(List<String> names) {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("A row needs at least one field");
        }
        String[] copy = new String[names.size()];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = Objects.requireNonNull(names.get(i), "field name");
        }
        return new RowLayout(copy);
    }

    public static RowLayout of(String... names) {
        return of(Arrays.asList(names));
    }

    private void insert(String name, int position) {
        int slot = name.hashCode() & mask;
        while (slotKeys[slot] != null) {
            if (slotKeys[slot].equals(name)) {
                throw new IllegalArgumentException("Duplicate field name: " + name);
            }
            slot = (slot + 1) & mask;
        }
        slotKeys[slot] = name;
        slotPositions[slot] = position;
    }

    /**
     * Position of the named field, or -1 if there is no such field.
     */
    public int indexOf(String name) {
        int slot = name.hashCode() & mask;
        while (slotKeys[slot] != null) {
            if (slotKeys[slot].equals(name)) {
                return slotPositions[slot];
            }
            slot = (slot + 1) & mask;
        }
        return ABSENT;
    }

    public int size() {
        return names.length;
    }

    public String name(int index) {
        return names[index];
    }

    public List<String> names() {
        return List.of(names);
    }

    /**
     * Create a row with this layout. Values are given in field order.
     */
    public Row row(FieldValue... values) {
        if (values.length != names.length) {
            throw new IllegalArgumentException("Expected " + names.length + " values but got " + values.length);
        }
        FieldValue[] copy = new FieldValue[values.length];
        for (int i = 0; i < values.length; i++) {
            copy[i] = Objects.requireNonNull(values[i], "value");
        }
        return new Row(this, copy);
    }

    private static int tableSizeFor(int cap) {
        int n = Integer.highestOneBit(Math.max(cap - 1, 1)) << 1;
        return Math.max(n, 8);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RowLayout other && Arrays.equals(names, other.names);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(names);
    }

    @Override
    public String toString() {
        return Arrays.toString(names);
    }
}
