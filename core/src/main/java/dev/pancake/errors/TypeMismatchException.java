/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.errors;

/**
 * The encoded values of a page disagree with the type declared by the column descriptor.
 * Points at a caller or schema metadata error.
 */
public class TypeMismatchException extends PancakeException {

    private final String columnName;

    public TypeMismatchException(String columnName, String message) {
        super("Type mismatch in column '" + columnName + "': " + message);
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
