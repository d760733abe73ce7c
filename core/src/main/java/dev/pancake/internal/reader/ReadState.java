/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.reader;

/**
 * States of a {@link ColumnStreamReader}.
 */
public enum ReadState {
    /** Nothing requested yet; the continuation token is empty. */
    START,
    /** Pages are being requested; the next request uses the current continuation token. */
    FETCHING,
    /** The last page had an empty continuation token. Terminal. */
    DONE,
    /** A read or decode error aborted the column. Terminal, accumulated values are discarded. */
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
