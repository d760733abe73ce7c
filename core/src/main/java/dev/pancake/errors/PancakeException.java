/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.errors;

import java.io.IOException;

/**
 * Base class for all failures while reading segment data.
 */
public abstract class PancakeException extends IOException {

    protected PancakeException(String message) {
        super(message);
    }

    protected PancakeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the failed call at the same continuation token may succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
