/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.errors;

/**
 * A call to the server failed before a page could be obtained.
 * <p>
 * Connection failures, timeouts and overload responses are retryable: reads are
 * idempotent for a given continuation token. Rejected requests (for example an unknown
 * table) are not.
 * </p>
 */
public class TransportException extends PancakeException {

    public static final int NO_STATUS = -1;

    private final boolean retryable;
    private final int statusCode;

    public TransportException(String message, boolean retryable) {
        this(message, retryable, NO_STATUS, null);
    }

    public TransportException(String message, boolean retryable, Throwable cause) {
        this(message, retryable, NO_STATUS, cause);
    }

    public TransportException(String message, boolean retryable, int statusCode, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    public static TransportException retryable(String message, Throwable cause) {
        return new TransportException(message, true, cause);
    }

    public static TransportException fatal(String message, Throwable cause) {
        return new TransportException(message, false, cause);
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * The status code reported by the server, or {@link #NO_STATUS} if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
