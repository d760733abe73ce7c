/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.reader;

import java.time.Duration;
import java.util.Objects;

/**
 * How often, and with which delays, a page read is repeated after a retryable transport failure.
 * <p>
 * Delays grow exponentially from {@code initialBackoff}, doubling per attempt, capped at
 * {@code maxBackoff}. The defaults can be overridden with the system properties
 * {@value #MAX_RETRIES_PROPERTY}, {@value #INITIAL_BACKOFF_PROPERTY} and {@value #MAX_BACKOFF_PROPERTY}.
 * </p>
 *
 * @param maxRetries number of retries after the first attempt, 0 to disable retrying
 * @param initialBackoff delay before the first retry
 * @param maxBackoff upper bound for any delay
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, Duration maxBackoff) {

    public static final String MAX_RETRIES_PROPERTY = "pancake.read.maxRetries";
    public static final String INITIAL_BACKOFF_PROPERTY = "pancake.read.initialBackoffMillis";
    public static final String MAX_BACKOFF_PROPERTY = "pancake.read.maxBackoffMillis";

    static final int DEFAULT_MAX_RETRIES = 3;
    static final long DEFAULT_INITIAL_BACKOFF_MILLIS = 100;
    static final long DEFAULT_MAX_BACKOFF_MILLIS = 2_000;

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff must not be negative");
        }
    }

    /**
     * The default policy, taking overrides from system properties.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(
                (int) longProperty(MAX_RETRIES_PROPERTY, DEFAULT_MAX_RETRIES),
                Duration.ofMillis(longProperty(INITIAL_BACKOFF_PROPERTY, DEFAULT_INITIAL_BACKOFF_MILLIS)),
                Duration.ofMillis(longProperty(MAX_BACKOFF_PROPERTY, DEFAULT_MAX_BACKOFF_MILLIS)));
    }

    /**
     * A policy that never retries.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Retry up to {@code maxRetries} times without waiting in between.
     */
    public static RetryPolicy immediate(int maxRetries) {
        return new RetryPolicy(maxRetries, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Delay before the given retry.
     *
     * @param retry the retry number, starting at 1
     */
    public Duration backoff(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("Retry number starts at 1: " + retry);
        }
        Duration delay = initialBackoff;
        for (int i = 1; i < retry && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private static long longProperty(String name, long defaultValue) {
        String value = System.getProperty(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for system property " + name + ": " + value, e);
        }
    }
}
