/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.reader;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(RetryPolicy.MAX_RETRIES_PROPERTY);
        System.clearProperty(RetryPolicy.INITIAL_BACKOFF_PROPERTY);
        System.clearProperty(RetryPolicy.MAX_BACKOFF_PROPERTY);
    }

    @Test
    void testDefaults() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.maxRetries()).isEqualTo(RetryPolicy.DEFAULT_MAX_RETRIES);
        assertThat(policy.initialBackoff()).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.maxBackoff()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void testSystemPropertyOverrides() {
        System.setProperty(RetryPolicy.MAX_RETRIES_PROPERTY, "7");
        System.setProperty(RetryPolicy.INITIAL_BACKOFF_PROPERTY, "10");
        System.setProperty(RetryPolicy.MAX_BACKOFF_PROPERTY, " 50 ");

        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy).isEqualTo(new RetryPolicy(7, Duration.ofMillis(10), Duration.ofMillis(50)));
    }

    @Test
    void testInvalidSystemProperty() {
        System.setProperty(RetryPolicy.MAX_RETRIES_PROPERTY, "many");

        assertThatThrownBy(RetryPolicy::defaults)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(RetryPolicy.MAX_RETRIES_PROPERTY);
    }

    @Test
    void testExponentialBackoffIsCapped() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(100), Duration.ofMillis(1000));

        assertThat(policy.backoff(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.backoff(4)).isEqualTo(Duration.ofMillis(800));
        assertThat(policy.backoff(5)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.backoff(1000)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void testInvalidArguments() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofMillis(-1), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.none().backoff(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
