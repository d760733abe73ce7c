/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.reader;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PancakeContextTest {

    @Test
    void testThreadsAreNamedDaemons() throws Exception {
        try (PancakeContext context = PancakeContext.create(2, RetryPolicy.none())) {
            Thread thread = CompletableFuture.supplyAsync(Thread::currentThread, context.executor())
                    .get(10, TimeUnit.SECONDS);

            assertThat(thread.getName()).startsWith("pancake-");
            assertThat(thread.isDaemon()).isTrue();
            assertThat(context.retryPolicy()).isEqualTo(RetryPolicy.none());
            assertThat(context.decompressorFactory()).isNotNull();
        }
    }

    @Test
    void testCloseShutsDownExecutor() {
        PancakeContext context = PancakeContext.create(1);
        context.close();

        assertThat(context.executor().isShutdown()).isTrue();
    }

    @Test
    void testRequiresAThread() {
        assertThatThrownBy(() -> PancakeContext.create(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
