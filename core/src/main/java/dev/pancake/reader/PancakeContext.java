/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.reader;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import dev.pancake.internal.compression.DecompressorFactory;

/**
 * Context object that manages shared resources for segment reads.
 * <p>
 * Holds the thread pool the columns of a segment are read on, the decompressor factory
 * and the retry policy for transient transport failures.
 * </p>
 * <p>
 * The context lifecycle is tied to either:
 * <ul>
 *   <li>the application, when passed to {@link SegmentReader#create(dev.pancake.rpc.SegmentColumnGateway, PancakeContext)}</li>
 *   <li>a {@link SegmentReader} instance, when opened with {@link SegmentReader#open(dev.pancake.rpc.SegmentColumnGateway)}</li>
 * </ul>
 * </p>
 */
public final class PancakeContext implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(PancakeContext.class.getName());

    private final ExecutorService executor;
    private final DecompressorFactory decompressorFactory;
    private final RetryPolicy retryPolicy;

    private PancakeContext(ExecutorService executor, RetryPolicy retryPolicy) {
        this.executor = executor;
        this.decompressorFactory = new DecompressorFactory();
        this.retryPolicy = retryPolicy;
    }

    /**
     * Create a new context with a thread pool sized to available processors and the default retry policy.
     */
    public static PancakeContext create() {
        return create(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Create a new context with a thread pool of the specified size and the default retry policy.
     */
    public static PancakeContext create(int threads) {
        return create(threads, RetryPolicy.defaults());
    }

    /**
     * Create a new context with a thread pool of the specified size and the given retry policy.
     */
    public static PancakeContext create(int threads, RetryPolicy retryPolicy) {
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (threads < 1) {
            throw new IllegalArgumentException("At least one thread is required, got " + threads);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "pancake-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        LOG.log(System.Logger.Level.DEBUG, "Created context with {0} threads, retry policy {1}", threads, retryPolicy);
        return new PancakeContext(executor, retryPolicy);
    }

    /**
     * Get the executor service column reads run on.
     */
    public ExecutorService executor() {
        return executor;
    }

    /**
     * Get the decompressor factory.
     */
    public DecompressorFactory decompressorFactory() {
        return decompressorFactory;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
