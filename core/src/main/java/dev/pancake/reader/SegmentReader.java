/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.reader;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import dev.pancake.errors.PancakeException;
import dev.pancake.internal.reader.RowAssembler;
import dev.pancake.metadata.ColumnDescriptor;
import dev.pancake.metadata.SegmentKey;
import dev.pancake.row.FieldValue;
import dev.pancake.row.Row;
import dev.pancake.rpc.SegmentColumnGateway;

/**
 * Entry point for reading segments: decodes whole columns or assembles rows from several columns.
 *
 * <pre>{@code
 * try (SegmentReader reader = SegmentReader.open(HttpSegmentColumnGateway.create("localhost", 3841))) {
 *     SegmentKey segment = SegmentKey.of("events", segmentId, PartitionField.of("day", "2021-11-01"));
 *     List<Row> rows = reader.decodeSegment(segment, List.of(
 *             ColumnDescriptor.of("id", DataType.INT64),
 *             ColumnDescriptor.of("name", DataType.STRING)));
 * }
 * }</pre>
 */
public class SegmentReader implements AutoCloseable {

    private final PancakeContext context;
    private final boolean ownsContext;
    private final RowAssembler assembler;

    private SegmentReader(SegmentColumnGateway gateway, PancakeContext context, boolean ownsContext) {
        this.context = context;
        this.ownsContext = ownsContext;
        this.assembler = new RowAssembler(gateway, context.executor(), context.decompressorFactory(),
                context.retryPolicy());
    }

    /**
     * Open a reader with its own context, released when the reader is closed.
     */
    public static SegmentReader open(SegmentColumnGateway gateway) {
        return new SegmentReader(Objects.requireNonNull(gateway, "gateway"), PancakeContext.create(), true);
    }

    /**
     * Create a reader using a shared context. Closing the reader leaves the context open.
     */
    public static SegmentReader create(SegmentColumnGateway gateway, PancakeContext context) {
        return new SegmentReader(Objects.requireNonNull(gateway, "gateway"),
                Objects.requireNonNull(context, "context"), false);
    }

    /**
     * Generate a new random correlation id.
     * <p>
     * All reads of one segment that must see the same data have to use the same
     * correlation id. Reusing an id for another segment or much later may yield
     * errors or inconsistent data, so create one per segment read.
     * </p>
     */
    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Read all values of one column of a segment, following continuation tokens.
     *
     * @return the values in row order
     * @throws PancakeException if a page could not be fetched or decoded
     */
    public List<FieldValue> decodeSegmentColumn(SegmentKey segment, ColumnDescriptor column) throws PancakeException {
        return decodeSegmentColumn(segment, column, newCorrelationId());
    }

    /**
     * Read all values of one column of a segment with the given correlation id.
     */
    public List<FieldValue> decodeSegmentColumn(SegmentKey segment, ColumnDescriptor column, String correlationId)
            throws PancakeException {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(correlationId, "correlationId");
        return assembler.readColumn(segment, column, correlationId);
    }

    /**
     * Read the given columns of a segment and assemble them into rows.
     *
     * @param columns columns to read, in the field order of the resulting rows
     * @return the rows in segment order
     * @throws PancakeException if a column could not be read, or the columns differ in length
     * @throws IllegalArgumentException if no columns are given or a column name occurs twice
     */
    public List<Row> decodeSegment(SegmentKey segment, List<ColumnDescriptor> columns) throws PancakeException {
        return await(decodeSegmentAsync(segment, columns));
    }

    /**
     * Asynchronous variant of {@link #decodeSegment(SegmentKey, List)}.
     * Cancelling the returned future aborts all column reads still in progress.
     */
    public CompletableFuture<List<Row>> decodeSegmentAsync(SegmentKey segment, List<ColumnDescriptor> columns) {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(columns, "columns");
        return assembler.assemble(segment, List.copyOf(columns), newCorrelationId());
    }

    private static <T> T await(CompletableFuture<T> future) throws PancakeException {
        try {
            return future.get();
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Interrupted while reading segment");
            cancellation.initCause(e);
            throw cancellation;
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof PancakeException) {
                throw (PancakeException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CompletionException(cause);
        }
    }

    @Override
    public void close() {
        if (ownsContext) {
            context.close();
        }
    }
}
