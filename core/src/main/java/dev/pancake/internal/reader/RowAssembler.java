/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.reader;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import dev.pancake.errors.PancakeException;
import dev.pancake.errors.RowAlignmentException;
import dev.pancake.internal.compression.DecompressorFactory;
import dev.pancake.internal.encoding.PageDecoder;
import dev.pancake.metadata.ColumnDescriptor;
import dev.pancake.metadata.SegmentKey;
import dev.pancake.reader.RetryPolicy;
import dev.pancake.row.FieldValue;
import dev.pancake.row.Row;
import dev.pancake.row.RowLayout;
import dev.pancake.rpc.SegmentColumnGateway;

/**
 * Reads several columns of the same segment and zips their values into rows.
 * <p>
 * Each column is read by its own {@link ColumnStreamReader} task on the executor; the
 * tasks share nothing but an abort flag. Rows are only built once every column has been
 * read completely and all columns have the same length. The first failing column aborts
 * the others and its error is the one reported.
 * </p>
 */
public class RowAssembler {

    private static final Logger LOG = System.getLogger(RowAssembler.class.getName());

    private final SegmentColumnGateway gateway;
    private final Executor executor;
    private final DecompressorFactory decompressorFactory;
    private final RetryPolicy retryPolicy;

    public RowAssembler(SegmentColumnGateway gateway, Executor executor, DecompressorFactory decompressorFactory,
                        RetryPolicy retryPolicy) {
        this.gateway = gateway;
        this.executor = executor;
        this.decompressorFactory = decompressorFactory;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Read a single column on the calling thread.
     */
    public List<FieldValue> readColumn(SegmentKey segment, ColumnDescriptor column, String correlationId)
            throws PancakeException {
        return newColumnReader(segment, column, correlationId, () -> false).read();
    }

    /**
     * Read the given columns concurrently and assemble them into rows.
     * <p>
     * Cancelling the returned future aborts all column reads still in progress.
     * </p>
     *
     * @param segment the segment to read
     * @param columns the columns to read; determines the field order of the rows
     * @param correlationId sent with every request, so all columns see the same segment snapshot
     * @return future of the rows in segment order; fails with the {@link PancakeException}
     *         of the first failing column or a {@link RowAlignmentException}
     * @throws IllegalArgumentException if no columns are given or a column name occurs twice
     */
    public CompletableFuture<List<Row>> assemble(SegmentKey segment, List<ColumnDescriptor> columns,
                                                 String correlationId) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Unable to decode segment " + segment + " with no columns specified");
        }
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnDescriptor column : columns) {
            names.add(column.name());
        }
        RowLayout layout = RowLayout.of(names);

        LOG.log(Level.DEBUG, "Reading {0} columns of segment {1}, correlation id {2}",
                columns.size(), segment, correlationId);

        AtomicBoolean aborted = new AtomicBoolean();
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();

        @SuppressWarnings("unchecked")
        CompletableFuture<List<FieldValue>>[] columnFutures = new CompletableFuture[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            ColumnDescriptor column = columns.get(i);
            columnFutures[i] = CompletableFuture.supplyAsync(() -> {
                try {
                    return newColumnReader(segment, column, correlationId, aborted::get).read();
                }
                catch (PancakeException e) {
                    throw new CompletionException(e);
                }
            }, executor).whenComplete((values, error) -> {
                if (error != null && firstFailure.compareAndSet(null, unwrap(error))) {
                    aborted.set(true);
                }
            });
        }

        CompletableFuture<List<Row>> result = new CompletableFuture<>();
        CompletableFuture.allOf(columnFutures).whenComplete((ignored, error) -> {
            Throwable failure = firstFailure.get();
            if (failure != null) {
                result.completeExceptionally(failure);
                return;
            }
            List<List<FieldValue>> columnValues = new ArrayList<>(columnFutures.length);
            for (CompletableFuture<List<FieldValue>> future : columnFutures) {
                columnValues.add(future.join());
            }
            try {
                result.complete(zip(segment, layout, columnValues));
            }
            catch (RowAlignmentException e) {
                result.completeExceptionally(e);
            }
        });

        result.whenComplete((rows, error) -> {
            if (error instanceof CancellationException) {
                aborted.set(true);
            }
        });
        return result;
    }

    private ColumnStreamReader newColumnReader(SegmentKey segment, ColumnDescriptor column, String correlationId,
                                               BooleanSupplier aborted) {
        PageDecoder decoder = new PageDecoder(column, decompressorFactory);
        return new ColumnStreamReader(gateway, segment, decoder, correlationId, retryPolicy, aborted);
    }

    /**
     * Zip per-column values into rows by index.
     *
     * @throws RowAlignmentException if the columns differ in length
     */
    static List<Row> zip(SegmentKey segment, RowLayout layout, List<List<FieldValue>> columnValues)
            throws RowAlignmentException {
        int rowCount = columnValues.get(0).size();
        boolean aligned = true;
        for (List<FieldValue> values : columnValues) {
            aligned &= values.size() == rowCount;
        }
        if (!aligned) {
            Map<String, Integer> lengths = new LinkedHashMap<>();
            for (int j = 0; j < columnValues.size(); j++) {
                lengths.put(layout.name(j), columnValues.get(j).size());
            }
            throw new RowAlignmentException(segment, lengths);
        }

        List<Row> rows = new ArrayList<>(rowCount);
        FieldValue[] values = new FieldValue[columnValues.size()];
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < values.length; j++) {
                values[j] = columnValues.get(j).get(i);
            }
            rows.add(layout.row(values));
        }

        LOG.log(Level.DEBUG, "Assembled {0} rows from {1} columns of segment {2}", rowCount, values.length, segment);
        return rows;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
