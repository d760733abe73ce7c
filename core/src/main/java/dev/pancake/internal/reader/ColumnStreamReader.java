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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import dev.pancake.errors.PageDecodeException;
import dev.pancake.errors.PancakeException;
import dev.pancake.errors.TransportException;
import dev.pancake.internal.encoding.PageDecoder;
import dev.pancake.metadata.ColumnDescriptor;
import dev.pancake.metadata.SegmentKey;
import dev.pancake.reader.RetryPolicy;
import dev.pancake.row.FieldValue;
import dev.pancake.rpc.ReadSegmentColumnRequest;
import dev.pancake.rpc.ReadSegmentColumnResponse;
import dev.pancake.rpc.SegmentColumnGateway;

/**
 * Reads all values of one column of one segment, following continuation tokens until
 * the server reports the column as exhausted.
 * <p>
 * The reader is a small state machine (see {@link ReadState}) and is single-use.
 * Page boundaries are chosen by the server; nothing is assumed about how many values a
 * page holds. The result is all or nothing: if any page fails, the values accumulated so
 * far are dropped and the error is propagated.
 * </p>
 * <p>
 * Values decoded from compressed pages come first, followed by the implicit nulls
 * reported with the last page, followed by values from uncompressed pages.
 * </p>
 */
public class ColumnStreamReader {

    private static final Logger LOG = System.getLogger(ColumnStreamReader.class.getName());

    private final SegmentColumnGateway gateway;
    private final SegmentKey segment;
    private final ColumnDescriptor column;
    private final String correlationId;
    private final PageDecoder decoder;
    private final RetryPolicy retryPolicy;
    private final BooleanSupplier aborted;

    private ReadState state = ReadState.START;
    private String continuationToken = "";
    private int requestCount;

    private List<FieldValue> compactedValues;
    private List<FieldValue> flushedValues;
    private boolean sawCompressedData;
    private long implicitNullsCount;

    /**
     * @param gateway the server to read pages from
     * @param segment the segment to read
     * @param decoder decoder for the pages of the column to read
     * @param correlationId correlation id sent with every request
     * @param retryPolicy policy for retryable transport failures
     * @param aborted checked before every request; once true, the read stops with a {@link CancellationException}
     */
    public ColumnStreamReader(SegmentColumnGateway gateway, SegmentKey segment, PageDecoder decoder,
                              String correlationId, RetryPolicy retryPolicy, BooleanSupplier aborted) {
        this.gateway = gateway;
        this.segment = segment;
        this.column = decoder.getColumn();
        this.correlationId = correlationId;
        this.decoder = decoder;
        this.retryPolicy = retryPolicy;
        this.aborted = aborted;
    }

    /**
     * Read the complete column.
     *
     * @return all values of the column in row order
     * @throws PancakeException if a page could not be fetched or decoded
     * @throws CancellationException if the read was aborted
     * @throws IllegalStateException if this reader was used before
     */
    public List<FieldValue> read() throws PancakeException {
        if (state != ReadState.START) {
            throw new IllegalStateException("Reader for column '" + column.name() + "' was already used, state " + state);
        }

        try {
            while (true) {
                switch (state) {
                    case START -> {
                        continuationToken = "";
                        compactedValues = new ArrayList<>();
                        flushedValues = new ArrayList<>();
                        state = ReadState.FETCHING;
                    }
                    case FETCHING -> {
                        checkNotAborted();
                        ReadSegmentColumnResponse page = fetchPage();
                        appendPage(page);
                        continuationToken = page.continuationToken();
                        state = page.hasMorePages() ? ReadState.FETCHING : ReadState.DONE;
                    }
                    case DONE -> {
                        return finish();
                    }
                    case FAILED -> throw new IllegalStateException("Unreachable");
                }
            }
        }
        catch (PancakeException | RuntimeException e) {
            state = ReadState.FAILED;
            compactedValues = null;
            flushedValues = null;
            throw e;
        }
    }

    public ReadState getState() {
        return state;
    }

    /**
     * Number of requests sent so far, retries included.
     */
    public int getRequestCount() {
        return requestCount;
    }

    private void appendPage(ReadSegmentColumnResponse page) throws PancakeException {
        List<FieldValue> values = decoder.decodePage(page.codec(), page.data());
        if (page.isCompressed()) {
            compactedValues.addAll(values);
            sawCompressedData |= page.data().length > 0;
        }
        else {
            flushedValues.addAll(values);
        }
        implicitNullsCount = page.implicitNullsCount();

        LOG.log(Level.TRACE, "Decoded {0} values from page {1} of column ''{2}'' in segment {3}",
                values.size(), requestCount, column.name(), segment);
    }

    private List<FieldValue> finish() throws PageDecodeException {
        if (sawCompressedData && implicitNullsCount > 0) {
            throw new PageDecodeException("Contradictory read responses for column '" + column.name()
                    + "': both compacted data and " + implicitNullsCount + " implicit nulls received");
        }
        long total = compactedValues.size() + implicitNullsCount + flushedValues.size();
        if (total > Integer.MAX_VALUE - 8) {
            throw new PageDecodeException("Column '" + column.name() + "' has too many values: " + total);
        }

        List<FieldValue> values = new ArrayList<>((int) total);
        values.addAll(compactedValues);
        values.addAll(Collections.nCopies((int) implicitNullsCount, FieldValue.NULL));
        values.addAll(flushedValues);
        compactedValues = null;
        flushedValues = null;

        LOG.log(Level.DEBUG, "Read {0} values of column ''{1}'' in segment {2} with {3} requests",
                values.size(), column.name(), segment, requestCount);
        return values;
    }

    private ReadSegmentColumnResponse fetchPage() throws TransportException {
        ReadSegmentColumnRequest request = ReadSegmentColumnRequest.of(segment, column.name(), correlationId,
                continuationToken);
        int retry = 0;
        while (true) {
            requestCount++;
            try {
                return gateway.readSegmentColumn(request);
            }
            catch (TransportException e) {
                if (!e.isRetryable() || retry >= retryPolicy.maxRetries()) {
                    throw e;
                }
                retry++;
                Duration backoff = retryPolicy.backoff(retry);
                LOG.log(Level.WARNING, "Transient failure reading column ''{0}'' of segment {1}, retry {2} of {3} in {4} ms: {5}",
                        column.name(), segment, retry, retryPolicy.maxRetries(), backoff.toMillis(), e.getMessage());
                sleep(backoff);
                checkNotAborted();
            }
        }
    }

    private void checkNotAborted() {
        if (aborted.getAsBoolean()) {
            throw new CancellationException("Read of column '" + column.name() + "' in segment " + segment + " was aborted");
        }
    }

    private static void sleep(Duration backoff) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Interrupted while waiting to retry");
            cancellation.initCause(e);
            throw cancellation;
        }
    }
}
