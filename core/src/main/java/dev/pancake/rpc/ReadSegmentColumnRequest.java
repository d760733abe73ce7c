/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.rpc;

import java.util.List;
import java.util.Objects;

import dev.pancake.metadata.PartitionField;
import dev.pancake.metadata.SegmentKey;

/**
 * Request for one page of a segment column.
 *
 * @param tableName table to read from
 * @param partition partition the segment belongs to
 * @param segmentId id of the segment
 * @param columnName column to read
 * @param correlationId shared by all reads of one segment snapshot
 * @param continuationToken token from the previous page, empty for the first page
 */
public record ReadSegmentColumnRequest(
        String tableName,
        List<PartitionField> partition,
        String segmentId,
        String columnName,
        String correlationId,
        String continuationToken) {

    public ReadSegmentColumnRequest {
        Objects.requireNonNull(tableName, "tableName");
        Objects.requireNonNull(segmentId, "segmentId");
        Objects.requireNonNull(columnName, "columnName");
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(continuationToken, "continuationToken");
        partition = List.copyOf(Objects.requireNonNull(partition, "partition"));
    }

    public static ReadSegmentColumnRequest of(SegmentKey segment, String columnName, String correlationId,
                                              String continuationToken) {
        return new ReadSegmentColumnRequest(segment.tableName(), segment.partition(), segment.segmentId(),
                columnName, correlationId, continuationToken);
    }

    public boolean isFirstPage() {
        return continuationToken.isEmpty();
    }
}
