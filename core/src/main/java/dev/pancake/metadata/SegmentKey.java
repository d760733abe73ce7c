/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.metadata;

import java.util.List;
import java.util.Objects;

/**
 * Fully specifies a segment: table name, partition and segment id.
 */
public record SegmentKey(String tableName, List<PartitionField> partition, String segmentId) {

    public SegmentKey {
        Objects.requireNonNull(tableName, "tableName");
        Objects.requireNonNull(segmentId, "segmentId");
        partition = List.copyOf(Objects.requireNonNull(partition, "partition"));
    }

    public static SegmentKey of(String tableName, String segmentId, PartitionField... partition) {
        return new SegmentKey(tableName, List.of(partition), segmentId);
    }

    @Override
    public String toString() {
        return tableName + partition + "/" + segmentId;
    }
}
