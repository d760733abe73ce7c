/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import dev.pancake.metadata.SegmentKey;

/**
 * Columns of one segment decoded to different numbers of values, so they cannot be
 * zipped into rows. Indicates inconsistent data on the server.
 */
public class RowAlignmentException extends PancakeException {

    private final SegmentKey segment;
    private final Map<String, Integer> columnLengths;

    public RowAlignmentException(SegmentKey segment, Map<String, Integer> columnLengths) {
        super("Columns of segment '" + segment.segmentId() + "' in table '" + segment.tableName()
                + "' (partition " + segment.partition() + ") have different lengths: "
                + columnLengths.entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(", ")));
        this.segment = segment;
        this.columnLengths = Collections.unmodifiableMap(new LinkedHashMap<>(columnLengths));
    }

    public SegmentKey getSegment() {
        return segment;
    }

    /**
     * Decoded length per column, in the order the columns were requested.
     */
    public Map<String, Integer> getColumnLengths() {
        return columnLengths;
    }
}
