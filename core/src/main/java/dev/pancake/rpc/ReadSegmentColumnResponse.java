/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.rpc;

import java.util.Objects;

/**
 * One page of a segment column as returned by the server.
 *
 * @param data the encoded values, possibly compressed
 * @param codec codec the data is compressed with, empty if uncompressed
 * @param implicitNullsCount number of rows the column has no stored data for, reported
 *        for columns added to the table after those rows were compacted
 * @param continuationToken token for the next page, empty if this is the last page
 */
public record ReadSegmentColumnResponse(byte[] data, String codec, long implicitNullsCount, String continuationToken) {

    public ReadSegmentColumnResponse {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(continuationToken, "continuationToken");
        if (implicitNullsCount < 0) {
            throw new IllegalArgumentException("Implicit nulls count must not be negative: " + implicitNullsCount);
        }
    }

    /**
     * An uncompressed page without implicit nulls.
     */
    public static ReadSegmentColumnResponse of(byte[] data, String continuationToken) {
        return new ReadSegmentColumnResponse(data, "", 0, continuationToken);
    }

    public boolean hasMorePages() {
        return !continuationToken.isEmpty();
    }

    public boolean isCompressed() {
        return !codec.isEmpty();
    }

    @Override
    public String toString() {
        return "ReadSegmentColumnResponse[" + data.length + " bytes, codec='" + codec + "', implicitNullsCount="
                + implicitNullsCount + ", continuationToken='" + continuationToken + "']";
    }
}
