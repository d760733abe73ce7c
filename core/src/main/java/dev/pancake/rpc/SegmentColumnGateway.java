/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.rpc;

import dev.pancake.errors.TransportException;

/**
 * The server call segment reads are built on: fetch one page of one column.
 * <p>
 * Implementations must be safe for concurrent use, as the columns of a segment are
 * read in parallel. A call must not have side effects on the server, so that it can be
 * repeated at the same continuation token after a transient failure.
 * </p>
 */
@FunctionalInterface
public interface SegmentColumnGateway {

    /**
     * Read one page of a segment column.
     *
     * @param request the column, segment and continuation token to read at
     * @return the page; its continuation token is empty once the column is exhausted
     * @throws TransportException if no page could be obtained
     */
    ReadSegmentColumnResponse readSegmentColumn(ReadSegmentColumnRequest request) throws TransportException;
}
