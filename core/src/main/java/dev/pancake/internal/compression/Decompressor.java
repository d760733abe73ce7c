/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.compression;

import java.io.IOException;

/**
 * Interface for decompressing the data of a column page.
 */
public interface Decompressor {

    /**
     * Decompress one page.
     *
     * @param compressed the page data as received from the server
     * @return the uncompressed data
     * @throws IOException if the data is not valid for this codec
     */
    byte[] decompress(byte[] compressed) throws IOException;

    /**
     * Get the name of this decompressor.
     */
    String getName();
}
