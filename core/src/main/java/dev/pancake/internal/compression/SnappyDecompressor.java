/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.compression;

import java.io.IOException;

import org.xerial.snappy.Snappy;

/**
 * Decompressor for Snappy compressed data.
 */
public class SnappyDecompressor implements Decompressor {

    @Override
    public byte[] decompress(byte[] compressed) throws IOException {
        if (compressed.length == 0) {
            return compressed;
        }
        if (!Snappy.isValidCompressedBuffer(compressed)) {
            throw new IOException("Invalid Snappy compressed data of " + compressed.length + " bytes");
        }
        return Snappy.uncompress(compressed);
    }

    @Override
    public String getName() {
        return "SNAPPY";
    }
}
