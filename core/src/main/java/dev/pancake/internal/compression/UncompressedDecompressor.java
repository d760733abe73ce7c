/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.compression;

/**
 * Decompressor for uncompressed data (passthrough).
 */
public class UncompressedDecompressor implements Decompressor {

    @Override
    public byte[] decompress(byte[] compressed) {
        return compressed;
    }

    @Override
    public String getName() {
        return "UNCOMPRESSED";
    }
}
