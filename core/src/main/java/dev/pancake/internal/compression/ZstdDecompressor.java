/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.compression;

import java.io.IOException;

import com.github.luben.zstd.Zstd;

/**
 * Decompressor for ZSTD frames. The frame header must carry the content size.
 */
public class ZstdDecompressor implements Decompressor {

    @Override
    public byte[] decompress(byte[] compressed) throws IOException {
        if (compressed.length == 0) {
            return compressed;
        }

        long uncompressedSize = Zstd.decompressedSize(compressed);
        if (uncompressedSize < 0 || uncompressedSize > Integer.MAX_VALUE) {
            throw new IOException("ZSTD frame does not declare a usable content size: " + uncompressedSize);
        }
        if (uncompressedSize == 0) {
            return new byte[0];
        }

        try {
            byte[] uncompressed = Zstd.decompress(compressed, (int) uncompressedSize);
            if (uncompressed.length != uncompressedSize) {
                throw new IOException(
                        "ZSTD decompression size mismatch: expected " + uncompressedSize + ", got " + uncompressed.length);
            }
            return uncompressed;
        }
        catch (RuntimeException e) {
            throw new IOException("ZSTD decompression failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "ZSTD";
    }
}
