/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.compression;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

/**
 * Decompressor for GZIP compressed data, including concatenated members.
 */
public class GzipDecompressor implements Decompressor {

    private static final int GZIP_MAGIC = 0x8b1f;

    @Override
    public byte[] decompress(byte[] compressed) throws IOException {
        if (compressed.length == 0) {
            return compressed;
        }
        if (compressed.length < 10) {
            throw new IOException("GZIP data too short for header");
        }
        int magic = (compressed[0] & 0xff) | ((compressed[1] & 0xff) << 8);
        if (magic != GZIP_MAGIC) {
            throw new IOException("Not in GZIP format");
        }

        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }

    @Override
    public String getName() {
        return "GZIP";
    }
}
