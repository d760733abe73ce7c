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

import net.jpountz.lz4.LZ4FrameInputStream;

/**
 * Decompressor for LZ4 data in the standard LZ4 frame format.
 * <p>
 * The frame format is self-delimiting, so no uncompressed size has to travel with the page.
 * Concatenated frames are read one after the other.
 * </p>
 */
public class Lz4Decompressor implements Decompressor {

    @Override
    public byte[] decompress(byte[] compressed) throws IOException {
        if (compressed.length == 0) {
            return compressed;
        }
        try (InputStream in = new LZ4FrameInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
        catch (RuntimeException e) {
            throw new IOException("LZ4 decompression failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "LZ4";
    }
}
