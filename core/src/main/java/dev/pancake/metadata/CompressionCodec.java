/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.metadata;

/**
 * Compression codecs a column page may be delivered with.
 * The wire name is the value of the response's codec field; an empty name means
 * the page is not compressed.
 */
public enum CompressionCodec {
    UNCOMPRESSED(""),
    ZSTD("zstd"),
    SNAPPY("snappy"),
    LZ4("lz4"),
    GZIP("gzip");

    private final String wireName;

    CompressionCodec(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static CompressionCodec fromWireName(String name) {
        for (CompressionCodec codec : values()) {
            if (codec.wireName.equals(name)) {
                return codec;
            }
        }
        throw new IllegalArgumentException("Unknown compression codec: " + name);
    }
}
