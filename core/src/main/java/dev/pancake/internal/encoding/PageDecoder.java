/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.encoding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import dev.pancake.errors.PageDecodeException;
import dev.pancake.errors.PancakeException;
import dev.pancake.errors.TypeMismatchException;
import dev.pancake.internal.compression.Decompressor;
import dev.pancake.internal.compression.DecompressorFactory;
import dev.pancake.metadata.ColumnDescriptor;
import dev.pancake.metadata.CompressionCodec;
import dev.pancake.metadata.DataType;
import dev.pancake.row.FieldValue;

/**
 * Decoder for the pages of one column.
 * <p>
 * A page is a sequence of slots, one per row. A slot is either the null marker {@code 0x00}
 * or a value. Values nest {@link ColumnDescriptor#nestedListDepth()} levels of lists
 * (marker {@code 0x08}, unsigned 32-bit element count, elements) around a leaf, which is
 * the {@link DataType#getTag() tag} of the column type followed by its payload:
 * </p>
 * <ul>
 *   <li>STRING, BYTES - unsigned 32-bit length and that many bytes (UTF-8 for strings)</li>
 *   <li>INT64, TIMESTAMP_MICROS - 8 bytes</li>
 *   <li>FLOAT32 - 4 bytes, FLOAT64 - 8 bytes, IEEE 754</li>
 *   <li>BOOL - one byte, 0 or 1</li>
 * </ul>
 * <p>
 * All numbers are big-endian. List elements are never null. Decoding is pure: the same
 * bytes always yield the same values.
 * </p>
 */
public class PageDecoder {

    static final byte NULL_MARKER = 0x00;
    static final byte LIST_MARKER = 0x08;

    private final ColumnDescriptor column;
    private final DecompressorFactory decompressorFactory;

    /**
     * @param column descriptor of the column whose pages are decoded
     * @param decompressorFactory factory for decompressors of compressed pages
     */
    public PageDecoder(ColumnDescriptor column, DecompressorFactory decompressorFactory) {
        this.column = column;
        this.decompressorFactory = decompressorFactory;
    }

    public ColumnDescriptor getColumn() {
        return column;
    }

    /**
     * Decode one page as delivered by the server.
     *
     * @param codec the codec name reported with the page, empty if uncompressed
     * @param data the page bytes
     * @return the values of the page in row order
     */
    public List<FieldValue> decodePage(String codec, byte[] data) throws PancakeException {
        return decode(decompress(codec, data));
    }

    /**
     * Decode the bytes of an uncompressed page.
     */
    public List<FieldValue> decode(byte[] data) throws PancakeException {
        PageBuffer buffer = new PageBuffer(data, column.name());
        List<FieldValue> values = new ArrayList<>();

        while (buffer.hasRemaining()) {
            byte marker = buffer.readByte();
            if (marker == NULL_MARKER) {
                values.add(FieldValue.NULL);
            }
            else {
                values.add(readValue(buffer, marker, 0));
            }
        }
        return values;
    }

    private byte[] decompress(String codecName, byte[] data) throws PageDecodeException {
        CompressionCodec codec;
        try {
            codec = CompressionCodec.fromWireName(codecName);
        }
        catch (IllegalArgumentException e) {
            throw new PageDecodeException("Unsupported codec '" + codecName + "' for column '" + column.name() + "'", e);
        }
        if (codec == CompressionCodec.UNCOMPRESSED) {
            return data;
        }

        Decompressor decompressor;
        try {
            decompressor = decompressorFactory.getDecompressor(codec);
        }
        catch (UnsupportedOperationException e) {
            throw new PageDecodeException(e.getMessage(), e);
        }
        try {
            return decompressor.decompress(data);
        }
        catch (IOException e) {
            throw new PageDecodeException("Failed to decompress " + decompressor.getName() + " page of column '"
                    + column.name() + "': " + e.getMessage(), e);
        }
    }

    private FieldValue readValue(PageBuffer buffer, byte marker, int depth) throws PancakeException {
        if (marker == NULL_MARKER) {
            throw new PageDecodeException("Null list element at offset " + (buffer.position() - 1)
                    + " in page of column '" + column.name() + "'");
        }

        if (depth < column.nestedListDepth()) {
            if (marker != LIST_MARKER) {
                DataType found = requireKnownTag(buffer, marker);
                throw new TypeMismatchException(column.name(), "expected list at nesting depth " + depth
                        + " but found " + found);
            }
            int count = buffer.readLength();
            List<FieldValue> elements = new ArrayList<>(Math.min(count, buffer.remaining()));
            for (int i = 0; i < count; i++) {
                elements.add(readValue(buffer, buffer.readByte(), depth + 1));
            }
            return FieldValue.list(elements);
        }

        if (marker == LIST_MARKER) {
            throw new TypeMismatchException(column.name(), "expected " + column.dataType()
                    + " but found list at nesting depth " + depth);
        }
        DataType found = requireKnownTag(buffer, marker);
        if (found != column.dataType()) {
            throw new TypeMismatchException(column.name(), "expected " + column.dataType() + " but found " + found);
        }
        return readLeaf(buffer, found);
    }

    private FieldValue readLeaf(PageBuffer buffer, DataType type) throws PageDecodeException {
        return switch (type) {
            case STRING -> FieldValue.string(buffer.readString(buffer.readLength()));
            case BYTES -> FieldValue.bytes(buffer.readBytes(buffer.readLength()));
            case INT64 -> FieldValue.int64(buffer.readLong());
            case TIMESTAMP_MICROS -> FieldValue.timestampMicros(buffer.readLong());
            case FLOAT32 -> FieldValue.float32(buffer.readFloat());
            case FLOAT64 -> FieldValue.float64(buffer.readDouble());
            case BOOL -> {
                int offset = buffer.position();
                byte b = buffer.readByte();
                if (b != 0 && b != 1) {
                    throw new PageDecodeException("Invalid boolean value " + b + " at offset " + offset
                            + " in page of column '" + column.name() + "'");
                }
                yield FieldValue.bool(b == 1);
            }
        };
    }

    private DataType requireKnownTag(PageBuffer buffer, byte marker) throws PageDecodeException {
        DataType type = DataType.forTag(marker);
        if (type == null) {
            throw new PageDecodeException("Unknown value tag " + (marker & 0xFF) + " at offset "
                    + (buffer.position() - 1) + " in page of column '" + column.name() + "'");
        }
        return type;
    }
}
