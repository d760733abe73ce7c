/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.encoding;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import dev.pancake.errors.PageDecodeException;

/**
 * Big-endian reader over the bytes of one column page.
 * Every read checks the remaining length and fails with a {@link PageDecodeException}
 * naming the offset where the page ended early.
 */
final class PageBuffer {

    private final ByteBuffer buffer;
    private final String columnName;

    PageBuffer(byte[] data, String columnName) {
        this.buffer = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
        this.columnName = columnName;
    }

    boolean hasRemaining() {
        return buffer.hasRemaining();
    }

    int remaining() {
        return buffer.remaining();
    }

    int position() {
        return buffer.position();
    }

    byte readByte() throws PageDecodeException {
        require(1, "byte");
        return buffer.get();
    }

    int readInt() throws PageDecodeException {
        require(Integer.BYTES, "int");
        return buffer.getInt();
    }

    long readLong() throws PageDecodeException {
        require(Long.BYTES, "long");
        return buffer.getLong();
    }

    float readFloat() throws PageDecodeException {
        require(Float.BYTES, "float");
        return buffer.getFloat();
    }

    double readDouble() throws PageDecodeException {
        require(Double.BYTES, "double");
        return buffer.getDouble();
    }

    /**
     * Read an unsigned 32-bit length or count that must fit into an int.
     */
    int readLength() throws PageDecodeException {
        int offset = buffer.position();
        int length = readInt();
        if (length < 0) {
            throw new PageDecodeException("Invalid length " + Integer.toUnsignedString(length)
                    + " at offset " + offset + " in page of column '" + columnName + "'");
        }
        return length;
    }

    byte[] readBytes(int length) throws PageDecodeException {
        require(length, length + " bytes");
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    String readString(int length) throws PageDecodeException {
        int offset = buffer.position();
        require(length, "string of " + length + " bytes");
        ByteBuffer slice = buffer.slice(offset, length);
        buffer.position(offset + length);

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = decoder.decode(slice);
            return chars.toString();
        }
        catch (CharacterCodingException e) {
            throw new PageDecodeException("Invalid UTF-8 string at offset " + offset
                    + " in page of column '" + columnName + "'", e);
        }
    }

    private void require(int length, String what) throws PageDecodeException {
        if (buffer.remaining() < length) {
            throw new PageDecodeException("Unexpected end of page while reading " + what + " at offset "
                    + buffer.position() + " (" + buffer.remaining() + " bytes left) in page of column '"
                    + columnName + "'");
        }
    }
}
