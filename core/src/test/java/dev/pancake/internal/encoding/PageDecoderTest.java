/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.encoding;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.Test;
import org.xerial.snappy.Snappy;

import com.github.luben.zstd.Zstd;

import dev.pancake.errors.PageDecodeException;
import dev.pancake.errors.TypeMismatchException;
import dev.pancake.internal.compression.DecompressorFactory;
import dev.pancake.metadata.ColumnDescriptor;
import dev.pancake.metadata.DataType;
import dev.pancake.row.FieldValue;
import dev.pancake.testing.PageWriter;
import net.jpountz.lz4.LZ4FrameOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageDecoderTest {

    private final DecompressorFactory decompressorFactory = new DecompressorFactory();

    private PageDecoder decoder(String name, DataType type) {
        return new PageDecoder(ColumnDescriptor.of(name, type), decompressorFactory);
    }

    @Test
    void testEmptyPage() throws Exception {
        assertThat(decoder("age", DataType.INT64).decode(new byte[0])).isEmpty();
        assertThat(decoder("age", DataType.INT64).decodePage("", new byte[0])).isEmpty();
    }

    @Test
    void testInt64WithNulls() throws Exception {
        byte[] page = PageWriter.page(FieldValue.int64(33), FieldValue.NULL, FieldValue.int64(-7),
                FieldValue.int64(Long.MAX_VALUE));

        List<FieldValue> values = decoder("age", DataType.INT64).decode(page);

        assertThat(values).containsExactly(FieldValue.int64(33), FieldValue.NULL, FieldValue.int64(-7),
                FieldValue.int64(Long.MAX_VALUE));
    }

    @Test
    void testAllLeafTypes() throws Exception {
        assertThat(decoder("s", DataType.STRING).decode(PageWriter.strings("a", null, "", "grüße")))
                .containsExactly(FieldValue.string("a"), FieldValue.NULL, FieldValue.string(""),
                        FieldValue.string("grüße"));
        assertThat(decoder("b", DataType.BOOL).decode(PageWriter.page(FieldValue.bool(true), FieldValue.bool(false))))
                .containsExactly(FieldValue.bool(true), FieldValue.bool(false));
        assertThat(decoder("f", DataType.FLOAT32).decode(PageWriter.page(FieldValue.float32(1.5f))))
                .containsExactly(FieldValue.float32(1.5f));
        assertThat(decoder("d", DataType.FLOAT64).decode(PageWriter.page(FieldValue.float64(-0.25))))
                .containsExactly(FieldValue.float64(-0.25));

        List<FieldValue> bytes = decoder("raw", DataType.BYTES)
                .decode(PageWriter.page(FieldValue.bytes(new byte[]{ 1, 2, (byte) 0xFF })));
        assertThat(((FieldValue.BytesValue) bytes.get(0)).value()).containsExactly(1, 2, 0xFF);

        Instant instant = Instant.parse("2021-11-01T10:15:30.123456Z");
        List<FieldValue> timestamps = decoder("ts", DataType.TIMESTAMP_MICROS)
                .decode(PageWriter.page(FieldValue.timestamp(instant)));
        assertThat(((FieldValue.TimestampValue) timestamps.get(0)).instant()).isEqualTo(instant);
    }

    @Test
    void testNestedLists() throws Exception {
        ColumnDescriptor column = ColumnDescriptor.listOf("tags", DataType.STRING, 2);
        FieldValue first = FieldValue.list(
                FieldValue.list(FieldValue.string("a"), FieldValue.string("b")),
                FieldValue.list());
        FieldValue second = FieldValue.list();
        byte[] page = PageWriter.page(first, FieldValue.NULL, second);

        List<FieldValue> values = new PageDecoder(column, decompressorFactory).decode(page);

        assertThat(values).containsExactly(first, FieldValue.NULL, second);
        assertThat(((FieldValue.ListValue) values.get(0)).get(0)).isEqualTo(
                FieldValue.list(FieldValue.string("a"), FieldValue.string("b")));
    }

    @Test
    void testTruncatedPage() {
        byte[] page = PageWriter.longs(1, 2);
        byte[] truncated = Arrays.copyOf(page, page.length - 3);

        assertThatThrownBy(() -> decoder("age", DataType.INT64).decode(truncated))
                .isInstanceOf(PageDecodeException.class)
                .hasMessageContaining("Unexpected end of page");
    }

    @Test
    void testTruncatedString() {
        byte[] page = new PageWriter().raw(DataType.STRING.getTag(), 0, 0, 0, 10, 'a', 'b').toByteArray();

        assertThatThrownBy(() -> decoder("name", DataType.STRING).decode(page))
                .isInstanceOf(PageDecodeException.class);
    }

    @Test
    void testUnknownTag() {
        byte[] page = new PageWriter().raw(0x42, 0, 0).toByteArray();

        assertThatThrownBy(() -> decoder("age", DataType.INT64).decode(page))
                .isInstanceOf(PageDecodeException.class)
                .hasMessageContaining("Unknown value tag 66");
    }

    @Test
    void testInvalidBoolean() {
        byte[] page = new PageWriter().raw(DataType.BOOL.getTag(), 2).toByteArray();

        assertThatThrownBy(() -> decoder("flag", DataType.BOOL).decode(page))
                .isInstanceOf(PageDecodeException.class)
                .hasMessageContaining("Invalid boolean value 2");
    }

    @Test
    void testInvalidUtf8() {
        byte[] page = new PageWriter().raw(DataType.STRING.getTag(), 0, 0, 0, 2, 0xC3, 0x28).toByteArray();

        assertThatThrownBy(() -> decoder("name", DataType.STRING).decode(page))
                .isInstanceOf(PageDecodeException.class);
    }

    @Test
    void testTypeMismatch() {
        byte[] page = PageWriter.strings("not a number");

        assertThatThrownBy(() -> decoder("age", DataType.INT64).decode(page))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("age")
                .hasMessageContaining("INT64")
                .hasMessageContaining("STRING");
    }

    @Test
    void testListWhereLeafExpected() {
        byte[] page = PageWriter.page(FieldValue.list(FieldValue.int64(1)));

        assertThatThrownBy(() -> decoder("age", DataType.INT64).decode(page))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    void testLeafWhereListExpected() {
        ColumnDescriptor column = ColumnDescriptor.listOf("ids", DataType.INT64, 1);
        byte[] page = PageWriter.longs(5);

        assertThatThrownBy(() -> new PageDecoder(column, decompressorFactory).decode(page))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("expected list");
    }

    @Test
    void testNullListElement() {
        ColumnDescriptor column = ColumnDescriptor.listOf("ids", DataType.INT64, 1);
        byte[] page = new PageWriter().raw(PageDecoder.LIST_MARKER, 0, 0, 0, 1, PageDecoder.NULL_MARKER).toByteArray();

        assertThatThrownBy(() -> new PageDecoder(column, decompressorFactory).decode(page))
                .isInstanceOf(PageDecodeException.class)
                .hasMessageContaining("Null list element");
    }

    @Test
    void testDecodingIsDeterministic() throws Exception {
        byte[] page = PageWriter.strings("x", null, "y");
        PageDecoder decoder = decoder("name", DataType.STRING);

        assertThat(decoder.decode(page)).isEqualTo(decoder.decode(page));
    }

    @Test
    void testCompressedPages() throws Exception {
        byte[] page = PageWriter.strings("alpha", null, "beta", "gamma");
        List<FieldValue> expected = decoder("name", DataType.STRING).decode(page);

        assertThat(decoder("name", DataType.STRING).decodePage("zstd", Zstd.compress(page))).isEqualTo(expected);
        assertThat(decoder("name", DataType.STRING).decodePage("snappy", Snappy.compress(page))).isEqualTo(expected);
        assertThat(decoder("name", DataType.STRING).decodePage("lz4", lz4(page))).isEqualTo(expected);
        assertThat(decoder("name", DataType.STRING).decodePage("gzip", gzip(page))).isEqualTo(expected);
    }

    @Test
    void testUnknownCodec() {
        assertThatThrownBy(() -> decoder("name", DataType.STRING).decodePage("q_compress", new byte[]{ 1 }))
                .isInstanceOf(PageDecodeException.class)
                .hasMessageContaining("Unsupported codec 'q_compress'");
    }

    @Test
    void testCorruptCompressedPage() {
        assertThatThrownBy(() -> decoder("name", DataType.STRING).decodePage("gzip", new byte[]{ 1, 2, 3, 4 }))
                .isInstanceOf(PageDecodeException.class)
                .hasMessageContaining("Failed to decompress");
    }

    private static byte[] lz4(byte[] data) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (LZ4FrameOutputStream lz4 = new LZ4FrameOutputStream(out)) {
            lz4.write(data);
        }
        return out.toByteArray();
    }

    private static byte[] gzip(byte[] data) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        }
        return out.toByteArray();
    }
}
