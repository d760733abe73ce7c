/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.rpc;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.pancake.errors.TransportException;
import dev.pancake.rpc.ReadSegmentColumnResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReadSegmentColumnCodecTest {

    private final ReadSegmentColumnCodec codec = new ReadSegmentColumnCodec(new ObjectMapper());

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    @Test
    void testDataMayContainDelimiter() throws Exception {
        ReadSegmentColumnResponse response = codec.decodeResponse(bytes("{\"codec\":\"zstd\"}\n}\n\u0001"));

        assertThat(response.codec()).isEqualTo("zstd");
        assertThat(response.data()).isEqualTo(bytes("}\n\u0001"));
    }

    @Test
    void testNestedObjectInHeader() throws Exception {
        // a nested object ends with "}," never "}\n"
        ReadSegmentColumnResponse response = codec.decodeResponse(
                bytes("{\"meta\":{\"a\":1},\"continuationToken\":\"x\"}\nDATA"));

        assertThat(response.continuationToken()).isEqualTo("x");
        assertThat(response.data()).isEqualTo(bytes("DATA"));
    }

    @Test
    void testInvalidHeader() {
        assertThatThrownBy(() -> codec.decodeResponse(bytes("{not json}\n")))
                .isInstanceOfSatisfying(TransportException.class, e -> assertThat(e.isRetryable()).isFalse());
        assertThatThrownBy(() -> codec.decodeResponse(bytes("[1}\n")))
                .isInstanceOf(TransportException.class);
    }

    @Test
    void testNegativeImplicitNulls() {
        assertThatThrownBy(() -> codec.decodeResponse(bytes("{\"implicitNullsCount\":-1}\n")))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("implicit nulls");
    }
}
