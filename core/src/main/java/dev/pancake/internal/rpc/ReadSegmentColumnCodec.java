/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.internal.rpc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.pancake.errors.TransportException;
import dev.pancake.metadata.PartitionField;
import dev.pancake.rpc.ReadSegmentColumnRequest;
import dev.pancake.rpc.ReadSegmentColumnResponse;

/**
 * JSON mapping of the read segment column call of the server's HTTP API.
 * <p>
 * Requests are JSON objects using the protobuf JSON field names; 64-bit integers are
 * written as strings. The response body is a JSON object terminated by
 * <code>}\n</code>, directly followed by the raw page bytes.
 * </p>
 */
public final class ReadSegmentColumnCodec {

    private static final byte[] HEADER_DELIMITER = "}\n".getBytes(StandardCharsets.US_ASCII);

    private final ObjectMapper mapper;

    public ReadSegmentColumnCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encodeRequest(ReadSegmentColumnRequest request) throws TransportException {
        ObjectNode root = mapper.createObjectNode();
        root.put("tableName", request.tableName());
        ObjectNode partition = root.putObject("partition");
        for (PartitionField field : request.partition()) {
            writePartitionValue(partition.putObject(field.name()), field.value());
        }
        root.put("segmentId", request.segmentId());
        root.put("columnName", request.columnName());
        root.put("correlationId", request.correlationId());
        root.put("continuationToken", request.continuationToken());

        try {
            return mapper.writeValueAsBytes(root);
        }
        catch (IOException e) {
            throw TransportException.fatal("Failed to serialize read request for column '" + request.columnName() + "'", e);
        }
    }

    private static void writePartitionValue(ObjectNode node, Object value) {
        if (value instanceof String) {
            node.put("stringVal", (String) value);
        }
        else if (value instanceof Long) {
            node.put("int64Val", Long.toString((Long) value));
        }
        else if (value instanceof Boolean) {
            node.put("boolVal", (Boolean) value);
        }
        else if (value instanceof Instant) {
            node.put("timestampVal", value.toString());
        }
        else {
            throw new IllegalArgumentException("Unsupported partition value: " + value);
        }
    }

    /**
     * Split a response body into its JSON header and page bytes.
     */
    public ReadSegmentColumnResponse decodeResponse(byte[] body) throws TransportException {
        int delimiter = indexOf(body, HEADER_DELIMITER);
        if (delimiter < 0) {
            throw TransportException.fatal("Could not parse read segment column response: no header delimiter in "
                    + body.length + " bytes", null);
        }

        JsonNode header;
        try {
            header = mapper.readTree(body, 0, delimiter + 1);
        }
        catch (IOException e) {
            throw TransportException.fatal("Could not parse read segment column response header", e);
        }
        if (header == null || !header.isObject()) {
            throw TransportException.fatal("Read segment column response header is not a JSON object", null);
        }

        long implicitNullsCount = header.path("implicitNullsCount").asLong(0);
        if (implicitNullsCount < 0) {
            throw TransportException.fatal("Invalid implicit nulls count in response: " + implicitNullsCount, null);
        }
        byte[] data = Arrays.copyOfRange(body, delimiter + HEADER_DELIMITER.length, body.length);
        return new ReadSegmentColumnResponse(
                data,
                header.path("codec").asText(""),
                implicitNullsCount,
                header.path("continuationToken").asText(""));
    }

    private static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
