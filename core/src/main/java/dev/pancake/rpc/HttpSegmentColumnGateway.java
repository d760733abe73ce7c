/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.rpc;

import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.pancake.errors.TransportException;
import dev.pancake.internal.rpc.ReadSegmentColumnCodec;

/**
 * {@link SegmentColumnGateway} talking to the server's HTTP API.
 * <p>
 * Connection failures, timeouts and the statuses 429, 502, 503 and 504 are reported as
 * retryable {@link TransportException}s, every other non-200 status as a non-retryable one.
 * </p>
 */
public class HttpSegmentColumnGateway implements SegmentColumnGateway {

    private static final Logger LOG = System.getLogger(HttpSegmentColumnGateway.class.getName());

    static final String READ_SEGMENT_COLUMN_PATH = "/rest/read_segment_column";
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 502, 503, 504);
    private static final int MAX_ERROR_TEXT_LENGTH = 500;

    private final HttpClient httpClient;
    private final URI readSegmentColumnUri;
    private final Duration requestTimeout;
    private final ReadSegmentColumnCodec codec;

    public HttpSegmentColumnGateway(HttpClient httpClient, URI baseUri, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.readSegmentColumnUri = Objects.requireNonNull(baseUri, "baseUri").resolve(READ_SEGMENT_COLUMN_PATH);
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.codec = new ReadSegmentColumnCodec(new ObjectMapper());
    }

    /**
     * Create a gateway for the server at the given host and HTTP port.
     */
    public static HttpSegmentColumnGateway create(String host, int port) {
        return create(URI.create("http://" + host + ":" + port), DEFAULT_REQUEST_TIMEOUT);
    }

    public static HttpSegmentColumnGateway create(URI baseUri, Duration requestTimeout) {
        HttpClient client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
        return new HttpSegmentColumnGateway(client, baseUri, requestTimeout);
    }

    @Override
    public ReadSegmentColumnResponse readSegmentColumn(ReadSegmentColumnRequest request) throws TransportException {
        HttpRequest httpRequest = HttpRequest.newBuilder(readSegmentColumnUri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .method("GET", HttpRequest.BodyPublishers.ofByteArray(codec.encodeRequest(request)))
                .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        }
        catch (IOException e) {
            throw TransportException.retryable("Failed to read column '" + request.columnName() + "' from "
                    + readSegmentColumnUri + ": " + e, e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransportException.fatal("Interrupted while reading column '" + request.columnName() + "'", e);
        }

        int status = response.statusCode();
        if (status != 200) {
            throw new TransportException("Server returned status " + status + " for column '" + request.columnName()
                    + "': " + errorText(response.body()), RETRYABLE_STATUSES.contains(status), status, null);
        }

        ReadSegmentColumnResponse page = codec.decodeResponse(response.body());
        LOG.log(Level.TRACE, "Received {0} bytes for column ''{1}'', continuation token ''{2}''",
                page.data().length, request.columnName(), page.continuationToken());
        return page;
    }

    private static String errorText(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8).strip();
        if (text.length() > MAX_ERROR_TEXT_LENGTH) {
            return text.substring(0, MAX_ERROR_TEXT_LENGTH) + "...";
        }
        return text;
    }
}
