/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.corekit.common;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.io.ByteStreams;

/**
 * An HTTP response whose body is a single-use {@link InputStream}.
 *
 * <p>A decorator that needs to look into the body must replace it with {@link #withBody(InputStream)},
 * e.g. with a stream that tees what the caller reads, so that the caller can still read the whole body.
 * The caller must read the body fully or {@link #close()} the response to release the connection.
 */
public final class HttpResponse implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpResponse.class);

    /**
     * Returns a new {@link HttpResponse} with the specified status and no content.
     */
    public static HttpResponse of(int status) {
        return of(status, HttpHeaders.of(), new byte[0]);
    }

    /**
     * Returns a new {@link HttpResponse} with the specified status and UTF-8 content.
     */
    public static HttpResponse of(int status, String content) {
        return of(status, HttpHeaders.of(), content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns a new {@link HttpResponse} with the specified status, headers and content.
     */
    public static HttpResponse of(int status, HttpHeaders headers, byte[] content) {
        requireNonNull(content, "content");
        return of(status, headers, new ByteArrayInputStream(content));
    }

    /**
     * Returns a new {@link HttpResponse} whose body is read from the specified {@link InputStream}.
     */
    public static HttpResponse of(int status, HttpHeaders headers, InputStream body) {
        checkArgument(status >= 0, "status: %s (expected: >= 0)", status);
        return new HttpResponse(status, requireNonNull(headers, "headers"), requireNonNull(body, "body"));
    }

    private final int status;
    private final HttpHeaders headers;
    private final InputStream body;

    private HttpResponse(int status, HttpHeaders headers, InputStream body) {
        this.status = status;
        this.headers = headers;
        this.body = body;
    }

    public int status() {
        return status;
    }

    public HttpHeaders headers() {
        return headers;
    }

    /**
     * Returns the body stream. It can be read only once.
     */
    public InputStream body() {
        return body;
    }

    /**
     * Reads the whole body and closes it.
     */
    public byte[] content() throws IOException {
        try (InputStream in = body) {
            return ByteStreams.toByteArray(in);
        }
    }

    /**
     * Reads the whole body as a UTF-8 string and closes it.
     */
    public String contentUtf8() throws IOException {
        return new String(content(), StandardCharsets.UTF_8);
    }

    /**
     * Returns whether this response was served from a local response cache.
     */
    public boolean isServedFromCache() {
        return "1".equals(headers.get(HttpHeaderNames.X_FROM_CACHE));
    }

    /**
     * Returns a copy of this response whose body is replaced with the specified stream.
     */
    public HttpResponse withBody(InputStream body) {
        return new HttpResponse(status, headers, requireNonNull(body, "body"));
    }

    /**
     * Returns a copy of this response whose headers are replaced with the specified headers.
     */
    public HttpResponse withHeaders(HttpHeaders headers) {
        return new HttpResponse(status, requireNonNull(headers, "headers"), body);
    }

    /**
     * Closes the body stream. A failure to close is logged and otherwise ignored because the response
     * is being discarded.
     */
    @Override
    public void close() {
        try {
            body.close();
        } catch (IOException e) {
            logger.debug("Failed to close the body of a response: {}", this, e);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("status", status)
                          .add("headers", headers)
                          .toString();
    }
}
