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

import static java.util.Objects.requireNonNull;

import java.net.URI;

import com.google.common.base.MoreObjects;

/**
 * An immutable HTTP request. Use {@link #builder(HttpMethod, String)} or the {@code with*()} methods to
 * create a modified copy.
 */
public final class HttpRequest {

    /**
     * Returns a new {@link HttpRequest} without headers and body.
     */
    public static HttpRequest of(HttpMethod method, String uri) {
        return builder(method, uri).build();
    }

    /**
     * Returns a new {@link HttpRequest} without headers and body.
     */
    public static HttpRequest of(HttpMethod method, URI uri) {
        return builder(method, uri).build();
    }

    /**
     * Returns a newly created {@link HttpRequestBuilder}.
     */
    public static HttpRequestBuilder builder(HttpMethod method, String uri) {
        requireNonNull(uri, "uri");
        return builder(method, URI.create(uri));
    }

    /**
     * Returns a newly created {@link HttpRequestBuilder}.
     */
    public static HttpRequestBuilder builder(HttpMethod method, URI uri) {
        return new HttpRequestBuilder(method, uri);
    }

    private final HttpMethod method;
    private final URI uri;
    private final HttpHeaders headers;
    private final RequestBody body;

    HttpRequest(HttpMethod method, URI uri, HttpHeaders headers, RequestBody body) {
        this.method = method;
        this.uri = uri;
        this.headers = headers;
        this.body = body;
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public HttpHeaders headers() {
        return headers;
    }

    /**
     * Returns the body of this request, which is {@link RequestBody#empty()} when the request has none.
     */
    public RequestBody body() {
        return body;
    }

    /**
     * Returns a copy of this request with the specified headers.
     */
    public HttpRequest withHeaders(HttpHeaders headers) {
        requireNonNull(headers, "headers");
        return new HttpRequest(method, uri, headers, body);
    }

    /**
     * Returns a copy of this request with the specified body.
     */
    public HttpRequest withBody(RequestBody body) {
        requireNonNull(body, "body");
        if (body == this.body) {
            return this;
        }
        return new HttpRequest(method, uri, headers, body);
    }

    /**
     * Returns a {@link HttpRequestBuilder} initialized with the properties of this request.
     */
    public HttpRequestBuilder toBuilder() {
        return new HttpRequestBuilder(this);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("method", method)
                          .add("uri", uri)
                          .add("headers", headers)
                          .add("body", body)
                          .toString();
    }
}
