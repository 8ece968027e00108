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

import java.net.URI;

/**
 * Builds a new {@link HttpRequest}.
 */
public final class HttpRequestBuilder {

    private HttpMethod method;
    private URI uri;
    private final HttpHeadersBuilder headers;
    private RequestBody body;

    HttpRequestBuilder(HttpMethod method, URI uri) {
        this.method = requireNonNull(method, "method");
        this.uri = validateUri(uri);
        headers = HttpHeaders.builder();
        body = RequestBody.empty();
    }

    HttpRequestBuilder(HttpRequest request) {
        method = request.method();
        uri = request.uri();
        headers = request.headers().toBuilder();
        body = request.body();
    }

    private static URI validateUri(URI uri) {
        requireNonNull(uri, "uri");
        checkArgument(uri.isAbsolute(), "uri: %s (expected: an absolute URI)", uri);
        return uri;
    }

    public HttpRequestBuilder method(HttpMethod method) {
        this.method = requireNonNull(method, "method");
        return this;
    }

    public HttpRequestBuilder uri(URI uri) {
        this.uri = validateUri(uri);
        return this;
    }

    /**
     * Adds a header value, keeping the existing values of the same name.
     */
    public HttpRequestBuilder header(String name, String value) {
        headers.add(name, value);
        return this;
    }

    /**
     * Adds all of the specified headers.
     */
    public HttpRequestBuilder headers(HttpHeaders headers) {
        this.headers.add(headers);
        return this;
    }

    /**
     * Sets a header, replacing the existing values of the same name.
     */
    public HttpRequestBuilder setHeader(String name, String value) {
        headers.set(name, value);
        return this;
    }

    public HttpRequestBuilder removeHeader(String name) {
        headers.remove(name);
        return this;
    }

    public HttpRequestBuilder body(RequestBody body) {
        this.body = requireNonNull(body, "body");
        return this;
    }

    public HttpRequestBuilder body(byte[] body) {
        return body(RequestBody.of(body));
    }

    public HttpRequestBuilder body(String body) {
        return body(RequestBody.ofUtf8(body));
    }

    /**
     * Returns a newly created {@link HttpRequest}.
     */
    public HttpRequest build() {
        return new HttpRequest(method, uri, headers.build(), body);
    }
}
