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
package com.linecorp.corekit.client.brave;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.common.HttpHeadersBuilder;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.annotation.Nullable;

/**
 * Wraps an {@link HttpRequest} and its {@link HttpResponse} in a {@link brave.http.HttpClientRequest} and
 * a {@link brave.http.HttpClientResponse}.
 */
final class HttpRequestAdapter {

    static brave.http.HttpClientRequest asHttpClientRequest(ClientRequestContext ctx, HttpRequest req,
                                                            HttpHeadersBuilder headersBuilder) {
        return new HttpClientRequest(ctx, req, headersBuilder);
    }

    static brave.http.HttpClientResponse asHttpClientResponse(brave.http.HttpClientRequest request,
                                                              @Nullable HttpResponse res,
                                                              @Nullable Throwable cause) {
        return new HttpClientResponse(request, res, cause);
    }

    @SuppressWarnings("ClassNameSameAsAncestorName")
    private static final class HttpClientRequest extends brave.http.HttpClientRequest {
        private final ClientRequestContext ctx;
        private final HttpRequest req;
        private final HttpHeadersBuilder headersBuilder;

        HttpClientRequest(ClientRequestContext ctx, HttpRequest req, HttpHeadersBuilder headersBuilder) {
            this.ctx = ctx;
            this.req = req;
            this.headersBuilder = headersBuilder;
        }

        @Override
        public ClientRequestContext unwrap() {
            return ctx;
        }

        @Override
        public String method() {
            return req.method().name();
        }

        @Override
        public String path() {
            return req.uri().getRawPath();
        }

        @Override
        @Nullable
        public String route() {
            return ctx.endpointTemplate();
        }

        @Override
        public String url() {
            return req.uri().toString();
        }

        @Override
        @Nullable
        public String header(String name) {
            return req.headers().get(name);
        }

        @Override
        public void header(String name, String value) {
            headersBuilder.set(name, value);
        }
    }

    @SuppressWarnings("ClassNameSameAsAncestorName")
    private static final class HttpClientResponse extends brave.http.HttpClientResponse {
        private final brave.http.HttpClientRequest request;
        @Nullable
        private final HttpResponse res;
        @Nullable
        private final Throwable cause;

        HttpClientResponse(brave.http.HttpClientRequest request, @Nullable HttpResponse res,
                           @Nullable Throwable cause) {
            this.request = request;
            this.res = res;
            this.cause = cause;
        }

        @Override
        @Nullable
        public Object unwrap() {
            return res;
        }

        @Override
        public brave.http.HttpClientRequest request() {
            return request;
        }

        @Override
        @Nullable
        public Throwable error() {
            return cause;
        }

        @Override
        public int statusCode() {
            return res != null ? res.status() : 0;
        }
    }

    private HttpRequestAdapter() {}
}
