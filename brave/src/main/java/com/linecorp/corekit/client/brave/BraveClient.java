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

import static java.util.Objects.requireNonNull;

import java.util.function.Function;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.client.SimpleDecoratingHttpClient;
import com.linecorp.corekit.common.HttpHeadersBuilder;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

import brave.Span;
import brave.Tracer;
import brave.Tracer.SpanInScope;
import brave.Tracing;
import brave.http.HttpClientHandler;
import brave.http.HttpClientRequest;
import brave.http.HttpClientResponse;
import brave.http.HttpTracing;

/**
 * Decorates an {@link HttpClient} to trace outbound {@link HttpRequest}s using
 * <a href="https://github.com/openzipkin/brave">Brave</a>.
 *
 * <p>The propagation headers of the new span are injected into the request, and the span is kept in
 * scope while the delegate runs. This decorator is meant to be the innermost one so that the span covers
 * the network exchange only.
 */
public final class BraveClient extends SimpleDecoratingHttpClient {

    /**
     * Creates a new tracing {@link HttpClient} decorator using the specified {@link Tracing} instance.
     */
    public static Function<? super HttpClient, BraveClient> newDecorator(Tracing tracing) {
        requireNonNull(tracing, "tracing");
        return newDecorator(HttpTracing.create(tracing));
    }

    /**
     * Creates a new tracing {@link HttpClient} decorator using the specified {@link HttpTracing} instance.
     */
    public static Function<? super HttpClient, BraveClient> newDecorator(HttpTracing httpTracing) {
        requireNonNull(httpTracing, "httpTracing");
        return delegate -> new BraveClient(delegate, httpTracing);
    }

    private final Tracer tracer;
    private final HttpClientHandler<HttpClientRequest, HttpClientResponse> handler;

    private BraveClient(HttpClient delegate, HttpTracing httpTracing) {
        super(delegate);
        tracer = httpTracing.tracing().tracer();
        handler = HttpClientHandler.create(httpTracing);
    }

    @Override
    public HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
        final HttpHeadersBuilder newHeaders = req.headers().toBuilder();
        final HttpClientRequest braveReq = HttpRequestAdapter.asHttpClientRequest(ctx, req, newHeaders);
        final Span span = handler.handleSend(braveReq);
        req = req.withHeaders(newHeaders.build());

        // For no-op spans, we only need to inject into headers.
        if (span.isNoop()) {
            try (SpanInScope ignored = tracer.withSpanInScope(span)) {
                return unwrap().execute(ctx, req);
            }
        }

        final HttpResponse res;
        try (SpanInScope ignored = tracer.withSpanInScope(span)) {
            res = unwrap().execute(ctx, req);
        } catch (Throwable cause) {
            handler.handleReceive(HttpRequestAdapter.asHttpClientResponse(braveReq, null, cause), span);
            throw cause;
        }
        handler.handleReceive(HttpRequestAdapter.asHttpClientResponse(braveReq, res, null), span);
        return res;
    }
}
