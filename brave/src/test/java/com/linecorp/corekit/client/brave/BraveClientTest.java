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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

import brave.Span;
import brave.Tracing;
import brave.handler.MutableSpan;
import brave.handler.SpanHandler;
import brave.propagation.ThreadLocalCurrentTraceContext;
import brave.propagation.TraceContext;
import brave.sampler.Sampler;

class BraveClientTest {

    private final List<MutableSpan> spans = new CopyOnWriteArrayList<>();
    private final AtomicReference<Span> currentSpan = new AtomicReference<>();

    private Tracing tracing;

    private Tracing newTracing(Sampler sampler) {
        tracing = Tracing.newBuilder()
                         .localServiceName("test")
                         .currentTraceContext(ThreadLocalCurrentTraceContext.create())
                         .sampler(sampler)
                         .addSpanHandler(new SpanHandler() {
                             @Override
                             public boolean end(TraceContext context, MutableSpan span, Cause cause) {
                                 spans.add(span);
                                 return true;
                             }
                         })
                         .build();
        return tracing;
    }

    @AfterEach
    void tearDown() {
        if (tracing != null) {
            tracing.close();
        }
    }

    @Test
    void injectsHeadersAndRecordsSpan() throws Exception {
        final Tracing tracing = newTracing(Sampler.ALWAYS_SAMPLE);
        final AtomicReference<HttpRequest> sent = new AtomicReference<>();
        final HttpClient client = BraveClient.newDecorator(tracing).apply((HttpClient) (ctx, req) -> {
            sent.set(req);
            currentSpan.set(tracing.tracer().currentSpan());
            return HttpResponse.of(200);
        });
        final ClientRequestContext ctx = ClientRequestContext.of();
        ctx.setEndpointTemplate("/users/{id}");

        client.execute(ctx, HttpRequest.of(HttpMethod.GET, "http://a.com/users/1?q=1")).close();

        assertThat(spans).hasSize(1);
        final MutableSpan span = spans.get(0);
        assertThat(span.kind()).isEqualTo(Span.Kind.CLIENT);
        assertThat(span.name()).isEqualToIgnoringCase("GET /users/{id}");
        assertThat(span.tag("http.method")).isEqualTo("GET");
        assertThat(span.tag("http.path")).isEqualTo("/users/1");
        assertThat(span.error()).isNull();

        assertThat(sent.get().headers().get("x-b3-traceid")).isEqualTo(span.traceId());
        assertThat(sent.get().headers().get("x-b3-spanid")).isEqualTo(span.id());
        assertThat(currentSpan.get().context().spanIdString()).isEqualTo(span.id());
    }

    @Test
    void recordsError() {
        final Tracing tracing = newTracing(Sampler.ALWAYS_SAMPLE);
        final IOException failure = new IOException("reset");
        final HttpClient client = BraveClient.newDecorator(tracing).apply((HttpClient) (ctx, req) -> {
            throw failure;
        });

        assertThatThrownBy(() -> client.execute(ClientRequestContext.of(),
                                                HttpRequest.of(HttpMethod.POST, "http://a.com/users")))
                .isSameAs(failure);

        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).error()).isSameAs(failure);
    }

    @Test
    void recordsErrorStatus() throws Exception {
        final Tracing tracing = newTracing(Sampler.ALWAYS_SAMPLE);
        final HttpClient client = BraveClient.newDecorator(tracing)
                                             .apply((HttpClient) (ctx, req) -> HttpResponse.of(503));

        client.execute(ClientRequestContext.of(), HttpRequest.of(HttpMethod.GET, "http://a.com/")).close();

        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).tag("http.status_code")).isEqualTo("503");
    }

    @Test
    void unsampledRequestOnlyPropagates() throws Exception {
        final Tracing tracing = newTracing(Sampler.NEVER_SAMPLE);
        final AtomicReference<HttpRequest> sent = new AtomicReference<>();
        final HttpClient client = BraveClient.newDecorator(tracing).apply((HttpClient) (ctx, req) -> {
            sent.set(req);
            return HttpResponse.of(200);
        });

        client.execute(ClientRequestContext.of(), HttpRequest.of(HttpMethod.GET, "http://a.com/")).close();

        assertThat(spans).isEmpty();
        assertThat(sent.get().headers().get("x-b3-sampled")).isEqualTo("0");
        assertThat(sent.get().headers().contains("x-b3-traceid")).isTrue();
    }
}
