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
package com.linecorp.corekit.client.tracing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.RequestTimeoutException;

import brave.Span;
import brave.Tracer.SpanInScope;
import brave.Tracing;
import brave.handler.MutableSpan;
import brave.handler.SpanHandler;
import brave.propagation.ThreadLocalCurrentTraceContext;
import brave.propagation.TraceContext;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class TracingClientTest {

    private static final HttpRequest REQ = HttpRequest.of(HttpMethod.POST, "http://a.com/users");

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void recordsRequestTime() throws Exception {
        final HttpClient client = TracingClient.newDecorator(registry)
                                               .apply((HttpClient) (ctx, req) -> HttpResponse.of(201));
        final ClientRequestContext ctx = ClientRequestContext.of();
        ctx.setTargetId("users");

        client.execute(ctx, REQ).close();

        final Timer timer = registry.find(AbstractTracingClient.REQUEST_TIME_METER_NAME)
                                    .tags("technology", "java", "target_id", "users", "method", "post",
                                          "status", "201", "status_class", "2xx")
                                    .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isOne();
    }

    @Test
    void recordsFailures() {
        final HttpClient timingOut = TracingClient.newDecorator(registry).apply((HttpClient) (ctx, req) -> {
            throw new RequestTimeoutException();
        });
        final HttpClient failing = TracingClient.newDecorator(registry).apply((HttpClient) (ctx, req) -> {
            throw new IOException("reset");
        });

        assertThatThrownBy(() -> timingOut.execute(ClientRequestContext.of(), REQ))
                .isInstanceOf(RequestTimeoutException.class);
        assertThatThrownBy(() -> failing.execute(ClientRequestContext.of(), REQ))
                .isInstanceOf(IOException.class);

        assertThat(registry.find(AbstractTracingClient.REQUEST_TIME_METER_NAME)
                           .tags("status", "timeout", "status_class", "error")
                           .timer()).isNotNull();
        assertThat(registry.find(AbstractTracingClient.REQUEST_TIME_METER_NAME)
                           .tags("status", "error", "status_class", "error")
                           .timer()).isNotNull();
        assertThat(registry.find(AbstractTracingClient.REQUEST_TIME_METER_NAME)
                           .tagKeys("target_id")
                           .timer()).isNull();
    }

    @Test
    void recordsChildSpanOfCurrentSpan() throws Exception {
        final List<MutableSpan> spans = new CopyOnWriteArrayList<>();
        try (Tracing tracing = Tracing.newBuilder()
                                      .currentTraceContext(ThreadLocalCurrentTraceContext.create())
                                      .addSpanHandler(new SpanHandler() {
                                          @Override
                                          public boolean end(TraceContext context, MutableSpan span,
                                                             Cause cause) {
                                              spans.add(span);
                                              return true;
                                          }
                                      })
                                      .build()) {
            final AtomicReference<TraceContext> currentInDelegate = new AtomicReference<>();
            final HttpClient client = TracingClient.newDecorator(registry).apply((HttpClient) (ctx, req) -> {
                currentInDelegate.set(tracing.currentTraceContext().get());
                return HttpResponse.of(200);
            });
            final ClientRequestContext ctx = ClientRequestContext.of();
            ctx.setEndpointTemplate("/users");

            // No span without a current span.
            client.execute(ctx, REQ).close();
            assertThat(spans).isEmpty();

            final Span parent = tracing.tracer().newTrace().name("parent").start();
            try (SpanInScope ignored = tracing.tracer().withSpanInScope(parent)) {
                client.execute(ctx, REQ).close();
                assertThat(tracing.tracer().currentSpan().context()).isEqualTo(parent.context());
            } finally {
                parent.finish();
            }

            assertThat(spans).hasSize(2);
            final MutableSpan child = spans.get(0);
            assertThat(child.name()).isEqualToIgnoringCase("POST /users");
            assertThat(child.kind()).isEqualTo(Span.Kind.CLIENT);
            assertThat(child.tag("http.method")).isEqualTo("POST");
            assertThat(child.tag("http.status_code")).isEqualTo("200");
            assertThat(child.traceId()).isEqualTo(parent.context().traceIdString());
            assertThat(child.parentId()).isEqualTo(parent.context().spanIdString());
            assertThat(currentInDelegate.get().spanIdString()).isEqualTo(child.id());
        }
    }
}
