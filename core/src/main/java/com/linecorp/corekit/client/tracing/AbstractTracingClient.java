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

import static java.util.Objects.requireNonNull;

import java.util.concurrent.TimeUnit;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.client.SimpleDecoratingHttpClient;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.annotation.Nullable;

import brave.Span;
import brave.Tracer;
import brave.Tracer.SpanInScope;
import brave.Tracing;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Records the {@value #REQUEST_TIME_METER_NAME} timer of every request and annotates a child of the
 * current Brave span, if any. The child span is in scope while the delegate runs.
 */
abstract class AbstractTracingClient extends SimpleDecoratingHttpClient {

    static final String REQUEST_TIME_METER_NAME = "toolkit.http.client.request.time";

    private final MeterRegistry meterRegistry;

    AbstractTracingClient(HttpClient delegate, MeterRegistry meterRegistry) {
        super(delegate);
        this.meterRegistry = requireNonNull(meterRegistry, "meterRegistry");
    }

    final MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    @Override
    public final HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
        final Tags tags = RequestMetricTags.common(ctx, req);
        final Tracing tracing = Tracing.current();
        final Tracer tracer = tracing != null ? tracing.tracer() : null;
        final Span span = tracer != null ? startSpan(tracer, ctx, req) : null;
        final long startNanos = System.nanoTime();

        final HttpResponse res;
        try (SpanInScope ignored = span != null ? tracer.withSpanInScope(span) : null) {
            res = doExecute(ctx, req, tags, startNanos);
        } catch (Throwable cause) {
            recordSince(REQUEST_TIME_METER_NAME, tags.and(RequestMetricTags.outcome(null, cause)), startNanos);
            finishSpan(span, null, cause);
            throw cause;
        }
        recordSince(REQUEST_TIME_METER_NAME, tags.and(RequestMetricTags.outcome(res, null)), startNanos);
        finishSpan(span, res, null);
        return res;
    }

    /**
     * Sends the request through the delegate.
     *
     * @param tags the common tags of the request metrics
     * @param startNanos the {@link System#nanoTime()} when the request started
     */
    abstract HttpResponse doExecute(ClientRequestContext ctx, HttpRequest req,
                                    Tags tags, long startNanos) throws Exception;

    final void recordSince(String name, Tags tags, long startNanos) {
        Timer.builder(name)
             .tags(tags)
             .register(meterRegistry)
             .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    @Nullable
    private static Span startSpan(Tracer tracer, ClientRequestContext ctx, HttpRequest req) {
        final Span parent = tracer.currentSpan();
        if (parent == null) {
            return null;
        }
        return tracer.newChild(parent.context())
                     .kind(Span.Kind.CLIENT)
                     .name(spanName(ctx, req))
                     .tag("http.method", req.method().name())
                     .start();
    }

    private static String spanName(ClientRequestContext ctx, HttpRequest req) {
        final String method = req.method().name();
        final String endpointTemplate = ctx.endpointTemplate();
        if (endpointTemplate != null) {
            return method + ' ' + endpointTemplate;
        }
        final String targetId = ctx.targetId();
        if (targetId != null) {
            return method + ' ' + targetId;
        }
        return method;
    }

    private static void finishSpan(@Nullable Span span, @Nullable HttpResponse res, @Nullable Throwable cause) {
        if (span == null) {
            return;
        }
        if (res != null) {
            span.tag("http.status_code", String.valueOf(res.status()));
        }
        if (cause != null) {
            span.error(cause);
        }
        span.finish();
    }
}
