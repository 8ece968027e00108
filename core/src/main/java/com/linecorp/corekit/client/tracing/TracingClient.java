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

import java.util.function.Function;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;

/**
 * An {@link HttpClient} decorator which records the elapsed time of every request as the
 * {@code toolkit.http.client.request.time} timer, tagged with:
 * <ul>
 *   <li>{@code technology}, always {@code java},</li>
 *   <li>{@code target_id}, if {@link ClientRequestContext#targetId()} is set,</li>
 *   <li>{@code method}, in lower case, and</li>
 *   <li>{@code status} and {@code status_class}, see {@link RequestMetricTags#outcome}.</li>
 * </ul>
 *
 * <p>If a Brave span is current when a request is sent, a child span named after the endpoint template
 * (or the target id) is recorded for the request.
 *
 * @see ExtendedTracingClient
 */
public final class TracingClient extends AbstractTracingClient {

    /**
     * Creates a new {@link TracingClient} decorator which records to {@link Metrics#globalRegistry}.
     */
    public static Function<? super HttpClient, TracingClient> newDecorator() {
        return newDecorator(Metrics.globalRegistry);
    }

    /**
     * Creates a new {@link TracingClient} decorator which records to the specified {@link MeterRegistry}.
     */
    public static Function<? super HttpClient, TracingClient> newDecorator(MeterRegistry meterRegistry) {
        requireNonNull(meterRegistry, "meterRegistry");
        return delegate -> new TracingClient(delegate, meterRegistry);
    }

    TracingClient(HttpClient delegate, MeterRegistry meterRegistry) {
        super(delegate, meterRegistry);
    }

    @Override
    HttpResponse doExecute(ClientRequestContext ctx, HttpRequest req,
                           Tags tags, long startNanos) throws Exception {
        return unwrap().execute(ctx, req);
    }
}
