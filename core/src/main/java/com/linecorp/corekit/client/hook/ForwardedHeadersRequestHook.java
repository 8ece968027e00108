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
package com.linecorp.corekit.client.hook;

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.common.HttpHeaders;
import com.linecorp.corekit.common.HttpHeadersBuilder;
import com.linecorp.corekit.common.HttpRequest;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * A {@link RequestHook} which copies {@link ClientRequestContext#forwardedHeaders()} into the outgoing
 * request, so that tracing headers of an incoming request reach the downstream services.
 *
 * <p>A header the caller has already set keeps its value. If that value differs from the one being
 * forwarded, the {@value #FORWARDED_HEADER_DIFF_METER_NAME} counter is incremented instead.
 */
public final class ForwardedHeadersRequestHook implements RequestHook {

    static final String FORWARDED_HEADER_DIFF_METER_NAME = "platform.traffic.forwarded_header.diff";

    private final MeterRegistry meterRegistry;

    /**
     * Creates a new instance which records its counter to the specified {@link MeterRegistry}.
     */
    public ForwardedHeadersRequestHook(MeterRegistry meterRegistry) {
        this.meterRegistry = requireNonNull(meterRegistry, "meterRegistry");
    }

    @Override
    public HttpRequest onRequest(ClientRequestContext ctx, HttpRequest req) {
        final HttpHeaders forwarded = ctx.forwardedHeaders();
        if (forwarded.isEmpty()) {
            return req;
        }

        final HttpHeaders headers = req.headers();
        final HttpHeadersBuilder builder = headers.toBuilder();
        for (String name : forwarded.names()) {
            final String value = forwarded.get(name);
            final String existing = headers.get(name);
            if (existing != null) {
                if (!existing.equals(value)) {
                    final String targetId = ctx.targetId();
                    meterRegistry.counter(FORWARDED_HEADER_DIFF_METER_NAME,
                                          "stack", "java",
                                          "header", name,
                                          "target_id", targetId != null ? targetId : "none")
                                 .increment();
                }
                continue;
            }
            builder.set(name, value);
        }
        return req.withHeaders(builder.build());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).toString();
    }
}
