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
package com.linecorp.corekit.client.retry;

import static java.util.Objects.requireNonNull;

import com.linecorp.corekit.client.hook.RequestHook;
import com.linecorp.corekit.client.hook.ResponseHook;
import com.linecorp.corekit.client.tracing.RequestMetricTags;
import com.linecorp.corekit.common.HttpHeaderNames;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Hooks which expose the {@linkplain com.linecorp.corekit.client.ClientRequestContext#retryAttempt()
 * retry attempt} set by a {@link RetryingRequester}.
 */
public final class RetryHooks {

    static final String RETRY_COUNT_METER_NAME = "toolkit.http.client.request.retry.count";

    private static final RequestHook RETRY_HEADER = (ctx, req) -> {
        final int attempt = ctx.retryAttempt();
        if (attempt <= 0) {
            return req;
        }
        return req.withHeaders(req.headers().toBuilder()
                                  .set(HttpHeaderNames.X_RETRY, String.valueOf(attempt))
                                  .build());
    };

    /**
     * Returns a {@link RequestHook} which sets the {@code x-retry} header to the attempt number
     * when the request is a retry.
     */
    public static RequestHook retryHeader() {
        return RETRY_HEADER;
    }

    /**
     * Returns a {@link ResponseHook} which increments the {@value #RETRY_COUNT_METER_NAME} counter for
     * every retried attempt, tagged with the request and its outcome.
     */
    public static ResponseHook retryMetric(MeterRegistry meterRegistry) {
        requireNonNull(meterRegistry, "meterRegistry");
        return (ctx, req, res, cause) -> {
            if (ctx.retryAttempt() <= 0) {
                return;
            }
            meterRegistry.counter(RETRY_COUNT_METER_NAME,
                                  RequestMetricTags.common(ctx, req).and(RequestMetricTags.outcome(res, cause)))
                         .increment();
        };
    }

    private RetryHooks() {}
}
