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

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.hook.ResponseHook;
import com.linecorp.corekit.common.HttpHeaderNames;
import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class RetryHooksTest {

    private static final HttpRequest REQ = HttpRequest.of(HttpMethod.GET, "http://a.com/");

    private static ClientRequestContext attempt(int attempt) {
        final ClientRequestContext ctx = ClientRequestContext.of();
        ctx.setRetryAttempt(attempt);
        return ctx;
    }

    @Test
    void retryHeaderIsSetOnlyOnRetries() throws Exception {
        assertThat(RetryHooks.retryHeader().onRequest(attempt(0), REQ)).isSameAs(REQ);
        assertThat(RetryHooks.retryHeader().onRequest(attempt(2), REQ).headers().get(HttpHeaderNames.X_RETRY))
                .isEqualTo("2");
    }

    @Test
    void retryMetricCountsRetriedAttempts() throws Exception {
        final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        final ResponseHook hook = RetryHooks.retryMetric(registry);
        final ClientRequestContext retry = attempt(1);
        retry.setTargetId("users");

        hook.onResponse(attempt(0), REQ, HttpResponse.of(200), null);
        assertThat(registry.getMeters()).isEmpty();

        hook.onResponse(retry, REQ, HttpResponse.of(200), null);
        hook.onResponse(retry, REQ, null, new IOException());

        final Counter ok = registry.find(RetryHooks.RETRY_COUNT_METER_NAME)
                                   .tags("target_id", "users", "method", "get", "status", "200")
                                   .counter();
        final Counter error = registry.find(RetryHooks.RETRY_COUNT_METER_NAME)
                                      .tags("status", "error", "status_class", "error")
                                      .counter();
        assertThat(ok).isNotNull();
        assertThat(ok.count()).isEqualTo(1.0);
        assertThat(error).isNotNull();
        assertThat(error.count()).isEqualTo(1.0);
    }
}
