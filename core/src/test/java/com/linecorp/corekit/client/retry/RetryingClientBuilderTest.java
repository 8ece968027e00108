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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.linecorp.corekit.client.Clients;
import com.linecorp.corekit.client.DefaultRequester;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.common.HttpHeaderNames;
import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class RetryingClientBuilderTest {

    @Test
    void retriesThroughDecoratedTransport() throws Exception {
        final List<HttpRequest> sent = new ArrayList<>();
        final HttpClient transport = (ctx, req) -> {
            sent.add(req);
            return HttpResponse.of(sent.size() < 3 ? 503 : 200);
        };
        final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        final List<String> userHookHeaders = new ArrayList<>();

        final RetryingRequester requester =
                Clients.retryingBuilder(3)
                       .transport(transport)
                       .meterRegistry(registry)
                       .requestHook((ctx, req) -> {
                           userHookHeaders.add(req.headers().get(HttpHeaderNames.X_RETRY));
                           return req;
                       })
                       .build();

        try (HttpResponse res = requester.execute(HttpRequest.of(HttpMethod.GET, "http://a.com/"))) {
            assertThat(res.status()).isEqualTo(200);
        }

        assertThat(sent).hasSize(3);
        assertThat(sent.get(0).headers().contains(HttpHeaderNames.X_RETRY)).isFalse();
        assertThat(sent.get(1).headers().get(HttpHeaderNames.X_RETRY)).isEqualTo("1");
        assertThat(sent.get(2).headers().get(HttpHeaderNames.X_RETRY)).isEqualTo("2");
        // The retry header is set before the user hooks run.
        assertThat(userHookHeaders).containsExactly(null, "1", "2");

        assertThat(registry.find(RetryHooks.RETRY_COUNT_METER_NAME).counters())
                .extracting(Counter::count)
                .containsExactlyInAnyOrder(1.0, 1.0);
        assertThat(requester.retryMax()).isEqualTo(3);
        assertThat(requester.delegate()).isInstanceOf(DefaultRequester.class);
    }

    @Test
    void rejectsNegativeRetryMax() {
        assertThatThrownBy(() -> Clients.retryingBuilder(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
