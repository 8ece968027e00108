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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.common.HttpHeaders;
import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class ForwardedHeadersRequestHookTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ForwardedHeadersRequestHook hook = new ForwardedHeadersRequestHook(registry);

    @Test
    void returnsRequestAsIsWithoutForwardedHeaders() {
        final HttpRequest req = HttpRequest.of(HttpMethod.GET, "http://a.com/");
        assertThat(hook.onRequest(ClientRequestContext.of(), req)).isSameAs(req);
    }

    @Test
    void copiesForwardedHeaders() {
        final ClientRequestContext ctx = ClientRequestContext.of();
        ctx.setForwardedHeaders(HttpHeaders.of("x-b3-traceid", "463ac35c9f6413ad",
                                               "x-request-id", "abc"));

        final HttpRequest res = hook.onRequest(ctx, HttpRequest.of(HttpMethod.GET, "http://a.com/"));

        assertThat(res.headers().get("x-b3-traceid")).isEqualTo("463ac35c9f6413ad");
        assertThat(res.headers().get("x-request-id")).isEqualTo("abc");
        assertThat(registry.getMeters()).isEmpty();
    }

    @Test
    void keepsExistingHeaderAndCountsDifference() {
        final ClientRequestContext ctx = ClientRequestContext.of();
        ctx.setTargetId("users");
        ctx.setForwardedHeaders(HttpHeaders.of("x-request-id", "abc", "x-flag", "on"));
        final HttpRequest req = HttpRequest.builder(HttpMethod.GET, "http://a.com/")
                                           .header("X-Request-Id", "xyz")
                                           .header("x-flag", "on")
                                           .build();

        final HttpRequest res = hook.onRequest(ctx, req);

        assertThat(res.headers().getAll("x-request-id")).containsExactly("xyz");
        assertThat(res.headers().get("x-flag")).isEqualTo("on");

        final Counter counter = registry.find(ForwardedHeadersRequestHook.FORWARDED_HEADER_DIFF_METER_NAME)
                                        .tags("stack", "java", "header", "x-request-id",
                                              "target_id", "users")
                                        .counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
        assertThat(registry.find(ForwardedHeadersRequestHook.FORWARDED_HEADER_DIFF_METER_NAME)
                           .tag("header", "x-flag")
                           .counter()).isNull();
    }
}
