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
package com.linecorp.corekit.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.linecorp.corekit.client.cache.CachingClient;
import com.linecorp.corekit.client.circuitbreaker.CircuitBreakerAdmission;
import com.linecorp.corekit.client.circuitbreaker.CircuitBreakerClient;
import com.linecorp.corekit.client.circuitbreaker.FailFastException;
import com.linecorp.corekit.client.hook.HookClient;
import com.linecorp.corekit.client.tracing.ExtendedTracingClient;
import com.linecorp.corekit.client.tracing.TracingClient;
import com.linecorp.corekit.common.HttpHeaderNames;
import com.linecorp.corekit.common.HttpHeaders;
import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class ClientsTest {

    private static final HttpRequest REQ = HttpRequest.of(HttpMethod.GET, "http://a.com/users/1");

    @Test
    void decoratorsRunInOrder() throws Exception {
        final List<String> trail = new ArrayList<>();
        final AtomicReference<HttpRequest> sent = new AtomicReference<>();
        final HttpClient transport = (ctx, req) -> {
            sent.set(req);
            return HttpResponse.of(200);
        };
        final SimpleMeterRegistry registry = new SimpleMeterRegistry();

        final Requester requester =
                Clients.builder()
                       .transport(transport)
                       .meterRegistry(registry)
                       .targetId("users")
                       .requestHook((ctx, req) -> {
                           // The forwarded headers and the user agent are set before the user hooks run.
                           trail.add("hook " + req.headers().get("x-request-id") + ' ' +
                                     req.headers().contains(HttpHeaderNames.USER_AGENT));
                           return req.withHeaders(req.headers().toBuilder().set("x-hook", "1").build());
                       })
                       .responseHook((ctx, req, res, cause) -> trail.add("response " + res.status()))
                       .telemetryDecorator(delegate -> (ctx, req) -> {
                           trail.add("telemetry " + ctx.targetId());
                           return delegate.execute(ctx, req);
                       })
                       .build();

        final ClientRequestContext ctx = ClientRequestContext.of();
        ctx.setForwardedHeaders(HttpHeaders.of("x-request-id", "abc"));
        requester.execute(ctx, REQ).close();

        assertThat(trail).containsExactly("hook abc true", "telemetry users", "response 200");
        assertThat(sent.get().headers().get("x-hook")).isEqualTo("1");
        assertThat(sent.get().headers().get("x-request-id")).isEqualTo("abc");
        assertThat(sent.get().headers().get(HttpHeaderNames.USER_AGENT))
                .isEqualTo(UserAgentClient.DEFAULT_USER_AGENT);

        final Timer timer = registry.find("toolkit.http.client.request.time")
                                    .tags("target_id", "users", "method", "get", "status", "200")
                                    .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isOne();
    }

    @Test
    void buildsHttpClientWithOptionalDecorators() {
        final HttpClient transport = (ctx, req) -> HttpResponse.of(200);

        final HttpClient plain = Clients.builder().transport(transport).buildHttpClient();
        assertThat(plain.as(UserAgentClient.class)).isNotNull();
        assertThat(plain.as(HookClient.class)).isNotNull();
        assertThat(plain.as(TracingClient.class)).isNotNull();
        assertThat(plain.as(TargetClient.class)).isNull();
        assertThat(plain.as(CachingClient.class)).isNull();
        assertThat(plain.as(CircuitBreakerClient.class)).isNull();
        assertThat(plain.as(ExtendedTracingClient.class)).isNull();

        final HttpClient full = Clients.builder()
                                       .transport(transport)
                                       .targetId("users")
                                       .enableCache()
                                       .enableClientTrace()
                                       .circuitBreaker(bucket -> CircuitBreakerAdmission.allowed())
                                       .buildHttpClient();
        assertThat(full).isInstanceOf(TargetClient.class);
        assertThat(full.as(CachingClient.class)).isNotNull();
        assertThat(full.as(CircuitBreakerClient.class)).isNotNull();
        assertThat(full.as(ExtendedTracingClient.class)).isNotNull();
        assertThat(full.as(TracingClient.class)).isNull();
    }

    @Test
    void circuitBreakerUsesTargetIdAsBucket() {
        final AtomicInteger sent = new AtomicInteger();
        final AtomicReference<String> bucket = new AtomicReference<>();
        final Requester requester = Clients.builder()
                                           .transport((ctx, req) -> {
                                               sent.incrementAndGet();
                                               return HttpResponse.of(200);
                                           })
                                           .meterRegistry(new SimpleMeterRegistry())
                                           .targetId("users")
                                           .circuitBreaker(b -> {
                                               bucket.set(b);
                                               return CircuitBreakerAdmission.denied();
                                           })
                                           .build();

        assertThatThrownBy(() -> requester.execute(REQ)).isInstanceOf(FailFastException.class);
        assertThat(bucket).hasValue("users");
        assertThat(sent).hasValue(0);
    }

    @Test
    void timeoutOptions() throws Exception {
        final AtomicReference<ClientRequestContext> seen = new AtomicReference<>();
        final HttpClient transport = (ctx, req) -> {
            seen.set(ctx);
            return HttpResponse.of(200);
        };

        Clients.builder().transport(transport).build().execute(REQ).close();
        assertThat(seen.get().remainingNanos()).isBetween(TimeUnit.SECONDS.toNanos(2),
                                                          TimeUnit.SECONDS.toNanos(3));

        Clients.builder().transport(transport).timeout(Duration.ofMillis(-1)).build().execute(REQ).close();
        assertThat(seen.get().remainingNanos()).isBetween(TimeUnit.SECONDS.toNanos(2),
                                                          TimeUnit.SECONDS.toNanos(3));

        Clients.builder().transport(transport).timeoutMillis(100).build().execute(REQ).close();
        assertThat(seen.get().remainingNanos()).isLessThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(100));

        Clients.builder().transport(transport).disableTimeout().build().execute(REQ).close();
        assertThat(seen.get().hasDeadline()).isFalse();
    }
}
