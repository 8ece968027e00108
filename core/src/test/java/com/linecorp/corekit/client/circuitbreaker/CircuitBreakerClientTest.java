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
package com.linecorp.corekit.client.circuitbreaker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class CircuitBreakerClientTest {

    private static final HttpRequest REQ = HttpRequest.of(HttpMethod.GET, "http://a.com/users/1");

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private HttpClient newClient(CircuitBreaker breaker, HttpClient delegate) {
        return CircuitBreakerClient.newDecorator(breaker, CircuitBreakerClient.defaultSuccessPredicate(),
                                                 BucketMapping.ofDefault(), registry)
                                   .apply(delegate);
    }

    @Test
    void rejectedRequestFailsFast() {
        final AtomicInteger sent = new AtomicInteger();
        final HttpClient client = newClient(bucket -> CircuitBreakerAdmission.denied(), (ctx, req) -> {
            sent.incrementAndGet();
            return HttpResponse.of(200);
        });
        final ClientRequestContext ctx = ClientRequestContext.of();
        ctx.setTargetId("users");

        assertThatThrownBy(() -> client.execute(ctx, REQ))
                .isInstanceOfSatisfying(FailFastException.class,
                                        cause -> assertThat(cause.bucket()).isEqualTo("users"));
        assertThat(sent).hasValue(0);

        final Counter counter = registry.find(CircuitBreakerClient.CIRCUIT_BREAKER_OPEN_METER_NAME)
                                        .tags("target_id", "users", "bucket", "users")
                                        .counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void reportsOutcomes() throws Exception {
        final CircuitBreakerAdmission admission = mock(CircuitBreakerAdmission.class);
        when(admission.isAllowed()).thenReturn(true);
        final CircuitBreaker breaker = mock(CircuitBreaker.class);
        when(breaker.allow(anyString())).thenReturn(admission);

        newClient(breaker, (ctx, req) -> HttpResponse.of(404)).execute(ClientRequestContext.of(), REQ);
        verify(admission).onSuccess();
        verify(admission, never()).onFailure();

        newClient(breaker, (ctx, req) -> HttpResponse.of(501)).execute(ClientRequestContext.of(), REQ);
        verify(admission).onFailure();

        final IOException failure = new IOException("reset");
        assertThatThrownBy(() -> newClient(breaker, (ctx, req) -> {
            throw failure;
        }).execute(ClientRequestContext.of(), REQ)).isSameAs(failure);
        verify(admission, times(2)).onFailure();
        verify(breaker, times(3)).allow("");
    }

    @Test
    void bucketFallsBackToEndpointTemplate() {
        final ClientRequestContext ctx = ClientRequestContext.of();
        assertThat(BucketMapping.ofDefault().bucket(ctx, REQ)).isEmpty();

        ctx.setEndpointTemplate("/users/{id}");
        assertThat(BucketMapping.ofDefault().bucket(ctx, REQ)).isEqualTo("/users/{id}");

        ctx.setTargetId("users");
        assertThat(BucketMapping.ofDefault().bucket(ctx, REQ)).isEqualTo("users");
    }

    @Test
    void customSuccessPredicate() throws Exception {
        final CircuitBreakerAdmission admission = mock(CircuitBreakerAdmission.class);
        when(admission.isAllowed()).thenReturn(true);
        final HttpClient client = CircuitBreakerClient.newDecorator(bucket -> admission,
                                                                    res -> res.status() < 400)
                                                      .apply((HttpClient) (ctx, req) -> HttpResponse.of(429));

        client.execute(ClientRequestContext.of(), REQ);
        verify(admission).onFailure();
    }

    @Test
    void exposesCircuitBreaker() {
        final CircuitBreaker breaker = bucket -> CircuitBreakerAdmission.allowed();
        final HttpClient client = newClient(breaker, (ctx, req) -> HttpResponse.of(200));
        assertThat(client.as(CircuitBreakerClient.class).circuitBreaker()).isSameAs(breaker);
    }
}
