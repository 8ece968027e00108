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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

class HookClientTest {

    private static final HttpRequest REQ = HttpRequest.of(HttpMethod.GET, "http://a.com/");

    private static RequestHook addHeader(String name, List<String> trail) {
        return (ctx, req) -> {
            trail.add("request " + name);
            return req.withHeaders(req.headers().toBuilder().add("x-hooks", name).build());
        };
    }

    @Test
    void runsHooksInOrder() throws Exception {
        final List<String> trail = new ArrayList<>();
        final AtomicReference<HttpRequest> sent = new AtomicReference<>();
        final HttpClient client = HookClient.newDecorator(
                ImmutableList.of(addHeader("first", trail), addHeader("second", trail)),
                ImmutableList.<ResponseHook>of(
                        (ctx, req, res, cause) -> trail.add("response a " + res.status()),
                        (ctx, req, res, cause) -> trail.add("response b")))
                                            .apply((HttpClient) (ctx, req) -> {
                                                trail.add("send");
                                                sent.set(req);
                                                return HttpResponse.of(204);
                                            });

        client.execute(ClientRequestContext.of(), REQ).close();

        assertThat(trail).containsExactly("request first", "request second", "send",
                                          "response a 204", "response b");
        assertThat(sent.get().headers().getAll("x-hooks")).containsExactly("first", "second");
    }

    @Test
    void failingRequestHookAbortsRequest() {
        final AtomicInteger sent = new AtomicInteger();
        final AtomicInteger responses = new AtomicInteger();
        final IOException failure = new IOException("signing failed");
        final HttpClient client = HookClient.newDecorator(
                ImmutableList.<RequestHook>of((ctx, req) -> {
                    throw failure;
                }),
                ImmutableList.<ResponseHook>of((ctx, req, res, cause) -> responses.incrementAndGet()))
                                            .apply((HttpClient) (ctx, req) -> {
                                                sent.incrementAndGet();
                                                return HttpResponse.of(200);
                                            });

        assertThatThrownBy(() -> client.execute(ClientRequestContext.of(), REQ)).isSameAs(failure);
        assertThat(sent).hasValue(0);
        assertThat(responses).hasValue(0);
    }

    @Test
    void responseHooksObserveFailures() {
        final AtomicReference<Throwable> observed = new AtomicReference<>();
        final IOException failure = new IOException("connection reset");
        final HttpClient client = HookClient.newDecorator(
                ImmutableList.of(),
                ImmutableList.<ResponseHook>of((ctx, req, res, cause) -> {
                    assertThat(res).isNull();
                    observed.set(cause);
                }))
                                            .apply((HttpClient) (ctx, req) -> {
                                                throw failure;
                                            });

        assertThatThrownBy(() -> client.execute(ClientRequestContext.of(), REQ)).isSameAs(failure);
        assertThat(observed).hasValue(failure);
    }

    @Test
    void failingResponseHookDoesNotChangeOutcome() throws Exception {
        final AtomicInteger laterHook = new AtomicInteger();
        final HttpClient client = HookClient.newDecorator(
                ImmutableList.of(),
                ImmutableList.<ResponseHook>of((ctx, req, res, cause) -> {
                    throw new IllegalStateException("broken hook");
                }, (ctx, req, res, cause) -> laterHook.incrementAndGet()))
                                            .apply((HttpClient) (ctx, req) -> HttpResponse.of(200, "ok"));

        try (HttpResponse res = client.execute(ClientRequestContext.of(), REQ)) {
            assertThat(res.contentUtf8()).isEqualTo("ok");
        }
        assertThat(laterHook).hasValue(1);
    }

    @Test
    void requestHookMustNotReturnNull() {
        final HttpClient client = HookClient.newDecorator(
                ImmutableList.<RequestHook>of((ctx, req) -> null), ImmutableList.of())
                                            .apply((HttpClient) (ctx, req) -> HttpResponse.of(200));

        assertThatThrownBy(() -> client.execute(ClientRequestContext.of(), REQ))
                .isInstanceOf(NullPointerException.class);
    }
}
