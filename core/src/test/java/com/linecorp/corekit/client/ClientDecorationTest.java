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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.junit.jupiter.api.Test;

import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

class ClientDecorationTest {

    private static final HttpRequest REQ = HttpRequest.of(HttpMethod.GET, "http://127.0.0.1/");

    @Test
    void firstDecoratorIsOutermost() throws Exception {
        final List<String> calls = new ArrayList<>();
        final HttpClient base = (ctx, req) -> {
            calls.add("base");
            return HttpResponse.of(200);
        };

        final ClientDecoration decoration = ClientDecoration.of(recording("a", calls),
                                                                recording("b", calls),
                                                                recording("c", calls));
        decoration.decorate(base).execute(ClientRequestContext.of(), REQ);

        assertThat(calls).containsExactly("a", "b", "c", "base");
    }

    @Test
    void emptyDecorationReturnsClientAsIs() {
        final HttpClient base = (ctx, req) -> HttpResponse.of(200);
        assertThat(ClientDecoration.of().isEmpty()).isTrue();
        assertThat(ClientDecoration.of().decorate(base)).isSameAs(base);
    }

    @Test
    void builderAppendsDecorations() throws Exception {
        final List<String> calls = new ArrayList<>();
        final ClientDecoration decoration =
                ClientDecoration.builder()
                                .add(recording("a", calls))
                                .add(ClientDecoration.of(recording("b", calls), recording("c", calls)))
                                .add(recording("d", calls))
                                .build();
        assertThat(decoration.decorators()).hasSize(4);

        decoration.decorate((ctx, req) -> HttpResponse.of(200)).execute(ClientRequestContext.of(), REQ);
        assertThat(calls).containsExactly("a", "b", "c", "d");
    }

    @Test
    void chainsBuiltFromSameDecorationShareNoState() throws Exception {
        final List<String> calls = new ArrayList<>();
        final ClientDecoration decoration = ClientDecoration.of(recording("a", calls));
        final HttpClient first = decoration.decorate((ctx, req) -> HttpResponse.of(200));
        final HttpClient second = decoration.decorate((ctx, req) -> HttpResponse.of(201));

        assertThat(first).isNotSameAs(second);
        assertThat(first.execute(ClientRequestContext.of(), REQ).status()).isEqualTo(200);
        assertThat(second.execute(ClientRequestContext.of(), REQ).status()).isEqualTo(201);
    }

    @Test
    void asFindsDecoratorInChain() {
        final List<String> calls = new ArrayList<>();
        final HttpClient client = ClientDecoration.of(recording("a", calls), UserAgentClient.newDecorator())
                                                  .decorate((ctx, req) -> HttpResponse.of(200));
        assertThat(client.as(RecordingClient.class)).isSameAs(client);
        assertThat(client.as(UserAgentClient.class)).isNotNull();
        assertThat(client.as(TargetClient.class)).isNull();
    }

    static Function<? super HttpClient, RecordingClient> recording(String name, List<String> calls) {
        return delegate -> new RecordingClient(delegate, name, calls);
    }

    static final class RecordingClient extends SimpleDecoratingHttpClient {

        private final String name;
        private final List<String> calls;

        RecordingClient(HttpClient delegate, String name, List<String> calls) {
            super(delegate);
            this.name = name;
            this.calls = calls;
        }

        @Override
        public HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
            calls.add(name);
            return unwrap().execute(ctx, req);
        }
    }
}
