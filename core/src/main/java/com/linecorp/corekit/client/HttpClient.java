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

import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.annotation.Nullable;

/**
 * Sends an {@link HttpRequest} and returns its {@link HttpResponse}. {@link PooledTransport} is the
 * implementation which talks to the network, and decorators such as {@link UserAgentClient} wrap
 * another {@link HttpClient} to add behavior. An implementation must be safe for concurrent use.
 *
 * @see ClientDecoration
 */
@FunctionalInterface
public interface HttpClient {

    /**
     * Sends the specified {@link HttpRequest}.
     *
     * @param ctx the {@link ClientRequestContext} of the request
     * @param req the {@link HttpRequest} being sent
     *
     * @return the {@link HttpResponse}, whose body must be read fully or closed by the caller
     */
    HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception;

    /**
     * Unwraps this {@link HttpClient} into the object of the specified {@code type}.
     * Use this method instead of an explicit downcast. For example:
     * <pre>{@code
     * HttpClient client = Clients.builder()
     *                            .circuitBreaker(breaker)
     *                            .buildHttpClient();
     * CircuitBreakerClient cbc = client.as(CircuitBreakerClient.class);
     * }</pre>
     *
     * @return the object of the specified {@code type} if found, or {@code null} if not found
     */
    @Nullable
    default <T> T as(Class<T> type) {
        return type.isInstance(this) ? type.cast(this) : null;
    }
}
