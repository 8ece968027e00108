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

import java.time.Duration;
import java.util.function.Function;

import com.linecorp.corekit.client.cache.Cache;
import com.linecorp.corekit.client.circuitbreaker.CircuitBreaker;
import com.linecorp.corekit.client.hook.RequestHook;
import com.linecorp.corekit.client.hook.ResponseHook;
import com.linecorp.corekit.common.annotation.Nullable;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Builds a {@link Requester} which sends every request once. Use {@link Clients#builder()} to create one.
 */
public final class ClientBuilder extends AbstractClientBuilder {

    ClientBuilder() {}

    /**
     * Returns a newly-created {@link Requester} based on the properties of this builder.
     */
    public Requester build() {
        return buildDefaultRequester();
    }

    // Override the return type of the chaining methods in the superclass.

    @Override
    public ClientBuilder timeout(Duration timeout) {
        return (ClientBuilder) super.timeout(timeout);
    }

    @Override
    public ClientBuilder timeoutMillis(long timeoutMillis) {
        return (ClientBuilder) super.timeoutMillis(timeoutMillis);
    }

    @Override
    public ClientBuilder disableTimeout() {
        return (ClientBuilder) super.disableTimeout();
    }

    @Override
    public ClientBuilder followRedirects(boolean followRedirects) {
        return (ClientBuilder) super.followRedirects(followRedirects);
    }

    @Override
    public ClientBuilder transport(HttpClient transport) {
        return (ClientBuilder) super.transport(transport);
    }

    @Override
    public ClientBuilder requestHook(RequestHook... requestHooks) {
        return (ClientBuilder) super.requestHook(requestHooks);
    }

    @Override
    public ClientBuilder responseHook(ResponseHook... responseHooks) {
        return (ClientBuilder) super.responseHook(responseHooks);
    }

    @Override
    public ClientBuilder cache(@Nullable Cache cache) {
        return (ClientBuilder) super.cache(cache);
    }

    @Override
    public ClientBuilder enableCache() {
        return (ClientBuilder) super.enableCache();
    }

    @Override
    public ClientBuilder circuitBreaker(CircuitBreaker circuitBreaker) {
        return (ClientBuilder) super.circuitBreaker(circuitBreaker);
    }

    @Override
    public ClientBuilder enableClientTrace() {
        return (ClientBuilder) super.enableClientTrace();
    }

    @Override
    public ClientBuilder meterRegistry(MeterRegistry meterRegistry) {
        return (ClientBuilder) super.meterRegistry(meterRegistry);
    }

    @Override
    public ClientBuilder targetId(String targetId) {
        return (ClientBuilder) super.targetId(targetId);
    }

    @Override
    public ClientBuilder telemetryDecorator(
            Function<? super HttpClient, ? extends HttpClient> telemetryDecorator) {
        return (ClientBuilder) super.telemetryDecorator(telemetryDecorator);
    }
}
