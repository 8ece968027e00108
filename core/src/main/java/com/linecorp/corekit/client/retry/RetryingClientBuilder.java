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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

import com.linecorp.corekit.client.AbstractClientBuilder;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.client.cache.Cache;
import com.linecorp.corekit.client.circuitbreaker.CircuitBreaker;
import com.linecorp.corekit.client.hook.RequestHook;
import com.linecorp.corekit.client.hook.ResponseHook;
import com.linecorp.corekit.common.annotation.Nullable;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Builds a {@link RetryingRequester} on top of the decorator chain built by {@link AbstractClientBuilder}.
 * Use {@link com.linecorp.corekit.client.Clients#retryingBuilder(int)} to create one.
 *
 * <p>In addition to the hooks of {@link AbstractClientBuilder}, {@link RetryHooks#retryHeader()} and
 * {@link RetryHooks#retryMetric(MeterRegistry)} are installed before the hooks added by the user.
 */
public final class RetryingClientBuilder extends AbstractClientBuilder {

    private final int retryMax;
    private Backoff backoff = Backoff.withoutDelay();
    private RetryPolicy retryPolicy = RetryPolicy.serverErrors();

    /**
     * Creates a new instance.
     *
     * @param retryMax the maximum number of retries. {@code 0} disables retrying.
     */
    public RetryingClientBuilder(int retryMax) {
        checkArgument(retryMax >= 0, "retryMax: %s (expected: >= 0)", retryMax);
        this.retryMax = retryMax;
    }

    /**
     * Sets the {@link Backoff}. The default is {@link Backoff#withoutDelay()}.
     */
    public RetryingClientBuilder backoff(Backoff backoff) {
        this.backoff = requireNonNull(backoff, "backoff");
        return this;
    }

    /**
     * Sets the {@link RetryPolicy}. The default is {@link RetryPolicy#serverErrors()}.
     */
    public RetryingClientBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy");
        return this;
    }

    @Override
    protected List<RequestHook> defaultRequestHooks() {
        return ImmutableList.<RequestHook>builder()
                            .addAll(super.defaultRequestHooks())
                            .add(RetryHooks.retryHeader())
                            .build();
    }

    @Override
    protected List<ResponseHook> defaultResponseHooks() {
        return ImmutableList.<ResponseHook>builder()
                            .addAll(super.defaultResponseHooks())
                            .add(RetryHooks.retryMetric(meterRegistry()))
                            .build();
    }

    /**
     * Returns a newly-created {@link RetryingRequester} based on the properties of this builder.
     */
    public RetryingRequester build() {
        return RetryingRequester.builder(buildDefaultRequester())
                                .retryMax(retryMax)
                                .backoff(backoff)
                                .retryPolicy(retryPolicy)
                                .build();
    }

    // Override the return type of the chaining methods in the superclass.

    @Override
    public RetryingClientBuilder timeout(Duration timeout) {
        return (RetryingClientBuilder) super.timeout(timeout);
    }

    @Override
    public RetryingClientBuilder timeoutMillis(long timeoutMillis) {
        return (RetryingClientBuilder) super.timeoutMillis(timeoutMillis);
    }

    @Override
    public RetryingClientBuilder disableTimeout() {
        return (RetryingClientBuilder) super.disableTimeout();
    }

    @Override
    public RetryingClientBuilder followRedirects(boolean followRedirects) {
        return (RetryingClientBuilder) super.followRedirects(followRedirects);
    }

    @Override
    public RetryingClientBuilder transport(HttpClient transport) {
        return (RetryingClientBuilder) super.transport(transport);
    }

    @Override
    public RetryingClientBuilder requestHook(RequestHook... requestHooks) {
        return (RetryingClientBuilder) super.requestHook(requestHooks);
    }

    @Override
    public RetryingClientBuilder responseHook(ResponseHook... responseHooks) {
        return (RetryingClientBuilder) super.responseHook(responseHooks);
    }

    @Override
    public RetryingClientBuilder cache(@Nullable Cache cache) {
        return (RetryingClientBuilder) super.cache(cache);
    }

    @Override
    public RetryingClientBuilder enableCache() {
        return (RetryingClientBuilder) super.enableCache();
    }

    @Override
    public RetryingClientBuilder circuitBreaker(CircuitBreaker circuitBreaker) {
        return (RetryingClientBuilder) super.circuitBreaker(circuitBreaker);
    }

    @Override
    public RetryingClientBuilder enableClientTrace() {
        return (RetryingClientBuilder) super.enableClientTrace();
    }

    @Override
    public RetryingClientBuilder meterRegistry(MeterRegistry meterRegistry) {
        return (RetryingClientBuilder) super.meterRegistry(meterRegistry);
    }

    @Override
    public RetryingClientBuilder targetId(String targetId) {
        return (RetryingClientBuilder) super.targetId(targetId);
    }

    @Override
    public RetryingClientBuilder telemetryDecorator(
            Function<? super HttpClient, ? extends HttpClient> telemetryDecorator) {
        return (RetryingClientBuilder) super.telemetryDecorator(telemetryDecorator);
    }
}
