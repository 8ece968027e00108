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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

import com.linecorp.corekit.client.cache.Cache;
import com.linecorp.corekit.client.cache.CachingClient;
import com.linecorp.corekit.client.cache.LocalCache;
import com.linecorp.corekit.client.circuitbreaker.BucketMapping;
import com.linecorp.corekit.client.circuitbreaker.CircuitBreaker;
import com.linecorp.corekit.client.circuitbreaker.CircuitBreakerClient;
import com.linecorp.corekit.client.hook.ForwardedHeadersRequestHook;
import com.linecorp.corekit.client.hook.HookClient;
import com.linecorp.corekit.client.hook.RequestHook;
import com.linecorp.corekit.client.hook.ResponseHook;
import com.linecorp.corekit.client.tracing.ExtendedTracingClient;
import com.linecorp.corekit.client.tracing.TracingClient;
import com.linecorp.corekit.common.Flags;
import com.linecorp.corekit.common.annotation.Nullable;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;

/**
 * A skeletal builder of a client which sends requests through a chain of decorators on top of
 * a transport.
 *
 * <p>The decorators are applied in the following order, from the outermost to the innermost:
 * <ol>
 *   <li>{@link TargetClient}, if a {@linkplain #targetId(String) target ID} is set</li>
 *   <li>{@link UserAgentClient}</li>
 *   <li>{@link CachingClient}, if a {@linkplain #cache(Cache) cache} is set</li>
 *   <li>{@link HookClient}, which runs {@link ForwardedHeadersRequestHook} before the other hooks</li>
 *   <li>{@link TracingClient}, or {@link ExtendedTracingClient} if {@link #enableClientTrace()}</li>
 *   <li>{@link CircuitBreakerClient}, if a {@linkplain #circuitBreaker(CircuitBreaker) breaker} is set</li>
 *   <li>the {@linkplain #telemetryDecorator(Function) telemetry decorator}, if any</li>
 * </ol>
 */
public abstract class AbstractClientBuilder {

    private Duration timeout = Duration.ofMillis(Flags.defaultTimeoutMillis());
    private boolean followRedirects;
    @Nullable
    private HttpClient transport;
    private final List<RequestHook> requestHooks = new ArrayList<>();
    private final List<ResponseHook> responseHooks = new ArrayList<>();
    @Nullable
    private Cache cache;
    @Nullable
    private CircuitBreaker circuitBreaker;
    private boolean clientTrace;
    private MeterRegistry meterRegistry = Metrics.globalRegistry;
    @Nullable
    private String targetId;
    @Nullable
    private Function<? super HttpClient, ? extends HttpClient> telemetryDecorator;

    /**
     * Creates a new instance.
     */
    protected AbstractClientBuilder() {}

    /**
     * Sets the timeout of a request, which covers the redirects it follows. When retrying, every attempt
     * has its own timeout. {@link Duration#ZERO} disables the timeout, and a negative value is ignored.
     * The default is {@link Flags#defaultTimeoutMillis()}.
     */
    public AbstractClientBuilder timeout(Duration timeout) {
        requireNonNull(timeout, "timeout");
        if (!timeout.isNegative()) {
            this.timeout = timeout;
        }
        return this;
    }

    /**
     * Sets the timeout of a request in milliseconds.
     *
     * @see #timeout(Duration)
     */
    public AbstractClientBuilder timeoutMillis(long timeoutMillis) {
        return timeout(Duration.ofMillis(timeoutMillis));
    }

    /**
     * Disables the timeout of a request.
     */
    public AbstractClientBuilder disableTimeout() {
        return timeout(Duration.ZERO);
    }

    /**
     * Sets whether to follow redirects, up to 10 of them. Redirects are not followed by default.
     */
    public AbstractClientBuilder followRedirects(boolean followRedirects) {
        this.followRedirects = followRedirects;
        return this;
    }

    /**
     * Sets the transport which sends the requests. The default is {@link Clients#defaultTransport()}.
     */
    public AbstractClientBuilder transport(HttpClient transport) {
        this.transport = requireNonNull(transport, "transport");
        return this;
    }

    /**
     * Adds the {@link RequestHook}s to run before sending a request.
     */
    public AbstractClientBuilder requestHook(RequestHook... requestHooks) {
        requireNonNull(requestHooks, "requestHooks");
        for (RequestHook hook : requestHooks) {
            this.requestHooks.add(requireNonNull(hook, "requestHooks contains null."));
        }
        return this;
    }

    /**
     * Adds the {@link ResponseHook}s to run after receiving a response.
     */
    public AbstractClientBuilder responseHook(ResponseHook... responseHooks) {
        requireNonNull(responseHooks, "responseHooks");
        for (ResponseHook hook : responseHooks) {
            this.responseHooks.add(requireNonNull(hook, "responseHooks contains null."));
        }
        return this;
    }

    /**
     * Sets the {@link Cache} which stores the responses. {@code null} disables caching.
     */
    public AbstractClientBuilder cache(@Nullable Cache cache) {
        this.cache = cache;
        return this;
    }

    /**
     * Enables caching with {@link LocalCache#shared()}, unless a {@link Cache} has been set already.
     */
    public AbstractClientBuilder enableCache() {
        if (cache == null) {
            cache = LocalCache.shared();
        }
        return this;
    }

    /**
     * Sets the {@link CircuitBreaker}. A request is mapped to the bucket of its target ID, or its
     * endpoint template if it has no target ID.
     */
    public AbstractClientBuilder circuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = requireNonNull(circuitBreaker, "circuitBreaker");
        return this;
    }

    /**
     * Enables recording the metrics of the connection phases of a request with
     * {@link ExtendedTracingClient}.
     */
    public AbstractClientBuilder enableClientTrace() {
        clientTrace = true;
        return this;
    }

    /**
     * Sets the {@link MeterRegistry} the metrics are recorded to. The default is
     * {@link Metrics#globalRegistry}.
     */
    public AbstractClientBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = requireNonNull(meterRegistry, "meterRegistry");
        return this;
    }

    /**
     * Sets the target ID of the requests whose {@link ClientRequestContext} has none.
     */
    public AbstractClientBuilder targetId(String targetId) {
        this.targetId = requireNonNull(targetId, "targetId");
        return this;
    }

    /**
     * Sets the innermost decorator which exports the requests to a distributed tracing system, such as
     * {@code BraveClient.newDecorator(tracing)}.
     */
    public AbstractClientBuilder telemetryDecorator(
            Function<? super HttpClient, ? extends HttpClient> telemetryDecorator) {
        this.telemetryDecorator = requireNonNull(telemetryDecorator, "telemetryDecorator");
        return this;
    }

    /**
     * Returns the {@link MeterRegistry} the metrics are recorded to.
     */
    protected final MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    /**
     * Returns the {@link RequestHook}s which run before the ones added with
     * {@link #requestHook(RequestHook...)}.
     */
    protected List<RequestHook> defaultRequestHooks() {
        return ImmutableList.of(new ForwardedHeadersRequestHook(meterRegistry));
    }

    /**
     * Returns the {@link ResponseHook}s which run before the ones added with
     * {@link #responseHook(ResponseHook...)}.
     */
    protected List<ResponseHook> defaultResponseHooks() {
        return ImmutableList.of();
    }

    /**
     * Returns the {@link ClientDecoration} built from the properties of this builder.
     */
    protected final ClientDecoration buildDecoration() {
        final ClientDecorationBuilder builder = ClientDecoration.builder();
        if (targetId != null) {
            builder.add(TargetClient.newDecorator(targetId));
        }
        builder.add(UserAgentClient.newDecorator());
        if (cache != null) {
            builder.add(CachingClient.newDecorator(cache));
        }
        builder.add(HookClient.newDecorator(
                ImmutableList.<RequestHook>builder().addAll(defaultRequestHooks()).addAll(requestHooks).build(),
                ImmutableList.<ResponseHook>builder().addAll(defaultResponseHooks()).addAll(responseHooks)
                             .build()));
        if (clientTrace) {
            builder.add(ExtendedTracingClient.newDecorator(meterRegistry));
        } else {
            builder.add(TracingClient.newDecorator(meterRegistry));
        }
        if (circuitBreaker != null) {
            builder.add(CircuitBreakerClient.newDecorator(circuitBreaker,
                                                          CircuitBreakerClient.defaultSuccessPredicate(),
                                                          BucketMapping.ofDefault(), meterRegistry));
        }
        if (telemetryDecorator != null) {
            builder.add(telemetryDecorator);
        }
        return builder.build();
    }

    /**
     * Returns a newly-created {@link HttpClient} which sends a request once through the decorated
     * transport, without the timeout and the redirects handled by a {@link Requester}.
     */
    public final HttpClient buildHttpClient() {
        final HttpClient base = transport != null ? transport : Clients.defaultTransport();
        return buildDecoration().decorate(base);
    }

    /**
     * Returns a newly-created {@link DefaultRequester} which sends the requests through
     * {@link #buildHttpClient()}.
     */
    protected final DefaultRequester buildDefaultRequester() {
        return new DefaultRequester(buildHttpClient(), timeout, followRedirects);
    }
}
