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

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import com.linecorp.corekit.common.HttpHeaderNames;
import com.linecorp.corekit.common.HttpHeaders;
import com.linecorp.corekit.common.HttpHeadersBuilder;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.RequestBody;
import com.linecorp.corekit.common.annotation.Nullable;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import okhttp3.Call;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSink;
import okio.Okio;
import okio.Source;

/**
 * The {@link HttpClient} which sends requests over the network using a pool of connections.
 *
 * <p>A {@link PooledTransport} keeps track of the number of live connections per remote address, which
 * can be polled with {@link #stats()} or exported as gauges by {@linkplain #bindTo(MeterRegistry) binding}
 * it to a {@link MeterRegistry}. Counting never locks the request path.
 *
 * <p>A {@link PooledTransport} honors the {@link ClientRequestContext} of a request. A request whose
 * context is already done fails immediately with {@link ClientRequestContext#cause()}, the remaining time
 * until the deadline becomes the timeout of the whole exchange, and {@link ClientRequestContext#cancel()}
 * aborts the exchange in flight.
 */
public final class PooledTransport implements HttpClient, MeterBinder, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PooledTransport.class);

    static final String CONN_POOLS_METER_NAME = "toolkit.http.client.conn_pools";

    private static final okhttp3.RequestBody EMPTY_BODY =
            okhttp3.RequestBody.create(new byte[0], (MediaType) null);

    /**
     * Returns a new {@link PooledTransportBuilder}.
     *
     * @param name the name of the transport, used as the {@code name} tag of its gauges
     */
    public static PooledTransportBuilder builder(String name) {
        return new PooledTransportBuilder(name);
    }

    /**
     * Returns a new {@link PooledTransport} with the default options.
     */
    public static PooledTransport of(String name) {
        return builder(name).build();
    }

    /**
     * Returns a new {@link PooledTransport} which sends requests using the connection pool and the
     * options of the specified {@link OkHttpClient}. Its socket factory and event listener are replaced
     * so that connections can be counted and traced, and redirects are never followed.
     */
    public static PooledTransport of(String name, OkHttpClient client) {
        return new PooledTransport(name, client.newBuilder(), ConnectionPoolListener.noop());
    }

    private final String name;
    private final OkHttpClient client;
    private final ConnectionPoolListener listener;
    private final Map<String, AtomicLong> connections = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<MeterRegistry> registries = new CopyOnWriteArrayList<>();

    PooledTransport(String name, OkHttpClient.Builder clientBuilder, ConnectionPoolListener listener) {
        this.name = requireNonNull(name, "name");
        this.listener = requireNonNull(listener, "listener");
        client = clientBuilder.socketFactory(new ConnectionCountingSocketFactory(new CountingListener()))
                              .eventListenerFactory(ConnectionTraceEventListener.FACTORY)
                              .followRedirects(false)
                              .followSslRedirects(false)
                              .build();
    }

    /**
     * Returns the name of this transport.
     */
    public String name() {
        return name;
    }

    /**
     * Returns a snapshot of the number of live connections keyed by {@code "tcp:<host>:<port>"}.
     * The snapshot is not atomic with respect to the connections being opened or closed concurrently.
     */
    public Map<String, Long> stats() {
        final ImmutableMap.Builder<String, Long> builder = ImmutableMap.builder();
        connections.forEach((key, count) -> builder.put(key, count.get()));
        return builder.build();
    }

    /**
     * Registers the {@value #CONN_POOLS_METER_NAME} gauge of every known and future address to the
     * specified {@link MeterRegistry}.
     */
    @Override
    public void bindTo(MeterRegistry registry) {
        requireNonNull(registry, "registry");
        if (registries.addIfAbsent(registry)) {
            connections.forEach((key, count) -> registerGauge(registry, key, count));
        }
    }

    private void registerGauge(MeterRegistry registry, String key, AtomicLong count) {
        Gauge.builder(CONN_POOLS_METER_NAME, count, AtomicLong::get)
             .description("The number of live connections of an HTTP client connection pool")
             .tag("name", name)
             .tag("address", key)
             .register(registry);
    }

    private AtomicLong counter(String key) {
        final AtomicLong existing = connections.get(key);
        if (existing != null) {
            return existing;
        }
        final AtomicLong newCount = new AtomicLong();
        final AtomicLong count = connections.putIfAbsent(key, newCount);
        if (count != null) {
            return count;
        }
        for (MeterRegistry registry : registries) {
            registerGauge(registry, key, newCount);
        }
        return newCount;
    }

    @Override
    public HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
        requireNonNull(ctx, "ctx");
        requireNonNull(req, "req");
        final RuntimeException cause = ctx.cause();
        if (cause != null) {
            throw cause;
        }

        final Call call = client.newCall(toOkHttpRequest(ctx, req));
        if (ctx.hasDeadline()) {
            call.timeout().timeout(Math.max(1, ctx.remainingNanos()), TimeUnit.NANOSECONDS);
        }
        ctx.whenCancelled().thenRun(call::cancel);

        final Response response = call.execute();
        final ResponseBody body = response.body();
        final InputStream content = body != null ? body.byteStream() : InputStream.nullInputStream();
        return HttpResponse.of(response.code(), toHttpHeaders(response.headers()), content);
    }

    private static Request toOkHttpRequest(ClientRequestContext ctx, HttpRequest req) {
        final Request.Builder builder = new Request.Builder().url(req.uri().toString())
                                                             .tag(ClientRequestContext.class, ctx);
        req.headers().forEach(builder::addHeader);

        final RequestBody body = req.body();
        final okhttp3.RequestBody okHttpBody;
        if (body == RequestBody.empty()) {
            okHttpBody = req.method().requiresBody() ? EMPTY_BODY : null;
        } else {
            okHttpBody = new StreamingRequestBody(body, req.headers().get(HttpHeaderNames.CONTENT_TYPE));
        }
        return builder.method(req.method().name(), okHttpBody).build();
    }

    private static HttpHeaders toHttpHeaders(Headers headers) {
        final HttpHeadersBuilder builder = HttpHeaders.builder();
        for (int i = 0; i < headers.size(); i++) {
            builder.add(headers.name(i), headers.value(i));
        }
        return builder.build();
    }

    /**
     * Closes the idle connections of the pool. The connections in use are not affected.
     */
    public void evictIdleConnections() {
        client.connectionPool().evictAll();
    }

    /**
     * Closes all pooled connections and stops the dispatcher of this transport. The gauges bound to
     * a {@link MeterRegistry} keep reporting the last known counts.
     */
    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("name", name)
                          .add("connections", stats())
                          .toString();
    }

    private final class CountingListener implements ConnectionPoolListener {

        @Override
        public void connectionOpen(String key, InetSocketAddress remoteAddr) throws Exception {
            final long count = counter(key).incrementAndGet();
            logger.debug("[{}] Connection opened: {} (live: {})", name, key, count);
            listener.connectionOpen(key, remoteAddr);
        }

        @Override
        public void connectionClosed(String key, InetSocketAddress remoteAddr) throws Exception {
            final long count = counter(key).decrementAndGet();
            logger.debug("[{}] Connection closed: {} (live: {})", name, key, count);
            listener.connectionClosed(key, remoteAddr);
        }
    }

    private static final class StreamingRequestBody extends okhttp3.RequestBody {

        private final RequestBody body;
        @Nullable
        private final MediaType contentType;

        StreamingRequestBody(RequestBody body, @Nullable String contentType) {
            this.body = body;
            this.contentType = contentType != null ? MediaType.parse(contentType) : null;
        }

        @Nullable
        @Override
        public MediaType contentType() {
            return contentType;
        }

        @Override
        public long contentLength() {
            return body.contentLength();
        }

        @Override
        public boolean isOneShot() {
            return !body.isRepeatable();
        }

        @Override
        public void writeTo(BufferedSink sink) throws IOException {
            try (Source source = Okio.source(body.openStream())) {
                sink.writeAll(source);
            }
        }
    }
}
