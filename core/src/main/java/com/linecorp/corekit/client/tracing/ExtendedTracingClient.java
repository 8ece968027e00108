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
package com.linecorp.corekit.client.tracing;

import static java.util.Objects.requireNonNull;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import com.linecorp.corekit.client.ClientConnectionTrace;
import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.annotation.Nullable;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;

/**
 * A {@link TracingClient} which also records the timings of the connection phases of every request.
 *
 * <p>The following timers are recorded only when a new connection is established, tagged with
 * {@code status} ({@code ok}, {@code timeout} or {@code error}):
 * <ul>
 *   <li>{@code toolkit.http.client.dns.time}</li>
 *   <li>{@code toolkit.http.client.tcp_connect.time}</li>
 *   <li>{@code toolkit.http.client.tls_handshake.time}</li>
 * </ul>
 * The following timers are recorded for every request, measured from the start of the request:
 * <ul>
 *   <li>{@code toolkit.http.client.got_connection.time}, tagged with {@code reused} and
 *       {@code was_idle}</li>
 *   <li>{@code toolkit.http.client.request_written.time}, tagged with {@code status}</li>
 *   <li>{@code toolkit.http.client.response_first_byte.time}</li>
 *   <li>{@code toolkit.http.client.response_fully_read.time}, recorded when the caller reads the
 *       response body to its end or fails to read it, tagged like the request timer</li>
 * </ul>
 */
public final class ExtendedTracingClient extends AbstractTracingClient {

    static final String DNS_TIME_METER_NAME = "toolkit.http.client.dns.time";
    static final String TCP_CONNECT_TIME_METER_NAME = "toolkit.http.client.tcp_connect.time";
    static final String TLS_HANDSHAKE_TIME_METER_NAME = "toolkit.http.client.tls_handshake.time";
    static final String GOT_CONNECTION_TIME_METER_NAME = "toolkit.http.client.got_connection.time";
    static final String REQUEST_WRITTEN_TIME_METER_NAME = "toolkit.http.client.request_written.time";
    static final String RESPONSE_FIRST_BYTE_TIME_METER_NAME = "toolkit.http.client.response_first_byte.time";
    static final String RESPONSE_FULLY_READ_TIME_METER_NAME = "toolkit.http.client.response_fully_read.time";

    /**
     * Creates a new {@link ExtendedTracingClient} decorator which records to
     * {@link Metrics#globalRegistry}.
     */
    public static Function<? super HttpClient, ExtendedTracingClient> newDecorator() {
        return newDecorator(Metrics.globalRegistry);
    }

    /**
     * Creates a new {@link ExtendedTracingClient} decorator which records to the specified
     * {@link MeterRegistry}.
     */
    public static Function<? super HttpClient, ExtendedTracingClient> newDecorator(
            MeterRegistry meterRegistry) {
        requireNonNull(meterRegistry, "meterRegistry");
        return delegate -> new ExtendedTracingClient(delegate, meterRegistry);
    }

    ExtendedTracingClient(HttpClient delegate, MeterRegistry meterRegistry) {
        super(delegate, meterRegistry);
    }

    @Override
    HttpResponse doExecute(ClientRequestContext ctx, HttpRequest req,
                           Tags tags, long startNanos) throws Exception {
        final ClientRequestContext derivedCtx = ctx.newDerivedContext();
        derivedCtx.setClientTrace(new TimingTrace(tags, startNanos));

        final HttpResponse res = unwrap().execute(derivedCtx, req);
        return res.withBody(new FullyReadTracingInputStream(res.body(), cause -> {
            recordSince(RESPONSE_FULLY_READ_TIME_METER_NAME,
                        tags.and(RequestMetricTags.outcome(cause == null ? res : null, cause)), startNanos);
        }));
    }

    /**
     * Records the connection phase timers of a single request.
     */
    private final class TimingTrace implements ClientConnectionTrace {

        private final Tags tags;
        private final long startNanos;

        // Updated by the thread which executes the request.
        private volatile long dnsStartNanos;
        private volatile long connectStartNanos;
        private volatile long tlsHandshakeStartNanos;

        TimingTrace(Tags tags, long startNanos) {
            this.tags = tags;
            this.startNanos = startNanos;
        }

        @Override
        public void dnsStart(String host) {
            dnsStartNanos = System.nanoTime();
        }

        @Override
        public void dnsDone(@Nullable Throwable cause) {
            recordPhase(DNS_TIME_METER_NAME, dnsStartNanos, cause);
        }

        @Override
        public void connectStart(InetSocketAddress address) {
            connectStartNanos = System.nanoTime();
        }

        @Override
        public void connectDone(InetSocketAddress address, @Nullable Throwable cause) {
            recordPhase(TCP_CONNECT_TIME_METER_NAME, connectStartNanos, cause);
        }

        @Override
        public void tlsHandshakeStart() {
            tlsHandshakeStartNanos = System.nanoTime();
        }

        @Override
        public void tlsHandshakeDone(@Nullable Throwable cause) {
            recordPhase(TLS_HANDSHAKE_TIME_METER_NAME, tlsHandshakeStartNanos, cause);
        }

        @Override
        public void gotConnection(boolean reused, boolean wasIdle) {
            recordSince(GOT_CONNECTION_TIME_METER_NAME,
                        tags.and("reused", String.valueOf(reused), "was_idle", String.valueOf(wasIdle)),
                        startNanos);
        }

        @Override
        public void wroteRequest(@Nullable Throwable cause) {
            recordSince(REQUEST_WRITTEN_TIME_METER_NAME, tags.and(RequestMetricTags.phaseStatus(cause)),
                        startNanos);
        }

        @Override
        public void gotFirstResponseByte() {
            recordSince(RESPONSE_FIRST_BYTE_TIME_METER_NAME, tags, startNanos);
        }

        private void recordPhase(String name, long phaseStartNanos, @Nullable Throwable cause) {
            if (phaseStartNanos == 0) {
                // The phase has not started.
                return;
            }
            recordSince(name, tags.and(RequestMetricTags.phaseStatus(cause)), phaseStartNanos);
        }
    }

    /**
     * Notifies the end of a body exactly once, when a read hits the end of the stream or fails.
     */
    private static final class FullyReadTracingInputStream extends FilterInputStream {

        private final OnBodyEnd onBodyEnd;
        private final AtomicBoolean notified = new AtomicBoolean();

        FullyReadTracingInputStream(InputStream in, OnBodyEnd onBodyEnd) {
            super(in);
            this.onBodyEnd = onBodyEnd;
        }

        @Override
        public int read() throws IOException {
            try {
                final int b = super.read();
                if (b < 0) {
                    notifyEnd(null);
                }
                return b;
            } catch (IOException e) {
                notifyEnd(e);
                throw e;
            }
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            try {
                final int n = super.read(b, off, len);
                if (n < 0) {
                    notifyEnd(null);
                }
                return n;
            } catch (IOException e) {
                notifyEnd(e);
                throw e;
            }
        }

        private void notifyEnd(@Nullable IOException cause) {
            if (notified.compareAndSet(false, true)) {
                onBodyEnd.onEnd(cause);
            }
        }
    }

    @FunctionalInterface
    private interface OnBodyEnd {
        void onEnd(@Nullable Throwable cause);
    }
}
