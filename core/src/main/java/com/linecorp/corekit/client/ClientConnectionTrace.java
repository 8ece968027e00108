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

import java.net.InetSocketAddress;

import com.linecorp.corekit.common.annotation.Nullable;

/**
 * Receives the low-level network events of a single request from {@link PooledTransport}.
 * Install it with {@link ClientRequestContext#setClientTrace(ClientConnectionTrace)}.
 *
 * <p>The events are delivered in the following order. The DNS, connect and TLS events are only
 * delivered when a new connection is established for the request.
 * <pre>{@code
 * dnsStart => dnsDone
 * connectStart => connectDone
 * tlsHandshakeStart => tlsHandshakeDone
 * gotConnection
 * wroteRequest
 * gotFirstResponseByte
 * }</pre>
 * An implementation must return quickly since it is invoked from the request path.
 */
public interface ClientConnectionTrace {

    /**
     * Returns a {@link ClientConnectionTrace} which does nothing.
     */
    static ClientConnectionTrace noop() {
        return NoopClientConnectionTrace.INSTANCE;
    }

    default void dnsStart(String host) {}

    default void dnsDone(@Nullable Throwable cause) {}

    default void connectStart(InetSocketAddress address) {}

    default void connectDone(InetSocketAddress address, @Nullable Throwable cause) {}

    default void tlsHandshakeStart() {}

    default void tlsHandshakeDone(@Nullable Throwable cause) {}

    /**
     * Invoked when a connection has been obtained for the request.
     *
     * @param reused whether the connection was taken from the pool rather than newly established
     * @param wasIdle whether the connection had been idle in the pool
     */
    default void gotConnection(boolean reused, boolean wasIdle) {}

    default void wroteRequest(@Nullable Throwable cause) {}

    default void gotFirstResponseByte() {}
}
