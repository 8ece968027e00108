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

/**
 * Listens to the connection events of a {@link PooledTransport}.
 */
public interface ConnectionPoolListener {

    /**
     * Returns an instance that does nothing.
     */
    static ConnectionPoolListener noop() {
        return NoopConnectionPoolListener.INSTANCE;
    }

    /**
     * Invoked when a new connection has been established. A failed connection attempt does not
     * trigger this event.
     *
     * @param key the {@code "tcp:<host>:<port>"} key the connection is counted under
     */
    void connectionOpen(String key, InetSocketAddress remoteAddr) throws Exception;

    /**
     * Invoked exactly once when a connection previously reported by
     * {@link #connectionOpen(String, InetSocketAddress)} has been closed, either by the pool or by its user.
     */
    void connectionClosed(String key, InetSocketAddress remoteAddr) throws Exception;
}
