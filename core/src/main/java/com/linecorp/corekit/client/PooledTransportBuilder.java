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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.X509TrustManager;

import com.linecorp.corekit.common.Flags;
import com.linecorp.corekit.common.annotation.Nullable;

import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

/**
 * Builds a new {@link PooledTransport}.
 */
public final class PooledTransportBuilder {

    private final String name;
    private Duration dialTimeout = Duration.ofMillis(Flags.defaultDialTimeoutMillis());
    private Duration responseHeaderTimeout = Duration.ZERO;
    private Duration idleConnectionTimeout = Duration.ofMillis(Flags.defaultIdleConnectionTimeoutMillis());
    private int maxIdleConnections = Flags.defaultMaxIdleConnections();
    @Nullable
    private SSLSocketFactory sslSocketFactory;
    @Nullable
    private X509TrustManager trustManager;
    private ConnectionPoolListener connectionPoolListener = ConnectionPoolListener.noop();

    PooledTransportBuilder(String name) {
        this.name = requireNonNull(name, "name");
    }

    /**
     * Sets the timeout of establishing a TCP connection.
     */
    public PooledTransportBuilder dialTimeout(Duration dialTimeout) {
        requireNonNull(dialTimeout, "dialTimeout");
        checkArgument(!dialTimeout.isNegative() && !dialTimeout.isZero(),
                      "dialTimeout: %s (expected: > 0)", dialTimeout);
        this.dialTimeout = dialTimeout;
        return this;
    }

    /**
     * Sets the maximum time to wait between two reads from a connection, which bounds the time to
     * receive the response headers after the request has been written. {@link Duration#ZERO} disables it.
     */
    public PooledTransportBuilder responseHeaderTimeout(Duration responseHeaderTimeout) {
        requireNonNull(responseHeaderTimeout, "responseHeaderTimeout");
        checkArgument(!responseHeaderTimeout.isNegative(),
                      "responseHeaderTimeout: %s (expected: >= 0)", responseHeaderTimeout);
        this.responseHeaderTimeout = responseHeaderTimeout;
        return this;
    }

    /**
     * Sets how long an idle connection is kept in the pool before being closed.
     */
    public PooledTransportBuilder idleConnectionTimeout(Duration idleConnectionTimeout) {
        requireNonNull(idleConnectionTimeout, "idleConnectionTimeout");
        checkArgument(!idleConnectionTimeout.isNegative() && !idleConnectionTimeout.isZero(),
                      "idleConnectionTimeout: %s (expected: > 0)", idleConnectionTimeout);
        this.idleConnectionTimeout = idleConnectionTimeout;
        return this;
    }

    /**
     * Sets the maximum number of idle connections kept in the pool.
     */
    public PooledTransportBuilder maxIdleConnections(int maxIdleConnections) {
        checkArgument(maxIdleConnections >= 0,
                      "maxIdleConnections: %s (expected: >= 0)", maxIdleConnections);
        this.maxIdleConnections = maxIdleConnections;
        return this;
    }

    /**
     * Sets the {@link SSLSocketFactory} and {@link X509TrustManager} used for {@code https} requests.
     */
    public PooledTransportBuilder tls(SSLSocketFactory sslSocketFactory, X509TrustManager trustManager) {
        this.sslSocketFactory = requireNonNull(sslSocketFactory, "sslSocketFactory");
        this.trustManager = requireNonNull(trustManager, "trustManager");
        return this;
    }

    /**
     * Sets the {@link ConnectionPoolListener} notified when a connection is opened or closed.
     */
    public PooledTransportBuilder connectionPoolListener(ConnectionPoolListener connectionPoolListener) {
        this.connectionPoolListener = requireNonNull(connectionPoolListener, "connectionPoolListener");
        return this;
    }

    /**
     * Returns a newly-created {@link PooledTransport} based on the properties of this builder.
     */
    public PooledTransport build() {
        final OkHttpClient.Builder builder =
                new OkHttpClient.Builder()
                        .connectionPool(new ConnectionPool(maxIdleConnections,
                                                           idleConnectionTimeout.toMillis(),
                                                           TimeUnit.MILLISECONDS))
                        .connectTimeout(dialTimeout)
                        .readTimeout(responseHeaderTimeout)
                        .writeTimeout(Duration.ZERO)
                        .callTimeout(Duration.ZERO);
        if (sslSocketFactory != null && trustManager != null) {
            builder.sslSocketFactory(sslSocketFactory, trustManager);
        }
        return new PooledTransport(name, builder, connectionPoolListener);
    }
}
