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

import com.linecorp.corekit.client.retry.RetryingClientBuilder;

/**
 * Creates the builders of the clients.
 */
public final class Clients {

    /**
     * Returns the {@link PooledTransport} used by a builder which has no transport set. It is created
     * on first use and lives as long as the JVM; an application may use it directly as well.
     */
    public static PooledTransport defaultTransport() {
        return DefaultTransportHolder.INSTANCE;
    }

    /**
     * Returns a new {@link ClientBuilder} which builds a {@link Requester} sending every request once.
     */
    public static ClientBuilder builder() {
        return new ClientBuilder();
    }

    /**
     * Returns a new {@link RetryingClientBuilder} which builds a
     * {@link com.linecorp.corekit.client.retry.RetryingRequester} retrying a request up to
     * {@code retryMax} times. {@code 0} disables retrying.
     */
    public static RetryingClientBuilder retryingBuilder(int retryMax) {
        return new RetryingClientBuilder(retryMax);
    }

    private static final class DefaultTransportHolder {
        static final PooledTransport INSTANCE = PooledTransport.of("corekit-default");
    }

    private Clients() {}
}
