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

import com.google.common.base.MoreObjects;

import com.linecorp.corekit.common.annotation.Nullable;

/**
 * Decorates an {@link HttpClient}. Extend this class to implement a decorator which delegates to
 * another {@link HttpClient}.
 */
public abstract class SimpleDecoratingHttpClient implements HttpClient {

    private final HttpClient delegate;

    /**
     * Creates a new instance that decorates the specified {@link HttpClient}.
     */
    protected SimpleDecoratingHttpClient(HttpClient delegate) {
        this.delegate = requireNonNull(delegate, "delegate");
    }

    /**
     * Returns the {@link HttpClient} being decorated.
     */
    public final HttpClient unwrap() {
        return delegate;
    }

    @Nullable
    @Override
    public final <T> T as(Class<T> type) {
        requireNonNull(type, "type");
        final T result = HttpClient.super.as(type);
        return result != null ? result : delegate.as(type);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("delegate", delegate).toString();
    }
}
