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

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

import com.linecorp.corekit.common.annotation.Nullable;

/**
 * The decision of a {@link RetryPolicy} on the outcome of an attempt.
 */
public final class RetryDecision {

    private static final RetryDecision RETRY = new RetryDecision(true, null);
    private static final RetryDecision STOP = new RetryDecision(false, null);

    /**
     * Returns a {@link RetryDecision} that retries the request.
     */
    public static RetryDecision retry() {
        return RETRY;
    }

    /**
     * Returns a {@link RetryDecision} that stops retrying and keeps the outcome of the last attempt.
     */
    public static RetryDecision stop() {
        return STOP;
    }

    /**
     * Returns a {@link RetryDecision} that stops retrying and fails the request with the specified
     * exception instead of the outcome of the last attempt.
     */
    public static RetryDecision stop(Exception override) {
        return new RetryDecision(false, requireNonNull(override, "override"));
    }

    private final boolean shouldRetry;
    @Nullable
    private final Exception override;

    private RetryDecision(boolean shouldRetry, @Nullable Exception override) {
        this.shouldRetry = shouldRetry;
        this.override = override;
    }

    public boolean shouldRetry() {
        return shouldRetry;
    }

    /**
     * Returns the exception which replaces the outcome of the last attempt, or {@code null} to keep it.
     */
    @Nullable
    public Exception override() {
        return override;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("shouldRetry", shouldRetry)
                          .add("override", override)
                          .toString();
    }
}
