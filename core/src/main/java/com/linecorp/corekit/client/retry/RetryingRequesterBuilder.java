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

import java.time.Clock;

import com.linecorp.corekit.client.Requester;
import com.linecorp.corekit.common.Flags;

/**
 * Builds a new {@link RetryingRequester}.
 */
public final class RetryingRequesterBuilder {

    private final Requester delegate;
    private int retryMax;
    private Backoff backoff = Backoff.withoutDelay();
    private RetryPolicy retryPolicy = RetryPolicy.serverErrors();
    private int drainLimitBytes = Flags.defaultDrainLimitBytes();
    private Clock clock = Clock.systemUTC();

    RetryingRequesterBuilder(Requester delegate) {
        this.delegate = requireNonNull(delegate, "delegate");
    }

    /**
     * Sets the maximum number of retries. {@code 0} disables retrying. The default is {@code 0}.
     */
    public RetryingRequesterBuilder retryMax(int retryMax) {
        checkArgument(retryMax >= 0, "retryMax: %s (expected: >= 0)", retryMax);
        this.retryMax = retryMax;
        return this;
    }

    /**
     * Sets the {@link Backoff}. The default is {@link Backoff#withoutDelay()}.
     */
    public RetryingRequesterBuilder backoff(Backoff backoff) {
        this.backoff = requireNonNull(backoff, "backoff");
        return this;
    }

    /**
     * Sets the {@link RetryPolicy}. The default is {@link RetryPolicy#serverErrors()}.
     */
    public RetryingRequesterBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy");
        return this;
    }

    /**
     * Sets the maximum number of bytes read from the body of a discarded response before closing it.
     * The default is {@link Flags#defaultDrainLimitBytes()}.
     */
    public RetryingRequesterBuilder drainLimitBytes(int drainLimitBytes) {
        checkArgument(drainLimitBytes >= 0, "drainLimitBytes: %s (expected: >= 0)", drainLimitBytes);
        this.drainLimitBytes = drainLimitBytes;
        return this;
    }

    RetryingRequesterBuilder clock(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Returns a newly-created {@link RetryingRequester}.
     */
    public RetryingRequester build() {
        return new RetryingRequester(delegate, retryMax, backoff, retryPolicy, drainLimitBytes, clock);
    }
}
