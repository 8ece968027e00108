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

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Computes the delay before a retry from the number of the attempt that has just failed.
 * An implementation must be a pure function of the attempt number, apart from randomness.
 */
@FunctionalInterface
public interface Backoff {

    /**
     * Returns a {@link Backoff} that never waits between attempts.
     */
    static Backoff withoutDelay() {
        return FixedBackoff.NO_DELAY;
    }

    /**
     * Returns a {@link Backoff} that waits a fixed delay between attempts.
     */
    static Backoff constant(long delayMillis) {
        return delayMillis == 0 ? FixedBackoff.NO_DELAY : new FixedBackoff(delayMillis);
    }

    /**
     * Returns a {@link Backoff} that waits {@code minDelayMillis * 2^attempt} milliseconds, capped at
     * {@code maxDelayMillis}. A delay that would overflow is clamped to {@code maxDelayMillis}.
     */
    static Backoff exponential(long minDelayMillis, long maxDelayMillis) {
        return new ExponentialBackoff(minDelayMillis, maxDelayMillis);
    }

    /**
     * Returns a {@link Backoff} that waits a random delay in {@code [minDelayMillis, maxDelayMillis)}
     * multiplied by {@code attempt + 1}, chosen by {@link ThreadLocalRandom}. When {@code maxDelayMillis}
     * is not greater than {@code minDelayMillis}, it waits {@code minDelayMillis * (attempt + 1)}.
     */
    static Backoff linearJitter(long minDelayMillis, long maxDelayMillis) {
        return linearJitter(minDelayMillis, maxDelayMillis, ThreadLocalRandom::current);
    }

    /**
     * Returns a {@link Backoff} like {@link #linearJitter(long, long)} which uses the {@link Random}
     * provided by the specified {@link Supplier}.
     */
    static Backoff linearJitter(long minDelayMillis, long maxDelayMillis, Supplier<Random> randomSupplier) {
        return new LinearJitterBackoff(minDelayMillis, maxDelayMillis, randomSupplier);
    }

    /**
     * Returns the number of milliseconds to wait for before the next attempt.
     *
     * @param attempt the zero-based number of the attempt that has just failed
     */
    long nextDelayMillis(int attempt);
}
