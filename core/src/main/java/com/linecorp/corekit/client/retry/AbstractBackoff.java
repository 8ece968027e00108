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

/**
 * A skeletal {@link Backoff} implementation.
 */
abstract class AbstractBackoff implements Backoff {

    static void validateAttempt(int attempt) {
        checkArgument(attempt >= 0, "attempt: %s (expected: >= 0)", attempt);
    }

    static void validateDelays(long minDelayMillis, long maxDelayMillis) {
        checkArgument(minDelayMillis >= 0, "minDelayMillis: %s (expected: >= 0)", minDelayMillis);
        checkArgument(maxDelayMillis >= 0, "maxDelayMillis: %s (expected: >= 0)", maxDelayMillis);
    }

    @Override
    public final long nextDelayMillis(int attempt) {
        validateAttempt(attempt);
        return doNextDelayMillis(attempt);
    }

    /**
     * Invoked by {@link #nextDelayMillis(int)} after {@code attempt} is validated.
     */
    protected abstract long doNextDelayMillis(int attempt);
}
