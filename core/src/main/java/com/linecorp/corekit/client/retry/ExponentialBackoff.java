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

import com.google.common.base.MoreObjects;
import com.google.common.math.LongMath;

final class ExponentialBackoff extends AbstractBackoff {

    private final long minDelayMillis;
    private final long maxDelayMillis;

    ExponentialBackoff(long minDelayMillis, long maxDelayMillis) {
        validateDelays(minDelayMillis, maxDelayMillis);
        checkArgument(minDelayMillis <= maxDelayMillis, "minDelayMillis: %s (expected: <= %s)",
                      minDelayMillis, maxDelayMillis);
        this.minDelayMillis = minDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
    }

    @Override
    protected long doNextDelayMillis(int attempt) {
        if (attempt >= Long.SIZE - 1) {
            return minDelayMillis == 0 ? 0 : maxDelayMillis;
        }
        // Saturates at Long.MAX_VALUE instead of wrapping around.
        final long delayMillis = LongMath.saturatedMultiply(minDelayMillis, 1L << attempt);
        return Math.min(delayMillis, maxDelayMillis);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("minDelayMillis", minDelayMillis)
                          .add("maxDelayMillis", maxDelayMillis)
                          .toString();
    }
}
