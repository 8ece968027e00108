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

import java.util.Random;
import java.util.function.Supplier;

import com.google.common.base.MoreObjects;
import com.google.common.math.LongMath;

final class LinearJitterBackoff extends AbstractBackoff {

    private final long minDelayMillis;
    private final long maxDelayMillis;
    private final Supplier<Random> randomSupplier;

    LinearJitterBackoff(long minDelayMillis, long maxDelayMillis, Supplier<Random> randomSupplier) {
        validateDelays(minDelayMillis, maxDelayMillis);
        this.minDelayMillis = minDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.randomSupplier = requireNonNull(randomSupplier, "randomSupplier");
    }

    @Override
    protected long doNextDelayMillis(int attempt) {
        final long multiplier = attempt + 1L;
        if (maxDelayMillis <= minDelayMillis) {
            return LongMath.saturatedMultiply(minDelayMillis, multiplier);
        }
        final Random random = randomSupplier.get();
        final long jittered = minDelayMillis + nextLong(random, maxDelayMillis - minDelayMillis);
        return LongMath.saturatedMultiply(jittered, multiplier);
    }

    // Returns a uniformly distributed value in [0, bound).
    private static long nextLong(Random random, long bound) {
        long bits;
        long value;
        do {
            bits = random.nextLong() >>> 1;
            value = bits % bound;
        } while (bits - value + (bound - 1) < 0L);
        return value;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("minDelayMillis", minDelayMillis)
                          .add("maxDelayMillis", maxDelayMillis)
                          .toString();
    }
}
