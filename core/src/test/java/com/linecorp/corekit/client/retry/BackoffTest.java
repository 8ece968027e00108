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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;

import org.junit.jupiter.api.Test;

class BackoffTest {

    @Test
    void withoutDelay() {
        assertThat(Backoff.withoutDelay().nextDelayMillis(0)).isZero();
        assertThat(Backoff.withoutDelay().nextDelayMillis(100)).isZero();
        assertThat(Backoff.constant(0)).isSameAs(Backoff.withoutDelay());
    }

    @Test
    void constant() {
        final Backoff backoff = Backoff.constant(250);
        assertThat(backoff.nextDelayMillis(0)).isEqualTo(250);
        assertThat(backoff.nextDelayMillis(9)).isEqualTo(250);
        assertThatThrownBy(() -> Backoff.constant(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exponential() {
        final Backoff backoff = Backoff.exponential(100, 5000);
        assertThat(backoff.nextDelayMillis(0)).isEqualTo(100);
        assertThat(backoff.nextDelayMillis(1)).isEqualTo(200);
        assertThat(backoff.nextDelayMillis(2)).isEqualTo(400);
        assertThat(backoff.nextDelayMillis(5)).isEqualTo(3200);
        assertThat(backoff.nextDelayMillis(6)).isEqualTo(5000);
        assertThat(backoff.nextDelayMillis(62)).isEqualTo(5000);
        assertThat(backoff.nextDelayMillis(63)).isEqualTo(5000);
        assertThat(backoff.nextDelayMillis(Integer.MAX_VALUE)).isEqualTo(5000);
    }

    @Test
    void exponentialIsMonotonicAndBounded() {
        final long max = Long.MAX_VALUE / 2;
        final Backoff backoff = Backoff.exponential(3, max);
        long previous = 0;
        for (int attempt = 0; attempt < 70; attempt++) {
            final long delay = backoff.nextDelayMillis(attempt);
            assertThat(delay).isGreaterThanOrEqualTo(previous).isLessThanOrEqualTo(max);
            previous = delay;
        }
    }

    @Test
    void exponentialWithZeroMinimum() {
        final Backoff backoff = Backoff.exponential(0, 1000);
        assertThat(backoff.nextDelayMillis(0)).isZero();
        assertThat(backoff.nextDelayMillis(70)).isZero();
    }

    @Test
    void exponentialRejectsInvalidRange() {
        assertThatThrownBy(() -> Backoff.exponential(200, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Backoff.exponential(-1, 100)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void linearJitterStaysWithinRange() {
        final Backoff backoff = Backoff.linearJitter(100, 200, () -> new Random(42));
        for (int attempt = 0; attempt < 10; attempt++) {
            final long delay = backoff.nextDelayMillis(attempt);
            assertThat(delay).isBetween(100L * (attempt + 1), 200L * (attempt + 1) - 1);
        }
    }

    @Test
    void linearJitterWithoutRange() {
        final Backoff backoff = Backoff.linearJitter(100, 100);
        assertThat(backoff.nextDelayMillis(0)).isEqualTo(100);
        assertThat(backoff.nextDelayMillis(2)).isEqualTo(300);
        assertThat(Backoff.linearJitter(100, 50).nextDelayMillis(1)).isEqualTo(200);
    }

    @Test
    void rejectsNegativeAttempt() {
        assertThatThrownBy(() -> Backoff.exponential(1, 2).nextDelayMillis(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
