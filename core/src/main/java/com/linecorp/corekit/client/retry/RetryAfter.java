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

import java.time.Clock;
import java.time.Instant;

import com.linecorp.corekit.common.HttpHeaderNames;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.HttpStatus;
import com.linecorp.corekit.internal.common.HttpHeaderUtil;

/**
 * Reads the {@code retry-after} header of a {@code 429 Too Many Requests} or
 * {@code 503 Service Unavailable} response.
 */
final class RetryAfter {

    /**
     * Returns the delay requested by the {@code retry-after} header of the specified response in
     * milliseconds, or {@code -1} if the response has no valid one. The header is honored only
     * for the statuses {@code 429} and {@code 503}. A date in the past yields {@code 0}.
     */
    static long delayMillis(HttpResponse res, Clock clock) {
        final int status = res.status();
        if (status != HttpStatus.TOO_MANY_REQUESTS && status != HttpStatus.SERVICE_UNAVAILABLE) {
            return -1;
        }
        final String value = res.headers().get(HttpHeaderNames.RETRY_AFTER);
        if (value == null || value.isEmpty()) {
            return -1;
        }

        try {
            final long seconds = Long.parseLong(value.trim());
            if (seconds < 0) {
                return -1;
            }
            return seconds > Long.MAX_VALUE / 1000 ? Long.MAX_VALUE : seconds * 1000;
        } catch (NumberFormatException ignored) {
            // Not in seconds; try an HTTP date.
        }

        final Instant retryAt = HttpHeaderUtil.parseHttpDate(value);
        if (retryAt == null) {
            return -1;
        }
        return Math.max(retryAt.toEpochMilli() - clock.millis(), 0);
    }

    private RetryAfter() {}
}
