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

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.HttpStatus;
import com.linecorp.corekit.common.annotation.Nullable;

/**
 * Decides whether a {@link RetryingRequester} retries a request after an attempt.
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Returns the default {@link RetryPolicy}, which
     * <ul>
     *   <li>stops with the cause of the {@link ClientRequestContext} once it is cancelled or timed out,
     *       even if the attempt failed for another reason,</li>
     *   <li>retries when the attempt failed with an exception, and</li>
     *   <li>retries on the status {@code 0} and on any status greater than or equal to {@code 500}
     *       except {@code 501 Not Implemented}.</li>
     * </ul>
     */
    static RetryPolicy serverErrors() {
        return (ctx, res, cause) -> {
            final RuntimeException ctxCause = ctx.cause();
            if (ctxCause != null) {
                return RetryDecision.stop(ctxCause);
            }
            if (cause != null) {
                return RetryDecision.retry();
            }
            if (res != null) {
                final int status = res.status();
                if (status == 0 || (status >= 500 && status != HttpStatus.NOT_IMPLEMENTED)) {
                    return RetryDecision.retry();
                }
            }
            return RetryDecision.stop();
        };
    }

    /**
     * Returns a {@link RetryPolicy} which never retries and keeps the outcome of the first attempt.
     */
    static RetryPolicy never() {
        return (ctx, res, cause) -> RetryDecision.stop();
    }

    /**
     * Returns the {@link RetryDecision} on the outcome of an attempt. Exactly one of {@code res} and
     * {@code cause} is non-null.
     */
    RetryDecision decide(ClientRequestContext ctx, @Nullable HttpResponse res, @Nullable Exception cause)
            throws Exception;
}
