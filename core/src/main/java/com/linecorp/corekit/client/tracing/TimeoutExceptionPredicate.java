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
package com.linecorp.corekit.client.tracing;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import com.linecorp.corekit.common.RequestTimeoutException;
import com.linecorp.corekit.common.annotation.Nullable;

/**
 * Tells whether an exception raised by a request represents a timeout.
 */
public final class TimeoutExceptionPredicate {

    /**
     * Returns {@code true} if the specified {@link Throwable}, or the cause it wraps, is a timeout.
     */
    public static boolean isTimeoutException(@Nullable Throwable cause) {
        if (cause == null) {
            return false;
        }
        cause = peel(cause);

        if (cause instanceof RequestTimeoutException) {
            // The deadline of a request context.
            return true;
        }
        if (cause instanceof SocketTimeoutException || cause instanceof TimeoutException) {
            // A connect or read timeout.
            return true;
        }
        if (cause instanceof InterruptedIOException) {
            // OkHttp signals a call timeout with a plain InterruptedIOException.
            return "timeout".equals(cause.getMessage());
        }
        return false;
    }

    private static Throwable peel(Throwable cause) {
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) &&
               cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private TimeoutExceptionPredicate() {}
}
