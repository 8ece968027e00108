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

import com.google.common.base.Ascii;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.HttpStatus;
import com.linecorp.corekit.common.annotation.Nullable;

import io.micrometer.core.instrument.Tags;

/**
 * Creates the {@link Tags} shared by the request metrics of the client decorators.
 */
public final class RequestMetricTags {

    /**
     * Returns the {@code technology}, {@code target_id} (if any) and lower-cased {@code method} tags.
     */
    public static Tags common(ClientRequestContext ctx, HttpRequest req) {
        final Tags tags = Tags.of("technology", "java");
        final String targetId = ctx.targetId();
        return (targetId != null ? tags.and("target_id", targetId) : tags)
                .and("method", Ascii.toLowerCase(req.method().name()));
    }

    /**
     * Returns the {@code status} and {@code status_class} tags classifying the outcome of a request:
     * <ul>
     *   <li>{@code timeout} and {@code error} if the request timed out,</li>
     *   <li>{@code error} and {@code error} if it failed otherwise, and</li>
     *   <li>the status code and its class, e.g. {@code 503} and {@code 5xx}, if it has a response.</li>
     * </ul>
     */
    public static Tags outcome(@Nullable HttpResponse res, @Nullable Throwable cause) {
        if (cause == null && res != null) {
            return Tags.of("status", String.valueOf(res.status()),
                           "status_class", HttpStatus.statusClass(res.status()));
        }
        final String status = TimeoutExceptionPredicate.isTimeoutException(cause) ? "timeout" : "error";
        return Tags.of("status", status, "status_class", "error");
    }

    /**
     * Returns the {@code status} tag of a connection phase, which is {@code ok}, {@code timeout} or
     * {@code error}.
     */
    public static Tags phaseStatus(@Nullable Throwable cause) {
        if (cause == null) {
            return Tags.of("status", "ok");
        }
        return Tags.of("status", TimeoutExceptionPredicate.isTimeoutException(cause) ? "timeout" : "error");
    }

    private RequestMetricTags() {}
}
