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
package com.linecorp.corekit.client.circuitbreaker;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.common.HttpRequest;

/**
 * Returns the {@link CircuitBreaker} bucket of a request.
 */
@FunctionalInterface
public interface BucketMapping {

    /**
     * Returns the default {@link BucketMapping}, which uses {@link ClientRequestContext#targetId()} and
     * falls back to {@link ClientRequestContext#endpointTemplate()}, or an empty string if neither is set.
     */
    static BucketMapping ofDefault() {
        return (ctx, req) -> {
            final String targetId = ctx.targetId();
            if (targetId != null) {
                return targetId;
            }
            final String endpointTemplate = ctx.endpointTemplate();
            return endpointTemplate != null ? endpointTemplate : "";
        };
    }

    /**
     * Returns the bucket of the specified request. Keep the number of distinct buckets low.
     */
    String bucket(ClientRequestContext ctx, HttpRequest req);
}
