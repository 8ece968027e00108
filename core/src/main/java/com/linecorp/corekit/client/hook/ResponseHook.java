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
package com.linecorp.corekit.client.hook;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.annotation.Nullable;

/**
 * Invoked by a {@link HookClient} after a request has completed, successfully or not. A response hook
 * is meant for side effects such as recording metrics. It cannot change the outcome of the request, and
 * it must not consume the body of the response.
 */
@FunctionalInterface
public interface ResponseHook {

    /**
     * Observes the outcome of a request. Exactly one of {@code res} and {@code cause} is non-null.
     * An exception thrown by this method is logged and ignored.
     */
    void onResponse(ClientRequestContext ctx, HttpRequest req,
                    @Nullable HttpResponse res, @Nullable Throwable cause) throws Exception;
}
