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
package com.linecorp.corekit.client;

import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

/**
 * The entry point for sending a logical request. Unlike an {@link HttpClient}, which handles a single
 * exchange, a {@link Requester} may perform several exchanges for one call, e.g. by following redirects
 * or retrying.
 *
 * <p>Any implementation can sit beneath or above a retrying {@link Requester}, including a test double.
 */
@FunctionalInterface
public interface Requester {

    /**
     * Sends the specified {@link HttpRequest} with a new {@link ClientRequestContext} without deadline.
     */
    default HttpResponse execute(HttpRequest req) throws Exception {
        return execute(ClientRequestContext.of(), req);
    }

    /**
     * Sends the specified {@link HttpRequest}.
     *
     * @return the final {@link HttpResponse}, whose body must be read fully or closed by the caller
     */
    HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception;
}
