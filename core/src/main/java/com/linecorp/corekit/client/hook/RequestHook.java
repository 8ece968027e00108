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

/**
 * Invoked before a request is sent by a {@link HookClient}.
 */
@FunctionalInterface
public interface RequestHook {

    /**
     * Inspects or updates the specified request.
     *
     * @return the request to send, which is usually the specified one or a copy of it
     * @throws Exception to abort the request. The exception is thrown to the caller as it is and
     *                   nothing is sent.
     */
    HttpRequest onRequest(ClientRequestContext ctx, HttpRequest req) throws Exception;
}
