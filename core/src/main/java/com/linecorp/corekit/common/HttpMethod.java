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
package com.linecorp.corekit.common;

/**
 * HTTP request method.
 */
public enum HttpMethod {
    GET(true),
    HEAD(true),
    POST(false),
    PUT(false),
    PATCH(false),
    DELETE(false),
    OPTIONS(true),
    TRACE(true);

    private final boolean safe;

    HttpMethod(boolean safe) {
        this.safe = safe;
    }

    /**
     * Returns whether this method is safe as defined in
     * <a href="https://datatracker.ietf.org/doc/html/rfc7231#section-4.2.1">RFC 7231</a>.
     * A request of an unsafe method invalidates the cached responses of its target.
     */
    public boolean isSafe() {
        return safe;
    }

    /**
     * Returns whether a request of this method must carry a body when sent over the wire.
     */
    public boolean requiresBody() {
        return this == POST || this == PUT || this == PATCH;
    }
}
