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
 * HTTP status codes used by this library.
 */
public final class HttpStatus {

    public static final int OK = 200;
    public static final int MOVED_PERMANENTLY = 301;
    public static final int FOUND = 302;
    public static final int SEE_OTHER = 303;
    public static final int NOT_MODIFIED = 304;
    public static final int TEMPORARY_REDIRECT = 307;
    public static final int PERMANENT_REDIRECT = 308;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int TOO_MANY_REQUESTS = 429;
    public static final int INTERNAL_SERVER_ERROR = 500;
    public static final int NOT_IMPLEMENTED = 501;
    public static final int BAD_GATEWAY = 502;
    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int GATEWAY_TIMEOUT = 504;

    /**
     * Returns the class of the specified status code, e.g. {@code "2xx"} for {@code 204}.
     */
    public static String statusClass(int code) {
        return code / 100 + "xx";
    }

    /**
     * Returns whether the specified status code asks the client to follow the {@code location} header.
     */
    public static boolean isRedirection(int code) {
        switch (code) {
            case MOVED_PERMANENTLY:
            case FOUND:
            case SEE_OTHER:
            case TEMPORARY_REDIRECT:
            case PERMANENT_REDIRECT:
                return true;
            default:
                return false;
        }
    }

    private HttpStatus() {}
}
