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

import com.linecorp.corekit.common.annotation.Nullable;

/**
 * A {@link RuntimeException} raised when a request has been cancelled explicitly.
 */
public final class RequestCancellationException extends RuntimeException {

    private static final long serialVersionUID = 4810216421306618732L;

    /**
     * Creates a new instance.
     */
    public RequestCancellationException() {
        super("request cancelled");
    }

    /**
     * Creates a new instance with the specified cause.
     */
    public RequestCancellationException(@Nullable Throwable cause) {
        super("request cancelled", cause);
    }
}
