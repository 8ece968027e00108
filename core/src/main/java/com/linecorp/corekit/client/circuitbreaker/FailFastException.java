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

import static java.util.Objects.requireNonNull;

/**
 * An exception indicating that a request has been rejected by a {@link CircuitBreaker} without being
 * sent.
 */
public final class FailFastException extends RuntimeException {

    private static final long serialVersionUID = -946827349873835165L;

    private final String bucket;

    /**
     * Creates a new instance with the bucket whose circuit is open.
     */
    public FailFastException(String bucket) {
        super("circuit breaker open: " + requireNonNull(bucket, "bucket"));
        this.bucket = bucket;
    }

    /**
     * Returns the bucket whose circuit is open.
     */
    public String bucket() {
        return bucket;
    }

    @Override
    public Throwable fillInStackTrace() {
        return this;
    }
}
