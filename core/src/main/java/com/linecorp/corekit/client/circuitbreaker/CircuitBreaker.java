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

/**
 * A circuit breaker which decides whether a request may be sent, partitioned by bucket.
 * This library does not implement a circuit breaker algorithm; plug in an implementation with
 * {@link CircuitBreakerClient}.
 *
 * <p>An implementation must be safe for concurrent use, and the admission decision it makes for a
 * bucket must be atomic with respect to the outcomes reported for the same bucket.
 */
@FunctionalInterface
public interface CircuitBreaker {

    /**
     * Decides whether a request of the specified bucket may be sent.
     *
     * @param bucket the key which groups the requests sharing the same circuit state
     * @return the {@link CircuitBreakerAdmission} to report the outcome of the request to
     */
    CircuitBreakerAdmission allow(String bucket);
}
