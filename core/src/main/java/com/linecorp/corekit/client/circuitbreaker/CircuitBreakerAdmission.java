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
 * The decision of a {@link CircuitBreaker} for a single request.
 */
public interface CircuitBreakerAdmission {

    /**
     * Returns an admitted {@link CircuitBreakerAdmission} which ignores the reported outcome.
     */
    static CircuitBreakerAdmission allowed() {
        return SimpleCircuitBreakerAdmission.ALLOWED;
    }

    /**
     * Returns a rejected {@link CircuitBreakerAdmission}.
     */
    static CircuitBreakerAdmission denied() {
        return SimpleCircuitBreakerAdmission.DENIED;
    }

    /**
     * Returns whether the request may be sent.
     */
    boolean isAllowed();

    /**
     * Reports that the admitted request succeeded.
     */
    void onSuccess();

    /**
     * Reports that the admitted request failed.
     */
    void onFailure();
}
