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

import java.util.function.Function;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.client.SimpleDecoratingHttpClient;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;

/**
 * An {@link HttpClient} decorator that handles failures of remote invocation based on a
 * {@link CircuitBreaker}.
 *
 * <p>Every request is mapped to a bucket by a {@link BucketMapping} and sent only if
 * {@link CircuitBreaker#allow(String)} admits it. A rejected request fails with a
 * {@link FailFastException} without reaching the delegate, and increments the
 * {@value #CIRCUIT_BREAKER_OPEN_METER_NAME} counter. The outcome of an admitted request is reported
 * back to the breaker: an exception is a failure, and a response is classified by a success
 * {@link Predicate}, which by default regards any status below {@code 500} as a success.
 *
 * <p>Note that the default classifier regards {@code 501 Not Implemented} as a failure, whereas the
 * default {@link com.linecorp.corekit.client.retry.RetryPolicy} does not retry it.
 */
public final class CircuitBreakerClient extends SimpleDecoratingHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerClient.class);

    static final String CIRCUIT_BREAKER_OPEN_METER_NAME = "toolkit.http.client.circuit_breaker.open";

    private static final Predicate<HttpResponse> DEFAULT_SUCCESS_PREDICATE = res -> res.status() < 500;

    /**
     * Returns the default success {@link Predicate}, which regards any status below {@code 500}
     * as a success.
     */
    public static Predicate<HttpResponse> defaultSuccessPredicate() {
        return DEFAULT_SUCCESS_PREDICATE;
    }

    /**
     * Creates a new decorator using the specified {@link CircuitBreaker}, the default success
     * {@link Predicate} and {@link BucketMapping#ofDefault()}.
     */
    public static Function<? super HttpClient, CircuitBreakerClient> newDecorator(CircuitBreaker breaker) {
        return newDecorator(breaker, DEFAULT_SUCCESS_PREDICATE);
    }

    /**
     * Creates a new decorator using the specified {@link CircuitBreaker} and success {@link Predicate}.
     */
    public static Function<? super HttpClient, CircuitBreakerClient> newDecorator(
            CircuitBreaker breaker, Predicate<? super HttpResponse> successPredicate) {
        return newDecorator(breaker, successPredicate, BucketMapping.ofDefault(), Metrics.globalRegistry);
    }

    /**
     * Creates a new decorator.
     *
     * @param breaker the {@link CircuitBreaker} consulted before every request
     * @param successPredicate returns {@code true} if a response is a success
     * @param bucketMapping maps a request to its bucket
     * @param meterRegistry the {@link MeterRegistry} the rejection counter is recorded to
     */
    public static Function<? super HttpClient, CircuitBreakerClient> newDecorator(
            CircuitBreaker breaker, Predicate<? super HttpResponse> successPredicate,
            BucketMapping bucketMapping, MeterRegistry meterRegistry) {
        requireNonNull(breaker, "breaker");
        requireNonNull(successPredicate, "successPredicate");
        requireNonNull(bucketMapping, "bucketMapping");
        requireNonNull(meterRegistry, "meterRegistry");
        return delegate -> new CircuitBreakerClient(delegate, breaker, successPredicate,
                                                    bucketMapping, meterRegistry);
    }

    private final CircuitBreaker breaker;
    private final Predicate<? super HttpResponse> successPredicate;
    private final BucketMapping bucketMapping;
    private final MeterRegistry meterRegistry;

    CircuitBreakerClient(HttpClient delegate, CircuitBreaker breaker,
                         Predicate<? super HttpResponse> successPredicate,
                         BucketMapping bucketMapping, MeterRegistry meterRegistry) {
        super(delegate);
        this.breaker = breaker;
        this.successPredicate = successPredicate;
        this.bucketMapping = bucketMapping;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Returns the {@link CircuitBreaker} consulted by this client.
     */
    public CircuitBreaker circuitBreaker() {
        return breaker;
    }

    @Override
    public HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
        final String bucket = bucketMapping.bucket(ctx, req);
        final CircuitBreakerAdmission admission = breaker.allow(bucket);
        if (!admission.isAllowed()) {
            final String targetId = ctx.targetId();
            final Tags tags = targetId != null ? Tags.of("target_id", targetId, "bucket", bucket)
                                               : Tags.of("bucket", bucket);
            meterRegistry.counter(CIRCUIT_BREAKER_OPEN_METER_NAME, tags).increment();
            logger.debug("Circuit open for bucket '{}', rejected: {} {}", bucket, req.method(), req.uri());
            throw new FailFastException(bucket);
        }

        final HttpResponse res;
        try {
            res = unwrap().execute(ctx, req);
        } catch (Throwable cause) {
            admission.onFailure();
            throw cause;
        }

        if (successPredicate.test(res)) {
            admission.onSuccess();
        } else {
            admission.onFailure();
        }
        return res;
    }
}
