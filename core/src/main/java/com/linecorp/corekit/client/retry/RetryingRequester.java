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
package com.linecorp.corekit.client.retry;

import static java.util.Objects.requireNonNull;

import java.io.InputStream;
import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.io.ByteStreams;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.Requester;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.annotation.Nullable;

/**
 * A {@link Requester} which retries a request according to a {@link RetryPolicy}, waiting for
 * a {@link Backoff} between attempts.
 *
 * <p>Every attempt is sent with a {@linkplain ClientRequestContext#newDerivedContext() derived context}
 * whose {@link ClientRequestContext#retryAttempt()} is the zero-based number of the attempt, so that
 * the decorators below can tell a retry from the first attempt. Before a retry:
 * <ul>
 *   <li>the request body is {@linkplain com.linecorp.corekit.common.RequestBody#rewind() rewound}.
 *       The body must be repeatable; a failure to rewind aborts the request immediately.</li>
 *   <li>the {@code retry-after} header of a {@code 429} or {@code 503} response, if any, overrides
 *       the {@link Backoff}.</li>
 *   <li>if the deadline of the context would pass while waiting, the outcome of the last attempt is
 *       returned without waiting.</li>
 *   <li>the body of the discarded response is drained up to a limit and closed.</li>
 * </ul>
 *
 * <p>When the retries are exhausted, the outcome of the last attempt is returned as it is. A cancellation
 * of the context while waiting fails the request with the cause of the context.
 */
public final class RetryingRequester implements Requester {

    private static final Logger logger = LoggerFactory.getLogger(RetryingRequester.class);

    /**
     * Returns a new {@link RetryingRequesterBuilder} which retries the requests sent by the specified
     * {@link Requester}.
     */
    public static RetryingRequesterBuilder builder(Requester delegate) {
        return new RetryingRequesterBuilder(delegate);
    }

    private final Requester delegate;
    private final int retryMax;
    private final Backoff backoff;
    private final RetryPolicy retryPolicy;
    private final int drainLimitBytes;
    private final Clock clock;

    RetryingRequester(Requester delegate, int retryMax, Backoff backoff, RetryPolicy retryPolicy,
                      int drainLimitBytes, Clock clock) {
        this.delegate = requireNonNull(delegate, "delegate");
        this.retryMax = retryMax;
        this.backoff = requireNonNull(backoff, "backoff");
        this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy");
        this.drainLimitBytes = drainLimitBytes;
        this.clock = requireNonNull(clock, "clock");
    }

    /**
     * Returns the {@link Requester} which sends each attempt.
     */
    public Requester delegate() {
        return delegate;
    }

    /**
     * Returns the maximum number of retries. The request is sent at most {@code retryMax() + 1} times.
     */
    public int retryMax() {
        return retryMax;
    }

    @Override
    public HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
        requireNonNull(ctx, "ctx");
        requireNonNull(req, "req");

        for (int attempt = 0;; attempt++) {
            final ClientRequestContext attemptCtx = ctx.newDerivedContext();
            attemptCtx.setRetryAttempt(attempt);
            final HttpRequest attemptReq = attempt > 0 ? req.withBody(req.body().rewind()) : req;

            HttpResponse res = null;
            Exception cause = null;
            try {
                res = delegate.execute(attemptCtx, attemptReq);
            } catch (Exception e) {
                cause = e;
            }

            final RetryDecision decision;
            try {
                decision = retryPolicy.decide(attemptCtx, res, cause);
            } catch (Exception e) {
                closeQuietly(res);
                throw e;
            }

            if (!decision.shouldRetry()) {
                final Exception override = decision.override();
                if (override != null) {
                    closeQuietly(res);
                    throw override;
                }
                return complete(res, cause);
            }

            if (attempt >= retryMax) {
                logger.debug("Retries exhausted after {} attempt(s): {} {}",
                             attempt + 1, req.method(), req.uri());
                return complete(res, cause);
            }

            long waitMillis = res != null ? RetryAfter.delayMillis(res, clock) : -1;
            if (waitMillis < 0) {
                waitMillis = backoff.nextDelayMillis(attempt);
            }

            if (ctx.remainingNanos() <= TimeUnit.MILLISECONDS.toNanos(waitMillis)) {
                logger.debug("Not retrying {} {} because the deadline would pass in {} ms of backoff",
                             req.method(), req.uri(), waitMillis);
                return complete(res, cause);
            }

            if (res != null) {
                drain(res);
            }

            logger.debug("Retrying {} {} in {} ms (attempt: {}, status: {}, cause: {})",
                         req.method(), req.uri(), waitMillis, attempt + 1,
                         res != null ? res.status() : null, cause != null ? cause.toString() : null);
            waitFor(ctx, waitMillis);
        }
    }

    private static HttpResponse complete(@Nullable HttpResponse res, @Nullable Exception cause)
            throws Exception {
        if (cause != null) {
            closeQuietly(res);
            throw cause;
        }
        return requireNonNull(res, "res");
    }

    private void drain(HttpResponse res) {
        try (InputStream body = res.body()) {
            ByteStreams.exhaust(ByteStreams.limit(body, drainLimitBytes));
        } catch (Exception e) {
            logger.debug("Failed to drain the body of a response: {}", res, e);
        }
    }

    private static void waitFor(ClientRequestContext ctx, long waitMillis) throws Exception {
        if (waitMillis <= 0) {
            final RuntimeException cause = ctx.cause();
            if (cause != null) {
                throw cause;
            }
            return;
        }
        try {
            ctx.whenCancelled().get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            // Never completed exceptionally.
            throw new IllegalStateException(e.getCause());
        }
        throw requireNonNull(ctx.cause(), "cause");
    }

    private static void closeQuietly(@Nullable HttpResponse res) {
        if (res != null) {
            res.close();
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("delegate", delegate)
                          .add("retryMax", retryMax)
                          .add("backoff", backoff)
                          .add("retryPolicy", retryPolicy)
                          .toString();
    }
}
