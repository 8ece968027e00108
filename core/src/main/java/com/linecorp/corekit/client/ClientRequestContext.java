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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import com.google.common.base.MoreObjects;

import com.linecorp.corekit.common.HttpHeaders;
import com.linecorp.corekit.common.RequestCancellationException;
import com.linecorp.corekit.common.RequestTimeoutException;
import com.linecorp.corekit.common.annotation.Nullable;

import io.netty.util.AttributeKey;
import io.netty.util.DefaultAttributeMap;

/**
 * Request-scoped metadata passed along with an {@link com.linecorp.corekit.common.HttpRequest} through
 * a chain of {@link HttpClient} decorators.
 *
 * <p>A context carries:
 * <ul>
 *   <li>typed attributes such as {@link #targetId()}, {@link #retryAttempt()} and
 *       {@link #forwardedHeaders()}, plus arbitrary {@link AttributeKey}-keyed attributes,</li>
 *   <li>an optional deadline, and</li>
 *   <li>a cancellation signal.</li>
 * </ul>
 *
 * <p>A context is meant to be used by a single logical request. A decorator which needs to change an
 * attribute for the requests it sends downstream, such as a retrying client stamping the attempt number,
 * should create a {@linkplain #newDerivedContext() derived context} instead of mutating the one it
 * received. A derived context sees the attributes of its parent, is cancelled when its parent is
 * cancelled and never outlives the deadline of its parent.
 */
public final class ClientRequestContext {

    private static final AttributeKey<String> TARGET_ID =
            AttributeKey.valueOf(ClientRequestContext.class, "TARGET_ID");
    private static final AttributeKey<String> ENDPOINT_TEMPLATE =
            AttributeKey.valueOf(ClientRequestContext.class, "ENDPOINT_TEMPLATE");
    private static final AttributeKey<Integer> RETRY_ATTEMPT =
            AttributeKey.valueOf(ClientRequestContext.class, "RETRY_ATTEMPT");
    private static final AttributeKey<HttpHeaders> FORWARDED_HEADERS =
            AttributeKey.valueOf(ClientRequestContext.class, "FORWARDED_HEADERS");
    private static final AttributeKey<ClientConnectionTrace> CLIENT_TRACE =
            AttributeKey.valueOf(ClientRequestContext.class, "CLIENT_TRACE");

    // The longest timeout whose deadline can be compared with System.nanoTime() without overflow.
    private static final Duration MAX_TIMEOUT = Duration.ofNanos(Long.MAX_VALUE / 2);

    /**
     * Returns a new {@link ClientRequestContext} without a deadline.
     */
    public static ClientRequestContext of() {
        return new ClientRequestContext(null, 0);
    }

    /**
     * Returns a new {@link ClientRequestContext} whose deadline is the specified {@code timeout} from now.
     * A zero {@code timeout} or one longer than about 146 years means no deadline.
     */
    public static ClientRequestContext of(Duration timeout) {
        return new ClientRequestContext(null, deadlineNanos(timeout));
    }

    private static long deadlineNanos(Duration timeout) {
        requireNonNull(timeout, "timeout");
        checkArgument(!timeout.isNegative(), "timeout: %s (expected: >= 0)", timeout);
        if (timeout.isZero() || timeout.compareTo(MAX_TIMEOUT) > 0) {
            return 0;
        }
        final long deadline = System.nanoTime() + timeout.toNanos();
        // 0 is reserved for 'no deadline'.
        return deadline == 0 ? 1 : deadline;
    }

    @Nullable
    private final ClientRequestContext parent;
    private final DefaultAttributeMap attrs = new DefaultAttributeMap();
    private final CompletableFuture<RequestCancellationException> whenCancelled = new CompletableFuture<>();
    private final long deadlineNanos;

    private ClientRequestContext(@Nullable ClientRequestContext parent, long deadlineNanos) {
        this.parent = parent;
        if (parent != null && parent.hasDeadline()) {
            if (deadlineNanos == 0 || parent.deadlineNanos - deadlineNanos < 0) {
                deadlineNanos = parent.deadlineNanos;
            }
        }
        this.deadlineNanos = deadlineNanos;
        if (parent != null) {
            parent.whenCancelled.thenAccept(whenCancelled::complete);
        }
    }

    /**
     * Returns a new child context which inherits the attributes, the deadline and the cancellation of
     * this context. Attributes set on the child are not visible from this context.
     */
    public ClientRequestContext newDerivedContext() {
        return new ClientRequestContext(this, 0);
    }

    /**
     * Returns a new child context like {@link #newDerivedContext()}, whose deadline is the earlier of
     * the deadline of this context and the specified {@code timeout} from now. A zero {@code timeout}
     * keeps the deadline of this context.
     */
    public ClientRequestContext newDerivedContext(Duration timeout) {
        return new ClientRequestContext(this, deadlineNanos(timeout));
    }

    /**
     * Returns the parent context, or {@code null} if this context was not derived.
     */
    @Nullable
    public ClientRequestContext parent() {
        return parent;
    }

    /**
     * Returns the value of the specified attribute, looking up the parent contexts if this context does
     * not have it.
     */
    @Nullable
    public <T> T attr(AttributeKey<T> key) {
        requireNonNull(key, "key");
        if (attrs.hasAttr(key)) {
            final T value = attrs.attr(key).get();
            if (value != null) {
                return value;
            }
        }
        return parent != null ? parent.attr(key) : null;
    }

    /**
     * Sets the value of the specified attribute in this context.
     */
    public <T> void setAttr(AttributeKey<T> key, @Nullable T value) {
        requireNonNull(key, "key");
        attrs.attr(key).set(value);
    }

    /**
     * Returns the low-cardinality identifier of the logical destination of the request, which is used
     * as a metric tag and as a circuit breaker bucket.
     */
    @Nullable
    public String targetId() {
        return attr(TARGET_ID);
    }

    public void setTargetId(String targetId) {
        setAttr(TARGET_ID, requireNonNull(targetId, "targetId"));
    }

    /**
     * Returns the template of the requested endpoint, e.g. {@code /users/{id}}.
     */
    @Nullable
    public String endpointTemplate() {
        return attr(ENDPOINT_TEMPLATE);
    }

    public void setEndpointTemplate(String endpointTemplate) {
        setAttr(ENDPOINT_TEMPLATE, requireNonNull(endpointTemplate, "endpointTemplate"));
    }

    /**
     * Returns the number of the current retry attempt. {@code 0} is the first attempt.
     */
    public int retryAttempt() {
        final Integer attempt = attr(RETRY_ATTEMPT);
        return attempt != null ? attempt : 0;
    }

    public void setRetryAttempt(int retryAttempt) {
        checkArgument(retryAttempt >= 0, "retryAttempt: %s (expected: >= 0)", retryAttempt);
        setAttr(RETRY_ATTEMPT, retryAttempt);
    }

    /**
     * Returns the headers of an incoming request that should be forwarded to the outgoing requests.
     */
    public HttpHeaders forwardedHeaders() {
        final HttpHeaders headers = attr(FORWARDED_HEADERS);
        return headers != null ? headers : HttpHeaders.of();
    }

    public void setForwardedHeaders(HttpHeaders forwardedHeaders) {
        setAttr(FORWARDED_HEADERS, requireNonNull(forwardedHeaders, "forwardedHeaders"));
    }

    /**
     * Returns the {@link ClientConnectionTrace} notified of the connection events of the request.
     */
    public ClientConnectionTrace clientTrace() {
        final ClientConnectionTrace trace = attr(CLIENT_TRACE);
        return trace != null ? trace : ClientConnectionTrace.noop();
    }

    public void setClientTrace(ClientConnectionTrace clientTrace) {
        setAttr(CLIENT_TRACE, requireNonNull(clientTrace, "clientTrace"));
    }

    /**
     * Cancels the request. The derived contexts are cancelled as well.
     */
    public void cancel() {
        whenCancelled.complete(new RequestCancellationException());
    }

    /**
     * Cancels the request with the specified cause.
     */
    public void cancel(Throwable cause) {
        requireNonNull(cause, "cause");
        whenCancelled.complete(new RequestCancellationException(cause));
    }

    /**
     * Returns a {@link CompletableFuture} which is completed when this context is cancelled.
     * It is never completed by the deadline alone.
     */
    public CompletableFuture<RequestCancellationException> whenCancelled() {
        return whenCancelled;
    }

    public boolean isCancelled() {
        return whenCancelled.isDone();
    }

    /**
     * Returns whether the deadline of this context has passed.
     */
    public boolean isTimedOut() {
        return hasDeadline() && remainingNanos() <= 0;
    }

    /**
     * Returns whether this context has been cancelled or timed out.
     */
    public boolean isDone() {
        return isCancelled() || isTimedOut();
    }

    /**
     * Returns why this context is done; a {@link RequestCancellationException} if it was cancelled,
     * a {@link RequestTimeoutException} if its deadline has passed, or {@code null} if it is still active.
     */
    @Nullable
    public RuntimeException cause() {
        final RequestCancellationException cancellation = whenCancelled.getNow(null);
        if (cancellation != null) {
            return cancellation;
        }
        if (isTimedOut()) {
            return new RequestTimeoutException();
        }
        return null;
    }

    public boolean hasDeadline() {
        return deadlineNanos != 0;
    }

    /**
     * Returns the deadline as a {@link System#nanoTime()} value. Valid only if {@link #hasDeadline()}.
     */
    public long deadlineNanos() {
        return deadlineNanos;
    }

    /**
     * Returns the time left until the deadline in nanoseconds, which may be negative, or
     * {@link Long#MAX_VALUE} if there is no deadline.
     */
    public long remainingNanos() {
        if (!hasDeadline()) {
            return Long.MAX_VALUE;
        }
        return deadlineNanos - System.nanoTime();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("targetId", targetId())
                          .add("endpointTemplate", endpointTemplate())
                          .add("retryAttempt", retryAttempt())
                          .add("cancelled", isCancelled())
                          .add("remainingNanos", hasDeadline() ? remainingNanos() : null)
                          .toString();
    }
}
