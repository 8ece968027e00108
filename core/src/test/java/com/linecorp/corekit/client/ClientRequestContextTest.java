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

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.io.IOException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.linecorp.corekit.common.HttpHeaders;
import com.linecorp.corekit.common.RequestCancellationException;
import com.linecorp.corekit.common.RequestTimeoutException;

import io.netty.util.AttributeKey;

class ClientRequestContextTest {

    private static final AttributeKey<String> FOO = AttributeKey.valueOf(ClientRequestContextTest.class, "FOO");

    @Test
    void defaults() {
        final ClientRequestContext ctx = ClientRequestContext.of();
        assertThat(ctx.targetId()).isNull();
        assertThat(ctx.endpointTemplate()).isNull();
        assertThat(ctx.retryAttempt()).isZero();
        assertThat(ctx.forwardedHeaders().isEmpty()).isTrue();
        assertThat(ctx.clientTrace()).isSameAs(ClientConnectionTrace.noop());
        assertThat(ctx.hasDeadline()).isFalse();
        assertThat(ctx.remainingNanos()).isEqualTo(Long.MAX_VALUE);
        assertThat(ctx.isDone()).isFalse();
        assertThat(ctx.cause()).isNull();
        assertThat(ctx.parent()).isNull();
    }

    @Test
    void derivedContextInheritsAttributesWithoutLeaking() {
        final ClientRequestContext parent = ClientRequestContext.of();
        parent.setTargetId("users");
        parent.setAttr(FOO, "parent");
        parent.setForwardedHeaders(HttpHeaders.of("x-request-id", "abc"));

        final ClientRequestContext child = parent.newDerivedContext();
        assertThat(child.parent()).isSameAs(parent);
        assertThat(child.targetId()).isEqualTo("users");
        assertThat(child.attr(FOO)).isEqualTo("parent");
        assertThat(child.forwardedHeaders().get("x-request-id")).isEqualTo("abc");

        child.setRetryAttempt(2);
        child.setAttr(FOO, "child");
        child.setEndpointTemplate("/users/{id}");
        assertThat(child.retryAttempt()).isEqualTo(2);
        assertThat(child.attr(FOO)).isEqualTo("child");
        assertThat(parent.retryAttempt()).isZero();
        assertThat(parent.attr(FOO)).isEqualTo("parent");
        assertThat(parent.endpointTemplate()).isNull();
    }

    @Test
    void cancellationPropagatesToDerivedContexts() {
        final ClientRequestContext parent = ClientRequestContext.of();
        final ClientRequestContext child = parent.newDerivedContext();
        final ClientRequestContext grandChild = child.newDerivedContext();

        parent.cancel();

        assertThat(child.isCancelled()).isTrue();
        assertThat(grandChild.isCancelled()).isTrue();
        assertThat(grandChild.cause()).isInstanceOf(RequestCancellationException.class);
        assertThat(grandChild.whenCancelled()).isCompleted();
    }

    @Test
    void cancellingChildDoesNotCancelParent() {
        final ClientRequestContext parent = ClientRequestContext.of();
        final ClientRequestContext child = parent.newDerivedContext();
        child.cancel(new IOException("stop"));

        assertThat(child.cause()).isInstanceOf(RequestCancellationException.class)
                                 .hasCauseInstanceOf(IOException.class);
        assertThat(parent.isCancelled()).isFalse();
    }

    @Test
    void derivedContextNeverOutlivesParentDeadline() {
        final ClientRequestContext parent = ClientRequestContext.of(Duration.ofSeconds(1));
        final ClientRequestContext longer = parent.newDerivedContext(Duration.ofHours(1));
        final ClientRequestContext shorter = parent.newDerivedContext(Duration.ofMillis(10));
        final ClientRequestContext unbounded = parent.newDerivedContext();

        assertThat(longer.deadlineNanos()).isEqualTo(parent.deadlineNanos());
        assertThat(unbounded.deadlineNanos()).isEqualTo(parent.deadlineNanos());
        assertThat(shorter.deadlineNanos() - parent.deadlineNanos()).isNegative();
        assertThat(shorter.remainingNanos()).isLessThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(10));
    }

    @Test
    void zeroTimeoutMeansNoDeadline() {
        assertThat(ClientRequestContext.of(Duration.ZERO).hasDeadline()).isFalse();
    }

    @Test
    void hugeTimeoutMeansNoDeadline() {
        final Duration forever = ChronoUnit.FOREVER.getDuration();
        final ClientRequestContext ctx = ClientRequestContext.of(forever);
        assertThat(ctx.hasDeadline()).isFalse();
        assertThat(ctx.isDone()).isFalse();
        assertThat(ClientRequestContext.of(Duration.ofDays(365L * 300)).hasDeadline()).isFalse();

        final ClientRequestContext parent = ClientRequestContext.of(Duration.ofSeconds(1));
        assertThat(parent.newDerivedContext(forever).deadlineNanos()).isEqualTo(parent.deadlineNanos());

        final ClientRequestContext longButBounded = ClientRequestContext.of(Duration.ofDays(365L * 100));
        assertThat(longButBounded.hasDeadline()).isTrue();
        assertThat(longButBounded.remainingNanos()).isPositive();
    }

    @Test
    void timesOutAfterDeadline() {
        final ClientRequestContext ctx = ClientRequestContext.of(Duration.ofMillis(50));
        assertThat(ctx.isTimedOut()).isFalse();

        await().untilAsserted(() -> assertThat(ctx.isTimedOut()).isTrue());
        assertThat(ctx.isDone()).isTrue();
        assertThat(ctx.isCancelled()).isFalse();
        assertThat(ctx.cause()).isInstanceOf(RequestTimeoutException.class);
    }
}
