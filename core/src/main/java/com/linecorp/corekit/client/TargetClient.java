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

import java.util.function.Function;

import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

/**
 * An {@link HttpClient} decorator which sends a request without a
 * {@link ClientRequestContext#targetId()} with a derived context carrying the target ID, so that the
 * metrics and the circuit breaker buckets of the decorators below are tagged with the service being
 * called.
 */
public final class TargetClient extends SimpleDecoratingHttpClient {

    /**
     * Creates a new {@link TargetClient} decorator with the specified target ID.
     */
    public static Function<? super HttpClient, TargetClient> newDecorator(String targetId) {
        requireNonNull(targetId, "targetId");
        checkArgument(!targetId.isEmpty(), "targetId is empty.");
        return delegate -> new TargetClient(delegate, targetId);
    }

    private final String targetId;

    TargetClient(HttpClient delegate, String targetId) {
        super(delegate);
        this.targetId = targetId;
    }

    @Override
    public HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
        if (ctx.targetId() != null) {
            return unwrap().execute(ctx, req);
        }
        final ClientRequestContext derivedCtx = ctx.newDerivedContext();
        derivedCtx.setTargetId(targetId);
        return unwrap().execute(derivedCtx, req);
    }
}
