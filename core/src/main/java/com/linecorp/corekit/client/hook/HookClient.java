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
package com.linecorp.corekit.client.hook;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.client.SimpleDecoratingHttpClient;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.annotation.Nullable;

/**
 * An {@link HttpClient} decorator which runs {@link RequestHook}s before and {@link ResponseHook}s after
 * sending a request.
 *
 * <p>The request hooks run in order. When one of them throws, the exception is rethrown as it is, and
 * neither the request is sent nor the response hooks are run. The response hooks run in order after
 * the delegate returned or threw; their own failures are logged and never change the outcome.
 */
public final class HookClient extends SimpleDecoratingHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(HookClient.class);

    /**
     * Creates a new {@link HookClient} decorator with the specified hooks.
     */
    public static Function<? super HttpClient, HookClient> newDecorator(
            Iterable<? extends RequestHook> requestHooks, Iterable<? extends ResponseHook> responseHooks) {
        final List<RequestHook> requestHookList = ImmutableList.copyOf(requireNonNull(requestHooks,
                                                                                      "requestHooks"));
        final List<ResponseHook> responseHookList = ImmutableList.copyOf(requireNonNull(responseHooks,
                                                                                        "responseHooks"));
        return delegate -> new HookClient(delegate, requestHookList, responseHookList);
    }

    private final List<RequestHook> requestHooks;
    private final List<ResponseHook> responseHooks;

    HookClient(HttpClient delegate, List<RequestHook> requestHooks, List<ResponseHook> responseHooks) {
        super(delegate);
        this.requestHooks = requestHooks;
        this.responseHooks = responseHooks;
    }

    @Override
    public HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
        for (RequestHook hook : requestHooks) {
            req = requireNonNull(hook.onRequest(ctx, req), "RequestHook.onRequest() returned null.");
        }

        final HttpResponse res;
        try {
            res = unwrap().execute(ctx, req);
        } catch (Throwable cause) {
            runResponseHooks(ctx, req, null, cause);
            throw cause;
        }
        runResponseHooks(ctx, req, res, null);
        return res;
    }

    private void runResponseHooks(ClientRequestContext ctx, HttpRequest req,
                                  @Nullable HttpResponse res, @Nullable Throwable cause) {
        for (ResponseHook hook : responseHooks) {
            try {
                hook.onResponse(ctx, req, res, cause);
            } catch (Exception e) {
                logger.warn("Unexpected exception from a response hook: {}", hook, e);
            }
        }
    }
}
