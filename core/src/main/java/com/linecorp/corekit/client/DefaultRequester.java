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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;

import com.linecorp.corekit.common.HttpHeaderNames;
import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpRequestBuilder;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.HttpStatus;
import com.linecorp.corekit.common.RequestBody;

/**
 * A {@link Requester} which sends a request through an {@link HttpClient} with a timeout, optionally
 * following redirects.
 *
 * <p>The timeout covers the whole exchange including the redirects. When following redirects,
 * at most {@value #MAX_REDIRECTS} are followed. A {@code 301}, {@code 302} or {@code 303} response turns
 * a request other than {@code GET} and {@code HEAD} into a {@code GET} without a body, whereas
 * {@code 307} and {@code 308} resend the same request with its body rewound.
 */
public final class DefaultRequester implements Requester {

    private static final Logger logger = LoggerFactory.getLogger(DefaultRequester.class);

    static final int MAX_REDIRECTS = 10;

    private final HttpClient client;
    private final Duration timeout;
    private final boolean followRedirects;

    /**
     * Creates a new instance.
     *
     * @param client the {@link HttpClient} which sends every request
     * @param timeout the timeout of a request, or {@link Duration#ZERO} to disable it
     * @param followRedirects whether to follow redirects
     */
    public DefaultRequester(HttpClient client, Duration timeout, boolean followRedirects) {
        this.client = requireNonNull(client, "client");
        this.timeout = requireNonNull(timeout, "timeout");
        this.followRedirects = followRedirects;
    }

    /**
     * Returns the {@link HttpClient} which sends every request.
     */
    public HttpClient client() {
        return client;
    }

    @Override
    public HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
        final ClientRequestContext reqCtx = timeout.isZero() ? ctx.newDerivedContext()
                                                             : ctx.newDerivedContext(timeout);
        HttpRequest current = req;
        for (int redirects = 0;; redirects++) {
            final HttpResponse res = client.execute(reqCtx, current);
            if (!followRedirects || !HttpStatus.isRedirection(res.status())) {
                return res;
            }
            final String location = res.headers().get(HttpHeaderNames.LOCATION);
            if (location == null) {
                return res;
            }
            res.close();
            if (redirects >= MAX_REDIRECTS) {
                throw new IOException("stopped after " + MAX_REDIRECTS + " redirects: " + req.uri());
            }
            final HttpRequest next = redirect(current, res.status(), location);
            logger.debug("Following a redirect: {} {} -> {} {}",
                         current.method(), current.uri(), next.method(), next.uri());
            current = next;
        }
    }

    static HttpRequest redirect(HttpRequest req, int status, String location) {
        final URI target = req.uri().resolve(location);
        final HttpRequestBuilder builder = req.toBuilder().uri(target);
        if (status != HttpStatus.TEMPORARY_REDIRECT && status != HttpStatus.PERMANENT_REDIRECT &&
            req.method() != HttpMethod.GET && req.method() != HttpMethod.HEAD) {
            builder.method(HttpMethod.GET)
                   .body(RequestBody.empty())
                   .removeHeader(HttpHeaderNames.CONTENT_TYPE)
                   .removeHeader(HttpHeaderNames.CONTENT_LENGTH);
        } else {
            builder.body(req.body().rewind());
        }
        if (!sameHost(req.uri(), target)) {
            // Credentials are not sent to another host.
            builder.removeHeader(HttpHeaderNames.AUTHORIZATION)
                   .removeHeader(HttpHeaderNames.COOKIE);
        }
        return builder.build();
    }

    private static boolean sameHost(URI a, URI b) {
        return a.getHost() != null && a.getHost().equalsIgnoreCase(b.getHost());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("client", client)
                          .add("timeout", timeout)
                          .add("followRedirects", followRedirects)
                          .toString();
    }
}
