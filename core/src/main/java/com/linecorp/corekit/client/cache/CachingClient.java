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
package com.linecorp.corekit.client.cache;

import static java.util.Objects.requireNonNull;

import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ascii;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import com.linecorp.corekit.client.ClientRequestContext;
import com.linecorp.corekit.client.HttpClient;
import com.linecorp.corekit.client.SimpleDecoratingHttpClient;
import com.linecorp.corekit.common.HttpHeaderNames;
import com.linecorp.corekit.common.HttpHeaders;
import com.linecorp.corekit.common.HttpHeadersBuilder;
import com.linecorp.corekit.common.HttpMethod;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.HttpStatus;
import com.linecorp.corekit.common.annotation.Nullable;
import com.linecorp.corekit.internal.common.HttpHeaderUtil;

/**
 * An {@link HttpClient} decorator which serves responses from a {@link Cache} following the client
 * caching rules of RFC 7234.
 *
 * <p>Only {@code GET} and {@code HEAD} requests without a {@code range} header are served from the
 * cache. A request of any other method removes the entry of its key. A request of an unsafe method
 * such as {@code POST} or {@code PUT} also removes the entries of its URI, and those of the
 * {@code location} and {@code content-location} of a successful response on the same host.
 * A fresh entry is returned without
 * sending the request, marked with the {@code x-from-cache: 1} header. A stale entry is revalidated
 * with {@code if-none-match} and {@code if-modified-since}, and a {@code 304 Not Modified} response
 * is answered with the stored response whose end-to-end headers are refreshed.
 *
 * <p>A {@code 200 OK} response is stored unless the request or the response has the {@code no-store}
 * directive. The body of a {@code GET} response is stored when the caller has read it to the end.
 */
public final class CachingClient extends SimpleDecoratingHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(CachingClient.class);

    private static final Set<String> HOP_BY_HOP_HEADERS = ImmutableSet.of(
            HttpHeaderNames.CONNECTION, HttpHeaderNames.KEEP_ALIVE, HttpHeaderNames.PROXY_AUTHENTICATE,
            HttpHeaderNames.PROXY_AUTHORIZATION, HttpHeaderNames.TE, HttpHeaderNames.TRAILERS,
            HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderNames.UPGRADE);

    private static final List<String> INVALIDATED_LOCATION_HEADERS =
            ImmutableList.of(HttpHeaderNames.LOCATION, HttpHeaderNames.CONTENT_LOCATION);

    /**
     * Creates a new {@link CachingClient} decorator which stores responses into the specified
     * {@link Cache}.
     */
    public static Function<? super HttpClient, CachingClient> newDecorator(Cache cache) {
        requireNonNull(cache, "cache");
        return delegate -> new CachingClient(delegate, cache, Clock.systemUTC());
    }

    /**
     * Returns the key of the specified request: the URI for {@code GET} and the method followed by
     * the URI for the others.
     */
    static String cacheKey(HttpRequest req) {
        if (req.method() == HttpMethod.GET) {
            return req.uri().toString();
        }
        return req.method().name() + ' ' + req.uri();
    }

    enum Freshness {
        FRESH,
        STALE,
        TRANSPARENT
    }

    private final Cache cache;
    private final Clock clock;

    CachingClient(HttpClient delegate, Cache cache, Clock clock) {
        super(delegate);
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * Returns the {@link Cache} this client stores responses into.
     */
    public Cache cache() {
        return cache;
    }

    @Override
    public HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
        final String key = cacheKey(req);
        final boolean cacheable = (req.method() == HttpMethod.GET || req.method() == HttpMethod.HEAD) &&
                                  !req.headers().contains(HttpHeaderNames.RANGE);
        final CachedResponse cached = cacheable ? load(key) : null;

        HttpResponse res;
        if (cached != null) {
            final HttpHeaders cachedHeaders = cached.httpHeaders();
            HttpRequest sent = req;
            if (varyMatches(cached, req)) {
                final Freshness freshness = freshness(cachedHeaders, req.headers(), cached.storedAtMillis());
                if (freshness == Freshness.FRESH) {
                    return markCached(cached, cachedHeaders);
                }
                if (freshness == Freshness.STALE) {
                    sent = withConditionalHeaders(req, cachedHeaders);
                }
            }

            final HttpResponse fetched;
            try {
                fetched = unwrap().execute(ctx, sent);
            } catch (Exception e) {
                if (req.method() == HttpMethod.GET && canStaleOnError(cachedHeaders, req.headers())) {
                    logger.debug("Serving a stale response of '{}' due to an error: {}", key, e.toString());
                    return markCached(cached, cachedHeaders);
                }
                cache.delete(key);
                throw e;
            }

            if (req.method() == HttpMethod.GET && fetched.status() == HttpStatus.NOT_MODIFIED) {
                fetched.close();
                final HttpHeaders merged = mergeEndToEndHeaders(cachedHeaders, fetched.headers());
                final CachedResponse refreshed = cached.withHeaders(merged, clock.millis());
                if (canStore(req.headers(), merged)) {
                    put(key, refreshed);
                } else {
                    cache.delete(key);
                }
                return markCached(refreshed, merged);
            } else if (req.method() == HttpMethod.GET && fetched.status() >= 500 &&
                       canStaleOnError(cachedHeaders, req.headers())) {
                fetched.close();
                return markCached(cached, cachedHeaders);
            } else {
                if (fetched.status() != HttpStatus.OK) {
                    cache.delete(key);
                }
                res = fetched;
            }
        } else if (HttpHeaderUtil.directives(req.headers(), HttpHeaderNames.CACHE_CONTROL)
                                 .containsKey("only-if-cached")) {
            res = HttpResponse.of(HttpStatus.GATEWAY_TIMEOUT);
        } else {
            try {
                res = unwrap().execute(ctx, req);
            } catch (Exception e) {
                if (!req.method().isSafe()) {
                    invalidate(req, null);
                }
                throw e;
            }
        }

        if (!req.method().isSafe()) {
            invalidate(req, res);
        }
        if (cacheable && res.status() == HttpStatus.OK && canStore(req.headers(), res.headers())) {
            return store(key, req, res);
        }
        cache.delete(key);
        return res;
    }

    private void invalidate(HttpRequest req, @Nullable HttpResponse res) {
        final URI uri = req.uri();
        deleteResource(uri);
        if (res == null || res.status() < 200 || res.status() >= 400) {
            return;
        }
        for (String name : INVALIDATED_LOCATION_HEADERS) {
            final String location = res.headers().get(name);
            if (Strings.isNullOrEmpty(location)) {
                continue;
            }
            final URI target;
            try {
                target = uri.resolve(location);
            } catch (IllegalArgumentException e) {
                logger.debug("Ignoring an invalid {} header: {}", name, location, e);
                continue;
            }
            // Only the entries on the same host are removed.
            if (target.getHost() != null && uri.getHost() != null &&
                Ascii.equalsIgnoreCase(target.getHost(), uri.getHost())) {
                deleteResource(target);
            }
        }
    }

    private void deleteResource(URI uri) {
        cache.delete(uri.toString());
        cache.delete(HttpMethod.HEAD.name() + ' ' + uri);
    }

    @Nullable
    private CachedResponse load(String key) {
        final byte[] bytes = cache.get(key);
        if (bytes == null) {
            return null;
        }
        try {
            return CachedResponse.deserialize(bytes);
        } catch (IOException e) {
            logger.warn("Failed to deserialize a cached response of '{}'; removing it.", key, e);
            cache.delete(key);
            return null;
        }
    }

    private HttpResponse store(String key, HttpRequest req, HttpResponse res) throws IOException {
        final Map<String, String> variedHeaders = new LinkedHashMap<>();
        for (String name : HttpHeaderUtil.commaSeparatedValues(res.headers(), HttpHeaderNames.VARY)) {
            final String value = req.headers().get(name);
            if (!Strings.isNullOrEmpty(value)) {
                variedHeaders.put(Ascii.toLowerCase(name), value);
            }
        }

        final HttpResponse storable = res.withHeaders(res.headers().toBuilder()
                                                         .remove(HttpHeaderNames.X_FROM_CACHE)
                                                         .build());
        if (req.method() == HttpMethod.GET) {
            return res.withBody(new CachingInputStream(res.body(), content -> {
                put(key, CachedResponse.of(storable, content, variedHeaders, clock.millis()));
            }));
        }

        final byte[] content = res.content();
        put(key, CachedResponse.of(storable, content, variedHeaders, clock.millis()));
        return HttpResponse.of(res.status(), res.headers(), content);
    }

    private void put(String key, CachedResponse entry) {
        try {
            cache.set(key, entry.serialize());
        } catch (IOException e) {
            logger.warn("Failed to serialize a response of '{}': {}", key, entry, e);
        }
    }

    private static HttpResponse markCached(CachedResponse cached, HttpHeaders headers) {
        return cached.toResponse(headers.toBuilder().set(HttpHeaderNames.X_FROM_CACHE, "1").build());
    }

    private static HttpRequest withConditionalHeaders(HttpRequest req, HttpHeaders cachedHeaders) {
        final HttpHeadersBuilder builder = req.headers().toBuilder();
        final String etag = cachedHeaders.get(HttpHeaderNames.ETAG);
        if (etag != null) {
            builder.setIfAbsent(HttpHeaderNames.IF_NONE_MATCH, etag);
        }
        final String lastModified = cachedHeaders.get(HttpHeaderNames.LAST_MODIFIED);
        if (lastModified != null) {
            builder.setIfAbsent(HttpHeaderNames.IF_MODIFIED_SINCE, lastModified);
        }
        return req.withHeaders(builder.build());
    }

    /**
     * Replaces the end-to-end headers of a stored response with the ones of a revalidation response.
     */
    static HttpHeaders mergeEndToEndHeaders(HttpHeaders cachedHeaders, HttpHeaders newHeaders) {
        final Set<String> hopByHop = ImmutableSet.<String>builder()
                                                 .addAll(HOP_BY_HOP_HEADERS)
                                                 .addAll(lowerCase(HttpHeaderUtil.commaSeparatedValues(
                                                         newHeaders, HttpHeaderNames.CONNECTION)))
                                                 .build();
        final HttpHeadersBuilder builder = cachedHeaders.toBuilder();
        for (String name : newHeaders.names()) {
            if (hopByHop.contains(name)) {
                continue;
            }
            builder.remove(name);
            for (String value : newHeaders.getAll(name)) {
                builder.add(name, value);
            }
        }
        return builder.build();
    }

    private static List<String> lowerCase(List<String> values) {
        return Lists.transform(values, Ascii::toLowerCase);
    }

    private static boolean varyMatches(CachedResponse cached, HttpRequest req) {
        final HttpHeaders cachedHeaders = cached.httpHeaders();
        for (String name : HttpHeaderUtil.commaSeparatedValues(cachedHeaders, HttpHeaderNames.VARY)) {
            final String lowerCased = Ascii.toLowerCase(name);
            final String requested = Strings.nullToEmpty(req.headers().get(lowerCased));
            final String stored = Strings.nullToEmpty(cached.variedHeaders().get(lowerCased));
            if (!requested.equals(stored)) {
                return false;
            }
        }
        return true;
    }

    Freshness freshness(HttpHeaders resHeaders, HttpHeaders reqHeaders, long storedAtMillis) {
        final Map<String, String> resCacheControl =
                HttpHeaderUtil.directives(resHeaders, HttpHeaderNames.CACHE_CONTROL);
        final Map<String, String> reqCacheControl =
                HttpHeaderUtil.directives(reqHeaders, HttpHeaderNames.CACHE_CONTROL);
        if (reqCacheControl.containsKey("no-cache")) {
            return Freshness.TRANSPARENT;
        }
        if (resCacheControl.containsKey("no-cache")) {
            return Freshness.STALE;
        }
        if (reqCacheControl.containsKey("only-if-cached")) {
            return Freshness.FRESH;
        }

        final long dateMillis = dateMillis(resHeaders, storedAtMillis);
        long currentAgeMillis = clock.millis() - dateMillis;
        long lifetimeMillis = 0;
        if (resCacheControl.containsKey("max-age")) {
            lifetimeMillis = secondsToMillis(resCacheControl.get("max-age"), 0);
        } else {
            final String expires = resHeaders.get(HttpHeaderNames.EXPIRES);
            if (expires != null) {
                final Instant expiresAt = HttpHeaderUtil.parseHttpDate(expires);
                lifetimeMillis = expiresAt != null ? expiresAt.toEpochMilli() - dateMillis : 0;
            }
        }

        if (reqCacheControl.containsKey("max-age")) {
            lifetimeMillis = secondsToMillis(reqCacheControl.get("max-age"), 0);
        }
        if (reqCacheControl.containsKey("min-fresh")) {
            currentAgeMillis += secondsToMillis(reqCacheControl.get("min-fresh"), 0);
        }
        if (reqCacheControl.containsKey("max-stale")) {
            final String maxStale = reqCacheControl.get("max-stale");
            if (Strings.isNullOrEmpty(maxStale)) {
                return Freshness.FRESH;
            }
            currentAgeMillis -= secondsToMillis(maxStale, 0);
        }

        return lifetimeMillis > currentAgeMillis ? Freshness.FRESH : Freshness.STALE;
    }

    /**
     * Returns whether a stored response may be served when revalidating it failed, according to the
     * {@code stale-if-error} directive of the response or the request.
     */
    boolean canStaleOnError(HttpHeaders resHeaders, HttpHeaders reqHeaders) {
        long lifetimeMillis = -1;
        for (HttpHeaders headers : new HttpHeaders[] { resHeaders, reqHeaders }) {
            final Map<String, String> cacheControl =
                    HttpHeaderUtil.directives(headers, HttpHeaderNames.CACHE_CONTROL);
            if (cacheControl.containsKey("stale-if-error")) {
                final String value = cacheControl.get("stale-if-error");
                if (Strings.isNullOrEmpty(value)) {
                    return true;
                }
                lifetimeMillis = secondsToMillis(value, -1);
                if (lifetimeMillis < 0) {
                    return false;
                }
            }
        }
        if (lifetimeMillis < 0) {
            return false;
        }
        final Instant date = HttpHeaderUtil.parseHttpDate(resHeaders.get(HttpHeaderNames.DATE));
        if (date == null) {
            return false;
        }
        return lifetimeMillis > clock.millis() - date.toEpochMilli();
    }

    private static boolean canStore(HttpHeaders reqHeaders, HttpHeaders resHeaders) {
        return !HttpHeaderUtil.directives(reqHeaders, HttpHeaderNames.CACHE_CONTROL).containsKey("no-store") &&
               !HttpHeaderUtil.directives(resHeaders, HttpHeaderNames.CACHE_CONTROL).containsKey("no-store");
    }

    private static long dateMillis(HttpHeaders resHeaders, long storedAtMillis) {
        final Instant date = HttpHeaderUtil.parseHttpDate(resHeaders.get(HttpHeaderNames.DATE));
        return date != null ? date.toEpochMilli() : storedAtMillis;
    }

    private static long secondsToMillis(@Nullable String seconds, long defaultValue) {
        if (seconds == null) {
            return defaultValue;
        }
        try {
            final long value = Long.parseLong(seconds.trim());
            return value >= 0 ? value * 1000 : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @FunctionalInterface
    private interface ContentConsumer {
        void accept(byte[] content);
    }

    /**
     * Copies what the caller reads and passes the copy to a {@link ContentConsumer} at the end of the
     * stream. Nothing is passed when the stream is closed before the end.
     */
    private static final class CachingInputStream extends FilterInputStream {

        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        private final ContentConsumer onEof;
        private boolean done;

        CachingInputStream(InputStream in, ContentConsumer onEof) {
            super(in);
            this.onEof = onEof;
        }

        @Override
        public int read() throws IOException {
            final int b = super.read();
            if (b < 0) {
                complete();
            } else if (!done) {
                buf.write(b);
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            final int n = super.read(b, off, len);
            if (n < 0) {
                complete();
            } else if (!done) {
                buf.write(b, off, n);
            }
            return n;
        }

        @Override
        public long skip(long n) throws IOException {
            // Skipped bytes have to be copied as well.
            final byte[] skipped = new byte[(int) Math.min(n, 8192)];
            final int read = read(skipped, 0, skipped.length);
            return Math.max(read, 0);
        }

        @Override
        public boolean markSupported() {
            return false;
        }

        private void complete() {
            if (!done) {
                done = true;
                onEof.accept(buf.toByteArray());
            }
        }
    }
}
