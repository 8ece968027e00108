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

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.linecorp.corekit.common.HttpHeaders;
import com.linecorp.corekit.common.HttpHeadersBuilder;
import com.linecorp.corekit.common.HttpResponse;
import com.linecorp.corekit.common.annotation.Nullable;

/**
 * A response stored in a {@link Cache}, serialized as JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class CachedResponse {

    private static final ObjectMapper mapper = new ObjectMapper();

    static CachedResponse deserialize(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, CachedResponse.class);
    }

    static CachedResponse of(HttpResponse res, byte[] content, Map<String, String> variedHeaders,
                             long storedAtMillis) {
        final Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : res.headers().names()) {
            headers.put(name, res.headers().getAll(name));
        }
        return new CachedResponse(res.status(), headers, content, variedHeaders, storedAtMillis);
    }

    private final int status;
    private final Map<String, List<String>> headers;
    private final byte[] content;
    private final Map<String, String> variedHeaders;
    private final long storedAtMillis;

    @JsonCreator
    CachedResponse(@JsonProperty("status") int status,
                   @JsonProperty("headers") @Nullable Map<String, List<String>> headers,
                   @JsonProperty("content") @Nullable byte[] content,
                   @JsonProperty("variedHeaders") @Nullable Map<String, String> variedHeaders,
                   @JsonProperty("storedAtMillis") long storedAtMillis) {
        this.status = status;
        this.headers = headers != null ? ImmutableMap.copyOf(headers) : ImmutableMap.of();
        this.content = content != null ? content : new byte[0];
        this.variedHeaders = variedHeaders != null ? ImmutableMap.copyOf(variedHeaders) : ImmutableMap.of();
        this.storedAtMillis = storedAtMillis;
    }

    @JsonProperty
    int status() {
        return status;
    }

    @JsonProperty
    Map<String, List<String>> headers() {
        return headers;
    }

    @JsonProperty
    byte[] content() {
        return content;
    }

    /**
     * Returns the values of the request headers named by the {@code vary} header of the response,
     * keyed by the lower-cased header name.
     */
    @JsonProperty
    Map<String, String> variedHeaders() {
        return variedHeaders;
    }

    /**
     * Returns when this response was stored, in milliseconds since the epoch.
     */
    @JsonProperty
    long storedAtMillis() {
        return storedAtMillis;
    }

    HttpHeaders httpHeaders() {
        final HttpHeadersBuilder builder = HttpHeaders.builder();
        headers.forEach((name, values) -> values.forEach(value -> builder.add(name, value)));
        return builder.build();
    }

    /**
     * Returns a copy of this entry whose headers are replaced with the specified ones, stored at the
     * specified time.
     */
    CachedResponse withHeaders(HttpHeaders newHeaders, long storedAtMillis) {
        requireNonNull(newHeaders, "newHeaders");
        final Map<String, List<String>> map = new LinkedHashMap<>();
        for (String name : newHeaders.names()) {
            map.put(name, ImmutableList.copyOf(newHeaders.getAll(name)));
        }
        return new CachedResponse(status, map, content, variedHeaders, storedAtMillis);
    }

    HttpResponse toResponse(HttpHeaders headers) {
        return HttpResponse.of(status, headers, content);
    }

    byte[] serialize() throws IOException {
        return mapper.writeValueAsBytes(this);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("status", status)
                          .add("headers", headers)
                          .add("contentLength", content.length)
                          .add("storedAtMillis", storedAtMillis)
                          .toString();
    }
}
