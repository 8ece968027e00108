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
package com.linecorp.corekit.common;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.LinkedListMultimap;

/**
 * Builds a new {@link HttpHeaders}.
 */
public final class HttpHeadersBuilder {

    private final LinkedListMultimap<String, String> entries;

    HttpHeadersBuilder() {
        entries = LinkedListMultimap.create();
    }

    HttpHeadersBuilder(HttpHeaders headers) {
        entries = LinkedListMultimap.create(headers.entries());
    }

    /**
     * Adds a new header value, keeping the existing values of the same name.
     */
    public HttpHeadersBuilder add(String name, String value) {
        requireNonNull(value, "value");
        entries.put(HttpHeaders.normalizeName(name), value);
        return this;
    }

    /**
     * Adds all headers of the specified {@link HttpHeaders}.
     */
    public HttpHeadersBuilder add(HttpHeaders headers) {
        requireNonNull(headers, "headers");
        entries.putAll(headers.entries());
        return this;
    }

    /**
     * Sets a header, replacing all existing values of the same name.
     */
    public HttpHeadersBuilder set(String name, String value) {
        requireNonNull(value, "value");
        final String normalized = HttpHeaders.normalizeName(name);
        entries.removeAll(normalized);
        entries.put(normalized, value);
        return this;
    }

    /**
     * Sets a header only when no header of the same name exists.
     */
    public HttpHeadersBuilder setIfAbsent(String name, String value) {
        requireNonNull(value, "value");
        final String normalized = HttpHeaders.normalizeName(name);
        if (!entries.containsKey(normalized)) {
            entries.put(normalized, value);
        }
        return this;
    }

    /**
     * Removes all values of the header with the specified {@code name}.
     */
    public HttpHeadersBuilder remove(String name) {
        entries.removeAll(HttpHeaders.normalizeName(name));
        return this;
    }

    public boolean contains(String name) {
        return entries.containsKey(HttpHeaders.normalizeName(name));
    }

    /**
     * Returns a newly created {@link HttpHeaders} with the entries set so far.
     */
    public HttpHeaders build() {
        if (entries.isEmpty()) {
            return HttpHeaders.of();
        }
        return new HttpHeaders(ImmutableListMultimap.copyOf(entries));
    }
}
