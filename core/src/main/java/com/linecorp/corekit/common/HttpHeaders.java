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

import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;

import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableListMultimap;

import com.linecorp.corekit.common.annotation.Nullable;

/**
 * Immutable HTTP headers. Header names are case-insensitive and always stored in lower case.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(ImmutableListMultimap.of());

    /**
     * Returns an empty {@link HttpHeaders}.
     */
    public static HttpHeaders of() {
        return EMPTY;
    }

    /**
     * Returns a new {@link HttpHeaders} with the specified header.
     */
    public static HttpHeaders of(String name, String value) {
        return builder().add(name, value).build();
    }

    /**
     * Returns a new {@link HttpHeaders} with the specified headers.
     */
    public static HttpHeaders of(String name1, String value1, String name2, String value2) {
        return builder().add(name1, value1).add(name2, value2).build();
    }

    /**
     * Returns a newly created {@link HttpHeadersBuilder}.
     */
    public static HttpHeadersBuilder builder() {
        return new HttpHeadersBuilder();
    }

    static String normalizeName(String name) {
        requireNonNull(name, "name");
        return Ascii.toLowerCase(name.trim());
    }

    private final ImmutableListMultimap<String, String> entries;

    HttpHeaders(ImmutableListMultimap<String, String> entries) {
        this.entries = entries;
    }

    /**
     * Returns the first value of the header with the specified {@code name}, or {@code null} if there
     * is no such header.
     */
    @Nullable
    public String get(String name) {
        final List<String> values = entries.get(normalizeName(name));
        return values.isEmpty() ? null : values.get(0);
    }

    /**
     * Returns the first value of the header with the specified {@code name}, or {@code defaultValue}
     * if there is no such header.
     */
    public String get(String name, String defaultValue) {
        final String value = get(name);
        return value != null ? value : defaultValue;
    }

    /**
     * Returns all values of the header with the specified {@code name}.
     */
    public List<String> getAll(String name) {
        return entries.get(normalizeName(name));
    }

    /**
     * Returns whether a header with the specified {@code name} exists.
     */
    public boolean contains(String name) {
        return entries.containsKey(normalizeName(name));
    }

    /**
     * Returns the lower-cased names of all headers.
     */
    public Set<String> names() {
        return entries.keySet();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns the number of header entries. A header with two values counts twice.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Invokes the specified {@link BiConsumer} for every header entry in insertion order.
     */
    public void forEach(BiConsumer<String, String> action) {
        requireNonNull(action, "action");
        entries.forEach(action);
    }

    /**
     * Returns a {@link HttpHeadersBuilder} initialized with the headers of this instance.
     */
    public HttpHeadersBuilder toBuilder() {
        return new HttpHeadersBuilder(this);
    }

    ImmutableListMultimap<String, String> entries() {
        return entries;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HttpHeaders)) {
            return false;
        }
        return entries.equals(((HttpHeaders) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).addValue(entries).toString();
    }
}
