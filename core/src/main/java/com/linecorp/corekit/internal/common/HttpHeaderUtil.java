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
package com.linecorp.corekit.internal.common;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.linecorp.corekit.common.HttpHeaders;
import com.linecorp.corekit.common.annotation.Nullable;

/**
 * Utilities for parsing HTTP header values.
 */
public final class HttpHeaderUtil {

    private static final Splitter COMMA_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    /**
     * Parses the specified HTTP header directives and invokes the specified {@code callback}
     * with the lower-cased directive names and values. A directive without a value yields {@code null}.
     */
    public static void parseDirectives(String directives, BiConsumer<String, String> callback) {
        final int len = directives.length();
        for (int i = 0; i < len;) {
            final int nameStart = i;
            final String name;
            final String value;

            // Find the name.
            for (; i < len; i++) {
                final char ch = directives.charAt(i);
                if (ch == ',' || ch == '=') {
                    break;
                }
            }
            name = directives.substring(nameStart, i).trim();

            // Find the value.
            if (i == len || directives.charAt(i) == ',') {
                // Skip comma or go beyond 'len' to break the loop.
                i++;
                value = null;
            } else {
                // Skip '='.
                i++;

                // Skip whitespaces.
                for (; i < len; i++) {
                    final char ch = directives.charAt(i);
                    if (ch != ' ' && ch != '\t') {
                        break;
                    }
                }

                if (i < len && directives.charAt(i) == '\"') {
                    // Skip the opening quote.
                    i++;
                    final int valueStart = i;

                    // Find the closing quote.
                    for (; i < len; i++) {
                        if (directives.charAt(i) == '\"') {
                            break;
                        }
                    }
                    value = directives.substring(valueStart, i);

                    // Skip the closing quote.
                    i++;

                    // Find the comma and skip it.
                    for (; i < len; i++) {
                        if (directives.charAt(i) == ',') {
                            i++;
                            break;
                        }
                    }
                } else {
                    final int valueStart = i;

                    // Find the comma.
                    for (; i < len; i++) {
                        if (directives.charAt(i) == ',') {
                            break;
                        }
                    }
                    value = directives.substring(valueStart, i).trim();

                    // Skip the comma.
                    i++;
                }
            }

            if (!name.isEmpty()) {
                callback.accept(Ascii.toLowerCase(name), Strings.emptyToNull(value));
            }
        }
    }

    /**
     * Returns the directives of all {@code name} headers as a map from a lower-cased directive name to its
     * value. A directive without a value is mapped to an empty string.
     */
    public static Map<String, String> directives(HttpHeaders headers, String name) {
        final Map<String, String> result = new LinkedHashMap<>();
        for (String value : headers.getAll(name)) {
            parseDirectives(value, (directive, directiveValue) -> {
                result.putIfAbsent(directive, Strings.nullToEmpty(directiveValue));
            });
        }
        return ImmutableMap.copyOf(result);
    }

    /**
     * Returns the comma-separated values of all {@code name} headers.
     */
    public static List<String> commaSeparatedValues(HttpHeaders headers, String name) {
        final ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (String value : headers.getAll(name)) {
            builder.addAll(COMMA_SPLITTER.split(value));
        }
        return builder.build();
    }

    /**
     * Parses an HTTP date such as {@code Sun, 06 Nov 1994 08:49:37 GMT}.
     *
     * @return the parsed {@link Instant}, or {@code null} if the value is not a valid HTTP date
     */
    @Nullable
    public static Instant parseHttpDate(@Nullable String value) {
        if (value == null) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeException e) {
            return null;
        }
    }

    /**
     * Formats the specified {@link Instant} as an HTTP date.
     */
    public static String formatHttpDate(Instant instant) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(instant.atZone(ZoneOffset.UTC));
    }

    private HttpHeaderUtil() {}
}
