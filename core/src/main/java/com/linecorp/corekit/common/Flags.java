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

import java.util.function.LongPredicate;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ascii;

/**
 * The system properties that affect the client behavior of this library.
 */
public final class Flags {

    private static final Logger logger = LoggerFactory.getLogger(Flags.class);

    private static final String PREFIX = "com.linecorp.corekit.";

    static final long DEFAULT_TIMEOUT_MILLIS = 3000;
    private static final long TIMEOUT_MILLIS =
            getLong("defaultTimeoutMillis", DEFAULT_TIMEOUT_MILLIS, value -> value >= 0);

    static final long DEFAULT_DIAL_TIMEOUT_MILLIS = 300;
    private static final long DIAL_TIMEOUT_MILLIS =
            getLong("defaultDialTimeoutMillis", DEFAULT_DIAL_TIMEOUT_MILLIS, value -> value > 0);

    static final long DEFAULT_IDLE_CONNECTION_TIMEOUT_MILLIS = 90_000;
    private static final long IDLE_CONNECTION_TIMEOUT_MILLIS =
            getLong("defaultIdleConnectionTimeoutMillis", DEFAULT_IDLE_CONNECTION_TIMEOUT_MILLIS,
                    value -> value > 0);

    static final int DEFAULT_MAX_IDLE_CONNECTIONS = 500;
    private static final int MAX_IDLE_CONNECTIONS =
            getInt("defaultMaxIdleConnections", DEFAULT_MAX_IDLE_CONNECTIONS, value -> value >= 0);

    static final long DEFAULT_LOCAL_CACHE_SIZE_MEGABYTES = 500;
    private static final long LOCAL_CACHE_SIZE_MEGABYTES =
            getLong("defaultLocalCacheSizeMegabytes", DEFAULT_LOCAL_CACHE_SIZE_MEGABYTES, value -> value > 0);

    static final int DEFAULT_DRAIN_LIMIT_BYTES = 4096;
    private static final int DRAIN_LIMIT_BYTES =
            getInt("defaultDrainLimitBytes", DEFAULT_DRAIN_LIMIT_BYTES, value -> value >= 0);

    /**
     * Returns the default timeout of a single request in milliseconds. {@code 0} disables the timeout.
     *
     * <p>The default value of this flag is {@value #DEFAULT_TIMEOUT_MILLIS}. Specify the
     * {@code -Dcom.linecorp.corekit.defaultTimeoutMillis=<long>} JVM option to override the default value.
     */
    public static long defaultTimeoutMillis() {
        return TIMEOUT_MILLIS;
    }

    /**
     * Returns the default timeout of a socket connection attempt in milliseconds.
     *
     * <p>The default value of this flag is {@value #DEFAULT_DIAL_TIMEOUT_MILLIS}. Specify the
     * {@code -Dcom.linecorp.corekit.defaultDialTimeoutMillis=<long>} JVM option to override the default
     * value.
     */
    public static long defaultDialTimeoutMillis() {
        return DIAL_TIMEOUT_MILLIS;
    }

    /**
     * Returns the default time in milliseconds an idle pooled connection is kept open.
     *
     * <p>The default value of this flag is {@value #DEFAULT_IDLE_CONNECTION_TIMEOUT_MILLIS}. Specify the
     * {@code -Dcom.linecorp.corekit.defaultIdleConnectionTimeoutMillis=<long>} JVM option to override
     * the default value.
     */
    public static long defaultIdleConnectionTimeoutMillis() {
        return IDLE_CONNECTION_TIMEOUT_MILLIS;
    }

    /**
     * Returns the default maximum number of idle connections kept in a connection pool.
     *
     * <p>The default value of this flag is {@value #DEFAULT_MAX_IDLE_CONNECTIONS}. Specify the
     * {@code -Dcom.linecorp.corekit.defaultMaxIdleConnections=<integer>} JVM option to override
     * the default value.
     */
    public static int defaultMaxIdleConnections() {
        return MAX_IDLE_CONNECTIONS;
    }

    /**
     * Returns the capacity of the shared local response cache in megabytes.
     *
     * <p>The default value of this flag is {@value #DEFAULT_LOCAL_CACHE_SIZE_MEGABYTES}. Specify the
     * {@code -Dcom.linecorp.corekit.defaultLocalCacheSizeMegabytes=<long>} JVM option to override
     * the default value.
     */
    public static long defaultLocalCacheSizeMegabytes() {
        return LOCAL_CACHE_SIZE_MEGABYTES;
    }

    /**
     * Returns the maximum number of bytes read from the body of a response that is discarded before
     * a retry, so that its connection can return to the pool.
     *
     * <p>The default value of this flag is {@value #DEFAULT_DRAIN_LIMIT_BYTES}. Specify the
     * {@code -Dcom.linecorp.corekit.defaultDrainLimitBytes=<integer>} JVM option to override
     * the default value.
     */
    public static int defaultDrainLimitBytes() {
        return DRAIN_LIMIT_BYTES;
    }

    private static long getLong(String name, long defaultValue, LongPredicate validator) {
        return Long.parseLong(getNormalized(name, String.valueOf(defaultValue), value -> {
            try {
                return validator.test(Long.parseLong(value));
            } catch (Exception e) {
                // Not a number.
                return false;
            }
        }));
    }

    private static int getInt(String name, int defaultValue, LongPredicate validator) {
        return Math.toIntExact(getLong(name, defaultValue,
                                       value -> value <= Integer.MAX_VALUE && validator.test(value)));
    }

    private static String getNormalized(String name, String defaultValue, Predicate<String> validator) {
        final String fullName = PREFIX + name;
        String value = System.getProperty(fullName);
        if (value != null) {
            value = Ascii.toLowerCase(value.trim());
        }

        if (value != null) {
            if (validator.test(value)) {
                logger.info("{}: {} (sysprops)", name, value);
                return value;
            }
            logger.warn("{}: {} (sysprops, validation failed)", name, value);
        }
        logger.info("{}: {} (default)", name, defaultValue);
        return defaultValue;
    }

    private Flags() {}
}
