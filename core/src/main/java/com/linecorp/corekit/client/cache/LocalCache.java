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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.base.MoreObjects;

import com.linecorp.corekit.common.Flags;
import com.linecorp.corekit.common.annotation.Nullable;

/**
 * An in-memory {@link Cache} bounded by the total size of its entries. An entry expires one hour after
 * it was written.
 *
 * <p>A short-lived {@link LocalCache} should be {@linkplain #close() closed} when it is not used anymore.
 */
public final class LocalCache implements Cache, AutoCloseable {

    // The approximate per-entry overhead of the cache itself.
    static final int ENTRY_OVERHEAD_BYTES = 350;

    private static final Duration EXPIRY = Duration.ofHours(1);

    /**
     * Returns the process-wide {@link LocalCache} whose size is
     * {@link Flags#defaultLocalCacheSizeMegabytes()}. It is created on first use and never closed.
     */
    public static LocalCache shared() {
        return SharedHolder.INSTANCE;
    }

    /**
     * Returns a new {@link LocalCache} which keeps its total size below the specified megabytes.
     */
    public static LocalCache ofMegabytes(long maxSizeMegabytes) {
        checkArgument(maxSizeMegabytes > 0, "maxSizeMegabytes: %s (expected: > 0)", maxSizeMegabytes);
        return new LocalCache(maxSizeMegabytes * 1024 * 1024);
    }

    private final long maxWeightBytes;
    private final com.github.benmanes.caffeine.cache.Cache<String, byte[]> cache;

    LocalCache(long maxWeightBytes) {
        this.maxWeightBytes = maxWeightBytes;
        cache = Caffeine.newBuilder()
                        .maximumWeight(maxWeightBytes)
                        .<String, byte[]>weigher((key, value) -> value.length + ENTRY_OVERHEAD_BYTES)
                        .expireAfterWrite(EXPIRY)
                        .build();
    }

    @Nullable
    @Override
    public byte[] get(String key) {
        requireNonNull(key, "key");
        return cache.getIfPresent(key);
    }

    @Override
    public void set(String key, byte[] value) {
        requireNonNull(key, "key");
        requireNonNull(value, "value");
        cache.put(key, value);
    }

    @Override
    public void delete(String key) {
        requireNonNull(key, "key");
        cache.invalidate(key);
    }

    /**
     * Returns the approximate number of entries.
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Removes all entries.
     */
    @Override
    public void close() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("maxWeightBytes", maxWeightBytes)
                          .add("size", cache.estimatedSize())
                          .toString();
    }

    private static final class SharedHolder {
        static final LocalCache INSTANCE = ofMegabytes(Flags.defaultLocalCacheSizeMegabytes());
    }
}
