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

import com.linecorp.corekit.common.annotation.Nullable;

/**
 * A key-value store of serialized responses used by a {@link CachingClient}. The store decides its own
 * eviction policy. An implementation must be safe for concurrent use; the last write of a key wins.
 */
public interface Cache {

    /**
     * Returns the bytes stored for the specified key, or {@code null} if there is no entry.
     */
    @Nullable
    byte[] get(String key);

    /**
     * Stores the specified bytes for the specified key.
     */
    void set(String key, byte[] value);

    /**
     * Removes the entry of the specified key, if any.
     */
    void delete(String key);
}
