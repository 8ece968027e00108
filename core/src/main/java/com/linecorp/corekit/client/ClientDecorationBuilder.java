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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Creates a new {@link ClientDecoration} using the builder pattern. A decorator added earlier wraps
 * the decorators added later.
 */
public final class ClientDecorationBuilder {

    private final List<Function<? super HttpClient, ? extends HttpClient>> decorators = new ArrayList<>();

    ClientDecorationBuilder() {}

    /**
     * Appends the specified decorator, which becomes the innermost one so far.
     *
     * @param decorator the {@link Function} that transforms an {@link HttpClient} to another
     */
    public ClientDecorationBuilder add(Function<? super HttpClient, ? extends HttpClient> decorator) {
        decorators.add(requireNonNull(decorator, "decorator"));
        return this;
    }

    /**
     * Appends all decorators of the specified {@link ClientDecoration}.
     */
    public ClientDecorationBuilder add(ClientDecoration decoration) {
        requireNonNull(decoration, "decoration");
        decorators.addAll(decoration.decorators());
        return this;
    }

    /**
     * Returns a newly-created {@link ClientDecoration} based on the decorators added to this builder.
     */
    public ClientDecoration build() {
        if (decorators.isEmpty()) {
            return ClientDecoration.of();
        }
        return new ClientDecoration(decorators);
    }
}
