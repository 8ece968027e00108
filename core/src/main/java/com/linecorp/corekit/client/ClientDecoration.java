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

import java.util.List;
import java.util.function.Function;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * An ordered list of {@link Function}s that transforms an {@link HttpClient} into another.
 *
 * <p>The first decorator is the outermost one. Given the decorators {@code [d1, d2, d3]},
 * {@link #decorate(HttpClient)} returns {@code d1(d2(d3(client)))}, so {@code d1} sees a request first
 * and its response last. A {@link ClientDecoration} is immutable and knows nothing about what its
 * decorators do, so the same instance can decorate any number of clients.
 */
public final class ClientDecoration {

    private static final ClientDecoration NONE = new ClientDecoration(ImmutableList.of());

    /**
     * Returns an empty {@link ClientDecoration} which does not decorate an {@link HttpClient}.
     */
    public static ClientDecoration of() {
        return NONE;
    }

    /**
     * Creates a new instance from a single decorator {@link Function}.
     *
     * @param decorator the {@link Function} that transforms an {@link HttpClient} to another
     */
    public static ClientDecoration of(Function<? super HttpClient, ? extends HttpClient> decorator) {
        return builder().add(decorator).build();
    }

    /**
     * Creates a new instance from the specified decorators, the first being the outermost.
     */
    @SafeVarargs
    public static ClientDecoration of(Function<? super HttpClient, ? extends HttpClient>... decorators) {
        final ClientDecorationBuilder builder = builder();
        for (Function<? super HttpClient, ? extends HttpClient> decorator : decorators) {
            builder.add(decorator);
        }
        return builder.build();
    }

    /**
     * Returns a newly created {@link ClientDecorationBuilder}.
     */
    public static ClientDecorationBuilder builder() {
        return new ClientDecorationBuilder();
    }

    private final ImmutableList<Function<? super HttpClient, ? extends HttpClient>> decorators;

    ClientDecoration(List<Function<? super HttpClient, ? extends HttpClient>> decorators) {
        this.decorators = ImmutableList.copyOf(decorators);
    }

    /**
     * Returns the decorators, the first being the outermost.
     */
    public List<Function<? super HttpClient, ? extends HttpClient>> decorators() {
        return decorators;
    }

    public boolean isEmpty() {
        return decorators.isEmpty();
    }

    /**
     * Decorates the specified {@link HttpClient} using the decorators. Returns the specified
     * {@link HttpClient} as it is if this decoration is empty.
     *
     * @param client the {@link HttpClient} being decorated
     */
    public HttpClient decorate(HttpClient client) {
        for (Function<? super HttpClient, ? extends HttpClient> decorator : decorators.reverse()) {
            client = decorator.apply(client);
        }
        return client;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("decorators", decorators).toString();
    }
}
