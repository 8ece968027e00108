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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.function.Function;

import com.linecorp.corekit.common.HttpHeaderNames;
import com.linecorp.corekit.common.HttpRequest;
import com.linecorp.corekit.common.HttpResponse;

/**
 * An {@link HttpClient} decorator which sets the {@code user-agent} header of a request which has none.
 */
public final class UserAgentClient extends SimpleDecoratingHttpClient {

    private static final String VERSION_PROPERTIES = "/com/linecorp/corekit/core/version.properties";

    /**
     * The {@code user-agent} set by {@link #newDecorator()}, e.g. {@code corekit-java/1.0.0}.
     */
    public static final String DEFAULT_USER_AGENT = "corekit-java/" + loadVersion();

    private static String loadVersion() {
        try (InputStream in = UserAgentClient.class.getResourceAsStream(VERSION_PROPERTIES)) {
            if (in == null) {
                return "unknown";
            }
            final Properties props = new Properties();
            props.load(in);
            return props.getProperty("version", "unknown");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Creates a new {@link UserAgentClient} decorator which sets {@link #DEFAULT_USER_AGENT}.
     */
    public static Function<? super HttpClient, UserAgentClient> newDecorator() {
        return newDecorator(DEFAULT_USER_AGENT);
    }

    /**
     * Creates a new {@link UserAgentClient} decorator which sets the specified {@code user-agent}.
     */
    public static Function<? super HttpClient, UserAgentClient> newDecorator(String userAgent) {
        requireNonNull(userAgent, "userAgent");
        return delegate -> new UserAgentClient(delegate, userAgent);
    }

    private final String userAgent;

    UserAgentClient(HttpClient delegate, String userAgent) {
        super(delegate);
        this.userAgent = userAgent;
    }

    @Override
    public HttpResponse execute(ClientRequestContext ctx, HttpRequest req) throws Exception {
        if (!req.headers().contains(HttpHeaderNames.USER_AGENT)) {
            req = req.withHeaders(req.headers().toBuilder()
                                     .set(HttpHeaderNames.USER_AGENT, userAgent)
                                     .build());
        }
        return unwrap().execute(ctx, req);
    }
}
