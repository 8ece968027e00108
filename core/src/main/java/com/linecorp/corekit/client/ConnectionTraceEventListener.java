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

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.util.List;

import com.linecorp.corekit.common.annotation.Nullable;

import okhttp3.Call;
import okhttp3.Connection;
import okhttp3.EventListener;
import okhttp3.Handshake;
import okhttp3.Protocol;
import okhttp3.Request;

/**
 * Translates the OkHttp {@link EventListener} events of a {@link Call} into the
 * {@link ClientConnectionTrace} of its {@link ClientRequestContext}.
 */
final class ConnectionTraceEventListener extends EventListener {

    static final EventListener.Factory FACTORY = call -> {
        final ClientRequestContext ctx = call.request().tag(ClientRequestContext.class);
        if (ctx == null) {
            return EventListener.NONE;
        }
        final ClientConnectionTrace trace = ctx.clientTrace();
        if (trace == ClientConnectionTrace.noop()) {
            return EventListener.NONE;
        }
        return new ConnectionTraceEventListener(trace);
    };

    private final ClientConnectionTrace trace;

    // Accessed only by the thread executing the call.
    private boolean dnsInProgress;
    private boolean tlsInProgress;
    private boolean connected;
    private boolean hasBody;

    private ConnectionTraceEventListener(ClientConnectionTrace trace) {
        this.trace = trace;
    }

    @Override
    public void dnsStart(Call call, String domainName) {
        dnsInProgress = true;
        trace.dnsStart(domainName);
    }

    @Override
    public void dnsEnd(Call call, String domainName, List<InetAddress> inetAddressList) {
        dnsInProgress = false;
        trace.dnsDone(null);
    }

    @Override
    public void connectStart(Call call, InetSocketAddress inetSocketAddress, Proxy proxy) {
        connected = true;
        trace.connectStart(inetSocketAddress);
    }

    @Override
    public void secureConnectStart(Call call) {
        tlsInProgress = true;
        trace.tlsHandshakeStart();
    }

    @Override
    public void secureConnectEnd(Call call, @Nullable Handshake handshake) {
        tlsInProgress = false;
        trace.tlsHandshakeDone(null);
    }

    @Override
    public void connectEnd(Call call, InetSocketAddress inetSocketAddress, Proxy proxy,
                           @Nullable Protocol protocol) {
        trace.connectDone(inetSocketAddress, null);
    }

    @Override
    public void connectFailed(Call call, InetSocketAddress inetSocketAddress, Proxy proxy,
                              @Nullable Protocol protocol, IOException ioe) {
        if (tlsInProgress) {
            tlsInProgress = false;
            trace.tlsHandshakeDone(ioe);
        }
        trace.connectDone(inetSocketAddress, ioe);
    }

    @Override
    public void connectionAcquired(Call call, Connection connection) {
        // A connection acquired without connecting was taken from the pool.
        final boolean reused = !connected;
        trace.gotConnection(reused, reused);
    }

    @Override
    public void requestHeadersEnd(Call call, Request request) {
        hasBody = request.body() != null;
        if (!hasBody) {
            trace.wroteRequest(null);
        }
    }

    @Override
    public void requestBodyEnd(Call call, long byteCount) {
        if (hasBody) {
            trace.wroteRequest(null);
        }
    }

    @Override
    public void requestFailed(Call call, IOException ioe) {
        trace.wroteRequest(ioe);
    }

    @Override
    public void responseHeadersStart(Call call) {
        trace.gotFirstResponseByte();
    }

    @Override
    public void callFailed(Call call, IOException ioe) {
        if (dnsInProgress) {
            dnsInProgress = false;
            trace.dnsDone(ioe);
        }
    }
}
