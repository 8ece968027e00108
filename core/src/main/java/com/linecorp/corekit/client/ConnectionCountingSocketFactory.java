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
import java.net.Socket;
import java.net.SocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.net.SocketFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.corekit.common.annotation.Nullable;

/**
 * A {@link SocketFactory} whose sockets notify a {@link ConnectionPoolListener} when they are connected
 * and closed. A socket whose connection attempt failed is never reported, and a socket is reported as
 * closed at most once no matter how many times it is closed.
 */
final class ConnectionCountingSocketFactory extends SocketFactory {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionCountingSocketFactory.class);

    static String key(InetSocketAddress remoteAddr) {
        return "tcp:" + remoteAddr.getHostString() + ':' + remoteAddr.getPort();
    }

    private final ConnectionPoolListener listener;

    ConnectionCountingSocketFactory(ConnectionPoolListener listener) {
        this.listener = listener;
    }

    @Override
    public Socket createSocket() {
        return new CountingSocket();
    }

    @Override
    public Socket createSocket(String host, int port) throws IOException {
        return connect(new CountingSocket(), new InetSocketAddress(host, port), null);
    }

    @Override
    public Socket createSocket(String host, int port, InetAddress localHost, int localPort)
            throws IOException {
        return connect(new CountingSocket(), new InetSocketAddress(host, port),
                       new InetSocketAddress(localHost, localPort));
    }

    @Override
    public Socket createSocket(InetAddress host, int port) throws IOException {
        return connect(new CountingSocket(), new InetSocketAddress(host, port), null);
    }

    @Override
    public Socket createSocket(InetAddress address, int port, InetAddress localAddress, int localPort)
            throws IOException {
        return connect(new CountingSocket(), new InetSocketAddress(address, port),
                       new InetSocketAddress(localAddress, localPort));
    }

    private static Socket connect(Socket socket, InetSocketAddress remoteAddr,
                                  @Nullable InetSocketAddress localAddr) throws IOException {
        try {
            if (localAddr != null) {
                socket.bind(localAddr);
            }
            socket.connect(remoteAddr);
            return socket;
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    private final class CountingSocket extends Socket {

        private final AtomicBoolean opened = new AtomicBoolean();
        private final AtomicBoolean closed = new AtomicBoolean();
        @Nullable
        private volatile InetSocketAddress remoteAddr;

        @Override
        public void connect(SocketAddress endpoint, int timeout) throws IOException {
            super.connect(endpoint, timeout);
            if (!(endpoint instanceof InetSocketAddress)) {
                return;
            }
            final InetSocketAddress remoteAddr = (InetSocketAddress) endpoint;
            this.remoteAddr = remoteAddr;
            if (opened.compareAndSet(false, true)) {
                try {
                    listener.connectionOpen(key(remoteAddr), remoteAddr);
                } catch (Exception e) {
                    logger.warn("An exception occurred while notifying a connection open event: {}",
                                remoteAddr, e);
                }
            }
        }

        @Override
        public synchronized void close() throws IOException {
            try {
                super.close();
            } finally {
                final InetSocketAddress remoteAddr = this.remoteAddr;
                if (remoteAddr != null && opened.get() && closed.compareAndSet(false, true)) {
                    try {
                        listener.connectionClosed(key(remoteAddr), remoteAddr);
                    } catch (Exception e) {
                        logger.warn("An exception occurred while notifying a connection closed event: {}",
                                    remoteAddr, e);
                    }
                }
            }
        }
    }
}
