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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.base.MoreObjects;
import com.google.common.io.ByteSource;
import com.google.common.io.ByteStreams;

import com.linecorp.corekit.common.annotation.Nullable;

/**
 * The body of an {@link HttpRequest}.
 *
 * <p>A {@link RequestBody} is a factory of streams rather than a stream. Every call to
 * {@link #openStream()} yields the full payload from its first byte, which is what allows a request
 * to be sent again by a retrying client. The only exception is the body created by
 * {@link #ofOneShot(InputStream)}, which can be opened only once.
 */
public abstract class RequestBody {

    /**
     * Supplies a fresh {@link InputStream} over the same payload every time it is invoked.
     */
    @FunctionalInterface
    public interface StreamSupplier {
        /**
         * Returns a new {@link InputStream} positioned at the first byte of the payload.
         */
        InputStream get() throws IOException;
    }

    private static final RequestBody EMPTY = new ByteArrayRequestBody(new byte[0]);

    /**
     * Returns the {@link RequestBody} without any content.
     */
    public static RequestBody empty() {
        return EMPTY;
    }

    /**
     * Returns a {@link RequestBody} backed by the specified byte array. The array is not copied, so
     * it must not be modified after this method returns.
     */
    public static RequestBody of(byte[] content) {
        requireNonNull(content, "content");
        if (content.length == 0) {
            return EMPTY;
        }
        return new ByteArrayRequestBody(content);
    }

    /**
     * Returns a {@link RequestBody} with the UTF-8 encoded form of the specified text.
     */
    public static RequestBody ofUtf8(CharSequence text) {
        requireNonNull(text, "text");
        return of(text.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns a {@link RequestBody} which opens a new stream from the specified {@link StreamSupplier}
     * for every attempt.
     *
     * @param contentLength the length of the payload, or {@code -1} if unknown
     */
    public static RequestBody of(StreamSupplier supplier, long contentLength) {
        requireNonNull(supplier, "supplier");
        checkArgument(contentLength >= -1, "contentLength: %s (expected: >= -1)", contentLength);
        return new SuppliedRequestBody(supplier, contentLength);
    }

    /**
     * Returns a {@link RequestBody} which reads the specified {@link InputStream} as it is. The returned
     * body can be opened only once, so a request carrying it must not be sent through a retrying
     * client.
     */
    public static RequestBody ofOneShot(InputStream in) {
        requireNonNull(in, "in");
        return new OneShotRequestBody(in);
    }

    /**
     * Converts the specified object into a replayable {@link RequestBody}:
     * <ul>
     *   <li>{@link RequestBody} is returned as it is.</li>
     *   <li>{@link StreamSupplier} is used as the stream factory. It is invoked once to learn the content
     *       length, which is known only when the supplied stream is a {@link ByteArrayInputStream}.</li>
     *   <li>{@code byte[]}, {@link CharSequence} (UTF-8), {@link ByteBuffer} (its remaining bytes) and
     *       {@link ByteSource} are replayed from memory or from their source.</li>
     *   <li>{@link Path} and {@link File} are re-opened for every attempt.</li>
     *   <li>Any other {@link InputStream} is read fully once. An empty stream yields {@link #empty()}.</li>
     *   <li>{@code null} yields {@link #empty()}.</li>
     * </ul>
     *
     * @throws IllegalArgumentException if the type of the specified object is not supported
     * @throws IOException if failed to read the specified stream or file
     */
    public static RequestBody of(@Nullable Object body) throws IOException {
        if (body == null) {
            return EMPTY;
        }
        if (body instanceof RequestBody) {
            return (RequestBody) body;
        }
        if (body instanceof StreamSupplier) {
            final StreamSupplier supplier = (StreamSupplier) body;
            long contentLength = -1;
            try (InputStream probe = supplier.get()) {
                if (probe instanceof ByteArrayInputStream) {
                    contentLength = probe.available();
                }
            }
            return new SuppliedRequestBody(supplier, contentLength);
        }
        if (body instanceof byte[]) {
            return of((byte[]) body);
        }
        if (body instanceof CharSequence) {
            return ofUtf8((CharSequence) body);
        }
        if (body instanceof ByteBuffer) {
            final ByteBuffer buf = ((ByteBuffer) body).duplicate();
            final byte[] content = new byte[buf.remaining()];
            buf.get(content);
            return of(content);
        }
        if (body instanceof ByteSource) {
            final ByteSource source = (ByteSource) body;
            return new SuppliedRequestBody(source::openStream, source.sizeIfKnown().or(-1L));
        }
        if (body instanceof File) {
            return of(((File) body).toPath());
        }
        if (body instanceof Path) {
            final Path path = (Path) body;
            return new SuppliedRequestBody(() -> Files.newInputStream(path), Files.size(path));
        }
        if (body instanceof InputStream) {
            try (InputStream in = (InputStream) body) {
                return of(ByteStreams.toByteArray(in));
            }
        }
        throw new IllegalArgumentException("cannot handle type " + body.getClass().getName());
    }

    /**
     * Returns a new {@link InputStream} over the payload, starting from its first byte.
     */
    public abstract InputStream openStream() throws IOException;

    /**
     * Returns the length of the payload in bytes, or {@code -1} if unknown.
     */
    public abstract long contentLength();

    /**
     * Returns whether {@link #openStream()} can be invoked more than once.
     */
    public boolean isRepeatable() {
        return true;
    }

    /**
     * Returns a {@link RequestBody} that yields the full payload again. A retrying client invokes this
     * method before every attempt but the first one.
     *
     * @throws IllegalStateException if the payload has been consumed and cannot be produced again
     */
    public RequestBody rewind() {
        return this;
    }

    /**
     * Reads the whole payload into a byte array.
     */
    public byte[] toByteArray() throws IOException {
        try (InputStream in = openStream()) {
            return ByteStreams.toByteArray(in);
        }
    }

    private static final class ByteArrayRequestBody extends RequestBody {

        private final byte[] content;

        ByteArrayRequestBody(byte[] content) {
            this.content = content;
        }

        @Override
        public InputStream openStream() {
            return new ByteArrayInputStream(content);
        }

        @Override
        public long contentLength() {
            return content.length;
        }

        @Override
        public byte[] toByteArray() {
            return content.clone();
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("length", content.length).toString();
        }
    }

    private static final class SuppliedRequestBody extends RequestBody {

        private final StreamSupplier supplier;
        private final long contentLength;

        SuppliedRequestBody(StreamSupplier supplier, long contentLength) {
            this.supplier = supplier;
            this.contentLength = contentLength;
        }

        @Override
        public InputStream openStream() throws IOException {
            final InputStream in = supplier.get();
            checkState(in != null, "%s returned null.", supplier);
            return in;
        }

        @Override
        public long contentLength() {
            return contentLength;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("length", contentLength).toString();
        }
    }

    private static final class OneShotRequestBody extends RequestBody {

        private final InputStream in;
        private final AtomicBoolean opened = new AtomicBoolean();

        OneShotRequestBody(InputStream in) {
            this.in = in;
        }

        @Override
        public InputStream openStream() {
            checkState(opened.compareAndSet(false, true), "a one-shot request body cannot be read twice");
            return in;
        }

        @Override
        public long contentLength() {
            return -1;
        }

        @Override
        public boolean isRepeatable() {
            return false;
        }

        @Override
        public RequestBody rewind() {
            checkState(!opened.get(), "a one-shot request body cannot be rewound once read");
            return this;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("opened", opened.get()).toString();
        }
    }
}
