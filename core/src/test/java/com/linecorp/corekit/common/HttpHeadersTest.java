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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HttpHeadersTest {

    @Test
    void namesAreCaseInsensitive() {
        final HttpHeaders headers = HttpHeaders.builder()
                                               .add("Content-Type", "text/plain")
                                               .add("X-Trace", "a")
                                               .add("x-trace", "b")
                                               .build();
        assertThat(headers.get("content-type")).isEqualTo("text/plain");
        assertThat(headers.get("CONTENT-TYPE")).isEqualTo("text/plain");
        assertThat(headers.getAll("X-TRACE")).containsExactly("a", "b");
        assertThat(headers.names()).containsExactly("content-type", "x-trace");
        assertThat(headers.size()).isEqualTo(3);
    }

    @Test
    void missingHeader() {
        final HttpHeaders headers = HttpHeaders.of();
        assertThat(headers.isEmpty()).isTrue();
        assertThat(headers.get("foo")).isNull();
        assertThat(headers.get("foo", "bar")).isEqualTo("bar");
        assertThat(headers.getAll("foo")).isEmpty();
        assertThat(headers.contains("foo")).isFalse();
    }

    @Test
    void setReplacesAllValues() {
        final HttpHeaders headers = HttpHeaders.of("accept", "a", "Accept", "b")
                                               .toBuilder()
                                               .set("ACCEPT", "c")
                                               .setIfAbsent("accept", "d")
                                               .setIfAbsent("user-agent", "e")
                                               .build();
        assertThat(headers.getAll("accept")).containsExactly("c");
        assertThat(headers.get("user-agent")).isEqualTo("e");
    }

    @Test
    void builderDoesNotAffectOriginal() {
        final HttpHeaders original = HttpHeaders.of("a", "1");
        final HttpHeaders modified = original.toBuilder().remove("a").add("b", "2").build();
        assertThat(original.get("a")).isEqualTo("1");
        assertThat(original.contains("b")).isFalse();
        assertThat(modified.contains("a")).isFalse();
        assertThat(modified.get("b")).isEqualTo("2");
    }

    @Test
    void equality() {
        assertThat(HttpHeaders.of("A", "1")).isEqualTo(HttpHeaders.of("a", "1"));
        assertThat(HttpHeaders.of("a", "1")).isNotEqualTo(HttpHeaders.of("a", "2"));
        assertThat(HttpHeaders.of("a", "1").hashCode()).isEqualTo(HttpHeaders.of("A", "1").hashCode());
    }
}
