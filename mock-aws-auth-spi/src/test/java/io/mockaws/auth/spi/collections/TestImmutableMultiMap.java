/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.mockaws.auth.spi.collections;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TestImmutableMultiMap
{
    @Test
    public void testCaseInsensitiveKeys()
    {
        MultiMap headers = ImmutableMultiMap.builder(false)
                .add("X-Amz-Date", "20240101T000000Z")
                .add("Host", "localhost")
                .add("x-custom", "one")
                .add("X-CUSTOM", "two")
                .build();

        assertThat(headers.isCaseSensitiveKeys()).isFalse();
        assertThat(headers.getFirst("x-amz-date")).contains("20240101T000000Z");
        assertThat(headers.getFirst("HOST")).contains("localhost");
        assertThat(headers.get("X-Custom")).containsExactly("one", "two");
        assertThat(headers.keySet()).containsExactlyInAnyOrder("x-amz-date", "host", "x-custom");
        assertThat(headers.containsKey("missing")).isFalse();
        assertThat(headers.getFirst("missing")).isEmpty();
    }

    @Test
    public void testCaseSensitiveKeys()
    {
        MultiMap parameters = ImmutableMultiMap.builder(true)
                .add("Action", "ListUsers")
                .build();

        assertThat(parameters.getFirst("Action")).contains("ListUsers");
        assertThat(parameters.getFirst("action")).isEmpty();
    }

    @Test
    public void testPutOrReplaceSingle()
    {
        MultiMap map = ImmutableMultiMap.builder(false)
                .addAll("key", ImmutableList.of("a", "b"))
                .putOrReplaceSingle("KEY", "c")
                .build();

        assertThat(map.get("key")).containsExactly("c");
    }

    @Test
    public void testCopyOfCaseInsensitive()
    {
        MultiMap map = ImmutableMultiMap.copyOfCaseInsensitive(ImmutableMap.of("Content-Type", ImmutableList.of("text/plain")));

        assertThat(map.getFirst("content-type")).contains("text/plain");
        assertThat(ImmutableMultiMap.empty().keySet()).isEmpty();
    }
}
