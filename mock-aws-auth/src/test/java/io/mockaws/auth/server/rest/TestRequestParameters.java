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
package io.mockaws.auth.server.rest;

import com.google.common.collect.ImmutableList;
import io.mockaws.auth.spi.collections.ImmutableMultiMap;
import io.mockaws.auth.spi.collections.MultiMap;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

public class TestRequestParameters
{
    @Test
    public void testParseQuery()
    {
        MultiMap parameters = RequestParameters.parseQuery("Action=ListUsers&Marker=a%2Fb+c&flag&Tag=1&Tag=2");

        assertThat(parameters.getFirst("Action")).contains("ListUsers");
        assertThat(parameters.getFirst("Marker")).contains("a/b c");
        assertThat(parameters.getFirst("flag")).contains("");
        assertThat(parameters.get("Tag")).containsExactly("1", "2");
        // parameter names are case-sensitive
        assertThat(parameters.getFirst("action")).isEmpty();
    }

    @Test
    public void testParseEmptyQuery()
    {
        assertThat(RequestParameters.parseQuery(null).keySet()).isEmpty();
        assertThat(RequestParameters.parseQuery("").keySet()).isEmpty();
        assertThat(RequestParameters.parseQuery("&&").keySet()).isEmpty();
    }

    @Test
    public void testFormBody()
    {
        MultiMap headers = ImmutableMultiMap.builder(false)
                .add("Content-Type", "application/x-www-form-urlencoded; charset=utf-8")
                .build();

        MultiMap parameters = RequestParameters.fromRequest(
                URI.create("/?Version=2010-05-08"),
                headers,
                Optional.of("Action=GetUser&UserName=alice".getBytes(UTF_8)));

        assertThat(parameters.getFirst("Version")).contains("2010-05-08");
        assertThat(parameters.getFirst("Action")).contains("GetUser");
        assertThat(parameters.getFirst("UserName")).contains("alice");
    }

    @Test
    public void testNonFormBodyIgnored()
    {
        MultiMap headers = ImmutableMultiMap.builder(false)
                .add("Content-Type", "application/json")
                .build();

        MultiMap parameters = RequestParameters.fromRequest(
                URI.create("/my-bucket/object?uploads"),
                headers,
                Optional.of("Action=GetUser".getBytes(UTF_8)));

        assertThat(parameters.getFirst("Action")).isEmpty();
        assertThat(parameters.get("uploads")).isEqualTo(ImmutableList.of(""));
    }
}
