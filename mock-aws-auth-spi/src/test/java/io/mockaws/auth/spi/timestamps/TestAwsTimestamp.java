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
package io.mockaws.auth.spi.timestamps;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class TestAwsTimestamp
{
    @Test
    public void testRequestFormat()
    {
        assertThat(AwsTimestamp.fromRequestTimestamp("20240516T024511Z")).isEqualTo(Instant.parse("2024-05-16T02:45:11Z"));
        assertThat(AwsTimestamp.fromRequestTimestamp("20241231T235959Z")).isEqualTo(Instant.parse("2024-12-31T23:59:59Z"));
    }

    @Test
    public void testInvalidTimestamps()
    {
        assertThat(AwsTimestamp.tryParseRequestTimestamp("20240516T024511Z")).isPresent();
        assertThat(AwsTimestamp.tryParseRequestTimestamp("2024-05-16T02:45:11Z")).isEmpty();
        assertThat(AwsTimestamp.tryParseRequestTimestamp("Thu, 16 May 2024 02:45:11 GMT")).isEmpty();
        assertThat(AwsTimestamp.tryParseRequestTimestamp("")).isEmpty();
    }
}
