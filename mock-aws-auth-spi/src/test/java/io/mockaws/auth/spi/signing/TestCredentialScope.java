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
package io.mockaws.auth.spi.signing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TestCredentialScope
{
    @Test
    public void testParse()
    {
        CredentialScope scope = CredentialScope.parse("ASIAEXAMPLE/20240101/eu-west-1/s3/aws4_request");
        assertThat(scope).isEqualTo(new CredentialScope("ASIAEXAMPLE", "20240101", "eu-west-1", "s3"));
        assertThat(scope.isValid()).isTrue();
    }

    @Test
    public void testTooFewParts()
    {
        assertThat(CredentialScope.parse("")).isEqualTo(CredentialScope.EMPTY);
        assertThat(CredentialScope.parse("ASIAEXAMPLE/20240101/eu-west-1")).isEqualTo(CredentialScope.EMPTY);
        assertThat(CredentialScope.EMPTY.isValid()).isFalse();
    }

    @Test
    public void testEmptyService()
    {
        assertThat(CredentialScope.parse("ASIAEXAMPLE/20240101/eu-west-1//aws4_request").isValid()).isFalse();
    }
}
