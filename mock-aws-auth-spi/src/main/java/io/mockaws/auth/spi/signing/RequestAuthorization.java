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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static java.util.Objects.requireNonNull;

public record RequestAuthorization(CredentialScope credentialScope, Set<String> lowercaseSignedHeaders, String signature)
{
    public static final RequestAuthorization INVALID = new RequestAuthorization(CredentialScope.EMPTY, ImmutableSet.of(), "");
    private static final String SIGNATURE_ALGORITHM = "AWS4-HMAC-SHA256";
    private static final String CREDENTIAL_HEADER = "%s Credential".formatted(SIGNATURE_ALGORITHM);

    public RequestAuthorization
    {
        requireNonNull(credentialScope, "credentialScope is null");
        lowercaseSignedHeaders = ImmutableSet.copyOf(lowercaseSignedHeaders);
        requireNonNull(signature, "signature is null");
    }

    public boolean isValid()
    {
        return credentialScope.isValid() && !lowercaseSignedHeaders.isEmpty() && !signature.isEmpty();
    }

    public String accessKey()
    {
        return credentialScope.accessKeyId();
    }

    public static RequestAuthorization parse(String authorization)
    {
        if (authorization.isBlank()) {
            return INVALID;
        }

        Map<String, String> parts;
        try {
            parts = Splitter.on(',').omitEmptyStrings().trimResults().withKeyValueSeparator('=').split(authorization);
        }
        catch (IllegalArgumentException e) {
            parts = ImmutableMap.of();
        }

        CredentialScope credentialScope = CredentialScope.parse(parts.getOrDefault(CREDENTIAL_HEADER, ""));

        Set<String> signedHeaders = Splitter.on(';').omitEmptyStrings()
                .trimResults()
                .splitToStream(parts.getOrDefault("SignedHeaders", ""))
                .map(header -> header.toLowerCase(Locale.ROOT))
                .collect(toImmutableSet());

        return new RequestAuthorization(credentialScope, signedHeaders, parts.getOrDefault("Signature", ""));
    }
}
