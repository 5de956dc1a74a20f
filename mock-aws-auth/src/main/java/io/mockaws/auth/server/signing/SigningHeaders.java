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
package io.mockaws.auth.server.signing;

import io.mockaws.auth.spi.collections.ImmutableMultiMap;
import io.mockaws.auth.spi.collections.MultiMap;

import java.util.Locale;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The headers of a request restricted to those its client declared in {@code SignedHeaders}
 */
final class SigningHeaders
{
    private final MultiMap headersToSign;

    private SigningHeaders(MultiMap headersToSign)
    {
        this.headersToSign = requireNonNull(headersToSign, "headersToSign is null");
    }

    /**
     * @param requestHeaders all headers of the request
     * @param lowercaseHeadersToSign names of the signed headers, lowercased
     */
    static SigningHeaders build(MultiMap requestHeaders, Set<String> lowercaseHeadersToSign)
    {
        ImmutableMultiMap.Builder builder = ImmutableMultiMap.builder(false);
        requestHeaders.forEach((name, values) -> {
            if (lowercaseHeadersToSign.contains(name.toLowerCase(Locale.ROOT))) {
                builder.addAll(name, values);
            }
        });
        return new SigningHeaders(builder.build());
    }

    MultiMap headersToSign()
    {
        return headersToSign;
    }
}
