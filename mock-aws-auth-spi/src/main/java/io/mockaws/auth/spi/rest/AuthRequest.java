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
package io.mockaws.auth.spi.rest;

import io.mockaws.auth.spi.collections.MultiMap;

import java.net.URI;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * An inbound request as seen by the authentication engine.
 *
 * @param requestUri path and raw query string of the request, the host is taken from the {@code Host} header
 * @param headers request headers, expected to be case-insensitive
 * @param parameters decoded query string and form parameters, the source of the action name and target resource
 */
public record AuthRequest(String httpMethod, URI requestUri, MultiMap headers, MultiMap parameters, Optional<byte[]> body)
{
    public AuthRequest
    {
        requireNonNull(httpMethod, "httpMethod is null");
        requireNonNull(requestUri, "requestUri is null");
        requireNonNull(headers, "headers is null");
        requireNonNull(parameters, "parameters is null");
        requireNonNull(body, "body is null");
        checkArgument(!headers.isCaseSensitiveKeys(), "headers must be case-insensitive");
    }

    public Optional<String> header(String name)
    {
        return headers.getFirst(name);
    }

    public Optional<String> parameter(String name)
    {
        return parameters.getFirst(name);
    }

    public AuthRequest withBody(byte[] newBody)
    {
        return new AuthRequest(httpMethod, requestUri, headers, parameters, Optional.of(newBody));
    }
}
