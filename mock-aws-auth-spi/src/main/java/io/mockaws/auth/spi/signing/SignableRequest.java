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

import io.mockaws.auth.spi.collections.MultiMap;

import java.net.URI;
import java.time.Instant;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The parts of an inbound request that take part in computing its signature.
 * {@code headers} holds only the headers the client declared as signed.
 */
public record SignableRequest(String httpMethod, URI requestUri, MultiMap headers, MultiMap queryParameters, Optional<byte[]> body, Instant requestDate)
{
    public SignableRequest
    {
        requireNonNull(httpMethod, "httpMethod is null");
        requireNonNull(requestUri, "requestUri is null");
        requireNonNull(headers, "headers is null");
        requireNonNull(queryParameters, "queryParameters is null");
        requireNonNull(body, "body is null");
        requireNonNull(requestDate, "requestDate is null");
    }
}
