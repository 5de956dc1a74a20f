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
package io.mockaws.auth.spi.security;

import jakarta.ws.rs.core.Response.Status;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A failure expressed in the error vocabulary of the service that received the request
 *
 * @param resource name of the targeted resource (bucket) when the service reports it
 */
public record AuthError(String code, String message, Status status, Optional<String> resource)
{
    public AuthError
    {
        requireNonNull(code, "code is null");
        requireNonNull(message, "message is null");
        requireNonNull(status, "status is null");
        requireNonNull(resource, "resource is null");
    }

    public AuthError(String code, String message, Status status)
    {
        this(code, message, status, Optional.empty());
    }
}
