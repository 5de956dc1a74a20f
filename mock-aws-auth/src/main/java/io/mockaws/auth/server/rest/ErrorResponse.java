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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

@JacksonXmlRootElement(localName = "Error")
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record ErrorResponse(String code, String message, Optional<String> bucketName, String requestId)
{
    public ErrorResponse
    {
        requireNonNull(code, "code is null");
        requireNonNull(message, "message is null");
        requireNonNull(bucketName, "bucketName is null");
        requireNonNull(requestId, "requestId is null");
    }
}
