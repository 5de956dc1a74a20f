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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.mockaws.auth.spi.security.AuthError;

import java.io.UncheckedIOException;

import static jakarta.ws.rs.core.MediaType.APPLICATION_XML;
import static java.util.Objects.requireNonNull;

/**
 * Writes an {@link AuthError} as the XML error document AWS services answer with
 */
public class AuthErrorRenderer
{
    private static final Logger log = Logger.get(AuthErrorRenderer.class);

    private final XmlMapper xmlMapper;

    @Inject
    public AuthErrorRenderer(XmlMapper xmlMapper)
    {
        this.xmlMapper = requireNonNull(xmlMapper, "xmlMapper is null");
    }

    public RenderedError render(AuthError error, String requestId)
    {
        requireNonNull(error, "error is null");
        requireNonNull(requestId, "requestId is null");

        ErrorResponse response = new ErrorResponse(error.code(), error.message(), error.resource(), requestId);
        try {
            return new RenderedError(error.status(), APPLICATION_XML, xmlMapper.writeValueAsString(response));
        }
        catch (JsonProcessingException e) {
            log.error(e, "Could not render error %s", error.code());
            throw new UncheckedIOException(e);
        }
    }
}
