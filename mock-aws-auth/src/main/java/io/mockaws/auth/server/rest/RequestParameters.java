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

import com.google.common.base.Splitter;
import io.mockaws.auth.spi.collections.ImmutableMultiMap;
import io.mockaws.auth.spi.collections.MultiMap;

import java.net.URI;
import java.net.URLDecoder;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Decodes the query string and url-encoded form bodies of a request into its parameters
 */
public final class RequestParameters
{
    private static final Splitter PARAMETER_SPLITTER = Splitter.on('&').omitEmptyStrings();
    private static final Splitter KEY_VALUE_SPLITTER = Splitter.on('=').limit(2);

    private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private RequestParameters() {}

    public static MultiMap parseQuery(String rawQuery)
    {
        ImmutableMultiMap.Builder builder = ImmutableMultiMap.builder(true);
        addEncodedParameters(builder, rawQuery);
        return builder.build();
    }

    /**
     * Parameters of the query string followed by those of the body, when the body is a url-encoded form
     */
    public static MultiMap fromRequest(URI requestUri, MultiMap headers, Optional<byte[]> body)
    {
        ImmutableMultiMap.Builder builder = ImmutableMultiMap.builder(true);
        addEncodedParameters(builder, requestUri.getRawQuery());
        if (body.isPresent() && isFormContent(headers)) {
            addEncodedParameters(builder, new String(body.get(), UTF_8));
        }
        return builder.build();
    }

    private static boolean isFormContent(MultiMap headers)
    {
        return headers.getFirst("content-type")
                .map(contentType -> contentType.toLowerCase(Locale.ROOT).startsWith(FORM_CONTENT_TYPE))
                .orElse(false);
    }

    private static void addEncodedParameters(ImmutableMultiMap.Builder builder, String encoded)
    {
        if (encoded == null) {
            return;
        }
        for (String parameter : PARAMETER_SPLITTER.split(encoded)) {
            List<String> parts = KEY_VALUE_SPLITTER.splitToList(parameter);
            String value = (parts.size() == 2) ? decode(parts.get(1)) : "";
            builder.add(decode(parts.get(0)), value);
        }
    }

    private static String decode(String value)
    {
        return URLDecoder.decode(value, UTF_8);
    }
}
