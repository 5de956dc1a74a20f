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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The {@code Credential=} component of a SigV4 authorization:
 * {@code <access-key-id>/<yyyyMMdd>/<region>/<service>/aws4_request}
 */
public record CredentialScope(String accessKeyId, String date, String region, String service)
{
    public static final CredentialScope EMPTY = new CredentialScope("", "", "", "");

    public CredentialScope
    {
        requireNonNull(accessKeyId, "accessKeyId is null");
        requireNonNull(date, "date is null");
        requireNonNull(region, "region is null");
        requireNonNull(service, "service is null");
    }

    public boolean isValid()
    {
        return !accessKeyId.isEmpty() && !region.isEmpty() && !service.isEmpty();
    }

    public static CredentialScope parse(String credential)
    {
        List<String> parts = Splitter.on('/').trimResults().splitToList(credential);
        if (parts.size() < 4) {
            return EMPTY;
        }
        return new CredentialScope(parts.get(0), parts.get(1), parts.get(2), parts.get(3));
    }
}
