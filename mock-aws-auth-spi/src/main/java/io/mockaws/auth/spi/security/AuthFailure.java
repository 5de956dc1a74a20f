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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

public sealed interface AuthFailure
{
    record CredentialResolutionFailed(ResolutionFailure reason)
            implements AuthFailure
    {
        public CredentialResolutionFailed
        {
            requireNonNull(reason, "reason is null");
        }
    }

    record SignatureMismatch()
            implements AuthFailure
    {
    }

    record AccessDenied(String principalArn, String action, Optional<String> resource)
            implements AuthFailure
    {
        public AccessDenied
        {
            requireNonNull(principalArn, "principalArn is null");
            requireNonNull(action, "action is null");
            requireNonNull(resource, "resource is null");
        }
    }

    record MalformedAuthorization(String detail)
            implements AuthFailure
    {
        public MalformedAuthorization
        {
            requireNonNull(detail, "detail is null");
        }
    }

    record MissingAction()
            implements AuthFailure
    {
    }
}
