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
package io.mockaws.auth.server.security;

import io.mockaws.auth.spi.security.AuthError;
import io.mockaws.auth.spi.security.ResolutionFailure;

import java.util.Optional;

/**
 * The error vocabulary of a family of services. Each method turns one kind of failure into the
 * code, message and status a real service of that family would answer with.
 */
public interface ErrorFlavor
{
    AuthError credentialResolutionFailed(ResolutionFailure reason, String service, Optional<String> resource);

    AuthError signatureMismatch();

    AuthError accessDenied(String principalArn, String action, Optional<String> resource);

    AuthError malformedAuthorization(String detail);

    AuthError missingAction(String actionParameter);
}
