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

import com.google.inject.Inject;
import io.mockaws.auth.server.AuthConfig;
import io.mockaws.auth.server.policy.PolicyAggregator;
import io.mockaws.auth.server.principal.PrincipalResolver;
import io.mockaws.auth.server.signing.SignatureVerifier;
import io.mockaws.auth.spi.rest.AuthRequest;
import io.mockaws.auth.spi.security.AuthOutcome;

import java.util.Arrays;
import java.util.Map;

import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static java.util.Objects.requireNonNull;

public class AuthenticationController
{
    private final Map<AuthFlavor, RequestAuthenticator> authenticators;

    @Inject
    public AuthenticationController(
            PrincipalResolver principalResolver,
            SignatureVerifier signatureVerifier,
            PolicyAggregator policyAggregator,
            AuthConfig authConfig)
    {
        authenticators = Arrays.stream(AuthFlavor.values())
                .collect(toImmutableMap(
                        flavor -> flavor,
                        flavor -> new RequestAuthenticator(principalResolver, signatureVerifier, policyAggregator, authConfig, flavor.errorFlavor(), flavor.signingFlavor())));
    }

    public AuthOutcome authenticateAndAuthorize(AuthFlavor flavor, AuthRequest request)
    {
        requireNonNull(flavor, "flavor is null");
        return authenticator(flavor).authenticateAndAuthorize(request);
    }

    public RequestAuthenticator authenticator(AuthFlavor flavor)
    {
        return authenticators.get(flavor);
    }
}
