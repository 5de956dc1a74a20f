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

import io.airlift.log.Logger;
import io.mockaws.auth.server.AuthConfig;
import io.mockaws.auth.server.policy.PermissionResult;
import io.mockaws.auth.server.policy.PolicyAggregator;
import io.mockaws.auth.server.policy.PolicyParseException;
import io.mockaws.auth.server.principal.Principal;
import io.mockaws.auth.server.principal.PrincipalResolution;
import io.mockaws.auth.server.principal.PrincipalResolver;
import io.mockaws.auth.server.signing.SignatureVerification;
import io.mockaws.auth.server.signing.SignatureVerifier;
import io.mockaws.auth.spi.directory.DirectoryLookupException;
import io.mockaws.auth.spi.rest.AuthRequest;
import io.mockaws.auth.spi.security.AuthError;
import io.mockaws.auth.spi.security.AuthFailure;
import io.mockaws.auth.spi.security.AuthOutcome;
import io.mockaws.auth.spi.signing.RequestAuthorization;
import io.mockaws.auth.spi.signing.SigningFlavor;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Authenticates and authorizes requests of one {@link AuthFlavor}: the principal is resolved from the
 * access key, the signature is recomputed and compared, then the principal's policies decide whether
 * the requested action is allowed. The first failing step ends processing.
 */
public class RequestAuthenticator
{
    private static final Logger log = Logger.get(RequestAuthenticator.class);

    public static final String AUTHORIZATION_HEADER = "Authorization";

    private final PrincipalResolver principalResolver;
    private final SignatureVerifier signatureVerifier;
    private final PolicyAggregator policyAggregator;
    private final ErrorFlavor errorFlavor;
    private final SigningFlavor signingFlavor;
    private final String actionParameter;
    private final String resourceParameter;

    public RequestAuthenticator(
            PrincipalResolver principalResolver,
            SignatureVerifier signatureVerifier,
            PolicyAggregator policyAggregator,
            AuthConfig authConfig,
            ErrorFlavor errorFlavor,
            SigningFlavor signingFlavor)
    {
        this.principalResolver = requireNonNull(principalResolver, "principalResolver is null");
        this.signatureVerifier = requireNonNull(signatureVerifier, "signatureVerifier is null");
        this.policyAggregator = requireNonNull(policyAggregator, "policyAggregator is null");
        this.errorFlavor = requireNonNull(errorFlavor, "errorFlavor is null");
        this.signingFlavor = requireNonNull(signingFlavor, "signingFlavor is null");
        requireNonNull(authConfig, "authConfig is null");
        this.actionParameter = authConfig.getActionParameter();
        this.resourceParameter = authConfig.getResourceParameter();
    }

    public AuthOutcome authenticateAndAuthorize(AuthRequest request)
    {
        requireNonNull(request, "request is null");

        Optional<String> resource = request.parameter(resourceParameter);

        RequestAuthorization authorization = request.header(AUTHORIZATION_HEADER)
                .map(RequestAuthorization::parse)
                .orElse(RequestAuthorization.INVALID);
        if (!authorization.isValid()) {
            log.debug("Missing or malformed %s header. Request: %s %s", AUTHORIZATION_HEADER, request.httpMethod(), request.requestUri());
            String detail = "the Authorization header must carry a Credential, SignedHeaders and Signature";
            return failure(new AuthFailure.MalformedAuthorization(detail), errorFlavor.malformedAuthorization(detail));
        }

        Optional<String> actionName = request.parameter(actionParameter);
        if (actionName.isEmpty()) {
            log.debug("Request names no action. Request: %s %s", request.httpMethod(), request.requestUri());
            return failure(new AuthFailure.MissingAction(), errorFlavor.missingAction(actionParameter));
        }
        String service = authorization.credentialScope().service();
        String action = service + ":" + actionName.get();

        PrincipalResolution resolution = principalResolver.resolve(authorization.accessKey(), request.headers());
        if (resolution instanceof PrincipalResolution.Failed failed) {
            return failure(new AuthFailure.CredentialResolutionFailed(failed.reason()), errorFlavor.credentialResolutionFailed(failed.reason(), service, resource));
        }
        Principal principal = ((PrincipalResolution.Resolved) resolution).principal();

        SignatureVerification verification = signatureVerifier.verify(request, authorization, principal, signingFlavor);
        if (verification == SignatureVerification.MISSING_TIMESTAMP) {
            String detail = "the request must carry a valid %s header".formatted(SignatureVerifier.AMZ_DATE_HEADER);
            return failure(new AuthFailure.MalformedAuthorization(detail), errorFlavor.malformedAuthorization(detail));
        }
        if (verification == SignatureVerification.MISMATCH) {
            return failure(new AuthFailure.SignatureMismatch(), errorFlavor.signatureMismatch());
        }

        if (authorize(principal, action) != PermissionResult.PERMITTED) {
            return failure(new AuthFailure.AccessDenied(principal.identityArn(), action, resource), errorFlavor.accessDenied(principal.identityArn(), action, resource));
        }
        return new AuthOutcome.Success(principal.identityArn(), action);
    }

    private PermissionResult authorize(Principal principal, String action)
    {
        try {
            return policyAggregator.authorize(principal, action);
        }
        catch (DirectoryLookupException | PolicyParseException e) {
            log.warn(e, "Could not evaluate policies, denying access. Principal: %s, Action: %s", principal.identityArn(), action);
            return PermissionResult.DENIED;
        }
    }

    private static AuthOutcome failure(AuthFailure failure, AuthError error)
    {
        return new AuthOutcome.Failure(failure, error);
    }
}
