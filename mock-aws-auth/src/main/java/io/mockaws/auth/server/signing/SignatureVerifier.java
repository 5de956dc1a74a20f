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
package io.mockaws.auth.server.signing;

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.mockaws.auth.server.principal.Principal;
import io.mockaws.auth.server.rest.RequestParameters;
import io.mockaws.auth.spi.rest.AuthRequest;
import io.mockaws.auth.spi.signing.CredentialScope;
import io.mockaws.auth.spi.signing.RequestAuthorization;
import io.mockaws.auth.spi.signing.RequestSigner;
import io.mockaws.auth.spi.signing.SignableRequest;
import io.mockaws.auth.spi.signing.SigningFlavor;
import io.mockaws.auth.spi.signing.UnsignableRequestException;
import io.mockaws.auth.spi.timestamps.AwsTimestamp;

import java.time.Instant;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public class SignatureVerifier
{
    private static final Logger log = Logger.get(SignatureVerifier.class);

    public static final String AMZ_DATE_HEADER = "X-Amz-Date";

    private final RequestSigner requestSigner;

    @Inject
    public SignatureVerifier(RequestSigner requestSigner)
    {
        this.requestSigner = requireNonNull(requestSigner, "requestSigner is null");
    }

    /**
     * Recompute the signature of {@code request} with the credential of {@code principal} and compare it with
     * the one the client sent. Only the headers listed in the authorization's {@code SignedHeaders} take part.
     */
    public SignatureVerification verify(AuthRequest request, RequestAuthorization authorization, Principal principal, SigningFlavor signingFlavor)
    {
        requireNonNull(request, "request is null");
        requireNonNull(authorization, "authorization is null");
        requireNonNull(principal, "principal is null");
        requireNonNull(signingFlavor, "signingFlavor is null");

        Optional<Instant> requestDate = request.header(AMZ_DATE_HEADER).flatMap(AwsTimestamp::tryParseRequestTimestamp);
        if (requestDate.isEmpty()) {
            log.debug("Request has no valid %s header. Request: %s %s", AMZ_DATE_HEADER, request.httpMethod(), request.requestUri());
            return SignatureVerification.MISSING_TIMESTAMP;
        }

        SigningHeaders signingHeaders = SigningHeaders.build(request.headers(), authorization.lowercaseSignedHeaders());
        SignableRequest signableRequest = new SignableRequest(
                request.httpMethod(),
                request.requestUri(),
                signingHeaders.headersToSign(),
                RequestParameters.parseQuery(request.requestUri().getRawQuery()),
                request.body(),
                requestDate.get());

        CredentialScope credentialScope = authorization.credentialScope();
        String expectedSignature;
        try {
            expectedSignature = requestSigner.sign(principal.credential(), credentialScope.service(), credentialScope.region(), signingFlavor, signableRequest);
        }
        catch (UnsignableRequestException e) {
            // the client's signature cannot be reproduced
            log.debug("Request cannot be signed: %s. Request: %s %s", e.getMessage(), request.httpMethod(), request.requestUri());
            return SignatureVerification.MISMATCH;
        }
        if (!expectedSignature.equals(authorization.signature())) {
            log.debug("Signature mismatch. Principal: %s, Expected: %s, Received: %s", principal.identityArn(), expectedSignature, authorization.signature());
            return SignatureVerification.MISMATCH;
        }
        return SignatureVerification.MATCH;
    }
}
