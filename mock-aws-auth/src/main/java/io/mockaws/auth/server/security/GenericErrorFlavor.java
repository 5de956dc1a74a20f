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

import static jakarta.ws.rs.core.Response.Status.BAD_REQUEST;
import static jakarta.ws.rs.core.Response.Status.FORBIDDEN;
import static jakarta.ws.rs.core.Response.Status.UNAUTHORIZED;

/**
 * Errors of the query-protocol services (IAM, STS, EC2 and the like)
 */
public class GenericErrorFlavor
        implements ErrorFlavor
{
    static final String SIGNATURE_DOES_NOT_MATCH_MESSAGE = "The request signature we calculated does not match the signature you provided. " +
            "Check your AWS Secret Access Key and signing method. Consult the service documentation for details.";

    @Override
    public AuthError credentialResolutionFailed(ResolutionFailure reason, String service, Optional<String> resource)
    {
        // EC2 answers both unknown keys and bad tokens with its own code
        if (service.equals("ec2")) {
            return new AuthError("AuthFailure", "AWS was not able to validate the provided access credentials", UNAUTHORIZED);
        }
        return new AuthError("InvalidClientTokenId", "The security token included in the request is invalid.", FORBIDDEN);
    }

    @Override
    public AuthError signatureMismatch()
    {
        return new AuthError("SignatureDoesNotMatch", SIGNATURE_DOES_NOT_MATCH_MESSAGE, FORBIDDEN);
    }

    @Override
    public AuthError accessDenied(String principalArn, String action, Optional<String> resource)
    {
        return new AuthError("AccessDenied", "User: %s is not authorized to perform: %s".formatted(principalArn, action), FORBIDDEN);
    }

    @Override
    public AuthError malformedAuthorization(String detail)
    {
        return new AuthError("IncompleteSignature", detail, BAD_REQUEST);
    }

    @Override
    public AuthError missingAction(String actionParameter)
    {
        return new AuthError("MissingAction", "Could not find operation: missing %s parameter".formatted(actionParameter), BAD_REQUEST);
    }
}
