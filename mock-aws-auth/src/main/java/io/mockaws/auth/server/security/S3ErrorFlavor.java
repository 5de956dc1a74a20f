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

import static io.mockaws.auth.server.security.GenericErrorFlavor.SIGNATURE_DOES_NOT_MATCH_MESSAGE;
import static jakarta.ws.rs.core.Response.Status.BAD_REQUEST;
import static jakarta.ws.rs.core.Response.Status.FORBIDDEN;

/**
 * Errors of S3, which names the bucket when the request targets one
 */
public class S3ErrorFlavor
        implements ErrorFlavor
{
    @Override
    public AuthError credentialResolutionFailed(ResolutionFailure reason, String service, Optional<String> resource)
    {
        return switch (reason) {
            case INVALID_ID -> new AuthError("InvalidAccessKeyId", "The AWS Access Key Id you provided does not exist in our records.", FORBIDDEN, resource);
            case INVALID_TOKEN -> new AuthError("InvalidToken", "The provided token is malformed or otherwise invalid.", BAD_REQUEST, resource);
        };
    }

    @Override
    public AuthError signatureMismatch()
    {
        return new AuthError("SignatureDoesNotMatch", SIGNATURE_DOES_NOT_MATCH_MESSAGE, FORBIDDEN);
    }

    @Override
    public AuthError accessDenied(String principalArn, String action, Optional<String> resource)
    {
        return new AuthError("AccessDenied", "Access Denied", FORBIDDEN, resource);
    }

    @Override
    public AuthError malformedAuthorization(String detail)
    {
        return new AuthError("AuthorizationHeaderMalformed", "The authorization header is malformed; " + detail, BAD_REQUEST);
    }

    @Override
    public AuthError missingAction(String actionParameter)
    {
        return new AuthError("InvalidRequest", "Missing required parameter: " + actionParameter, BAD_REQUEST);
    }
}
