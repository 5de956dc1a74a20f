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
package io.mockaws.auth.server.principal;

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.mockaws.auth.server.AuthConfig;
import io.mockaws.auth.spi.collections.MultiMap;
import io.mockaws.auth.spi.directory.AccessKey;
import io.mockaws.auth.spi.directory.AssumedRoleSession;
import io.mockaws.auth.spi.directory.IamUser;
import io.mockaws.auth.spi.directory.IdentityDirectory;
import io.mockaws.auth.spi.directory.SessionDirectory;

import java.util.Optional;

import static io.mockaws.auth.spi.security.ResolutionFailure.INVALID_ID;
import static io.mockaws.auth.spi.security.ResolutionFailure.INVALID_TOKEN;
import static java.util.Objects.requireNonNull;

public class PrincipalResolver
{
    private static final Logger log = Logger.get(PrincipalResolver.class);

    public static final String SECURITY_TOKEN_HEADER = "X-Amz-Security-Token";

    private final IdentityDirectory identityDirectory;
    private final SessionDirectory sessionDirectory;
    private final String accountId;
    private final String longTermAccessKeyPrefix;

    @Inject
    public PrincipalResolver(IdentityDirectory identityDirectory, SessionDirectory sessionDirectory, AuthConfig authConfig)
    {
        this.identityDirectory = requireNonNull(identityDirectory, "identityDirectory is null");
        this.sessionDirectory = requireNonNull(sessionDirectory, "sessionDirectory is null");
        requireNonNull(authConfig, "authConfig is null");
        this.accountId = authConfig.getAccountId();
        this.longTermAccessKeyPrefix = authConfig.getLongTermAccessKeyPrefix();
    }

    /**
     * Find who owns {@code accessKeyId}. Long-term keys, and any key sent without a security token,
     * belong to IAM users; the others to assumed-role sessions.
     */
    public PrincipalResolution resolve(String accessKeyId, MultiMap headers)
    {
        requireNonNull(accessKeyId, "accessKeyId is null");
        requireNonNull(headers, "headers is null");

        Optional<String> securityToken = headers.getFirst(SECURITY_TOKEN_HEADER);
        if (accessKeyId.startsWith(longTermAccessKeyPrefix) || securityToken.isEmpty()) {
            return resolveUser(accessKeyId, securityToken);
        }
        return resolveAssumedRole(accessKeyId, securityToken.get());
    }

    private PrincipalResolution resolveUser(String accessKeyId, Optional<String> securityToken)
    {
        for (IamUser user : identityDirectory.listUsers()) {
            Optional<AccessKey> accessKey = user.accessKey(accessKeyId);
            if (accessKey.isPresent()) {
                if (securityToken.isPresent()) {
                    log.debug("Security token sent with a long-term access key. AccessKey: %s, User: %s", accessKeyId, user.name());
                    return new PrincipalResolution.Failed(INVALID_TOKEN);
                }
                return new PrincipalResolution.Resolved(new IamUserPrincipal(user.name(), accessKey.get(), accountId, identityDirectory));
            }
        }
        log.debug("No user owns access key. AccessKey: %s", accessKeyId);
        return new PrincipalResolution.Failed(INVALID_ID);
    }

    private PrincipalResolution resolveAssumedRole(String accessKeyId, String securityToken)
    {
        for (AssumedRoleSession session : sessionDirectory.activeAssumedRoles()) {
            if (session.accessKeyId().equals(accessKeyId)) {
                if (!session.sessionToken().equals(securityToken)) {
                    log.debug("Security token does not match assumed-role session. AccessKey: %s, Role: %s", accessKeyId, session.arn());
                    return new PrincipalResolution.Failed(INVALID_TOKEN);
                }
                return new PrincipalResolution.Resolved(new AssumedRolePrincipal(session, accountId, identityDirectory));
            }
        }
        log.debug("No assumed-role session owns access key. AccessKey: %s", accessKeyId);
        return new PrincipalResolution.Failed(INVALID_ID);
    }
}
