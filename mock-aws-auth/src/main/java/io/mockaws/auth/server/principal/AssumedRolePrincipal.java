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

import com.google.common.collect.ImmutableList;
import io.mockaws.auth.server.policy.PolicyDocument;
import io.mockaws.auth.server.policy.PolicyDocumentParser;
import io.mockaws.auth.spi.credentials.Credential;
import io.mockaws.auth.spi.directory.AssumedRoleSession;
import io.mockaws.auth.spi.directory.IdentityDirectory;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public final class AssumedRolePrincipal
        implements Principal
{
    private final AssumedRoleSession session;
    private final String accountId;
    private final IdentityDirectory identityDirectory;

    public AssumedRolePrincipal(AssumedRoleSession session, String accountId, IdentityDirectory identityDirectory)
    {
        this.session = requireNonNull(session, "session is null");
        this.accountId = requireNonNull(accountId, "accountId is null");
        this.identityDirectory = requireNonNull(identityDirectory, "identityDirectory is null");
    }

    public String roleName()
    {
        return session.roleName();
    }

    public String sessionName()
    {
        return session.sessionName();
    }

    @Override
    public PrincipalType type()
    {
        return PrincipalType.ASSUMED_ROLE;
    }

    @Override
    public String identityArn()
    {
        return "arn:aws:sts::%s:assumed-role/%s/%s".formatted(accountId, session.roleName(), session.sessionName());
    }

    @Override
    public Credential credential()
    {
        return new Credential(session.accessKeyId(), session.secretAccessKey(), Optional.of(session.sessionToken()));
    }

    @Override
    public List<PolicyDocument> attachedPolicies()
    {
        String roleName = session.roleName();
        ImmutableList.Builder<PolicyDocument> policies = ImmutableList.builder();

        for (String policyName : identityDirectory.listRolePolicies(roleName)) {
            policies.add(PolicyDocumentParser.parse(identityDirectory.getRolePolicy(roleName, policyName)));
        }
        identityDirectory.listAttachedRolePolicies(roleName).stream()
                .map(PolicyDocumentParser::parse)
                .forEach(policies::add);

        return policies.build();
    }

    @Override
    public String toString()
    {
        return identityArn();
    }
}
