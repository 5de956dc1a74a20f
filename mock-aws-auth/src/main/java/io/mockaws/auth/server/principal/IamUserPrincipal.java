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
import io.mockaws.auth.spi.directory.AccessKey;
import io.mockaws.auth.spi.directory.IamGroup;
import io.mockaws.auth.spi.directory.IdentityDirectory;

import java.util.List;

import static java.util.Objects.requireNonNull;

public final class IamUserPrincipal
        implements Principal
{
    private final String userName;
    private final AccessKey accessKey;
    private final String accountId;
    private final IdentityDirectory identityDirectory;

    public IamUserPrincipal(String userName, AccessKey accessKey, String accountId, IdentityDirectory identityDirectory)
    {
        this.userName = requireNonNull(userName, "userName is null");
        this.accessKey = requireNonNull(accessKey, "accessKey is null");
        this.accountId = requireNonNull(accountId, "accountId is null");
        this.identityDirectory = requireNonNull(identityDirectory, "identityDirectory is null");
    }

    @Override
    public PrincipalType type()
    {
        return PrincipalType.IAM_USER;
    }

    @Override
    public String identityArn()
    {
        return "arn:aws:iam::%s:user/%s".formatted(accountId, userName);
    }

    @Override
    public Credential credential()
    {
        return new Credential(accessKey.accessKeyId(), accessKey.secretAccessKey());
    }

    @Override
    public List<PolicyDocument> attachedPolicies()
    {
        ImmutableList.Builder<PolicyDocument> policies = ImmutableList.builder();

        for (String policyName : identityDirectory.listUserPolicies(userName)) {
            policies.add(PolicyDocumentParser.parse(identityDirectory.getUserPolicy(userName, policyName)));
        }
        identityDirectory.listAttachedUserPolicies(userName).stream()
                .map(PolicyDocumentParser::parse)
                .forEach(policies::add);

        for (IamGroup group : identityDirectory.groupsForUser(userName)) {
            for (String policyName : identityDirectory.listGroupPolicies(group.name())) {
                policies.add(PolicyDocumentParser.parse(identityDirectory.getGroupPolicy(group.name(), policyName)));
            }
            identityDirectory.listAttachedGroupPolicies(group.name()).stream()
                    .map(PolicyDocumentParser::parse)
                    .forEach(policies::add);
        }

        return policies.build();
    }

    @Override
    public String toString()
    {
        return identityArn();
    }
}
