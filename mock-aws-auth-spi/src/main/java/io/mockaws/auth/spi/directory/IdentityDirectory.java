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
package io.mockaws.auth.spi.directory;

import io.mockaws.auth.spi.policy.InlinePolicy;
import io.mockaws.auth.spi.policy.ManagedPolicy;

import java.util.List;

/**
 * Read access to the IAM users, groups, roles and policies of the mock account.
 * Implementations own their locking; every method may be called concurrently.
 * Lookups naming an unknown user, group, role or policy throw {@link DirectoryLookupException}.
 */
public interface IdentityDirectory
{
    List<IamUser> listUsers();

    List<String> listUserPolicies(String userName);

    InlinePolicy getUserPolicy(String userName, String policyName);

    List<ManagedPolicy> listAttachedUserPolicies(String userName);

    List<IamGroup> groupsForUser(String userName);

    List<String> listGroupPolicies(String groupName);

    InlinePolicy getGroupPolicy(String groupName, String policyName);

    List<ManagedPolicy> listAttachedGroupPolicies(String groupName);

    List<String> listRolePolicies(String roleName);

    InlinePolicy getRolePolicy(String roleName, String policyName);

    List<ManagedPolicy> listAttachedRolePolicies(String roleName);
}
