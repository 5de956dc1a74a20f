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
package io.mockaws.auth.server.directory;

import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.mockaws.auth.spi.directory.AccessKey;
import io.mockaws.auth.spi.directory.AssumedRoleSession;
import io.mockaws.auth.spi.directory.DirectoryLookupException;
import io.mockaws.auth.spi.directory.IamGroup;
import io.mockaws.auth.spi.directory.IamUser;
import io.mockaws.auth.spi.directory.IdentityDirectory;
import io.mockaws.auth.spi.directory.SessionDirectory;
import io.mockaws.auth.spi.policy.InlinePolicy;
import io.mockaws.auth.spi.policy.ManagedPolicy;
import io.mockaws.auth.spi.policy.PolicyVersion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * A mutable directory held in memory. Every method locks the directory, and reads hand out immutable copies.
 */
public class InMemoryIdentityDirectory
        implements IdentityDirectory, SessionDirectory
{
    private static final Logger log = Logger.get(InMemoryIdentityDirectory.class);

    private final Map<String, UserEntry> users = new LinkedHashMap<>();
    private final Map<String, PolicyHolder> groups = new LinkedHashMap<>();
    private final Map<String, PolicyHolder> roles = new LinkedHashMap<>();
    private final Map<String, ManagedPolicy> managedPolicies = new LinkedHashMap<>();
    private final Map<String, AssumedRoleSession> sessions = new LinkedHashMap<>();

    public synchronized void createUser(String userName)
    {
        requireNonNull(userName, "userName is null");
        checkArgument(!users.containsKey(userName), "User already exists: %s", userName);
        users.put(userName, new UserEntry());
    }

    public synchronized void addAccessKey(String userName, AccessKey accessKey)
    {
        requireNonNull(accessKey, "accessKey is null");
        UserEntry user = user(userName);
        checkAccessKeyUnused(accessKey.accessKeyId());
        user.accessKeys.add(accessKey);
    }

    public synchronized void putUserPolicy(String userName, String policyName, String document)
    {
        user(userName).putInline(policyName, document);
    }

    public synchronized void attachUserPolicy(String userName, String policyArn)
    {
        user(userName).attached.add(managedPolicy(policyArn).arn());
    }

    public synchronized void createGroup(String groupName)
    {
        requireNonNull(groupName, "groupName is null");
        checkArgument(!groups.containsKey(groupName), "Group already exists: %s", groupName);
        groups.put(groupName, new PolicyHolder());
    }

    public synchronized void addUserToGroup(String groupName, String userName)
    {
        group(groupName);
        user(userName).groups.add(groupName);
    }

    public synchronized void putGroupPolicy(String groupName, String policyName, String document)
    {
        group(groupName).putInline(policyName, document);
    }

    public synchronized void attachGroupPolicy(String groupName, String policyArn)
    {
        group(groupName).attached.add(managedPolicy(policyArn).arn());
    }

    public synchronized void createRole(String roleName)
    {
        requireNonNull(roleName, "roleName is null");
        checkArgument(!roles.containsKey(roleName), "Role already exists: %s", roleName);
        roles.put(roleName, new PolicyHolder());
    }

    public synchronized void putRolePolicy(String roleName, String policyName, String document)
    {
        role(roleName).putInline(policyName, document);
    }

    public synchronized void attachRolePolicy(String roleName, String policyArn)
    {
        role(roleName).attached.add(managedPolicy(policyArn).arn());
    }

    /**
     * Create a managed policy whose only version, {@code v1}, is the default one
     */
    public synchronized ManagedPolicy createPolicy(String policyArn, String document)
    {
        requireNonNull(policyArn, "policyArn is null");
        checkArgument(!managedPolicies.containsKey(policyArn), "Policy already exists: %s", policyArn);
        ManagedPolicy policy = new ManagedPolicy(policyArn, ImmutableList.of(new PolicyVersion("v1", document, true)));
        managedPolicies.put(policyArn, policy);
        return policy;
    }

    public synchronized ManagedPolicy createPolicyVersion(String policyArn, String document, boolean setAsDefault)
    {
        ManagedPolicy current = managedPolicy(policyArn);
        String versionId = "v" + (current.versions().size() + 1);

        ImmutableList.Builder<PolicyVersion> versions = ImmutableList.builder();
        for (PolicyVersion version : current.versions()) {
            versions.add(setAsDefault ? new PolicyVersion(version.versionId(), version.document(), false) : version);
        }
        versions.add(new PolicyVersion(versionId, document, setAsDefault));

        ManagedPolicy updated = new ManagedPolicy(policyArn, versions.build());
        managedPolicies.put(policyArn, updated);
        return updated;
    }

    public synchronized void addAssumedRoleSession(AssumedRoleSession session)
    {
        requireNonNull(session, "session is null");
        checkAccessKeyUnused(session.accessKeyId());
        sessions.put(session.accessKeyId(), session);
        log.debug("Added assumed-role session. Role: %s, Session: %s", session.arn(), session.sessionName());
    }

    public synchronized void removeAssumedRoleSession(String accessKeyId)
    {
        sessions.remove(accessKeyId);
    }

    @Override
    public synchronized List<IamUser> listUsers()
    {
        return users.entrySet().stream()
                .map(entry -> new IamUser(entry.getKey(), entry.getValue().accessKeys))
                .collect(toImmutableList());
    }

    @Override
    public synchronized List<String> listUserPolicies(String userName)
    {
        return ImmutableList.copyOf(user(userName).inline.keySet());
    }

    @Override
    public synchronized InlinePolicy getUserPolicy(String userName, String policyName)
    {
        return user(userName).inline(policyName, "user " + userName);
    }

    @Override
    public synchronized List<ManagedPolicy> listAttachedUserPolicies(String userName)
    {
        return attachedPolicies(user(userName));
    }

    @Override
    public synchronized List<IamGroup> groupsForUser(String userName)
    {
        return user(userName).groups.stream()
                .map(IamGroup::new)
                .collect(toImmutableList());
    }

    @Override
    public synchronized List<String> listGroupPolicies(String groupName)
    {
        return ImmutableList.copyOf(group(groupName).inline.keySet());
    }

    @Override
    public synchronized InlinePolicy getGroupPolicy(String groupName, String policyName)
    {
        return group(groupName).inline(policyName, "group " + groupName);
    }

    @Override
    public synchronized List<ManagedPolicy> listAttachedGroupPolicies(String groupName)
    {
        return attachedPolicies(group(groupName));
    }

    @Override
    public synchronized List<String> listRolePolicies(String roleName)
    {
        return ImmutableList.copyOf(role(roleName).inline.keySet());
    }

    @Override
    public synchronized InlinePolicy getRolePolicy(String roleName, String policyName)
    {
        return role(roleName).inline(policyName, "role " + roleName);
    }

    @Override
    public synchronized List<ManagedPolicy> listAttachedRolePolicies(String roleName)
    {
        return attachedPolicies(role(roleName));
    }

    @Override
    public synchronized List<AssumedRoleSession> activeAssumedRoles()
    {
        return ImmutableList.copyOf(sessions.values());
    }

    // an access key id must identify exactly one user or session
    private void checkAccessKeyUnused(String accessKeyId)
    {
        boolean ownedByUser = users.values().stream()
                .flatMap(user -> user.accessKeys.stream())
                .anyMatch(accessKey -> accessKey.accessKeyId().equals(accessKeyId));
        checkArgument(!ownedByUser && !sessions.containsKey(accessKeyId), "Access key already in use: %s", accessKeyId);
    }

    private List<ManagedPolicy> attachedPolicies(PolicyHolder holder)
    {
        return holder.attached.stream()
                .map(this::managedPolicy)
                .collect(toImmutableList());
    }

    private UserEntry user(String userName)
    {
        requireNonNull(userName, "userName is null");
        UserEntry user = users.get(userName);
        if (user == null) {
            throw new DirectoryLookupException("The user with name %s cannot be found.".formatted(userName));
        }
        return user;
    }

    private PolicyHolder group(String groupName)
    {
        requireNonNull(groupName, "groupName is null");
        PolicyHolder group = groups.get(groupName);
        if (group == null) {
            throw new DirectoryLookupException("The group with name %s cannot be found.".formatted(groupName));
        }
        return group;
    }

    private PolicyHolder role(String roleName)
    {
        requireNonNull(roleName, "roleName is null");
        PolicyHolder role = roles.get(roleName);
        if (role == null) {
            throw new DirectoryLookupException("The role with name %s cannot be found.".formatted(roleName));
        }
        return role;
    }

    private ManagedPolicy managedPolicy(String policyArn)
    {
        requireNonNull(policyArn, "policyArn is null");
        ManagedPolicy policy = managedPolicies.get(policyArn);
        if (policy == null) {
            throw new DirectoryLookupException("Policy %s was not found.".formatted(policyArn));
        }
        return policy;
    }

    private static class PolicyHolder
    {
        final Map<String, String> inline = new LinkedHashMap<>();
        final Set<String> attached = new LinkedHashSet<>();

        void putInline(String policyName, String document)
        {
            requireNonNull(policyName, "policyName is null");
            requireNonNull(document, "document is null");
            inline.put(policyName, document);
        }

        InlinePolicy inline(String policyName, String owner)
        {
            requireNonNull(policyName, "policyName is null");
            String document = inline.get(policyName);
            if (document == null) {
                throw new DirectoryLookupException("The %s does not have a policy named %s.".formatted(owner, policyName));
            }
            return new InlinePolicy(policyName, document);
        }
    }

    private static class UserEntry
            extends PolicyHolder
    {
        final List<AccessKey> accessKeys = new ArrayList<>();
        final Set<String> groups = new LinkedHashSet<>();
    }
}
