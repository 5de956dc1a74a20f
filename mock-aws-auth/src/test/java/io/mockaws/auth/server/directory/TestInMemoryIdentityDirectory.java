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
import io.mockaws.auth.spi.directory.AccessKey;
import io.mockaws.auth.spi.directory.AssumedRoleSession;
import io.mockaws.auth.spi.directory.DirectoryLookupException;
import io.mockaws.auth.spi.directory.IamGroup;
import io.mockaws.auth.spi.directory.IamUser;
import io.mockaws.auth.spi.policy.InlinePolicy;
import io.mockaws.auth.spi.policy.ManagedPolicy;
import io.mockaws.auth.spi.policy.PolicyVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestInMemoryIdentityDirectory
{
    private static final String POLICY_ARN = "arn:aws:iam::123456789012:policy/read-only";

    private InMemoryIdentityDirectory directory;

    @BeforeEach
    public void setUp()
    {
        directory = new InMemoryIdentityDirectory();
    }

    @Test
    public void testUsers()
    {
        directory.createUser("alice");
        directory.createUser("bob");
        directory.addAccessKey("alice", new AccessKey("AKIA1", "s1"));
        directory.addAccessKey("alice", new AccessKey("AKIA2", "s2"));

        assertThat(directory.listUsers()).containsExactly(
                new IamUser("alice", ImmutableList.of(new AccessKey("AKIA1", "s1"), new AccessKey("AKIA2", "s2"))),
                new IamUser("bob", ImmutableList.of()));

        assertThatThrownBy(() -> directory.createUser("alice"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alice");
        assertThatThrownBy(() -> directory.addAccessKey("carol", new AccessKey("AKIA3", "s3")))
                .isInstanceOf(DirectoryLookupException.class)
                .hasMessage("The user with name carol cannot be found.");
    }

    @Test
    public void testInlinePolicies()
    {
        directory.createUser("alice");
        directory.putUserPolicy("alice", "first", "{}");
        directory.putUserPolicy("alice", "second", "{\"Statement\": []}");
        directory.putUserPolicy("alice", "first", "{\"Version\": \"2012-10-17\"}");

        assertThat(directory.listUserPolicies("alice")).containsExactly("first", "second");
        assertThat(directory.getUserPolicy("alice", "first")).isEqualTo(new InlinePolicy("first", "{\"Version\": \"2012-10-17\"}"));
        assertThatThrownBy(() -> directory.getUserPolicy("alice", "third"))
                .isInstanceOf(DirectoryLookupException.class)
                .hasMessage("The user alice does not have a policy named third.");
    }

    @Test
    public void testGroups()
    {
        directory.createUser("alice");
        directory.createGroup("developers");
        directory.createGroup("admins");
        directory.addUserToGroup("developers", "alice");
        directory.addUserToGroup("admins", "alice");
        directory.putGroupPolicy("admins", "all", "{}");

        assertThat(directory.groupsForUser("alice")).containsExactly(new IamGroup("developers"), new IamGroup("admins"));
        assertThat(directory.listGroupPolicies("admins")).containsExactly("all");
        assertThat(directory.listGroupPolicies("developers")).isEmpty();
        assertThat(directory.getGroupPolicy("admins", "all").document()).isEqualTo("{}");

        assertThatThrownBy(() -> directory.addUserToGroup("testers", "alice"))
                .isInstanceOf(DirectoryLookupException.class)
                .hasMessage("The group with name testers cannot be found.");
        assertThatThrownBy(() -> directory.listGroupPolicies("testers"))
                .isInstanceOf(DirectoryLookupException.class);
    }

    @Test
    public void testRoles()
    {
        directory.createRole("reader");
        directory.putRolePolicy("reader", "read", "{}");
        directory.createPolicy(POLICY_ARN, "{}");
        directory.attachRolePolicy("reader", POLICY_ARN);

        assertThat(directory.listRolePolicies("reader")).containsExactly("read");
        assertThat(directory.getRolePolicy("reader", "read")).isEqualTo(new InlinePolicy("read", "{}"));
        assertThat(directory.listAttachedRolePolicies("reader")).extracting(ManagedPolicy::arn).containsExactly(POLICY_ARN);
        assertThatThrownBy(() -> directory.listRolePolicies("writer"))
                .isInstanceOf(DirectoryLookupException.class)
                .hasMessage("The role with name writer cannot be found.");
    }

    @Test
    public void testManagedPolicyVersions()
    {
        directory.createUser("alice");
        ManagedPolicy created = directory.createPolicy(POLICY_ARN, "{\"v\": 1}");
        directory.attachUserPolicy("alice", POLICY_ARN);

        assertThat(created.versions()).containsExactly(new PolicyVersion("v1", "{\"v\": 1}", true));

        directory.createPolicyVersion(POLICY_ARN, "{\"v\": 2}", false);
        assertThat(directory.listAttachedUserPolicies("alice").get(0).effectiveDocument()).isEqualTo("{\"v\": 1}");

        ManagedPolicy updated = directory.createPolicyVersion(POLICY_ARN, "{\"v\": 3}", true);
        assertThat(updated.versions()).containsExactly(
                new PolicyVersion("v1", "{\"v\": 1}", false),
                new PolicyVersion("v2", "{\"v\": 2}", false),
                new PolicyVersion("v3", "{\"v\": 3}", true));
        // attachments observe the new default version
        assertThat(directory.listAttachedUserPolicies("alice").get(0).effectiveDocument()).isEqualTo("{\"v\": 3}");
    }

    @Test
    public void testUnknownManagedPolicy()
    {
        directory.createUser("alice");

        assertThatThrownBy(() -> directory.attachUserPolicy("alice", POLICY_ARN))
                .isInstanceOf(DirectoryLookupException.class)
                .hasMessage("Policy %s was not found.".formatted(POLICY_ARN));
        assertThatThrownBy(() -> directory.createPolicyVersion(POLICY_ARN, "{}", true))
                .isInstanceOf(DirectoryLookupException.class);

        directory.createPolicy(POLICY_ARN, "{}");
        assertThatThrownBy(() -> directory.createPolicy(POLICY_ARN, "{}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testAssumedRoleSessions()
    {
        AssumedRoleSession first = new AssumedRoleSession("ASIA1", "s1", "t1", "arn:aws:iam::123456789012:role/reader", "one");
        AssumedRoleSession second = new AssumedRoleSession("ASIA2", "s2", "t2", "arn:aws:iam::123456789012:role/writer", "two");
        directory.addAssumedRoleSession(first);
        directory.addAssumedRoleSession(second);

        assertThat(directory.activeAssumedRoles()).containsExactly(first, second);

        directory.removeAssumedRoleSession("ASIA1");
        assertThat(directory.activeAssumedRoles()).containsExactly(second);
    }

    @Test
    public void testAccessKeyIdsAreUnique()
    {
        directory.createUser("alice");
        directory.createUser("bob");
        directory.addAccessKey("alice", new AccessKey("AKIADUP", "alice-secret"));
        directory.addAssumedRoleSession(new AssumedRoleSession("ASIADUP", "s1", "t1", "arn:aws:iam::123456789012:role/reader", "one"));

        assertThatThrownBy(() -> directory.addAccessKey("bob", new AccessKey("AKIADUP", "bob-secret")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Access key already in use: AKIADUP");
        assertThatThrownBy(() -> directory.addAccessKey("alice", new AccessKey("AKIADUP", "other-secret")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> directory.addAccessKey("bob", new AccessKey("ASIADUP", "bob-secret")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Access key already in use: ASIADUP");
        assertThatThrownBy(() -> directory.addAssumedRoleSession(new AssumedRoleSession("AKIADUP", "s2", "t2", "arn:aws:iam::123456789012:role/reader", "two")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> directory.addAssumedRoleSession(new AssumedRoleSession("ASIADUP", "s3", "t3", "arn:aws:iam::123456789012:role/writer", "three")))
                .isInstanceOf(IllegalArgumentException.class);

        // rejected keys leave the directory unchanged
        assertThat(directory.listUsers()).containsExactly(
                new IamUser("alice", ImmutableList.of(new AccessKey("AKIADUP", "alice-secret"))),
                new IamUser("bob", ImmutableList.of()));
        assertThat(directory.activeAssumedRoles()).extracting(AssumedRoleSession::sessionName).containsExactly("one");

        // a removed session frees its key id
        directory.removeAssumedRoleSession("ASIADUP");
        directory.addAccessKey("bob", new AccessKey("ASIADUP", "bob-secret"));
        assertThat(directory.listUsers().get(1).accessKey("ASIADUP")).isPresent();
    }

    @Test
    public void testReadsAreSnapshots()
    {
        directory.createUser("alice");
        directory.putUserPolicy("alice", "first", "{}");

        List<String> policies = directory.listUserPolicies("alice");
        directory.putUserPolicy("alice", "second", "{}");

        assertThat(policies).containsExactly("first");
        assertThatThrownBy(() -> policies.add("third")).isInstanceOf(UnsupportedOperationException.class);
    }
}
