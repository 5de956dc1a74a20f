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
package io.mockaws.auth.server.directory.file;

import io.airlift.json.JsonCodec;
import io.mockaws.auth.spi.directory.AccessKey;
import io.mockaws.auth.spi.directory.AssumedRoleSession;
import io.mockaws.auth.spi.directory.DirectoryLookupException;
import io.mockaws.auth.spi.directory.IamGroup;
import io.mockaws.auth.spi.policy.ManagedPolicy;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;

import static io.airlift.json.JsonCodec.jsonCodec;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestFileBasedIdentityDirectory
{
    private static final JsonCodec<DirectorySnapshot> CODEC = jsonCodec(DirectorySnapshot.class);

    private static final String DIRECTORY_JSON = """
            {
              "managedPolicies": [
                {
                  "arn": "arn:aws:iam::123456789012:policy/no-delete",
                  "document": {"Version": "2012-10-17", "Statement": {"Effect": "Deny", "Action": "s3:DeleteObject"}}
                }
              ],
              "groups": [
                {
                  "name": "admins",
                  "inlinePolicies": {"everything": {"Statement": [{"Effect": "Allow", "Action": "*"}]}}
                }
              ],
              "users": [
                {
                  "name": "alice",
                  "accessKeys": [{"accessKeyId": "AKIAALICE", "secretAccessKey": "alice-secret"}],
                  "inlinePolicies": {"list": "{\\"Statement\\": [{\\"Effect\\": \\"Allow\\", \\"Action\\": \\"s3:ListBucket\\"}]}"},
                  "attachedPolicies": ["arn:aws:iam::123456789012:policy/no-delete"],
                  "groups": ["admins"]
                },
                {
                  "name": "bob"
                }
              ],
              "roles": [
                {
                  "name": "reader",
                  "attachedPolicies": ["arn:aws:iam::123456789012:policy/no-delete"]
                }
              ],
              "assumedRoleSessions": [
                {
                  "accessKeyId": "ASIAREADER",
                  "secretAccessKey": "reader-secret",
                  "sessionToken": "reader-token",
                  "arn": "arn:aws:iam::123456789012:role/reader",
                  "sessionName": "nightly-job"
                }
              ]
            }
            """;

    @Test
    public void testLoadDirectory()
            throws IOException
    {
        FileBasedIdentityDirectory directory = new FileBasedIdentityDirectory(config(writeDirectoryFile(DIRECTORY_JSON)), CODEC);

        assertThat(directory.listUsers()).hasSize(2);
        assertThat(directory.listUsers().get(0).accessKey("AKIAALICE")).contains(new AccessKey("AKIAALICE", "alice-secret"));
        assertThat(directory.listUsers().get(1).accessKeys()).isEmpty();

        // string documents are kept as written
        assertThat(directory.getUserPolicy("alice", "list").document())
                .isEqualTo("{\"Statement\": [{\"Effect\": \"Allow\", \"Action\": \"s3:ListBucket\"}]}");
        assertThat(directory.listAttachedUserPolicies("alice"))
                .extracting(ManagedPolicy::arn)
                .containsExactly("arn:aws:iam::123456789012:policy/no-delete");
        assertThat(directory.groupsForUser("alice")).containsExactly(new IamGroup("admins"));
        assertThat(directory.getGroupPolicy("admins", "everything").document()).contains("\"Action\":\"*\"");

        assertThat(directory.listRolePolicies("reader")).isEmpty();
        assertThat(directory.listAttachedRolePolicies("reader")).hasSize(1);
        assertThat(directory.activeAssumedRoles()).containsExactly(
                new AssumedRoleSession("ASIAREADER", "reader-secret", "reader-token", "arn:aws:iam::123456789012:role/reader", "nightly-job"));
    }

    @Test
    public void testEmptyDirectory()
            throws IOException
    {
        FileBasedIdentityDirectory directory = new FileBasedIdentityDirectory(config(writeDirectoryFile("{}")), CODEC);

        assertThat(directory.listUsers()).isEmpty();
        assertThat(directory.activeAssumedRoles()).isEmpty();
    }

    @Test
    public void testUnknownAttachment()
            throws IOException
    {
        File directoryFile = writeDirectoryFile("""
                {"users": [{"name": "alice", "attachedPolicies": ["arn:aws:iam::123456789012:policy/missing"]}]}
                """);

        assertThatThrownBy(() -> new FileBasedIdentityDirectory(config(directoryFile), CODEC))
                .isInstanceOf(DirectoryLookupException.class)
                .hasMessageContaining("policy/missing");
    }

    @Test
    public void testSharedAccessKey()
            throws IOException
    {
        File directoryFile = writeDirectoryFile("""
                {
                  "users": [
                    {"name": "alice", "accessKeys": [{"accessKeyId": "AKIADUP", "secretAccessKey": "alice-secret"}]},
                    {"name": "bob", "accessKeys": [{"accessKeyId": "AKIADUP", "secretAccessKey": "bob-secret"}]}
                  ]
                }
                """);

        assertThatThrownBy(() -> new FileBasedIdentityDirectory(config(directoryFile), CODEC))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Access key already in use: AKIADUP");
    }

    @Test
    public void testMissingFile()
    {
        File missing = new File("does-not-exist-identity-directory.json");

        assertThatThrownBy(() -> new FileBasedIdentityDirectory(config(missing), CODEC))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessage("Failed to read identity directory file");
    }

    private static FileBasedIdentityDirectoryConfig config(File directoryFile)
    {
        return new FileBasedIdentityDirectoryConfig().setDirectoryFile(directoryFile);
    }

    private static File writeDirectoryFile(String json)
            throws IOException
    {
        File directoryFile = File.createTempFile("identity-directory", ".json");
        directoryFile.deleteOnExit();
        Files.writeString(directoryFile.toPath(), json);
        return directoryFile;
    }
}
