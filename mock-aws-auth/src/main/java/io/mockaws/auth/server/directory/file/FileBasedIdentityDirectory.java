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

import com.google.common.io.Files;
import com.google.inject.Inject;
import io.airlift.json.JsonCodec;
import io.airlift.log.Logger;
import io.mockaws.auth.server.directory.InMemoryIdentityDirectory;
import io.mockaws.auth.spi.directory.AccessKey;
import io.mockaws.auth.spi.directory.AssumedRoleSession;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;

import static io.mockaws.auth.server.directory.file.DirectorySnapshot.documentText;
import static java.util.Objects.requireNonNull;

/**
 * An in-memory directory populated once, at startup, from a JSON file
 */
public class FileBasedIdentityDirectory
        extends InMemoryIdentityDirectory
{
    private static final Logger log = Logger.get(FileBasedIdentityDirectory.class);

    @Inject
    public FileBasedIdentityDirectory(FileBasedIdentityDirectoryConfig config, JsonCodec<DirectorySnapshot> jsonCodec)
    {
        requireNonNull(config, "config is null");
        requireNonNull(jsonCodec, "jsonCodec is null");
        load(readSnapshot(config.getDirectoryFile(), jsonCodec));
    }

    private static DirectorySnapshot readSnapshot(File directoryFile, JsonCodec<DirectorySnapshot> jsonCodec)
    {
        try {
            return jsonCodec.fromJson(Files.toByteArray(directoryFile));
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read identity directory file", e);
        }
    }

    private void load(DirectorySnapshot snapshot)
    {
        // policies first, attachments refer to them
        snapshot.managedPolicies().forEach(policy -> createPolicy(policy.arn(), documentText(policy.document())));

        snapshot.groups().forEach(group -> {
            createGroup(group.name());
            group.inlinePolicies().forEach((name, document) -> putGroupPolicy(group.name(), name, documentText(document)));
            group.attachedPolicies().forEach(arn -> attachGroupPolicy(group.name(), arn));
        });

        snapshot.users().forEach(user -> {
            createUser(user.name());
            user.accessKeys().forEach(accessKey -> addAccessKey(user.name(), new AccessKey(accessKey.accessKeyId(), accessKey.secretAccessKey())));
            user.inlinePolicies().forEach((name, document) -> putUserPolicy(user.name(), name, documentText(document)));
            user.attachedPolicies().forEach(arn -> attachUserPolicy(user.name(), arn));
            user.groups().forEach(group -> addUserToGroup(group, user.name()));
        });

        snapshot.roles().forEach(role -> {
            createRole(role.name());
            role.inlinePolicies().forEach((name, document) -> putRolePolicy(role.name(), name, documentText(document)));
            role.attachedPolicies().forEach(arn -> attachRolePolicy(role.name(), arn));
        });

        snapshot.assumedRoleSessions().forEach(session -> addAssumedRoleSession(
                new AssumedRoleSession(session.accessKeyId(), session.secretAccessKey(), session.sessionToken(), session.arn(), session.sessionName())));

        log.info("Loaded identity directory. Users: %s, Groups: %s, Roles: %s, Policies: %s",
                snapshot.users().size(), snapshot.groups().size(), snapshot.roles().size(), snapshot.managedPolicies().size());
    }
}
