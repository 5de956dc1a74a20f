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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Contents of a directory file. Policy documents may be written either as JSON objects or as strings holding JSON.
 */
public record DirectorySnapshot(
        @JsonProperty("managedPolicies") List<ManagedPolicyEntry> managedPolicies,
        @JsonProperty("users") List<UserEntry> users,
        @JsonProperty("groups") List<GroupEntry> groups,
        @JsonProperty("roles") List<RoleEntry> roles,
        @JsonProperty("assumedRoleSessions") List<SessionEntry> assumedRoleSessions)
{
    @JsonCreator
    public DirectorySnapshot
    {
        managedPolicies = copyOrEmpty(managedPolicies);
        users = copyOrEmpty(users);
        groups = copyOrEmpty(groups);
        roles = copyOrEmpty(roles);
        assumedRoleSessions = copyOrEmpty(assumedRoleSessions);
    }

    public record ManagedPolicyEntry(@JsonProperty("arn") String arn, @JsonProperty("document") JsonNode document)
    {
        @JsonCreator
        public ManagedPolicyEntry
        {
            requireNonNull(arn, "arn is null");
            requireNonNull(document, "document is null");
        }
    }

    public record AccessKeyEntry(@JsonProperty("accessKeyId") String accessKeyId, @JsonProperty("secretAccessKey") String secretAccessKey)
    {
        @JsonCreator
        public AccessKeyEntry
        {
            requireNonNull(accessKeyId, "accessKeyId is null");
            requireNonNull(secretAccessKey, "secretAccessKey is null");
        }
    }

    public record UserEntry(
            @JsonProperty("name") String name,
            @JsonProperty("accessKeys") List<AccessKeyEntry> accessKeys,
            @JsonProperty("inlinePolicies") Map<String, JsonNode> inlinePolicies,
            @JsonProperty("attachedPolicies") List<String> attachedPolicies,
            @JsonProperty("groups") List<String> groups)
    {
        @JsonCreator
        public UserEntry
        {
            requireNonNull(name, "name is null");
            accessKeys = copyOrEmpty(accessKeys);
            inlinePolicies = copyOrEmpty(inlinePolicies);
            attachedPolicies = copyOrEmpty(attachedPolicies);
            groups = copyOrEmpty(groups);
        }
    }

    public record GroupEntry(
            @JsonProperty("name") String name,
            @JsonProperty("inlinePolicies") Map<String, JsonNode> inlinePolicies,
            @JsonProperty("attachedPolicies") List<String> attachedPolicies)
    {
        @JsonCreator
        public GroupEntry
        {
            requireNonNull(name, "name is null");
            inlinePolicies = copyOrEmpty(inlinePolicies);
            attachedPolicies = copyOrEmpty(attachedPolicies);
        }
    }

    public record RoleEntry(
            @JsonProperty("name") String name,
            @JsonProperty("inlinePolicies") Map<String, JsonNode> inlinePolicies,
            @JsonProperty("attachedPolicies") List<String> attachedPolicies)
    {
        @JsonCreator
        public RoleEntry
        {
            requireNonNull(name, "name is null");
            inlinePolicies = copyOrEmpty(inlinePolicies);
            attachedPolicies = copyOrEmpty(attachedPolicies);
        }
    }

    public record SessionEntry(
            @JsonProperty("accessKeyId") String accessKeyId,
            @JsonProperty("secretAccessKey") String secretAccessKey,
            @JsonProperty("sessionToken") String sessionToken,
            @JsonProperty("arn") String arn,
            @JsonProperty("sessionName") String sessionName)
    {
        @JsonCreator
        public SessionEntry
        {
            requireNonNull(accessKeyId, "accessKeyId is null");
            requireNonNull(secretAccessKey, "secretAccessKey is null");
            requireNonNull(sessionToken, "sessionToken is null");
            requireNonNull(arn, "arn is null");
            requireNonNull(sessionName, "sessionName is null");
        }
    }

    static String documentText(JsonNode document)
    {
        return document.isTextual() ? document.asText() : document.toString();
    }

    private static <T> List<T> copyOrEmpty(List<T> values)
    {
        return (values == null) ? ImmutableList.of() : ImmutableList.copyOf(values);
    }

    private static <K, V> Map<K, V> copyOrEmpty(Map<K, V> values)
    {
        return (values == null) ? ImmutableMap.of() : ImmutableMap.copyOf(values);
    }
}
