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

import static java.util.Objects.requireNonNull;

/**
 * Temporary credentials handed out by an STS {@code AssumeRole} call.
 *
 * @param arn ARN of the role that was assumed, e.g. {@code arn:aws:iam::123456789012:role/my-role}
 */
public record AssumedRoleSession(String accessKeyId, String secretAccessKey, String sessionToken, String arn, String sessionName)
{
    public AssumedRoleSession
    {
        requireNonNull(accessKeyId, "accessKeyId is null");
        requireNonNull(secretAccessKey, "secretAccessKey is null");
        requireNonNull(sessionToken, "sessionToken is null");
        requireNonNull(arn, "arn is null");
        requireNonNull(sessionName, "sessionName is null");
    }

    public String roleName()
    {
        return arn.substring(arn.lastIndexOf('/') + 1);
    }
}
