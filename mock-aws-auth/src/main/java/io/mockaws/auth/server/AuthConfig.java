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
package io.mockaws.auth.server;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public class AuthConfig
{
    private String accountId = "123456789012";
    private String longTermAccessKeyPrefix = "AKIA";
    private String actionParameter = "Action";
    private String resourceParameter = "BucketName";

    @NotNull
    @Pattern(regexp = "\\d{12}", message = "must be a 12 digit account id")
    public String getAccountId()
    {
        return accountId;
    }

    @Config("auth.account-id")
    @ConfigDescription("Account id used when building principal ARNs")
    public AuthConfig setAccountId(String accountId)
    {
        this.accountId = accountId;
        return this;
    }

    @NotEmpty
    public String getLongTermAccessKeyPrefix()
    {
        return longTermAccessKeyPrefix;
    }

    @Config("auth.long-term-access-key-prefix")
    @ConfigDescription("Access keys with this prefix always belong to IAM users, never to assumed-role sessions")
    public AuthConfig setLongTermAccessKeyPrefix(String longTermAccessKeyPrefix)
    {
        this.longTermAccessKeyPrefix = longTermAccessKeyPrefix;
        return this;
    }

    @NotEmpty
    public String getActionParameter()
    {
        return actionParameter;
    }

    @Config("auth.action-parameter")
    @ConfigDescription("Request parameter carrying the name of the invoked action")
    public AuthConfig setActionParameter(String actionParameter)
    {
        this.actionParameter = actionParameter;
        return this;
    }

    @NotEmpty
    public String getResourceParameter()
    {
        return resourceParameter;
    }

    @Config("auth.resource-parameter")
    @ConfigDescription("Request parameter naming the targeted resource, reported in resource-scoped errors")
    public AuthConfig setResourceParameter(String resourceParameter)
    {
        this.resourceParameter = resourceParameter;
        return this;
    }
}
