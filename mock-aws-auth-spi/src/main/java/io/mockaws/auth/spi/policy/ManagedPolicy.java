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
package io.mockaws.auth.spi.policy;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public record ManagedPolicy(String arn, List<PolicyVersion> versions)
        implements PolicySource
{
    public ManagedPolicy
    {
        requireNonNull(arn, "arn is null");
        versions = ImmutableList.copyOf(versions);
        checkArgument(versions.stream().filter(PolicyVersion::isDefault).count() == 1, "policy %s must have exactly one default version", arn);
    }

    public PolicyVersion defaultVersion()
    {
        return versions.stream()
                .filter(PolicyVersion::isDefault)
                .findFirst()
                .orElseThrow();
    }

    @Override
    public String effectiveDocument()
    {
        return defaultVersion().document();
    }
}
