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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public record IamUser(String name, List<AccessKey> accessKeys)
{
    public IamUser
    {
        requireNonNull(name, "name is null");
        accessKeys = ImmutableList.copyOf(accessKeys);
    }

    public Optional<AccessKey> accessKey(String accessKeyId)
    {
        return accessKeys.stream()
                .filter(accessKey -> accessKey.accessKeyId().equals(accessKeyId))
                .findFirst();
    }
}
