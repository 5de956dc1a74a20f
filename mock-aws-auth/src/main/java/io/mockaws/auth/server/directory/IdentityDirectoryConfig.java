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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

import java.util.Optional;

public class IdentityDirectoryConfig
{
    private Optional<String> directoryType = Optional.empty();

    public Optional<String> getDirectoryType()
    {
        return directoryType;
    }

    @Config("identity-directory.type")
    @ConfigDescription("Identifier of the identity directory implementation to use, the in-memory directory when unset")
    public IdentityDirectoryConfig setDirectoryType(String directoryType)
    {
        this.directoryType = Optional.ofNullable(directoryType);
        return this;
    }
}
