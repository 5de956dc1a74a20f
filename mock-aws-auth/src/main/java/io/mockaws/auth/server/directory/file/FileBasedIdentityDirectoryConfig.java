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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import jakarta.validation.constraints.NotNull;

import java.io.File;

public class FileBasedIdentityDirectoryConfig
{
    private File directoryFile;

    @NotNull
    public File getDirectoryFile()
    {
        return directoryFile;
    }

    @Config("identity-directory.file-path")
    @ConfigDescription("JSON file holding the users, groups, roles, policies and sessions of the directory")
    public FileBasedIdentityDirectoryConfig setDirectoryFile(File directoryFile)
    {
        this.directoryFile = directoryFile;
        return this;
    }
}
