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

import com.google.inject.Binder;
import com.google.inject.Scopes;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.airlift.log.Logger;
import io.mockaws.auth.server.directory.IdentityDirectoryConfig;
import io.mockaws.auth.spi.directory.IdentityDirectory;
import io.mockaws.auth.spi.directory.SessionDirectory;

import static com.google.inject.multibindings.OptionalBinder.newOptionalBinder;
import static io.airlift.configuration.ConditionalModule.conditionalModule;
import static io.airlift.configuration.ConfigBinder.configBinder;
import static io.airlift.json.JsonCodecBinder.jsonCodecBinder;

public class FileBasedIdentityDirectoryModule
        extends AbstractConfigurationAwareModule
{
    private static final Logger log = Logger.get(FileBasedIdentityDirectoryModule.class);

    // set as config value for "identity-directory.type"
    public static final String FILE_BASED_DIRECTORY_IDENTIFIER = "file";

    @Override
    protected void setup(Binder binder)
    {
        install(conditionalModule(
                IdentityDirectoryConfig.class,
                config -> config.getDirectoryType().map(FILE_BASED_DIRECTORY_IDENTIFIER::equals).orElse(false),
                innerBinder -> {
                    log.info("Using %s with identifier \"%s\"", FileBasedIdentityDirectory.class.getSimpleName(), FILE_BASED_DIRECTORY_IDENTIFIER);
                    configBinder(innerBinder).bindConfig(FileBasedIdentityDirectoryConfig.class);
                    jsonCodecBinder(innerBinder).bindJsonCodec(DirectorySnapshot.class);
                    innerBinder.bind(FileBasedIdentityDirectory.class).in(Scopes.SINGLETON);
                    newOptionalBinder(innerBinder, IdentityDirectory.class).setBinding().to(FileBasedIdentityDirectory.class);
                    newOptionalBinder(innerBinder, SessionDirectory.class).setBinding().to(FileBasedIdentityDirectory.class);
                }));
    }
}
