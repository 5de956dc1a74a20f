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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.airlift.log.Logger;
import io.mockaws.auth.server.directory.IdentityDirectoryConfig;
import io.mockaws.auth.server.directory.InMemoryIdentityDirectory;
import io.mockaws.auth.server.directory.file.FileBasedIdentityDirectoryModule;
import io.mockaws.auth.server.policy.PolicyAggregator;
import io.mockaws.auth.server.policy.PolicyEvaluator;
import io.mockaws.auth.server.principal.PrincipalResolver;
import io.mockaws.auth.server.rest.AuthErrorRenderer;
import io.mockaws.auth.server.security.AuthenticationController;
import io.mockaws.auth.server.signing.AwsSdkRequestSigner;
import io.mockaws.auth.server.signing.SignatureVerifier;
import io.mockaws.auth.spi.directory.IdentityDirectory;
import io.mockaws.auth.spi.directory.SessionDirectory;
import io.mockaws.auth.spi.signing.RequestSigner;

import static com.google.inject.multibindings.OptionalBinder.newOptionalBinder;
import static io.airlift.configuration.ConfigBinder.configBinder;

public class MockAwsAuthModule
        extends AbstractConfigurationAwareModule
{
    private static final Logger log = Logger.get(MockAwsAuthModule.class);

    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(AuthConfig.class);

        binder.bind(PolicyEvaluator.class).in(Scopes.SINGLETON);
        binder.bind(PolicyAggregator.class).in(Scopes.SINGLETON);
        binder.bind(PrincipalResolver.class).in(Scopes.SINGLETON);
        binder.bind(SignatureVerifier.class).in(Scopes.SINGLETON);
        binder.bind(AuthenticationController.class).in(Scopes.SINGLETON);
        binder.bind(AuthErrorRenderer.class).in(Scopes.SINGLETON);

        newOptionalBinder(binder, RequestSigner.class).setDefault().toProvider(() -> {
            log.info("Using default %s implementation", AwsSdkRequestSigner.class.getSimpleName());
            return new AwsSdkRequestSigner();
        }).in(Scopes.SINGLETON);

        // IdentityDirectory and SessionDirectory binder, both served by one directory
        configBinder(binder).bindConfig(IdentityDirectoryConfig.class);
        binder.bind(InMemoryIdentityDirectory.class).in(Scopes.SINGLETON);
        newOptionalBinder(binder, IdentityDirectory.class).setDefault().to(InMemoryIdentityDirectory.class);
        newOptionalBinder(binder, SessionDirectory.class).setDefault().to(InMemoryIdentityDirectory.class);

        // provided implementations
        install(new FileBasedIdentityDirectoryModule());
    }

    @Provides
    public XmlMapper newXmlMapper()
    {
        // not a singleton, XmlMappers are mutable
        XmlMapper xmlMapper = new XmlMapper();
        xmlMapper.registerModule(new Jdk8Module());
        xmlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.UPPER_CAMEL_CASE);
        return xmlMapper;
    }
}
