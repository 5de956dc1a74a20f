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
package io.mockaws.auth.server.principal;

import io.mockaws.auth.server.policy.PolicyDocument;
import io.mockaws.auth.spi.credentials.Credential;

import java.util.List;

/**
 * The identity that signed a request. Instances are built per request and hold no mutable state.
 */
public sealed interface Principal
        permits IamUserPrincipal, AssumedRolePrincipal
{
    PrincipalType type();

    String identityArn();

    /**
     * The credential the request must have been signed with
     */
    Credential credential();

    /**
     * Every policy that applies to this principal, parsed. Order carries no meaning and the same
     * policy may appear more than once.
     *
     * @throws io.mockaws.auth.spi.directory.DirectoryLookupException if one of the policies cannot be looked up
     * @throws io.mockaws.auth.server.policy.PolicyParseException if one of the policies is malformed
     */
    List<PolicyDocument> attachedPolicies();
}
