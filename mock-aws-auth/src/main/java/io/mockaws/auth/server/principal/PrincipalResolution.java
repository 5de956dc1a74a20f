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

import io.mockaws.auth.spi.security.ResolutionFailure;

import static java.util.Objects.requireNonNull;

public sealed interface PrincipalResolution
{
    record Resolved(Principal principal)
            implements PrincipalResolution
    {
        public Resolved
        {
            requireNonNull(principal, "principal is null");
        }
    }

    record Failed(ResolutionFailure reason)
            implements PrincipalResolution
    {
        public Failed
        {
            requireNonNull(reason, "reason is null");
        }
    }
}
