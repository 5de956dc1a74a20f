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
package io.mockaws.auth.spi.security;

import static java.util.Objects.requireNonNull;

public sealed interface AuthOutcome
{
    default boolean isSuccess()
    {
        return this instanceof Success;
    }

    record Success(String principalArn, String action)
            implements AuthOutcome
    {
        public Success
        {
            requireNonNull(principalArn, "principalArn is null");
            requireNonNull(action, "action is null");
        }
    }

    record Failure(AuthFailure failure, AuthError error)
            implements AuthOutcome
    {
        public Failure
        {
            requireNonNull(failure, "failure is null");
            requireNonNull(error, "error is null");
        }
    }
}
