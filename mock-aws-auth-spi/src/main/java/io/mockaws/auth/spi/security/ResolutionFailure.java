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

/**
 * Why an access key could not be turned into a principal
 */
public enum ResolutionFailure
{
    /**
     * No user or active session owns the access key
     */
    INVALID_ID,
    /**
     * The security token is missing, does not match the session, or was sent with a long-term key
     */
    INVALID_TOKEN,
}
