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

/**
 * A policy as stored in the directory, before it is parsed into statements
 */
public sealed interface PolicySource
        permits ManagedPolicy, InlinePolicy
{
    /**
     * The JSON text of the policy document that is in effect
     */
    String effectiveDocument();
}
