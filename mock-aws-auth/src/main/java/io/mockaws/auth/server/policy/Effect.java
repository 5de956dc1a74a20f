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
package io.mockaws.auth.server.policy;

import java.util.Optional;

public enum Effect
{
    ALLOW("Allow"),
    DENY("Deny");

    private final String jsonValue;

    Effect(String jsonValue)
    {
        this.jsonValue = jsonValue;
    }

    public static Optional<Effect> fromJsonValue(String value)
    {
        for (Effect effect : values()) {
            if (effect.jsonValue.equals(value)) {
                return Optional.of(effect);
            }
        }
        return Optional.empty();
    }
}
