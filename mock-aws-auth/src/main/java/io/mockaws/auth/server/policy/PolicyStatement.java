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

import static java.util.Objects.requireNonNull;

/**
 * One statement of a policy document. Resource, NotResource and Condition elements are not kept:
 * only the action decides whether a statement applies.
 */
public record PolicyStatement(Optional<String> sid, Effect effect, ActionMatcher actionMatcher)
{
    public PolicyStatement
    {
        requireNonNull(sid, "sid is null");
        requireNonNull(effect, "effect is null");
        requireNonNull(actionMatcher, "actionMatcher is null");
    }

    public PolicyStatement(Effect effect, ActionMatcher actionMatcher)
    {
        this(Optional.empty(), effect, actionMatcher);
    }

    public PermissionResult evaluate(String action)
    {
        if (!actionMatcher.concerns(action)) {
            return PermissionResult.NEUTRAL;
        }
        return switch (effect) {
            case ALLOW -> PermissionResult.PERMITTED;
            case DENY -> PermissionResult.DENIED;
        };
    }
}
