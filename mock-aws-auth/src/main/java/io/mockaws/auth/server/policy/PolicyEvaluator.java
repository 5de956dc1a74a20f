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

import io.airlift.log.Logger;

import static java.util.Objects.requireNonNull;

public class PolicyEvaluator
{
    private static final Logger log = Logger.get(PolicyEvaluator.class);

    /**
     * Evaluate the statements of {@code document} in order. A statement denying the action ends the
     * evaluation; otherwise the document permits the action if any statement allowed it.
     */
    public PermissionResult evaluate(PolicyDocument document, String action)
    {
        requireNonNull(document, "document is null");
        requireNonNull(action, "action is null");

        boolean permitted = false;
        for (PolicyStatement statement : document.statements()) {
            PermissionResult result = statement.evaluate(action);
            if (result == PermissionResult.DENIED) {
                log.debug("Action %s denied by statement %s", action, statement.sid().orElse("<unnamed>"));
                return PermissionResult.DENIED;
            }
            if (result == PermissionResult.PERMITTED) {
                permitted = true;
            }
        }
        return permitted ? PermissionResult.PERMITTED : PermissionResult.NEUTRAL;
    }
}
