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

import com.google.inject.Inject;
import io.airlift.log.Logger;
import io.mockaws.auth.server.principal.Principal;

import static java.util.Objects.requireNonNull;

public class PolicyAggregator
{
    private static final Logger log = Logger.get(PolicyAggregator.class);

    private final PolicyEvaluator policyEvaluator;

    @Inject
    public PolicyAggregator(PolicyEvaluator policyEvaluator)
    {
        this.policyEvaluator = requireNonNull(policyEvaluator, "policyEvaluator is null");
    }

    /**
     * Decide whether {@code principal} may perform {@code action}. Never returns {@link PermissionResult#NEUTRAL}:
     * an explicit deny in any attached policy wins, and an action no policy allows is denied.
     *
     * @throws io.mockaws.auth.spi.directory.DirectoryLookupException if the principal's policies cannot be collected
     * @throws PolicyParseException if one of the principal's policies is malformed
     */
    public PermissionResult authorize(Principal principal, String action)
    {
        requireNonNull(principal, "principal is null");
        requireNonNull(action, "action is null");

        boolean permitted = false;
        for (PolicyDocument document : principal.attachedPolicies()) {
            PermissionResult result = policyEvaluator.evaluate(document, action);
            if (result == PermissionResult.DENIED) {
                log.debug("Explicit deny. Principal: %s, Action: %s", principal.identityArn(), action);
                return PermissionResult.DENIED;
            }
            if (result == PermissionResult.PERMITTED) {
                permitted = true;
            }
        }

        if (!permitted) {
            log.debug("No policy allows action. Principal: %s, Action: %s", principal.identityArn(), action);
            return PermissionResult.DENIED;
        }
        return PermissionResult.PERMITTED;
    }
}
