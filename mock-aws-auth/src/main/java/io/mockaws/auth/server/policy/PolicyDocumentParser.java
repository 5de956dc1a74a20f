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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.mockaws.auth.spi.policy.PolicySource;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Turns the JSON text of an IAM policy into a {@link PolicyDocument}. This is the only place that deals with
 * the shapes a policy can arrive in: a managed policy with versions, an inline policy, or bare JSON text.
 */
public final class PolicyDocumentParser
{
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private PolicyDocumentParser() {}

    public static PolicyDocument parse(PolicySource policySource)
    {
        requireNonNull(policySource, "policySource is null");
        return parse(policySource.effectiveDocument());
    }

    public static PolicyDocument parse(String policyJson)
    {
        requireNonNull(policyJson, "policyJson is null");

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(policyJson);
        }
        catch (JsonProcessingException e) {
            throw new PolicyParseException("Policy document is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new PolicyParseException("Policy document must be a JSON object");
        }

        JsonNode statementNode = root.get("Statement");
        if (statementNode == null) {
            throw new PolicyParseException("Policy document has no Statement");
        }

        // a single statement may be given without the enclosing array
        List<JsonNode> statementNodes = statementNode.isArray() ? ImmutableList.copyOf(statementNode) : ImmutableList.of(statementNode);

        ImmutableList.Builder<PolicyStatement> statements = ImmutableList.builder();
        for (JsonNode node : statementNodes) {
            statements.add(parseStatement(node));
        }
        return new PolicyDocument(statements.build());
    }

    private static PolicyStatement parseStatement(JsonNode node)
    {
        if (!node.isObject()) {
            throw new PolicyParseException("Statement must be a JSON object: " + node);
        }

        Effect effect = Optional.ofNullable(node.get("Effect"))
                .filter(JsonNode::isTextual)
                .flatMap(effectNode -> Effect.fromJsonValue(effectNode.asText()))
                .orElseThrow(() -> new PolicyParseException("Statement Effect must be \"Allow\" or \"Deny\": " + node));

        JsonNode notAction = node.get("NotAction");
        ActionMatcher actionMatcher;
        if (notAction != null) {
            actionMatcher = new ActionMatcher(ActionMatcher.Kind.NOT_ACTION, patterns(notAction, "NotAction"));
        }
        else {
            JsonNode action = node.get("Action");
            if (action == null) {
                throw new PolicyParseException("Statement has neither Action nor NotAction: " + node);
            }
            actionMatcher = new ActionMatcher(ActionMatcher.Kind.ACTION, patterns(action, "Action"));
        }

        Optional<String> sid = Optional.ofNullable(node.get("Sid")).map(JsonNode::asText);
        return new PolicyStatement(sid, effect, actionMatcher);
    }

    private static Set<String> patterns(JsonNode node, String elementName)
    {
        if (node.isTextual()) {
            return ImmutableSet.of(node.asText());
        }
        if (node.isArray() && !node.isEmpty()) {
            ImmutableSet.Builder<String> patterns = ImmutableSet.builder();
            for (JsonNode element : node) {
                if (!element.isTextual()) {
                    throw new PolicyParseException("%s entries must be strings: %s".formatted(elementName, node));
                }
                patterns.add(element.asText());
            }
            return patterns.build();
        }
        throw new PolicyParseException("%s must be a string or a non-empty array of strings: %s".formatted(elementName, node));
    }
}
