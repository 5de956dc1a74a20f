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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * The {@code Action} or {@code NotAction} element of a statement.
 * Patterns are matched against the whole action, case-sensitively; {@code *} matches any run of characters
 * and every other character stands for itself.
 */
public final class ActionMatcher
{
    public enum Kind
    {
        ACTION,
        NOT_ACTION,
    }

    private final Kind kind;
    private final Set<String> patterns;
    private final List<Pattern> compiledPatterns;

    public ActionMatcher(Kind kind, Set<String> patterns)
    {
        this.kind = requireNonNull(kind, "kind is null");
        this.patterns = ImmutableSet.copyOf(patterns);
        checkArgument(!this.patterns.isEmpty(), "patterns is empty");
        this.compiledPatterns = this.patterns.stream()
                .map(ActionMatcher::toRegex)
                .collect(toImmutableList());
    }

    public static ActionMatcher action(String... patterns)
    {
        return new ActionMatcher(Kind.ACTION, ImmutableSet.copyOf(patterns));
    }

    public static ActionMatcher notAction(String... patterns)
    {
        return new ActionMatcher(Kind.NOT_ACTION, ImmutableSet.copyOf(patterns));
    }

    public Kind kind()
    {
        return kind;
    }

    public Set<String> patterns()
    {
        return patterns;
    }

    /**
     * Whether a statement using this matcher applies to {@code action}
     */
    public boolean concerns(String action)
    {
        boolean anyMatch = matchesAny(action);
        return switch (kind) {
            case ACTION -> anyMatch;
            case NOT_ACTION -> !anyMatch;
        };
    }

    public boolean matchesAny(String action)
    {
        requireNonNull(action, "action is null");
        return compiledPatterns.stream().anyMatch(pattern -> pattern.matcher(action).matches());
    }

    static Pattern toRegex(String glob)
    {
        List<String> literals = ImmutableList.copyOf(Splitter.on('*').split(glob));
        return Pattern.compile(literals.stream()
                .map(literal -> literal.isEmpty() ? "" : Pattern.quote(literal))
                .collect(joining(".*")), Pattern.DOTALL);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActionMatcher that)) {
            return false;
        }
        return kind == that.kind && patterns.equals(that.patterns);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, patterns);
    }

    @Override
    public String toString()
    {
        return kind + patterns.toString();
    }
}
