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
package io.mockaws.auth.spi.collections;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

import static java.util.Objects.requireNonNull;

public final class ImmutableMultiMap
        implements MultiMap
{
    private final boolean caseSensitiveKeys;
    private final ImmutableListMultimap<String, String> mapData;

    private ImmutableMultiMap(ImmutableListMultimap<String, String> mapData, boolean caseSensitiveKeys)
    {
        this.mapData = requireNonNull(mapData, "mapData is null");
        this.caseSensitiveKeys = caseSensitiveKeys;
    }

    @Override
    public boolean isCaseSensitiveKeys()
    {
        return caseSensitiveKeys;
    }

    @Override
    public Set<String> keySet()
    {
        return ImmutableSet.copyOf(mapData.keySet());
    }

    @Override
    public Set<Map.Entry<String, List<String>>> entrySet()
    {
        return Multimaps.asMap(mapData).entrySet();
    }

    @Override
    public List<String> get(String key)
    {
        return mapData.get(actualKey(key, caseSensitiveKeys));
    }

    @Override
    public Optional<String> getFirst(String key)
    {
        List<String> values = get(key);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    @Override
    public void forEach(BiConsumer<String, List<String>> consumer)
    {
        Multimaps.asMap(mapData).forEach(consumer);
    }

    @Override
    public boolean containsKey(String key)
    {
        return !get(key).isEmpty();
    }

    @Override
    public String toString()
    {
        return mapData.toString();
    }

    public static ImmutableMultiMap empty()
    {
        return builder(false).build();
    }

    public static Builder builder(boolean caseSensitiveKeys)
    {
        return new Builder(caseSensitiveKeys);
    }

    public static ImmutableMultiMap copyOfCaseInsensitive(Map<String, ? extends Collection<String>> data)
    {
        Builder builder = builder(false);
        data.forEach(builder::addAll);
        return builder.build();
    }

    private static String actualKey(String key, boolean caseSensitiveKeys)
    {
        requireNonNull(key, "key is null");
        return caseSensitiveKeys ? key : key.toLowerCase(Locale.ROOT);
    }

    public static class Builder
    {
        private final ListMultimap<String, String> data = LinkedListMultimap.create();
        private final boolean caseSensitiveKeys;

        private Builder(boolean caseSensitiveKeys)
        {
            this.caseSensitiveKeys = caseSensitiveKeys;
        }

        /**
         * Replace every value already stored under {@code key} with {@code value}
         */
        public Builder putOrReplaceSingle(String key, String value)
        {
            data.replaceValues(actualKey(key, caseSensitiveKeys), ImmutableList.of(value));
            return this;
        }

        public Builder add(String key, String value)
        {
            data.put(actualKey(key, caseSensitiveKeys), value);
            return this;
        }

        public Builder addAll(String key, Collection<String> values)
        {
            data.putAll(actualKey(key, caseSensitiveKeys), values);
            return this;
        }

        public ImmutableMultiMap build()
        {
            return new ImmutableMultiMap(ImmutableListMultimap.copyOf(data), caseSensitiveKeys);
        }
    }
}
