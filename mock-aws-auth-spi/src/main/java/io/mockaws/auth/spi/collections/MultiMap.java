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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Headers or request parameters: each key may carry several values.
 * A case-insensitive map stores its keys lowercased, so lookups by any casing succeed.
 */
public interface MultiMap
{
    boolean isCaseSensitiveKeys();

    Set<String> keySet();

    Set<Map.Entry<String, List<String>>> entrySet();

    /**
     * All values for {@code key}, empty if the key is absent
     *
     * @throws NullPointerException if key is null
     */
    List<String> get(String key);

    Optional<String> getFirst(String key);

    void forEach(BiConsumer<String, List<String>> consumer);

    boolean containsKey(String key);
}
