/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
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
package org.tarik.ax.transform;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static java.util.Objects.requireNonNull;
import static org.tarik.ax.model.DocumentNode.ATTRIBUTES_KEY;

/**
 * Generic filters over parsed documents (nested mappings and lists). Inputs are never modified, every filter returns a copy.
 */
public final class DocumentFilters {
    // Marks a subtree which must be dropped by its parent
    private static final Object REMOVED = new Object();

    private DocumentFilters() {
    }

    /**
     * Removes every entry with one of the given keys from every mapping of the document, at any depth. Whole nodes are never
     * removed, only the matching entries.
     */
    public static Map<String, Object> removeKeys(@NotNull Map<String, ?> document, @NotNull Collection<String> keys) {
        requireNonNull(document);
        var keysToRemove = Set.copyOf(keys);
        return copyMap(document, keysToRemove);
    }

    /**
     * Removes every node (mapping) which has the given key, either as a direct field or inside its {@code attributes} mapping.
     * If a value is provided, the node is removed only if the string forms of both values are equal. The whole subtree of a
     * matching node is dropped, as well as mappings and lists which are left empty after such removal.
     */
    public static Map<String, Object> removeMatchingNodes(@NotNull Map<String, ?> document, @NotNull String key,
                                                          @Nullable Object value) {
        requireNonNull(document);
        requireNonNull(key);
        var result = prune(document, key, value);
        if (result == REMOVED) {
            return new LinkedHashMap<>();
        }
        @SuppressWarnings("unchecked")
        var pruned = (Map<String, Object>) result;
        return pruned;
    }

    private static Object copyValue(Object value, Set<String> keysToRemove) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map, keysToRemove);
        } else if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item, keysToRemove)));
            return copy;
        } else {
            return value;
        }
    }

    private static Map<String, Object> copyMap(Map<?, ?> map, Set<String> keysToRemove) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((entryKey, entryValue) -> {
            var name = String.valueOf(entryKey);
            if (!keysToRemove.contains(name)) {
                copy.put(name, copyValue(entryValue, keysToRemove));
            }
        });
        return copy;
    }

    private static Object prune(Object node, String key, Object value) {
        if (node instanceof Map<?, ?> map) {
            if (matches(map, key, value)) {
                return REMOVED;
            }
            boolean removedAny = false;
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                var pruned = prune(entry.getValue(), key, value);
                if (pruned == REMOVED) {
                    removedAny = true;
                } else {
                    result.put(String.valueOf(entry.getKey()), pruned);
                }
            }
            return removedAny && result.isEmpty() ? REMOVED : result;
        } else if (node instanceof List<?> list) {
            boolean removedAny = false;
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                var pruned = prune(item, key, value);
                if (pruned == REMOVED) {
                    removedAny = true;
                } else {
                    result.add(pruned);
                }
            }
            return removedAny && result.isEmpty() ? REMOVED : result;
        } else {
            return node;
        }
    }

    private static boolean matches(Map<?, ?> node, String key, Object value) {
        if (fieldMatches(node, key, value)) {
            return true;
        }
        return node.get(ATTRIBUTES_KEY) instanceof Map<?, ?> attributes && fieldMatches(attributes, key, value);
    }

    private static boolean fieldMatches(Map<?, ?> node, String key, Object value) {
        if (!node.containsKey(key)) {
            return false;
        }
        return value == null || String.valueOf(node.get(key)).equals(String.valueOf(value));
    }
}
