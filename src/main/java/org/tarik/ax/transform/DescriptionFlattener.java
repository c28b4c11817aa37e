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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static java.util.Locale.ROOT;
import static java.util.stream.Collectors.joining;
import static org.tarik.ax.model.AttributeNames.*;

/**
 * Folds the descriptive attributes of an element into one short lower-case phrase.
 */
public final class DescriptionFlattener {
    static final Pattern PUNCTUATION = Pattern.compile("\\p{P}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> DESCRIPTIVE_ATTRIBUTES = List.of(ROLE, ROLE_DESCRIPTION, TITLE, HELP, IDENTIFIER, LABEL);

    private DescriptionFlattener() {
    }

    /**
     * Removes role, role description, title, help, identifier and label from the given attributes and returns their words joined
     * by spaces, without punctuation, lower-cased and without repeated words.
     */
    public static String flattenedDescription(@NotNull Map<String, Object> attributes) {
        List<String> parts = new ArrayList<>();
        for (String name : DESCRIPTIVE_ATTRIBUTES) {
            var value = attributes.remove(name);
            if (value instanceof String text) {
                parts.add(text);
            }
        }

        var cleaned = PUNCTUATION.matcher(String.join(" ", parts)).replaceAll("").toLowerCase(ROOT);
        Set<String> words = new LinkedHashSet<>();
        for (String word : WHITESPACE.split(cleaned)) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words.stream().collect(joining(" "));
    }
}
