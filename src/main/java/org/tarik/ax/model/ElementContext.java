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
package org.tarik.ax.model;

import java.util.Optional;

import static java.util.Arrays.stream;

/**
 * Namespace under which the handle table of one snapshot is kept. Each snapshot writes exactly one context.
 */
public enum ElementContext {
    APPLICATION("App"),
    MAIN_WINDOW("Main"),
    FOCUSED_WINDOW("Focus"),
    MENU_BAR("Menu"),
    QUERY_RESULT("Query");

    private final String shortName;

    ElementContext(String shortName) {
        this.shortName = shortName;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * Accepts either the short name ("Main") or the constant name ("MAIN_WINDOW"), case-insensitively.
     */
    public static Optional<ElementContext> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        var trimmed = name.trim();
        return stream(values())
                .filter(context -> context.shortName.equalsIgnoreCase(trimmed) || context.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
