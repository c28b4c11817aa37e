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
import org.tarik.ax.ExplorerConfig;

import java.util.*;

import static java.util.Objects.requireNonNull;
import static org.tarik.ax.model.AttributeNames.*;
import static org.tarik.ax.model.DocumentNode.ATTRIBUTES_KEY;
import static org.tarik.ax.model.DocumentNode.CHILDREN_KEY;
import static org.tarik.ax.transform.DescriptionFlattener.PUNCTUATION;

/**
 * Post-processor for spreadsheet-like documents. Each table cell, which the accessibility tree exposes as a small subtree of
 * groups and text areas, is collapsed into a single node carrying only its name and value. Afterwards the remaining nodes are
 * stripped of attributes which repeat what their role description already says.
 */
public class CellFlattener {
    public static final String CELL_KEY = "cell";
    static final String CELL_ROLE = "Cell";
    static final String CELL_ROLE_DESCRIPTION = "cell";
    static final String TEXT_ENTRY_AREA_ROLE_DESCRIPTION = "text entry area";

    private final String helpBoilerplate;
    private final String ignoredAction;
    private final List<String> compactExcludedKeys;

    public CellFlattener() {
        this(ExplorerConfig.getHelpBoilerplate(), ExplorerConfig.getIgnoredAction(), ExplorerConfig.getCompactExcludedKeys());
    }

    public CellFlattener(@NotNull String helpBoilerplate, @NotNull String ignoredAction, @NotNull List<String> compactExcludedKeys) {
        this.helpBoilerplate = requireNonNull(helpBoilerplate);
        this.ignoredAction = requireNonNull(ignoredAction);
        this.compactExcludedKeys = List.copyOf(compactExcludedKeys);
    }

    /**
     * Returns a flattened copy of the document, the input stays untouched.
     */
    public Map<String, Object> flatten(@NotNull Map<String, ?> document) {
        requireNonNull(document);
        var copy = DocumentFilters.removeKeys(document, List.of());
        flattenCells(copy, false);
        simplifyElements(copy);
        return copy;
    }

    /**
     * Same as {@link #flatten(Map)}, but drops the geometry and other noisy keys beforehand.
     */
    public Map<String, Object> compactCells(@NotNull Map<String, ?> document) {
        requireNonNull(document);
        var copy = DocumentFilters.removeKeys(document, compactExcludedKeys);
        flattenCells(copy, false);
        simplifyElements(copy);
        return copy;
    }

    private void flattenCells(Map<String, Object> node, boolean insideCell) {
        var attributes = asMutableMap(node.get(ATTRIBUTES_KEY));
        if (attributes != null && (insideCell || isCell(attributes))) {
            if (node.get(CHILDREN_KEY) instanceof Map<?, ?> children) {
                for (Object child : children.values()) {
                    var childNode = asMutableMap(child);
                    if (childNode != null) {
                        flattenCells(childNode, true);
                        mergeInto(attributes, asMutableMap(childNode.get(ATTRIBUTES_KEY)));
                    }
                }
            }
            node.put(ATTRIBUTES_KEY, attributes);

            if (!insideCell) {
                var description = attributes.get(DESCRIPTION) instanceof String text ? text : "";
                var cellName = PUNCTUATION.matcher(description).replaceAll("").trim();
                node.remove(ATTRIBUTES_KEY);
                node.remove(ROLE_DESCRIPTION);
                node.put(CELL_KEY, cellName);
                if (attributes.containsKey(VALUE)) {
                    node.put(VALUE, attributes.get(VALUE));
                }
            }
            node.remove(CHILDREN_KEY);
        } else {
            for (Map.Entry<String, Object> entry : node.entrySet()) {
                if (entry.getValue() instanceof Map<?, ?>) {
                    flattenCells(asMutableMap(entry.getValue()), false);
                } else if (entry.getValue() instanceof List<?> list) {
                    for (Object item : list) {
                        var nested = asMutableMap(item);
                        if (nested != null) {
                            flattenCells(nested, false);
                        }
                    }
                }
            }
        }
    }

    private static void mergeInto(Map<String, Object> target, Map<String, Object> source) {
        if (source == null) {
            return;
        }
        if (source.get(DESCRIPTION) instanceof String description) {
            target.put(DESCRIPTION, description);
        }
        if (source.get(ROLE_DESCRIPTION) instanceof String roleDescription) {
            target.put(ROLE_DESCRIPTION,
                    TEXT_ENTRY_AREA_ROLE_DESCRIPTION.equals(roleDescription) ? CELL_ROLE_DESCRIPTION : roleDescription);
        }
        if (source.containsKey(VALUE) && source.get(VALUE) != null) {
            target.put(VALUE, source.get(VALUE));
        }
    }

    private void simplifyElements(Map<String, Object> node) {
        var attributes = asMutableMap(node.get(ATTRIBUTES_KEY));
        if (attributes != null && attributes.containsKey(ROLE_DESCRIPTION)) {
            attributes.remove(ROLE);
            attributes.remove(SUBROLE);
            attributes.remove(ENABLED);
            if (attributes.get(HELP) instanceof String help && isRedundantHelp(help, attributes.get(TITLE))) {
                attributes.remove(HELP);
            }
            if (attributes.get(AVAILABLE_ACTIONS) instanceof List<?> actions) {
                List<Object> remaining = new ArrayList<>(actions);
                remaining.removeIf(ignoredAction::equals);
                if (remaining.isEmpty()) {
                    attributes.remove(AVAILABLE_ACTIONS);
                } else {
                    attributes.put(AVAILABLE_ACTIONS, remaining);
                }
            }
            if (attributes.isEmpty()) {
                node.remove(ATTRIBUTES_KEY);
            } else {
                node.put(ATTRIBUTES_KEY, attributes);
            }
        }

        for (Map.Entry<String, Object> entry : node.entrySet()) {
            if (entry.getValue() instanceof Map<?, ?>) {
                simplifyElements(asMutableMap(entry.getValue()));
            } else if (entry.getValue() instanceof List<?> list) {
                for (Object item : list) {
                    var nested = asMutableMap(item);
                    if (nested != null) {
                        simplifyElements(nested);
                    }
                }
            }
        }
    }

    private boolean isRedundantHelp(String help, Object title) {
        return (title instanceof String titleText && titleText.contains(help)) || help.contains(helpBoilerplate);
    }

    private static boolean isCell(Map<String, Object> attributes) {
        return CELL_ROLE.equals(attributes.get(ROLE)) && CELL_ROLE_DESCRIPTION.equals(attributes.get(ROLE_DESCRIPTION));
    }

    // Documents passed here are always copies made by DocumentFilters, so nested mappings are mutable string-keyed maps
    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMutableMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }
}
