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

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * One captured element: its ID inside the snapshot, the normalized attributes in insertion order, and the captured children in
 * adapter order. Instances are immutable.
 */
public record DocumentNode(int id, @NotNull Map<String, AttributeValue> attributes, @NotNull List<DocumentNode> children) {
    public static final String ATTRIBUTES_KEY = "attributes";
    public static final String CHILDREN_KEY = "children";
    private static final String ELEMENT_KEY_PREFIX = "element";

    public DocumentNode {
        checkArgument(id > 0, "Element ID must be positive, got %s", id);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(attributes)));
        children = List.copyOf(requireNonNull(children));
    }

    public static String keyOf(int id) {
        return ELEMENT_KEY_PREFIX + id;
    }

    public String key() {
        return keyOf(id);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Renders this node as the single-entry mapping {@code {element<ID>: {attributes: ..., children: ...}}}.
     */
    public Map<String, Object> toPlainDocument() {
        var result = new LinkedHashMap<String, Object>();
        result.put(key(), toPlainBody());
        return result;
    }

    private Map<String, Object> toPlainBody() {
        var body = new LinkedHashMap<String, Object>();
        var plainAttributes = new LinkedHashMap<String, Object>();
        attributes.forEach((name, value) -> plainAttributes.put(name, value.toPlainValue()));
        body.put(ATTRIBUTES_KEY, plainAttributes);
        if (hasChildren()) {
            var plainChildren = new LinkedHashMap<String, Object>();
            children.forEach(child -> plainChildren.put(child.key(), child.toPlainBody()));
            body.put(CHILDREN_KEY, plainChildren);
        }
        return body;
    }
}
