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

import java.util.List;
import java.util.Set;

public final class AttributeNames {
    public static final String TITLE = "title";
    public static final String LABEL = "label";
    public static final String ROLE = "role";
    public static final String SUBROLE = "subrole";
    public static final String ROLE_DESCRIPTION = "roleDescription";
    public static final String DESCRIPTION = "description";
    public static final String VALUE = "value";
    public static final String HELP = "help";
    public static final String IDENTIFIER = "identifier";
    public static final String ENABLED = "enabled";
    public static final String FOCUSED = "focused";
    public static final String SELECTED = "selected";
    public static final String POSITION = "position";
    public static final String SIZE = "size";
    public static final String FRAME = "frame";
    public static final String RECT_IN_PARENT_SPACE = "rectInParentSpace";
    public static final String SELECTED_TEXT_RANGE = "selectedTextRange";
    public static final String NUMBER_OF_CHARACTERS = "numberOfCharacters";

    public static final String CHILDREN = "children";
    public static final String VISIBLE_CHILDREN = "visibleChildren";
    public static final String CHILDREN_IN_NAVIGATION_ORDER = "childrenInNavigationOrder";
    public static final String SELECTED_CHILDREN = "selectedChildren";
    public static final String PARENT = "parent";
    public static final String TOP_LEVEL_UI_ELEMENT = "topLevelUIElement";

    public static final String AVAILABLE_ACTIONS = "availableActions";

    // Always fetched first, in this order, whether reported by the adapter or not
    public static final List<String> MANDATORY_ATTRIBUTES = List.of(TITLE, LABEL, ROLE, SUBROLE, DESCRIPTION, VALUE, HELP);

    // Structural links are never read as attributes, the traversal derives structure itself
    public static final Set<String> STRUCTURAL_ATTRIBUTES = Set.of(CHILDREN, VISIBLE_CHILDREN, CHILDREN_IN_NAVIGATION_ORDER,
            SELECTED_CHILDREN, PARENT, TOP_LEVEL_UI_ELEMENT);

    private AttributeNames() {
    }
}
