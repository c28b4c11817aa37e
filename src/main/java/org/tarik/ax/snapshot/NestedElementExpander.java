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
package org.tarik.ax.snapshot;

import org.jetbrains.annotations.NotNull;
import org.tarik.ax.model.DocumentNode;

import java.util.Optional;

/**
 * Expands an element referenced from an attribute value within the traversal that is currently running, sharing its ID counter
 * and visited set.
 */
@FunctionalInterface
public interface NestedElementExpander<R> {

    /**
     * Returns empty if the element was already captured in this traversal or lies deeper than the depth limit.
     */
    Optional<DocumentNode> expand(@NotNull R element, int depth);
}
