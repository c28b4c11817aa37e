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
package org.tarik.ax.adapter;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * Bridge to an external accessibility graph. Implementations hand out opaque references of type {@code R} which must be
 * comparable by {@code equals}/{@code hashCode}; the explorer only borrows them and never assumes they stay valid.
 * <p>
 * Any method may throw a {@link RuntimeException} when the underlying element is gone, callers treat this as "no value".
 *
 * @param <R> native element reference type
 */
public interface NodeAdapter<R> {

    Optional<R> findApplication(@NotNull String applicationName);

    /**
     * Names of all attributes the element reports, in the adapter's own order.
     */
    List<String> attributeNames(@NotNull R element);

    /**
     * Raw value of the attribute, or empty if the element has no such attribute or it has no value right now.
     */
    Optional<Object> attributeValue(@NotNull R element, @NotNull String attributeName);

    /**
     * Children in keyboard navigation order. Empty when the element doesn't expose this ordering.
     */
    default List<R> navigationOrderedChildren(@NotNull R element) {
        return List.of();
    }

    Optional<List<R>> children(@NotNull R element);

    List<String> actionNames(@NotNull R element);

    /**
     * Returns the value as an element reference if it is one, which lets attribute values point to other elements.
     */
    Optional<R> asReference(@NotNull Object value);

    boolean performAction(@NotNull R element, @NotNull String actionName);

    boolean setAttributeValue(@NotNull R element, @NotNull String attributeName, @NotNull AttributeInput value);

    boolean isAttributeSettable(@NotNull R element, @NotNull String attributeName);

    Optional<R> elementAtPosition(@NotNull R application, double x, double y);

    Optional<R> mainWindow(@NotNull R application);

    Optional<R> focusedWindow(@NotNull R application);

    Optional<R> menuBar(@NotNull R application);
}
