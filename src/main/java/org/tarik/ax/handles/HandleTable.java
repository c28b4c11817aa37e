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
package org.tarik.ax.handles;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Optional.ofNullable;

/**
 * Immutable mapping from the element IDs of one snapshot to the references they were captured from.
 */
public final class HandleTable<R> {
    private static final HandleTable<?> EMPTY = new HandleTable<>(ImmutableMap.of());

    private final ImmutableMap<Integer, R> handlesById;

    private HandleTable(ImmutableMap<Integer, R> handlesById) {
        this.handlesById = handlesById;
    }

    public static <R> HandleTable<R> of(@NotNull Map<Integer, R> handlesById) {
        return new HandleTable<>(ImmutableMap.copyOf(handlesById));
    }

    @SuppressWarnings("unchecked")
    public static <R> HandleTable<R> empty() {
        return (HandleTable<R>) EMPTY;
    }

    public Optional<R> resolve(int id) {
        return ofNullable(handlesById.get(id));
    }

    public Set<Integer> ids() {
        return handlesById.keySet();
    }

    public int size() {
        return handlesById.size();
    }

    public boolean isEmpty() {
        return handlesById.isEmpty();
    }

    @Override
    public String toString() {
        return "HandleTable{size=%d}".formatted(handlesById.size());
    }
}
