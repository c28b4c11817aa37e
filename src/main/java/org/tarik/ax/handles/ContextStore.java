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

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.ax.model.ElementContext;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Keeps the handle table of the latest snapshot per {@link ElementContext}. Storing a table replaces the previous one of the same
 * context as a whole, so only IDs of the latest snapshot are guaranteed to resolve. IDs of an older snapshot aren't detected as
 * stale: they either resolve to nothing or to whatever element carries the same ID in the newer snapshot.
 * <p>
 * Not thread-safe.
 */
public class ContextStore<R> {
    private static final Logger LOG = LoggerFactory.getLogger(ContextStore.class);
    private final Map<ElementContext, HandleTable<R>> tables = new EnumMap<>(ElementContext.class);

    public void store(@NotNull ElementContext context, @NotNull HandleTable<R> table) {
        requireNonNull(context);
        requireNonNull(table);
        var previous = tables.put(context, table);
        if (previous != null) {
            LOG.debug("Replaced {} handles of context {} with {} new ones", previous.size(), context, table.size());
        }
    }

    public Optional<R> resolve(@NotNull ElementContext context, int id) {
        return table(context).resolve(id);
    }

    public HandleTable<R> table(@NotNull ElementContext context) {
        return tables.getOrDefault(context, HandleTable.empty());
    }

    public void clear() {
        tables.clear();
    }
}
