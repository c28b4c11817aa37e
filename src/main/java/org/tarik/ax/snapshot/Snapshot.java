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
import org.tarik.ax.handles.HandleTable;
import org.tarik.ax.model.DocumentNode;

import static java.util.Objects.requireNonNull;

/**
 * Result of one traversal: the captured document and the table resolving its element IDs to live references.
 */
public record Snapshot<R>(@NotNull DocumentNode document, @NotNull HandleTable<R> handles) {
    public Snapshot {
        requireNonNull(document);
        requireNonNull(handles);
    }
}
