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
package org.tarik.ax;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.ax.adapter.AttributeInput;
import org.tarik.ax.adapter.NodeAdapter;
import org.tarik.ax.explorer.AccessExplorer;
import org.tarik.ax.model.ElementContext;
import org.tarik.ax.serialization.YamlDocumentCodec;
import org.tarik.ax.transform.CellFlattener;
import org.tarik.ax.transform.DocumentFilters;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import static java.util.Optional.empty;
import static org.tarik.ax.utils.CommonUtils.isBlank;

/**
 * Entry points for callers which work with plain values: context names instead of {@link ElementContext} constants, tagged
 * attribute values and YAML text. None of the methods throws, failures are logged and reported as {@code null} or
 * {@code false}.
 */
public final class Explorers {
    private static final Logger LOG = LoggerFactory.getLogger(Explorers.class);
    private static final CellFlattener CELL_FLATTENER = new CellFlattener();

    private Explorers() {
    }

    @Nullable
    public static <R> AccessExplorer<R> createExplorer(@Nullable NodeAdapter<R> adapter, @Nullable String applicationName) {
        if (adapter == null) {
            LOG.error("Node adapter must be provided in order to create an explorer");
            return null;
        }
        return AccessExplorer.create(adapter, applicationName).orElse(null);
    }

    @Nullable
    public static String snapshot(@Nullable AccessExplorer<?> explorer, @Nullable String contextName, int maxDepth) {
        return withContext(explorer, contextName)
                .flatMap(context -> explorer.snapshot(context, maxDepth))
                .orElse(null);
    }

    @Nullable
    public static String snapshotAt(@Nullable AccessExplorer<?> explorer, double x, double y, int maxDepth) {
        if (explorer == null) {
            LOG.error("Explorer must be provided");
            return null;
        }
        return explorer.snapshotAt(x, y, maxDepth).orElse(null);
    }

    @Nullable
    public static String resolveAndSnapshot(@Nullable AccessExplorer<?> explorer, @Nullable String contextName, int id,
                                            int maxDepth) {
        return withContext(explorer, contextName)
                .flatMap(context -> explorer.resolveAndSnapshot(context, id, maxDepth))
                .orElse(null);
    }

    public static boolean performAction(@Nullable AccessExplorer<?> explorer, @Nullable String contextName, int id,
                                        @Nullable String actionName) {
        if (isBlank(actionName)) {
            LOG.error("Action name must be provided");
            return false;
        }
        return withContext(explorer, contextName)
                .map(context -> explorer.performAction(context, id, actionName))
                .orElse(false);
    }

    /**
     * Writes a value into an element attribute. The type tag ({@code String}, {@code Bool}, {@code Number} or {@code List}) tells
     * how the value must be interpreted, a value which doesn't match its tag isn't written.
     */
    public static boolean setAttribute(@Nullable AccessExplorer<?> explorer, @Nullable String contextName, int id,
                                       @Nullable String attributeName, @Nullable Object value, @Nullable String typeTag) {
        if (isBlank(attributeName)) {
            LOG.error("Attribute name must be provided");
            return false;
        }
        var input = AttributeInput.fromTagged(value, typeTag);
        if (input.isEmpty()) {
            LOG.error("Value '{}' can't be interpreted as '{}'", value, typeTag);
            return false;
        }
        return withContext(explorer, contextName)
                .map(context -> explorer.setAttribute(context, id, attributeName, input.get()))
                .orElse(false);
    }

    public static boolean isAttributeSettable(@Nullable AccessExplorer<?> explorer, @Nullable String contextName, int id,
                                              @Nullable String attributeName) {
        if (isBlank(attributeName)) {
            LOG.error("Attribute name must be provided");
            return false;
        }
        return withContext(explorer, contextName)
                .map(context -> explorer.isAttributeSettable(context, id, attributeName))
                .orElse(false);
    }

    @Nullable
    public static String filterByKeys(@Nullable String yaml, @Nullable Collection<String> keys) {
        List<String> keysToRemove = keys == null ? List.of() : keys.stream().filter(Objects::nonNull).toList();
        return transform(yaml, document -> DocumentFilters.removeKeys(document, keysToRemove));
    }

    @Nullable
    public static String filterMatchingNodes(@Nullable String yaml, @Nullable String key, @Nullable Object value) {
        if (isBlank(key)) {
            LOG.error("Key of the nodes to remove must be provided");
            return null;
        }
        return transform(yaml, document -> DocumentFilters.removeMatchingNodes(document, key, value));
    }

    @Nullable
    public static String applyDomainPostProcessor(@Nullable String yaml) {
        return transform(yaml, CELL_FLATTENER::flatten);
    }

    @Nullable
    public static String compactCells(@Nullable String yaml) {
        return transform(yaml, CELL_FLATTENER::compactCells);
    }

    public static void destroyExplorer(@Nullable AccessExplorer<?> explorer) {
        if (explorer != null) {
            explorer.close();
        }
    }

    private static String transform(String yaml, Function<Map<String, Object>, Map<String, Object>> transformation) {
        return YamlDocumentCodec.parse(yaml)
                .map(transformation)
                .flatMap(YamlDocumentCodec::toYaml)
                .orElse(null);
    }

    private static Optional<ElementContext> withContext(AccessExplorer<?> explorer, String contextName) {
        if (explorer == null) {
            LOG.error("Explorer must be provided");
            return empty();
        }
        var context = ElementContext.fromName(contextName);
        if (context.isEmpty()) {
            LOG.error("Unknown element context '{}'", contextName);
        }
        return context;
    }
}
