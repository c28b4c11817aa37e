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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.ax.adapter.NodeAdapter;
import org.tarik.ax.handles.HandleTable;
import org.tarik.ax.model.DocumentNode;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Optional.empty;

/**
 * Walks the element graph starting at a root, depth-first, and captures every reachable element at most once. Each captured
 * element gets an ID (starting with 1 for every snapshot) which is registered in the handle table of the resulting
 * {@link Snapshot}. Elements which were already captured or lie deeper than the requested depth are silently left out.
 */
public class TraversalEngine<R> {
    private static final Logger LOG = LoggerFactory.getLogger(TraversalEngine.class);

    private final NodeAdapter<R> adapter;
    private final AttributeNormalizer<R> normalizer;

    public TraversalEngine(@NotNull NodeAdapter<R> adapter) {
        this(adapter, new AttributeNormalizer<>(adapter));
    }

    TraversalEngine(@NotNull NodeAdapter<R> adapter, @NotNull AttributeNormalizer<R> normalizer) {
        this.adapter = adapter;
        this.normalizer = normalizer;
    }

    public Snapshot<R> snapshot(@NotNull R root, int maxDepth) {
        checkNotNull(root, "Root element must be provided");
        checkArgument(maxDepth >= 0, "Max depth can't be negative, got %s", maxDepth);

        var start = Instant.now();
        var traversal = new Traversal(maxDepth);
        var document = traversal.expand(root, 0)
                .orElseThrow(() -> new IllegalStateException("Root element couldn't be captured"));
        LOG.debug("Captured {} elements up to depth {} in {} ms", traversal.handlesById.size(), maxDepth,
                Duration.between(start, Instant.now()).toMillis());
        return new Snapshot<>(document, HandleTable.of(traversal.handlesById));
    }

    private List<R> childrenOf(R element) {
        List<R> children = List.of();
        try {
            children = adapter.navigationOrderedChildren(element);
            if (children == null || children.isEmpty()) {
                children = adapter.children(element).orElse(List.of());
            }
        } catch (RuntimeException e) {
            LOG.debug("Couldn't read children of the element, treating it as a leaf: {}", e.getMessage());
        }
        return children == null ? List.of() : children;
    }

    private class Traversal implements NestedElementExpander<R> {
        private final int maxDepth;
        private final Set<R> visited = new HashSet<>();
        private final Map<Integer, R> handlesById = new LinkedHashMap<>();
        private int nextId = 1;

        private Traversal(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        @Override
        public Optional<DocumentNode> expand(@NotNull R element, int depth) {
            if (depth > maxDepth || !visited.add(element)) {
                return empty();
            }

            int id = nextId++;
            handlesById.put(id, element);
            var attributes = normalizer.normalize(element, depth, this);
            List<DocumentNode> children = new ArrayList<>();
            for (R child : childrenOf(element)) {
                if (child != null) {
                    expand(child, depth + 1).ifPresent(children::add);
                }
            }
            return Optional.of(new DocumentNode(id, attributes, children));
        }
    }
}
