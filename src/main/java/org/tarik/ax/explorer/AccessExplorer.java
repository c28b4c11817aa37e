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
package org.tarik.ax.explorer;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.ax.ExplorerConfig;
import org.tarik.ax.adapter.AttributeInput;
import org.tarik.ax.adapter.NodeAdapter;
import org.tarik.ax.handles.ContextStore;
import org.tarik.ax.model.DocumentNode;
import org.tarik.ax.model.ElementContext;
import org.tarik.ax.serialization.YamlDocumentCodec;
import org.tarik.ax.snapshot.Snapshot;
import org.tarik.ax.snapshot.TraversalEngine;

import java.awt.*;
import java.awt.geom.Dimension2D;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.Optional;
import java.util.function.Supplier;

import static java.util.Optional.empty;
import static org.tarik.ax.model.AttributeNames.*;
import static org.tarik.ax.model.ElementContext.*;
import static org.tarik.ax.utils.CommonUtils.isBlank;

/**
 * Exploration session bound to one application. It captures snapshots of the application's element graph, remembers the IDs
 * handed out by the latest snapshot of each {@link ElementContext}, and lets callers act on elements using those IDs.
 * <p>
 * A session isn't thread-safe. Once closed, all of its IDs become unresolvable while the application itself stays untouched.
 *
 * @param <R> native element reference type of the adapter
 */
public class AccessExplorer<R> implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AccessExplorer.class);

    private final NodeAdapter<R> adapter;
    private final R application;
    private final String applicationName;
    private final TraversalEngine<R> traversalEngine;
    private final ContextStore<R> contextStore = new ContextStore<>();
    private boolean closed;

    AccessExplorer(@NotNull NodeAdapter<R> adapter, @NotNull String applicationName, @NotNull R application) {
        this.adapter = adapter;
        this.applicationName = applicationName;
        this.application = application;
        this.traversalEngine = new TraversalEngine<>(adapter);
    }

    public static <R> Optional<AccessExplorer<R>> create(@NotNull NodeAdapter<R> adapter, String applicationName) {
        if (isBlank(applicationName)) {
            LOG.error("Application name must be provided in order to explore it");
            return empty();
        }
        Optional<R> application = safely(() -> adapter.findApplication(applicationName), "searching for the application")
                .flatMap(found -> found);
        if (application.isEmpty()) {
            LOG.error("Couldn't find any running application named '{}'", applicationName);
            return empty();
        }
        LOG.info("Started exploring application '{}'", applicationName);
        return Optional.of(new AccessExplorer<>(adapter, applicationName, application.get()));
    }

    public Optional<String> snapshotApplication() {
        return snapshot(APPLICATION, ExplorerConfig.getDefaultMaxDepth());
    }

    public Optional<String> snapshotMainWindow() {
        return snapshot(MAIN_WINDOW, ExplorerConfig.getDefaultMaxDepth());
    }

    public Optional<String> snapshotFocusedWindow() {
        return snapshot(FOCUSED_WINDOW, ExplorerConfig.getDefaultMaxDepth());
    }

    public Optional<String> snapshotMenuBar() {
        return snapshot(MENU_BAR, ExplorerConfig.getDefaultMaxDepth());
    }

    /**
     * Captures the element graph under the root of the given context and returns it as YAML. The IDs of the captured elements
     * replace the ones stored for this context before, unless the snapshot can't be rendered.
     */
    public Optional<String> snapshot(@NotNull ElementContext context, int maxDepth) {
        if (!isUsable(maxDepth)) {
            return empty();
        }
        return rootOf(context).flatMap(root -> captureAsYaml(context, root, maxDepth));
    }

    public Optional<DocumentNode> captureSnapshot(@NotNull ElementContext context, int maxDepth) {
        if (!isUsable(maxDepth)) {
            return empty();
        }
        return rootOf(context).map(root -> {
            var snapshot = traversalEngine.snapshot(root, maxDepth);
            store(context, snapshot);
            return snapshot.document();
        });
    }

    /**
     * Captures the element located at the given screen point. The result is stored under {@link ElementContext#QUERY_RESULT}.
     */
    public Optional<String> snapshotAt(double x, double y, int maxDepth) {
        if (!isUsable(maxDepth)) {
            return empty();
        }
        var element = safely(() -> adapter.elementAtPosition(application, x, y), "searching for the element at position")
                .flatMap(found -> found);
        if (element.isEmpty()) {
            LOG.warn("No element found at position ({}, {}) in application '{}'", x, y, applicationName);
            return empty();
        }
        return captureAsYaml(QUERY_RESULT, element.get(), maxDepth);
    }

    /**
     * Captures the subtree of an element from an earlier snapshot. The result is stored under
     * {@link ElementContext#QUERY_RESULT}, so a lookup in that context and a new capture may be chained.
     */
    public Optional<String> resolveAndSnapshot(@NotNull ElementContext context, int id, int maxDepth) {
        if (!isUsable(maxDepth)) {
            return empty();
        }
        return resolve(context, id).flatMap(element -> captureAsYaml(QUERY_RESULT, element, maxDepth));
    }

    public Optional<R> resolve(@NotNull ElementContext context, int id) {
        if (closed) {
            LOG.warn("Explorer of application '{}' is already closed, can't resolve element {}", applicationName, id);
            return empty();
        }
        var element = contextStore.resolve(context, id);
        if (element.isEmpty()) {
            LOG.warn("Element with ID {} is not known in context {}", id, context);
        }
        return element;
    }

    public boolean performAction(@NotNull ElementContext context, int id, @NotNull String actionName) {
        return resolve(context, id)
                .flatMap(element -> safely(() -> adapter.performAction(element, actionName), "performing action '%s'"
                        .formatted(actionName)))
                .orElse(false);
    }

    public boolean setAttribute(@NotNull ElementContext context, int id, @NotNull String attributeName,
                                @NotNull AttributeInput value) {
        return resolve(context, id)
                .flatMap(element -> safely(() -> adapter.setAttributeValue(element, attributeName, value),
                        "setting attribute '%s'".formatted(attributeName)))
                .orElse(false);
    }

    public boolean isAttributeSettable(@NotNull ElementContext context, int id, @NotNull String attributeName) {
        return resolve(context, id)
                .flatMap(element -> safely(() -> adapter.isAttributeSettable(element, attributeName),
                        "checking if attribute '%s' is settable".formatted(attributeName)))
                .orElse(false);
    }

    /**
     * Returns the screen point of an element, derived from its position and size if both are known, or otherwise from its frame.
     */
    public Optional<Point> locateElement(@NotNull ElementContext context, int id, @NotNull ElementAnchor anchor) {
        return resolve(context, id)
                .flatMap(this::getBounds)
                .map(bounds -> switch (anchor) {
                    case CENTER -> new Point((int) Math.round(bounds.getCenterX()), (int) Math.round(bounds.getCenterY()));
                    case BOTTOM_RIGHT -> new Point((int) Math.round(bounds.getMaxX()), (int) Math.round(bounds.getMaxY()));
                });
    }

    public String getApplicationName() {
        return applicationName;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            contextStore.clear();
            closed = true;
            LOG.info("Stopped exploring application '{}'", applicationName);
        }
    }

    // IDs are stored only if the caller actually receives them
    private Optional<String> captureAsYaml(ElementContext context, R root, int maxDepth) {
        var snapshot = traversalEngine.snapshot(root, maxDepth);
        var yaml = YamlDocumentCodec.toYaml(snapshot.document());
        if (yaml.isPresent()) {
            store(context, snapshot);
        } else {
            LOG.warn("Snapshot of context {} couldn't be rendered, keeping the previously stored IDs", context);
        }
        return yaml;
    }

    private void store(ElementContext context, Snapshot<R> snapshot) {
        contextStore.store(context, snapshot.handles());
        LOG.debug("Stored {} element IDs under context {}", snapshot.handles().size(), context);
    }

    private Optional<R> rootOf(ElementContext context) {
        Optional<Optional<R>> root = switch (context) {
            case APPLICATION -> Optional.of(Optional.of(application));
            case MAIN_WINDOW -> safely(() -> adapter.mainWindow(application), "searching for the main window");
            case FOCUSED_WINDOW -> safely(() -> adapter.focusedWindow(application), "searching for the focused window");
            case MENU_BAR -> safely(() -> adapter.menuBar(application), "searching for the menu bar");
            case QUERY_RESULT -> empty();
        };
        var element = root.flatMap(found -> found);
        if (element.isEmpty()) {
            LOG.warn("Application '{}' has no root element for context {}", applicationName, context);
        }
        return element;
    }

    private Optional<Rectangle2D> getBounds(R element) {
        var position = readAttribute(element, POSITION);
        var size = readAttribute(element, SIZE);
        if (position.orElse(null) instanceof Point2D point && size.orElse(null) instanceof Dimension2D dimension) {
            return Optional.of(new Rectangle2D.Double(point.getX(), point.getY(), dimension.getWidth(), dimension.getHeight()));
        }
        for (String attributeName : new String[]{FRAME, RECT_IN_PARENT_SPACE}) {
            if (readAttribute(element, attributeName).orElse(null) instanceof Rectangle2D rectangle) {
                return Optional.of(rectangle);
            }
        }
        LOG.warn("Element of application '{}' exposes neither position and size nor frame", applicationName);
        return empty();
    }

    private Optional<Object> readAttribute(R element, String attributeName) {
        return safely(() -> adapter.attributeValue(element, attributeName), "reading attribute '%s'".formatted(attributeName))
                .flatMap(value -> value);
    }

    private boolean isUsable(int maxDepth) {
        if (closed) {
            LOG.warn("Explorer of application '{}' is already closed", applicationName);
            return false;
        }
        if (maxDepth < 0) {
            LOG.warn("Max depth can't be negative, got {}", maxDepth);
            return false;
        }
        return true;
    }

    private static <T> Optional<T> safely(Supplier<T> action, String description) {
        try {
            return Optional.ofNullable(action.get());
        } catch (RuntimeException e) {
            LOG.error("Failure while {}", description, e);
            return empty();
        }
    }
}
