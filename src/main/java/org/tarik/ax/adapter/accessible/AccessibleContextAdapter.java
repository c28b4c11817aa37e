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
package org.tarik.ax.adapter.accessible;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.ax.adapter.AttributeInput;
import org.tarik.ax.adapter.AttributeInput.NumberInput;
import org.tarik.ax.adapter.AttributeInput.TextInput;
import org.tarik.ax.adapter.NodeAdapter;
import org.tarik.ax.model.TextRange;

import javax.accessibility.*;
import java.awt.*;
import java.util.*;
import java.util.List;
import java.util.function.Supplier;

import static java.util.Arrays.stream;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;
import static org.tarik.ax.model.AttributeNames.*;

/**
 * {@link NodeAdapter} over the Java Accessibility API, which makes any AWT/Swing user interface running in the current JVM
 * explorable. The element reference is the {@link AccessibleContext} of a component.
 */
public class AccessibleContextAdapter implements NodeAdapter<AccessibleContext> {
    private static final Logger LOG = LoggerFactory.getLogger(AccessibleContextAdapter.class);
    private static final String VISIBLE = "visible";
    private static final String SHOWING = "showing";
    private static final String EDITABLE = "editable";
    private static final String LABELED_BY = "labeledBy";
    private static final int MAX_MENU_BAR_SEARCH_DEPTH = 10;

    private final Supplier<Collection<? extends Accessible>> applicationRootsSupplier;

    public AccessibleContextAdapter() {
        this(() -> List.of(Window.getWindows()));
    }

    public AccessibleContextAdapter(@NotNull Supplier<Collection<? extends Accessible>> applicationRootsSupplier) {
        this.applicationRootsSupplier = applicationRootsSupplier;
    }

    @Override
    public Optional<AccessibleContext> findApplication(@NotNull String applicationName) {
        return applicationRootsSupplier.get().stream()
                .filter(Objects::nonNull)
                .filter(root -> applicationName.equals(getRootTitle(root)))
                .map(Accessible::getAccessibleContext)
                .filter(Objects::nonNull)
                .findFirst();
    }

    @Override
    public List<String> attributeNames(@NotNull AccessibleContext element) {
        List<String> names = new ArrayList<>(List.of(TITLE, DESCRIPTION, ROLE, ENABLED, FOCUSED, VISIBLE, SHOWING, SELECTED,
                EDITABLE));
        if (element.getAccessibleValue() != null || element.getAccessibleEditableText() != null) {
            names.add(VALUE);
        }
        if (element.getAccessibleComponent() != null) {
            names.addAll(List.of(POSITION, SIZE, FRAME));
        }
        if (element.getAccessibleText() != null) {
            names.addAll(List.of(SELECTED_TEXT_RANGE, NUMBER_OF_CHARACTERS));
        }
        var relations = element.getAccessibleRelationSet();
        if (relations != null && relations.contains(AccessibleRelation.LABELED_BY)) {
            names.add(LABELED_BY);
        }
        names.addAll(List.of(PARENT, CHILDREN));
        return names;
    }

    @Override
    public Optional<Object> attributeValue(@NotNull AccessibleContext element, @NotNull String attributeName) {
        switch (attributeName) {
            case TITLE:
                return ofNullable(element.getAccessibleName());
            case DESCRIPTION:
                return ofNullable(element.getAccessibleDescription());
            case ROLE:
                return ofNullable(element.getAccessibleRole()).map(role -> role.toDisplayString(Locale.ENGLISH));
            case VALUE:
                return getValue(element);
            case ENABLED:
                return Optional.of(hasState(element, AccessibleState.ENABLED));
            case FOCUSED:
                return Optional.of(hasState(element, AccessibleState.FOCUSED));
            case VISIBLE:
                return Optional.of(hasState(element, AccessibleState.VISIBLE));
            case SHOWING:
                return Optional.of(hasState(element, AccessibleState.SHOWING));
            case SELECTED:
                return Optional.of(hasState(element, AccessibleState.SELECTED));
            case EDITABLE:
                return Optional.of(hasState(element, AccessibleState.EDITABLE));
            case POSITION:
                return ofNullable(element.getAccessibleComponent()).flatMap(AccessibleContextAdapter::getScreenLocation);
            case SIZE:
                return ofNullable(element.getAccessibleComponent()).map(AccessibleComponent::getSize);
            case FRAME:
                return ofNullable(element.getAccessibleComponent()).map(AccessibleComponent::getBounds);
            case SELECTED_TEXT_RANGE:
                return ofNullable(element.getAccessibleText())
                        .map(text -> new TextRange(text.getSelectionStart(), text.getSelectionEnd() - text.getSelectionStart()));
            case NUMBER_OF_CHARACTERS:
                return ofNullable(element.getAccessibleText()).map(AccessibleText::getCharCount);
            case LABELED_BY:
                return getLabeledBy(element);
            case PARENT:
                return ofNullable(element.getAccessibleParent()).map(Accessible::getAccessibleContext);
            default:
                return empty();
        }
    }

    @Override
    public Optional<List<AccessibleContext>> children(@NotNull AccessibleContext element) {
        int childrenCount = element.getAccessibleChildrenCount();
        if (childrenCount < 0) {
            return empty();
        }
        List<AccessibleContext> children = new ArrayList<>(childrenCount);
        for (int i = 0; i < childrenCount; i++) {
            ofNullable(element.getAccessibleChild(i))
                    .map(Accessible::getAccessibleContext)
                    .ifPresent(children::add);
        }
        return Optional.of(children);
    }

    @Override
    public List<String> actionNames(@NotNull AccessibleContext element) {
        var action = element.getAccessibleAction();
        if (action == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (int i = 0; i < action.getAccessibleActionCount(); i++) {
            ofNullable(action.getAccessibleActionDescription(i)).ifPresent(names::add);
        }
        return names;
    }

    @Override
    public Optional<AccessibleContext> asReference(@NotNull Object value) {
        if (value instanceof AccessibleContext context) {
            return Optional.of(context);
        }
        return empty();
    }

    @Override
    public boolean performAction(@NotNull AccessibleContext element, @NotNull String actionName) {
        var action = element.getAccessibleAction();
        if (action == null) {
            LOG.warn("Element '{}' doesn't support any actions", element.getAccessibleName());
            return false;
        }
        for (int i = 0; i < action.getAccessibleActionCount(); i++) {
            if (actionName.equalsIgnoreCase(action.getAccessibleActionDescription(i))) {
                return action.doAccessibleAction(i);
            }
        }
        LOG.warn("Element '{}' has no action named '{}'", element.getAccessibleName(), actionName);
        return false;
    }

    @Override
    public boolean setAttributeValue(@NotNull AccessibleContext element, @NotNull String attributeName,
                                     @NotNull AttributeInput value) {
        switch (attributeName) {
            case VALUE:
                if (value instanceof NumberInput numberInput && element.getAccessibleValue() != null) {
                    return element.getAccessibleValue().setCurrentAccessibleValue(numberInput.number());
                } else if (value instanceof TextInput textInput && element.getAccessibleEditableText() != null) {
                    element.getAccessibleEditableText().setTextContents(textInput.text());
                    return true;
                }
                break;
            case TITLE:
                if (value instanceof TextInput textInput) {
                    element.setAccessibleName(textInput.text());
                    return true;
                }
                break;
            case DESCRIPTION:
                if (value instanceof TextInput textInput) {
                    element.setAccessibleDescription(textInput.text());
                    return true;
                }
                break;
            default:
                break;
        }
        LOG.warn("Attribute '{}' of element '{}' can't be set to {}", attributeName, element.getAccessibleName(), value);
        return false;
    }

    @Override
    public boolean isAttributeSettable(@NotNull AccessibleContext element, @NotNull String attributeName) {
        switch (attributeName) {
            case TITLE:
            case DESCRIPTION:
                return true;
            case VALUE:
                return element.getAccessibleValue() != null || (element.getAccessibleEditableText() != null &&
                        hasState(element, AccessibleState.EDITABLE));
            default:
                return false;
        }
    }

    @Override
    public Optional<AccessibleContext> elementAtPosition(@NotNull AccessibleContext application, double x, double y) {
        var component = application.getAccessibleComponent();
        if (component == null) {
            return empty();
        }
        var origin = getScreenLocation(component).orElseGet(() -> new Point(0, 0));
        var localPoint = new Point((int) Math.floor(x) - origin.x, (int) Math.floor(y) - origin.y);
        if (!component.contains(localPoint)) {
            return empty();
        }

        AccessibleContext current = application;
        AccessibleComponent currentComponent = component;
        Set<AccessibleContext> visited = new HashSet<>();
        while (visited.add(current)) {
            var hit = currentComponent.getAccessibleAt(localPoint);
            if (hit == null || hit.getAccessibleContext() == null || hit.getAccessibleContext().equals(current)) {
                break;
            }
            var hitContext = hit.getAccessibleContext();
            var hitComponent = hitContext.getAccessibleComponent();
            if (hitComponent == null || hitComponent.getLocation() == null) {
                current = hitContext;
                break;
            }
            var hitLocation = hitComponent.getLocation();
            localPoint = new Point(localPoint.x - hitLocation.x, localPoint.y - hitLocation.y);
            current = hitContext;
            currentComponent = hitComponent;
        }
        return Optional.of(current);
    }

    @Override
    public Optional<AccessibleContext> mainWindow(@NotNull AccessibleContext application) {
        return Optional.of(application);
    }

    @Override
    public Optional<AccessibleContext> focusedWindow(@NotNull AccessibleContext application) {
        return ofNullable(KeyboardFocusManager.getCurrentKeyboardFocusManager().getFocusedWindow())
                .map(Window::getAccessibleContext);
    }

    @Override
    public Optional<AccessibleContext> menuBar(@NotNull AccessibleContext application) {
        return findByRole(application, AccessibleRole.MENU_BAR, 0, new HashSet<>());
    }

    private Optional<AccessibleContext> findByRole(AccessibleContext element, AccessibleRole role, int depth,
                                                   Set<AccessibleContext> visited) {
        if (depth > MAX_MENU_BAR_SEARCH_DEPTH || !visited.add(element)) {
            return empty();
        }
        if (role.equals(element.getAccessibleRole())) {
            return Optional.of(element);
        }
        return children(element).orElse(List.of()).stream()
                .map(child -> findByRole(child, role, depth + 1, visited))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static String getRootTitle(Accessible root) {
        if (root instanceof Frame frame) {
            return frame.getTitle();
        } else if (root instanceof Dialog dialog) {
            return dialog.getTitle();
        } else {
            return ofNullable(root.getAccessibleContext()).map(AccessibleContext::getAccessibleName).orElse(null);
        }
    }

    private static Optional<Object> getValue(AccessibleContext element) {
        var editableText = element.getAccessibleEditableText();
        if (editableText != null) {
            return Optional.of(editableText.getTextRange(0, editableText.getCharCount()));
        }
        return ofNullable(element.getAccessibleValue()).map(AccessibleValue::getCurrentAccessibleValue);
    }

    private static boolean hasState(AccessibleContext element, AccessibleState state) {
        var states = element.getAccessibleStateSet();
        return states != null && states.contains(state);
    }

    private static Optional<Object> getLabeledBy(AccessibleContext element) {
        var relationSet = element.getAccessibleRelationSet();
        if (relationSet == null || relationSet.get(AccessibleRelation.LABELED_BY) == null) {
            return empty();
        }
        var targets = relationSet.get(AccessibleRelation.LABELED_BY).getTarget();
        List<Object> labels = stream(targets)
                .map(target -> target instanceof Accessible accessible ? accessible.getAccessibleContext() : target)
                .filter(Objects::nonNull)
                .toList();
        return labels.isEmpty() ? empty() : Optional.of(labels);
    }

    private static Optional<Point> getScreenLocation(AccessibleComponent component) {
        return ofNullable(component.getLocationOnScreen()).or(() -> ofNullable(component.getLocation()));
    }
}
