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
import org.tarik.ax.model.AttributeValue;
import org.tarik.ax.model.AttributeValue.*;
import org.tarik.ax.model.TextRange;

import java.awt.geom.Dimension2D;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.*;
import java.util.function.Supplier;

import static java.util.Optional.empty;
import static java.util.Optional.of;
import static org.tarik.ax.model.AttributeNames.*;

/**
 * Builds the normalized attributes of a single element. Values are classified by their runtime type, element references are
 * expanded into nested documents through the traversal which is in progress. Types which can't be represented are replaced
 * with a placeholder instead of failing the snapshot.
 */
public class AttributeNormalizer<R> {
    private static final Logger LOG = LoggerFactory.getLogger(AttributeNormalizer.class);
    static final String FAILED_URL_PLACEHOLDER = "[Failed URL]";

    private final NodeAdapter<R> adapter;

    public AttributeNormalizer(@NotNull NodeAdapter<R> adapter) {
        this.adapter = adapter;
    }

    public Map<String, AttributeValue> normalize(@NotNull R element, int depth, @NotNull NestedElementExpander<R> expander) {
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        for (String name : getAttributeNames(element)) {
            safeRead(() -> adapter.attributeValue(element, name), "attribute '%s'".formatted(name))
                    .flatMap(raw -> raw)
                    .flatMap(raw -> normalizeValue(raw, depth, expander))
                    .ifPresent(value -> attributes.put(name, value));
        }

        List<AttributeValue> actions = safeRead(() -> adapter.actionNames(element), "action names")
                .orElse(List.of())
                .stream()
                .filter(Objects::nonNull)
                .filter(action -> !action.isEmpty())
                .<AttributeValue>map(TextValue::new)
                .toList();
        if (!actions.isEmpty()) {
            attributes.put(AVAILABLE_ACTIONS, new ListValue(actions));
        }
        return attributes;
    }

    private Collection<String> getAttributeNames(R element) {
        Set<String> names = new LinkedHashSet<>(MANDATORY_ATTRIBUTES);
        safeRead(() -> adapter.attributeNames(element), "attribute names")
                .orElse(List.of())
                .stream()
                .filter(Objects::nonNull)
                .filter(name -> !STRUCTURAL_ATTRIBUTES.contains(name))
                .forEach(names::add);
        return names;
    }

    Optional<AttributeValue> normalizeValue(@NotNull Object raw, int depth, @NotNull NestedElementExpander<R> expander) {
        var reference = safeRead(() -> adapter.asReference(raw), "element reference").flatMap(ref -> ref);
        if (reference.isPresent()) {
            return expander.expand(reference.get(), depth + 1).map(NodeValue::new);
        }

        if (raw instanceof String text) {
            return text.isEmpty() ? empty() : of(new TextValue(text));
        } else if (raw instanceof Boolean bool) {
            return of(new BooleanValue(bool));
        } else if (raw instanceof Number number) {
            return of(new NumberValue(number));
        } else if (raw instanceof Point2D point) {
            return of(new PointValue(point.getX(), point.getY()));
        } else if (raw instanceof Rectangle2D rectangle) {
            return of(new RectValue(rectangle.getX(), rectangle.getY(), rectangle.getWidth(), rectangle.getHeight()));
        } else if (raw instanceof Dimension2D dimension) {
            return of(new SizeValue(dimension.getWidth(), dimension.getHeight()));
        } else if (raw instanceof TextRange range) {
            return of(new RangeValue(range.location(), range.length()));
        } else if (raw instanceof URI uri) {
            return of(new TextValue(uri.toString()));
        } else if (raw instanceof URL url) {
            return of(convertUrl(url));
        } else if (raw instanceof Collection<?> collection) {
            return normalizeList(collection, depth, expander);
        } else if (raw instanceof Object[] array) {
            return normalizeList(Arrays.asList(array), depth, expander);
        } else if (raw instanceof Map<?, ?> map) {
            return normalizeMap(map, depth, expander);
        } else {
            return of(UnsupportedValue.ofType(raw.getClass()));
        }
    }

    private Optional<AttributeValue> normalizeList(Collection<?> items, int depth, NestedElementExpander<R> expander) {
        List<AttributeValue> values = new ArrayList<>();
        for (Object item : items) {
            if (item != null) {
                normalizeValue(item, depth, expander)
                        .filter(value -> !(value instanceof UnsupportedValue))
                        .ifPresent(values::add);
            }
        }
        return values.isEmpty() ? empty() : of(new ListValue(values));
    }

    private Optional<AttributeValue> normalizeMap(Map<?, ?> entries, int depth, NestedElementExpander<R> expander) {
        Map<String, AttributeValue> values = new LinkedHashMap<>();
        entries.forEach((key, item) -> {
            if (item != null) {
                normalizeValue(item, depth, expander)
                        .filter(value -> !(value instanceof UnsupportedValue))
                        .ifPresent(value -> values.put(String.valueOf(key), value));
            }
        });
        return values.isEmpty() ? empty() : of(new MapValue(values));
    }

    private static AttributeValue convertUrl(URL url) {
        try {
            return new TextValue(url.toURI().toString());
        } catch (URISyntaxException e) {
            LOG.debug("Couldn't convert URL {} into a URI", url, e);
            return new UnsupportedValue(FAILED_URL_PLACEHOLDER);
        }
    }

    private static <T> Optional<T> safeRead(Supplier<T> reader, String description) {
        try {
            return Optional.ofNullable(reader.get());
        } catch (RuntimeException e) {
            LOG.debug("Couldn't read {} of the element, skipping it: {}", description, e.getMessage());
            return empty();
        }
    }
}
