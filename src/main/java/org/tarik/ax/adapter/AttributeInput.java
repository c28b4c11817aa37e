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
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static java.util.Optional.empty;
import static java.util.Optional.of;
import static org.tarik.ax.utils.CommonUtils.parseStringAsDouble;

/**
 * Typed value which can be written into an element attribute.
 */
public sealed interface AttributeInput {
    Logger LOG = LoggerFactory.getLogger(AttributeInput.class);

    String STRING_TAG = "String";
    String BOOL_TAG = "Bool";
    String NUMBER_TAG = "Number";
    String LIST_TAG = "List";

    record TextInput(@NotNull String text) implements AttributeInput {
        public TextInput {
            requireNonNull(text);
        }
    }

    record BooleanInput(boolean value) implements AttributeInput {
    }

    record NumberInput(@NotNull Number number) implements AttributeInput {
        public NumberInput {
            requireNonNull(number);
        }
    }

    record ListInput(@NotNull List<AttributeInput> values) implements AttributeInput {
        public ListInput {
            values = List.copyOf(values);
        }
    }

    /**
     * Converts a caller-supplied value according to its type tag ({@code String}, {@code Bool}, {@code Number} or {@code List},
     * case-insensitive). Returns empty if the tag is unknown or the value doesn't match it.
     */
    static Optional<AttributeInput> fromTagged(@Nullable Object value, @Nullable String typeTag) {
        if (value == null || typeTag == null) {
            return empty();
        }
        var tag = typeTag.trim();
        if (STRING_TAG.equalsIgnoreCase(tag)) {
            return value instanceof String text ? of(new TextInput(text)) : empty();
        } else if (BOOL_TAG.equalsIgnoreCase(tag)) {
            return toBoolean(value).map(BooleanInput::new);
        } else if (NUMBER_TAG.equalsIgnoreCase(tag)) {
            return toNumber(value).map(NumberInput::new);
        } else if (LIST_TAG.equalsIgnoreCase(tag)) {
            return toList(value);
        } else {
            LOG.warn("Unknown attribute value type tag '{}'", typeTag);
            return empty();
        }
    }

    private static Optional<Boolean> toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return of(bool);
        }
        if (value instanceof String text) {
            var trimmed = text.trim();
            if ("true".equalsIgnoreCase(trimmed)) {
                return of(true);
            } else if ("false".equalsIgnoreCase(trimmed)) {
                return of(false);
            }
        }
        return empty();
    }

    private static Optional<Number> toNumber(Object value) {
        if (value instanceof Number number) {
            return of(number);
        }
        if (value instanceof String text) {
            return parseStringAsDouble(text).map(Number.class::cast);
        }
        return empty();
    }

    private static Optional<AttributeInput> toList(Object value) {
        Collection<?> items;
        if (value instanceof Collection<?> collection) {
            items = collection;
        } else if (value instanceof Object[] array) {
            items = Arrays.asList(array);
        } else {
            return empty();
        }

        List<AttributeInput> converted = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof String text) {
                converted.add(new TextInput(text));
            } else if (item instanceof Boolean bool) {
                converted.add(new BooleanInput(bool));
            } else if (item instanceof Number number) {
                converted.add(new NumberInput(number));
            } else {
                LOG.warn("Skipping list item of unsupported type {}", item == null ? "null" : item.getClass().getSimpleName());
            }
        }
        return of(new ListInput(converted));
    }
}
