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
package org.tarik.ax.model;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Normalized value of a single element attribute. Every variant renders itself into plain Java structures (strings, numbers,
 * booleans, ordered maps and lists) which are then serialized as a part of the snapshot document.
 */
public sealed interface AttributeValue {
    String X = "x";
    String Y = "y";
    String WIDTH = "width";
    String HEIGHT = "height";
    String LOCATION = "location";
    String LENGTH = "length";

    @NotNull
    Object toPlainValue();

    record TextValue(@NotNull String text) implements AttributeValue {
        public TextValue {
            requireNonNull(text);
            checkArgument(!text.isEmpty(), "Text attribute values can't be empty");
        }

        @Override
        public @NotNull Object toPlainValue() {
            return text;
        }
    }

    record NumberValue(@NotNull Number number) implements AttributeValue {
        public NumberValue {
            number = normalize(requireNonNull(number));
        }

        @Override
        public @NotNull Object toPlainValue() {
            return number;
        }

        /**
         * Numbers without a fractional part become integers (Integer if they fit, Long otherwise), all others stay floating.
         */
        public static Number normalize(@NotNull Number number) {
            if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
                return number.intValue();
            }
            if (number instanceof Long longValue) {
                return narrow(longValue);
            }
            if (number instanceof BigInteger bigInteger) {
                return bigInteger.bitLength() < Long.SIZE ? narrow(bigInteger.longValue()) : bigInteger.doubleValue();
            }
            if (number instanceof BigDecimal bigDecimal && bigDecimal.signum() != 0 && bigDecimal.stripTrailingZeros().scale() > 0) {
                return bigDecimal.doubleValue();
            }
            double doubleValue = number.doubleValue();
            if (Double.isFinite(doubleValue) && doubleValue == Math.rint(doubleValue) && Math.abs(doubleValue) < Long.MAX_VALUE) {
                return narrow((long) doubleValue);
            }
            return doubleValue;
        }

        private static Number narrow(long value) {
            return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE ? (Number) (int) value : (Number) value;
        }
    }

    record BooleanValue(boolean value) implements AttributeValue {
        @Override
        public @NotNull Object toPlainValue() {
            return value;
        }
    }

    record PointValue(@NotNull Number x, @NotNull Number y) implements AttributeValue {
        public PointValue {
            x = NumberValue.normalize(x);
            y = NumberValue.normalize(y);
        }

        @Override
        public @NotNull Object toPlainValue() {
            var result = new LinkedHashMap<String, Object>();
            result.put(X, x);
            result.put(Y, y);
            return result;
        }
    }

    record RectValue(@NotNull Number x, @NotNull Number y, @NotNull Number width, @NotNull Number height) implements AttributeValue {
        public RectValue {
            x = NumberValue.normalize(x);
            y = NumberValue.normalize(y);
            width = NumberValue.normalize(width);
            height = NumberValue.normalize(height);
        }

        @Override
        public @NotNull Object toPlainValue() {
            var result = new LinkedHashMap<String, Object>();
            result.put(X, x);
            result.put(Y, y);
            result.put(WIDTH, width);
            result.put(HEIGHT, height);
            return result;
        }
    }

    record SizeValue(@NotNull Number width, @NotNull Number height) implements AttributeValue {
        public SizeValue {
            width = NumberValue.normalize(width);
            height = NumberValue.normalize(height);
        }

        @Override
        public @NotNull Object toPlainValue() {
            var result = new LinkedHashMap<String, Object>();
            result.put(WIDTH, width);
            result.put(HEIGHT, height);
            return result;
        }
    }

    record RangeValue(long location, long length) implements AttributeValue {
        @Override
        public @NotNull Object toPlainValue() {
            var result = new LinkedHashMap<String, Object>();
            result.put(LOCATION, NumberValue.normalize(location));
            result.put(LENGTH, NumberValue.normalize(length));
            return result;
        }
    }

    record ListValue(@NotNull List<AttributeValue> values) implements AttributeValue {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public @NotNull Object toPlainValue() {
            var result = new ArrayList<>(values.size());
            values.forEach(value -> result.add(value.toPlainValue()));
            return result;
        }
    }

    record MapValue(@NotNull Map<String, AttributeValue> values) implements AttributeValue {
        public MapValue {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        @Override
        public @NotNull Object toPlainValue() {
            var result = new LinkedHashMap<String, Object>();
            values.forEach((key, value) -> result.put(key, value.toPlainValue()));
            return result;
        }
    }

    /**
     * An element referenced by an attribute, expanded in place into its own document.
     */
    record NodeValue(@NotNull DocumentNode node) implements AttributeValue {
        @Override
        public @NotNull Object toPlainValue() {
            return node.toPlainDocument();
        }
    }

    record UnsupportedValue(@NotNull String diagnostic) implements AttributeValue {
        public static UnsupportedValue ofType(@NotNull Class<?> type) {
            return new UnsupportedValue("[Unsupported type: %s]".formatted(type.getSimpleName()));
        }

        @Override
        public @NotNull Object toPlainValue() {
            return diagnostic;
        }
    }
}
