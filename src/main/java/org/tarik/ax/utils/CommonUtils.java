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
package org.tarik.ax.utils;

import java.util.Optional;

import static java.util.Optional.empty;
import static java.util.Optional.of;

public class CommonUtils {

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static boolean isNotBlank(String value) {
        return !isBlank(value);
    }

    public static Optional<Integer> parseStringAsInteger(String value) {
        if (isBlank(value)) {
            return empty();
        }
        try {
            return of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return empty();
        }
    }

    public static Optional<Double> parseStringAsDouble(String value) {
        if (isBlank(value)) {
            return empty();
        }
        try {
            return of(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return empty();
        }
    }
}
