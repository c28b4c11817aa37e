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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.ax.adapter.AttributeInput.*;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeInputTest {

    @Test
    @DisplayName("Tags are matched ignoring case")
    void tagsIgnoreCase() {
        assertThat(AttributeInput.fromTagged("Total", "string")).contains(new TextInput("Total"));
        assertThat(AttributeInput.fromTagged(true, "BOOL")).contains(new BooleanInput(true));
        assertThat(AttributeInput.fromTagged(42, "Number")).contains(new NumberInput(42));
    }

    @Test
    @DisplayName("String values are parsed according to the tag")
    void stringValuesAreParsed() {
        assertThat(AttributeInput.fromTagged("false", "Bool")).contains(new BooleanInput(false));
        assertThat(AttributeInput.fromTagged("12.5", "Number")).contains(new NumberInput(12.5));
        assertThat(AttributeInput.fromTagged("yes", "Bool")).isEmpty();
        assertThat(AttributeInput.fromTagged("twelve", "Number")).isEmpty();
    }

    @Test
    @DisplayName("Values not matching the tag and unknown tags are rejected")
    void mismatchesAreRejected() {
        assertThat(AttributeInput.fromTagged(12, "String")).isEmpty();
        assertThat(AttributeInput.fromTagged("x", "Date")).isEmpty();
        assertThat(AttributeInput.fromTagged(null, "String")).isEmpty();
        assertThat(AttributeInput.fromTagged("x", null)).isEmpty();
    }

    @Test
    @DisplayName("Lists keep strings, numbers and booleans and skip other items")
    void listsKeepSupportedItems() {
        var input = AttributeInput.fromTagged(Arrays.asList("a", 1, false, new Object(), null), "List");

        assertThat(input).contains(new ListInput(List.of(new TextInput("a"), new NumberInput(1), new BooleanInput(false))));
        assertThat(AttributeInput.fromTagged("a,b", "List")).isEmpty();
    }
}
