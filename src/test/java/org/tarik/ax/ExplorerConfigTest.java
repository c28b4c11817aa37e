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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExplorerConfigTest {

    @Test
    @DisplayName("Values are loaded from the bundled properties file")
    void loadsBundledProperties() {
        assertThat(ExplorerConfig.getDefaultMaxDepth()).isEqualTo(5);
        assertThat(ExplorerConfig.getQueryMaxDepth()).isEqualTo(2);
        assertThat(ExplorerConfig.getHelpBoilerplate()).isEqualTo("For more options");
        assertThat(ExplorerConfig.getIgnoredAction()).isEqualTo("showMenu");
    }

    @Test
    @DisplayName("List values are split and trimmed")
    void parsesListValues() {
        assertThat(ExplorerConfig.getCompactExcludedKeys())
                .startsWith("frame", "position", "size")
                .contains("selectedTextRange", "orientation")
                .doesNotContain("");
    }
}
