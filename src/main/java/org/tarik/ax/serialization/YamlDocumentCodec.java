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
package org.tarik.ax.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.ax.model.DocumentNode;
import org.yaml.snakeyaml.LoaderOptions;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Optional.empty;
import static java.util.Optional.of;
import static org.tarik.ax.utils.CommonUtils.isBlank;

/**
 * Converts documents to YAML text and back. Key order is preserved in both directions.
 */
public final class YamlDocumentCodec {
    private static final Logger LOG = LoggerFactory.getLogger(YamlDocumentCodec.class);
    private static final YAMLMapper MAPPER = YAMLMapper.builder(YAMLFactory.builder().loaderOptions(createLoaderOptions()).build())
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .build();

    private YamlDocumentCodec() {
    }

    // Snapshots of large tables easily exceed the default limit of SnakeYAML
    private static LoaderOptions createLoaderOptions() {
        var options = new LoaderOptions();
        options.setCodePointLimit(Integer.MAX_VALUE);
        return options;
    }

    public static Optional<String> toYaml(@NotNull DocumentNode document) {
        return toYaml(document.toPlainDocument());
    }

    public static Optional<String> toYaml(@NotNull Map<String, ?> document) {
        try {
            return of(MAPPER.writeValueAsString(document));
        } catch (JsonProcessingException e) {
            LOG.error("Couldn't serialize the document into YAML", e);
            return empty();
        }
    }

    /**
     * Parses YAML text whose top level is a mapping. Blank or malformed text, as well as text with any other top-level node,
     * yields an empty result.
     */
    public static Optional<Map<String, Object>> parse(@Nullable String yaml) {
        if (isBlank(yaml)) {
            LOG.warn("Received blank YAML, nothing to parse");
            return empty();
        }
        try {
            var parsed = MAPPER.readValue(yaml, Object.class);
            if (!(parsed instanceof Map<?, ?> map)) {
                LOG.warn("Expected a mapping at the top level of YAML, got {}", parsed == null ? "nothing" : parsed.getClass().getSimpleName());
                return empty();
            }
            Map<String, Object> document = new LinkedHashMap<>();
            map.forEach((key, value) -> document.put(String.valueOf(key), value));
            return of(document);
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.error("Couldn't parse YAML: {}", e.getMessage());
            return empty();
        }
    }
}
