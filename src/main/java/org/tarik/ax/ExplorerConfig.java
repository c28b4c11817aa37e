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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.ax.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.stream;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;

public class ExplorerConfig {
    private static final Logger LOG = LoggerFactory.getLogger(ExplorerConfig.class);
    private static final Properties properties = loadConfigPropertiesFromFile();

    public record ConfigProperty<T>(T value, boolean isSecret) {
    }

    // -----------------------------------------------------
    // Constants
    private static final String CONFIG_FILE = "config.properties";
    private static final String LIST_SEPARATOR = ",";

    // Snapshot Config
    private static final ConfigProperty<Integer> DEFAULT_MAX_DEPTH =
            loadPropertyAsInteger("snapshot.default.max.depth", "SNAPSHOT_DEFAULT_MAX_DEPTH", "5", false);
    private static final ConfigProperty<Integer> QUERY_MAX_DEPTH =
            loadPropertyAsInteger("snapshot.query.max.depth", "SNAPSHOT_QUERY_MAX_DEPTH", "2", false);

    // Post-Processor Config
    private static final ConfigProperty<String> HELP_BOILERPLATE = loadProperty("postprocessor.help.boilerplate",
            "POSTPROCESSOR_HELP_BOILERPLATE", "For more options", s -> s, false);
    private static final ConfigProperty<String> IGNORED_ACTION = loadProperty("postprocessor.ignored.action",
            "POSTPROCESSOR_IGNORED_ACTION", "showMenu", s -> s, false);
    private static final ConfigProperty<List<String>> COMPACT_EXCLUDED_KEYS = loadProperty("postprocessor.compact.excluded.keys",
            "POSTPROCESSOR_COMPACT_EXCLUDED_KEYS", "frame,position,size", ExplorerConfig::parseList, false);

    // -----------------------------------------------------
    // Snapshot Config
    public static int getDefaultMaxDepth() {
        return DEFAULT_MAX_DEPTH.value();
    }

    public static int getQueryMaxDepth() {
        return QUERY_MAX_DEPTH.value();
    }

    // -----------------------------------------------------
    // Post-Processor Config
    public static String getHelpBoilerplate() {
        return HELP_BOILERPLATE.value();
    }

    public static String getIgnoredAction() {
        return IGNORED_ACTION.value();
    }

    public static List<String> getCompactExcludedKeys() {
        return COMPACT_EXCLUDED_KEYS.value();
    }

    // -----------------------------------------------------
    // Private methods
    private static Properties loadConfigPropertiesFromFile() {
        var properties = new Properties();
        try (InputStream inputStream = ExplorerConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                LOG.error("Cannot find resource file '{}' in classpath.", CONFIG_FILE);
                throw new IOException("Cannot find resource: " + CONFIG_FILE);
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from {}", CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file " + CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static List<String> parseList(String value) {
        return stream(value.split(LIST_SEPARATOR))
                .map(String::trim)
                .filter(CommonUtils::isNotBlank)
                .toList();
    }

    private static <T> ConfigProperty<T> loadProperty(String key, String envVar, String defaultValue, Function<String, T> converter,
                                                      boolean isSecret) {
        var value = getProperty(key, envVar, defaultValue, isSecret);
        return new ConfigProperty<>(converter.apply(value), isSecret);
    }

    private static Optional<String> getProperty(String key, String envVar, boolean isSecret) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            var message = "Using environment variable '%s' for key '%s'".formatted(envVar, key);
            if (!isSecret) {
                message = "%s with value '%s'".formatted(message, envVariableOptional.get());
            }
            LOG.info(message);
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                var message = "Using property file value for key '%s'".formatted(key);
                if (!isSecret) {
                    message = "%s with value '%s'".formatted(message, propertyFileValueOptional.get());
                }
                LOG.info(message);
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static String getProperty(String key, String envVar, String defaultValue, boolean isSecret) {
        return getProperty(key, envVar, isSecret).orElseGet(() -> {
            LOG.debug("Using default value for key '{}'", key);
            return defaultValue;
        });
    }

    private static ConfigProperty<Integer> loadPropertyAsInteger(String propertyKey, String envVar, String defaultValue, boolean isSecret) {
        var configProperty = loadProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Integer value = CommonUtils.parseStringAsInteger(configProperty.value()).orElseThrow(() -> new IllegalArgumentException(
                "The value of property '%s' is not a correct integer value:%s".formatted(propertyKey, configProperty.value())));
        if (value < 0) {
            throw new IllegalStateException("The value of property '%s' can't be negative, got %d".formatted(propertyKey, value));
        }
        return new ConfigProperty<>(value, configProperty.isSecret());
    }
}
