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
package org.tarik.ax.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import dev.langchain4j.agent.tool.ToolSpecification;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.ax.ExplorerConfig;
import org.tarik.ax.adapter.AttributeInput;
import org.tarik.ax.explorer.AccessExplorer;
import org.tarik.ax.explorer.ElementAnchor;
import org.tarik.ax.model.ElementContext;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static dev.langchain4j.agent.tool.ToolSpecifications.toolSpecificationsFrom;
import static java.util.Arrays.stream;
import static java.util.Optional.ofNullable;
import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toMap;
import static org.tarik.ax.tools.AbstractTools.ToolExecutionStatus.ERROR;
import static org.tarik.ax.utils.CommonUtils.*;

/**
 * Tools which let a model explore and operate the application bound to an {@link AccessExplorer}. Elements are addressed by the
 * context of the snapshot which captured them and their ID in it.
 */
public class ExplorerTools extends AbstractTools {
    private static final Logger LOG = LoggerFactory.getLogger(ExplorerTools.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Map<String, ToolSpecification> toolSpecificationsByName = toolSpecificationsFrom(ExplorerTools.class)
            .stream()
            .collect(toMap(ToolSpecification::name, identity()));

    private final AccessExplorer<?> explorer;

    public ExplorerTools(@NotNull AccessExplorer<?> explorer) {
        this.explorer = explorer;
    }

    public static List<ToolSpecification> getToolSpecifications() {
        return List.copyOf(toolSpecificationsByName.values());
    }

    @Tool(value = "Captures the accessibility tree of the application window as YAML. Each element is keyed as 'element<ID>', the " +
            "ID can be used afterwards together with the same context name in order to interact with that element.")
    public ToolExecutionResult snapshotWindow(
            @P(value = "The name of the context to capture: 'App' for the whole application, 'Main' for the main window, 'Focus' " +
                    "for the focused window or 'Menu' for the menu bar.") String contextName,
            @P(value = "The maximal depth of the captured tree, the default one is used if not provided.", required = false)
            String maxDepth) {
        var context = ElementContext.fromName(contextName);
        if (context.isEmpty()) {
            return getFailedToolExecutionResult("'%s' is not a valid context name".formatted(contextName), true);
        }
        return withDepth(maxDepth, ExplorerConfig.getDefaultMaxDepth(), depth -> explorer.snapshot(context.get(), depth)
                .map(AbstractTools::getSuccessfulResult)
                .orElseGet(() -> getFailedToolExecutionResult("Couldn't capture the context '%s' of the application '%s'"
                        .formatted(contextName, explorer.getApplicationName()), false)));
    }

    @Tool(value = "Captures the accessibility subtree of an element from an earlier snapshot as YAML. The captured elements get new " +
            "IDs which belong to the 'Query' context.")
    public ToolExecutionResult describeElement(
            @P(value = "The name of the context in which the element was captured.") String contextName,
            @P(value = "The ID of the element.") String elementId,
            @P(value = "The maximal depth of the captured subtree, the default one is used if not provided.", required = false)
            String maxDepth) {
        return withElement(contextName, elementId, (context, id) -> withDepth(maxDepth, ExplorerConfig.getQueryMaxDepth(),
                depth -> explorer.resolveAndSnapshot(context, id, depth)
                        .map(AbstractTools::getSuccessfulResult)
                        .orElseGet(() -> getFailedToolExecutionResult("Element %s from context '%s' couldn't be captured"
                                .formatted(id, contextName), false))));
    }

    @Tool(value = "Performs an accessibility action on an element from an earlier snapshot, e.g. 'click' or 'press'. The available " +
            "actions of each element are listed in its 'availableActions' attribute.")
    public ToolExecutionResult performElementAction(
            @P(value = "The name of the context in which the element was captured.") String contextName,
            @P(value = "The ID of the element.") String elementId,
            @P(value = "The name of the action to perform.") String actionName) {
        if (isBlank(actionName)) {
            return getFailedToolExecutionResult("Action name must be provided", true);
        }
        return withElement(contextName, elementId, (context, id) -> explorer.performAction(context, id, actionName)
                ? getSuccessfulResult("Performed action '%s' on element %s".formatted(actionName, id))
                : getFailedToolExecutionResult("Action '%s' couldn't be performed on element %s".formatted(actionName, id), false));
    }

    @Tool(value = "Sets the value of an attribute of an element from an earlier snapshot, e.g. the text of an input field.")
    public ToolExecutionResult setElementValue(
            @P(value = "The name of the context in which the element was captured.") String contextName,
            @P(value = "The ID of the element.") String elementId,
            @P(value = "The name of the attribute, usually 'value'.") String attributeName,
            @P(value = "The new value of the attribute.") String value,
            @P(value = "The type of the value: 'String', 'Bool' or 'Number'.") String valueType) {
        if (isBlank(attributeName)) {
            return getFailedToolExecutionResult("Attribute name must be provided", true);
        }
        var input = AttributeInput.fromTagged(value, valueType);
        if (input.isEmpty()) {
            return getFailedToolExecutionResult("'%s' is not a valid value of type '%s'".formatted(value, valueType), true);
        }
        return withElement(contextName, elementId, (context, id) -> explorer.setAttribute(context, id, attributeName, input.get())
                ? getSuccessfulResult("Set attribute '%s' of element %s to '%s'".formatted(attributeName, id, value))
                : getFailedToolExecutionResult("Attribute '%s' of element %s couldn't be set".formatted(attributeName, id), false));
    }

    @Tool(value = "Returns the screen coordinates of the center of an element from an earlier snapshot.")
    public ToolExecutionResult locateElement(
            @P(value = "The name of the context in which the element was captured.") String contextName,
            @P(value = "The ID of the element.") String elementId) {
        return withElement(contextName, elementId, (context, id) -> explorer.locateElement(context, id, ElementAnchor.CENTER)
                .map(point -> getSuccessfulResult("Element %s is located at (%s, %s)".formatted(id, point.x, point.y)))
                .orElseGet(() -> getFailedToolExecutionResult("Location of element %s is unknown".formatted(id), false)));
    }

    /**
     * Executes the tool with the given name, taking its arguments from a JSON object keyed by parameter names.
     */
    public ToolExecutionResult executeTool(@NotNull String toolName, @NotNull String argumentsJson) {
        checkArgument(toolSpecificationsByName.containsKey(toolName),
                "The requested tool '%s' is not registered, please fix the prompt", toolName);
        var method = getToolMethod(toolName);
        var arguments = parseArgumentsJson(argumentsJson, method);
        LOG.info("Executing tool '{}' with arguments: <{}>", toolName, Arrays.toString(arguments));
        try {
            return (ToolExecutionResult) method.invoke(this, arguments);
        } catch (IllegalAccessException e) {
            throw new RuntimeException("Access denied while invoking tool '%s'".formatted(toolName), e);
        } catch (InvocationTargetException e) {
            LOG.error("Exception thrown by tool '{}': {}", toolName, ofNullable(e.getCause()).map(Throwable::getMessage)
                    .orElse("Unknown Cause"), e);
            return new ToolExecutionResult(ERROR, "'%s' tool execution failed because of internal error.".formatted(toolName), false);
        }
    }

    private ToolExecutionResult withElement(String contextName, String elementId, ElementOperation operation) {
        var context = ElementContext.fromName(contextName);
        if (context.isEmpty()) {
            return getFailedToolExecutionResult("'%s' is not a valid context name".formatted(contextName), true);
        }
        Optional<Integer> id = parseStringAsInteger(elementId);
        if (id.isEmpty()) {
            return getFailedToolExecutionResult("'%s' is not a valid element ID".formatted(elementId), true);
        }
        return operation.apply(context.get(), id.get());
    }

    private static ToolExecutionResult withDepth(String maxDepth, int defaultDepth, Function<Integer, ToolExecutionResult> operation) {
        if (isBlank(maxDepth)) {
            return operation.apply(defaultDepth);
        }
        return parseStringAsInteger(maxDepth)
                .filter(depth -> depth >= 0)
                .map(operation)
                .orElseGet(() -> getFailedToolExecutionResult("'%s' is not a valid depth".formatted(maxDepth), true));
    }

    private static Method getToolMethod(String toolName) {
        return stream(ExplorerTools.class.getMethods())
                .filter(method -> method.getName().equals(toolName) && method.isAnnotationPresent(Tool.class))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No method found for tool '%s'".formatted(toolName)));
    }

    private static Object[] parseArgumentsJson(String argumentsJson, Method method) {
        try {
            Map<String, Object> argumentsMap = OBJECT_MAPPER.readValue(argumentsJson, new TypeReference<>() {
            });
            return stream(method.getParameters())
                    .map(parameter -> OBJECT_MAPPER.convertValue(argumentsMap.get(parameter.getName()), parameter.getType()))
                    .toArray();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Couldn't parse the tool arguments JSON: %s".formatted(argumentsJson), e);
        }
    }

    @FunctionalInterface
    private interface ElementOperation {
        ToolExecutionResult apply(ElementContext context, int id);
    }
}
