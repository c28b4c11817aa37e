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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.tarik.ax.tools.AbstractTools.ToolExecutionStatus.ERROR;
import static org.tarik.ax.tools.AbstractTools.ToolExecutionStatus.SUCCESS;

public abstract class AbstractTools {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractTools.class);

    protected static ToolExecutionResult getSuccessfulResult(String message) {
        return new ToolExecutionResult(SUCCESS, message, false);
    }

    protected static ToolExecutionResult getFailedToolExecutionResult(String message, boolean retryMakesSense) {
        LOG.warn(message);
        return new ToolExecutionResult(ERROR, message, retryMakesSense);
    }

    public enum ToolExecutionStatus {
        SUCCESS, ERROR
    }

    public record ToolExecutionResult(ToolExecutionStatus executionStatus, String message, boolean retryMakesSense) {
    }
}
