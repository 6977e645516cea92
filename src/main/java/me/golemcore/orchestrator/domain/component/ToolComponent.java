package me.golemcore.orchestrator.domain.component;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.orchestrator.domain.model.ToolCapabilities;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolExecutionContext;
import me.golemcore.orchestrator.domain.model.ToolParameters;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.ValidationResult;
import me.golemcore.orchestrator.domain.service.ParameterSchemaValidator;

import java.util.concurrent.CompletableFuture;

/**
 * Component representing an executable tool that can be invoked by the LLM.
 * Tools expose their JSON Schema definition to the LLM via function calling,
 * declare capability flags for the orchestrator, and implement the execution
 * logic. Concrete filesystem, search and shell tools live outside this module
 * and are picked up as Spring beans.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling. The
     * definition includes the tool name, description, version and parameter
     * schema.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified parameters. Long-running tools should
     * poll {@link ToolExecutionContext#isCancelled()}: the dispatch timeout only
     * stops waiting, it does not stop the tool.
     *
     * @param parameters
     *            validated parameters
     * @param context
     *            effective execution context
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(ToolParameters parameters, ToolExecutionContext context);

    /**
     * Returns the capability flags of this tool.
     */
    default ToolCapabilities getCapabilities() {
        return ToolCapabilities.readOnly();
    }

    /**
     * Validates parameters before execution. The default implementation checks
     * them against the declared input schema.
     */
    default ValidationResult validate(ToolParameters parameters) {
        return ParameterSchemaValidator.validate(getDefinition().getInputSchema(), parameters);
    }

    /**
     * Called once when the registry initializes all tools.
     */
    default void initialize(ToolExecutionContext context) {
        // Default no-op
    }

    /**
     * Called once when the registry shuts all tools down.
     */
    default void shutdown() {
        // Default no-op
    }

    default boolean supportsDryRun() {
        return false;
    }

    /**
     * Previews the effect of a call without side effects. Only meaningful when
     * {@link #supportsDryRun()} is true.
     */
    default CompletableFuture<ToolResult> dryRun(ToolParameters parameters, ToolExecutionContext context) {
        return CompletableFuture.failedFuture(
                new UnsupportedOperationException("Dry run not supported by tool: " + getToolName()));
    }

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
