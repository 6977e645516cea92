package me.golemcore.orchestrator.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.ExecutionOptions;
import me.golemcore.orchestrator.domain.model.ExecutionStats;
import me.golemcore.orchestrator.domain.model.ToolError;
import me.golemcore.orchestrator.domain.model.ToolErrorCode;
import me.golemcore.orchestrator.domain.model.ToolExecutionContext;
import me.golemcore.orchestrator.domain.model.ToolExecutionMetadata;
import me.golemcore.orchestrator.domain.model.ToolParameters;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.ValidationResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Tool dispatch pipeline: lookup, validation, execution under a timeout,
 * exception conversion and statistics.
 *
 * <p>
 * Never throws: every failure is returned as a {@link ToolResult} with one of
 * the {@link ToolErrorCode} codes, and every result carries
 * {@code metadata.executionTimeMs}. A timeout only stops waiting for the tool;
 * the tool itself keeps running unless it honors the cancellation signal of its
 * context.
 */
@Service
@Slf4j
public class ToolExecutionService {

    private final ToolRegistryService registry;
    private final ToolExecutionContext defaultContext;
    private final Duration defaultTimeout;

    private long totalExecutions;
    private long successCount;
    private long errorCount;
    private long totalExecutionTimeMs;
    private final Map<String, Long> executionsByTool = new LinkedHashMap<>();

    public ToolExecutionService(ToolRegistryService registry, ToolExecutionContext defaultContext,
            OrchestratorProperties properties) {
        this.registry = registry;
        this.defaultContext = defaultContext;
        this.defaultTimeout = properties.getTools().getDefaultTimeout();
    }

    public ToolResult execute(String name, ToolParameters params) {
        return executeWithContext(name, params, defaultContext, ExecutionOptions.defaults());
    }

    public ToolResult execute(String name, ToolParameters params, ExecutionOptions options) {
        return executeWithContext(name, params, defaultContext, options);
    }

    public ToolResult executeWithContext(String name, ToolParameters params, ToolExecutionContext context) {
        return executeWithContext(name, params, context, ExecutionOptions.defaults());
    }

    public ToolResult executeWithContext(String name, ToolParameters params, ToolExecutionContext context,
            ExecutionOptions options) {
        return dispatch(name, params, context, options, false);
    }

    /**
     * Dispatches the tool's dry-run hook through the same pipeline. Dry runs are
     * not counted in the statistics.
     */
    public ToolResult executeDryRun(String name, ToolParameters params, ExecutionOptions options) {
        return dispatch(name, params, defaultContext, options, true);
    }

    public ValidationResult validate(String name, ToolParameters params) {
        Optional<ToolComponent> tool = registry.get(name);
        if (tool.isEmpty()) {
            return ValidationResult.invalid(List.of("Unknown tool: " + name));
        }
        return safeValidate(tool.get(), params != null ? params : ToolParameters.empty());
    }

    public synchronized ExecutionStats getStats() {
        double average = totalExecutions > 0 ? (double) totalExecutionTimeMs / totalExecutions : 0.0;
        return new ExecutionStats(totalExecutions, successCount, errorCount, executionsByTool, average);
    }

    private ToolResult dispatch(String name, ToolParameters params, ToolExecutionContext context,
            ExecutionOptions options, boolean dryRun) {
        long startNanos = System.nanoTime();
        ExecutionOptions effectiveOptions = options != null ? options : ExecutionOptions.defaults();
        ToolParameters parameters = params != null ? params : ToolParameters.empty();

        Optional<ToolComponent> found = registry.get(name);
        if (found.isEmpty()) {
            log.warn("[Tools] Unknown tool requested: {}", name);
            ToolResult notFound = ToolResult.failure(ToolErrorCode.TOOL_NOT_FOUND,
                    "Unknown tool: " + name + ". Available tools: " + String.join(", ", registry.getNames()));
            return withTiming(notFound, startNanos);
        }
        ToolComponent tool = found.get();

        if (!effectiveOptions.isSkipValidation()) {
            ValidationResult validation = safeValidate(tool, parameters);
            if (!validation.valid()) {
                log.debug("[Tools] Validation failed for '{}': {}", name, validation.errors());
                ToolResult invalid = ToolResult.builder()
                        .success(false)
                        .error(ToolError.of(ToolErrorCode.VALIDATION_ERROR, "Invalid parameters",
                                validation.errors()))
                        .build();
                return withTiming(invalid, startNanos);
            }
        }

        if (dryRun && !tool.supportsDryRun()) {
            return withTiming(ToolResult.failure(ToolErrorCode.EXECUTION_ERROR,
                    "Dry run not supported by tool: " + name), startNanos);
        }

        Duration timeout = effectiveOptions.getTimeout() != null ? effectiveOptions.getTimeout() : defaultTimeout;
        ToolExecutionContext effectiveContext = (context != null ? context : defaultContext).merge(effectiveOptions);

        Supplier<CompletableFuture<ToolResult>> invocation = dryRun
                ? () -> tool.dryRun(parameters, effectiveContext)
                : () -> tool.execute(parameters, effectiveContext);
        ToolResult result = withTiming(runWithTimeout(name, invocation, timeout), startNanos);

        if (!dryRun) {
            recordStats(name, result);
        }
        return result;
    }

    private ToolResult runWithTimeout(String name, Supplier<CompletableFuture<ToolResult>> invocation,
            Duration timeout) {
        CompletableFuture<ToolResult> future;
        try {
            future = invocation.get();
        } catch (RuntimeException e) { // NOSONAR - tools must never break the pipeline
            log.error("[Tools] Tool execution failed: {}", name, e);
            return ToolResult.failure(ToolErrorCode.EXECUTION_ERROR, safeCauseMessage(e));
        }
        if (future == null) {
            return ToolResult.failure(ToolErrorCode.EXECUTION_ERROR, "Tool returned no result: " + name);
        }

        try {
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure(ToolErrorCode.EXECUTION_ERROR, "Tool returned no result: " + name);
            }
            return result;
        } catch (TimeoutException e) {
            log.warn("[Tools] Tool '{}' timed out after {} ms", name, timeout.toMillis());
            return ToolResult.failure(ToolErrorCode.TIMEOUT,
                    "Tool '" + name + "' timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolErrorCode.EXECUTION_ERROR, "Interrupted while waiting for tool: " + name);
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", name, e);
            return ToolResult.failure(ToolErrorCode.EXECUTION_ERROR, safeCauseMessage(e));
        }
    }

    private ValidationResult safeValidate(ToolComponent tool, ToolParameters parameters) {
        try {
            ValidationResult result = tool.validate(parameters);
            return result != null ? result : ValidationResult.ok();
        } catch (RuntimeException e) {
            log.warn("[Tools] Validator of '{}' threw: {}", tool.getToolName(), e.getMessage());
            return ValidationResult.invalid(List.of("Validator failed: " + safeCauseMessage(e)));
        }
    }

    private ToolResult withTiming(ToolResult result, long startNanos) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        ToolExecutionMetadata metadata = result.getMetadata() != null
                ? result.getMetadata().toBuilder().executionTimeMs(elapsedMs).build()
                : ToolExecutionMetadata.builder().executionTimeMs(elapsedMs).build();
        return result.toBuilder().metadata(metadata).build();
    }

    private synchronized void recordStats(String name, ToolResult result) {
        totalExecutions++;
        if (result.isSuccess()) {
            successCount++;
        } else {
            errorCount++;
        }
        executionsByTool.merge(name, 1L, Long::sum);
        totalExecutionTimeMs += result.getMetadata().getExecutionTimeMs();
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
