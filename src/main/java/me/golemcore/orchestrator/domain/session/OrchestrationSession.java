package me.golemcore.orchestrator.domain.session;

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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.cache.BoundedCache;
import me.golemcore.orchestrator.domain.context.ContextBudgeter;
import me.golemcore.orchestrator.domain.model.Action;
import me.golemcore.orchestrator.domain.model.ErrorInfo;
import me.golemcore.orchestrator.domain.model.ErrorKind;
import me.golemcore.orchestrator.domain.model.ToolErrorCode;
import me.golemcore.orchestrator.domain.model.ToolExecutionMetadata;
import me.golemcore.orchestrator.domain.model.ToolParameters;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.planning.TaskPlanner;
import me.golemcore.orchestrator.domain.recovery.ErrorRecoveryEngine;
import me.golemcore.orchestrator.domain.recovery.ExhaustionReportBuilder;
import me.golemcore.orchestrator.domain.recovery.IterationGuard;
import me.golemcore.orchestrator.domain.recovery.ToolNames;
import me.golemcore.orchestrator.domain.service.ToolExecutionService;

import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * State of one conversation with the agent: failure engine, context budget,
 * search caches, planner and iteration guard. Nothing here is shared between
 * sessions.
 *
 * <p>
 * {@link #executeTool} is the single entry point of the agent loop for tool
 * calls: it serves repeated searches from the session caches, dispatches
 * through the shared executor and feeds the outcome into the failure engine.
 * A call without a tool name comes back as a {@code TOOL_NOT_FOUND} failure.
 */
@Slf4j
@Getter
public class OrchestrationSession {

    static final String UNNAMED_TOOL = "unnamed_tool";

    private final String id;
    private final ErrorRecoveryEngine recoveryEngine;
    private final ContextBudgeter contextBudgeter;
    private final BoundedCache<String, ToolResult> searchCache;
    private final BoundedCache<String, ToolResult> grepCache;
    private final TaskPlanner taskPlanner;
    private final IterationGuard iterationGuard;

    private final ToolExecutionService toolExecutor;

    OrchestrationSession(String id, ToolExecutionService toolExecutor, ErrorRecoveryEngine recoveryEngine,
            ContextBudgeter contextBudgeter, BoundedCache<String, ToolResult> searchCache,
            BoundedCache<String, ToolResult> grepCache, TaskPlanner taskPlanner, IterationGuard iterationGuard) {
        this.id = id;
        this.toolExecutor = toolExecutor;
        this.recoveryEngine = recoveryEngine;
        this.contextBudgeter = contextBudgeter;
        this.searchCache = searchCache;
        this.grepCache = grepCache;
        this.taskPlanner = taskPlanner;
        this.iterationGuard = iterationGuard;
    }

    public ToolResult executeTool(String toolName, ToolParameters params) {
        if (toolName == null || toolName.isBlank()) {
            log.warn("[Session {}] Tool call without a tool name", id);
            ToolResult rejected = toolExecutor.execute(toolName, params);
            recoveryEngine.recordFailure(Action.of(UNNAMED_TOOL), toErrorInfo(rejected));
            iterationGuard.recordIteration();
            return rejected;
        }

        long startNanos = System.nanoTime();
        Action action = new Action(toolName, params);
        Optional<BoundedCache<String, ToolResult>> cache = cacheFor(toolName);

        Optional<ToolResult> cached = cache.flatMap(c -> c.get(action.key()));
        ToolResult result;
        if (cached.isPresent()) {
            log.debug("[Session {}] Cache hit for {}", id, toolName);
            result = fromCache(cached.get(), startNanos);
        } else {
            ToolResult fresh = toolExecutor.execute(toolName, action.params());
            if (fresh.isSuccess()) {
                cache.ifPresent(c -> c.set(action.key(), fresh));
            }
            result = fresh;
        }

        if (result.isSuccess()) {
            recoveryEngine.recordAction(action);
        } else {
            recoveryEngine.recordFailure(action, toErrorInfo(result));
        }
        iterationGuard.recordIteration();
        return result;
    }

    /**
     * Whether the agent loop has to stop: a loop was detected or the iteration
     * limit is reached.
     */
    public boolean isExhausted() {
        return recoveryEngine.detectLoop() || iterationGuard.isLimitReached();
    }

    public String buildExhaustionReport() {
        return ExhaustionReportBuilder.build(recoveryEngine);
    }

    /**
     * Starts a new user turn: resets the iteration count and re-opens failed
     * plan steps.
     */
    public void startNewTurn() {
        iterationGuard.reset();
        taskPlanner.startNewTurn();
    }

    private static ToolResult fromCache(ToolResult cached, long startNanos) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        ToolExecutionMetadata metadata = cached.getMetadata() != null
                ? cached.getMetadata().toBuilder().executionTimeMs(elapsedMs).build()
                : ToolExecutionMetadata.builder().executionTimeMs(elapsedMs).build();
        return cached.toBuilder().metadata(metadata).build();
    }

    private Optional<BoundedCache<String, ToolResult>> cacheFor(String toolName) {
        return switch (toolName) {
        case ToolNames.GLOB, ToolNames.SEARCH_CODE -> Optional.of(searchCache);
        case ToolNames.GREP -> Optional.of(grepCache);
        default -> Optional.empty();
        };
    }

    static ErrorInfo toErrorInfo(ToolResult result) {
        if (result.getError() == null) {
            return ErrorInfo.of(ErrorKind.UNKNOWN, "Tool failed without error details");
        }
        String code = result.getError().code();
        String message = result.getError().message();
        if (ToolErrorCode.TIMEOUT.name().equals(code)) {
            return ErrorInfo.of(ErrorKind.TIMEOUT, message);
        }
        ErrorKind kind = Arrays.stream(ErrorKind.values())
                .filter(candidate -> candidate.name().equals(code))
                .findFirst()
                .orElse(ErrorKind.UNKNOWN);
        return ErrorInfo.of(kind, message);
    }
}
