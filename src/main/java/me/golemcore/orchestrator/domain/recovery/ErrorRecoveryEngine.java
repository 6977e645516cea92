package me.golemcore.orchestrator.domain.recovery;

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
import me.golemcore.orchestrator.domain.model.Action;
import me.golemcore.orchestrator.domain.model.ActionHistoryEntry;
import me.golemcore.orchestrator.domain.model.AlternativeAction;
import me.golemcore.orchestrator.domain.model.ErrorClass;
import me.golemcore.orchestrator.domain.model.ErrorInfo;
import me.golemcore.orchestrator.domain.model.ErrorKind;
import me.golemcore.orchestrator.domain.model.LoopType;
import me.golemcore.orchestrator.domain.model.RecoveryStrategy;
import me.golemcore.orchestrator.domain.model.RecoveryStrategyType;
import me.golemcore.orchestrator.domain.model.TaskStatus;
import me.golemcore.orchestrator.domain.model.ToolParameters;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Failure and loop engine of one orchestration session.
 *
 * <p>
 * Keeps the append-only action log, per-action failure counters and per-task
 * status. From those it detects loops, proposes alternative actions, classifies
 * errors and decides when the user must be consulted.
 *
 * <p>
 * {@link #isRecoverable(ErrorInfo)} and {@link #getRecoveryStrategy(ErrorInfo)}
 * answer different questions: whether the exact same action may be retried,
 * and which different action to try. They may disagree, e.g. a missing file is
 * not retryable but still has a search-first strategy.
 */
@Slf4j
public class ErrorRecoveryEngine {

    static final int DEFAULT_ASK_USER_THRESHOLD = 3;
    static final int DEFAULT_COMPLETION_WINDOW = 5;

    private static final Set<ErrorKind> TRANSIENT_KINDS = EnumSet.of(
            ErrorKind.NETWORK_ERROR, ErrorKind.TIMEOUT, ErrorKind.COMMAND_FAILED);

    private static final Set<ErrorKind> NOT_RETRYABLE_KINDS = EnumSet.of(
            ErrorKind.INVALID_PATH, ErrorKind.SYNTAX_ERROR, ErrorKind.PERMISSION_DENIED, ErrorKind.FILE_NOT_FOUND);

    private final Clock clock;
    private final int askUserFailureThreshold;
    private final int completionWindow;

    private final List<ActionHistoryEntry> history = new ArrayList<>();
    private final Map<String, Integer> failures = new HashMap<>();
    private final Map<String, TaskStatus> taskStatus = new HashMap<>();
    private final Map<String, String> taskFailureReasons = new HashMap<>();
    private String currentTask;

    public ErrorRecoveryEngine(Clock clock) {
        this(clock, DEFAULT_ASK_USER_THRESHOLD, DEFAULT_COMPLETION_WINDOW);
    }

    public ErrorRecoveryEngine(Clock clock, int askUserFailureThreshold, int completionWindow) {
        if (askUserFailureThreshold <= 0 || completionWindow <= 0) {
            throw new IllegalArgumentException("Failure threshold and completion window must be positive");
        }
        this.clock = clock;
        this.askUserFailureThreshold = askUserFailureThreshold;
        this.completionWindow = completionWindow;
    }

    // ==================== Recording ====================

    public synchronized void recordAction(Action action) {
        history.add(ActionHistoryEntry.succeeded(action, clock.instant()));
    }

    public synchronized void recordFailure(Action action, ErrorInfo error) {
        ErrorInfo info = error != null ? error : ErrorInfo.of(ErrorKind.UNKNOWN, "");
        history.add(ActionHistoryEntry.failed(action, clock.instant(), info));
        failures.merge(action.key(), 1, Integer::sum);

        if (currentTask != null) {
            taskStatus.put(currentTask, TaskStatus.FAILED);
            taskFailureReasons.put(currentTask, info.message());
        }
        log.debug("[Recovery] Failure recorded for {}: {} ({})", action.tool(), info.type(), info.message());
    }

    public synchronized List<ActionHistoryEntry> getHistory() {
        return List.copyOf(history);
    }

    public synchronized int getFailureCount() {
        return failures.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Drops the action log but keeps failure counters and task status.
     */
    public synchronized void clearHistory() {
        history.clear();
    }

    public synchronized void reset() {
        history.clear();
        failures.clear();
        taskStatus.clear();
        taskFailureReasons.clear();
        currentTask = null;
    }

    // ==================== Loop detection ====================

    public synchronized boolean detectLoop() {
        LoopType type = getLoopType();
        if (type != LoopType.NONE) {
            log.warn("[Recovery] Loop detected: {}", type);
            return true;
        }
        return false;
    }

    public synchronized LoopType getLoopType() {
        return LoopDetector.detect(history.stream().map(ActionHistoryEntry::action).toList());
    }

    // ==================== Suggestions ====================

    /**
     * Proposes an action from a different tool family than the last recorded
     * one.
     */
    public synchronized AlternativeAction suggestAlternative() {
        if (history.isEmpty()) {
            return listDirectory(".", "No previous action to analyze");
        }
        Action last = history.get(history.size() - 1).action();
        String path = last.params().getString("path").orElse(null);

        return switch (last.tool()) {
        case ToolNames.GREP, ToolNames.SEARCH_CODE -> new AlternativeAction(ToolNames.GLOB,
                ToolParameters.of("pattern", "**/*"), "Try file pattern search instead of content search");
        case ToolNames.GLOB -> listDirectory(".", "List the directory instead of matching file patterns");
        case ToolNames.LIST_DIRECTORY -> new AlternativeAction(ToolNames.GLOB,
                ToolParameters.of("pattern", "**/*"), "Search files recursively instead of listing one directory");
        case ToolNames.READ_FILE -> listDirectory(parentDirectory(path), "List directory to find correct file");
        case ToolNames.EDIT_FILE, ToolNames.WRITE_FILE -> path != null
                ? new AlternativeAction(ToolNames.READ_FILE, ToolParameters.of("path", path),
                        "Re-read file to verify current content")
                : listDirectory(".", "Start fresh with directory listing");
        default -> listDirectory(".", "Start fresh with directory listing");
        };
    }

    /**
     * Proposes a modified retry of a specific failed action.
     */
    public AlternativeAction suggestRetry(Action action, ErrorInfo error) {
        ErrorKind kind = error != null ? error.type() : ErrorKind.UNKNOWN;
        switch (kind) {
        case FILE_NOT_FOUND: {
            String path = action.params().getString("path").orElse("");
            String baseName = path.substring(path.lastIndexOf('/') + 1);
            if (baseName.isEmpty()) {
                baseName = "*";
            }
            return new AlternativeAction(ToolNames.GLOB, ToolParameters.of("pattern", "**/*" + baseName),
                    "Search for file with similar name");
        }
        case NO_MATCHES: {
            String pattern = action.params().getString("pattern").orElse("");
            String simplified = pattern.split(" ", -1)[0];
            return new AlternativeAction(action.tool(), action.params().with("pattern", simplified),
                    "Try with simpler pattern");
        }
        default:
            return listDirectory(".", "Start with directory listing");
        }
    }

    public synchronized boolean shouldAskUser() {
        return getFailureCount() >= askUserFailureThreshold;
    }

    // ==================== Classification ====================

    /**
     * Whether blindly retrying the exact same action can succeed.
     */
    public boolean isRecoverable(ErrorInfo error) {
        return !NOT_RETRYABLE_KINDS.contains(kindOf(error));
    }

    public ErrorClass classifyError(ErrorInfo error) {
        return TRANSIENT_KINDS.contains(kindOf(error)) ? ErrorClass.TRANSIENT : ErrorClass.PERMANENT;
    }

    public String getHelpfulMessage(ErrorInfo error) {
        ErrorInfo info = error != null ? error : ErrorInfo.of(ErrorKind.UNKNOWN, "");
        return info.message() + " - " + info.type().getSuggestion();
    }

    public RecoveryStrategy getRecoveryStrategy(ErrorInfo error) {
        return switch (kindOf(error)) {
        case FILE_NOT_FOUND -> new RecoveryStrategy(RecoveryStrategyType.SEARCH_FIRST,
                List.of(ToolNames.GLOB, ToolNames.LIST_DIRECTORY), "Search for the file first");
        case NO_MATCHES -> new RecoveryStrategy(RecoveryStrategyType.BROADEN_SEARCH,
                List.of(ToolNames.GREP, ToolNames.GLOB), "Try a broader search pattern");
        case AMBIGUOUS -> new RecoveryStrategy(RecoveryStrategyType.ASK_USER, List.of(), "Ask user to clarify");
        case NETWORK_ERROR, TIMEOUT -> new RecoveryStrategy(RecoveryStrategyType.RETRY, List.of(),
                "Retry after brief wait");
        case INVALID_PATH, SYNTAX_ERROR -> new RecoveryStrategy(RecoveryStrategyType.ABORT, List.of(),
                "Cannot recover from this error");
        default -> new RecoveryStrategy(RecoveryStrategyType.ASK_USER, List.of(), "Ask user for guidance");
        };
    }

    // ==================== Task status ====================

    public synchronized void setCurrentTask(String taskId) {
        currentTask = taskId;
        taskStatus.putIfAbsent(taskId, TaskStatus.IN_PROGRESS);
    }

    public synchronized TaskStatus getTaskStatus(String taskId) {
        return taskStatus.getOrDefault(taskId, TaskStatus.UNKNOWN);
    }

    public synchronized Optional<String> getFailureReason(String taskId) {
        return Optional.ofNullable(taskFailureReasons.get(taskId));
    }

    /**
     * False while any of the most recent log entries is a failure.
     */
    public synchronized boolean canMarkComplete() {
        int from = Math.max(0, history.size() - completionWindow);
        return history.subList(from, history.size()).stream().allMatch(ActionHistoryEntry::success);
    }

    private static ErrorKind kindOf(ErrorInfo error) {
        return error != null ? error.type() : ErrorKind.UNKNOWN;
    }

    private static AlternativeAction listDirectory(String path, String reason) {
        return new AlternativeAction(ToolNames.LIST_DIRECTORY, ToolParameters.of("path", path), reason);
    }

    private static String parentDirectory(String path) {
        if (path == null) {
            return ".";
        }
        int slash = path.lastIndexOf('/');
        return slash > 0 ? path.substring(0, slash) : ".";
    }
}
