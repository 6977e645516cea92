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

import me.golemcore.orchestrator.domain.model.ActionHistoryEntry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the explanation shown to the user when the agent loop stops on an
 * iteration limit or a detected loop, so the user never gets an empty answer.
 *
 * <p>
 * The report lists what was attempted, what went wrong and a concrete next
 * step keyed by the last tool used.
 */
public final class ExhaustionReportBuilder {

    static final String LOOP_ISSUE = "Loop detected: Repeatedly using same tools without making progress";
    static final String LIMIT_ISSUE = "Iteration limit reached without completing task";

    private static final int MAX_REPORTED_FAILURES = 3;

    private ExhaustionReportBuilder() {
    }

    public static String build(ErrorRecoveryEngine engine) {
        return build(engine.getHistory(), engine.detectLoop());
    }

    public static String build(List<ActionHistoryEntry> history, boolean loopDetected) {
        StringBuilder sb = new StringBuilder();
        sb.append("I attempted to complete your request but encountered difficulties:\n\n");
        sb.append("**Attempted:**\n").append(summarizeToolCalls(history)).append("\n\n");
        sb.append("**Issue:**\n").append(loopDetected ? LOOP_ISSUE : LIMIT_ISSUE);

        List<ActionHistoryEntry> failed = history.stream().filter(entry -> !entry.success()).toList();
        if (!failed.isEmpty()) {
            List<ActionHistoryEntry> recent = failed.subList(Math.max(0, failed.size() - MAX_REPORTED_FAILURES),
                    failed.size());
            for (ActionHistoryEntry entry : recent) {
                sb.append("\n- ").append(entry.action().tool()).append(" failed: ")
                        .append(entry.error().message());
            }
        }

        sb.append("\n\n**Suggestion:**\n").append(suggest(history)).append("\n\n");
        sb.append("Would you like me to try that, or would you prefer to provide more guidance?");
        return sb.toString();
    }

    static String summarizeToolCalls(List<ActionHistoryEntry> history) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ActionHistoryEntry entry : history) {
            counts.merge(entry.action().tool(), 1, Integer::sum);
        }
        if (counts.isEmpty()) {
            return "- No tool calls were made";
        }

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            sb.append("- Called ").append(entry.getKey());
            if (entry.getValue() > 1) {
                sb.append(' ').append(entry.getValue()).append(" times");
            }
        }
        return sb.toString();
    }

    static String suggest(List<ActionHistoryEntry> history) {
        if (history.isEmpty()) {
            return "Try a different approach or ask for clarification";
        }
        String lastTool = history.get(history.size() - 1).action().tool();
        return switch (lastTool) {
        case ToolNames.READ_FILE -> "Try using grep to search for specific patterns instead of reading entire files";
        case ToolNames.GREP, ToolNames.SEARCH_CODE ->
            "Try reading the full file or asking for clarification about what to search for";
        case ToolNames.EDIT_FILE -> "Re-read the file to verify the exact content before attempting to edit";
        default -> "Let me know what you'd like me to focus on, or try a different approach";
        };
    }
}
