package me.golemcore.orchestrator.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running dispatch statistics.
 *
 * @param totalExecutions
 *            dispatches that reached tool execution
 * @param successCount
 *            executions returning a successful result
 * @param errorCount
 *            executions returning a failure, timing out or throwing
 * @param executionsByTool
 *            per-tool execution counts in first-use order
 * @param averageExecutionTimeMs
 *            mean wall-clock time per execution
 */
public record ExecutionStats(long totalExecutions, long successCount, long errorCount,
        Map<String, Long> executionsByTool, double averageExecutionTimeMs) {

    public ExecutionStats {
        executionsByTool = Collections.unmodifiableMap(new LinkedHashMap<>(executionsByTool));
    }
}
