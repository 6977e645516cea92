package me.golemcore.orchestrator.domain.model;

import java.util.List;

/**
 * Diagnostics collected by {@code markUsed}. Has no effect on selection.
 *
 * @param filesUsed
 *            distinct sources marked as used, in first-use order
 * @param totalTurns
 *            number of {@code markUsed} calls
 * @param tokenUsage
 *            selected-context token total after each call
 */
public record ContextUsageStats(List<String> filesUsed, int totalTurns, List<Integer> tokenUsage) {

    public ContextUsageStats {
        filesUsed = List.copyOf(filesUsed);
        tokenUsage = List.copyOf(tokenUsage);
    }
}
