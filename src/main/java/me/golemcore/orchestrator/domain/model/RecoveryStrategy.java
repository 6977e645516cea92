package me.golemcore.orchestrator.domain.model;

import java.util.List;

/**
 * Recommended recovery for an error kind.
 *
 * @param type
 *            strategy category
 * @param actions
 *            tool names to try, in order
 * @param suggestion
 *            short human-readable advice
 */
public record RecoveryStrategy(RecoveryStrategyType type, List<String> actions, String suggestion) {

    public RecoveryStrategy {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
