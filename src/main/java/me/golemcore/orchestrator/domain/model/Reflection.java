package me.golemcore.orchestrator.domain.model;

import java.util.List;

/**
 * Post-execution review of a plan.
 */
public record Reflection(List<String> lessonsLearned, List<String> patterns, List<String> recommendations) {

    public Reflection {
        lessonsLearned = List.copyOf(lessonsLearned);
        patterns = List.copyOf(patterns);
        recommendations = List.copyOf(recommendations);
    }
}
