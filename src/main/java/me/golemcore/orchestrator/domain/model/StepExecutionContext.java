package me.golemcore.orchestrator.domain.model;

import java.util.Collections;
import java.util.Map;

/**
 * Context passed to a step executor: results of the steps completed so far,
 * keyed by step id.
 */
public record StepExecutionContext(Map<String, Object> previousResults) {

    public StepExecutionContext {
        previousResults = Collections.unmodifiableMap(previousResults);
    }
}
