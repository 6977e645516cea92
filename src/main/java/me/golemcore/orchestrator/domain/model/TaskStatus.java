package me.golemcore.orchestrator.domain.model;

/**
 * Status of a task tracked by the recovery engine. There is no completed state
 * here: completion is asserted by the caller once the engine allows it.
 */
public enum TaskStatus {
    IN_PROGRESS, FAILED, UNKNOWN
}
