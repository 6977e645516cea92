package me.golemcore.orchestrator.domain.model;

/**
 * Plan-level failures detected before any step runs.
 */
public enum PlanErrorCode {
    UNKNOWN_DEPENDENCY, PLAN_CYCLE, DUPLICATE_STEP_ID
}
