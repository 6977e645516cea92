package me.golemcore.orchestrator.domain.model;

import java.util.List;

/**
 * Summary of a finished plan execution.
 *
 * @param completedSteps
 *            ids of completed steps, in execution order
 * @param failedSteps
 *            ids of steps that failed themselves
 * @param blockedSteps
 *            ids of steps skipped because a dependency did not complete
 * @param errorCode
 *            plan-level failure, or {@code null} when the plan was valid
 * @param errorMessage
 *            description of the plan-level failure
 */
public record PlanExecutionReport(List<String> completedSteps, List<String> failedSteps, List<String> blockedSteps,
        PlanErrorCode errorCode, String errorMessage) {

    public PlanExecutionReport {
        completedSteps = List.copyOf(completedSteps);
        failedSteps = List.copyOf(failedSteps);
        blockedSteps = List.copyOf(blockedSteps);
    }

    public static PlanExecutionReport rejected(PlanErrorCode errorCode, String errorMessage) {
        return new PlanExecutionReport(List.of(), List.of(), List.of(), errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return errorCode == null && failedSteps.isEmpty() && blockedSteps.isEmpty();
    }
}
