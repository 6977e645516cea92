package me.golemcore.orchestrator.domain.model;

/**
 * Outcome of one call into a step executor.
 *
 * @param success
 *            whether the step succeeded
 * @param result
 *            step output, exposed to later steps through
 *            {@link StepExecutionContext#previousResults()}
 * @param error
 *            failure description
 * @param retryable
 *            whether the planner may call the executor again for this step
 */
public record StepResult(boolean success, Object result, String error, boolean retryable) {

    public static StepResult success(Object result) {
        return new StepResult(true, result, null, false);
    }

    public static StepResult failure(String error) {
        return new StepResult(false, null, error, false);
    }

    public static StepResult retryableFailure(String error) {
        return new StepResult(false, null, error, true);
    }
}
