package me.golemcore.orchestrator.domain.planning;

import me.golemcore.orchestrator.domain.model.PlanErrorCode;

/**
 * Thrown when a plan's dependencies reference unknown steps or form a cycle.
 */
public class PlanValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final PlanErrorCode errorCode;

    public PlanValidationException(PlanErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PlanErrorCode getErrorCode() {
        return errorCode;
    }
}
