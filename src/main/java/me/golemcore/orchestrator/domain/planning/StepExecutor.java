package me.golemcore.orchestrator.domain.planning;

import me.golemcore.orchestrator.domain.model.PlanStep;
import me.golemcore.orchestrator.domain.model.StepExecutionContext;
import me.golemcore.orchestrator.domain.model.StepResult;

import java.util.concurrent.CompletableFuture;

/**
 * Runs one plan step on behalf of the planner. Supplied by the caller of
 * {@link TaskPlanner#execute}.
 */
@FunctionalInterface
public interface StepExecutor {

    CompletableFuture<StepResult> execute(PlanStep step, StepExecutionContext context);
}
