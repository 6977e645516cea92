package me.golemcore.orchestrator.domain.planning;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ExecutionPlan;
import me.golemcore.orchestrator.domain.model.PlanExecutionOptions;
import me.golemcore.orchestrator.domain.model.PlanExecutionReport;
import me.golemcore.orchestrator.domain.model.PlanStep;
import me.golemcore.orchestrator.domain.model.Reflection;
import me.golemcore.orchestrator.domain.model.StepExecutionContext;
import me.golemcore.orchestrator.domain.model.StepResult;
import me.golemcore.orchestrator.domain.model.TodoItem;
import me.golemcore.orchestrator.domain.model.Understanding;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.IntentClassifierPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Four-phase task planner: understand a request, plan steps from a template,
 * execute them in dependency order with retries, and reflect on the outcome.
 *
 * <p>
 * Steps run strictly one at a time. A step is only started once all of its
 * dependencies are terminal. Steps whose dependency failed or was blocked are
 * marked {@link PlanStep.StepStatus#BLOCKED} and never reach the step
 * executor. Steps already completed in an earlier turn are not re-run; their
 * results are still passed to later steps.
 */
@Slf4j
public class TaskPlanner {

    public static final String UNKNOWN_INTENT = "unknown";
    static final String SMALLER_STEPS_RECOMMENDATION = "Break the task into smaller steps";

    private final IntentClassifierPort intentClassifier;
    private final OrchestratorProperties.PlanProperties properties;

    private ExecutionPlan currentPlan;

    public TaskPlanner(IntentClassifierPort intentClassifier, OrchestratorProperties.PlanProperties properties) {
        this.intentClassifier = intentClassifier;
        this.properties = properties;
    }

    // ==================== Understand ====================

    public Understanding understand(String message) {
        String text = message != null ? message : "";
        return new Understanding(classifyIntent(text),
                UnderstandingExtractor.extractEntities(text),
                UnderstandingExtractor.extractConstraints(text),
                UnderstandingExtractor.extractSuccessCriteria(text));
    }

    private String classifyIntent(String message) {
        try {
            String intent = intentClassifier.classify(message);
            return intent != null && !intent.isBlank() ? intent : UNKNOWN_INTENT;
        } catch (RuntimeException e) { // NOSONAR - classifier is external
            log.warn("[Plan] Intent classification failed: {}", e.getMessage());
            return UNKNOWN_INTENT;
        }
    }

    // ==================== Plan ====================

    public synchronized ExecutionPlan plan(Understanding understanding, String taskDescription) {
        ExecutionPlan plan = ExecutionPlan.of(PlanTemplates.stepsFor(understanding.intent()));
        log.info("[Plan] Planned {} steps for intent '{}' ({} tokens): {}", plan.getSteps().size(),
                understanding.intent(), plan.getTotalEstimatedTokens(), taskDescription);
        currentPlan = plan;
        return plan;
    }

    public synchronized Optional<ExecutionPlan> getCurrentPlan() {
        return Optional.ofNullable(currentPlan);
    }

    // ==================== Execute ====================

    public CompletableFuture<PlanExecutionReport> execute(ExecutionPlan plan, StepExecutor stepExecutor) {
        return execute(plan, stepExecutor, PlanExecutionOptions.builder()
                .maxRetries(properties.getMaxRetries())
                .skipBlockedSteps(properties.isSkipBlockedSteps())
                .build());
    }

    /**
     * Runs the plan. The returned future completes with a report once every
     * step is terminal. An invalid plan completes immediately with a report
     * carrying the plan-level error code and no step is run.
     */
    public CompletableFuture<PlanExecutionReport> execute(ExecutionPlan plan, StepExecutor stepExecutor,
            PlanExecutionOptions options) {
        if (options.getMaxRetries() <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive: " + options.getMaxRetries());
        }

        List<PlanStep> ordered;
        try {
            ordered = PlanDependencyResolver.order(plan.getSteps());
        } catch (PlanValidationException e) {
            log.warn("[Plan] Rejected plan: {}", e.getMessage());
            return CompletableFuture.completedFuture(PlanExecutionReport.rejected(e.getErrorCode(), e.getMessage()));
        }

        log.info("[Plan] Executing {} steps", ordered.size());
        Map<String, Object> previousResults = new LinkedHashMap<>();
        StepExecutionContext context = new StepExecutionContext(previousResults);

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (PlanStep step : ordered) {
            chain = chain.thenCompose(ignored -> runStep(plan, step, stepExecutor, context, previousResults,
                    options));
        }
        return chain.thenApply(ignored -> buildReport(ordered));
    }

    private CompletableFuture<Void> runStep(ExecutionPlan plan, PlanStep step, StepExecutor stepExecutor,
            StepExecutionContext context, Map<String, Object> previousResults, PlanExecutionOptions options) {
        if (step.getStatus() == PlanStep.StepStatus.COMPLETED) {
            previousResults.put(step.getId(), step.getResult());
            log.debug("[Plan] Step {} already completed, skipping", step.getId());
            return CompletableFuture.completedFuture(null);
        }

        if (options.isSkipBlockedSteps()) {
            Optional<String> blocker = findUnfinishedDependency(plan, step);
            if (blocker.isPresent()) {
                step.setStatus(PlanStep.StepStatus.BLOCKED);
                step.setError("Blocked by failed dependency: " + blocker.get());
                log.warn("[Plan] Step {} blocked by step {}", step.getId(), blocker.get());
                return CompletableFuture.completedFuture(null);
            }
        }

        step.setStatus(PlanStep.StepStatus.IN_PROGRESS);
        step.setRetryCount(0);
        step.setAttempts(0);
        log.info("[Plan] Executing step {}: {}", step.getId(), step.getDescription());
        return attempt(step, stepExecutor, context, previousResults, options);
    }

    private Optional<String> findUnfinishedDependency(ExecutionPlan plan, PlanStep step) {
        if (step.getDependencies() == null) {
            return Optional.empty();
        }
        for (String dependencyId : step.getDependencies()) {
            Optional<PlanStep> dependency = plan.findStep(dependencyId);
            if (dependency.isPresent() && (dependency.get().getStatus() == PlanStep.StepStatus.FAILED
                    || dependency.get().getStatus() == PlanStep.StepStatus.BLOCKED)) {
                return Optional.of(dependencyId);
            }
        }
        return Optional.empty();
    }

    private CompletableFuture<Void> attempt(PlanStep step, StepExecutor stepExecutor, StepExecutionContext context,
            Map<String, Object> previousResults, PlanExecutionOptions options) {
        step.setAttempts(step.getAttempts() + 1);
        return invoke(stepExecutor, step, context).thenCompose(result -> {
            if (result.success()) {
                step.setStatus(PlanStep.StepStatus.COMPLETED);
                step.setResult(result.result());
                step.setError(null);
                previousResults.put(step.getId(), result.result());
                log.info("[Plan] Step {} completed after {} attempt(s)", step.getId(), step.getAttempts());
                return CompletableFuture.completedFuture(null);
            }

            step.setRetryCount(step.getRetryCount() + 1);
            step.setError(result.error());
            if (!result.retryable() || step.getRetryCount() >= options.getMaxRetries()) {
                step.setStatus(PlanStep.StepStatus.FAILED);
                log.warn("[Plan] Step {} failed after {} attempt(s): {}", step.getId(), step.getAttempts(),
                        result.error());
                notifyStuck(options.getOnStuck(), step);
                return CompletableFuture.completedFuture(null);
            }

            log.debug("[Plan] Retrying step {} ({}/{})", step.getId(), step.getRetryCount(), options.getMaxRetries());
            return attempt(step, stepExecutor, context, previousResults, options);
        });
    }

    private CompletableFuture<StepResult> invoke(StepExecutor stepExecutor, PlanStep step,
            StepExecutionContext context) {
        CompletableFuture<StepResult> future;
        try {
            future = stepExecutor.execute(step, context);
        } catch (RuntimeException e) { // NOSONAR - executor failures count as retryable
            log.warn("[Plan] Step {} executor threw: {}", step.getId(), e.getMessage());
            return CompletableFuture.completedFuture(StepResult.retryableFailure(describe(e)));
        }
        if (future == null) {
            return CompletableFuture.completedFuture(StepResult.retryableFailure("Step executor returned no result"));
        }
        return future.handle((result, error) -> {
            if (error != null) {
                return StepResult.retryableFailure(describe(error));
            }
            return result != null ? result : StepResult.retryableFailure("Step executor returned no result");
        });
    }

    private void notifyStuck(Consumer<PlanStep> onStuck, PlanStep step) {
        if (onStuck == null) {
            return;
        }
        try {
            onStuck.accept(step);
        } catch (RuntimeException e) {
            log.warn("[Plan] onStuck callback failed for step {}: {}", step.getId(), e.getMessage());
        }
    }

    private PlanExecutionReport buildReport(List<PlanStep> ordered) {
        List<String> completed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> blocked = new ArrayList<>();
        for (PlanStep step : ordered) {
            switch (step.getStatus()) {
            case COMPLETED -> completed.add(step.getId());
            case FAILED -> failed.add(step.getId());
            case BLOCKED -> blocked.add(step.getId());
            default -> log.debug("[Plan] Step {} left in status {}", step.getId(), step.getStatus());
            }
        }
        log.info("[Plan] Finished: {} completed, {} failed, {} blocked", completed.size(), failed.size(),
                blocked.size());
        return new PlanExecutionReport(completed, failed, blocked, null, null);
    }

    private static String describe(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }

    // ==================== Reflect ====================

    public Reflection reflect(ExecutionPlan plan) {
        List<String> lessons = new ArrayList<>();
        List<String> patterns = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        List<PlanStep> failed = plan.getSteps().stream()
                .filter(step -> step.getStatus() == PlanStep.StepStatus.FAILED)
                .toList();
        if (!failed.isEmpty()) {
            lessons.add(failed.size() + " steps failed - may need different approach");
            for (PlanStep step : failed) {
                if (step.getError() != null) {
                    lessons.add("Step \"" + step.getDescription() + "\" failed: " + step.getError());
                }
            }
        }

        for (PlanStep step : plan.getSteps()) {
            if (step.getStatus() == PlanStep.StepStatus.BLOCKED) {
                recommendations.add("Fix the failed dependency of step \"" + step.getDescription()
                        + "\" and run it again");
            }
        }
        if (!failed.isEmpty()) {
            recommendations.add(SMALLER_STEPS_RECOMMENDATION);
        }

        if (plan.countByStatus(PlanStep.StepStatus.COMPLETED) == plan.getSteps().size()) {
            patterns.add("All steps completed successfully");
        }

        boolean hasRead = plan.getSteps().stream()
                .anyMatch(step -> descriptionContains(step, "read"));
        boolean hasEdit = plan.getSteps().stream()
                .anyMatch(step -> descriptionContains(step, "implement") || descriptionContains(step, "apply"));
        if (hasRead && hasEdit) {
            patterns.add("Read-then-edit pattern detected");
        }

        return new Reflection(lessons, patterns, recommendations);
    }

    private static boolean descriptionContains(PlanStep step, String word) {
        return step.getDescription() != null && step.getDescription().toLowerCase(Locale.ROOT).contains(word);
    }

    // ==================== Turns ====================

    /**
     * Resets failed and blocked steps of the current plan to pending so they can
     * run again. Completed steps keep their results.
     */
    public synchronized void startNewTurn() {
        if (currentPlan == null) {
            return;
        }
        for (PlanStep step : currentPlan.getSteps()) {
            if (step.getStatus() == PlanStep.StepStatus.FAILED || step.getStatus() == PlanStep.StepStatus.BLOCKED) {
                step.setStatus(PlanStep.StepStatus.PENDING);
                step.setRetryCount(0);
                step.setAttempts(0);
                step.setError(null);
            }
        }
    }

    // ==================== Todo projection ====================

    public List<TodoItem> toTodoList(ExecutionPlan plan) {
        return plan.getSteps().stream()
                .map(step -> new TodoItem(step.getDescription(), todoStatus(step.getStatus()),
                        toActiveForm(step.getDescription())))
                .toList();
    }

    private static String todoStatus(PlanStep.StepStatus status) {
        return switch (status) {
        case COMPLETED -> "completed";
        case IN_PROGRESS -> "in_progress";
        default -> "pending";
        };
    }

    static String toActiveForm(String description) {
        if (description == null || description.isEmpty()) {
            return "";
        }
        String[] words = description.split(" ", -1);
        String verb = words[0].toLowerCase(Locale.ROOT);
        String gerund;
        if (verb.endsWith("e")) {
            gerund = verb.substring(0, verb.length() - 1) + "ing";
        } else if (verb.endsWith("y")) {
            gerund = verb.substring(0, verb.length() - 1) + "ying";
        } else {
            gerund = verb + "ing";
        }
        words[0] = Character.toUpperCase(gerund.charAt(0)) + gerund.substring(1);
        return String.join(" ", words);
    }
}
