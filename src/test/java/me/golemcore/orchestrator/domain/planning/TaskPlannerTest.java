package me.golemcore.orchestrator.domain.planning;

import me.golemcore.orchestrator.domain.model.ExecutionPlan;
import me.golemcore.orchestrator.domain.model.PlanErrorCode;
import me.golemcore.orchestrator.domain.model.PlanExecutionOptions;
import me.golemcore.orchestrator.domain.model.PlanExecutionReport;
import me.golemcore.orchestrator.domain.model.PlanStep;
import me.golemcore.orchestrator.domain.model.Reflection;
import me.golemcore.orchestrator.domain.model.StepResult;
import me.golemcore.orchestrator.domain.model.TodoItem;
import me.golemcore.orchestrator.domain.model.Understanding;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.IntentClassifierPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TaskPlannerTest {

    private IntentClassifierPort classifier;
    private TaskPlanner planner;

    @BeforeEach
    void setUp() {
        classifier = mock(IntentClassifierPort.class);
        when(classifier.classify(anyString())).thenReturn("debug");
        planner = new TaskPlanner(classifier, new OrchestratorProperties.PlanProperties());
    }

    // ==================== Understand ====================

    @Test
    void shouldUnderstandRequest() {
        Understanding understanding = planner.understand(
                "Fix the crash in src/app/user.ts without breaking the login flow. Make sure tests pass");

        assertEquals("debug", understanding.intent());
        assertEquals(List.of("src/app/user.ts"), understanding.entities().files());
        assertEquals(List.of("without breaking the login flow"), understanding.constraints());
        assertEquals(List.of("tests pass"), understanding.successCriteria());
    }

    @Test
    void shouldFallBackToUnknownIntent() {
        TaskPlanner failing = new TaskPlanner(message -> {
            throw new IllegalStateException("classifier down");
        }, new OrchestratorProperties.PlanProperties());
        TaskPlanner blank = new TaskPlanner(message -> "  ", new OrchestratorProperties.PlanProperties());

        assertEquals(TaskPlanner.UNKNOWN_INTENT, failing.understand("do something").intent());
        assertEquals(TaskPlanner.UNKNOWN_INTENT, blank.understand("do something").intent());
    }

    // ==================== Plan ====================

    @Test
    void shouldPlanFromIntentTemplate() {
        ExecutionPlan plan = planner.plan(understanding("implement"), "Add login");

        assertEquals(List.of("Analyze requirements", "Search for relevant files", "Read existing code",
                "Implement feature", "Run tests"),
                plan.getSteps().stream().map(PlanStep::getDescription).toList());
        assertEquals(4300, plan.getTotalEstimatedTokens());
        assertEquals(Set.of(), plan.getSteps().get(0).getDependencies());
        assertEquals(Set.of("4"), plan.getSteps().get(4).getDependencies());
        assertTrue(plan.getSteps().stream().allMatch(step -> step.getStatus() == PlanStep.StepStatus.PENDING));
        assertSame(plan, planner.getCurrentPlan().orElseThrow());
    }

    @Test
    void shouldUseDefaultTemplateForUnknownIntent() {
        ExecutionPlan plan = planner.plan(understanding("translate"), "Translate docs");

        assertEquals(List.of("Analyze task", "Execute task"),
                plan.getSteps().stream().map(PlanStep::getDescription).toList());
        assertEquals(1500, plan.getTotalEstimatedTokens());
    }

    // ==================== Execute ====================

    @Test
    void shouldRunStepsInDependencyOrderAndPassResults() {
        PlanStep second = step("b", "a");
        PlanStep first = step("a");
        ExecutionPlan plan = ExecutionPlan.of(List.of(second, first));
        List<String> order = new ArrayList<>();
        List<Map<String, Object>> seen = new ArrayList<>();

        PlanExecutionReport report = planner.execute(plan, (step, context) -> {
            order.add(step.getId());
            seen.add(Map.copyOf(context.previousResults()));
            return CompletableFuture.completedFuture(StepResult.success("result-" + step.getId()));
        }).join();

        assertEquals(List.of("a", "b"), order);
        assertEquals(Map.of(), seen.get(0));
        assertEquals(Map.of("a", "result-a"), seen.get(1));
        assertEquals(List.of("a", "b"), report.completedSteps());
        assertTrue(report.isSuccessful());
        assertEquals("result-b", second.getResult());
    }

    @Test
    void shouldRetryUntilSuccess() {
        PlanStep step = step("1");
        AtomicInteger calls = new AtomicInteger();

        planner.execute(ExecutionPlan.of(List.of(step)), (s, context) -> {
            if (calls.incrementAndGet() < 3) {
                return CompletableFuture.completedFuture(StepResult.retryableFailure("flaky"));
            }
            return CompletableFuture.completedFuture(StepResult.success("ok"));
        }).join();

        assertEquals(PlanStep.StepStatus.COMPLETED, step.getStatus());
        assertEquals(3, step.getAttempts());
        assertEquals(2, step.getRetryCount());
        assertNull(step.getError());
    }

    @Test
    void shouldFailAfterMaxRetriesAndBlockDependents() {
        PlanStep first = step("1");
        PlanStep second = step("2", "1");
        PlanStep third = step("3", "2");
        List<PlanStep> stuck = new ArrayList<>();
        List<String> executed = new ArrayList<>();
        PlanExecutionOptions options = PlanExecutionOptions.builder().onStuck(stuck::add).build();

        PlanExecutionReport report = planner.execute(ExecutionPlan.of(List.of(first, second, third)),
                (step, context) -> {
                    executed.add(step.getId());
                    return CompletableFuture.completedFuture(StepResult.retryableFailure("boom"));
                }, options).join();

        assertEquals(List.of("1", "1", "1"), executed);
        assertEquals(PlanStep.StepStatus.FAILED, first.getStatus());
        assertEquals(3, first.getAttempts());
        assertEquals("boom", first.getError());
        assertEquals(List.of(first), stuck);
        assertEquals(PlanStep.StepStatus.BLOCKED, second.getStatus());
        assertEquals("Blocked by failed dependency: 1", second.getError());
        assertEquals(PlanStep.StepStatus.BLOCKED, third.getStatus());
        assertEquals(List.of("1"), report.failedSteps());
        assertEquals(List.of("2", "3"), report.blockedSteps());
        assertFalse(report.isSuccessful());
    }

    @Test
    void shouldNotRetryNonRetryableFailure() {
        PlanStep step = step("1");

        planner.execute(ExecutionPlan.of(List.of(step)),
                (s, context) -> CompletableFuture.completedFuture(StepResult.failure("fatal"))).join();

        assertEquals(PlanStep.StepStatus.FAILED, step.getStatus());
        assertEquals(1, step.getAttempts());
    }

    @Test
    void shouldTreatExecutorExceptionsAsRetryable() {
        PlanStep step = step("1");
        AtomicInteger calls = new AtomicInteger();

        planner.execute(ExecutionPlan.of(List.of(step)), (s, context) -> {
            int call = calls.incrementAndGet();
            if (call == 1) {
                throw new IllegalStateException("thrown");
            }
            if (call == 2) {
                return CompletableFuture.failedFuture(new IllegalStateException("async failure"));
            }
            return CompletableFuture.completedFuture(StepResult.success("done"));
        }).join();

        assertEquals(PlanStep.StepStatus.COMPLETED, step.getStatus());
        assertEquals(3, step.getAttempts());
    }

    @Test
    void shouldRunDependentsWhenBlockingIsDisabled() {
        PlanStep first = step("1");
        PlanStep second = step("2", "1");
        PlanExecutionOptions options = PlanExecutionOptions.builder().maxRetries(1).skipBlockedSteps(false).build();

        planner.execute(ExecutionPlan.of(List.of(first, second)), (step, context) -> CompletableFuture
                .completedFuture("1".equals(step.getId()) ? StepResult.failure("no") : StepResult.success("yes")),
                options).join();

        assertEquals(PlanStep.StepStatus.FAILED, first.getStatus());
        assertEquals(PlanStep.StepStatus.COMPLETED, second.getStatus());
    }

    @Test
    void shouldIgnoreFailingStuckCallback() {
        PlanStep step = step("1");
        PlanExecutionOptions options = PlanExecutionOptions.builder()
                .onStuck(s -> {
                    throw new IllegalStateException("callback");
                })
                .build();

        PlanExecutionReport report = planner.execute(ExecutionPlan.of(List.of(step)),
                (s, context) -> CompletableFuture.completedFuture(StepResult.failure("fatal")), options).join();

        assertEquals(List.of("1"), report.failedSteps());
    }

    @Test
    void shouldRejectCyclicPlanWithoutRunningSteps() {
        PlanStep first = step("1", "2");
        PlanStep second = step("2", "1");
        AtomicInteger calls = new AtomicInteger();

        PlanExecutionReport report = planner.execute(ExecutionPlan.of(List.of(first, second)), (step, context) -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(StepResult.success(null));
        }).join();

        assertEquals(PlanErrorCode.PLAN_CYCLE, report.errorCode());
        assertEquals(0, calls.get());
        assertEquals(PlanStep.StepStatus.PENDING, first.getStatus());
        assertFalse(report.isSuccessful());
    }

    @Test
    void shouldRejectUnknownDependency() {
        PlanExecutionReport report = planner.execute(ExecutionPlan.of(List.of(step("1", "missing"))),
                (step, context) -> CompletableFuture.completedFuture(StepResult.success(null))).join();

        assertEquals(PlanErrorCode.UNKNOWN_DEPENDENCY, report.errorCode());
        assertTrue(report.errorMessage().contains("missing"));
    }

    @Test
    void shouldRejectDuplicateStepIdsWithoutRunningAnyStep() {
        PlanStep first = PlanStep.builder().id("1").description("First").dependencies(new LinkedHashSet<>()).build();
        PlanStep duplicate = PlanStep.builder().id("1").description("Duplicate").dependencies(new LinkedHashSet<>())
                .build();
        List<String> ran = new ArrayList<>();

        PlanExecutionReport report = planner.execute(ExecutionPlan.of(List.of(first, duplicate)), (step, context) -> {
            ran.add(step.getDescription());
            return CompletableFuture.completedFuture(StepResult.success(null));
        }).join();

        assertEquals(PlanErrorCode.DUPLICATE_STEP_ID, report.errorCode());
        assertFalse(report.isSuccessful());
        assertTrue(ran.isEmpty());
        assertEquals(PlanStep.StepStatus.PENDING, duplicate.getStatus());
    }

    @Test
    void shouldRejectNonPositiveMaxRetries() {
        ExecutionPlan plan = ExecutionPlan.of(List.of(step("1")));
        PlanExecutionOptions options = PlanExecutionOptions.builder().maxRetries(0).build();

        assertThrows(IllegalArgumentException.class, () -> planner.execute(plan,
                (step, context) -> CompletableFuture.completedFuture(StepResult.success(null)), options));
    }

    // ==================== Turns ====================

    @Test
    void shouldResumeFailedStepsOnNewTurnWithoutRerunningCompletedOnes() {
        ExecutionPlan plan = planner.plan(understanding("debug"), "Fix crash");
        List<String> executed = new ArrayList<>();
        AtomicInteger turn = new AtomicInteger(1);

        planner.execute(plan, (step, context) -> {
            executed.add(step.getId());
            if ("2".equals(step.getId()) && turn.get() == 1) {
                return CompletableFuture.completedFuture(StepResult.failure("not located"));
            }
            return CompletableFuture.completedFuture(StepResult.success("out-" + step.getId()));
        }).join();
        assertEquals(List.of("1", "2"), executed);
        assertEquals(2, plan.countByStatus(PlanStep.StepStatus.BLOCKED));

        planner.startNewTurn();
        turn.set(2);
        executed.clear();
        assertEquals(PlanStep.StepStatus.PENDING, plan.getSteps().get(1).getStatus());
        assertNull(plan.getSteps().get(1).getError());

        PlanExecutionReport report = planner.execute(plan, (step, context) -> {
            executed.add(step.getId());
            if ("2".equals(step.getId())) {
                assertEquals("out-1", context.previousResults().get("1"));
            }
            return CompletableFuture.completedFuture(StepResult.success("out-" + step.getId()));
        }).join();

        assertEquals(List.of("2", "3", "4"), executed);
        assertEquals(List.of("1", "2", "3", "4"), report.completedSteps());
    }

    // ==================== Reflect ====================

    @Test
    void shouldReflectOnSuccessfulPlan() {
        ExecutionPlan plan = planner.plan(understanding("implement"), "Add login");
        planner.execute(plan, (step, context) -> CompletableFuture.completedFuture(StepResult.success(null))).join();

        Reflection reflection = planner.reflect(plan);

        assertTrue(reflection.lessonsLearned().isEmpty());
        assertTrue(reflection.recommendations().isEmpty());
        assertEquals(List.of("All steps completed successfully", "Read-then-edit pattern detected"),
                reflection.patterns());
    }

    @Test
    void shouldReflectOnFailures() {
        ExecutionPlan plan = planner.plan(understanding("unknown"), "Do it");
        planner.execute(plan, (step, context) -> CompletableFuture.completedFuture(StepResult.failure("boom")))
                .join();

        Reflection reflection = planner.reflect(plan);

        assertEquals(List.of("1 steps failed - may need different approach", "Step \"Analyze task\" failed: boom"),
                reflection.lessonsLearned());
        assertEquals(List.of("Fix the failed dependency of step \"Execute task\" and run it again",
                TaskPlanner.SMALLER_STEPS_RECOMMENDATION), reflection.recommendations());
        assertTrue(reflection.patterns().isEmpty());
    }

    // ==================== Todo projection ====================

    @Test
    void shouldProjectPlanToTodoList() {
        ExecutionPlan plan = planner.plan(understanding("debug"), "Fix crash");
        plan.getSteps().get(0).setStatus(PlanStep.StepStatus.COMPLETED);
        plan.getSteps().get(1).setStatus(PlanStep.StepStatus.IN_PROGRESS);
        plan.getSteps().get(2).setStatus(PlanStep.StepStatus.FAILED);

        List<TodoItem> todos = planner.toTodoList(plan);

        assertEquals(new TodoItem("Understand the bug", "completed", "Understanding the bug"), todos.get(0));
        assertEquals(new TodoItem("Locate bug source", "in_progress", "Locating bug source"), todos.get(1));
        assertEquals(new TodoItem("Apply fix", "pending", "Applying fix"), todos.get(2));
        assertEquals("pending", todos.get(3).status());
    }

    @Test
    void shouldBuildActiveForm() {
        assertEquals("Analyzing requirements", TaskPlanner.toActiveForm("Analyze requirements"));
        assertEquals("Verifying fix", TaskPlanner.toActiveForm("Verify fix"));
        assertEquals("Reading relevant code", TaskPlanner.toActiveForm("Read relevant code"));
        assertEquals("", TaskPlanner.toActiveForm(""));
    }

    private static Understanding understanding(String intent) {
        return new Understanding(intent, null, null, null);
    }

    private static PlanStep step(String id, String... dependencies) {
        return PlanStep.builder()
                .id(id)
                .description("Step " + id)
                .dependencies(new LinkedHashSet<>(List.of(dependencies)))
                .build();
    }
}
