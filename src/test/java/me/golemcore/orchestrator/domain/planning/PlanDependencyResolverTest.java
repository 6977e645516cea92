package me.golemcore.orchestrator.domain.planning;

import me.golemcore.orchestrator.domain.model.PlanErrorCode;
import me.golemcore.orchestrator.domain.model.PlanStep;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PlanDependencyResolverTest {

    @Test
    void shouldPlaceDependenciesFirst() {
        List<PlanStep> ordered = PlanDependencyResolver.order(List.of(
                step("deploy", "test", "build"),
                step("test", "build"),
                step("build"),
                step("docs")));

        assertEquals(List.of("build", "test", "deploy", "docs"), ordered.stream().map(PlanStep::getId).toList());
    }

    @Test
    void shouldKeepPlanOrderForIndependentSteps() {
        List<PlanStep> ordered = PlanDependencyResolver.order(List.of(step("c"), step("a"), step("b")));

        assertEquals(List.of("c", "a", "b"), ordered.stream().map(PlanStep::getId).toList());
    }

    @Test
    void shouldTolerateMissingDependencySet() {
        PlanStep step = step("1");
        step.setDependencies(null);

        assertEquals(List.of(step), PlanDependencyResolver.order(List.of(step)));
    }

    @Test
    void shouldRejectCycle() {
        PlanValidationException error = assertThrows(PlanValidationException.class,
                () -> PlanDependencyResolver.order(List.of(step("1", "3"), step("2", "1"), step("3", "2"))));

        assertEquals(PlanErrorCode.PLAN_CYCLE, error.getErrorCode());
    }

    @Test
    void shouldRejectSelfDependency() {
        PlanValidationException error = assertThrows(PlanValidationException.class,
                () -> PlanDependencyResolver.order(List.of(step("1", "1"))));

        assertEquals(PlanErrorCode.PLAN_CYCLE, error.getErrorCode());
    }

    @Test
    void shouldRejectUnknownDependency() {
        PlanValidationException error = assertThrows(PlanValidationException.class,
                () -> PlanDependencyResolver.order(List.of(step("1"), step("2", "7"))));

        assertEquals(PlanErrorCode.UNKNOWN_DEPENDENCY, error.getErrorCode());
        assertEquals("Step '2' depends on unknown step '7'", error.getMessage());
    }

    @Test
    void shouldRejectDuplicateStepId() {
        PlanValidationException error = assertThrows(PlanValidationException.class,
                () -> PlanDependencyResolver.order(List.of(step("1"), step("2", "1"), step("1"))));

        assertEquals(PlanErrorCode.DUPLICATE_STEP_ID, error.getErrorCode());
        assertEquals("Duplicate step id '1'", error.getMessage());
    }

    private static PlanStep step(String id, String... dependencies) {
        return PlanStep.builder()
                .id(id)
                .description("Step " + id)
                .dependencies(new LinkedHashSet<>(List.of(dependencies)))
                .build();
    }
}
