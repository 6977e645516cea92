package me.golemcore.orchestrator.domain.planning;

import me.golemcore.orchestrator.domain.model.PlanStep;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed step templates per intent. Steps get ids "1".."n" and each step
 * depends on the previous one.
 */
final class PlanTemplates {

    private record StepTemplate(String description, int estimatedTokens) {
    }

    private static final List<StepTemplate> DEFAULT_TEMPLATE = List.of(
            new StepTemplate("Analyze task", 500),
            new StepTemplate("Execute task", 1000));

    private static final Map<String, List<StepTemplate>> TEMPLATES = Map.of(
            "implement", List.of(
                    new StepTemplate("Analyze requirements", 500),
                    new StepTemplate("Search for relevant files", 300),
                    new StepTemplate("Read existing code", 1000),
                    new StepTemplate("Implement feature", 2000),
                    new StepTemplate("Run tests", 500)),
            "debug", List.of(
                    new StepTemplate("Understand the bug", 500),
                    new StepTemplate("Locate bug source", 800),
                    new StepTemplate("Apply fix", 1000),
                    new StepTemplate("Verify fix", 500)),
            "refactor", List.of(
                    new StepTemplate("Analyze current code", 800),
                    new StepTemplate("Plan refactoring", 500),
                    new StepTemplate("Apply changes", 1500),
                    new StepTemplate("Verify tests pass", 500)),
            "explain", List.of(
                    new StepTemplate("Read relevant code", 1000),
                    new StepTemplate("Analyze structure", 500),
                    new StepTemplate("Generate explanation", 800)));

    private PlanTemplates() {
    }

    static List<PlanStep> stepsFor(String intent) {
        List<StepTemplate> template = intent != null ? TEMPLATES.getOrDefault(intent, DEFAULT_TEMPLATE)
                : DEFAULT_TEMPLATE;

        List<PlanStep> steps = new ArrayList<>(template.size());
        for (int i = 0; i < template.size(); i++) {
            Set<String> dependencies = new LinkedHashSet<>();
            if (i > 0) {
                dependencies.add(String.valueOf(i));
            }
            steps.add(PlanStep.builder()
                    .id(String.valueOf(i + 1))
                    .description(template.get(i).description())
                    .estimatedTokens(template.get(i).estimatedTokens())
                    .dependencies(dependencies)
                    .build());
        }
        return steps;
    }
}
