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

import me.golemcore.orchestrator.domain.model.PlanErrorCode;
import me.golemcore.orchestrator.domain.model.PlanStep;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders plan steps so that every step comes after all of its dependencies.
 *
 * <p>
 * Depth-first traversal in plan order with three node states. Reaching a step
 * that is still being visited means the dependencies form a cycle, which is
 * rejected instead of recursing forever.
 */
public final class PlanDependencyResolver {

    private enum Mark {
        VISITING, VISITED
    }

    private PlanDependencyResolver() {
    }

    /**
     * @throws PlanValidationException
     *             with {@link PlanErrorCode#DUPLICATE_STEP_ID},
     *             {@link PlanErrorCode#UNKNOWN_DEPENDENCY} or
     *             {@link PlanErrorCode#PLAN_CYCLE}
     */
    public static List<PlanStep> order(List<PlanStep> steps) {
        Map<String, PlanStep> byId = new LinkedHashMap<>();
        for (PlanStep step : steps) {
            if (byId.putIfAbsent(step.getId(), step) != null) {
                throw new PlanValidationException(PlanErrorCode.DUPLICATE_STEP_ID,
                        "Duplicate step id '" + step.getId() + "'");
            }
        }

        Map<String, Mark> marks = new HashMap<>();
        List<PlanStep> ordered = new ArrayList<>(byId.size());
        for (PlanStep step : byId.values()) {
            visit(step, byId, marks, ordered);
        }
        return ordered;
    }

    private static void visit(PlanStep step, Map<String, PlanStep> byId, Map<String, Mark> marks,
            List<PlanStep> ordered) {
        Mark mark = marks.get(step.getId());
        if (mark == Mark.VISITED) {
            return;
        }
        if (mark == Mark.VISITING) {
            throw new PlanValidationException(PlanErrorCode.PLAN_CYCLE,
                    "Dependency cycle detected at step '" + step.getId() + "'");
        }

        marks.put(step.getId(), Mark.VISITING);
        Set<String> dependencies = step.getDependencies() != null ? step.getDependencies() : Set.of();
        for (String dependencyId : dependencies) {
            PlanStep dependency = byId.get(dependencyId);
            if (dependency == null) {
                throw new PlanValidationException(PlanErrorCode.UNKNOWN_DEPENDENCY,
                        "Step '" + step.getId() + "' depends on unknown step '" + dependencyId + "'");
            }
            visit(dependency, byId, marks, ordered);
        }
        marks.put(step.getId(), Mark.VISITED);
        ordered.add(step);
    }
}
