package me.golemcore.orchestrator.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered steps produced by the planner for one request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionPlan {

    private List<PlanStep> steps = new ArrayList<>();
    private int totalEstimatedTokens;

    public static ExecutionPlan of(List<PlanStep> steps) {
        int total = steps.stream().mapToInt(PlanStep::getEstimatedTokens).sum();
        return new ExecutionPlan(new ArrayList<>(steps), total);
    }

    public Optional<PlanStep> findStep(String id) {
        return steps.stream().filter(step -> step.getId().equals(id)).findFirst();
    }

    @JsonIgnore
    public long countByStatus(PlanStep.StepStatus status) {
        return steps.stream().filter(step -> step.getStatus() == status).count();
    }
}
