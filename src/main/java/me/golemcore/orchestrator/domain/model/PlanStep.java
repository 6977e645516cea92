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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single step of an {@link ExecutionPlan}. Created once per plan generation
 * and mutated only by the execution routine currently running the plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanStep {

    private String id;
    private String description;

    @Builder.Default
    private StepStatus status = StepStatus.PENDING;

    private int estimatedTokens;

    @Builder.Default
    private Set<String> dependencies = new LinkedHashSet<>();

    private Object result;
    private String error;

    /**
     * Number of failed attempts in the current execution.
     */
    private int retryCount;

    /**
     * Number of calls into the step executor in the current execution.
     */
    private int attempts;

    public boolean isTerminal() {
        return status == StepStatus.COMPLETED || status == StepStatus.FAILED || status == StepStatus.BLOCKED;
    }

    /**
     * Step execution states. {@code BLOCKED} marks a step that was not run
     * because one of its dependencies did not complete.
     */
    public enum StepStatus {
        PENDING, IN_PROGRESS, COMPLETED, FAILED, BLOCKED
    }
}
