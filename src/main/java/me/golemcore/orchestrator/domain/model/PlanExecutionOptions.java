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

import lombok.Builder;
import lombok.Value;

import java.util.function.Consumer;

/**
 * Options of a plan execution.
 */
@Value
@Builder
public class PlanExecutionOptions {

    @Builder.Default
    int maxRetries = 3;

    /**
     * Mark steps whose dependency did not complete as blocked instead of
     * running them.
     */
    @Builder.Default
    boolean skipBlockedSteps = true;

    /**
     * Called for each step that fails after exhausting its retries or with a
     * non-retryable result.
     */
    Consumer<PlanStep> onStuck;

    public static PlanExecutionOptions defaults() {
        return PlanExecutionOptions.builder().build();
    }
}
