package me.golemcore.orchestrator.domain.recovery;

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
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;

/**
 * Counts tool-call iterations of one agent turn and reports the configured
 * warning levels. Warnings fire exactly once, on the iteration that reaches
 * each threshold.
 */
@Slf4j
public class IterationGuard {

    private final int maxIterations;
    private final int firstWarning;
    private final int secondWarning;
    private final int finalWarning;

    private int iterations;

    public IterationGuard(OrchestratorProperties.IterationProperties properties) {
        this(properties.getMaxIterations(), properties.getFirstWarning(), properties.getSecondWarning(),
                properties.getFinalWarning());
    }

    public IterationGuard(int maxIterations, int firstWarning, int secondWarning, int finalWarning) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (firstWarning > secondWarning || secondWarning > finalWarning || finalWarning >= maxIterations) {
            throw new IllegalArgumentException("Warning thresholds must be ascending and below maxIterations");
        }
        this.maxIterations = maxIterations;
        this.firstWarning = firstWarning;
        this.secondWarning = secondWarning;
        this.finalWarning = finalWarning;
    }

    /**
     * Records one completed iteration and returns the warning it triggers.
     */
    public synchronized IterationWarning recordIteration() {
        iterations++;
        IterationWarning warning = warningAt(iterations);
        if (warning != IterationWarning.NONE) {
            log.warn("[Iteration] {}", warning.format(iterations));
        }
        return warning;
    }

    public IterationWarning warningAt(int iteration) {
        if (iteration == finalWarning) {
            return IterationWarning.FINAL;
        }
        if (iteration == secondWarning) {
            return IterationWarning.SECOND;
        }
        if (iteration == firstWarning) {
            return IterationWarning.FIRST;
        }
        return IterationWarning.NONE;
    }

    public synchronized boolean isLimitReached() {
        return iterations >= maxIterations;
    }

    public synchronized int getIterations() {
        return iterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public synchronized void reset() {
        iterations = 0;
    }
}
