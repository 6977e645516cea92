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

import java.nio.file.Path;
import java.time.Duration;

/**
 * Per-call dispatch options. Unset fields fall back to the executor defaults
 * and to the default execution context.
 */
@Value
@Builder
public class ExecutionOptions {

    private static final ExecutionOptions DEFAULTS = ExecutionOptions.builder().build();

    Duration timeout;
    boolean skipValidation;

    /**
     * Overrides the working directory of the effective context.
     */
    Path workingDirectory;

    /**
     * Overrides the cancellation signal of the effective context.
     */
    CancellationSignal cancellationSignal;

    public static ExecutionOptions defaults() {
        return DEFAULTS;
    }

    public static ExecutionOptions withTimeout(Duration timeout) {
        return ExecutionOptions.builder().timeout(timeout).build();
    }
}
