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
import lombok.Data;

/**
 * Capability flags of a tool. Used by the orchestrator for policy decisions and
 * never sent to the LLM.
 */
@Data
@Builder
public class ToolCapabilities {

    private boolean writesFiles;
    private boolean executesCommands;
    private boolean requiresExternalEngine;
    private boolean accessesNetwork;
    private boolean idempotent;
    private boolean retryable;

    /**
     * Capabilities of a side-effect free tool that may be retried freely.
     */
    public static ToolCapabilities readOnly() {
        return ToolCapabilities.builder()
                .idempotent(true)
                .retryable(true)
                .build();
    }
}
