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

/**
 * Result of a tool dispatch. Produced fresh by every call and never mutated
 * afterwards; the executor derives a copy via {@code toBuilder()} when it
 * attaches timing metadata.
 */
@Value
@Builder(toBuilder = true)
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    boolean success;
    Object data;
    ToolError error;
    ToolExecutionMetadata metadata;

    /**
     * Creates a successful tool result with structured data.
     */
    public static ToolResult success(Object data) {
        return ToolResult.builder()
                .success(true)
                .data(data)
                .build();
    }

    /**
     * Creates a failed tool result with a dispatch error code.
     */
    public static ToolResult failure(ToolErrorCode code, String message) {
        return ToolResult.builder()
                .success(false)
                .error(ToolError.of(code, message))
                .build();
    }

    /**
     * Creates a failed tool result with a tool-specific error code.
     */
    public static ToolResult failure(String code, String message) {
        return ToolResult.builder()
                .success(false)
                .error(new ToolError(code, message, null))
                .build();
    }

    public boolean hasErrorCode(ToolErrorCode code) {
        return error != null && error.hasCode(code);
    }
}
