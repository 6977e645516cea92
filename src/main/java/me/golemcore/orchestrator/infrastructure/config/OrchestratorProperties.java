package me.golemcore.orchestrator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code orchestrator.*} prefix:
 * <ul>
 * <li>{@link ToolsProperties} - dispatch timeout and working directory</li>
 * <li>{@link ContextProperties} - token budget of the context budgeter</li>
 * <li>{@link RecoveryProperties} - failure thresholds of the recovery
 * engine</li>
 * <li>{@link PlanProperties} - retry budget and blocked-step policy</li>
 * <li>{@link CacheProperties} - per-session lookup cache sizes</li>
 * <li>{@link IterationProperties} - agent loop iteration limits</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private ToolsProperties tools = new ToolsProperties();
    private ContextProperties context = new ContextProperties();
    private RecoveryProperties recovery = new RecoveryProperties();
    private PlanProperties plan = new PlanProperties();
    private CacheProperties cache = new CacheProperties();
    private IterationProperties iteration = new IterationProperties();

    @Data
    public static class ToolsProperties {
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private String workingDirectory = "";
    }

    @Data
    public static class ContextProperties {
        private int tokenBudget = 8000;
        private int truncationThreshold = 10;
    }

    @Data
    public static class RecoveryProperties {
        private int askUserFailureThreshold = 3;
        private int completionWindow = 5;
    }

    @Data
    public static class PlanProperties {
        private int maxRetries = 3;
        private boolean skipBlockedSteps = true;
    }

    @Data
    public static class CacheProperties {
        private int searchCapacity = 50;
        private int grepCapacity = 50;
    }

    @Data
    public static class IterationProperties {
        private int maxIterations = 16;
        private int firstWarning = 10;
        private int secondWarning = 13;
        private int finalWarning = 15;
    }
}
