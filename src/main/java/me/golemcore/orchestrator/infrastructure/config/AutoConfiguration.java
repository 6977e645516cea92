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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ToolExecutionContext;
import me.golemcore.orchestrator.domain.service.ToolRegistryService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Startup wiring of the orchestrator.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} used for action and context timestamps</li>
 * <li>Runs the initialize hook of every registered tool on startup</li>
 * <li>Runs the shutdown hook of every registered tool on context close</li>
 * </ul>
 *
 * <p>
 * A failing hook is logged and does not prevent the other tools from starting
 * or stopping.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final OrchestratorProperties properties;
    private final ToolRegistryService toolRegistry;
    private final ToolExecutionContext defaultToolExecutionContext;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @PostConstruct
    public void init() {
        log.info("=== golemcore-orchestrator starting ===");
        log.info("Tools: {}", toolRegistry.getNames());
        log.info("Tool timeout: {}, token budget: {}, max plan retries: {}",
                properties.getTools().getDefaultTimeout(),
                properties.getContext().getTokenBudget(),
                properties.getPlan().getMaxRetries());

        List<String> failed = toolRegistry.initializeAll(defaultToolExecutionContext);
        if (!failed.isEmpty()) {
            log.warn("[Registry] Tools failed to initialize: {}", failed);
        }
    }

    @PreDestroy
    public void shutdown() {
        List<String> failed = toolRegistry.shutdownAll();
        if (!failed.isEmpty()) {
            log.warn("[Registry] Tools failed to shut down: {}", failed);
        }
    }
}
