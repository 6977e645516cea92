package me.golemcore.orchestrator.domain.session;

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
import me.golemcore.orchestrator.cache.BoundedCache;
import me.golemcore.orchestrator.domain.context.ContextBudgeter;
import me.golemcore.orchestrator.domain.planning.TaskPlanner;
import me.golemcore.orchestrator.domain.recovery.ErrorRecoveryEngine;
import me.golemcore.orchestrator.domain.recovery.IterationGuard;
import me.golemcore.orchestrator.domain.service.ToolExecutionService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.IntentClassifierPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Creates {@link OrchestrationSession}s. Each session gets fresh per-session
 * state configured from {@link OrchestratorProperties}; the tool executor is
 * shared.
 *
 * <p>
 * Intent classification is supplied by the host through an
 * {@link IntentClassifierPort} bean. Without one, every request is planned
 * with the default template.
 */
@Component
@Slf4j
public class OrchestrationSessionFactory {

    private final OrchestratorProperties properties;
    private final Clock clock;
    private final ToolExecutionService toolExecutor;
    private final IntentClassifierPort intentClassifier;

    public OrchestrationSessionFactory(OrchestratorProperties properties, Clock clock,
            ToolExecutionService toolExecutor, ObjectProvider<IntentClassifierPort> intentClassifier) {
        this.properties = properties;
        this.clock = clock;
        this.toolExecutor = toolExecutor;
        this.intentClassifier = intentClassifier.getIfAvailable(() -> message -> TaskPlanner.UNKNOWN_INTENT);
    }

    public OrchestrationSession create() {
        return create(UUID.randomUUID().toString());
    }

    public OrchestrationSession create(String sessionId) {
        OrchestratorProperties.RecoveryProperties recovery = properties.getRecovery();
        OrchestratorProperties.ContextProperties context = properties.getContext();
        OrchestratorProperties.CacheProperties cache = properties.getCache();

        OrchestrationSession session = new OrchestrationSession(
                sessionId,
                toolExecutor,
                new ErrorRecoveryEngine(clock, recovery.getAskUserFailureThreshold(), recovery.getCompletionWindow()),
                new ContextBudgeter(clock, context.getTokenBudget(), context.getTruncationThreshold()),
                new BoundedCache<>(cache.getSearchCapacity()),
                new BoundedCache<>(cache.getGrepCapacity()),
                new TaskPlanner(intentClassifier, properties.getPlan()),
                new IterationGuard(properties.getIteration()));
        log.debug("[Session {}] Created", sessionId);
        return session;
    }
}
