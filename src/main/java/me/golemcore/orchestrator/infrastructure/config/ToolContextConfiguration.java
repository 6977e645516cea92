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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ToolExecutionContext;
import me.golemcore.orchestrator.port.outbound.CodeIntelligencePort;
import me.golemcore.orchestrator.port.outbound.ConfirmationPort;
import me.golemcore.orchestrator.port.outbound.FileSystemPort;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Builds the default {@link ToolExecutionContext} handed to tools. The
 * code-intelligence engine and the confirmation channel are optional: they are
 * wired only when the host application provides a bean for them.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ToolContextConfiguration {

    static final String TOOL_LOGGER_NAME = "me.golemcore.orchestrator.tools";

    private final OrchestratorProperties properties;

    @Bean
    public ToolExecutionContext defaultToolExecutionContext(FileSystemPort fileSystem,
            ObjectProvider<CodeIntelligencePort> codeIntelligence,
            ObjectProvider<ConfirmationPort> confirmation) {
        Path workingDirectory = resolveWorkingDirectory(properties.getTools().getWorkingDirectory());
        ToolExecutionContext context = ToolExecutionContext.builder()
                .fileSystem(fileSystem)
                .codeIntelligence(codeIntelligence.getIfAvailable())
                .confirmation(confirmation.getIfAvailable())
                .workingDirectory(workingDirectory)
                .logger(LoggerFactory.getLogger(TOOL_LOGGER_NAME))
                .build();
        log.info("[Tools] Working directory: {} (code intelligence: {}, confirmation: {})", workingDirectory,
                context.getCodeIntelligence() != null, context.getConfirmation() != null);
        return context;
    }

    static Path resolveWorkingDirectory(String configured) {
        if (configured == null || configured.isBlank()) {
            return Path.of("").toAbsolutePath().normalize();
        }
        return Path.of(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }
}
