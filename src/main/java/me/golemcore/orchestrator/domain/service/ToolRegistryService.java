package me.golemcore.orchestrator.domain.service;

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
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.ToolDeclaration;
import me.golemcore.orchestrator.domain.model.ToolExecutionContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name-to-tool registry. Preserves registration order and rejects duplicate
 * names. Lifecycle hooks are run for every tool even when some of them fail.
 *
 * <p>
 * Tool beans found in the application context are registered at startup in
 * bean order. Access is synchronized so the registry can be shared between
 * concurrent sessions.
 */
@Service
@Slf4j
public class ToolRegistryService {

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

    public ToolRegistryService() {
    }

    @Autowired
    public ToolRegistryService(ObjectProvider<ToolComponent> toolBeans) {
        toolBeans.orderedStream().forEach(this::register);
    }

    public synchronized void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new ToolRegistrationException("Tool name must not be blank: " + tool.getClass().getName());
        }
        if (tools.containsKey(name)) {
            throw new ToolRegistrationException("Tool \"" + name + "\" is already registered");
        }
        tools.put(name, tool);
        log.info("[Registry] Registered tool '{}' v{}", name, tool.getDefinition().getVersion());
    }

    public synchronized boolean unregister(String name) {
        boolean removed = tools.remove(name) != null;
        if (removed) {
            log.debug("[Registry] Unregistered tool '{}'", name);
        }
        return removed;
    }

    public synchronized Optional<ToolComponent> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized boolean has(String name) {
        return tools.containsKey(name);
    }

    public synchronized List<ToolComponent> getAll() {
        return List.copyOf(tools.values());
    }

    public synchronized List<String> getNames() {
        return List.copyOf(tools.keySet());
    }

    /**
     * Declarations suitable for presentation to the LLM: name, description and
     * parameter schema only.
     */
    public List<ToolDeclaration> getDeclarations() {
        return getAll().stream()
                .map(tool -> tool.getDefinition().toDeclaration())
                .toList();
    }

    /**
     * Runs every tool's initialize hook.
     *
     * @return names of tools whose hook failed
     */
    public List<String> initializeAll(ToolExecutionContext context) {
        List<String> failed = new ArrayList<>();
        List<ToolComponent> snapshot = getAll();
        for (ToolComponent tool : snapshot) {
            try {
                tool.initialize(context);
            } catch (RuntimeException e) {
                log.error("[Registry] Failed to initialize tool '{}'", tool.getToolName(), e);
                failed.add(tool.getToolName());
            }
        }
        log.info("[Registry] Initialized {} tools ({} failed)", snapshot.size(), failed.size());
        return failed;
    }

    /**
     * Runs every tool's shutdown hook.
     *
     * @return names of tools whose hook failed
     */
    public List<String> shutdownAll() {
        List<String> failed = new ArrayList<>();
        for (ToolComponent tool : getAll()) {
            try {
                tool.shutdown();
            } catch (RuntimeException e) {
                log.error("[Registry] Failed to shutdown tool '{}'", tool.getToolName(), e);
                failed.add(tool.getToolName());
            }
        }
        return failed;
    }
}
