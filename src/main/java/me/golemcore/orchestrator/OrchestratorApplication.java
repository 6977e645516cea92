package me.golemcore.orchestrator;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class of the golemcore orchestrator.
 *
 * <p>
 * The orchestrator is the core of a coding agent that sits between a language
 * model and a set of tools.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Tool Dispatch</b> - registry plus an executor that validates, times
 * out and never throws</li>
 * <li><b>Failure &amp; Loop Engine</b> - action log, loop detection and
 * recovery strategies</li>
 * <li><b>Context Budgeter</b> - tiered selection of context within a token
 * budget</li>
 * <li><b>Task Planner</b> - understand, plan, execute with retries,
 * reflect</li>
 * <li><b>Bounded Cache</b> - per-session LRU caches for search results</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code orchestrator.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }

}
