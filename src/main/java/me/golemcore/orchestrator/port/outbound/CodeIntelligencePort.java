package me.golemcore.orchestrator.port.outbound;

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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Port to the native code-intelligence engine (symbol search, dependency graph,
 * references). Results are opaque JSON trees produced by the engine and passed
 * through to tools unchanged.
 */
public interface CodeIntelligencePort {

    List<JsonNode> search(String path, String query);

    JsonNode getSymbolInfo(String file, String symbol);

    JsonNode getImportsExports(String file);

    JsonNode buildDependencyGraph(String path);

    JsonNode resolveSymbol(String symbol, String file);

    List<JsonNode> findReferences(String symbol, String path);

    String generateRepoMap(String path);
}
