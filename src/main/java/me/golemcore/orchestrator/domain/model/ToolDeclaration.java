package me.golemcore.orchestrator.domain.model;

import java.util.Map;

/**
 * What the LLM sees of a registered tool. Capability flags are not part of
 * it.
 *
 * @param name
 *            tool name
 * @param description
 *            human-readable description
 * @param parameters
 *            parameter schema
 */
public record ToolDeclaration(String name, String description, Map<String, Object> parameters) {
}
