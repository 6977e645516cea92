package me.golemcore.orchestrator.domain.model;

import java.util.Map;

/**
 * A tool invocation attempted by the agent: tool name plus parameters.
 *
 * <p>
 * Two actions are the same action when their {@link #key()} matches. The key
 * is built from the canonical (sorted-key) parameter encoding, so the order in
 * which parameters were supplied never affects identity.
 *
 * @param tool
 *            tool name
 * @param params
 *            validated primitive parameters
 */
public record Action(String tool, ToolParameters params) {

    public Action {
        if (tool == null || tool.isBlank()) {
            throw new IllegalArgumentException("Action tool must not be blank");
        }
        if (params == null) {
            params = ToolParameters.empty();
        }
    }

    public static Action of(String tool) {
        return new Action(tool, ToolParameters.empty());
    }

    public static Action of(String tool, Map<String, ?> params) {
        return new Action(tool, ToolParameters.of(params));
    }

    /**
     * Canonical identity key, e.g. {@code read_file:{"limit":10,"path":"a.ts"}}.
     */
    public String key() {
        return tool + ":" + params.toCanonicalJson();
    }
}
