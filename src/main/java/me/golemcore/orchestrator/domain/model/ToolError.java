package me.golemcore.orchestrator.domain.model;

/**
 * Error part of a {@link ToolResult}.
 *
 * @param code
 *            machine-readable code, either a {@link ToolErrorCode} name or a
 *            tool-specific code
 * @param message
 *            human-readable message
 * @param details
 *            optional structured details, e.g. validation errors
 */
public record ToolError(String code, String message, Object details) {

    public static ToolError of(ToolErrorCode code, String message) {
        return new ToolError(code.name(), message, null);
    }

    public static ToolError of(ToolErrorCode code, String message, Object details) {
        return new ToolError(code.name(), message, details);
    }

    public boolean hasCode(ToolErrorCode expected) {
        return expected.name().equals(code);
    }
}
