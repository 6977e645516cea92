package me.golemcore.orchestrator.domain.model;

/**
 * Machine-readable dispatch failure codes.
 *
 * <p>
 * Narrower than {@link ErrorKind}: these describe why the dispatch pipeline
 * could not produce a tool's own result.
 */
public enum ToolErrorCode {

    /**
     * No tool registered under the requested name.
     */
    TOOL_NOT_FOUND,

    /**
     * Parameters rejected by the tool's validator; execution did not start.
     */
    VALIDATION_ERROR,

    /**
     * The tool did not complete before the dispatch timeout.
     */
    TIMEOUT,

    /**
     * The tool threw or completed exceptionally.
     */
    EXECUTION_ERROR
}
