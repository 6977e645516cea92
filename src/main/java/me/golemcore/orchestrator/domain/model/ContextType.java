package me.golemcore.orchestrator.domain.model;

/**
 * Relationship of a context fragment to the current task.
 */
public enum ContextType {
    CURRENT_FILE, IMPORT, DEPENDENCY, OTHER
}
