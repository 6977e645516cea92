package me.golemcore.orchestrator.domain.model;

/**
 * Whether an error is expected to clear up on its own.
 */
public enum ErrorClass {
    TRANSIENT, PERMANENT
}
