package me.golemcore.orchestrator.domain.service;

/**
 * Thrown when a tool cannot be registered, e.g. because its name is taken.
 */
public class ToolRegistrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ToolRegistrationException(String message) {
        super(message);
    }
}
