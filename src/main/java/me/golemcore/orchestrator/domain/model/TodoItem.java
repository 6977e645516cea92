package me.golemcore.orchestrator.domain.model;

/**
 * Progress-UI projection of a plan step.
 *
 * @param content
 *            step description
 * @param status
 *            {@code pending}, {@code in_progress} or {@code completed}
 * @param activeForm
 *            gerund form of the description, e.g. "Running tests"
 */
public record TodoItem(String content, String status, String activeForm) {
}
