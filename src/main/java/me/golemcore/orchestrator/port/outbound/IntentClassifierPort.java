package me.golemcore.orchestrator.port.outbound;

/**
 * Port to the external intent classifier.
 *
 * <p>
 * Returns an intent label such as {@code implement}, {@code debug},
 * {@code refactor} or {@code explain}. Unknown labels are planned with the
 * generic two-step template.
 */
@FunctionalInterface
public interface IntentClassifierPort {

    String classify(String message);
}
