package me.golemcore.orchestrator.domain.model;

import java.time.Instant;

/**
 * One entry of the append-only action log.
 *
 * @param action
 *            attempted action
 * @param timestamp
 *            when it was recorded
 * @param success
 *            whether it succeeded
 * @param error
 *            failure details, {@code null} on success
 */
public record ActionHistoryEntry(Action action, Instant timestamp, boolean success, ErrorInfo error) {

    public static ActionHistoryEntry succeeded(Action action, Instant timestamp) {
        return new ActionHistoryEntry(action, timestamp, true, null);
    }

    public static ActionHistoryEntry failed(Action action, Instant timestamp, ErrorInfo error) {
        return new ActionHistoryEntry(action, timestamp, false, error);
    }
}
