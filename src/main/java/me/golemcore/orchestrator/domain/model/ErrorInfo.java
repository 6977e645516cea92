package me.golemcore.orchestrator.domain.model;

/**
 * Classified failure of an action.
 *
 * @param type
 *            error kind
 * @param message
 *            original error message
 */
public record ErrorInfo(ErrorKind type, String message) {

    public ErrorInfo {
        if (type == null) {
            type = ErrorKind.UNKNOWN;
        }
        if (message == null) {
            message = "";
        }
    }

    public static ErrorInfo of(ErrorKind type, String message) {
        return new ErrorInfo(type, message);
    }
}
