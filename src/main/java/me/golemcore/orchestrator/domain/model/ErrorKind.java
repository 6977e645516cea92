package me.golemcore.orchestrator.domain.model;

/**
 * Closed taxonomy of failures reported by tools to the recovery engine. Each
 * kind carries a fixed human-readable suggestion.
 */
public enum ErrorKind {

    FILE_NOT_FOUND("File not found. Suggestion: Use glob or list_directory to find the correct file path."),

    INVALID_PATH("Invalid path. Suggestion: Check for path traversal or invalid characters."),

    SYNTAX_ERROR("Syntax error in code. Suggestion: Review the syntax and fix before retrying."),

    NETWORK_ERROR("Network error. Suggestion: Retry the operation after a brief wait."),

    COMMAND_FAILED("Command failed. Suggestion: Check command syntax or try alternative approach."),

    NO_MATCHES("No matches found. Suggestion: Broaden your search pattern or check spelling."),

    EDIT_CONFLICT("Edit conflict. Suggestion: Re-read the file and verify the old string matches exactly."),

    AMBIGUOUS("Ambiguous request. Suggestion: Ask user for clarification."),

    PERMISSION_DENIED("Permission denied. Suggestion: Check file permissions or run with elevated privileges."),

    TIMEOUT("Operation timed out. Suggestion: Try with smaller input or increase timeout."),

    UNKNOWN("Unknown error. Suggestion: Review the error message and try a different approach.");

    private final String suggestion;

    ErrorKind(String suggestion) {
        this.suggestion = suggestion;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
