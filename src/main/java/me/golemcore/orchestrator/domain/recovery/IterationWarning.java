package me.golemcore.orchestrator.domain.recovery;

/**
 * Warning levels raised as the agent loop approaches its iteration limit.
 */
public enum IterationWarning {

    NONE(""),

    FIRST("tool calls made - consider summarizing progress or changing approach"),

    SECOND("tool calls made - please wrap up soon"),

    FINAL("tool calls made - final iteration, must provide response");

    private final String message;

    IterationWarning(String message) {
        this.message = message;
    }

    public String format(int iterations) {
        return this == NONE ? "" : iterations + " " + message;
    }
}
