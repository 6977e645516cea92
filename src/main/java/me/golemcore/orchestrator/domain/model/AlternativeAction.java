package me.golemcore.orchestrator.domain.model;

/**
 * A different action suggested instead of repeating a failing one.
 *
 * @param tool
 *            tool to call
 * @param params
 *            parameters for the call
 * @param reason
 *            why this alternative is suggested
 */
public record AlternativeAction(String tool, ToolParameters params, String reason) {

    public Action toAction() {
        return new Action(tool, params);
    }
}
