package me.golemcore.orchestrator.domain.model;

import java.util.List;

/**
 * Outcome of parameter validation.
 *
 * @param valid
 *            whether the parameters are acceptable
 * @param errors
 *            one message per problem, empty when valid
 */
public record ValidationResult(boolean valid, List<String> errors) {

    private static final ValidationResult OK = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(false, errors);
    }

    public static ValidationResult of(List<String> errors) {
        return errors == null || errors.isEmpty() ? OK : invalid(errors);
    }
}
