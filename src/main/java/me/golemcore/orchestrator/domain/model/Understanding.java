package me.golemcore.orchestrator.domain.model;

import java.util.List;

/**
 * What the planner understood from a user request.
 *
 * @param intent
 *            classified intent, e.g. {@code implement} or {@code debug}
 * @param entities
 *            code entities named in the request
 * @param constraints
 *            constraint phrases such as "without breaking the API"
 * @param successCriteria
 *            normalized success criteria
 */
public record Understanding(String intent, Entities entities, List<String> constraints,
        List<String> successCriteria) {

    public Understanding {
        entities = entities != null ? entities : Entities.none();
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
    }

    /**
     * Files, classes and functions mentioned in a request, in order of first
     * appearance.
     */
    public record Entities(List<String> files, List<String> classes, List<String> functions) {

        public Entities {
            files = files == null ? List.of() : List.copyOf(files);
            classes = classes == null ? List.of() : List.copyOf(classes);
            functions = functions == null ? List.of() : List.copyOf(functions);
        }

        public static Entities none() {
            return new Entities(List.of(), List.of(), List.of());
        }
    }
}
