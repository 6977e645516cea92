package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.ToolParameters;
import me.golemcore.orchestrator.domain.model.ValidationResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Validates tool parameters against a JSON-Schema-like declaration.
 *
 * <p>
 * Supported subset: {@code properties} with {@code type} of {@code string},
 * {@code integer}, {@code number} or {@code boolean}, {@code enum} on
 * properties, {@code required}, and {@code additionalProperties: false}.
 * Anything else in the schema is ignored.
 */
public final class ParameterSchemaValidator {

    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_REQUIRED = "required";
    private static final String KEY_TYPE = "type";
    private static final String KEY_ENUM = "enum";
    private static final String KEY_ADDITIONAL = "additionalProperties";

    private ParameterSchemaValidator() {
    }

    public static ValidationResult validate(Map<String, Object> schema, ToolParameters parameters) {
        if (schema == null || schema.isEmpty()) {
            return ValidationResult.ok();
        }
        ToolParameters params = parameters != null ? parameters : ToolParameters.empty();
        List<String> errors = new ArrayList<>();

        Map<String, Object> properties = asMap(schema.get(KEY_PROPERTIES));

        for (String required : asStrings(schema.get(KEY_REQUIRED))) {
            if (!params.contains(required)) {
                errors.add("Missing required parameter: " + required);
            }
        }

        for (Map.Entry<String, Object> entry : params.asMap().entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            Map<String, Object> property = asMap(properties.get(name));

            if (!properties.containsKey(name)) {
                if (Boolean.FALSE.equals(schema.get(KEY_ADDITIONAL))) {
                    errors.add("Unknown parameter: " + name);
                }
                continue;
            }

            Object declaredType = property.get(KEY_TYPE);
            if (declaredType instanceof String type && !matchesType(type, value)) {
                errors.add("Parameter '" + name + "' must be of type " + type);
                continue;
            }

            List<String> allowed = asStrings(property.get(KEY_ENUM));
            if (!allowed.isEmpty() && !allowed.contains(String.valueOf(value))) {
                errors.add("Parameter '" + name + "' must be one of " + allowed);
            }
        }

        return ValidationResult.of(errors);
    }

    private static boolean matchesType(String type, Object value) {
        return switch (type) {
        case "string" -> value instanceof String;
        case "integer" -> value instanceof Long;
        case "number" -> value instanceof Long || value instanceof Double;
        case "boolean" -> value instanceof Boolean;
        default -> true;
        };
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    private static List<String> asStrings(Object value) {
        if (!(value instanceof Collection<?> collection)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(collection.size());
        for (Object item : collection) {
            result.add(String.valueOf(item));
        }
        return result;
    }
}
