package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.ToolParameters;
import me.golemcore.orchestrator.domain.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParameterSchemaValidatorTest {

    private static final Map<String, Object> READ_FILE_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "path", Map.of("type", "string"),
                    "offset", Map.of("type", "integer"),
                    "mode", Map.of("type", "string", "enum", List.of("text", "binary"))),
            "required", List.of("path"),
            "additionalProperties", false);

    @Test
    void shouldAcceptValidParameters() {
        ValidationResult result = ParameterSchemaValidator.validate(READ_FILE_SCHEMA,
                ToolParameters.of("path", "a.ts", "offset", 10));

        assertTrue(result.valid());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void shouldReportMissingRequiredParameter() {
        ValidationResult result = ParameterSchemaValidator.validate(READ_FILE_SCHEMA, ToolParameters.empty());

        assertFalse(result.valid());
        assertEquals(List.of("Missing required parameter: path"), result.errors());
    }

    @Test
    void shouldReportTypeMismatch() {
        ValidationResult result = ParameterSchemaValidator.validate(READ_FILE_SCHEMA,
                ToolParameters.of("path", "a.ts", "offset", "ten"));

        assertFalse(result.valid());
        assertEquals(List.of("Parameter 'offset' must be of type integer"), result.errors());
    }

    @Test
    void shouldReportValueOutsideEnum() {
        ValidationResult result = ParameterSchemaValidator.validate(READ_FILE_SCHEMA,
                ToolParameters.of("path", "a.ts", "mode", "hex"));

        assertFalse(result.valid());
        assertTrue(result.errors().get(0).startsWith("Parameter 'mode' must be one of"));
    }

    @Test
    void shouldRejectUnknownParameterWhenAdditionalPropertiesDisallowed() {
        ValidationResult result = ParameterSchemaValidator.validate(READ_FILE_SCHEMA,
                ToolParameters.of("path", "a.ts", "encoding", "utf-8"));

        assertEquals(List.of("Unknown parameter: encoding"), result.errors());
    }

    @Test
    void shouldAcceptAnythingWithoutSchema() {
        assertTrue(ParameterSchemaValidator.validate(null, ToolParameters.of("x", 1)).valid());
        assertTrue(ParameterSchemaValidator.validate(Map.of(), ToolParameters.of("x", 1)).valid());
    }
}
