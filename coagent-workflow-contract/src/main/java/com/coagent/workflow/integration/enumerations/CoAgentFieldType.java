package com.coagent.workflow.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Types a workflow can declare for the fields of its state schema.
 */
@Getter
@AllArgsConstructor
public enum CoAgentFieldType {
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    LIST("list"),
    MAP("map"),
    ANY("any");

    private final String value;

    /**
     * Checks a state value against this type. {@code null} is never accepted;
     * optional fields are handled by the schema, not by the type.
     */
    public boolean accepts(Object candidate) {
        if (candidate == null) {
            return false;
        }
        return switch (this) {
            case STRING -> candidate instanceof String;
            case INTEGER -> candidate instanceof Integer || candidate instanceof Long
                    || candidate instanceof Short || candidate instanceof Byte;
            case NUMBER -> candidate instanceof Number;
            case BOOLEAN -> candidate instanceof Boolean;
            case LIST -> candidate instanceof List<?>;
            case MAP -> candidate instanceof Map<?, ?>;
            case ANY -> true;
        };
    }
}
