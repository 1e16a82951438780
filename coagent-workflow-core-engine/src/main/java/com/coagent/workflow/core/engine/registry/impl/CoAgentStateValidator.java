package com.coagent.workflow.core.engine.registry.impl;

import com.coagent.workflow.core.exception.registry.CoAgentStateValidationException;
import com.coagent.workflow.integration.constant.CoAgentConstants;
import com.coagent.workflow.integration.models.workflow.CoAgentStateField;
import com.coagent.workflow.integration.models.workflow.CoAgentStateSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class CoAgentStateValidator {

    private CoAgentStateValidator() {
    }

    static Map<String, Object> validate(String workflowName, CoAgentStateSchema schema, Map<String, Object> initialState) {
        Map<String, Object> input = initialState == null ? Map.of() : initialState;
        List<String> missingFields = new ArrayList<>();
        Map<String, String> invalidFields = new LinkedHashMap<>();
        Map<String, Object> state = new LinkedHashMap<>(input);

        for (CoAgentStateField field : schema.getFields()) {
            Object value = input.get(field.getName());
            if (value == null) {
                if (field.isRequired()) {
                    missingFields.add(field.getName());
                } else if (field.getDefaultValue() != null) {
                    state.put(field.getName(), copyDefault(field.getDefaultValue()));
                } else {
                    state.putIfAbsent(field.getName(), null);
                }
                continue;
            }
            if (!field.getType().accepts(value)) {
                invalidFields.put(field.getName(), field.getType().getValue());
            }
        }

        if (!missingFields.isEmpty() || !invalidFields.isEmpty()) {
            throw new CoAgentStateValidationException(workflowName, missingFields, invalidFields);
        }

        state.putIfAbsent(CoAgentConstants.STEPS_COMPLETED, new ArrayList<>());
        state.putIfAbsent(CoAgentConstants.ERRORS, new ArrayList<>());
        state.putIfAbsent(CoAgentConstants.PENDING_APPROVAL, false);
        state.remove(CoAgentConstants.CURRENT_NODE);
        return state;
    }

    // defaults are shared by every thread of the workflow; containers are copied per thread
    private static Object copyDefault(Object defaultValue) {
        if (defaultValue instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (defaultValue instanceof Map<?, ?> map) {
            return new LinkedHashMap<>(map);
        }
        return defaultValue;
    }
}
