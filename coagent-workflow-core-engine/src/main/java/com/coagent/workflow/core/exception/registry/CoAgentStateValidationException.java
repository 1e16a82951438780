package com.coagent.workflow.core.exception.registry;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Initial state rejected before execution started.
 */
@Getter
public class CoAgentStateValidationException extends CoAgentWorkflowException {
    private final String workflowName;
    private final List<String> missingFields;

    /**
     * field name to the type the schema expected
     */
    private final Map<String, String> invalidFields;

    public CoAgentStateValidationException(String workflowName, List<String> missingFields, Map<String, String> invalidFields) {
        super(CoAgentInternalErrorCodes.STATE_VALIDATION_FAILED, details(missingFields, invalidFields), null, workflowName);
        this.workflowName = workflowName;
        this.missingFields = List.copyOf(missingFields);
        this.invalidFields = Map.copyOf(invalidFields);
    }

    private static Map<String, Object> details(List<String> missingFields, Map<String, String> invalidFields) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("missing_fields", missingFields);
        details.put("invalid_fields", invalidFields);
        return details;
    }
}
