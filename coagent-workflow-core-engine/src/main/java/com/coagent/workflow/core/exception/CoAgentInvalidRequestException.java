package com.coagent.workflow.core.exception;

import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;

import java.util.Map;

public class CoAgentInvalidRequestException extends CoAgentWorkflowException {
    public CoAgentInvalidRequestException(String reason, Map<String, Object> details) {
        super(CoAgentInternalErrorCodes.INVALID_REQUEST, details, null, reason);
    }
}
