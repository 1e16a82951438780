package com.coagent.workflow.core.exception;

import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;

/**
 * Unknown workflow name or unknown thread id.
 */
public abstract class CoAgentNotFoundException extends CoAgentWorkflowException {
    protected CoAgentNotFoundException(CoAgentInternalErrorCodes errorInfo, String identifier) {
        super(errorInfo, identifier);
    }
}
