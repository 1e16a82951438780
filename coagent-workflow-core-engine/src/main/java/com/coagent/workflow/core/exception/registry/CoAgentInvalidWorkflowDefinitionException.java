package com.coagent.workflow.core.exception.registry;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;

public class CoAgentInvalidWorkflowDefinitionException extends CoAgentWorkflowException {
    public CoAgentInvalidWorkflowDefinitionException(String workflowName, String reason) {
        super(CoAgentInternalErrorCodes.INVALID_WORKFLOW_DEFINITION, workflowName, reason);
    }
}
