package com.coagent.workflow.core.exception.registry;

import com.coagent.workflow.core.exception.CoAgentNotFoundException;
import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;
import lombok.Getter;

@Getter
public class CoAgentWorkflowNotFoundException extends CoAgentNotFoundException {
    private final String workflowName;

    public CoAgentWorkflowNotFoundException(String workflowName) {
        super(CoAgentInternalErrorCodes.WORKFLOW_NOT_FOUND, workflowName);
        this.workflowName = workflowName;
    }
}
