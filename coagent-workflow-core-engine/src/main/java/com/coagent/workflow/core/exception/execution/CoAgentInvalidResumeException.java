package com.coagent.workflow.core.exception.execution;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;
import lombok.Getter;

/**
 * Resume on a thread that is not suspended at an approval gate, or with a malformed decision.
 */
@Getter
public class CoAgentInvalidResumeException extends CoAgentWorkflowException {
    private final String threadId;

    public CoAgentInvalidResumeException(String threadId, String reason) {
        super(CoAgentInternalErrorCodes.INVALID_RESUME, threadId, reason);
        this.threadId = threadId;
    }
}
