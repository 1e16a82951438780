package com.coagent.workflow.core.exception.execution;

import com.coagent.workflow.core.exception.CoAgentNotFoundException;
import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;
import lombok.Getter;

@Getter
public class CoAgentThreadNotFoundException extends CoAgentNotFoundException {
    private final String threadId;

    public CoAgentThreadNotFoundException(String threadId) {
        super(CoAgentInternalErrorCodes.THREAD_NOT_FOUND, threadId);
        this.threadId = threadId;
    }
}
