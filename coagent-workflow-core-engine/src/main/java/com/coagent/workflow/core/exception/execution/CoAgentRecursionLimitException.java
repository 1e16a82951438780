package com.coagent.workflow.core.exception.execution;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

@Getter
public class CoAgentRecursionLimitException extends CoAgentWorkflowException {
    private final String threadId;
    private final int recursionLimit;

    public CoAgentRecursionLimitException(String threadId, int recursionLimit, String lastNode) {
        super(CoAgentInternalErrorCodes.RECURSION_LIMIT_EXCEEDED,
                Map.of("last_node", String.valueOf(lastNode)), null, threadId, recursionLimit);
        this.threadId = threadId;
        this.recursionLimit = recursionLimit;
    }
}
