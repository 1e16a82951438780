package com.coagent.workflow.core.exception.execution;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;
import lombok.Getter;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.util.Map;

/**
 * Business failure inside a node. Recorded into the state's errors and routed; it only reaches
 * callers when a workflow gives it nowhere else to go.
 */
@Getter
public class CoAgentNodeExecutionException extends CoAgentWorkflowException {
    private final String threadId;
    private final String nodeName;

    public CoAgentNodeExecutionException(String threadId, String nodeName, Throwable cause) {
        super(CoAgentInternalErrorCodes.NODE_EXECUTION_FAILED,
                Map.of("node", nodeName),
                cause,
                nodeName, threadId, ExceptionUtils.getRootCauseMessage(cause));
        this.threadId = threadId;
        this.nodeName = nodeName;
    }

    /**
     * @return the message of the failure as the node reported it
     */
    public String getNodeMessage() {
        Throwable cause = getCause();
        if (cause == null || cause.getMessage() == null) {
            return getMessage();
        }
        return cause.getMessage();
    }
}
