package com.coagent.workflow.core.exception.checkpoint;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

@Getter
public class CoAgentCheckpointPersistenceException extends CoAgentWorkflowException {
    private final String threadId;

    /**
     * @param operation what the store was doing, e.g. "writing", "reading", "deleting"
     */
    public CoAgentCheckpointPersistenceException(String operation, String threadId, Throwable cause) {
        super(CoAgentInternalErrorCodes.CHECKPOINT_PERSISTENCE_FAILED, Map.of(), cause, operation, threadId);
        this.threadId = threadId;
    }

    @Override
    public boolean isInfrastructureFailure() {
        return true;
    }
}
