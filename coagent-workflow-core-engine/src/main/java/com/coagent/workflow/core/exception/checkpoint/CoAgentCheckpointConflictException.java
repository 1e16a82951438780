package com.coagent.workflow.core.exception.checkpoint;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.codes.CoAgentInternalErrorCodes;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A write or resume raced with another writer of the same thread.
 */
@Getter
public class CoAgentCheckpointConflictException extends CoAgentWorkflowException {
    private final String threadId;
    private final Long expectedVersion;
    private final Long actualVersion;

    public CoAgentCheckpointConflictException(String threadId, Long expectedVersion, Long actualVersion) {
        super(CoAgentInternalErrorCodes.CHECKPOINT_CONFLICT,
                versions(expectedVersion, actualVersion),
                null,
                threadId,
                "expected version " + expectedVersion + " but found " + actualVersion);
        this.threadId = threadId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public CoAgentCheckpointConflictException(String threadId, String reason) {
        super(CoAgentInternalErrorCodes.CHECKPOINT_CONFLICT, threadId, reason);
        this.threadId = threadId;
        this.expectedVersion = null;
        this.actualVersion = null;
    }

    private static Map<String, Object> versions(Long expectedVersion, Long actualVersion) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expected_version", expectedVersion);
        details.put("actual_version", actualVersion);
        return details;
    }
}
