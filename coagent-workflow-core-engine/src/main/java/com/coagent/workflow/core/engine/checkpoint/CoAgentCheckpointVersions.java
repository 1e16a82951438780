package com.coagent.workflow.core.engine.checkpoint;

import com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointConflictException;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;

/**
 * Version rule shared by every store.
 */
public final class CoAgentCheckpointVersions {

    private CoAgentCheckpointVersions() {
    }

    /**
     * @param stored current checkpoint, {@code null} for a new thread
     * @param incoming checkpoint about to be written
     * @throws CoAgentCheckpointConflictException when {@code incoming} is not the successor of {@code stored}
     */
    public static void checkSuccessor(CoAgentCheckpoint stored, CoAgentCheckpoint incoming) {
        long expected = stored == null ? 1L : stored.getVersion() + 1;
        if (incoming.getVersion() != expected) {
            throw new CoAgentCheckpointConflictException(
                    incoming.getThreadId(),
                    expected,
                    incoming.getVersion());
        }
    }
}
