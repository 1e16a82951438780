package com.coagent.workflow.core.engine.timeout;

import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;

import java.time.Instant;
import java.util.Optional;

/**
 * Wall-clock deadlines of suspended approval gates.
 *
 * <p>One deadline per thread. When it passes, the registered handler is called with the thread id
 * and the checkpoint version the deadline was scheduled for; the handler decides whether the
 * gate is still waiting on that same request.</p>
 */
public interface ICoAgentApprovalTimeoutScheduler {

    @FunctionalInterface
    interface TimeoutHandler {
        void onTimeout(String threadId, long checkpointVersion);
    }

    /**
     * Schedules the deadline of a suspended checkpoint. Replaces any deadline of the same thread.
     * Does nothing when the pending request declares no timeout or was already escalated.
     */
    void schedule(CoAgentCheckpoint checkpoint);

    boolean cancel(String threadId);

    Optional<Instant> getDeadline(String threadId);

    void start(TimeoutHandler handler);

    void stop();
}
