package com.coagent.workflow.integration.models.execution;

import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Durable snapshot of one thread: where it stopped and the state it stopped with.
 *
 * <p>There is exactly one current checkpoint per thread. The {@code version} is the
 * checkpoint sequence number; every write must carry the successor of the stored version,
 * which lets stores detect concurrent writers.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@With
public class CoAgentCheckpoint implements Serializable {
    private String threadId;
    private String workflowName;
    private String nodeName;

    /**
     * Node the loop continues with after {@code nodeName}; {@code null} once suspended or terminal.
     */
    private String nextNode;
    private Map<String, Object> state;
    private long version;
    private CoAgentExecutionStatus status;

    /**
     * Present only while the thread is suspended at an approval gate.
     */
    private CoAgentApprovalRequest pendingApproval;

    /**
     * Present only once the thread reached a terminal node.
     */
    private CoAgentExecutionResult result;

    private boolean cancelled;

    /**
     * Sequence of the last progress event published for the thread when this checkpoint was written.
     */
    private long lastEventSequence;

    /**
     * Node visit limit the thread was started with; applied again on resume.
     */
    private int recursionLimit;

    private boolean eventsSuppressed;
    private Instant createdAt;
    private Instant timestamp;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean isAwaitingApproval() {
        return status == CoAgentExecutionStatus.PAUSED && pendingApproval != null;
    }
}
