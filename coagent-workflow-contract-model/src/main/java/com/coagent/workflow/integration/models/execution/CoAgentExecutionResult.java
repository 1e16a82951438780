package com.coagent.workflow.integration.models.execution;

import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Outcome of an execute, resume or cancel call. Terminal results are cached on the thread's
 * checkpoint and handed back unchanged on every later resume.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CoAgentExecutionResult implements Serializable {
    private String threadId;
    private String workflowName;
    private CoAgentExecutionStatus status;
    private Map<String, Object> finalState;
    private CoAgentApprovalRequest interruptData;
    private String error;
    private List<String> stepsCompleted;
    private long executionTimeMs;
    private Map<String, Object> metadata;

    public boolean isInterrupted() {
        return status == CoAgentExecutionStatus.PAUSED;
    }
}
