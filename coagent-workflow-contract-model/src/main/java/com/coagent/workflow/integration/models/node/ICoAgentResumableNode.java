package com.coagent.workflow.integration.models.node;

import com.coagent.workflow.integration.models.approval.CoAgentApprovalDecision;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalRequest;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import reactor.core.publisher.Mono;

/**
 * A node that may suspend. After a decision arrives the engine calls {@link #resume} with the
 * checkpointed state and the request the node suspended with; the node answers with the outcome
 * that continues the thread.
 */
public interface ICoAgentResumableNode extends ICoAgentNode {

    Mono<CoAgentNodeOutcome> resume(
            CoAgentExecutionState state,
            CoAgentApprovalRequest request,
            CoAgentApprovalDecision decision,
            ICoAgentNodeContext context);
}
