package com.coagent.workflow.core.engine.primitive;

import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.ICoAgentNodeContext;
import reactor.core.publisher.Mono;

/**
 * Side-effecting work guarded by a {@link CoAgentRetryNode}. Subscribed once per attempt.
 */
@FunctionalInterface
public interface ICoAgentRetryableOperation {

    Mono<CoAgentStatePatch> apply(CoAgentExecutionState state, ICoAgentNodeContext context);
}
