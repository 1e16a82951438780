package com.coagent.workflow.core.engine.execution;

import com.coagent.workflow.core.engine.registry.CoAgentValidatedState;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalDecision;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionConfig;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionResult;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Runs workflow threads node by node, checkpointing after every node.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>At most one execute, resume, recover, cancel or timeout handling is active per thread at a time</li>
 *   <li>Nothing after an approval gate runs before a decision was received</li>
 *   <li>A decision is consumed exactly once; resuming a finished thread returns its cached result</li>
 *   <li>The checkpoint of a node is stored before the node's exit event is published</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * engine.execute("hotel_o2c", Map.of("guest_name", "Ada", "room_number", "101"), CoAgentExecutionConfig.defaults())
 *     .filter(CoAgentExecutionResult::isInterrupted)
 *     .flatMap(paused -> engine.resume(CoAgentApprovalDecision.approve(paused.getThreadId())));
 * }</pre>
 */
public interface ICoAgentExecutionEngine {

    /**
     * Starts a new thread of an already validated workflow and runs it until it suspends or ends.
     *
     * @throws com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointConflictException
     *         (as an error signal) when the thread id is busy or already used
     */
    Mono<CoAgentExecutionResult> execute(CoAgentWorkflowDefinition definition, CoAgentValidatedState initialState, CoAgentExecutionConfig config);

    /**
     * Validates the initial state against the registered workflow, then starts it.
     */
    Mono<CoAgentExecutionResult> execute(String workflowName, Map<String, Object> initialState, CoAgentExecutionConfig config);

    /**
     * Applies a human decision to a suspended thread and continues it.
     */
    Mono<CoAgentExecutionResult> resume(CoAgentApprovalDecision decision);

    /**
     * Ends a thread as cancelled. A running thread stops before its next node; a suspended one
     * is cancelled immediately.
     */
    Mono<CoAgentExecutionResult> cancel(String threadId);

    /**
     * Continues a thread whose last checkpoint records a node to run next, for instance after a
     * checkpoint write or a notification failed mid-run, or after the node visit limit stopped it.
     * The run starts at the checkpoint's next node with a fresh visit budget. A finished thread
     * returns its cached result; a suspended one returns its snapshot unchanged.
     */
    Mono<CoAgentExecutionResult> recover(String threadId);

    /**
     * @return the cached result of a finished thread, or a snapshot of a running or suspended one
     */
    Mono<CoAgentExecutionResult> getResult(String threadId);

    /**
     * Re-arms the approval timeouts of every suspended thread, typically after a restart.
     *
     * @return number of timeouts scheduled
     */
    Mono<Long> rescheduleApprovalTimeouts();
}
