package com.coagent.workflow.integration.models.node;

import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import reactor.core.publisher.Mono;

/**
 * A single step of a workflow.
 *
 * <p>A node reads the current state and answers with an outcome carrying the patch to apply.
 * It never mutates the state it receives. Failures are signalled as errors on the returned
 * {@link Mono}; the engine records them into {@code errors} and routes the thread to the
 * definition's error node, or ends it.</p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ICoAgentNode createFolio = (state, context) -> context.getDocumentClient()
 *         .create("Folio", Map.of("guest", state.getString("guest_name")))
 *         .map(folio -> CoAgentNodeOutcome.next("add_charges",
 *                 CoAgentStatePatch.builder().put("folio_id", folio.get("name")).build()));
 * }</pre>
 */
@FunctionalInterface
public interface ICoAgentNode {

    Mono<CoAgentNodeOutcome> execute(CoAgentExecutionState state, ICoAgentNodeContext context);
}
