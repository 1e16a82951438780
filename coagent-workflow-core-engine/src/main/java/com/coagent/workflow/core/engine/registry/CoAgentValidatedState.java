package com.coagent.workflow.core.engine.registry;

import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Initial state that passed schema validation, with defaults and control fields filled in.
 * Produced by {@link ICoAgentWorkflowRegistry#validate}.
 */
@Getter
@ToString
@AllArgsConstructor
public final class CoAgentValidatedState {
    private final String workflowName;
    private final CoAgentExecutionState state;
}
