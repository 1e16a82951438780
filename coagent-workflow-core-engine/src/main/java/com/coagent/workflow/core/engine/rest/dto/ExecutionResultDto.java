package com.coagent.workflow.core.engine.rest.dto;

import com.coagent.workflow.integration.models.execution.CoAgentExecutionResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResultDto {

    @JsonProperty("thread_id")
    private String threadId;

    @JsonProperty("workflow_name")
    private String workflowName;

    private String status;

    @JsonProperty("final_state")
    private Map<String, Object> finalState;

    @JsonProperty("interrupt_data")
    private Map<String, Object> interruptData;

    private String error;

    @JsonProperty("steps_completed")
    private List<String> stepsCompleted;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    private Map<String, Object> metadata;

    public static ExecutionResultDto fromResult(CoAgentExecutionResult result) {
        return ExecutionResultDto.builder()
                .threadId(result.getThreadId())
                .workflowName(result.getWorkflowName())
                .status(result.getStatus().getValue())
                .finalState(result.getFinalState())
                .interruptData(result.getInterruptData() == null ? null : result.getInterruptData().toMap())
                .error(result.getError())
                .stepsCompleted(result.getStepsCompleted())
                .executionTimeMs(result.getExecutionTimeMs())
                .metadata(result.getMetadata())
                .build();
    }
}
