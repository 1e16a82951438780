package com.coagent.workflow.core.engine.rest.dto;

import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowSummary;
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
public class WorkflowSummaryDto {
    private String name;
    private String description;
    private String industry;
    private List<String> tags;

    @JsonProperty("declared_schema")
    private Map<String, Object> declaredSchema;

    @JsonProperty("estimated_steps")
    private int estimatedSteps;

    public static WorkflowSummaryDto fromSummary(CoAgentWorkflowSummary summary) {
        return WorkflowSummaryDto.builder()
                .name(summary.getName())
                .description(summary.getDescription())
                .industry(summary.getIndustry())
                .tags(summary.getTags())
                .declaredSchema(summary.getDeclaredSchema())
                .estimatedSteps(summary.getEstimatedSteps())
                .build();
    }
}
