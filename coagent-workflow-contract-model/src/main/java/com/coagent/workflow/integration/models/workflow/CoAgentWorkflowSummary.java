package com.coagent.workflow.integration.models.workflow;

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
public class CoAgentWorkflowSummary {
    private String name;
    private String description;
    private String industry;
    private List<String> tags;
    private Map<String, Object> declaredSchema;
    private int estimatedSteps;
}
