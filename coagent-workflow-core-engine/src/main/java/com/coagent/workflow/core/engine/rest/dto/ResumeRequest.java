package com.coagent.workflow.core.engine.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeRequest {

    @NotBlank(message = "thread_id is required")
    @JsonProperty("thread_id")
    private String threadId;

    @NotBlank(message = "decision is required")
    private String decision;

    private String comment;

    @JsonProperty("decided_by")
    private String decidedBy;

    @JsonProperty("expected_version")
    private Long expectedVersion;
}
