package com.coagent.workflow.core.engine.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteRequest {

    @NotBlank(message = "workflow_name is required")
    @JsonProperty("workflow_name")
    private String workflowName;

    @JsonProperty("initial_state")
    private Map<String, Object> initialState;

    @Pattern(regexp = "[A-Za-z0-9][A-Za-z0-9._-]{0,127}", message = "thread_id must be 1 to 128 letters, digits, dots, dashes or underscores")
    @JsonProperty("thread_id")
    private String threadId;

    /**
     * Answer with a server-sent event stream instead of a single JSON result. Absent means false.
     */
    private Boolean stream;

    @Min(value = 1, message = "recursion_limit must be at least 1")
    @JsonProperty("recursion_limit")
    private Integer recursionLimit;

    @JsonProperty("session_context")
    private Map<String, Object> sessionContext;

    public boolean streamRequested() {
        return Boolean.TRUE.equals(stream);
    }
}
