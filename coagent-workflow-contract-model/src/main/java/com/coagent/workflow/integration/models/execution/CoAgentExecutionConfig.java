package com.coagent.workflow.integration.models.execution;

import com.coagent.workflow.integration.constant.CoAgentConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CoAgentExecutionConfig {

    /**
     * Generated by the engine when absent.
     */
    private String threadId;

    @Builder.Default
    private int recursionLimit = CoAgentConstants.DEFAULT_RECURSION_LIMIT;

    @Builder.Default
    private boolean emitEvents = true;

    @Builder.Default
    private Map<String, Object> sessionContext = Map.of();

    public static CoAgentExecutionConfig defaults() {
        return CoAgentExecutionConfig.builder().build();
    }
}
