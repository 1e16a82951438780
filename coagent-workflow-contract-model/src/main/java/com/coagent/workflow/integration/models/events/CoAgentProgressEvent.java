package com.coagent.workflow.integration.models.events;

import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CoAgentProgressEvent implements Serializable {
    private CoAgentProgressEventType type;
    private String threadId;
    private long sequence;
    private Map<String, Object> payload;
    private Instant timestamp;

    public boolean isTerminal() {
        return type != null && type.isTerminal();
    }
}
