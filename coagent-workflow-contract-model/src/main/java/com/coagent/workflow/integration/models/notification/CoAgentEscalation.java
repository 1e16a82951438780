package com.coagent.workflow.integration.models.notification;

import com.coagent.workflow.integration.enumerations.CoAgentEscalationIssueType;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CoAgentEscalation {
    private String threadId;
    private String workflowName;
    private String nodeName;
    private CoAgentEscalationIssueType issueType;
    private CoAgentEscalationSeverity severity;
    private String recipient;
    private String message;
    private Map<String, Object> details;
    private Instant timestamp;

    /**
     * "HIGH: hotel_o2c - timeout"
     */
    public String getSubject() {
        return String.format("%s: %s - %s",
                severity.getValue().toUpperCase(Locale.ROOT),
                workflowName,
                issueType.getValue());
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subject", getSubject());
        payload.put("message", message);
        payload.put("issue_type", issueType.getValue());
        payload.put("severity", severity.getValue());
        payload.put("workflow", workflowName);
        payload.put("thread_id", threadId);
        payload.put("node", nodeName);
        payload.put("details", details == null ? Map.of() : details);
        payload.put("timestamp", timestamp == null ? null : timestamp.toString());
        return payload;
    }
}
