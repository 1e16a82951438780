package com.coagent.workflow.integration.models.approval;

import com.coagent.workflow.integration.enumerations.CoAgentRiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a suspended approval gate asks the human to decide. Lives only while the thread is suspended.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CoAgentApprovalRequest implements Serializable {
    private String nodeName;
    private String operation;
    private String preview;
    private Map<String, Object> details;
    private CoAgentRiskLevel riskLevel;
    private List<String> allowedDecisions;
    private String approvedNode;
    private String rejectedNode;
    private Instant requestedAt;
    private Long timeoutMs;

    /**
     * Node run when the request is still pending after {@code timeoutMs}.
     */
    private String timeoutNode;

    /**
     * Set once the timeout ran; a request is escalated at most once.
     */
    private Instant escalatedAt;

    public boolean allows(String decision) {
        return allowedDecisions != null && allowedDecisions.contains(decision);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("node", nodeName);
        map.put("operation", operation);
        map.put("preview", preview);
        map.put("details", details == null ? Map.of() : details);
        map.put("risk_level", riskLevel == null ? null : riskLevel.getValue());
        map.put("allowed_decisions", allowedDecisions == null ? List.of() : allowedDecisions);
        map.put("requested_at", requestedAt == null ? null : requestedAt.toString());
        if (timeoutMs != null) {
            map.put("timeout_ms", timeoutMs);
        }
        if (escalatedAt != null) {
            map.put("escalated_at", escalatedAt.toString());
        }
        return map;
    }
}
