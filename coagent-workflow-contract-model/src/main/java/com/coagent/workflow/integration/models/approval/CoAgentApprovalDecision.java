package com.coagent.workflow.integration.models.approval;

import com.coagent.workflow.integration.enumerations.CoAgentApprovalDecisionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoAgentApprovalDecision implements Serializable {
    private String threadId;
    private CoAgentApprovalDecisionType decision;
    private String comment;
    private String decidedBy;

    /**
     * Checkpoint version the decision was taken against; {@code null} skips the staleness check.
     */
    private Long expectedVersion;

    public static CoAgentApprovalDecision approve(String threadId) {
        return CoAgentApprovalDecision.builder().threadId(threadId).decision(CoAgentApprovalDecisionType.APPROVE).build();
    }

    public static CoAgentApprovalDecision reject(String threadId, String comment) {
        return CoAgentApprovalDecision.builder()
                .threadId(threadId)
                .decision(CoAgentApprovalDecisionType.REJECT)
                .comment(comment)
                .build();
    }

    public boolean isApproved() {
        return decision == CoAgentApprovalDecisionType.APPROVE;
    }
}
