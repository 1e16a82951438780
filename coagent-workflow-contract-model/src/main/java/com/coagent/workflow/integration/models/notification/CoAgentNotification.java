package com.coagent.workflow.integration.models.notification;

import com.coagent.workflow.integration.enumerations.CoAgentNotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CoAgentNotification {
    @Builder.Default
    private CoAgentNotificationType type = CoAgentNotificationType.INFO;
    private String title;
    private String message;
    private String actionUrl;
    private String actionLabel;

    public static CoAgentNotification progress(int step, int totalSteps, String currentNode) {
        return CoAgentNotification.builder()
                .title("Step " + step + " of " + totalSteps)
                .message("Running " + currentNode)
                .build();
    }

    public static CoAgentNotification workflowStarted(String workflowName) {
        return CoAgentNotification.builder()
                .title("Workflow started")
                .message(workflowName + " has started")
                .build();
    }

    public static CoAgentNotification workflowCompleted(String workflowName) {
        return CoAgentNotification.builder()
                .type(CoAgentNotificationType.SUCCESS)
                .title("Workflow completed")
                .message(workflowName + " completed successfully")
                .build();
    }

    public static CoAgentNotification workflowFailed(String workflowName, String error) {
        return CoAgentNotification.builder()
                .type(CoAgentNotificationType.ERROR)
                .title("Workflow failed")
                .message(workflowName + " failed: " + error)
                .build();
    }

    public static CoAgentNotification approvalRequested(String operation, String actionUrl) {
        return CoAgentNotification.builder()
                .type(CoAgentNotificationType.WARNING)
                .title("Approval required")
                .message(operation + " is waiting for approval")
                .actionUrl(actionUrl)
                .actionLabel("Review")
                .build();
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("notification_type", type.getValue());
        payload.put("title", title);
        payload.put("message", message);
        if (actionUrl != null) {
            payload.put("action_url", actionUrl);
        }
        if (actionLabel != null) {
            payload.put("action_label", actionLabel);
        }
        return payload;
    }
}
