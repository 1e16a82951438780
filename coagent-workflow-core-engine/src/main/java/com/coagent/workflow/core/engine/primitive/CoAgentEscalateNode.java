package com.coagent.workflow.core.engine.primitive;

import com.coagent.workflow.core.exception.notification.CoAgentNotificationDeliveryException;
import com.coagent.workflow.integration.constant.CoAgentConstants;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationIssueType;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationSeverity;
import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNodeContext;
import com.coagent.workflow.integration.models.node.ICoAgentRoutingNode;
import com.coagent.workflow.integration.models.notification.CoAgentEscalation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Hands an issue to a human through the notification sink, records it in {@code escalations}
 * and continues with the next node.
 *
 * <p>A sink failure is not a node failure: it surfaces as
 * {@link CoAgentNotificationDeliveryException} and ends the call.</p>
 */
@Slf4j
@Getter
public class CoAgentEscalateNode implements ICoAgentRoutingNode {

    private final CoAgentEscalationIssueType issueType;
    private final Function<CoAgentExecutionState, CoAgentEscalationSeverity> severity;
    private final String recipient;
    private final Function<CoAgentExecutionState, String> message;
    private final Function<CoAgentExecutionState, Map<String, Object>> details;
    private final String nextNode;

    private CoAgentEscalateNode(Builder builder) {
        this.issueType = builder.issueType;
        this.severity = builder.severity;
        this.recipient = builder.recipient;
        this.message = builder.message;
        this.details = builder.details;
        this.nextNode = builder.nextNode;
    }

    @Override
    public Set<String> getSuccessors() {
        return Set.of(nextNode);
    }

    @Override
    public Mono<CoAgentNodeOutcome> execute(CoAgentExecutionState state, ICoAgentNodeContext context) {
        return escalate(state, context).map(patch -> CoAgentNodeOutcome.next(nextNode, patch));
    }

    /**
     * Sends the escalation and returns the patch recording it, without routing.
     */
    public Mono<CoAgentStatePatch> escalate(CoAgentExecutionState state, ICoAgentNodeContext context) {
        return Mono.defer(() -> {
            CoAgentEscalation escalation = CoAgentEscalation.builder()
                    .threadId(context.getThreadId())
                    .workflowName(context.getWorkflowName())
                    .nodeName(context.getNodeName())
                    .issueType(issueType)
                    .severity(severity.apply(state))
                    .recipient(recipient)
                    .message(message.apply(state))
                    .details(details.apply(state))
                    .timestamp(Instant.now())
                    .build();

            return context.getNotificationSink()
                    .notify(recipient, escalation.toPayload())
                    .onErrorMap(error -> !(error instanceof CoAgentNotificationDeliveryException),
                            error -> new CoAgentNotificationDeliveryException(recipient, error))
                    .map(notificationId -> {
                        Map<String, Object> record = new LinkedHashMap<>(escalation.toPayload());
                        record.put("recipient", recipient);
                        record.put("success", true);
                        record.put("notification_id", notificationId);
                        context.emit(CoAgentProgressEventType.ESCALATE, record);
                        log.warn("Escalated {} on thread [{}] to [{}]: {}",
                                issueType.getValue(), context.getThreadId(), recipient, escalation.getSubject());
                        return CoAgentStatePatch.builder().append(CoAgentConstants.ESCALATIONS, record).build();
                    });
        });
    }

    public static IssueTypeStep builder() {
        return new Builder();
    }

    public interface IssueTypeStep {
        NextNodeStep issueType(CoAgentEscalationIssueType issueType);
    }

    public interface NextNodeStep {
        BuildStep nextNode(String nextNode);
    }

    public interface BuildStep {
        BuildStep severity(CoAgentEscalationSeverity severity);

        BuildStep severity(Function<CoAgentExecutionState, CoAgentEscalationSeverity> severity);

        BuildStep recipient(String recipient);

        BuildStep message(String message);

        BuildStep message(Function<CoAgentExecutionState, String> message);

        BuildStep details(Function<CoAgentExecutionState, Map<String, Object>> details);

        CoAgentEscalateNode build();
    }

    private static class Builder implements IssueTypeStep, NextNodeStep, BuildStep {
        private CoAgentEscalationIssueType issueType;
        private Function<CoAgentExecutionState, CoAgentEscalationSeverity> severity = state -> CoAgentEscalationSeverity.MEDIUM;
        private String recipient = CoAgentConstants.DEFAULT_ESCALATION_RECIPIENT;
        private Function<CoAgentExecutionState, String> message;
        private Function<CoAgentExecutionState, Map<String, Object>> details = state -> Map.of();
        private String nextNode;

        @Override
        public NextNodeStep issueType(CoAgentEscalationIssueType issueType) {
            this.issueType = issueType;
            return this;
        }

        @Override
        public BuildStep nextNode(String nextNode) {
            this.nextNode = nextNode;
            return this;
        }

        @Override
        public BuildStep severity(CoAgentEscalationSeverity severity) {
            this.severity = state -> severity;
            return this;
        }

        @Override
        public BuildStep severity(Function<CoAgentExecutionState, CoAgentEscalationSeverity> severity) {
            this.severity = severity;
            return this;
        }

        @Override
        public BuildStep recipient(String recipient) {
            this.recipient = recipient;
            return this;
        }

        @Override
        public BuildStep message(String message) {
            this.message = state -> message;
            return this;
        }

        @Override
        public BuildStep message(Function<CoAgentExecutionState, String> message) {
            this.message = message;
            return this;
        }

        @Override
        public BuildStep details(Function<CoAgentExecutionState, Map<String, Object>> details) {
            this.details = details;
            return this;
        }

        @Override
        public CoAgentEscalateNode build() {
            if (message == null) {
                message = state -> "Workflow needs attention: " + issueType.getValue();
            }
            return new CoAgentEscalateNode(this);
        }
    }
}
