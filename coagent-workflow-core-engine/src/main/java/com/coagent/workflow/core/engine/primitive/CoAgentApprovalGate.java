package com.coagent.workflow.core.engine.primitive;

import com.coagent.workflow.integration.constant.CoAgentConstants;
import com.coagent.workflow.integration.enumerations.CoAgentRiskLevel;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalDecision;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalRequest;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNodeContext;
import com.coagent.workflow.integration.models.node.ICoAgentResumableNode;
import com.coagent.workflow.integration.models.node.ICoAgentRoutingNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Human approval before a side-effecting step.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>risk below {@code autoApproveBelow}: continues to the approved node at once, recording
 *       {@code approval_decision = auto_approved}</li>
 *   <li>otherwise: suspends with an {@link CoAgentApprovalRequest} and {@code pending_approval = true}</li>
 *   <li>approve: continues to the approved node with the approval patch</li>
 *   <li>reject: continues to the rejected node and appends
 *       {@code {node, message: "<operation> rejected: <comment>"}} to {@code errors}</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CoAgentApprovalGate.builder()
 *         .operation("generate_invoice")
 *         .approvedNode("generate_invoice_document")
 *         .rejectedNode("workflow_rejected")
 *         .preview(state -> "Invoice for " + state.getString("guest_name"))
 *         .risk(state -> CoAgentRiskLevel.HIGH)
 *         .timeout(Duration.ofHours(2), "escalate_invoice_timeout")
 *         .build();
 * }</pre>
 */
@Slf4j
@Getter
public class CoAgentApprovalGate implements ICoAgentResumableNode, ICoAgentRoutingNode {

    private static final List<String> DECISIONS = List.of(CoAgentConstants.DECISION_APPROVE, CoAgentConstants.DECISION_REJECT);

    private final String operation;
    private final String approvedNode;
    private final String rejectedNode;
    private final Function<CoAgentExecutionState, String> preview;
    private final Function<CoAgentExecutionState, Map<String, Object>> details;
    private final Function<CoAgentExecutionState, CoAgentRiskLevel> risk;
    private final CoAgentRiskLevel autoApproveBelow;
    private final Function<CoAgentExecutionState, CoAgentStatePatch> onApprove;
    private final Duration timeout;
    private final String timeoutNode;

    private CoAgentApprovalGate(Builder builder) {
        this.operation = builder.operation;
        this.approvedNode = builder.approvedNode;
        this.rejectedNode = builder.rejectedNode;
        this.preview = builder.preview;
        this.details = builder.details;
        this.risk = builder.risk;
        this.autoApproveBelow = builder.autoApproveBelow;
        this.onApprove = builder.onApprove;
        this.timeout = builder.timeout;
        this.timeoutNode = builder.timeoutNode;
    }

    @Override
    public Set<String> getSuccessors() {
        Set<String> successors = new LinkedHashSet<>(List.of(approvedNode, rejectedNode));
        if (timeoutNode != null) {
            successors.add(timeoutNode);
        }
        return successors;
    }

    @Override
    public Mono<CoAgentNodeOutcome> execute(CoAgentExecutionState state, ICoAgentNodeContext context) {
        return Mono.fromSupplier(() -> {
            CoAgentRiskLevel riskLevel = risk.apply(state);
            if (autoApproveBelow != null && riskLevel.isBelow(autoApproveBelow)) {
                log.info("Auto-approved [{}] on thread [{}]: risk {} is below {}",
                        operation, context.getThreadId(), riskLevel.getValue(), autoApproveBelow.getValue());
                CoAgentStatePatch patch = onApprove.apply(state).merge(CoAgentStatePatch.builder()
                        .put(CoAgentConstants.PENDING_APPROVAL, false)
                        .put(CoAgentConstants.APPROVAL_DECISION, CoAgentConstants.DECISION_AUTO_APPROVED)
                        .build());
                return CoAgentNodeOutcome.next(approvedNode, patch);
            }

            CoAgentApprovalRequest request = CoAgentApprovalRequest.builder()
                    .nodeName(context.getNodeName())
                    .operation(operation)
                    .preview(preview.apply(state))
                    .details(details.apply(state))
                    .riskLevel(riskLevel)
                    .allowedDecisions(DECISIONS)
                    .approvedNode(approvedNode)
                    .rejectedNode(rejectedNode)
                    .requestedAt(Instant.now())
                    .timeoutMs(timeout == null ? null : timeout.toMillis())
                    .timeoutNode(timeoutNode)
                    .build();
            return CoAgentNodeOutcome.suspend(request, CoAgentStatePatch.builder()
                    .put(CoAgentConstants.PENDING_APPROVAL, true)
                    .build());
        });
    }

    @Override
    public Mono<CoAgentNodeOutcome> resume(CoAgentExecutionState state,
                                           CoAgentApprovalRequest request,
                                           CoAgentApprovalDecision decision,
                                           ICoAgentNodeContext context) {
        return Mono.fromSupplier(() -> {
            CoAgentStatePatch.Builder decisionPatch = CoAgentStatePatch.builder()
                    .put(CoAgentConstants.PENDING_APPROVAL, false)
                    .put(CoAgentConstants.APPROVAL_DECISION, decision.getDecision().getValue());
            if (decision.getComment() != null) {
                decisionPatch.put(CoAgentConstants.APPROVAL_COMMENT, decision.getComment());
            }

            if (decision.isApproved()) {
                return CoAgentNodeOutcome.next(approvedNode, onApprove.apply(state).merge(decisionPatch.build()));
            }
            String reason = decision.getComment() == null || decision.getComment().isBlank()
                    ? "no reason given"
                    : decision.getComment();
            decisionPatch.appendError(context.getNodeName(), operation + " rejected: " + reason);
            return CoAgentNodeOutcome.next(rejectedNode, decisionPatch.build());
        });
    }

    // ---------------------------------------------------------
    // Builder entry
    // ---------------------------------------------------------
    public static OperationStep builder() {
        return new Builder();
    }

    // ---------------------------------------------------------
    // Step Interfaces
    // ---------------------------------------------------------
    public interface OperationStep {
        ApprovedNodeStep operation(String operation);
    }

    public interface ApprovedNodeStep {
        RejectedNodeStep approvedNode(String approvedNode);
    }

    public interface RejectedNodeStep {
        BuildStep rejectedNode(String rejectedNode);
    }

    public interface BuildStep {
        BuildStep preview(Function<CoAgentExecutionState, String> preview);

        BuildStep details(Function<CoAgentExecutionState, Map<String, Object>> details);

        BuildStep risk(Function<CoAgentExecutionState, CoAgentRiskLevel> risk);

        /**
         * Requests approval only at or above the threshold; lower risks pass automatically.
         */
        BuildStep autoApproveBelow(CoAgentRiskLevel threshold);

        BuildStep onApprove(Function<CoAgentExecutionState, CoAgentStatePatch> onApprove);

        /**
         * Runs {@code timeoutNode} once when no decision arrived within {@code timeout}. The gate
         * keeps waiting afterwards.
         */
        BuildStep timeout(Duration timeout, String timeoutNode);

        CoAgentApprovalGate build();
    }

    // ---------------------------------------------------------
    // Builder Implementation
    // ---------------------------------------------------------
    private static class Builder implements OperationStep, ApprovedNodeStep, RejectedNodeStep, BuildStep {
        private String operation;
        private String approvedNode;
        private String rejectedNode;
        private Function<CoAgentExecutionState, String> preview;
        private Function<CoAgentExecutionState, Map<String, Object>> details = state -> Map.of();
        private Function<CoAgentExecutionState, CoAgentRiskLevel> risk = state -> CoAgentRiskLevel.MEDIUM;
        private CoAgentRiskLevel autoApproveBelow;
        private Function<CoAgentExecutionState, CoAgentStatePatch> onApprove = state -> CoAgentStatePatch.empty();
        private Duration timeout;
        private String timeoutNode;

        @Override
        public ApprovedNodeStep operation(String operation) {
            this.operation = operation;
            return this;
        }

        @Override
        public RejectedNodeStep approvedNode(String approvedNode) {
            this.approvedNode = approvedNode;
            return this;
        }

        @Override
        public BuildStep rejectedNode(String rejectedNode) {
            this.rejectedNode = rejectedNode;
            return this;
        }

        @Override
        public BuildStep preview(Function<CoAgentExecutionState, String> preview) {
            this.preview = preview;
            return this;
        }

        @Override
        public BuildStep details(Function<CoAgentExecutionState, Map<String, Object>> details) {
            this.details = details;
            return this;
        }

        @Override
        public BuildStep risk(Function<CoAgentExecutionState, CoAgentRiskLevel> risk) {
            this.risk = risk;
            return this;
        }

        @Override
        public BuildStep autoApproveBelow(CoAgentRiskLevel threshold) {
            this.autoApproveBelow = threshold;
            return this;
        }

        @Override
        public BuildStep onApprove(Function<CoAgentExecutionState, CoAgentStatePatch> onApprove) {
            this.onApprove = onApprove;
            return this;
        }

        @Override
        public BuildStep timeout(Duration timeout, String timeoutNode) {
            this.timeout = timeout;
            this.timeoutNode = timeoutNode;
            return this;
        }

        @Override
        public CoAgentApprovalGate build() {
            if (operation == null || approvedNode == null || rejectedNode == null) {
                throw new IllegalStateException("Approval gate needs an operation, an approved node and a rejected node");
            }
            if (preview == null) {
                preview = state -> "Approve " + operation + "?";
            }
            return new CoAgentApprovalGate(this);
        }
    }
}
