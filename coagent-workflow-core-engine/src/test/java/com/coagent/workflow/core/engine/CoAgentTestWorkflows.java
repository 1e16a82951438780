package com.coagent.workflow.core.engine;

import com.coagent.workflow.core.engine.primitive.CoAgentApprovalGate;
import com.coagent.workflow.core.engine.primitive.CoAgentEscalateNode;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationIssueType;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationSeverity;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.enumerations.CoAgentFieldType;
import com.coagent.workflow.integration.enumerations.CoAgentRiskLevel;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNode;
import com.coagent.workflow.integration.models.workflow.CoAgentStateSchema;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import lombok.Getter;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small workflows shared by the engine tests. Every side-effecting node counts its runs.
 *
 * <pre>
 * order_approval:  reserve_gate -> reserve_stock -> pack_order -> charge_gate -> charge_card -> completed
 *                        \________________________________________________\______-> rejected
 * </pre>
 */
public final class CoAgentTestWorkflows {

    public static final String ORDER_APPROVAL = "order_approval";
    public static final String FAILING = "failing_flow";
    public static final String LOOPING = "looping_flow";

    @Getter
    private final Map<String, AtomicInteger> runs = new ConcurrentHashMap<>();

    public int runsOf(String node) {
        return runs.getOrDefault(node, new AtomicInteger()).get();
    }

    public CoAgentWorkflowDefinition orderApproval() {
        return orderApproval(null);
    }

    /**
     * @param chargeTimeout when set, the charge gate escalates to {@code escalate_charge} after it
     */
    public CoAgentWorkflowDefinition orderApproval(Duration chargeTimeout) {
        CoAgentApprovalGate.BuildStep chargeGate = CoAgentApprovalGate.builder()
                .operation("charge_card")
                .approvedNode("charge_card")
                .rejectedNode("rejected")
                .preview(state -> "Charge " + state.getNumber("amount", 0) + " for order " + state.getString("order_id"))
                .risk(state -> CoAgentRiskLevel.HIGH);
        if (chargeTimeout != null) {
            chargeGate.timeout(chargeTimeout, "escalate_charge");
        }

        return CoAgentWorkflowDefinition.builder()
                .name(ORDER_APPROVAL)
                .description("Reserve, pack and charge an order, with approval before reserving and charging")
                .schema(CoAgentStateSchema.builder()
                        .required("order_id", CoAgentFieldType.STRING, "Order number")
                        .optional("amount", CoAgentFieldType.NUMBER, 100, "Amount to charge")
                        .build())
                .entryNode("reserve_gate")
                .node("reserve_gate", CoAgentApprovalGate.builder()
                        .operation("reserve_stock")
                        .approvedNode("reserve_stock")
                        .rejectedNode("rejected")
                        .build())
                .node("reserve_stock", counting("reserve_stock", "pack_order", "reserved", true))
                .node("pack_order", counting("pack_order", "charge_gate", "packed", true))
                .node("charge_gate", chargeGate.build())
                .node("charge_card", counting("charge_card", "completed", "charged", true))
                .node("escalate_charge", CoAgentEscalateNode.builder()
                        .issueType(CoAgentEscalationIssueType.TIMEOUT)
                        .nextNode("charge_gate")
                        .severity(CoAgentEscalationSeverity.HIGH)
                        .recipient("Finance Manager")
                        .message(state -> "Charge of order " + state.getString("order_id") + " is waiting for approval")
                        .build())
                .terminalNode("completed", CoAgentExecutionStatus.COMPLETED)
                .terminalNode("rejected", CoAgentExecutionStatus.REJECTED)
                .industry("retail")
                .tag("testing")
                .estimatedSteps(5)
                .build();
    }

    /**
     * {@code prepare -> explode -> completed}; {@code explode} always fails. With
     * {@code withErrorNode} failures are routed to {@code recover}.
     */
    public CoAgentWorkflowDefinition failing(boolean withErrorNode) {
        CoAgentWorkflowDefinition.NodeStep builder = CoAgentWorkflowDefinition.builder()
                .name(FAILING)
                .description("Fails on its second node")
                .schema(CoAgentStateSchema.empty())
                .entryNode("prepare")
                .node("prepare", counting("prepare", "explode", "prepared", true))
                .node("explode", (state, context) -> {
                    count("explode");
                    return Mono.error(new IllegalStateException("printer on fire"));
                })
                .terminalNode("completed", CoAgentExecutionStatus.COMPLETED);
        if (withErrorNode) {
            builder.node("recover", counting("recover", "failed", "recovered", true))
                    .terminalNode("failed", CoAgentExecutionStatus.ERROR)
                    .errorNode("recover");
        }
        return builder.build();
    }

    /**
     * A node that routes to itself forever.
     */
    public CoAgentWorkflowDefinition looping() {
        return CoAgentWorkflowDefinition.builder()
                .name(LOOPING)
                .description("Never terminates on its own")
                .schema(CoAgentStateSchema.empty())
                .entryNode("spin")
                .node("spin", (state, context) -> {
                    count("spin");
                    return Mono.just(CoAgentNodeOutcome.next("spin",
                            CoAgentStatePatch.builder().put("spins", (int) state.getNumber("spins", 0) + 1).build()));
                })
                .terminalNode("completed", CoAgentExecutionStatus.COMPLETED)
                .build();
    }

    public ICoAgentNode counting(String node, String next, String flag, Object value) {
        return (state, context) -> Mono.fromSupplier(() -> {
            count(node);
            return CoAgentNodeOutcome.next(next, CoAgentStatePatch.builder().put(flag, value).build());
        });
    }

    private void count(String node) {
        runs.computeIfAbsent(node, key -> new AtomicInteger()).incrementAndGet();
    }
}
