package com.coagent.workflow.plugins.sample.workflows;

import com.coagent.workflow.core.engine.primitive.CoAgentApprovalGate;
import com.coagent.workflow.core.engine.primitive.CoAgentEscalateNode;
import com.coagent.workflow.core.engine.primitive.CoAgentNotifyNode;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationIssueType;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationSeverity;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.enumerations.CoAgentFieldType;
import com.coagent.workflow.integration.enumerations.CoAgentRiskLevel;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNode;
import com.coagent.workflow.integration.models.notification.CoAgentNotification;
import com.coagent.workflow.integration.models.workflow.CoAgentStateSchema;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hotel order-to-cash: guest check-in to submitted invoice.
 *
 * <pre>
 * check_in_guest (approval) -> create_folio -> add_charges -> check_out_guest
 *     -> generate_invoice (approval, high risk) -> create_sales_invoice -> notify_completion -> workflow_completed
 * </pre>
 * Either rejection ends in {@code workflow_rejected}. An invoice approval pending for two hours is
 * escalated to the front office manager.
 */
public final class HotelOrderToCashWorkflow {

    public static final String NAME = "hotel_o2c";
    public static final double TAX_RATE = 0.10;

    private HotelOrderToCashWorkflow() {
    }

    public static CoAgentWorkflowDefinition create() {
        return CoAgentWorkflowDefinition.builder()
                .name(NAME)
                .description("Hotel order-to-cash: check-in, folio, charges, check-out and invoice")
                .schema(CoAgentStateSchema.builder()
                        .required("reservation_id", CoAgentFieldType.STRING, "Reservation being checked in")
                        .required("guest_name", CoAgentFieldType.STRING, "Guest full name")
                        .required("room_number", CoAgentFieldType.STRING, "Assigned room")
                        .required("check_in_date", CoAgentFieldType.STRING, "ISO date of arrival")
                        .required("check_out_date", CoAgentFieldType.STRING, "ISO date of departure")
                        .optional("room_rate", CoAgentFieldType.NUMBER, 150.0, "Nightly room rate")
                        .build())
                .entryNode("check_in_guest")
                .node("check_in_guest", checkInGuest())
                .node("create_folio", createFolio())
                .node("add_charges", addCharges())
                .node("check_out_guest", checkOutGuest())
                .node("generate_invoice", generateInvoice())
                .node("create_sales_invoice", createSalesInvoice())
                .node("notify_completion", new CoAgentNotifyNode(
                        state -> CoAgentNotification.workflowCompleted(NAME), "workflow_completed"))
                .node("escalate_invoice_approval", escalateInvoiceApproval())
                .terminalNode("workflow_completed", CoAgentExecutionStatus.COMPLETED)
                .terminalNode("workflow_rejected", CoAgentExecutionStatus.REJECTED)
                .industry("hospitality")
                .tag("hotel")
                .tag("o2c")
                .estimatedSteps(7)
                .build();
    }

    private static CoAgentApprovalGate checkInGuest() {
        return CoAgentApprovalGate.builder()
                .operation("check_in_guest")
                .approvedNode("create_folio")
                .rejectedNode("workflow_rejected")
                .preview(state -> String.format("Check-in of %s into room %s, %s to %s",
                        state.getString("guest_name"), state.getString("room_number"),
                        state.getString("check_in_date"), state.getString("check_out_date")))
                .details(state -> SampleDocuments.pick(state, "reservation_id", "guest_name", "room_number", "check_in_date", "check_out_date"))
                .risk(state -> CoAgentRiskLevel.MEDIUM)
                .onApprove(state -> CoAgentStatePatch.builder().put("reservation_status", "Checked In").build())
                .build();
    }

    private static ICoAgentNode createFolio() {
        return (state, context) -> context.getDocumentClient()
                .create("Folio", SampleDocuments.pick(state, "reservation_id", "guest_name", "room_number"))
                .map(folio -> CoAgentNodeOutcome.next("add_charges",
                        CoAgentStatePatch.builder().put("folio_id", SampleDocuments.nameOf(folio)).build()));
    }

    private static ICoAgentNode addCharges() {
        return (state, context) -> Mono.defer(() -> {
            LocalDate arrival = SampleDocuments.parseDate("check_in_date", state.getString("check_in_date"));
            LocalDate departure = SampleDocuments.parseDate("check_out_date", state.getString("check_out_date"));
            long nights = Math.max(1, ChronoUnit.DAYS.between(arrival, departure));
            double roomCharges = SampleDocuments.round(state.getNumber("room_rate", 150.0) * nights);
            double tax = SampleDocuments.round(roomCharges * TAX_RATE);

            Map<String, Object> charges = new LinkedHashMap<>();
            charges.put("nights", nights);
            charges.put("room_charges", roomCharges);
            charges.put("tax", tax);
            charges.put("grand_total", SampleDocuments.round(roomCharges + tax));
            return context.getDocumentClient()
                    .update("Folio", state.getString("folio_id"), charges)
                    .map(folio -> CoAgentNodeOutcome.next("check_out_guest", CoAgentStatePatch.of(charges)));
        });
    }

    private static ICoAgentNode checkOutGuest() {
        return (state, context) -> Mono.just(CoAgentNodeOutcome.next("generate_invoice", CoAgentStatePatch.builder()
                .put("reservation_status", "Checked Out")
                .put("room_status", "Available")
                .build()));
    }

    private static CoAgentApprovalGate generateInvoice() {
        return CoAgentApprovalGate.builder()
                .operation("generate_invoice")
                .approvedNode("create_sales_invoice")
                .rejectedNode("workflow_rejected")
                .preview(state -> String.format("Invoice for %s, folio %s: %.2f room charges + %.2f tax = %.2f",
                        state.getString("guest_name"), state.getString("folio_id"),
                        state.getNumber("room_charges", 0), state.getNumber("tax", 0), state.getNumber("grand_total", 0)))
                .details(state -> SampleDocuments.pick(state, "guest_name", "folio_id", "room_number", "nights", "room_charges", "tax", "grand_total"))
                .risk(state -> CoAgentRiskLevel.HIGH)
                .timeout(Duration.ofHours(2), "escalate_invoice_approval")
                .build();
    }

    private static ICoAgentNode createSalesInvoice() {
        return (state, context) -> context.getDocumentClient()
                .create("Sales Invoice", SampleDocuments.pick(state, "guest_name", "folio_id", "grand_total"))
                .flatMap(invoice -> context.getDocumentClient().submit("Sales Invoice", SampleDocuments.nameOf(invoice)))
                .map(invoice -> CoAgentNodeOutcome.next("notify_completion", CoAgentStatePatch.builder()
                        .put("invoice_id", SampleDocuments.nameOf(invoice))
                        .put("invoice_status", invoice.get("status"))
                        .build()));
    }

    private static CoAgentEscalateNode escalateInvoiceApproval() {
        return CoAgentEscalateNode.builder()
                .issueType(CoAgentEscalationIssueType.TIMEOUT)
                .nextNode("generate_invoice")
                .severity(CoAgentEscalationSeverity.HIGH)
                .recipient("Front Office Manager")
                .message(state -> "Invoice approval for " + state.getString("guest_name") + " is overdue")
                .details(state -> SampleDocuments.pick(state, "folio_id", "grand_total"))
                .build();
    }
}
