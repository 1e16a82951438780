package com.coagent.workflow.plugins.sample.workflows;

import com.coagent.workflow.core.engine.primitive.CoAgentApprovalGate;
import com.coagent.workflow.core.engine.primitive.CoAgentEscalateNode;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationIssueType;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationSeverity;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.enumerations.CoAgentFieldType;
import com.coagent.workflow.integration.enumerations.CoAgentRiskLevel;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNode;
import com.coagent.workflow.integration.models.workflow.CoAgentStateSchema;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hospital admission: patient record, admission appointment, clinical orders, encounter and invoice.
 *
 * <p>Clinical orders always need a physician's approval; the sepsis protocol is rated critical and
 * escalated to the attending physician when not decided within 30 minutes.</p>
 */
public final class HospitalAdmissionsWorkflow {

    public static final String NAME = "hospital_admissions";
    public static final String DEFAULT_PROTOCOL = "standard_admission";

    private static final Map<String, Map<String, List<String>>> PROTOCOLS = Map.of(
            "sepsis_protocol", Map.of(
                    "labs", List.of("CBC with differential", "Blood cultures x2", "Lactate level", "Comprehensive metabolic panel"),
                    "meds", List.of("Ceftriaxone 2g IV q24h", "Azithromycin 500mg IV daily", "Normal saline 30mL/kg IV bolus"),
                    "procedures", List.of("Continuous vital signs monitoring", "Central line placement")),
            "pneumonia_protocol", Map.of(
                    "labs", List.of("CBC with differential", "Blood cultures", "Chest X-ray"),
                    "meds", List.of("Azithromycin 500mg IV daily", "Ceftriaxone 1g IV q24h"),
                    "procedures", List.of("Oxygen therapy", "Pulse oximetry monitoring")),
            DEFAULT_PROTOCOL, Map.of(
                    "labs", List.of("CBC", "Basic metabolic panel"),
                    "meds", List.of(),
                    "procedures", List.of("Vital signs monitoring")));

    private static final double ADMISSION_FEE = 500.00;
    private static final double LAB_CHARGE = 87.50;
    private static final double MEDICATION_CHARGE = 62.50;
    private static final double PROCEDURE_CHARGE = 200.00;

    private HospitalAdmissionsWorkflow() {
    }

    public static CoAgentWorkflowDefinition create() {
        return CoAgentWorkflowDefinition.builder()
                .name(NAME)
                .description("Hospital admission: patient record, appointment, clinical orders, encounter and billing")
                .schema(CoAgentStateSchema.builder()
                        .required("patient_name", CoAgentFieldType.STRING, "Patient full name")
                        .required("admission_date", CoAgentFieldType.STRING, "ISO date of admission")
                        .required("primary_diagnosis", CoAgentFieldType.STRING, "Admitting diagnosis")
                        .optional("clinical_protocol", CoAgentFieldType.STRING, DEFAULT_PROTOCOL, "Order protocol to apply")
                        .build())
                .entryNode("create_patient")
                .node("create_patient", createPatient())
                .node("schedule_admission", scheduleAdmission())
                .node("create_order_set", createOrderSet())
                .node("record_order_set", recordOrderSet())
                .node("create_encounter", createEncounter())
                .node("generate_invoice", generateInvoice())
                .node("create_sales_invoice", createSalesInvoice())
                .node("escalate_order_set", escalateOrderSet())
                .terminalNode("workflow_completed", CoAgentExecutionStatus.COMPLETED)
                .terminalNode("workflow_rejected", CoAgentExecutionStatus.REJECTED)
                .industry("healthcare")
                .tag("hospital")
                .tag("admissions")
                .estimatedSteps(7)
                .build();
    }

    private static ICoAgentNode createPatient() {
        return (state, context) -> context.getDocumentClient()
                .create("Patient", SampleDocuments.pick(state, "patient_name"))
                .map(patient -> CoAgentNodeOutcome.next("schedule_admission",
                        CoAgentStatePatch.builder().put("patient_id", SampleDocuments.nameOf(patient)).build()));
    }

    private static ICoAgentNode scheduleAdmission() {
        return (state, context) -> context.getDocumentClient()
                .create("Patient Appointment", SampleDocuments.pick(state, "patient_id", "admission_date"))
                .map(appointment -> CoAgentNodeOutcome.next("create_order_set",
                        CoAgentStatePatch.builder().put("appointment_id", SampleDocuments.nameOf(appointment)).build()));
    }

    private static CoAgentApprovalGate createOrderSet() {
        return CoAgentApprovalGate.builder()
                .operation("create_order_set")
                .approvedNode("record_order_set")
                .rejectedNode("workflow_rejected")
                .preview(state -> {
                    Map<String, List<String>> orders = ordersFor(state);
                    return String.format("Clinical orders for %s (%s), protocol %s: %d labs, %d medications, %d procedures",
                            state.getString("patient_name"), state.getString("primary_diagnosis"), protocolOf(state),
                            orders.get("labs").size(), orders.get("meds").size(), orders.get("procedures").size());
                })
                .details(state -> {
                    Map<String, Object> details = SampleDocuments.pick(state, "patient_id", "patient_name", "primary_diagnosis");
                    details.put("protocol", protocolOf(state));
                    details.put("orders", ordersFor(state));
                    details.put("requires_physician_approval", true);
                    return details;
                })
                .risk(state -> "sepsis_protocol".equals(protocolOf(state)) ? CoAgentRiskLevel.CRITICAL : CoAgentRiskLevel.HIGH)
                .timeout(Duration.ofMinutes(30), "escalate_order_set")
                .build();
    }

    private static ICoAgentNode recordOrderSet() {
        return (state, context) -> {
            Map<String, Object> orderSet = SampleDocuments.pick(state, "patient_id", "primary_diagnosis");
            orderSet.put("protocol", protocolOf(state));
            orderSet.putAll(ordersFor(state));
            return context.getDocumentClient()
                    .create("Clinical Order Set", orderSet)
                    .map(record -> CoAgentNodeOutcome.next("create_encounter", CoAgentStatePatch.builder()
                            .put("order_set_id", SampleDocuments.nameOf(record))
                            .build()));
        };
    }

    private static ICoAgentNode createEncounter() {
        return (state, context) -> context.getDocumentClient()
                .create("Patient Encounter", SampleDocuments.pick(state, "patient_id", "appointment_id", "order_set_id"))
                .map(encounter -> CoAgentNodeOutcome.next("generate_invoice",
                        CoAgentStatePatch.builder().put("encounter_id", SampleDocuments.nameOf(encounter)).build()));
    }

    private static CoAgentApprovalGate generateInvoice() {
        return CoAgentApprovalGate.builder()
                .operation("generate_invoice")
                .approvedNode("create_sales_invoice")
                .rejectedNode("workflow_rejected")
                .preview(state -> String.format("Invoice for %s, encounter %s: %.2f",
                        state.getString("patient_name"), state.getString("encounter_id"), charges(state).get("grand_total")))
                .details(state -> {
                    Map<String, Object> details = SampleDocuments.pick(state, "patient_id", "patient_name", "encounter_id");
                    details.putAll(charges(state));
                    return details;
                })
                .risk(state -> CoAgentRiskLevel.HIGH)
                .onApprove(state -> CoAgentStatePatch.of(charges(state)))
                .build();
    }

    private static ICoAgentNode createSalesInvoice() {
        return (state, context) -> context.getDocumentClient()
                .create("Sales Invoice", SampleDocuments.pick(state, "patient_id", "encounter_id", "grand_total"))
                .flatMap(invoice -> context.getDocumentClient().submit("Sales Invoice", SampleDocuments.nameOf(invoice)))
                .map(invoice -> CoAgentNodeOutcome.next("workflow_completed",
                        CoAgentStatePatch.builder().put("invoice_id", SampleDocuments.nameOf(invoice)).build()));
    }

    private static CoAgentEscalateNode escalateOrderSet() {
        return CoAgentEscalateNode.builder()
                .issueType(CoAgentEscalationIssueType.TIMEOUT)
                .nextNode("create_order_set")
                .severity(state -> "sepsis_protocol".equals(protocolOf(state))
                        ? CoAgentEscalationSeverity.CRITICAL
                        : CoAgentEscalationSeverity.HIGH)
                .recipient("Attending Physician")
                .message(state -> "Clinical orders for " + state.getString("patient_name") + " are waiting for approval")
                .details(state -> SampleDocuments.pick(state, "patient_id", "primary_diagnosis"))
                .build();
    }

    static String protocolOf(CoAgentExecutionState state) {
        String protocol = state.getString("clinical_protocol");
        return protocol == null || !PROTOCOLS.containsKey(protocol) ? DEFAULT_PROTOCOL : protocol;
    }

    static Map<String, List<String>> ordersFor(CoAgentExecutionState state) {
        return PROTOCOLS.get(protocolOf(state));
    }

    static Map<String, Object> charges(CoAgentExecutionState state) {
        Map<String, List<String>> orders = ordersFor(state);
        double labs = SampleDocuments.round(orders.get("labs").size() * LAB_CHARGE);
        double medications = SampleDocuments.round(orders.get("meds").size() * MEDICATION_CHARGE);
        double procedures = SampleDocuments.round(orders.get("procedures").size() * PROCEDURE_CHARGE);

        Map<String, Object> charges = new LinkedHashMap<>();
        charges.put("admission_fee", ADMISSION_FEE);
        charges.put("lab_charges", labs);
        charges.put("medication_charges", medications);
        charges.put("procedure_charges", procedures);
        // hospital services are tax exempt
        charges.put("grand_total", SampleDocuments.round(ADMISSION_FEE + labs + medications + procedures));
        return charges;
    }
}
