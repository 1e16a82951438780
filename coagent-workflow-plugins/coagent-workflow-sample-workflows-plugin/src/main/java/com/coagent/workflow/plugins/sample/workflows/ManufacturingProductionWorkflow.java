package com.coagent.workflow.plugins.sample.workflows;

import com.coagent.workflow.core.engine.primitive.CoAgentApprovalGate;
import com.coagent.workflow.core.engine.primitive.CoAgentEscalateNode;
import com.coagent.workflow.core.engine.primitive.CoAgentFailureClassifier;
import com.coagent.workflow.core.engine.primitive.CoAgentRetryNode;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationIssueType;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationSeverity;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.enumerations.CoAgentFieldType;
import com.coagent.workflow.integration.enumerations.CoAgentRiskLevel;
import com.coagent.workflow.integration.models.commons.CoAgentRetryPolicy;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNode;
import com.coagent.workflow.integration.models.workflow.CoAgentStateSchema;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manufacturing production run: material check, work order, material request, stock entry and
 * quality inspection.
 *
 * <p>The work order is created through a retry step; when every attempt fails the failure is
 * escalated to the production manager and the thread ends in {@code workflow_failed}. The material
 * request gate auto-approves when nothing is short.</p>
 */
public final class ManufacturingProductionWorkflow {

    public static final String NAME = "manufacturing_production";

    private static final Map<String, List<Map<String, Object>>> BILLS_OF_MATERIALS = Map.of(
            "CHAIR-WOODEN", List.of(
                    material("WOOD-OAK", "Oak Wood", 2.5, "kg", 20.0),
                    material("SCREWS-M6", "M6 Screws", 12, "nos", 100),
                    material("VARNISH", "Wood Varnish", 0.5, "L", 3.0),
                    material("SANDPAPER", "Sandpaper 120-grit", 2, "sheets", 50)));

    private static final List<Map<String, Object>> DEFAULT_BOM = List.of(
            material("RAW-MAT-001", "Raw Material", 1.0, "kg", 100.0));

    private ManufacturingProductionWorkflow() {
    }

    public static CoAgentWorkflowDefinition create() {
        return create(CoAgentRetryPolicy.defaults());
    }

    /**
     * @param workOrderRetry retry policy of the work order creation
     */
    public static CoAgentWorkflowDefinition create(CoAgentRetryPolicy workOrderRetry) {
        return CoAgentWorkflowDefinition.builder()
                .name(NAME)
                .description("Manufacturing production: materials, work order, stock entry and quality inspection")
                .schema(CoAgentStateSchema.builder()
                        .required("item_code", CoAgentFieldType.STRING, "Item to produce")
                        .required("item_name", CoAgentFieldType.STRING, "Item description")
                        .required("qty_to_produce", CoAgentFieldType.NUMBER, "Quantity to produce")
                        .required("production_date", CoAgentFieldType.STRING, "ISO date of production")
                        .optional("warehouse", CoAgentFieldType.STRING, "Finished Goods", "Target warehouse")
                        .build())
                .entryNode("check_materials")
                .node("check_materials", checkMaterials())
                .node("create_work_order", createWorkOrder(workOrderRetry))
                .node("create_material_request", createMaterialRequest())
                .node("record_material_request", recordMaterialRequest())
                .node("create_stock_entry", createStockEntry())
                .node("create_quality_inspection", createQualityInspection())
                .node("record_quality_inspection", recordQualityInspection())
                .node("escalate_work_order_failure", escalateWorkOrderFailure())
                .terminalNode("workflow_completed", CoAgentExecutionStatus.COMPLETED)
                .terminalNode("workflow_rejected", CoAgentExecutionStatus.REJECTED)
                .terminalNode("workflow_failed", CoAgentExecutionStatus.ERROR)
                .industry("manufacturing")
                .tag("production")
                .estimatedSteps(7)
                .build();
    }

    private static ICoAgentNode checkMaterials() {
        return (state, context) -> Mono.fromSupplier(() -> {
            List<Map<String, Object>> materials = requiredMaterials(state);
            boolean shortage = materials.stream().anyMatch(material -> ((Number) material.get("shortage")).doubleValue() > 0);
            return CoAgentNodeOutcome.next("create_work_order", CoAgentStatePatch.builder()
                    .put("bom_id", "BOM-" + state.getString("item_code") + "-001")
                    .put("required_materials", materials)
                    .put("material_shortage", shortage)
                    .build());
        });
    }

    private static CoAgentRetryNode createWorkOrder(CoAgentRetryPolicy policy) {
        return CoAgentRetryNode.builder()
                .operationName("create_work_order")
                .operation((state, context) -> context.getDocumentClient()
                        .create("Work Order", SampleDocuments.pick(state, "item_code", "qty_to_produce", "production_date", "bom_id", "warehouse"))
                        .map(workOrder -> CoAgentStatePatch.builder()
                                .put("work_order_id", SampleDocuments.nameOf(workOrder))
                                .put("work_order_status", "Not Started")
                                .build()))
                .nextNode("create_material_request")
                .policy(policy)
                .classifier(CoAgentFailureClassifier.retryAll())
                .escalationNode("escalate_work_order_failure")
                .build();
    }

    private static CoAgentApprovalGate createMaterialRequest() {
        return CoAgentApprovalGate.builder()
                .operation("create_material_request")
                .approvedNode("record_material_request")
                .rejectedNode("workflow_rejected")
                .preview(state -> String.format("Purchase %d short materials for work order %s",
                        shortItems(state).size(), state.getString("work_order_id")))
                .details(state -> {
                    Map<String, Object> details = SampleDocuments.pick(state, "work_order_id", "item_code", "qty_to_produce");
                    details.put("short_items", shortItems(state));
                    return details;
                })
                .risk(state -> state.getBoolean("material_shortage") ? CoAgentRiskLevel.HIGH : CoAgentRiskLevel.LOW)
                .autoApproveBelow(CoAgentRiskLevel.MEDIUM)
                .build();
    }

    private static ICoAgentNode recordMaterialRequest() {
        return (state, context) -> {
            if (!state.getBoolean("material_shortage")) {
                return Mono.just(CoAgentNodeOutcome.next("create_stock_entry"));
            }
            Map<String, Object> request = SampleDocuments.pick(state, "work_order_id");
            request.put("items", shortItems(state));
            return context.getDocumentClient()
                    .create("Material Request", request)
                    .map(record -> CoAgentNodeOutcome.next("create_stock_entry", CoAgentStatePatch.builder()
                            .put("material_request_id", SampleDocuments.nameOf(record))
                            .build()));
        };
    }

    private static ICoAgentNode createStockEntry() {
        return (state, context) -> context.getDocumentClient()
                .create("Stock Entry", SampleDocuments.pick(state, "work_order_id", "item_code", "qty_to_produce", "warehouse"))
                .flatMap(entry -> context.getDocumentClient().submit("Stock Entry", SampleDocuments.nameOf(entry)))
                .map(entry -> CoAgentNodeOutcome.next("create_quality_inspection", CoAgentStatePatch.builder()
                        .put("stock_entry_id", SampleDocuments.nameOf(entry))
                        .put("work_order_status", "Completed")
                        .build()));
    }

    private static CoAgentApprovalGate createQualityInspection() {
        return CoAgentApprovalGate.builder()
                .operation("create_quality_inspection")
                .approvedNode("record_quality_inspection")
                .rejectedNode("workflow_rejected")
                .preview(state -> String.format("Quality sign-off of %s x %s from work order %s",
                        formatQuantity(state), state.getString("item_name"), state.getString("work_order_id")))
                .details(state -> SampleDocuments.pick(state, "work_order_id", "stock_entry_id", "item_code", "qty_to_produce"))
                .risk(state -> CoAgentRiskLevel.HIGH)
                .onApprove(state -> CoAgentStatePatch.builder().put("inspection_status", "Accepted").build())
                .build();
    }

    private static ICoAgentNode recordQualityInspection() {
        return (state, context) -> context.getDocumentClient()
                .create("Quality Inspection", SampleDocuments.pick(state, "work_order_id", "item_code", "inspection_status"))
                .flatMap(inspection -> context.getDocumentClient().submit("Quality Inspection", SampleDocuments.nameOf(inspection)))
                .map(inspection -> CoAgentNodeOutcome.next("workflow_completed", CoAgentStatePatch.builder()
                        .put("quality_inspection_id", SampleDocuments.nameOf(inspection))
                        .build()));
    }

    private static CoAgentEscalateNode escalateWorkOrderFailure() {
        return CoAgentEscalateNode.builder()
                .issueType(CoAgentEscalationIssueType.ERROR)
                .nextNode("workflow_failed")
                .severity(CoAgentEscalationSeverity.HIGH)
                .recipient("Production Manager")
                .message(state -> "Work order for " + state.getString("item_name") + " could not be created")
                .details(state -> {
                    Map<String, Object> details = SampleDocuments.pick(state, "item_code", "qty_to_produce");
                    details.put("errors", state.getErrors());
                    return details;
                })
                .build();
    }

    // ============================================================================
    // PRIVATE HELPERS
    // ============================================================================

    static List<Map<String, Object>> requiredMaterials(CoAgentExecutionState state) {
        double quantity = state.getNumber("qty_to_produce", 0);
        List<Map<String, Object>> materials = new ArrayList<>();
        for (Map<String, Object> material : BILLS_OF_MATERIALS.getOrDefault(state.getString("item_code"), DEFAULT_BOM)) {
            double required = ((Number) material.get("qty_per_unit")).doubleValue() * quantity;
            double available = ((Number) material.get("available_qty")).doubleValue();
            Map<String, Object> entry = new LinkedHashMap<>(material);
            entry.put("required_qty", required);
            entry.put("shortage", Math.max(0, required - available));
            materials.add(entry);
        }
        return materials;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> shortItems(CoAgentExecutionState state) {
        List<Map<String, Object>> materials = state.find("required_materials", List.class).orElse(List.of());
        return materials.stream()
                .filter(material -> ((Number) material.getOrDefault("shortage", 0)).doubleValue() > 0)
                .toList();
    }

    private static String formatQuantity(CoAgentExecutionState state) {
        double quantity = state.getNumber("qty_to_produce", 0);
        return quantity == Math.rint(quantity) ? String.valueOf((long) quantity) : String.valueOf(quantity);
    }

    private static Map<String, Object> material(String itemCode, String itemName, double qtyPerUnit, String uom, double availableQty) {
        Map<String, Object> material = new LinkedHashMap<>();
        material.put("item_code", itemCode);
        material.put("item_name", itemName);
        material.put("qty_per_unit", qtyPerUnit);
        material.put("uom", uom);
        material.put("available_qty", availableQty);
        return material;
    }
}
