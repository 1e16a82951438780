package com.coagent.workflow.plugins.sample.workflows;

import com.coagent.workflow.core.engine.primitive.CoAgentApprovalGate;
import com.coagent.workflow.core.engine.primitive.CoAgentNotifyNode;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.enumerations.CoAgentFieldType;
import com.coagent.workflow.integration.enumerations.CoAgentNotificationType;
import com.coagent.workflow.integration.enumerations.CoAgentRiskLevel;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNode;
import com.coagent.workflow.integration.models.notification.CoAgentNotification;
import com.coagent.workflow.integration.models.workflow.CoAgentStateSchema;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Retail order fulfillment: inventory check, sales order, pick list, delivery note and payment.
 *
 * <h2>Approval rules</h2>
 * <ul>
 *   <li>sales order: approved automatically unless an item runs low (medium risk) or the order
 *       exceeds {@value #LARGE_ORDER_THRESHOLD} (high risk)</li>
 *   <li>payment entry: approved automatically below {@value #PAYMENT_APPROVAL_THRESHOLD}</li>
 * </ul>
 */
public final class RetailFulfillmentWorkflow {

    public static final String NAME = "retail_fulfillment";
    public static final double LARGE_ORDER_THRESHOLD = 5000.00;
    public static final double PAYMENT_APPROVAL_THRESHOLD = 1000.00;

    private static final double DEFAULT_STOCK = 100;
    private static final Map<String, Double> STOCK_LEVELS = Map.of(
            "LAPTOP-001", 15.0,
            "MOUSE-001", 250.0,
            "KEYBOARD-001", 120.0,
            "MONITOR-001", 8.0);

    private RetailFulfillmentWorkflow() {
    }

    public static CoAgentWorkflowDefinition create() {
        return CoAgentWorkflowDefinition.builder()
                .name(NAME)
                .description("Retail fulfillment: inventory, sales order, pick list, delivery and payment")
                .schema(CoAgentStateSchema.builder()
                        .required("customer_name", CoAgentFieldType.STRING, "Customer display name")
                        .required("customer_id", CoAgentFieldType.STRING, "Customer identifier")
                        .required("order_items", CoAgentFieldType.LIST, "Items as {item_code, item_name, qty, rate}")
                        .required("delivery_date", CoAgentFieldType.STRING, "ISO date of delivery")
                        .optional("warehouse", CoAgentFieldType.STRING, "Main Store", "Warehouse to ship from")
                        .build())
                .entryNode("check_inventory")
                .node("check_inventory", checkInventory())
                .node("create_sales_order", createSalesOrder())
                .node("record_sales_order", recordSalesOrder())
                .node("create_pick_list", createPickList())
                .node("create_delivery_note", createDeliveryNote())
                .node("create_payment_entry", createPaymentEntry())
                .node("record_payment_entry", recordPaymentEntry())
                .node("notify_shipment", new CoAgentNotifyNode(state -> CoAgentNotification.builder()
                        .type(CoAgentNotificationType.SUCCESS)
                        .title("Order shipped")
                        .message("Delivery " + state.getString("delivery_note_id") + " for " + state.getString("customer_name") + " is on its way")
                        .build(), "workflow_completed"))
                .terminalNode("workflow_completed", CoAgentExecutionStatus.COMPLETED)
                .terminalNode("workflow_rejected", CoAgentExecutionStatus.REJECTED)
                .industry("retail")
                .tag("fulfillment")
                .tag("o2c")
                .estimatedSteps(8)
                .build();
    }

    private static ICoAgentNode checkInventory() {
        return (state, context) -> Mono.fromSupplier(() -> {
            Map<String, Object> availability = new LinkedHashMap<>();
            List<Map<String, Object>> lowStock = new ArrayList<>();
            double total = 0;
            for (Map<String, Object> item : orderItems(state)) {
                String itemCode = String.valueOf(item.getOrDefault("item_code", item.getOrDefault("item_name", "UNKNOWN")));
                double required = number(item.get("qty"));
                double available = STOCK_LEVELS.getOrDefault(itemCode, DEFAULT_STOCK);
                total += required * number(item.get("rate"));

                availability.put(itemCode, Map.of("available", available, "required", required, "sufficient", available >= required));
                double remaining = available - required;
                if (remaining < required * 0.2 || remaining < 10) {
                    Map<String, Object> warning = new LinkedHashMap<>();
                    warning.put("item_code", itemCode);
                    warning.put("required", required);
                    warning.put("available", available);
                    warning.put("remaining_after", remaining);
                    lowStock.add(warning);
                }
            }
            return CoAgentNodeOutcome.next("create_sales_order", CoAgentStatePatch.builder()
                    .put("stock_availability", availability)
                    .put("low_stock_items", lowStock)
                    .put("order_total", Math.round(total * 100.0) / 100.0)
                    .build());
        });
    }

    private static CoAgentApprovalGate createSalesOrder() {
        return CoAgentApprovalGate.builder()
                .operation("create_sales_order")
                .approvedNode("record_sales_order")
                .rejectedNode("workflow_rejected")
                .preview(state -> String.format("Sales order for %s: %d items, total %.2f, %d low stock warnings",
                        state.getString("customer_name"), orderItems(state).size(),
                        state.getNumber("order_total", 0), lowStockItems(state).size()))
                .details(state -> SampleDocuments.pick(state, "customer_id", "order_items", "order_total", "low_stock_items"))
                .risk(RetailFulfillmentWorkflow::salesOrderRisk)
                .autoApproveBelow(CoAgentRiskLevel.MEDIUM)
                .build();
    }

    private static ICoAgentNode recordSalesOrder() {
        return (state, context) -> context.getDocumentClient()
                .create("Sales Order", SampleDocuments.pick(state, "customer_id", "order_items", "delivery_date", "order_total"))
                .flatMap(order -> context.getDocumentClient().submit("Sales Order", SampleDocuments.nameOf(order)))
                .map(order -> CoAgentNodeOutcome.next("create_pick_list",
                        CoAgentStatePatch.builder().put("sales_order_id", SampleDocuments.nameOf(order)).build()));
    }

    private static ICoAgentNode createPickList() {
        return (state, context) -> context.getDocumentClient()
                .create("Pick List", SampleDocuments.pick(state, "sales_order_id", "warehouse", "order_items"))
                .map(pickList -> CoAgentNodeOutcome.next("create_delivery_note",
                        CoAgentStatePatch.builder().put("pick_list_id", SampleDocuments.nameOf(pickList)).build()));
    }

    private static ICoAgentNode createDeliveryNote() {
        return (state, context) -> context.getDocumentClient()
                .create("Delivery Note", SampleDocuments.pick(state, "sales_order_id", "pick_list_id", "customer_id", "delivery_date"))
                .flatMap(note -> context.getDocumentClient().submit("Delivery Note", SampleDocuments.nameOf(note)))
                .map(note -> CoAgentNodeOutcome.next("create_payment_entry",
                        CoAgentStatePatch.builder().put("delivery_note_id", SampleDocuments.nameOf(note)).build()));
    }

    private static CoAgentApprovalGate createPaymentEntry() {
        return CoAgentApprovalGate.builder()
                .operation("create_payment_entry")
                .approvedNode("record_payment_entry")
                .rejectedNode("workflow_rejected")
                .preview(state -> String.format("Record payment of %.2f from %s against %s",
                        state.getNumber("order_total", 0), state.getString("customer_name"), state.getString("sales_order_id")))
                .details(state -> SampleDocuments.pick(state, "customer_id", "sales_order_id", "delivery_note_id", "order_total"))
                .risk(state -> state.getNumber("order_total", 0) < PAYMENT_APPROVAL_THRESHOLD ? CoAgentRiskLevel.LOW : CoAgentRiskLevel.HIGH)
                .autoApproveBelow(CoAgentRiskLevel.MEDIUM)
                .build();
    }

    private static ICoAgentNode recordPaymentEntry() {
        return (state, context) -> context.getDocumentClient()
                .create("Payment Entry", SampleDocuments.pick(state, "customer_id", "sales_order_id", "order_total"))
                .flatMap(payment -> context.getDocumentClient().submit("Payment Entry", SampleDocuments.nameOf(payment)))
                .map(payment -> CoAgentNodeOutcome.next("notify_shipment",
                        CoAgentStatePatch.builder().put("payment_entry_id", SampleDocuments.nameOf(payment)).build()));
    }

    // ============================================================================
    // PRIVATE HELPERS
    // ============================================================================

    static CoAgentRiskLevel salesOrderRisk(CoAgentExecutionState state) {
        if (state.getNumber("order_total", 0) > LARGE_ORDER_THRESHOLD) {
            return CoAgentRiskLevel.HIGH;
        }
        return lowStockItems(state).isEmpty() ? CoAgentRiskLevel.LOW : CoAgentRiskLevel.MEDIUM;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> orderItems(CoAgentExecutionState state) {
        return state.find("order_items", List.class).orElse(List.of());
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> lowStockItems(CoAgentExecutionState state) {
        return state.find("low_stock_items", List.class).orElse(List.of());
    }

    private static double number(Object value) {
        return value instanceof Number number ? number.doubleValue() : 0;
    }
}
