package com.coagent.workflow.core.engine.registry.impl;

import com.coagent.workflow.core.engine.CoAgentTestWorkflows;
import com.coagent.workflow.core.engine.primitive.CoAgentApprovalGate;
import com.coagent.workflow.core.engine.registry.CoAgentValidatedState;
import com.coagent.workflow.core.exception.registry.CoAgentInvalidWorkflowDefinitionException;
import com.coagent.workflow.core.exception.registry.CoAgentStateValidationException;
import com.coagent.workflow.core.exception.registry.CoAgentWorkflowNotFoundException;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.enumerations.CoAgentFieldType;
import com.coagent.workflow.integration.models.workflow.CoAgentStateSchema;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoAgentWorkflowRegistryTest {

    private CoAgentTestWorkflows workflows;
    private CoAgentWorkflowRegistry registry;

    @BeforeEach
    void setUp() {
        workflows = new CoAgentTestWorkflows();
        registry = CoAgentWorkflowRegistry.empty();
        registry.register(workflows.orderApproval());
    }

    private static CoAgentWorkflowDefinition.NodeStep minimal(String name) {
        return CoAgentWorkflowDefinition.builder()
                .name(name)
                .description("Minimal workflow")
                .schema(CoAgentStateSchema.empty())
                .entryNode("only")
                .node("only", new CoAgentTestWorkflows().counting("only", "done", "ran", true))
                .terminalNode("done", CoAgentExecutionStatus.COMPLETED);
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("refuses a second workflow under the same name")
        void duplicateName() {
            assertThatThrownBy(() -> registry.register(workflows.orderApproval()))
                    .isInstanceOf(CoAgentInvalidWorkflowDefinitionException.class)
                    .hasMessageContaining("already registered");
        }

        @Test
        @DisplayName("refuses a gate routing to an undeclared node")
        void undeclaredSuccessor() {
            CoAgentWorkflowDefinition broken = minimal("broken_gate")
                    .node("gate", CoAgentApprovalGate.builder()
                            .operation("ship")
                            .approvedNode("ship_order")
                            .rejectedNode("done")
                            .build())
                    .build();

            assertThatThrownBy(() -> registry.register(broken))
                    .isInstanceOf(CoAgentInvalidWorkflowDefinitionException.class)
                    .hasMessageContaining("ship_order");
            assertThat(registry.contains("broken_gate")).isFalse();
        }

        @Test
        @DisplayName("the definition builder refuses a graph without terminal node")
        void noTerminalNode() {
            assertThatThrownBy(() -> CoAgentWorkflowDefinition.builder()
                    .name("endless")
                    .description("No way out")
                    .schema(CoAgentStateSchema.empty())
                    .entryNode("only")
                    .node("only", workflows.counting("only", "only", "ran", true))
                    .build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("terminal");
        }

        @Test
        @DisplayName("an unknown workflow is reported as not found")
        void unknownWorkflow() {
            assertThatThrownBy(() -> registry.load("payroll"))
                    .isInstanceOf(CoAgentWorkflowNotFoundException.class)
                    .hasMessageContaining("payroll");
        }
    }

    @Nested
    @DisplayName("Initial state validation")
    class Validation {

        @Test
        @DisplayName("fills defaults and control fields")
        void fillsDefaults() {
            CoAgentValidatedState validated = registry.validate(CoAgentTestWorkflows.ORDER_APPROVAL, Map.of("order_id", "SO-7"));

            assertThat(validated.getWorkflowName()).isEqualTo(CoAgentTestWorkflows.ORDER_APPROVAL);
            assertThat(validated.getState().asMap())
                    .containsEntry("order_id", "SO-7")
                    .containsEntry("amount", 100)
                    .containsEntry("steps_completed", List.of())
                    .containsEntry("errors", List.of())
                    .containsEntry("pending_approval", false);
        }

        @Test
        @DisplayName("keeps fields the schema does not declare")
        void keepsUndeclaredFields() {
            CoAgentValidatedState validated = registry.validate(CoAgentTestWorkflows.ORDER_APPROVAL,
                    Map.of("order_id", "SO-7", "channel", "web"));

            assertThat(validated.getState().asMap()).containsEntry("channel", "web");
        }

        @Test
        @DisplayName("lists every missing and mistyped field at once")
        void reportsAllProblems() {
            Map<String, Object> input = new HashMap<>();
            input.put("amount", "a lot");

            assertThatThrownBy(() -> registry.validate(CoAgentTestWorkflows.ORDER_APPROVAL, input))
                    .isInstanceOfSatisfying(CoAgentStateValidationException.class, error -> {
                        assertThat(error.getMissingFields()).containsExactly("order_id");
                        assertThat(error.getInvalidFields()).containsEntry("amount", "number");
                        assertThat(error.getDetails()).containsKeys("missing_fields", "invalid_fields");
                    });
        }

        @Test
        @DisplayName("an integer field refuses fractional numbers")
        void integerField() {
            CoAgentWorkflowDefinition counted = CoAgentWorkflowDefinition.builder()
                    .name("counted")
                    .description("Takes a quantity")
                    .schema(CoAgentStateSchema.builder()
                            .required("quantity", CoAgentFieldType.INTEGER, "Units")
                            .build())
                    .entryNode("only")
                    .node("only", workflows.counting("only", "done", "ran", true))
                    .terminalNode("done", CoAgentExecutionStatus.COMPLETED)
                    .build();
            registry.register(counted);

            assertThat(registry.validate("counted", Map.of("quantity", 3)).getState().asMap()).containsEntry("quantity", 3);
            assertThatThrownBy(() -> registry.validate("counted", Map.of("quantity", 2.5)))
                    .isInstanceOf(CoAgentStateValidationException.class);
        }

        @Test
        @DisplayName("a list default is copied per thread")
        void listDefaultsAreCopied() {
            CoAgentWorkflowDefinition listed = CoAgentWorkflowDefinition.builder()
                    .name("listed")
                    .description("Carries a list")
                    .schema(CoAgentStateSchema.builder()
                            .optional("items", CoAgentFieldType.LIST, List.of("a"), "Items")
                            .build())
                    .entryNode("only")
                    .node("only", workflows.counting("only", "done", "ran", true))
                    .terminalNode("done", CoAgentExecutionStatus.COMPLETED)
                    .build();
            registry.register(listed);

            Object first = registry.validate("listed", Map.of()).getState().asMap().get("items");
            Object second = registry.validate("listed", Map.of()).getState().asMap().get("items");

            assertThat(first).isEqualTo(List.of("a")).isNotSameAs(second);
        }
    }

    @Nested
    @DisplayName("Catalogue")
    class Catalogue {

        @BeforeEach
        void registerMore() {
            registry.register(minimal("plain_flow").industry("logistics").tag("demo").build());
            registry.register(minimal("other_flow").build());
        }

        @Test
        @DisplayName("lists all workflows sorted by name")
        void listAll() {
            assertThat(registry.list(null)).extracting(CoAgentWorkflowSummary::getName)
                    .containsExactly("order_approval", "other_flow", "plain_flow");
        }

        @Test
        @DisplayName("filters by industry or tag ignoring case")
        void listByTag() {
            assertThat(registry.list("LOGISTICS")).extracting(CoAgentWorkflowSummary::getName).containsExactly("plain_flow");
            assertThat(registry.list("testing")).extracting(CoAgentWorkflowSummary::getName).containsExactly("order_approval");
            assertThat(registry.list("mining")).isEmpty();
        }

        @Test
        @DisplayName("describes the declared schema")
        void describe() {
            CoAgentWorkflowSummary summary = registry.describe(CoAgentTestWorkflows.ORDER_APPROVAL);

            assertThat(summary.getIndustry()).isEqualTo("retail");
            assertThat(summary.getEstimatedSteps()).isEqualTo(5);
            assertThat(summary.getDeclaredSchema()).containsKeys("order_id", "amount");
            assertThat(registry.describe("other_flow").getIndustry()).isEqualTo("general");
        }

        @Test
        @DisplayName("counts workflows per industry")
        @SuppressWarnings("unchecked")
        void stats() {
            Map<String, Object> stats = registry.stats();

            assertThat(stats).containsEntry("total", 3);
            assertThat((Map<String, Integer>) stats.get("by_industry"))
                    .containsEntry("retail", 1)
                    .containsEntry("logistics", 1)
                    .containsEntry("general", 1);
            assertThat((List<String>) stats.get("available_industries")).containsExactly("general", "logistics", "retail");
        }
    }

    @Nested
    @DisplayName("Discovery")
    class Discovery {

        @Test
        @DisplayName("loads the workflows of providers on the classpath")
        void discover() {
            CoAgentWorkflowRegistry discovered = CoAgentWorkflowRegistry.discover();

            assertThat(discovered.contains(CoAgentTestWorkflows.ORDER_APPROVAL)).isTrue();
        }

        @Test
        @DisplayName("reload keeps programmatic registrations")
        void reloadKeepsRegistrations() {
            CoAgentWorkflowRegistry discovered = CoAgentWorkflowRegistry.discover();
            discovered.register(minimal("plain_flow").build());

            discovered.reload();

            assertThat(discovered.contains("plain_flow")).isTrue();
            assertThat(discovered.contains(CoAgentTestWorkflows.ORDER_APPROVAL)).isTrue();
        }

        @Test
        @DisplayName("an empty registry does not look at the classpath")
        void emptyRegistry() {
            CoAgentWorkflowRegistry empty = CoAgentWorkflowRegistry.empty();
            empty.reload();

            assertThat(empty.list(null)).isEmpty();
        }
    }
}
