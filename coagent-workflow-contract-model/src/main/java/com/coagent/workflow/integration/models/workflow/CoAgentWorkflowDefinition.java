package com.coagent.workflow.integration.models.workflow;

import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNode;
import lombok.Getter;
import lombok.ToString;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named graph of nodes over a declared state schema. Immutable once built.
 *
 * <pre>{@code
 * CoAgentWorkflowDefinition definition = CoAgentWorkflowDefinition.builder()
 *         .name("hotel_o2c")
 *         .description("Guest check-in to invoice")
 *         .schema(schema)
 *         .entryNode("check_in_guest")
 *         .node("check_in_guest", checkInGate)
 *         .node("create_folio", createFolio)
 *         .terminalNode("workflow_complete", CoAgentExecutionStatus.COMPLETED)
 *         .terminalNode("workflow_rejected", CoAgentExecutionStatus.REJECTED)
 *         .industry("hospitality")
 *         .build();
 * }</pre>
 */
@Getter
@ToString(of = {"name", "industry", "entryNode", "terminalNodes"})
public class CoAgentWorkflowDefinition {
    private final String name;
    private final String description;
    private final String industry;
    private final List<String> tags;
    private final CoAgentStateSchema schema;
    private final String entryNode;
    private final Map<String, ICoAgentNode> nodes;
    private final Map<String, CoAgentExecutionStatus> terminalNodes;
    private final String errorNode;
    private final int estimatedSteps;

    private CoAgentWorkflowDefinition(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.industry = builder.industry;
        this.tags = List.copyOf(builder.tags);
        this.schema = builder.schema;
        this.entryNode = builder.entryNode;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.terminalNodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.terminalNodes));
        this.errorNode = builder.errorNode;
        this.estimatedSteps = builder.estimatedSteps > 0
                ? builder.estimatedSteps
                : builder.nodes.size() - builder.terminalNodes.size();
    }

    public Optional<ICoAgentNode> getNode(String nodeName) {
        return Optional.ofNullable(nodes.get(nodeName));
    }

    public boolean isTerminalNode(String nodeName) {
        return terminalNodes.containsKey(nodeName);
    }

    public Optional<String> getErrorNode() {
        return Optional.ofNullable(errorNode);
    }

    public boolean hasTag(String tag) {
        if (tag == null) {
            return true;
        }
        return tag.equalsIgnoreCase(industry) || tags.stream().anyMatch(tag::equalsIgnoreCase);
    }

    // ---------------------------------------------------------
    // Builder entry
    // ---------------------------------------------------------
    public static NameStep builder() {
        return new Builder();
    }

    // ---------------------------------------------------------
    // Step Interfaces
    // ---------------------------------------------------------
    public interface NameStep {
        DescriptionStep name(String name);
    }

    public interface DescriptionStep {
        SchemaStep description(String description);
    }

    public interface SchemaStep {
        EntryNodeStep schema(CoAgentStateSchema schema);
    }

    public interface EntryNodeStep {
        NodeStep entryNode(String entryNode);
    }

    public interface NodeStep {
        NodeStep node(String nodeName, ICoAgentNode node);

        /**
         * Declares a terminal node that simply ends the thread with the given status.
         */
        NodeStep terminalNode(String nodeName, CoAgentExecutionStatus status);

        /**
         * Declares a terminal node with its own logic; it should answer with a terminal outcome.
         */
        NodeStep terminalNode(String nodeName, CoAgentExecutionStatus status, ICoAgentNode node);

        NodeStep errorNode(String nodeName);

        NodeStep industry(String industry);

        NodeStep tag(String tag);

        NodeStep estimatedSteps(int estimatedSteps);

        CoAgentWorkflowDefinition build();
    }

    // ---------------------------------------------------------
    // Builder Implementation
    // ---------------------------------------------------------
    private static class Builder implements NameStep, DescriptionStep, SchemaStep, EntryNodeStep, NodeStep {
        private String name;
        private String description;
        private String industry;
        private final List<String> tags = new ArrayList<>();
        private CoAgentStateSchema schema;
        private String entryNode;
        private final Map<String, ICoAgentNode> nodes = new LinkedHashMap<>();
        private final Map<String, CoAgentExecutionStatus> terminalNodes = new LinkedHashMap<>();
        private String errorNode;
        private int estimatedSteps;

        @Override
        public DescriptionStep name(String name) {
            this.name = name;
            return this;
        }

        @Override
        public SchemaStep description(String description) {
            this.description = description;
            return this;
        }

        @Override
        public EntryNodeStep schema(CoAgentStateSchema schema) {
            this.schema = schema == null ? CoAgentStateSchema.empty() : schema;
            return this;
        }

        @Override
        public NodeStep entryNode(String entryNode) {
            this.entryNode = entryNode;
            return this;
        }

        @Override
        public NodeStep node(String nodeName, ICoAgentNode node) {
            if (nodes.putIfAbsent(nodeName, node) != null) {
                throw new IllegalStateException("Node [" + nodeName + "] declared twice in workflow [" + name + "]");
            }
            return this;
        }

        @Override
        public NodeStep terminalNode(String nodeName, CoAgentExecutionStatus status) {
            return terminalNode(nodeName, status, (state, context) -> Mono.just(CoAgentNodeOutcome.terminal(status)));
        }

        @Override
        public NodeStep terminalNode(String nodeName, CoAgentExecutionStatus status, ICoAgentNode node) {
            if (!status.isTerminal()) {
                throw new IllegalStateException("Terminal node [" + nodeName + "] needs a terminal status, got " + status);
            }
            node(nodeName, node);
            terminalNodes.put(nodeName, status);
            return this;
        }

        @Override
        public NodeStep errorNode(String nodeName) {
            this.errorNode = nodeName;
            return this;
        }

        @Override
        public NodeStep industry(String industry) {
            this.industry = industry;
            return this;
        }

        @Override
        public NodeStep tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        @Override
        public NodeStep estimatedSteps(int estimatedSteps) {
            this.estimatedSteps = estimatedSteps;
            return this;
        }

        @Override
        public CoAgentWorkflowDefinition build() {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Workflow name is required");
            }
            if (!nodes.containsKey(entryNode)) {
                throw new IllegalStateException("Entry node [" + entryNode + "] is not declared in workflow [" + name + "]");
            }
            if (terminalNodes.isEmpty()) {
                throw new IllegalStateException("Workflow [" + name + "] declares no terminal node");
            }
            if (errorNode != null && !nodes.containsKey(errorNode)) {
                throw new IllegalStateException("Error node [" + errorNode + "] is not declared in workflow [" + name + "]");
            }
            return new CoAgentWorkflowDefinition(this);
        }
    }
}
