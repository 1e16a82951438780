package com.coagent.workflow.core.engine.registry.impl;

import com.coagent.workflow.core.engine.registry.CoAgentValidatedState;
import com.coagent.workflow.core.engine.registry.ICoAgentWorkflowRegistry;
import com.coagent.workflow.core.exception.registry.CoAgentInvalidWorkflowDefinitionException;
import com.coagent.workflow.core.exception.registry.CoAgentWorkflowNotFoundException;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.node.ICoAgentNode;
import com.coagent.workflow.integration.models.node.ICoAgentRoutingNode;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowSummary;
import com.coagent.workflow.integration.models.workflow.ICoAgentWorkflowProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry backed by {@link ServiceLoader} discovery plus programmatic registration.
 */
@Slf4j
public class CoAgentWorkflowRegistry implements ICoAgentWorkflowRegistry {

    private static final String UNCATEGORIZED = "general";

    private final ClassLoader classLoader;
    private final Map<String, CoAgentWorkflowDefinition> discovered = new LinkedHashMap<>();
    private final Map<String, CoAgentWorkflowDefinition> registered = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public CoAgentWorkflowRegistry() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public CoAgentWorkflowRegistry(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * Registry that only knows programmatically registered workflows.
     */
    public static CoAgentWorkflowRegistry empty() {
        return new CoAgentWorkflowRegistry(null);
    }

    public static CoAgentWorkflowRegistry discover() {
        CoAgentWorkflowRegistry registry = new CoAgentWorkflowRegistry();
        registry.reload();
        return registry;
    }

    @Override
    public CoAgentWorkflowDefinition load(String workflowName) {
        lock.readLock().lock();
        try {
            CoAgentWorkflowDefinition definition = find(workflowName);
            if (definition == null) {
                throw new CoAgentWorkflowNotFoundException(workflowName);
            }
            return definition;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CoAgentValidatedState validate(String workflowName, Map<String, Object> initialState) {
        CoAgentWorkflowDefinition definition = load(workflowName);
        Map<String, Object> state = CoAgentStateValidator.validate(workflowName, definition.getSchema(), initialState);
        return new CoAgentValidatedState(workflowName, CoAgentExecutionState.of(state));
    }

    @Override
    public List<CoAgentWorkflowSummary> list(String tag) {
        return snapshot().stream()
                .filter(definition -> definition.hasTag(tag))
                .sorted(Comparator.comparing(CoAgentWorkflowDefinition::getName))
                .map(CoAgentWorkflowRegistry::toSummary)
                .toList();
    }

    @Override
    public CoAgentWorkflowSummary describe(String workflowName) {
        return toSummary(load(workflowName));
    }

    @Override
    public Map<String, Object> stats() {
        Map<String, Integer> byIndustry = new TreeMap<>();
        List<CoAgentWorkflowDefinition> definitions = snapshot();
        definitions.forEach(definition -> byIndustry.merge(industryOf(definition), 1, Integer::sum));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total", definitions.size());
        stats.put("by_industry", byIndustry);
        stats.put("available_industries", new ArrayList<>(new TreeSet<>(byIndustry.keySet())));
        return stats;
    }

    @Override
    public void register(CoAgentWorkflowDefinition definition) {
        checkDefinition(definition);
        lock.writeLock().lock();
        try {
            if (find(definition.getName()) != null) {
                throw new CoAgentInvalidWorkflowDefinitionException(definition.getName(), "a workflow with this name is already registered");
            }
            registered.put(definition.getName(), definition);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered workflow [{}]", definition.getName());
    }

    @Override
    public boolean contains(String workflowName) {
        lock.readLock().lock();
        try {
            return find(workflowName) != null;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void reload() {
        if (classLoader == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            discovered.clear();
            ServiceLoader<ICoAgentWorkflowProvider> providers = ServiceLoader.load(ICoAgentWorkflowProvider.class, classLoader);
            for (ICoAgentWorkflowProvider provider : providers) {
                for (CoAgentWorkflowDefinition definition : provider.getWorkflowDefinitions()) {
                    checkDefinition(definition);
                    if (discovered.containsKey(definition.getName()) || registered.containsKey(definition.getName())) {
                        throw new CoAgentInvalidWorkflowDefinitionException(definition.getName(),
                                "provider [" + provider.getProviderName() + "] redeclares an existing workflow");
                    }
                    discovered.put(definition.getName(), definition);
                }
                log.info("Loaded workflow provider [{}]", provider.getProviderName());
            }
            log.info("Workflow registry holds {} workflows", discovered.size() + registered.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ============================================================================
    // PRIVATE HELPERS
    // ============================================================================

    private CoAgentWorkflowDefinition find(String workflowName) {
        CoAgentWorkflowDefinition definition = registered.get(workflowName);
        return definition != null ? definition : discovered.get(workflowName);
    }

    private List<CoAgentWorkflowDefinition> snapshot() {
        lock.readLock().lock();
        try {
            List<CoAgentWorkflowDefinition> definitions = new ArrayList<>(discovered.values());
            definitions.addAll(registered.values());
            return definitions;
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void checkDefinition(CoAgentWorkflowDefinition definition) {
        String name = definition.getName();
        if (!definition.getNodes().containsKey(definition.getEntryNode())) {
            throw new CoAgentInvalidWorkflowDefinitionException(name, "entry node [" + definition.getEntryNode() + "] is not declared");
        }
        for (String terminal : definition.getTerminalNodes().keySet()) {
            if (!definition.getNodes().containsKey(terminal)) {
                throw new CoAgentInvalidWorkflowDefinitionException(name, "terminal node [" + terminal + "] is not declared");
            }
        }
        for (Map.Entry<String, ICoAgentNode> entry : definition.getNodes().entrySet()) {
            if (entry.getValue() instanceof ICoAgentRoutingNode routingNode) {
                for (String successor : routingNode.getSuccessors()) {
                    if (!definition.getNodes().containsKey(successor)) {
                        throw new CoAgentInvalidWorkflowDefinitionException(name,
                                "node [" + entry.getKey() + "] routes to undeclared node [" + successor + "]");
                    }
                }
            }
        }
    }

    private static String industryOf(CoAgentWorkflowDefinition definition) {
        return definition.getIndustry() == null ? UNCATEGORIZED : definition.getIndustry();
    }

    private static CoAgentWorkflowSummary toSummary(CoAgentWorkflowDefinition definition) {
        return CoAgentWorkflowSummary.builder()
                .name(definition.getName())
                .description(definition.getDescription())
                .industry(industryOf(definition))
                .tags(definition.getTags())
                .declaredSchema(definition.getSchema().describe())
                .estimatedSteps(definition.getEstimatedSteps())
                .build();
    }
}
