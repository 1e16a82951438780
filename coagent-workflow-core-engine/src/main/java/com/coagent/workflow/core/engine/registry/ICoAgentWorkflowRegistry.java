package com.coagent.workflow.core.engine.registry;

import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowSummary;

import java.util.List;
import java.util.Map;

/**
 * Catalogue of the workflow definitions the engine can run.
 *
 * <h2>Sources</h2>
 * <ul>
 *   <li>{@link com.coagent.workflow.integration.models.workflow.ICoAgentWorkflowProvider}
 *       implementations found on the classpath at start and on {@link #reload()}</li>
 *   <li>definitions registered programmatically with {@link #register}</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CoAgentValidatedState validated = registry.validate("hotel_o2c", Map.of("guest_name", "Ada"));
 * CoAgentWorkflowDefinition definition = registry.load("hotel_o2c");
 * engine.execute(definition, validated, config);
 * }</pre>
 */
public interface ICoAgentWorkflowRegistry {

    /**
     * @throws com.coagent.workflow.core.exception.registry.CoAgentWorkflowNotFoundException if no workflow has that name
     */
    CoAgentWorkflowDefinition load(String workflowName);

    /**
     * Checks the initial state against the workflow's declared schema and fills in defaults.
     *
     * @throws com.coagent.workflow.core.exception.registry.CoAgentStateValidationException listing every
     *         missing and mistyped field
     */
    CoAgentValidatedState validate(String workflowName, Map<String, Object> initialState);

    /**
     * @param tag industry or tag to filter on, case-insensitive; {@code null} lists everything
     */
    List<CoAgentWorkflowSummary> list(String tag);

    CoAgentWorkflowSummary describe(String workflowName);

    /**
     * @return {@code total}, {@code by_industry} and {@code available_industries}
     */
    Map<String, Object> stats();

    /**
     * @throws com.coagent.workflow.core.exception.registry.CoAgentInvalidWorkflowDefinitionException when the
     *         name is taken or the graph is inconsistent
     */
    void register(CoAgentWorkflowDefinition definition);

    boolean contains(String workflowName);

    /**
     * Drops discovered definitions and runs provider discovery again. Programmatic
     * registrations are kept.
     */
    void reload();
}
