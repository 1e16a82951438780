package com.coagent.workflow.integration.models.workflow;

import java.util.List;

/**
 * Service-provider interface through which workflow plugins contribute definitions.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}; list the implementing
 * class in {@code META-INF/services/com.coagent.workflow.integration.models.workflow.ICoAgentWorkflowProvider}.</p>
 */
public interface ICoAgentWorkflowProvider {

    String getProviderName();

    List<CoAgentWorkflowDefinition> getWorkflowDefinitions();
}
