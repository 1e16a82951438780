package com.coagent.workflow.core.engine.rest;

import com.coagent.workflow.core.engine.CoAgentFacade;
import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.core.engine.config.CoAgentEngineSettings;
import com.coagent.workflow.core.engine.execution.ICoAgentExecutionEngine;
import com.coagent.workflow.core.engine.registry.ICoAgentWorkflowRegistry;
import com.coagent.workflow.core.engine.stream.ICoAgentProgressStream;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.EnableWebFlux;

/**
 * Spring configuration of the workflow REST API.
 *
 * <p>The engine services come from the {@link CoAgentFacade} singleton, so the API and any
 * embedding code share one engine.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(WorkflowApiConfiguration.class);
 * HttpHandler handler = WebHttpHandlerBuilder.applicationContext(context).build();
 * }</pre>
 */
@Configuration
@EnableWebFlux
public class WorkflowApiConfiguration {

    @Bean
    public CoAgentEngineSettings engineSettings() {
        return CoAgentFacade.getInstance().getSettings();
    }

    @Bean
    public ICoAgentExecutionEngine executionEngine() {
        return CoAgentFacade.getInstance().getExecutionEngine();
    }

    @Bean
    public ICoAgentWorkflowRegistry workflowRegistry() {
        return CoAgentFacade.getInstance().getWorkflowRegistry();
    }

    @Bean
    public ICoAgentProgressStream progressStream() {
        return CoAgentFacade.getInstance().getProgressStream();
    }

    @Bean
    public ICoAgentCheckpointStore checkpointStore() {
        return CoAgentFacade.getInstance().getCheckpointStore();
    }

    @Bean
    public WorkflowController workflowController(
            ICoAgentExecutionEngine executionEngine,
            ICoAgentWorkflowRegistry workflowRegistry,
            ICoAgentProgressStream progressStream,
            ICoAgentCheckpointStore checkpointStore,
            CoAgentEngineSettings engineSettings) {
        return new WorkflowController(executionEngine, workflowRegistry, progressStream, checkpointStore, engineSettings);
    }
}
