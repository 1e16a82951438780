package com.coagent.workflow.core.engine;

import com.coagent.workflow.core.engine.checkpoint.CoAgentCheckpointStoreManager;
import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.core.engine.config.CoAgentEngineSettings;
import com.coagent.workflow.core.engine.execution.ICoAgentExecutionEngine;
import com.coagent.workflow.core.engine.lock.ICoAgentThreadLockService;
import com.coagent.workflow.core.engine.misc.CoAgentObjectMapper;
import com.coagent.workflow.core.engine.registry.ICoAgentWorkflowRegistry;
import com.coagent.workflow.core.engine.stream.ICoAgentProgressStream;
import com.coagent.workflow.integration.contract.ICoAgentDocumentClient;
import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import reactor.core.publisher.Mono;

public interface ICoAgentFacade {
    CoAgentEngineSettings getSettings();
    CoAgentObjectMapper getObjectMapper();
    ICoAgentWorkflowRegistry getWorkflowRegistry();
    ICoAgentThreadLockService getThreadLockService();
    ICoAgentProgressStream getProgressStream();
    ICoAgentNotificationSink getNotificationSink();
    ICoAgentDocumentClient getDocumentClient();
    ICoAgentExecutionEngine getExecutionEngine();

    /**
     * Returns the checkpoint store manager, which owns the lifecycle of the configured store.
     */
    CoAgentCheckpointStoreManager getCheckpointStoreManager();

    /**
     * Returns the active checkpoint store, initializing it on first use.
     */
    ICoAgentCheckpointStore getCheckpointStore();

    /**
     * Removes the checkpoints not written within the configured checkpoint retention, finished
     * or not, together with the event channels of finished threads whose replay window elapsed.
     * Meant to be called by a periodic job.
     *
     * @return number of removed checkpoints
     */
    Mono<Long> purgeExpiredCheckpoints();

    /**
     * Stops the approval timeout scheduler and closes the checkpoint store.
     */
    void shutdown();
}
