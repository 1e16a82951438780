package com.coagent.workflow.core.engine.checkpoint;

import com.coagent.workflow.core.engine.config.CoAgentEngineSettings;

/**
 * Contributes the {@code DATABASE} checkpoint store. Discovered with {@link java.util.ServiceLoader}.
 */
public interface ICoAgentCheckpointStoreProvider {

    String getName();

    ICoAgentCheckpointStore createStore(CoAgentEngineSettings settings);
}
