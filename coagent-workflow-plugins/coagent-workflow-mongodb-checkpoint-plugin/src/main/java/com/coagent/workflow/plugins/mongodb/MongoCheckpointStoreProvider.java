package com.coagent.workflow.plugins.mongodb;

import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStoreProvider;
import com.coagent.workflow.core.engine.config.CoAgentEngineSettings;

/**
 * Contributes {@link MongoCheckpointStore} as the {@code DATABASE} checkpoint store, connected to
 * {@code coagent.workflow.mongodb.uri} and {@code coagent.workflow.mongodb.database}.
 */
public class MongoCheckpointStoreProvider implements ICoAgentCheckpointStoreProvider {

    public static final String NAME = "mongodb";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ICoAgentCheckpointStore createStore(CoAgentEngineSettings settings) {
        return MongoCheckpointStore.create(settings.getMongoUri(), settings.getMongoDatabase());
    }
}
