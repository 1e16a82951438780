package com.coagent.workflow.core.engine.checkpoint.impl;

import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;

class InMemoryCheckpointStoreTest extends AbstractCheckpointStoreTest {

    @Override
    protected ICoAgentCheckpointStore createStore() {
        return new InMemoryCheckpointStore();
    }
}
