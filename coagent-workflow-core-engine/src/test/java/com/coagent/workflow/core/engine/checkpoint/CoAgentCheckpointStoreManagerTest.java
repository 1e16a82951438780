package com.coagent.workflow.core.engine.checkpoint;

import com.coagent.workflow.core.engine.checkpoint.impl.FileBasedCheckpointStore;
import com.coagent.workflow.core.engine.checkpoint.impl.InMemoryCheckpointStore;
import com.coagent.workflow.core.engine.config.CoAgentEngineSettings;
import com.coagent.workflow.core.engine.config.CoAgentEngineSettings.StoreType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CoAgentCheckpointStoreManagerTest {

    @TempDir
    Path storeDir;

    private CoAgentCheckpointStoreManager manager(StoreType type) {
        return new CoAgentCheckpointStoreManager(CoAgentEngineSettings.builder()
                .storeType(type)
                .storePath(storeDir)
                .build());
    }

    @Test
    @DisplayName("creates the store of the configured type on first use")
    void createsConfiguredStore() {
        CoAgentCheckpointStoreManager memory = manager(StoreType.MEMORY);
        assertThat(memory.healthCheck().block()).isFalse();

        assertThat(memory.getStore()).isInstanceOf(InMemoryCheckpointStore.class);
        assertThat(memory.getActiveStoreType()).isEqualTo(StoreType.MEMORY);
        assertThat(memory.healthCheck().block()).isTrue();
        assertThat(manager(StoreType.FILE).getStore()).isInstanceOf(FileBasedCheckpointStore.class);
    }

    @Test
    @DisplayName("falls back to the file store when no database provider is installed")
    void databaseFallsBackToFile() {
        assertThat(manager(StoreType.DATABASE).getStore()).isInstanceOf(FileBasedCheckpointStore.class);
    }

    @Test
    @DisplayName("shutdown releases the store")
    void shutdown() {
        CoAgentCheckpointStoreManager memory = manager(StoreType.MEMORY);
        memory.getStore();

        memory.shutdown().block();

        assertThat(memory.getActiveStoreType()).isNull();
        assertThat(memory.healthCheck().block()).isFalse();
    }
}
