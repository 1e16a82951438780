package com.coagent.workflow.core.engine.checkpoint.impl;

import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FileBasedCheckpointStoreTest extends AbstractCheckpointStoreTest {

    @TempDir
    Path directory;

    @Override
    protected ICoAgentCheckpointStore createStore() {
        return new FileBasedCheckpointStore(directory.resolve("checkpoints"));
    }

    @Test
    @DisplayName("a new store on the same directory sees the suspended threads")
    void survivesRestart() {
        store.put(checkpoint("hotel-1", 1, CoAgentExecutionStatus.RUNNING)).block();
        store.put(checkpoint("hotel-1", 2, CoAgentExecutionStatus.PAUSED)).block();
        store.shutdown().block();

        FileBasedCheckpointStore restarted = new FileBasedCheckpointStore(directory.resolve("checkpoints"));
        restarted.initialize().block();
        CoAgentCheckpoint recovered = restarted.get("hotel-1").block();

        assertThat(recovered.getVersion()).isEqualTo(2L);
        assertThat(recovered.getState()).containsEntry("guest_name", "Ada Lovelace");
        assertThat(restarted.healthCheck().block()).isTrue();
    }

    @Test
    @DisplayName("leaves no temporary files behind")
    void noTemporaryFiles() throws IOException {
        store.put(checkpoint("hotel-2", 1, CoAgentExecutionStatus.RUNNING)).block();

        try (Stream<Path> files = Files.list(directory.resolve("checkpoints"))) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("hotel-2.json");
        }
    }

    @Test
    @DisplayName("skips unreadable files when loading")
    void skipsUnreadableFiles() throws IOException {
        store.put(checkpoint("hotel-3", 1, CoAgentExecutionStatus.PAUSED)).block();
        Files.writeString(directory.resolve("checkpoints").resolve("garbage.json"), "{not json");

        FileBasedCheckpointStore restarted = new FileBasedCheckpointStore(directory.resolve("checkpoints"));
        restarted.initialize().block();

        assertThat(restarted.count().block()).isEqualTo(1L);
        assertThat(restarted.get("hotel-3").block()).isNotNull();
    }
}
