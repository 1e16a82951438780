package com.coagent.workflow.core.engine.checkpoint.impl;

import com.coagent.workflow.core.engine.checkpoint.CoAgentCheckpointVersions;
import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.core.engine.misc.CoAgentObjectMapper;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoint store kept in memory. Used by tests and single-process setups that accept losing
 * suspended threads on restart.
 */
@Slf4j
public class InMemoryCheckpointStore implements ICoAgentCheckpointStore {

    private final Map<String, CoAgentCheckpoint> checkpoints = new ConcurrentHashMap<>();
    private final CoAgentObjectMapper objectMapper = CoAgentObjectMapper.getInstance();

    @Override
    public Mono<CoAgentCheckpoint> get(String threadId) {
        return Mono.fromCallable(() -> copy(checkpoints.get(threadId)));
    }

    @Override
    public Mono<CoAgentCheckpoint> put(CoAgentCheckpoint checkpoint) {
        return Mono.fromCallable(() -> {
            CoAgentCheckpoint toStore = copy(checkpoint.withTimestamp(Instant.now()));
            // compute() serialises writers of the same thread id
            checkpoints.compute(checkpoint.getThreadId(), (threadId, stored) -> {
                CoAgentCheckpointVersions.checkSuccessor(stored, toStore);
                return toStore;
            });
            log.debug("Stored checkpoint: threadId={}, version={}, node={}, status={}",
                    toStore.getThreadId(), toStore.getVersion(), toStore.getNodeName(), toStore.getStatus());
            return copy(toStore);
        });
    }

    @Override
    public Mono<Boolean> delete(String threadId) {
        return Mono.fromCallable(() -> checkpoints.remove(threadId) != null);
    }

    @Override
    public Flux<CoAgentCheckpoint> findAll() {
        return Flux.defer(() -> Flux.fromIterable(checkpoints.values()).map(this::copy));
    }

    @Override
    public Mono<Long> count() {
        return Mono.fromCallable(() -> (long) checkpoints.size());
    }

    public void clear() {
        checkpoints.clear();
    }

    private CoAgentCheckpoint copy(CoAgentCheckpoint checkpoint) {
        return objectMapper.deepCopy(checkpoint, CoAgentCheckpoint.class);
    }
}
