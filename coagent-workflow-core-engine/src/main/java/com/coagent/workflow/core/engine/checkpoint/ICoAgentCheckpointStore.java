package com.coagent.workflow.core.engine.checkpoint;

import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Durable store of the current checkpoint of every thread.
 *
 * <p>Implementations must provide:</p>
 * <ul>
 *   <li>One current checkpoint per thread id; {@link #put} supersedes the previous one</li>
 *   <li>Optimistic concurrency: a checkpoint may only be written with version
 *       {@code stored.version + 1} (or {@code 1} for a new thread); any other version fails with
 *       {@link com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointConflictException}</li>
 *   <li>Isolation: stored and returned checkpoints are copies, callers never share state with the store</li>
 *   <li>Backend failures reported as
 *       {@link com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointPersistenceException}</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * store.get(threadId)
 *     .map(current -> current.toBuilder().version(current.getVersion() + 1).state(newState).build())
 *     .flatMap(store::put);
 * }</pre>
 */
public interface ICoAgentCheckpointStore {

    /**
     * @return the current checkpoint, empty when the thread is unknown
     */
    Mono<CoAgentCheckpoint> get(String threadId);

    /**
     * Writes a checkpoint after checking its version against the stored one.
     *
     * @return the checkpoint as stored
     */
    Mono<CoAgentCheckpoint> put(CoAgentCheckpoint checkpoint);

    /**
     * @return true if a checkpoint existed and was removed
     */
    Mono<Boolean> delete(String threadId);

    Flux<CoAgentCheckpoint> findAll();

    default Flux<CoAgentCheckpoint> findByStatus(CoAgentExecutionStatus status) {
        return findAll().filter(checkpoint -> checkpoint.getStatus() == status);
    }

    default Mono<Long> count() {
        return findAll().count();
    }

    /**
     * Removes checkpoints not written for longer than the retention. Never called by the
     * engine itself; {@code ICoAgentFacade.purgeExpiredCheckpoints} applies the configured retention.
     *
     * @return number of removed checkpoints
     */
    default Mono<Long> purgeOlderThan(Duration retention) {
        return findAll()
                .filter(checkpoint -> checkpoint.getTimestamp() != null
                        && checkpoint.getTimestamp().isBefore(java.time.Instant.now().minus(retention)))
                .flatMap(checkpoint -> delete(checkpoint.getThreadId()))
                .filter(Boolean::booleanValue)
                .count();
    }

    default Mono<Void> initialize() {
        return Mono.empty();
    }

    default Mono<Void> shutdown() {
        return Mono.empty();
    }

    default Mono<Boolean> healthCheck() {
        return Mono.just(true);
    }
}
