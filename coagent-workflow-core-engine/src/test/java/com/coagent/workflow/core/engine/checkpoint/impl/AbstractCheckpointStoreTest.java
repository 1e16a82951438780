package com.coagent.workflow.core.engine.checkpoint.impl;

import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointConflictException;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalRequest;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour every checkpoint store shares. Subclasses provide the store under test.
 */
public abstract class AbstractCheckpointStoreTest {

    protected ICoAgentCheckpointStore store;

    protected abstract ICoAgentCheckpointStore createStore() throws Exception;

    @BeforeEach
    void createAndInitialize() throws Exception {
        store = createStore();
        store.initialize().block();
    }

    protected static CoAgentCheckpoint checkpoint(String threadId, long version, CoAgentExecutionStatus status) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("guest_name", "Ada Lovelace");
        state.put("steps_completed", new ArrayList<>(List.of("check_in_guest")));
        return CoAgentCheckpoint.builder()
                .threadId(threadId)
                .workflowName("hotel_o2c")
                .nodeName("check_in_guest")
                .state(state)
                .version(version)
                .status(status)
                .recursionLimit(25)
                .createdAt(Instant.now())
                .build();
    }

    @Test
    @DisplayName("unknown threads read as empty")
    void unknownThread() {
        StepVerifier.create(store.get("nobody")).verifyComplete();
    }

    @Test
    @DisplayName("a new thread starts at version one and moves by one")
    void versionSequence() {
        store.put(checkpoint("t-1", 1, CoAgentExecutionStatus.RUNNING)).block();
        store.put(checkpoint("t-1", 2, CoAgentExecutionStatus.PAUSED)).block();

        CoAgentCheckpoint stored = store.get("t-1").block();

        assertThat(stored.getVersion()).isEqualTo(2L);
        assertThat(stored.getStatus()).isEqualTo(CoAgentExecutionStatus.PAUSED);
        assertThat(stored.getTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("a write that is not the successor of the stored version conflicts")
    void versionConflict() {
        store.put(checkpoint("t-2", 1, CoAgentExecutionStatus.RUNNING)).block();

        StepVerifier.create(store.put(checkpoint("t-2", 1, CoAgentExecutionStatus.RUNNING)))
                .expectError(CoAgentCheckpointConflictException.class)
                .verify();
        StepVerifier.create(store.put(checkpoint("t-2", 3, CoAgentExecutionStatus.RUNNING)))
                .expectError(CoAgentCheckpointConflictException.class)
                .verify();
        StepVerifier.create(store.put(checkpoint("t-3", 2, CoAgentExecutionStatus.RUNNING)))
                .expectError(CoAgentCheckpointConflictException.class)
                .verify();
        assertThat(store.get("t-2").block().getVersion()).isEqualTo(1L);
    }

    @Test
    @DisplayName("of two concurrent writers of the same version exactly one wins")
    void concurrentWriters() {
        store.put(checkpoint("t-4", 1, CoAgentExecutionStatus.RUNNING)).block();

        List<Boolean> outcomes = Flux.range(0, 8)
                .flatMap(i -> store.put(checkpoint("t-4", 2, CoAgentExecutionStatus.RUNNING))
                        .map(stored -> true)
                        .onErrorResume(CoAgentCheckpointConflictException.class, e -> Mono.just(false))
                        .subscribeOn(Schedulers.parallel()))
                .collectList()
                .block(Duration.ofSeconds(10));

        assertThat(outcomes).hasSize(8).containsOnlyOnce(true);
    }

    @Test
    @DisplayName("callers never share state with the store")
    @SuppressWarnings("unchecked")
    void isolation() {
        CoAgentCheckpoint original = checkpoint("t-5", 1, CoAgentExecutionStatus.RUNNING);
        store.put(original).block();

        original.getState().put("guest_name", "changed after write");
        CoAgentCheckpoint read = store.get("t-5").block();
        ((List<String>) read.getState().get("steps_completed")).add("tampered");

        CoAgentCheckpoint again = store.get("t-5").block();
        assertThat(again.getState()).containsEntry("guest_name", "Ada Lovelace");
        assertThat((List<String>) again.getState().get("steps_completed")).containsExactly("check_in_guest");
    }

    @Test
    @DisplayName("keeps the pending approval of a suspended thread")
    void pendingApproval() {
        CoAgentCheckpoint paused = checkpoint("t-6", 1, CoAgentExecutionStatus.PAUSED).toBuilder()
                .pendingApproval(CoAgentApprovalRequest.builder()
                        .nodeName("check_in_guest")
                        .operation("check_in_guest")
                        .allowedDecisions(List.of("approve", "reject"))
                        .timeoutMs(60_000L)
                        .requestedAt(Instant.now())
                        .build())
                .build();
        store.put(paused).block();

        CoAgentCheckpoint read = store.get("t-6").block();

        assertThat(read.isAwaitingApproval()).isTrue();
        assertThat(read.getPendingApproval().getTimeoutMs()).isEqualTo(60_000L);
        assertThat(read.getPendingApproval().allows("approve")).isTrue();
    }

    @Test
    @DisplayName("finds checkpoints by status and counts them")
    void findByStatus() {
        store.put(checkpoint("t-7", 1, CoAgentExecutionStatus.PAUSED)).block();
        store.put(checkpoint("t-8", 1, CoAgentExecutionStatus.COMPLETED)).block();
        store.put(checkpoint("t-9", 1, CoAgentExecutionStatus.PAUSED)).block();

        assertThat(store.findByStatus(CoAgentExecutionStatus.PAUSED).map(CoAgentCheckpoint::getThreadId).collectList().block())
                .containsExactlyInAnyOrder("t-7", "t-9");
        assertThat(store.count().block()).isEqualTo(3L);
    }

    @Test
    @DisplayName("deletes a thread and purges old ones")
    void deleteAndPurge() throws InterruptedException {
        store.put(checkpoint("t-10", 1, CoAgentExecutionStatus.COMPLETED)).block();
        store.put(checkpoint("t-11", 1, CoAgentExecutionStatus.COMPLETED)).block();

        assertThat(store.delete("t-10").block()).isTrue();
        assertThat(store.delete("t-10").block()).isFalse();

        Thread.sleep(20);
        assertThat(store.purgeOlderThan(Duration.ofMillis(5)).block()).isEqualTo(1L);
        assertThat(store.count().block()).isZero();
    }
}
