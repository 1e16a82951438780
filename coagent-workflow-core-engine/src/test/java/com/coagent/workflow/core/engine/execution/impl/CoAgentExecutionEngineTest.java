package com.coagent.workflow.core.engine.execution.impl;

import com.coagent.workflow.core.engine.CoAgentTestWorkflows;
import com.coagent.workflow.core.engine.checkpoint.impl.InMemoryCheckpointStore;
import com.coagent.workflow.core.engine.registry.impl.CoAgentWorkflowRegistry;
import com.coagent.workflow.core.engine.stream.impl.CoAgentProgressStreamAdapter;
import com.coagent.workflow.core.exception.CoAgentInvalidRequestException;
import com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointConflictException;
import com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointPersistenceException;
import com.coagent.workflow.core.exception.execution.CoAgentInvalidResumeException;
import com.coagent.workflow.core.exception.execution.CoAgentRecursionLimitException;
import com.coagent.workflow.core.exception.execution.CoAgentThreadNotFoundException;
import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import com.coagent.workflow.integration.enumerations.CoAgentApprovalDecisionType;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import com.coagent.workflow.integration.enumerations.CoAgentRiskLevel;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalDecision;
import com.coagent.workflow.integration.models.events.CoAgentProgressEvent;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionConfig;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionResult;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.workflow.CoAgentStateSchema;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class CoAgentExecutionEngineTest {

    private CoAgentTestWorkflows workflows;
    private RecordingCheckpointStore store;
    private CoAgentProgressStreamAdapter progressStream;
    private RecordingNotificationSink notifications;
    private CoAgentExecutionEngine engine;

    @BeforeEach
    void setUp() {
        workflows = new CoAgentTestWorkflows();
        store = new RecordingCheckpointStore();
        progressStream = new CoAgentProgressStreamAdapter(256);
        notifications = new RecordingNotificationSink();
        engine = newEngine(workflows.orderApproval());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private CoAgentExecutionEngine newEngine(CoAgentWorkflowDefinition... definitions) {
        if (engine != null) {
            engine.shutdown();
        }
        CoAgentWorkflowRegistry registry = CoAgentWorkflowRegistry.empty();
        for (CoAgentWorkflowDefinition definition : definitions) {
            registry.register(definition);
        }
        return CoAgentExecutionEngine.builder()
                .registry(registry)
                .checkpointStore(store)
                .progressStream(progressStream)
                .notificationSink(notifications)
                .build();
    }

    private CoAgentExecutionResult start(String threadId) {
        return engine.execute(CoAgentTestWorkflows.ORDER_APPROVAL, Map.of("order_id", "SO-1001"), config(threadId)).block();
    }

    private CoAgentExecutionResult approve(String threadId) {
        return engine.resume(CoAgentApprovalDecision.approve(threadId)).block();
    }

    private static CoAgentExecutionConfig config(String threadId) {
        return CoAgentExecutionConfig.builder().threadId(threadId).build();
    }

    private List<CoAgentProgressEventType> eventTypes(String threadId) {
        return progressStream.history(threadId).stream().map(CoAgentProgressEvent::getType).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Approval path")
    class ApprovalPath {

        @Test
        @DisplayName("suspends before every gated side effect and completes after two approvals")
        void approveBothGates() {
            CoAgentExecutionResult first = start("order-1");

            assertThat(first.getStatus()).isEqualTo(CoAgentExecutionStatus.PAUSED);
            assertThat(first.isInterrupted()).isTrue();
            assertThat(first.getInterruptData().getNodeName()).isEqualTo("reserve_gate");
            assertThat(first.getInterruptData().getOperation()).isEqualTo("reserve_stock");
            assertThat(first.getInterruptData().getRiskLevel()).isEqualTo(CoAgentRiskLevel.MEDIUM);
            assertThat(first.getFinalState()).containsEntry("pending_approval", true);
            assertThat(workflows.runsOf("reserve_stock")).isZero();

            CoAgentExecutionResult second = approve("order-1");

            assertThat(second.getStatus()).isEqualTo(CoAgentExecutionStatus.PAUSED);
            assertThat(second.getInterruptData().getNodeName()).isEqualTo("charge_gate");
            assertThat(second.getInterruptData().getPreview()).isEqualTo("Charge 100.0 for order SO-1001");
            assertThat(workflows.runsOf("reserve_stock")).isEqualTo(1);
            assertThat(workflows.runsOf("pack_order")).isEqualTo(1);
            assertThat(workflows.runsOf("charge_card")).isZero();

            CoAgentExecutionResult last = approve("order-1");

            assertThat(last.getStatus()).isEqualTo(CoAgentExecutionStatus.COMPLETED);
            assertThat(last.isInterrupted()).isFalse();
            assertThat(last.getError()).isNull();
            assertThat(last.getStepsCompleted())
                    .containsExactly("reserve_gate", "reserve_stock", "pack_order", "charge_gate", "charge_card");
            assertThat(last.getFinalState())
                    .containsEntry("reserved", true)
                    .containsEntry("packed", true)
                    .containsEntry("charged", true)
                    .containsEntry("pending_approval", false)
                    .containsEntry("approval_decision", "approve");
            assertThat(last.getMetadata()).containsEntry("industry", "retail").containsEntry("actual_steps", 5);
        }

        @Test
        @DisplayName("a rejection at the first gate ends the thread before any side effect")
        void rejectFirstGate() {
            start("order-2");

            CoAgentExecutionResult result = engine.resume(
                    CoAgentApprovalDecision.reject("order-2", "customer cancelled")).block();

            assertThat(result.getStatus()).isEqualTo(CoAgentExecutionStatus.REJECTED);
            assertThat(result.getError()).isEqualTo("reserve_stock rejected: customer cancelled");
            assertThat(result.getStepsCompleted()).containsExactly("reserve_gate");
            assertThat(result.getFinalState()).doesNotContainKey("reserved")
                    .containsEntry("approval_decision", "reject")
                    .containsEntry("approval_comment", "customer cancelled");
            assertThat(workflows.runsOf("reserve_stock")).isZero();
        }

        @Test
        @DisplayName("a rejection at the second gate keeps the work done before it")
        void rejectSecondGate() {
            start("order-3");
            approve("order-3");

            CoAgentExecutionResult result = engine.resume(CoAgentApprovalDecision.builder()
                    .threadId("order-3")
                    .decision(CoAgentApprovalDecisionType.REJECT)
                    .build()).block();

            assertThat(result.getStatus()).isEqualTo(CoAgentExecutionStatus.REJECTED);
            assertThat(result.getError()).isEqualTo("charge_card rejected: no reason given");
            assertThat(result.getFinalState()).containsEntry("reserved", true).containsEntry("packed", true)
                    .doesNotContainKey("charged");
            assertThat(workflows.runsOf("charge_card")).isZero();
        }

        @Test
        @DisplayName("fills declared defaults into the initial state")
        void defaultsApplied() {
            CoAgentExecutionResult result = start("order-4");

            assertThat(result.getFinalState())
                    .containsEntry("order_id", "SO-1001")
                    .containsEntry("amount", 100)
                    .containsEntry("errors", List.of());
        }

        @Test
        @DisplayName("generates a thread id when none is given")
        void generatedThreadId() {
            CoAgentExecutionResult result = engine.execute(CoAgentTestWorkflows.ORDER_APPROVAL,
                    Map.of("order_id", "SO-1"), CoAgentExecutionConfig.defaults()).block();

            assertThat(result.getThreadId()).startsWith("thread-");
        }
    }

    @Nested
    @DisplayName("Resume")
    class Resume {

        @Test
        @DisplayName("resuming a finished thread returns its result without running anything again")
        void resumeFinishedThread() {
            start("order-10");
            approve("order-10");
            CoAgentExecutionResult finished = approve("order-10");
            int writes = store.getWrites().size();

            CoAgentExecutionResult again = approve("order-10");

            assertThat(again.getStatus()).isEqualTo(CoAgentExecutionStatus.COMPLETED);
            assertThat(again.getStepsCompleted()).isEqualTo(finished.getStepsCompleted());
            assertThat(again.getFinalState()).isEqualTo(finished.getFinalState());
            assertThat(workflows.runsOf("charge_card")).isEqualTo(1);
            assertThat(store.getWrites()).hasSize(writes);
        }

        @Test
        @DisplayName("a decision taken against an older checkpoint is refused")
        void staleDecision() {
            CoAgentExecutionResult paused = start("order-11");
            long version = store.get("order-11").block().getVersion();
            assertThat(paused.getStatus()).isEqualTo(CoAgentExecutionStatus.PAUSED);

            CoAgentApprovalDecision decision = CoAgentApprovalDecision.builder()
                    .threadId("order-11")
                    .decision(CoAgentApprovalDecisionType.APPROVE)
                    .expectedVersion(version)
                    .build();
            engine.resume(decision).block();

            StepVerifier.create(engine.resume(decision))
                    .expectError(CoAgentCheckpointConflictException.class)
                    .verify();
            assertThat(workflows.runsOf("reserve_stock")).isEqualTo(1);
            assertThat(workflows.runsOf("pack_order")).isEqualTo(1);
        }

        @Test
        @DisplayName("an unknown thread cannot be resumed")
        void unknownThread() {
            StepVerifier.create(engine.resume(CoAgentApprovalDecision.approve("nobody")))
                    .expectError(CoAgentThreadNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("a decision without a verdict is refused")
        void missingDecision() {
            start("order-12");

            StepVerifier.create(engine.resume(CoAgentApprovalDecision.builder().threadId("order-12").build()))
                    .expectError(CoAgentInvalidResumeException.class)
                    .verify();
            assertThat(store.get("order-12").block().getStatus()).isEqualTo(CoAgentExecutionStatus.PAUSED);
        }

        @Test
        @DisplayName("a malformed thread id is refused before touching the store")
        void malformedThreadId() {
            StepVerifier.create(engine.resume(CoAgentApprovalDecision.approve("../etc/passwd")))
                    .expectError(CoAgentInvalidResumeException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Checkpoints")
    class Checkpoints {

        @Test
        @DisplayName("a suspended thread is fully described by its checkpoint")
        void suspendedCheckpoint() {
            start("order-20");

            CoAgentCheckpoint checkpoint = store.get("order-20").block();

            assertThat(checkpoint.getStatus()).isEqualTo(CoAgentExecutionStatus.PAUSED);
            assertThat(checkpoint.isAwaitingApproval()).isTrue();
            assertThat(checkpoint.getVersion()).isEqualTo(1L);
            assertThat(checkpoint.getWorkflowName()).isEqualTo(CoAgentTestWorkflows.ORDER_APPROVAL);
            assertThat(checkpoint.getNodeName()).isEqualTo("reserve_gate");
            assertThat(checkpoint.getPendingApproval().getAllowedDecisions()).containsExactly("approve", "reject");
            assertThat(checkpoint.getPendingApproval().getApprovedNode()).isEqualTo("reserve_stock");
            assertThat(checkpoint.getState()).containsEntry("order_id", "SO-1001").containsEntry("pending_approval", true);
            assertThat(checkpoint.getLastEventSequence()).isEqualTo(progressStream.lastSequence("order-20"));
        }

        @Test
        @DisplayName("versions grow by one with every write")
        void versionsAreConsecutive() {
            start("order-21");
            approve("order-21");
            approve("order-21");

            List<Long> versions = store.getWrites().stream()
                    .filter(checkpoint -> checkpoint.getThreadId().equals("order-21"))
                    .map(CoAgentCheckpoint::getVersion)
                    .collect(Collectors.toList());

            assertThat(versions).isNotEmpty();
            for (int i = 0; i < versions.size(); i++) {
                assertThat(versions.get(i)).isEqualTo(i + 1L);
            }
            assertThat(store.get("order-21").block().getResult().getStatus()).isEqualTo(CoAgentExecutionStatus.COMPLETED);
        }

        @Test
        @DisplayName("every node exit event refers to a checkpoint that was already written")
        void exitEventsFollowCheckpoints() {
            start("order-22");
            approve("order-22");
            approve("order-22");

            List<Long> written = store.getWrites().stream().map(CoAgentCheckpoint::getVersion).collect(Collectors.toList());
            progressStream.history("order-22").stream()
                    .filter(event -> event.getType() == CoAgentProgressEventType.NODE_EXIT)
                    .forEach(event -> assertThat(written).contains(((Number) event.getPayload().get("checkpoint_version")).longValue()));
        }

        @Test
        @DisplayName("a thread id can only be started once")
        void duplicateThreadId() {
            start("order-23");

            StepVerifier.create(engine.execute(CoAgentTestWorkflows.ORDER_APPROVAL, Map.of("order_id", "SO-2"), config("order-23")))
                    .expectError(CoAgentCheckpointConflictException.class)
                    .verify();
            assertThat(store.get("order-23").block().getState()).containsEntry("order_id", "SO-1001");
        }

        @Test
        @DisplayName("getResult answers a snapshot while suspended and the cached result once finished")
        void getResult() {
            start("order-24");

            CoAgentExecutionResult suspended = engine.getResult("order-24").block();
            assertThat(suspended.getStatus()).isEqualTo(CoAgentExecutionStatus.PAUSED);
            assertThat(suspended.getInterruptData().getNodeName()).isEqualTo("reserve_gate");

            engine.resume(CoAgentApprovalDecision.reject("order-24", "no")).block();

            CoAgentExecutionResult finished = engine.getResult("order-24").block();
            assertThat(finished.getStatus()).isEqualTo(CoAgentExecutionStatus.REJECTED);
            assertThat(finished.getError()).isEqualTo("reserve_stock rejected: no");
        }

        @Test
        @DisplayName("a store failure ends the call and keeps the last checkpoint")
        void storeFailure() {
            start("order-25");
            store.failWritesFrom(2);

            StepVerifier.create(engine.resume(CoAgentApprovalDecision.approve("order-25")))
                    .expectError(CoAgentCheckpointPersistenceException.class)
                    .verify();

            CoAgentCheckpoint checkpoint = store.get("order-25").block();
            assertThat(checkpoint.getVersion()).isEqualTo(1L);
            assertThat(checkpoint.isAwaitingApproval()).isTrue();
            assertThat(workflows.runsOf("reserve_stock")).isZero();

            store.failWritesFrom(Long.MAX_VALUE);
            assertThat(approve("order-25").getInterruptData().getNodeName()).isEqualTo("charge_gate");
        }

        @Test
        @DisplayName("an outage after the decision was stored is continued by recover")
        void outageAfterDecision() {
            // Given a thread whose approval was stored before the store went down
            start("order-26");
            store.failWritesFrom(3);

            StepVerifier.create(engine.resume(CoAgentApprovalDecision.approve("order-26")))
                    .expectError(CoAgentCheckpointPersistenceException.class)
                    .verify();

            CoAgentCheckpoint running = store.get("order-26").block();
            assertThat(running.getVersion()).isEqualTo(2L);
            assertThat(running.getStatus()).isEqualTo(CoAgentExecutionStatus.RUNNING);
            assertThat(running.getNextNode()).isEqualTo("reserve_stock");
            assertThat(running.isAwaitingApproval()).isFalse();

            // When the decision is sent again, it is refused and points to recover
            StepVerifier.create(engine.resume(CoAgentApprovalDecision.approve("order-26")))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(CoAgentInvalidResumeException.class)
                            .hasMessageContaining("recover")
                            .hasMessageContaining("reserve_stock"))
                    .verify();

            // Then recover continues from the stored node once the store is back
            store.failWritesFrom(Long.MAX_VALUE);
            CoAgentExecutionResult recovered = engine.recover("order-26").block();

            assertThat(recovered.getStatus()).isEqualTo(CoAgentExecutionStatus.PAUSED);
            assertThat(recovered.getInterruptData().getNodeName()).isEqualTo("charge_gate");
            assertThat(workflows.runsOf("reserve_stock")).isEqualTo(2);
            assertThat(workflows.runsOf("pack_order")).isEqualTo(1);
            assertThat(approve("order-26").getStatus()).isEqualTo(CoAgentExecutionStatus.COMPLETED);
        }

        @Test
        @DisplayName("recover leaves a suspended thread waiting for its decision")
        void recoverSuspended() {
            start("order-27");
            int writes = store.getWrites().size();

            CoAgentExecutionResult result = engine.recover("order-27").block();

            assertThat(result.getStatus()).isEqualTo(CoAgentExecutionStatus.PAUSED);
            assertThat(result.getInterruptData().getNodeName()).isEqualTo("reserve_gate");
            assertThat(store.getWrites()).hasSize(writes);
            assertThat(workflows.runsOf("reserve_stock")).isZero();
        }

        @Test
        @DisplayName("an unknown thread cannot be recovered")
        void recoverUnknown() {
            StepVerifier.create(engine.recover("nobody"))
                    .expectError(CoAgentThreadNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Progress events")
    class ProgressEvents {

        @Test
        @DisplayName("sequences start at one and grow without gaps")
        void sequences() {
            start("order-30");
            approve("order-30");
            approve("order-30");

            List<Long> sequences = progressStream.history("order-30").stream()
                    .map(CoAgentProgressEvent::getSequence)
                    .collect(Collectors.toList());
            for (int i = 0; i < sequences.size(); i++) {
                assertThat(sequences.get(i)).isEqualTo(i + 1L);
            }
        }

        @Test
        @DisplayName("a suspension ends with node exit then interrupt, completion with complete")
        void eventOrder() {
            start("order-31");
            assertThat(eventTypes("order-31")).containsExactly(
                    CoAgentProgressEventType.START,
                    CoAgentProgressEventType.NODE_ENTER,
                    CoAgentProgressEventType.NODE_EXIT,
                    CoAgentProgressEventType.INTERRUPT);

            approve("order-31");
            approve("order-31");

            List<CoAgentProgressEventType> types = eventTypes("order-31");
            assertThat(types.get(4)).isEqualTo(CoAgentProgressEventType.RESUMED);
            assertThat(types.get(types.size() - 1)).isEqualTo(CoAgentProgressEventType.COMPLETE);
            assertThat(types.stream().filter(CoAgentProgressEventType::isTerminal)).hasSize(1);
        }

        @Test
        @DisplayName("a finished thread releases its events once their retention elapsed")
        void releasedAfterFinish() {
            progressStream = new CoAgentProgressStreamAdapter(256, Duration.ZERO);
            engine = newEngine(workflows.orderApproval());
            start("order-39");
            assertThat(progressStream.history("order-39")).isNotEmpty();

            engine.resume(CoAgentApprovalDecision.reject("order-39", "out of stock")).block();

            assertThat(progressStream.history("order-39")).isEmpty();
            assertThat(engine.getResult("order-39").block().getStatus()).isEqualTo(CoAgentExecutionStatus.REJECTED);
        }

        @Test
        @DisplayName("a late subscriber replays from its last seen sequence then completes on the terminal event")
        void replay() {
            start("order-32");
            approve("order-32");
            approve("order-32");

            StepVerifier.create(progressStream.events("order-32", 4).map(CoAgentProgressEvent::getSequence))
                    .expectNext(5L)
                    .thenConsumeWhile(sequence -> sequence > 5L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("no events are published when the caller turned them off")
        void eventsSuppressed() {
            engine.execute(CoAgentTestWorkflows.ORDER_APPROVAL, Map.of("order_id", "SO-9"),
                    CoAgentExecutionConfig.builder().threadId("order-33").emitEvents(false).build()).block();
            approve("order-33");

            assertThat(progressStream.history("order-33")).isEmpty();
            assertThat(store.get("order-33").block().isEventsSuppressed()).isTrue();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a failing node without error node ends the thread with status error")
        void failureWithoutErrorNode() {
            engine = newEngine(workflows.failing(false));

            CoAgentExecutionResult result = engine.execute(CoAgentTestWorkflows.FAILING, Map.of(), config("fail-1")).block();

            assertThat(result.getStatus()).isEqualTo(CoAgentExecutionStatus.ERROR);
            assertThat(result.getError()).contains("printer on fire");
            assertThat(result.getStepsCompleted()).containsExactly("prepare");
            assertThat(CoAgentExecutionState.of(result.getFinalState()).getErrors())
                    .singleElement()
                    .satisfies(error -> assertThat(error).containsEntry("node", "explode"));
            assertThat(eventTypes("fail-1")).last().isEqualTo(CoAgentProgressEventType.ERROR);
        }

        @Test
        @DisplayName("a failing node is routed to the declared error node")
        void failureWithErrorNode() {
            engine = newEngine(workflows.failing(true));

            CoAgentExecutionResult result = engine.execute(CoAgentTestWorkflows.FAILING, Map.of(), config("fail-2")).block();

            assertThat(result.getStatus()).isEqualTo(CoAgentExecutionStatus.ERROR);
            assertThat(workflows.runsOf("recover")).isEqualTo(1);
            assertThat(result.getFinalState()).containsEntry("recovered", true);
            assertThat(result.getStepsCompleted()).containsExactly("prepare", "recover");
        }

        @Test
        @DisplayName("a thread visiting more nodes than its limit is stopped")
        void recursionLimit() {
            engine = newEngine(workflows.looping());

            StepVerifier.create(engine.execute(CoAgentTestWorkflows.LOOPING, Map.of(),
                            CoAgentExecutionConfig.builder().threadId("loop-1").recursionLimit(5).build()))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(CoAgentRecursionLimitException.class)
                            .hasMessageContaining("loop-1"))
                    .verify();
            assertThat(workflows.runsOf("spin")).isEqualTo(5);
            assertThat(store.get("loop-1").block().getState()).containsEntry("spins", 5);
            assertThat(eventTypes("loop-1")).last().isEqualTo(CoAgentProgressEventType.ERROR);
        }

        @Test
        @DisplayName("a thread stopped by its limit continues with a fresh budget on recover")
        void recoverAfterRecursionLimit() {
            engine = newEngine(workflows.looping());
            engine.execute(CoAgentTestWorkflows.LOOPING, Map.of(),
                            CoAgentExecutionConfig.builder().threadId("loop-2").recursionLimit(5).build())
                    .onErrorResume(CoAgentRecursionLimitException.class, error -> Mono.empty())
                    .block();
            assertThat(store.get("loop-2").block().getNextNode()).isEqualTo("spin");

            StepVerifier.create(engine.recover("loop-2"))
                    .expectError(CoAgentRecursionLimitException.class)
                    .verify();

            assertThat(workflows.runsOf("spin")).isEqualTo(10);
            assertThat(store.get("loop-2").block().getState()).containsEntry("spins", 10);
            assertThat(eventTypes("loop-2")).contains(CoAgentProgressEventType.RESUMED);
        }

        @Test
        @DisplayName("a recursion limit below one is refused")
        void invalidRecursionLimit() {
            StepVerifier.create(engine.execute(CoAgentTestWorkflows.ORDER_APPROVAL, Map.of("order_id", "SO-1"),
                            CoAgentExecutionConfig.builder().threadId("order-40").recursionLimit(0).build()))
                    .expectError(CoAgentInvalidRequestException.class)
                    .verify();
            assertThat(store.get("order-40").block()).isNull();
        }

        @Test
        @DisplayName("a malformed thread id is refused")
        void malformedThreadId() {
            StepVerifier.create(engine.execute(CoAgentTestWorkflows.ORDER_APPROVAL, Map.of("order_id", "SO-1"),
                            config("has spaces")))
                    .expectError(CoAgentInvalidRequestException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("a suspended thread is cancelled at once and stays cancelled")
        void cancelSuspended() {
            start("order-50");

            CoAgentExecutionResult cancelled = engine.cancel("order-50").block();

            assertThat(cancelled.getStatus()).isEqualTo(CoAgentExecutionStatus.CANCELLED);
            assertThat(cancelled.getFinalState()).containsEntry("pending_approval", false);
            assertThat(store.get("order-50").block().isCancelled()).isTrue();
            assertThat(eventTypes("order-50")).last().isEqualTo(CoAgentProgressEventType.CANCELLED);

            CoAgentExecutionResult resumed = approve("order-50");
            assertThat(resumed.getStatus()).isEqualTo(CoAgentExecutionStatus.CANCELLED);
            assertThat(workflows.runsOf("reserve_stock")).isZero();
        }

        @Test
        @DisplayName("a running thread stops before its next node")
        void cancelRunning() {
            AtomicReference<CoAgentExecutionResult> cancelAnswer = new AtomicReference<>();
            AtomicReference<Throwable> cancelError = new AtomicReference<>();
            CoAgentWorkflowDefinition slow = CoAgentWorkflowDefinition.builder()
                    .name("slow_flow")
                    .description("Cancels itself while its first node runs")
                    .schema(CoAgentStateSchema.empty())
                    .entryNode("slow")
                    .node("slow", (state, context) -> {
                        engine.cancel(context.getThreadId()).subscribe(cancelAnswer::set, cancelError::set);
                        return Mono.delay(Duration.ofMillis(100)).thenReturn(CoAgentNodeOutcome.next("after"));
                    })
                    .node("after", workflows.counting("after", "completed", "after_ran", true))
                    .terminalNode("completed", CoAgentExecutionStatus.COMPLETED)
                    .build();
            engine = newEngine(slow);

            CoAgentExecutionResult result = engine.execute("slow_flow", Map.of(), config("slow-1")).block();

            assertThat(result.getStatus()).isEqualTo(CoAgentExecutionStatus.CANCELLED);
            assertThat(workflows.runsOf("after")).isZero();
            assertThat(result.getStepsCompleted()).containsExactly("slow");

            CoAgentExecutionResult answer = Flux.interval(Duration.ofMillis(20))
                    .filter(tick -> cancelAnswer.get() != null)
                    .map(tick -> cancelAnswer.get())
                    .blockFirst(Duration.ofSeconds(5));
            assertThat(cancelError.get()).isNull();
            assertThat(answer.getStatus()).isEqualTo(CoAgentExecutionStatus.CANCELLED);
        }

        @Test
        @DisplayName("cancelling an unknown thread fails")
        void cancelUnknown() {
            StepVerifier.create(engine.cancel("nobody"))
                    .expectError(CoAgentThreadNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Approval timeout")
    class ApprovalTimeout {

        @Test
        @DisplayName("a timeout escalates once and leaves the request pending")
        void escalatesOnce() {
            engine = newEngine(workflows.orderApproval(Duration.ofHours(1)));
            start("order-60");
            approve("order-60");
            long version = store.get("order-60").block().getVersion();

            assertThat(engine.handleApprovalTimeout("order-60", version).block()).isTrue();

            CoAgentCheckpoint escalated = store.get("order-60").block();
            assertThat(escalated.isAwaitingApproval()).isTrue();
            assertThat(escalated.getPendingApproval().getEscalatedAt()).isNotNull();
            assertThat(escalated.getState()).containsKey("escalations");
            assertThat(notifications.getRecipients()).containsExactly("Finance Manager");
            assertThat(eventTypes("order-60")).contains(CoAgentProgressEventType.ESCALATE);

            assertThat(engine.handleApprovalTimeout("order-60", version).block()).isFalse();
            assertThat(engine.handleApprovalTimeout("order-60", escalated.getVersion()).block()).isFalse();
            assertThat(notifications.getRecipients()).hasSize(1);

            CoAgentExecutionResult result = approve("order-60");
            assertThat(result.getStatus()).isEqualTo(CoAgentExecutionStatus.COMPLETED);
            assertThat(workflows.runsOf("charge_card")).isEqualTo(1);
        }

        @Test
        @DisplayName("the scheduler fires the escalation without any caller")
        void scheduledEscalation() {
            engine = newEngine(workflows.orderApproval(Duration.ofMillis(100)));
            start("order-61");
            approve("order-61");

            CoAgentCheckpoint escalated = Flux.interval(Duration.ofMillis(25))
                    .flatMap(tick -> store.get("order-61"))
                    .filter(checkpoint -> checkpoint.getPendingApproval() != null
                            && checkpoint.getPendingApproval().getEscalatedAt() != null)
                    .blockFirst(Duration.ofSeconds(5));

            assertThat(escalated.getStatus()).isEqualTo(CoAgentExecutionStatus.PAUSED);
            assertThat(engine.getTimeoutScheduler().getDeadline("order-61")).isEmpty();
            assertThat(notifications.getRecipients()).containsExactly("Finance Manager");
        }

        @Test
        @DisplayName("suspended threads get their deadlines back after a restart")
        void rescheduleAfterRestart() {
            engine = newEngine(workflows.orderApproval(Duration.ofHours(1)));
            start("order-62");
            approve("order-62");

            engine = newEngine(workflows.orderApproval(Duration.ofHours(1)));

            assertThat(engine.rescheduleApprovalTimeouts().block()).isEqualTo(1L);
            assertThat(engine.getTimeoutScheduler().getDeadline("order-62")).isPresent();
        }
    }

    /**
     * In-memory store remembering every accepted write, able to fail writes from a version on.
     */
    static class RecordingCheckpointStore extends InMemoryCheckpointStore {
        private final List<CoAgentCheckpoint> writes = Collections.synchronizedList(new ArrayList<>());
        private volatile long failFromVersion = Long.MAX_VALUE;

        @Override
        public Mono<CoAgentCheckpoint> put(CoAgentCheckpoint checkpoint) {
            if (checkpoint.getVersion() >= failFromVersion) {
                return Mono.error(new CoAgentCheckpointPersistenceException("writing", checkpoint.getThreadId(),
                        new IllegalStateException("disk full")));
            }
            return super.put(checkpoint).doOnNext(writes::add);
        }

        void failWritesFrom(long version) {
            this.failFromVersion = version;
        }

        List<CoAgentCheckpoint> getWrites() {
            synchronized (writes) {
                return List.copyOf(writes);
            }
        }
    }

    static class RecordingNotificationSink implements ICoAgentNotificationSink {
        private final List<String> recipients = Collections.synchronizedList(new ArrayList<>());

        @Override
        public Mono<String> notify(String recipient, Map<String, Object> payload) {
            return Mono.fromSupplier(() -> {
                recipients.add(recipient);
                return "NOTIFY-" + recipients.size();
            });
        }

        List<String> getRecipients() {
            synchronized (recipients) {
                return List.copyOf(recipients);
            }
        }
    }
}
