package com.coagent.workflow.core.engine.execution.impl;

import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.core.engine.document.impl.InMemoryDocumentClient;
import com.coagent.workflow.core.engine.execution.ICoAgentExecutionEngine;
import com.coagent.workflow.core.engine.lock.ICoAgentThreadLockService;
import com.coagent.workflow.core.engine.lock.impl.InMemoryThreadLockService;
import com.coagent.workflow.core.engine.notification.impl.ConsoleNotificationSink;
import com.coagent.workflow.core.engine.primitive.CoAgentEscalateNode;
import com.coagent.workflow.core.engine.registry.CoAgentValidatedState;
import com.coagent.workflow.core.engine.registry.ICoAgentWorkflowRegistry;
import com.coagent.workflow.core.engine.stream.ICoAgentProgressStream;
import com.coagent.workflow.core.engine.stream.impl.CoAgentProgressStreamAdapter;
import com.coagent.workflow.core.engine.timeout.ICoAgentApprovalTimeoutScheduler;
import com.coagent.workflow.core.engine.timeout.impl.CoAgentApprovalTimeoutScheduler;
import com.coagent.workflow.core.exception.CoAgentInvalidRequestException;
import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointConflictException;
import com.coagent.workflow.core.exception.execution.CoAgentInvalidResumeException;
import com.coagent.workflow.core.exception.execution.CoAgentNodeExecutionException;
import com.coagent.workflow.core.exception.execution.CoAgentRecursionLimitException;
import com.coagent.workflow.core.exception.execution.CoAgentThreadNotFoundException;
import com.coagent.workflow.integration.constant.CoAgentConstants;
import com.coagent.workflow.integration.contract.ICoAgentDocumentClient;
import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationIssueType;
import com.coagent.workflow.integration.enumerations.CoAgentEscalationSeverity;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalDecision;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalRequest;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionConfig;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionResult;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNode;
import com.coagent.workflow.integration.models.node.ICoAgentNodeContext;
import com.coagent.workflow.integration.models.node.ICoAgentResumableNode;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Default {@link ICoAgentExecutionEngine}.
 *
 * <p>A call holds the thread lock for its whole duration and refreshes the lease before every
 * node. Each node's result is checkpointed before its exit event is published, so a client that
 * saw an event can always find the matching checkpoint.</p>
 *
 * <p>Node failures are business failures: they are appended to the state's errors and routed to
 * the workflow's error node, or end the thread with status error. Infrastructure failures
 * (checkpoint persistence, notification delivery) end the call with an error signal and leave the
 * last checkpoint in place: a suspended thread can be resumed again, a running one is continued by
 * {@link #recover(String)}.</p>
 */
@Slf4j
public class CoAgentExecutionEngine implements ICoAgentExecutionEngine {

    private static final Pattern THREAD_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    @Getter
    private final ICoAgentWorkflowRegistry registry;
    @Getter
    private final ICoAgentCheckpointStore checkpointStore;
    private final ICoAgentThreadLockService lockService;
    @Getter
    private final ICoAgentProgressStream progressStream;
    private final ICoAgentNotificationSink notificationSink;
    @Getter
    private final ICoAgentDocumentClient documentClient;
    @Getter
    private final ICoAgentApprovalTimeoutScheduler timeoutScheduler;
    private final Duration lockDuration;
    private final Map<String, Run> activeRuns = new ConcurrentHashMap<>();

    @Builder
    public CoAgentExecutionEngine(
            ICoAgentWorkflowRegistry registry,
            ICoAgentCheckpointStore checkpointStore,
            ICoAgentThreadLockService lockService,
            ICoAgentProgressStream progressStream,
            ICoAgentNotificationSink notificationSink,
            ICoAgentDocumentClient documentClient,
            ICoAgentApprovalTimeoutScheduler timeoutScheduler,
            Duration lockDuration) {

        this.registry = Objects.requireNonNull(registry, "registry");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.lockService = lockService != null ? lockService : new InMemoryThreadLockService();
        this.progressStream = progressStream != null
                ? progressStream
                : new CoAgentProgressStreamAdapter(CoAgentConstants.DEFAULT_STREAM_BUFFER_SIZE);
        this.notificationSink = notificationSink != null ? notificationSink : new ConsoleNotificationSink();
        this.documentClient = documentClient != null ? documentClient : new InMemoryDocumentClient();
        this.timeoutScheduler = timeoutScheduler != null ? timeoutScheduler : new CoAgentApprovalTimeoutScheduler();
        this.lockDuration = lockDuration != null ? lockDuration : Duration.ofSeconds(30);
        this.timeoutScheduler.start(this::onApprovalTimeout);
    }

    @Override
    public Mono<CoAgentExecutionResult> execute(
            String workflowName,
            Map<String, Object> initialState,
            CoAgentExecutionConfig config) {

        return Mono.fromCallable(() -> registry.validate(workflowName, initialState))
                .flatMap(validated -> execute(registry.load(validated.getWorkflowName()), validated, config));
    }

    @Override
    public Mono<CoAgentExecutionResult> execute(
            CoAgentWorkflowDefinition definition,
            CoAgentValidatedState initialState,
            CoAgentExecutionConfig config) {

        return Mono.defer(() -> {
            CoAgentExecutionConfig effective = config == null ? CoAgentExecutionConfig.defaults() : config;
            String threadId = effective.getThreadId() == null || effective.getThreadId().isBlank()
                    ? "thread-" + UUID.randomUUID()
                    : checkThreadId(effective.getThreadId());
            if (effective.getRecursionLimit() < 1) {
                throw new CoAgentInvalidRequestException(
                        "recursion_limit must be at least 1",
                        Map.of("recursion_limit", effective.getRecursionLimit()));
            }

            Run run = Run.start(definition, threadId, newOwner("execute"), effective);
            return lockService.tryAcquire(threadId, run.ownerId, lockDuration, run.operation)
                    .flatMap(acquired -> {
                        if (!acquired) {
                            return Mono.error(new CoAgentCheckpointConflictException(threadId, "the thread is already running"));
                        }
                        Mono<CoAgentExecutionResult> action = checkpointStore.get(threadId)
                                .flatMap(existing -> Mono.<CoAgentExecutionResult>error(
                                        new CoAgentCheckpointConflictException(threadId, "the thread id is already in use")))
                                .switchIfEmpty(Mono.defer(() -> start(run, initialState.getState().asMap())));
                        return releasing(threadId, run.ownerId, action);
                    });
        });
    }

    @Override
    public Mono<CoAgentExecutionResult> resume(CoAgentApprovalDecision decision) {
        return Mono.defer(() -> {
            checkDecision(decision);
            String threadId = decision.getThreadId();
            String ownerId = newOwner("resume");
            return lockService.tryAcquire(threadId, ownerId, lockDuration, "resume")
                    .flatMap(acquired -> {
                        if (!acquired) {
                            return Mono.error(new CoAgentInvalidResumeException(threadId, "the thread is already being resumed or is still running"));
                        }
                        Mono<CoAgentExecutionResult> action = checkpointStore.get(threadId)
                                .switchIfEmpty(Mono.error(() -> new CoAgentThreadNotFoundException(threadId)))
                                .flatMap(checkpoint -> resumeFrom(checkpoint, decision, ownerId));
                        return releasing(threadId, ownerId, action);
                    });
        });
    }

    @Override
    public Mono<CoAgentExecutionResult> cancel(String threadId) {
        return Mono.defer(() -> {
            checkThreadId(threadId);
            Run active = activeRuns.get(threadId);
            if (active != null) {
                active.cancelRequested = true;
                log.info("Cancellation requested for running thread [{}]", threadId);
            }
            String ownerId = newOwner("cancel");
            return lockService.acquireWithWait(threadId, ownerId, lockDuration, "cancel", lockDuration)
                    .flatMap(acquired -> {
                        if (!acquired) {
                            return Mono.error(new CoAgentCheckpointConflictException(threadId, "the thread stayed busy; it stops before its next node"));
                        }
                        Mono<CoAgentExecutionResult> action = checkpointStore.get(threadId)
                                .switchIfEmpty(Mono.error(() -> new CoAgentThreadNotFoundException(threadId)))
                                .flatMap(checkpoint -> cancelFrom(checkpoint, ownerId));
                        return releasing(threadId, ownerId, action);
                    });
        });
    }

    @Override
    public Mono<CoAgentExecutionResult> recover(String threadId) {
        return Mono.defer(() -> {
            checkThreadId(threadId);
            String ownerId = newOwner("recover");
            return lockService.tryAcquire(threadId, ownerId, lockDuration, "recover")
                    .flatMap(acquired -> {
                        if (!acquired) {
                            return Mono.error(new CoAgentCheckpointConflictException(threadId, "the thread is still running"));
                        }
                        Mono<CoAgentExecutionResult> action = checkpointStore.get(threadId)
                                .switchIfEmpty(Mono.error(() -> new CoAgentThreadNotFoundException(threadId)))
                                .flatMap(checkpoint -> recoverFrom(checkpoint, ownerId));
                        return releasing(threadId, ownerId, action);
                    });
        });
    }

    @Override
    public Mono<CoAgentExecutionResult> getResult(String threadId) {
        return checkpointStore.get(threadId)
                .switchIfEmpty(Mono.error(() -> new CoAgentThreadNotFoundException(threadId)))
                .map(checkpoint -> checkpoint.getResult() != null ? checkpoint.getResult() : snapshot(checkpoint));
    }

    @Override
    public Mono<Long> rescheduleApprovalTimeouts() {
        return checkpointStore.findByStatus(CoAgentExecutionStatus.PAUSED)
                .filter(checkpoint -> checkpoint.getPendingApproval() != null
                        && checkpoint.getPendingApproval().getTimeoutMs() != null
                        && checkpoint.getPendingApproval().getEscalatedAt() == null)
                .doOnNext(timeoutScheduler::schedule)
                .count()
                .doOnNext(count -> log.info("Re-armed {} approval timeouts", count));
    }

    /**
     * Runs the timeout node of a request that is still pending at the given checkpoint version.
     * The request stays pending: a timeout escalates, it never decides.
     *
     * @return true when an escalation was recorded
     */
    public Mono<Boolean> handleApprovalTimeout(String threadId, long checkpointVersion) {
        String ownerId = newOwner("timeout");
        return lockService.tryAcquire(threadId, ownerId, lockDuration, "timeout")
                .flatMap(acquired -> {
                    if (!acquired) {
                        log.info("Skipping approval timeout of thread [{}], the thread is busy", threadId);
                        return Mono.just(false);
                    }
                    Mono<Boolean> action = checkpointStore.get(threadId)
                            .filter(checkpoint -> checkpoint.isAwaitingApproval()
                                    && checkpoint.getVersion() == checkpointVersion
                                    && checkpoint.getPendingApproval().getEscalatedAt() == null)
                            .flatMap(checkpoint -> escalateTimeout(checkpoint, ownerId))
                            .defaultIfEmpty(false);
                    return releasing(threadId, ownerId, action);
                });
    }

    public void shutdown() {
        timeoutScheduler.stop();
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private Mono<CoAgentExecutionResult> start(Run run, Map<String, Object> initialState) {
        CoAgentWorkflowDefinition definition = run.definition;
        activeRuns.put(run.threadId, run);
        log.info("Starting workflow [{}] on thread [{}]", definition.getName(), run.threadId);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflow_name", definition.getName());
        payload.put("thread_id", run.threadId);
        payload.put("industry", industryOf(definition));
        payload.put("total_steps", definition.getEstimatedSteps());
        payload.put("entry_node", definition.getEntryNode());
        publish(run, CoAgentProgressEventType.START, payload);

        return runFrom(run, definition.getEntryNode(), CoAgentExecutionState.of(initialState))
                .doFinally(signal -> activeRuns.remove(run.threadId, run));
    }

    // recursive method
    private Mono<CoAgentExecutionResult> runFrom(Run run, String nodeName, CoAgentExecutionState state) {
        return Mono.defer(() -> {
            if (run.cancelRequested) {
                log.info("Thread [{}] cancelled before node [{}]", run.threadId, nodeName);
                String lastNode = state.getCurrentNode() != null ? state.getCurrentNode() : nodeName;
                return finish(run, lastNode, state, CoAgentExecutionStatus.CANCELLED, false);
            }
            if (run.visits.incrementAndGet() > run.recursionLimit) {
                return recursionLimitExceeded(run, nodeName);
            }

            ICoAgentNode node = run.definition.getNode(nodeName)
                    .orElseThrow(() -> new IllegalStateException("Node [" + nodeName + "] is not declared in workflow [" + run.definition.getName() + "]"));
            CoAgentExecutionState entered = state.withCurrentNode(nodeName);
            publish(run, CoAgentProgressEventType.NODE_ENTER, enterPayload(run, nodeName, entered));
            log.debug("Thread [{}] entering node [{}]", run.threadId, nodeName);

            return refreshLease(run)
                    .then(invoke(run, nodeName, () -> node.execute(entered, contextFor(run, nodeName))))
                    .flatMap(result -> applyOutcome(run, nodeName, entered, result, true));
        });
    }

    private Mono<CoAgentExecutionResult> resumeFrom(CoAgentCheckpoint checkpoint, CoAgentApprovalDecision decision, String ownerId) {
        String threadId = checkpoint.getThreadId();
        if (checkpoint.isTerminal()) {
            log.info("Thread [{}] already ended with status [{}], returning its result", threadId, checkpoint.getStatus());
            return Mono.justOrEmpty(checkpoint.getResult())
                    .switchIfEmpty(Mono.fromCallable(() -> snapshot(checkpoint)));
        }
        if (decision.getExpectedVersion() != null && decision.getExpectedVersion() != checkpoint.getVersion()) {
            return Mono.error(new CoAgentCheckpointConflictException(threadId, decision.getExpectedVersion(), checkpoint.getVersion()));
        }
        if (!checkpoint.isAwaitingApproval()) {
            String reason = checkpoint.getNextNode() != null
                    ? "the thread is not waiting for an approval; recover it to continue at node [" + checkpoint.getNextNode() + "]"
                    : "the thread is not waiting for an approval";
            return Mono.error(new CoAgentInvalidResumeException(threadId, reason));
        }

        CoAgentApprovalRequest request = checkpoint.getPendingApproval();
        String decisionValue = decision.getDecision().getValue();
        if (!request.allows(decisionValue)) {
            return Mono.error(new CoAgentInvalidResumeException(threadId, "decision [" + decisionValue + "] is not allowed at node [" + request.getNodeName() + "]"));
        }
        CoAgentWorkflowDefinition definition = registry.load(checkpoint.getWorkflowName());
        String nodeName = request.getNodeName();
        Optional<ICoAgentNode> node = definition.getNode(nodeName);
        if (node.isEmpty() || !(node.get() instanceof ICoAgentResumableNode)) {
            return Mono.error(new CoAgentInvalidResumeException(threadId, "node [" + nodeName + "] cannot take a decision"));
        }
        ICoAgentResumableNode gate = (ICoAgentResumableNode) node.get();

        // the pending checkpoint stays current until the gate's outcome is stored
        progressStream.advanceSequence(threadId, checkpoint.getLastEventSequence());
        Run run = Run.rehydrate(definition, checkpoint, ownerId, "resume");
        run.clearTimeoutOnWrite = true;
        activeRuns.put(threadId, run);
        log.info("Resuming thread [{}] at node [{}] with decision [{}]", threadId, nodeName, decisionValue);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node", nodeName);
        payload.put("decision", decisionValue);
        payload.put("comment", decision.getComment());
        payload.put("decided_by", decision.getDecidedBy());
        payload.put("state", checkpoint.getState());
        payload.put("checkpoint_version", checkpoint.getVersion());
        publish(run, CoAgentProgressEventType.RESUMED, payload);

        CoAgentExecutionState state = CoAgentExecutionState.of(checkpoint.getState()).withCurrentNode(nodeName);
        return invoke(run, nodeName, () -> gate.resume(state, request, decision, contextFor(run, nodeName)))
                .flatMap(result -> applyOutcome(run, nodeName, state, result, false))
                .doFinally(signal -> activeRuns.remove(threadId, run));
    }

    private Mono<CoAgentExecutionResult> recoverFrom(CoAgentCheckpoint checkpoint, String ownerId) {
        String threadId = checkpoint.getThreadId();
        if (checkpoint.isTerminal()) {
            log.info("Thread [{}] already ended with status [{}], nothing to recover", threadId, checkpoint.getStatus());
            return Mono.justOrEmpty(checkpoint.getResult())
                    .switchIfEmpty(Mono.fromCallable(() -> snapshot(checkpoint)));
        }
        if (checkpoint.isAwaitingApproval()) {
            log.info("Thread [{}] is waiting for an approval at node [{}], nothing to recover", threadId, checkpoint.getNodeName());
            return Mono.fromCallable(() -> snapshot(checkpoint));
        }
        String nextNode = checkpoint.getNextNode();
        if (nextNode == null) {
            return Mono.error(new CoAgentInvalidResumeException(threadId, "the checkpoint does not record a node to continue with"));
        }

        progressStream.advanceSequence(threadId, checkpoint.getLastEventSequence());
        CoAgentWorkflowDefinition definition = registry.load(checkpoint.getWorkflowName());
        Run run = Run.rehydrate(definition, checkpoint, ownerId, "recover");
        activeRuns.put(threadId, run);
        log.info("Recovering thread [{}] of workflow [{}] at node [{}] from checkpoint version {}",
                threadId, definition.getName(), nextNode, checkpoint.getVersion());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node", nextNode);
        payload.put("recovered", true);
        payload.put("state", checkpoint.getState());
        payload.put("checkpoint_version", checkpoint.getVersion());
        publish(run, CoAgentProgressEventType.RESUMED, payload);

        return runFrom(run, nextNode, CoAgentExecutionState.of(checkpoint.getState()))
                .doFinally(signal -> activeRuns.remove(threadId, run));
    }

    private Mono<CoAgentExecutionResult> cancelFrom(CoAgentCheckpoint checkpoint, String ownerId) {
        if (checkpoint.isTerminal()) {
            log.info("Thread [{}] already ended with status [{}], nothing to cancel", checkpoint.getThreadId(), checkpoint.getStatus());
            return Mono.justOrEmpty(checkpoint.getResult())
                    .switchIfEmpty(Mono.fromCallable(() -> snapshot(checkpoint)));
        }
        progressStream.advanceSequence(checkpoint.getThreadId(), checkpoint.getLastEventSequence());
        Run run = Run.rehydrate(registry.load(checkpoint.getWorkflowName()), checkpoint, ownerId, "cancel");
        CoAgentExecutionState state = CoAgentExecutionState.of(checkpoint.getState())
                .apply(CoAgentStatePatch.builder().put(CoAgentConstants.PENDING_APPROVAL, false).build());
        log.info("Cancelling thread [{}] at node [{}]", checkpoint.getThreadId(), checkpoint.getNodeName());
        return finish(run, checkpoint.getNodeName(), state, CoAgentExecutionStatus.CANCELLED, false);
    }

    private Mono<NodeResult> invoke(Run run, String nodeName, Supplier<Mono<CoAgentNodeOutcome>> call) {
        return Mono.defer(call)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Node [" + nodeName + "] completed without an outcome")))
                .map(outcome -> new NodeResult(outcome, true))
                .onErrorResume(
                        error -> !isInfrastructureFailure(error),
                        error -> Mono.just(new NodeResult(failureOutcome(run, nodeName, error), false)));
    }

    private CoAgentNodeOutcome failureOutcome(Run run, String nodeName, Throwable error) {
        CoAgentNodeExecutionException failure = new CoAgentNodeExecutionException(run.threadId, nodeName, error);
        log.error("Node [{}] failed on thread [{}]: {}", nodeName, run.threadId, failure.getNodeMessage(), error);
        CoAgentStatePatch patch = CoAgentStatePatch.builder().appendError(nodeName, failure.getNodeMessage()).build();
        return run.definition.getErrorNode()
                .filter(errorNode -> !errorNode.equals(nodeName))
                .<CoAgentNodeOutcome>map(errorNode -> CoAgentNodeOutcome.next(errorNode, patch))
                .orElseGet(() -> CoAgentNodeOutcome.terminal(CoAgentExecutionStatus.ERROR, patch));
    }

    private Mono<CoAgentExecutionResult> applyOutcome(
            Run run,
            String nodeName,
            CoAgentExecutionState state,
            NodeResult result,
            boolean appendStep) {

        NodeResult routed = checkRoute(run, nodeName, result);
        CoAgentNodeOutcome outcome = routed.outcome;
        CoAgentExecutionState next = state.apply(outcome.getPatch());
        if (appendStep && routed.completed && !run.definition.isTerminalNode(nodeName)) {
            next = next.withStepCompleted(nodeName);
        }

        if (outcome instanceof CoAgentNodeOutcome.Continue) {
            return proceed(run, nodeName, next, ((CoAgentNodeOutcome.Continue) outcome).getNextNode());
        }
        if (outcome instanceof CoAgentNodeOutcome.Suspend) {
            return suspend(run, nodeName, next, ((CoAgentNodeOutcome.Suspend) outcome).getRequest());
        }
        return finish(run, nodeName, next, ((CoAgentNodeOutcome.Terminal) outcome).getStatus(), true);
    }

    private NodeResult checkRoute(Run run, String nodeName, NodeResult result) {
        CoAgentWorkflowDefinition definition = run.definition;
        if (result.completed && definition.isTerminalNode(nodeName) && !(result.outcome instanceof CoAgentNodeOutcome.Terminal)) {
            CoAgentExecutionStatus status = definition.getTerminalNodes().get(nodeName);
            return new NodeResult(CoAgentNodeOutcome.terminal(status, result.outcome.getPatch()), true);
        }
        if (result.outcome instanceof CoAgentNodeOutcome.Continue) {
            String target = ((CoAgentNodeOutcome.Continue) result.outcome).getNextNode();
            if (definition.getNode(target).isEmpty()) {
                IllegalStateException error = new IllegalStateException("Node [" + nodeName + "] routed to undeclared node [" + target + "]");
                return new NodeResult(failureOutcome(run, nodeName, error), false);
            }
        }
        return result;
    }

    private Mono<CoAgentExecutionResult> proceed(Run run, String nodeName, CoAgentExecutionState state, String nextNode) {
        CoAgentCheckpoint.CoAgentCheckpointBuilder checkpoint = CoAgentCheckpoint.builder()
                .nodeName(nodeName)
                .nextNode(nextNode)
                .status(CoAgentExecutionStatus.RUNNING)
                .state(state.asMap());

        return writeCheckpoint(run, checkpoint, 1)
                .flatMap(stored -> {
                    publish(run, CoAgentProgressEventType.NODE_EXIT, exitPayload(nodeName, "continue", nextNode, stored));
                    return runFrom(run, nextNode, CoAgentExecutionState.of(stored.getState()));
                });
    }

    private Mono<CoAgentExecutionResult> suspend(Run run, String nodeName, CoAgentExecutionState state, CoAgentApprovalRequest request) {
        CoAgentApprovalRequest.CoAgentApprovalRequestBuilder pending = request.toBuilder()
                .nodeName(nodeName)
                .escalatedAt(null);
        if (request.getRequestedAt() == null) {
            pending.requestedAt(Instant.now());
        }
        if (request.getAllowedDecisions() == null || request.getAllowedDecisions().isEmpty()) {
            pending.allowedDecisions(List.of(CoAgentConstants.DECISION_APPROVE, CoAgentConstants.DECISION_REJECT));
        }
        CoAgentCheckpoint.CoAgentCheckpointBuilder checkpoint = CoAgentCheckpoint.builder()
                .nodeName(nodeName)
                .status(CoAgentExecutionStatus.PAUSED)
                .pendingApproval(pending.build())
                .state(state.asMap());

        return writeCheckpoint(run, checkpoint, 2)
                .map(stored -> {
                    publish(run, CoAgentProgressEventType.NODE_EXIT, exitPayload(nodeName, "suspend", null, stored));

                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("node", nodeName);
                    payload.put("approval_request", stored.getPendingApproval().toMap());
                    payload.put("state", stored.getState());
                    payload.put("checkpoint_version", stored.getVersion());
                    publish(run, CoAgentProgressEventType.INTERRUPT, payload);

                    timeoutScheduler.schedule(stored);
                    log.info("Thread [{}] suspended at node [{}] waiting for approval of [{}]",
                            run.threadId, nodeName, stored.getPendingApproval().getOperation());
                    return toResult(run.definition, run.definition.getName(), run.threadId,
                            CoAgentExecutionStatus.PAUSED, stored.getState(), stored.getPendingApproval(), run.elapsedMs());
                });
    }

    private Mono<CoAgentExecutionResult> finish(
            Run run,
            String nodeName,
            CoAgentExecutionState state,
            CoAgentExecutionStatus status,
            boolean emitExit) {

        CoAgentExecutionResult result = toResult(run.definition, run.definition.getName(), run.threadId,
                status, state.asMap(), null, run.elapsedMs());
        CoAgentCheckpoint.CoAgentCheckpointBuilder checkpoint = CoAgentCheckpoint.builder()
                .nodeName(nodeName)
                .status(status)
                .state(state.asMap())
                .result(result)
                .cancelled(status == CoAgentExecutionStatus.CANCELLED);

        return writeCheckpoint(run, checkpoint, emitExit ? 2 : 1)
                .map(stored -> {
                    if (emitExit) {
                        publish(run, CoAgentProgressEventType.NODE_EXIT, exitPayload(nodeName, "terminal", null, stored));
                    }
                    CoAgentExecutionResult finished = stored.getResult();
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("status", status.getValue());
                    payload.put("error", finished.getError());
                    payload.put("steps_completed", finished.getStepsCompleted());
                    payload.put("final_state", finished.getFinalState());
                    payload.put("execution_time_ms", finished.getExecutionTimeMs());
                    publish(run, terminalEventType(status), payload);

                    timeoutScheduler.cancel(run.threadId);
                    progressStream.release(run.threadId);
                    log.info("Thread [{}] of workflow [{}] ended with status [{}], steps completed: {}",
                            run.threadId, run.definition.getName(), status.getValue(), finished.getStepsCompleted());
                    return finished;
                });
    }

    private Mono<CoAgentExecutionResult> recursionLimitExceeded(Run run, String nodeName) {
        CoAgentRecursionLimitException error = new CoAgentRecursionLimitException(run.threadId, run.recursionLimit, nodeName);
        log.error("Thread [{}] stopped before node [{}]: {}", run.threadId, nodeName, error.getMessage());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", CoAgentExecutionStatus.ERROR.getValue());
        payload.put("error", error.getMessage());
        payload.put("error_code", error.getErrorInfo().getErrorCode());
        payload.put("node", nodeName);
        publish(run, CoAgentProgressEventType.ERROR, payload);
        return Mono.error(error);
    }

    private Mono<Boolean> escalateTimeout(CoAgentCheckpoint checkpoint, String ownerId) {
        String threadId = checkpoint.getThreadId();
        progressStream.advanceSequence(threadId, checkpoint.getLastEventSequence());
        CoAgentWorkflowDefinition definition = registry.load(checkpoint.getWorkflowName());
        Run run = Run.rehydrate(definition, checkpoint, ownerId, "timeout");
        CoAgentApprovalRequest request = checkpoint.getPendingApproval();

        String timeoutNodeName = request.getTimeoutNode() != null ? request.getTimeoutNode() : request.getNodeName();
        ICoAgentNode timeoutNode = Optional.ofNullable(request.getTimeoutNode())
                .flatMap(definition::getNode)
                .orElseGet(() -> defaultTimeoutEscalation(request));
        CoAgentExecutionState state = CoAgentExecutionState.of(checkpoint.getState());
        ICoAgentNodeContext context = contextFor(run, timeoutNodeName);

        Mono<CoAgentStatePatch> patch = timeoutNode instanceof CoAgentEscalateNode
                ? ((CoAgentEscalateNode) timeoutNode).escalate(state, context)
                : timeoutNode.execute(state, context).map(CoAgentNodeOutcome::getPatch);

        return patch
                .defaultIfEmpty(CoAgentStatePatch.empty())
                .flatMap(escalation -> {
                    CoAgentCheckpoint.CoAgentCheckpointBuilder rewritten = checkpoint.toBuilder()
                            .state(state.apply(escalation).asMap())
                            .pendingApproval(request.toBuilder().escalatedAt(Instant.now()).build());
                    return writeCheckpoint(run, rewritten, 0);
                })
                .map(stored -> {
                    log.warn("Approval of [{}] on thread [{}] timed out and was escalated", request.getOperation(), threadId);
                    return true;
                });
    }

    private CoAgentEscalateNode defaultTimeoutEscalation(CoAgentApprovalRequest request) {
        return CoAgentEscalateNode.builder()
                .issueType(CoAgentEscalationIssueType.TIMEOUT)
                .nextNode(request.getNodeName())
                .severity(CoAgentEscalationSeverity.HIGH)
                .message(state -> "Approval of " + request.getOperation() + " has been waiting for "
                        + TimeUnit.MILLISECONDS.toMinutes(request.getTimeoutMs()) + " minutes")
                .details(state -> {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("operation", request.getOperation());
                    details.put("node", request.getNodeName());
                    details.put("requested_at", String.valueOf(request.getRequestedAt()));
                    details.put("timeout_ms", request.getTimeoutMs());
                    return details;
                })
                .build();
    }

    private void onApprovalTimeout(String threadId, long checkpointVersion) {
        handleApprovalTimeout(threadId, checkpointVersion)
                .subscribe(
                        escalated -> log.debug("Approval timeout of thread [{}] handled, escalated: {}", threadId, escalated),
                        error -> log.error("Approval timeout handling failed for thread [{}]", threadId, error));
    }

    private Mono<CoAgentCheckpoint> writeCheckpoint(Run run, CoAgentCheckpoint.CoAgentCheckpointBuilder builder, int eventsToFollow) {
        Instant now = Instant.now();
        long lastEventSequence = progressStream.lastSequence(run.threadId) + (run.eventsEnabled ? eventsToFollow : 0);
        CoAgentCheckpoint checkpoint = builder
                .threadId(run.threadId)
                .workflowName(run.definition.getName())
                .version(run.version + 1)
                .lastEventSequence(lastEventSequence)
                .recursionLimit(run.recursionLimit)
                .eventsSuppressed(!run.eventsEnabled)
                .createdAt(run.createdAt != null ? run.createdAt : now)
                .timestamp(now)
                .build();
        return checkpointStore.put(checkpoint)
                .doOnNext(stored -> {
                    run.version = stored.getVersion();
                    run.createdAt = stored.getCreatedAt();
                    if (run.clearTimeoutOnWrite) {
                        run.clearTimeoutOnWrite = false;
                        timeoutScheduler.cancel(run.threadId);
                    }
                });
    }

    private Mono<Void> refreshLease(Run run) {
        return lockService.tryAcquire(run.threadId, run.ownerId, lockDuration, run.operation)
                .flatMap(held -> held
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new CoAgentCheckpointConflictException(run.threadId, "the thread lock was taken over by another caller")));
    }

    private <T> Mono<T> releasing(String threadId, String ownerId, Mono<T> action) {
        return action
                .flatMap(value -> lockService.release(threadId, ownerId).thenReturn(value))
                .onErrorResume(error -> lockService.release(threadId, ownerId).then(Mono.error(error)))
                .doOnCancel(() -> lockService.release(threadId, ownerId)
                        .subscribe(
                                released -> log.debug("Released lock of thread [{}] after cancellation", threadId),
                                error -> log.warn("Failed to release lock of thread [{}]", threadId, error)));
    }

    private ICoAgentNodeContext contextFor(Run run, String nodeName) {
        return CoAgentNodeContext.builder()
                .threadId(run.threadId)
                .workflowName(run.definition.getName())
                .nodeName(nodeName)
                .sessionContext(run.sessionContext)
                .notificationSink(notificationSink)
                .documentClient(documentClient)
                .cancelled(() -> run.cancelRequested)
                .emitter((type, payload) -> publish(run, type, payload))
                .build();
    }

    private void publish(Run run, CoAgentProgressEventType type, Map<String, Object> payload) {
        if (run.eventsEnabled) {
            progressStream.publish(run.threadId, type, payload);
        }
    }

    private CoAgentExecutionResult snapshot(CoAgentCheckpoint checkpoint) {
        CoAgentWorkflowDefinition definition = registry.contains(checkpoint.getWorkflowName())
                ? registry.load(checkpoint.getWorkflowName())
                : null;
        return toResult(definition, checkpoint.getWorkflowName(), checkpoint.getThreadId(), checkpoint.getStatus(),
                checkpoint.getState(), checkpoint.getPendingApproval(), 0L);
    }

    private static CoAgentExecutionResult toResult(
            CoAgentWorkflowDefinition definition,
            String workflowName,
            String threadId,
            CoAgentExecutionStatus status,
            Map<String, Object> state,
            CoAgentApprovalRequest request,
            long executionTimeMs) {

        CoAgentExecutionState view = CoAgentExecutionState.of(state);
        String error = null;
        if (status == CoAgentExecutionStatus.ERROR || status == CoAgentExecutionStatus.REJECTED) {
            List<Map<String, Object>> errors = view.getErrors();
            error = errors.isEmpty()
                    ? "Workflow ended with status " + status.getValue()
                    : String.valueOf(errors.get(errors.size() - 1).get(CoAgentConstants.ERROR_MESSAGE));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (definition != null) {
            metadata.put("industry", industryOf(definition));
            metadata.put("estimated_steps", definition.getEstimatedSteps());
        }
        metadata.put("actual_steps", view.getStepsCompleted().size());

        return CoAgentExecutionResult.builder()
                .threadId(threadId)
                .workflowName(workflowName)
                .status(status)
                .finalState(view.toMap())
                .interruptData(request)
                .error(error)
                .stepsCompleted(List.copyOf(view.getStepsCompleted()))
                .executionTimeMs(executionTimeMs)
                .metadata(metadata)
                .build();
    }

    private static Map<String, Object> enterPayload(Run run, String nodeName, CoAgentExecutionState state) {
        int totalSteps = Math.max(1, run.definition.getEstimatedSteps());
        int currentStep = state.getStepsCompleted().size() + 1;
        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("current_step", currentStep);
        progress.put("total_steps", totalSteps);
        progress.put("percentage", Math.min(100, currentStep * 100 / totalSteps));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node", nodeName);
        payload.put("progress", progress);
        return payload;
    }

    private static Map<String, Object> exitPayload(String nodeName, String outcome, String nextNode, CoAgentCheckpoint stored) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node", nodeName);
        payload.put("outcome", outcome);
        if (nextNode != null) {
            payload.put("next_node", nextNode);
        }
        payload.put("steps_completed", CoAgentExecutionState.of(stored.getState()).getStepsCompleted());
        payload.put("checkpoint_version", stored.getVersion());
        return payload;
    }

    private static CoAgentProgressEventType terminalEventType(CoAgentExecutionStatus status) {
        switch (status) {
            case ERROR:
                return CoAgentProgressEventType.ERROR;
            case CANCELLED:
                return CoAgentProgressEventType.CANCELLED;
            default:
                return CoAgentProgressEventType.COMPLETE;
        }
    }

    private static String industryOf(CoAgentWorkflowDefinition definition) {
        return definition.getIndustry() != null ? definition.getIndustry() : "general";
    }

    private static boolean isInfrastructureFailure(Throwable error) {
        return error instanceof CoAgentWorkflowException && ((CoAgentWorkflowException) error).isInfrastructureFailure();
    }

    private static String checkThreadId(String threadId) {
        if (threadId == null || !THREAD_ID_PATTERN.matcher(threadId).matches()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("thread_id", threadId);
            throw new CoAgentInvalidRequestException(
                    "thread_id must be 1 to 128 letters, digits, dots, dashes or underscores", details);
        }
        return threadId;
    }

    private static void checkDecision(CoAgentApprovalDecision decision) {
        if (decision == null || decision.getThreadId() == null || decision.getThreadId().isBlank()) {
            throw new CoAgentInvalidResumeException(null, "a decision needs a thread_id");
        }
        if (!THREAD_ID_PATTERN.matcher(decision.getThreadId()).matches()) {
            throw new CoAgentInvalidResumeException(decision.getThreadId(), "the thread_id is malformed");
        }
        if (decision.getDecision() == null) {
            throw new CoAgentInvalidResumeException(decision.getThreadId(), "the decision must be approve or reject");
        }
    }

    private static String newOwner(String operation) {
        return operation + "-" + UUID.randomUUID();
    }

    @AllArgsConstructor
    private static final class NodeResult {
        private final CoAgentNodeOutcome outcome;

        /**
         * False when the outcome was produced from a failure of the node.
         */
        private final boolean completed;
    }

    /**
     * Mutable bookkeeping of one execute, resume, cancel or timeout call.
     */
    private static final class Run {
        private final CoAgentWorkflowDefinition definition;
        private final String threadId;
        private final String ownerId;
        private final String operation;
        private final int recursionLimit;
        private final boolean eventsEnabled;
        private final Map<String, Object> sessionContext;
        private final long startNanos = System.nanoTime();
        private final AtomicInteger visits = new AtomicInteger();
        private volatile boolean cancelRequested;

        /**
         * Set by resume: the approval timeout is dropped once the decision's outcome is stored.
         */
        private boolean clearTimeoutOnWrite;
        private long version;
        private Instant createdAt;

        private Run(CoAgentWorkflowDefinition definition, String threadId, String ownerId, String operation,
                    int recursionLimit, boolean eventsEnabled, Map<String, Object> sessionContext) {
            this.definition = definition;
            this.threadId = threadId;
            this.ownerId = ownerId;
            this.operation = operation;
            this.recursionLimit = recursionLimit;
            this.eventsEnabled = eventsEnabled;
            this.sessionContext = sessionContext == null ? Map.of() : sessionContext;
        }

        static Run start(CoAgentWorkflowDefinition definition, String threadId, String ownerId, CoAgentExecutionConfig config) {
            return new Run(definition, threadId, ownerId, "execute",
                    config.getRecursionLimit(), config.isEmitEvents(), config.getSessionContext());
        }

        static Run rehydrate(CoAgentWorkflowDefinition definition, CoAgentCheckpoint checkpoint, String ownerId, String operation) {
            int recursionLimit = checkpoint.getRecursionLimit() > 0
                    ? checkpoint.getRecursionLimit()
                    : CoAgentConstants.DEFAULT_RECURSION_LIMIT;
            Run run = new Run(definition, checkpoint.getThreadId(), ownerId, operation,
                    recursionLimit, !checkpoint.isEventsSuppressed(), Map.of());
            run.version = checkpoint.getVersion();
            run.createdAt = checkpoint.getCreatedAt();
            return run;
        }

        long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }
}
