package com.coagent.workflow.core.engine.primitive;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.integration.constant.CoAgentConstants;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.enumerations.CoAgentFailureKind;
import com.coagent.workflow.integration.models.commons.CoAgentRetryPolicy;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNodeContext;
import com.coagent.workflow.integration.models.node.ICoAgentRoutingNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs an operation with exponential backoff and routes on the outcome.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>success: {@code Continue(next)} with the operation's patch</li>
 *   <li>attempts exhausted, or a fatal failure: {@code Continue(escalation)} when an escalation
 *       node is declared, otherwise {@code Terminal(error)}; the failure is appended to
 *       {@code errors}</li>
 * </ul>
 *
 * <p>Every run records {@code retry_attempts[node] = {attempts, total_delay_ms, success}}.</p>
 *
 * <pre>{@code
 * CoAgentRetryNode.builder()
 *         .operationName("create_work_order")
 *         .operation((state, ctx) -> ctx.getDocumentClient().create("Work Order", payload(state)).map(...))
 *         .nextNode("start_production")
 *         .policy(CoAgentRetryPolicy.defaults())
 *         .escalationNode("escalate_failure")
 *         .build();
 * }</pre>
 */
@Slf4j
@Getter
public class CoAgentRetryNode implements ICoAgentRoutingNode {

    private final String operationName;
    private final ICoAgentRetryableOperation operation;
    private final String nextNode;
    private final CoAgentRetryPolicy policy;
    private final CoAgentFailureClassifier classifier;
    private final String escalationNode;

    private CoAgentRetryNode(Builder builder) {
        this.operationName = builder.operationName;
        this.operation = builder.operation;
        this.nextNode = builder.nextNode;
        this.policy = builder.policy;
        this.classifier = builder.classifier;
        this.escalationNode = builder.escalationNode;
    }

    @Override
    public Set<String> getSuccessors() {
        Set<String> successors = new LinkedHashSet<>();
        successors.add(nextNode);
        if (escalationNode != null) {
            successors.add(escalationNode);
        }
        return successors;
    }

    @Override
    public Mono<CoAgentNodeOutcome> execute(CoAgentExecutionState state, ICoAgentNodeContext context) {
        AtomicInteger attempts = new AtomicInteger();
        AtomicLong lastFailureNanos = new AtomicLong(-1);
        AtomicLong totalDelayNanos = new AtomicLong();

        Mono<CoAgentStatePatch> attempt = Mono.defer(() -> {
                    int number = attempts.incrementAndGet();
                    long failedAt = lastFailureNanos.get();
                    if (failedAt >= 0) {
                        totalDelayNanos.addAndGet(now() - failedAt);
                    }
                    log.debug("Running [{}] attempt {}/{} on thread [{}]",
                            operationName, number, policy.getMaxAttempts(), context.getThreadId());
                    return operation.apply(state, context);
                })
                .defaultIfEmpty(CoAgentStatePatch.empty())
                .doOnError(error -> lastFailureNanos.set(now()));

        return attempt
                .retryWhen(CoAgentRetryFactory.buildRetry(policy, this::isTransient)
                        .doBeforeRetry(signal -> log.warn("Retrying [{}] on thread [{}], attempt {}/{}: {}",
                                operationName, context.getThreadId(), signal.totalRetries() + 2,
                                policy.getMaxAttempts(), signal.failure().getMessage())))
                .map(patch -> {
                    CoAgentStatePatch record = attemptsRecord(state, context.getNodeName(), attempts.get(), totalDelayNanos.get(), true);
                    return (CoAgentNodeOutcome) CoAgentNodeOutcome.next(nextNode, patch.merge(record));
                })
                .onErrorResume(error -> !isInfrastructureFailure(error),
                        error -> Mono.just(failed(state, context, error, attempts.get(), totalDelayNanos.get())));
    }

    // ============================================================================
    // PRIVATE HELPERS
    // ============================================================================

    // the clock the backoff is scheduled on
    private static long now() {
        return Schedulers.parallel().now(TimeUnit.NANOSECONDS);
    }

    private boolean isTransient(Throwable error) {
        return classifier.apply(error) == CoAgentFailureKind.TRANSIENT;
    }

    private static boolean isInfrastructureFailure(Throwable error) {
        return error instanceof CoAgentWorkflowException workflowException && workflowException.isInfrastructureFailure();
    }

    private CoAgentNodeOutcome failed(CoAgentExecutionState state, ICoAgentNodeContext context, Throwable error,
                                      int attempts, long totalDelayNanos) {
        String cause = ExceptionUtils.getRootCauseMessage(error);
        String message = isTransient(error)
                ? String.format("%s failed after %d attempts. Last error: %s", operationName, attempts, cause)
                : String.format("%s failed with a non-retryable error: %s", operationName, cause);
        log.warn("Retry node [{}] on thread [{}] gave up: {}", context.getNodeName(), context.getThreadId(), message);

        CoAgentStatePatch patch = CoAgentStatePatch.builder()
                .appendError(context.getNodeName(), message)
                .build()
                .merge(attemptsRecord(state, context.getNodeName(), attempts, totalDelayNanos, false));
        if (escalationNode != null) {
            return CoAgentNodeOutcome.next(escalationNode, patch);
        }
        return CoAgentNodeOutcome.terminal(CoAgentExecutionStatus.ERROR, patch);
    }

    @SuppressWarnings("unchecked")
    private static CoAgentStatePatch attemptsRecord(CoAgentExecutionState state, String nodeName, int attempts,
                                                    long totalDelayNanos, boolean success) {
        Map<String, Object> allAttempts = new LinkedHashMap<>(
                state.find(CoAgentConstants.RETRY_ATTEMPTS, Map.class).orElse(Map.of()));
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("attempts", attempts);
        record.put("total_delay_ms", TimeUnit.NANOSECONDS.toMillis(totalDelayNanos));
        record.put("success", success);
        allAttempts.put(nodeName, record);
        return CoAgentStatePatch.builder().put(CoAgentConstants.RETRY_ATTEMPTS, allAttempts).build();
    }

    // ---------------------------------------------------------
    // Builder entry
    // ---------------------------------------------------------
    public static OperationNameStep builder() {
        return new Builder();
    }

    // ---------------------------------------------------------
    // Step Interfaces
    // ---------------------------------------------------------
    public interface OperationNameStep {
        OperationStep operationName(String operationName);
    }

    public interface OperationStep {
        NextNodeStep operation(ICoAgentRetryableOperation operation);
    }

    public interface NextNodeStep {
        BuildStep nextNode(String nextNode);
    }

    public interface BuildStep {
        BuildStep policy(CoAgentRetryPolicy policy);

        BuildStep classifier(CoAgentFailureClassifier classifier);

        BuildStep escalationNode(String escalationNode);

        CoAgentRetryNode build();
    }

    // ---------------------------------------------------------
    // Builder Implementation
    // ---------------------------------------------------------
    private static class Builder implements OperationNameStep, OperationStep, NextNodeStep, BuildStep {
        private String operationName;
        private ICoAgentRetryableOperation operation;
        private String nextNode;
        private CoAgentRetryPolicy policy = CoAgentRetryPolicy.defaults();
        private CoAgentFailureClassifier classifier = CoAgentFailureClassifier.defaults();
        private String escalationNode;

        @Override
        public OperationStep operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        @Override
        public NextNodeStep operation(ICoAgentRetryableOperation operation) {
            this.operation = operation;
            return this;
        }

        @Override
        public BuildStep nextNode(String nextNode) {
            this.nextNode = nextNode;
            return this;
        }

        @Override
        public BuildStep policy(CoAgentRetryPolicy policy) {
            this.policy = policy;
            return this;
        }

        @Override
        public BuildStep classifier(CoAgentFailureClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        @Override
        public BuildStep escalationNode(String escalationNode) {
            this.escalationNode = escalationNode;
            return this;
        }

        @Override
        public CoAgentRetryNode build() {
            if (operation == null || nextNode == null) {
                throw new IllegalStateException("Retry node [" + operationName + "] needs an operation and a next node");
            }
            return new CoAgentRetryNode(this);
        }
    }
}
