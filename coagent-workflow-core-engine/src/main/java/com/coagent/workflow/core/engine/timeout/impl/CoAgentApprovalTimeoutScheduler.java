package com.coagent.workflow.core.engine.timeout.impl;

import com.coagent.workflow.core.engine.timeout.ICoAgentApprovalTimeoutScheduler;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalRequest;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * In-memory scheduler. Deadlines are not durable; after a restart the engine schedules them
 * again from the suspended checkpoints.
 */
@Slf4j
public class CoAgentApprovalTimeoutScheduler implements ICoAgentApprovalTimeoutScheduler {

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledDeadline> deadlines = new ConcurrentHashMap<>();
    private volatile TimeoutHandler handler;

    public CoAgentApprovalTimeoutScheduler() {
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "approval-timeout-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void schedule(CoAgentCheckpoint checkpoint) {
        CoAgentApprovalRequest request = checkpoint.getPendingApproval();
        if (request == null || request.getTimeoutMs() == null || request.getEscalatedAt() != null) {
            return;
        }
        if (handler == null) {
            throw new IllegalStateException("Approval timeout scheduler is not running");
        }
        String threadId = checkpoint.getThreadId();
        long version = checkpoint.getVersion();
        Instant requestedAt = request.getRequestedAt() == null ? Instant.now() : request.getRequestedAt();
        Instant deadline = requestedAt.plusMillis(request.getTimeoutMs());
        Duration delay = Duration.between(Instant.now(), deadline);

        ScheduledFuture<?> future = scheduler.schedule(
                () -> fire(threadId, version),
                Math.max(0, delay.toMillis()),
                TimeUnit.MILLISECONDS
        );
        ScheduledDeadline previous = deadlines.put(threadId, new ScheduledDeadline(threadId, version, deadline, future));
        if (previous != null) {
            previous.getFuture().cancel(false);
        }
        log.info("Scheduled approval timeout: threadId={}, node={}, at={}", threadId, request.getNodeName(), deadline);
    }

    @Override
    public boolean cancel(String threadId) {
        ScheduledDeadline deadline = deadlines.remove(threadId);
        if (deadline == null) {
            return false;
        }
        deadline.getFuture().cancel(false);
        log.debug("Cancelled approval timeout: threadId={}", threadId);
        return true;
    }

    @Override
    public Optional<Instant> getDeadline(String threadId) {
        return Optional.ofNullable(deadlines.get(threadId)).map(ScheduledDeadline::getDeadline);
    }

    @Override
    public void start(TimeoutHandler handler) {
        this.handler = handler;
        log.info("Approval timeout scheduler started");
    }

    @Override
    public void stop() {
        handler = null;
        deadlines.values().forEach(deadline -> deadline.getFuture().cancel(false));
        deadlines.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Approval timeout scheduler stopped");
    }

    private void fire(String threadId, long version) {
        deadlines.computeIfPresent(threadId, (key, deadline) -> deadline.getVersion() == version ? null : deadline);
        TimeoutHandler current = handler;
        if (current == null) {
            log.warn("Approval timeout for thread [{}] fired after the scheduler stopped", threadId);
            return;
        }
        log.info("Approval timeout triggered: threadId={}, version={}", threadId, version);
        try {
            current.onTimeout(threadId, version);
        } catch (RuntimeException e) {
            log.error("Approval timeout handling failed for thread [{}]", threadId, e);
        }
    }

    @Data
    private static class ScheduledDeadline {
        private final String threadId;
        private final long version;
        private final Instant deadline;
        private final ScheduledFuture<?> future;
    }
}
