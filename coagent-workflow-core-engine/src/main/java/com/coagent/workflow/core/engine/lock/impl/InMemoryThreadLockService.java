package com.coagent.workflow.core.engine.lock.impl;

import com.coagent.workflow.core.engine.lock.CoAgentThreadLock;
import com.coagent.workflow.core.engine.lock.ICoAgentThreadLockService;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lock service for single-process deployments.
 */
@Slf4j
public class InMemoryThreadLockService implements ICoAgentThreadLockService {

    private static final Duration RETRY_INTERVAL = Duration.ofMillis(20);

    private final Map<String, CoAgentThreadLock> locks = new ConcurrentHashMap<>();

    @Override
    public Mono<Boolean> tryAcquire(String threadId, String ownerId, Duration duration, String operation) {
        return Mono.fromCallable(() -> tryAcquireSync(threadId, ownerId, duration, operation));
    }

    public boolean tryAcquireSync(String threadId, String ownerId, Duration duration, String operation) {
        if (threadId == null || ownerId == null) {
            throw new IllegalArgumentException("threadId and ownerId cannot be null");
        }
        return locks.compute(threadId, (key, existingLock) -> {
            if (existingLock == null) {
                log.debug("Acquiring lock: threadId={}, owner={}, operation={}", threadId, ownerId, operation);
                return CoAgentThreadLock.create(threadId, ownerId, duration, operation);
            }
            if (existingLock.getOwnerId().equals(ownerId)) {
                return existingLock.extend(duration);
            }
            if (existingLock.isExpired()) {
                log.warn("Taking over expired lock: threadId={}, previousOwner={}, newOwner={}",
                        threadId, existingLock.getOwnerId(), ownerId);
                return CoAgentThreadLock.create(threadId, ownerId, duration, operation);
            }
            log.debug("Lock held by another owner: threadId={}, holder={}", threadId, existingLock.getOwnerId());
            return existingLock;
        }).getOwnerId().equals(ownerId);
    }

    @Override
    public Mono<Boolean> acquireWithWait(String threadId, String ownerId, Duration duration, String operation, Duration waitTimeout) {
        long maxRetries = Math.max(1, waitTimeout.toMillis() / RETRY_INTERVAL.toMillis());
        return Mono.fromCallable(() -> tryAcquireSync(threadId, ownerId, duration, operation))
                .filter(Boolean::booleanValue)
                .repeatWhenEmpty(Math.toIntExact(Math.min(maxRetries, Integer.MAX_VALUE)),
                        attempts -> attempts.delayElements(RETRY_INTERVAL))
                .onErrorResume(IllegalStateException.class, e -> Mono.just(false))
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Boolean> release(String threadId, String ownerId) {
        return Mono.fromCallable(() -> releaseSync(threadId, ownerId));
    }

    public boolean releaseSync(String threadId, String ownerId) {
        if (threadId == null || ownerId == null) {
            return false;
        }
        boolean[] released = {false};
        locks.computeIfPresent(threadId, (key, existingLock) -> {
            if (existingLock.getOwnerId().equals(ownerId)) {
                log.debug("Releasing lock: threadId={}, owner={}", threadId, ownerId);
                released[0] = true;
                return null;
            }
            log.warn("Cannot release lock, not owner: threadId={}, holder={}, requester={}",
                    threadId, existingLock.getOwnerId(), ownerId);
            return existingLock;
        });
        return released[0];
    }

    @Override
    public Mono<Optional<CoAgentThreadLock>> getLockInfo(String threadId) {
        return Mono.fromCallable(() -> Optional.ofNullable(locks.get(threadId)).filter(lock -> !lock.isExpired()));
    }

    @Override
    public Mono<Long> cleanupExpiredLocks() {
        return Mono.fromCallable(() -> {
            long before = locks.size();
            locks.entrySet().removeIf(entry -> entry.getValue().isExpired());
            long removed = before - locks.size();
            if (removed > 0) {
                log.info("Cleaned up {} expired thread locks", removed);
            }
            return removed;
        });
    }
}
