package com.coagent.workflow.core.engine.lock;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-thread mutual exclusion for execute, resume, cancel and timeout handling.
 *
 * <p>Locks are leases: an expired lock can be taken over, so a crashed holder never blocks a
 * thread forever. Only the owner can release a lock.</p>
 */
public interface ICoAgentThreadLockService {

    Mono<Boolean> tryAcquire(String threadId, String ownerId, Duration duration, String operation);

    /**
     * Keeps trying until the lock is obtained or the wait timeout elapses.
     */
    Mono<Boolean> acquireWithWait(String threadId, String ownerId, Duration duration, String operation, Duration waitTimeout);

    Mono<Boolean> release(String threadId, String ownerId);

    Mono<Optional<CoAgentThreadLock>> getLockInfo(String threadId);

    Mono<Long> cleanupExpiredLocks();
}
