package com.coagent.workflow.core.engine.lock;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Lease held on a thread while one caller executes, resumes or cancels it.
 */
@Data
@Builder(toBuilder = true)
public class CoAgentThreadLock {
    private final String threadId;
    private final String ownerId;

    /**
     * execute, resume, cancel or timeout; for diagnostics
     */
    private final String operation;
    private final Instant acquiredAt;
    private final Instant expiresAt;

    public static CoAgentThreadLock create(String threadId, String ownerId, Duration duration, String operation) {
        Instant now = Instant.now();
        return CoAgentThreadLock.builder()
                .threadId(threadId)
                .ownerId(ownerId)
                .operation(operation)
                .acquiredAt(now)
                .expiresAt(now.plus(duration))
                .build();
    }

    public boolean isExpired() {
        return Instant.now().isAfter(expiresAt);
    }

    public CoAgentThreadLock extend(Duration duration) {
        return toBuilder().expiresAt(Instant.now().plus(duration)).build();
    }
}
