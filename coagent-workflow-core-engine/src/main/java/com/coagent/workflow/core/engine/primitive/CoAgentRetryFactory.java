package com.coagent.workflow.core.engine.primitive;

import com.coagent.workflow.integration.contract.ICoAgentRetryPolicy;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.util.function.Predicate;

public final class CoAgentRetryFactory {

    private CoAgentRetryFactory() {
    }

    /**
     * Backoff between attempts: {@code initialDelay * backoffFactor^(n-1)}, capped at {@code maxDelay},
     * spread by {@code jitter}. {@code maxAttempts} counts the first attempt.
     */
    public static RetryBackoffSpec buildRetry(ICoAgentRetryPolicy policy, Predicate<Throwable> retryPredicate) {
        return Retry
                .backoff(Math.max(0, policy.getMaxAttempts() - 1), policy.getInitialDelay())
                .maxBackoff(policy.getMaxDelay())
                .multiplier(policy.getBackoffFactor())
                .jitter(policy.getJitter())
                .filter(retryPredicate)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
