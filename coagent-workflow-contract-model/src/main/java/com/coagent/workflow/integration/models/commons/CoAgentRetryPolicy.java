package com.coagent.workflow.integration.models.commons;

import com.coagent.workflow.integration.contract.ICoAgentRetryPolicy;
import lombok.Data;

import java.io.Serializable;
import java.time.Duration;

@Data
public class CoAgentRetryPolicy implements ICoAgentRetryPolicy, Serializable {
    private final int maxAttempts;
    private final Duration initialDelay;
    private final double backoffFactor;
    private final Duration maxDelay;
    private final double jitter;

    /**
     * Three attempts, 1s initial delay doubling up to 60s, 25% jitter.
     */
    public static CoAgentRetryPolicy defaults() {
        return builder()
                .maxAttempts(3)
                .initialDelay(Duration.ofSeconds(1))
                .backoffFactor(2.0)
                .maxDelay(Duration.ofSeconds(60))
                .jitter(0.25)
                .build();
    }

    /**
     * Delay before the given retry, 1-based, without jitter.
     */
    public Duration delayBeforeRetry(int retryNumber) {
        double millis = initialDelay.toMillis() * Math.pow(backoffFactor, retryNumber - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    // ---------------------------------------------------------
    // Builder entry
    // ---------------------------------------------------------
    public static MaxAttemptsStep builder() {
        return new Builder();
    }

    // ---------------------------------------------------------
    // Step Interfaces
    // ---------------------------------------------------------
    public interface MaxAttemptsStep {
        InitialDelayStep maxAttempts(int maxAttempts);
    }

    public interface InitialDelayStep {
        BackoffFactorStep initialDelay(Duration initialDelay);
    }

    public interface BackoffFactorStep {
        MaxDelayStep backoffFactor(double backoffFactor);
    }

    public interface MaxDelayStep {
        BuildStep maxDelay(Duration maxDelay);
    }

    public interface BuildStep {
        BuildStep jitter(double jitter);

        CoAgentRetryPolicy build();
    }

    // ---------------------------------------------------------
    // Builder Implementation
    // ---------------------------------------------------------
    private static class Builder implements
            MaxAttemptsStep,
            InitialDelayStep,
            BackoffFactorStep,
            MaxDelayStep,
            BuildStep {

        private int maxAttempts;
        private Duration initialDelay;
        private double backoffFactor;
        private Duration maxDelay;
        private double jitter;

        @Override
        public InitialDelayStep maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        @Override
        public BackoffFactorStep initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        @Override
        public MaxDelayStep backoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
            return this;
        }

        @Override
        public BuildStep maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        @Override
        public BuildStep jitter(double jitter) {
            this.jitter = jitter;
            return this;
        }

        @Override
        public CoAgentRetryPolicy build() {
            if (maxAttempts < 1) {
                throw new IllegalStateException("maxAttempts must be at least 1");
            }
            if (jitter < 0 || jitter > 1) {
                throw new IllegalStateException("jitter must be within [0, 1]");
            }
            return new CoAgentRetryPolicy(maxAttempts, initialDelay, backoffFactor, maxDelay, jitter);
        }
    }
}
