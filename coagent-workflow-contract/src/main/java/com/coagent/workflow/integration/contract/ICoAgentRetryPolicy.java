package com.coagent.workflow.integration.contract;

import java.time.Duration;

public interface ICoAgentRetryPolicy {
    int getMaxAttempts();
    Duration getInitialDelay();
    double getBackoffFactor();
    Duration getMaxDelay();
    double getJitter();
}
