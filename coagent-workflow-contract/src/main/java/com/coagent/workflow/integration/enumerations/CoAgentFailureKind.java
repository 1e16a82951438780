package com.coagent.workflow.integration.enumerations;

/**
 * Classification of a failed node operation, decides whether a retry is worth attempting.
 */
public enum CoAgentFailureKind {

    /**
     * Network hiccups, timeouts, temporarily unavailable services. Retried with backoff.
     */
    TRANSIENT,

    /**
     * Bad data, permission problems, business rule violations. Never retried.
     */
    FATAL
}
