package com.uisafe.model;

/**
 * How a {@link com.uisafe.executor.FailureClassifier} sees a failed interaction attempt.
 *
 *   RECOVERABLE    — eligible for the policy's corrective action and one retry
 *   UNRECOVERABLE  — propagated to the caller immediately, untouched
 */
public enum FailureKind {
    RECOVERABLE,
    UNRECOVERABLE
}
