package com.uisafe.model;

/**
 * States of a single {@link com.uisafe.executor.RecoveringInteractor#interact} call.
 *
 *   ATTEMPTING  — the action is being invoked for the first time
 *   RECOVERING  — the first attempt failed recoverably; corrective action and retry pending
 *   DONE        — a terminal success or failure has been reached
 */
public enum RecoveryState {
    ATTEMPTING,
    RECOVERING,
    DONE
}
