package com.sitepilot.orchestrator.apply;

/** Where the loop goes after an apply. */
public enum ApplyTransition {
    VALIDATE,
    RETRY_CYCLE,
    ABORT
}
