package com.sitepilot.orchestrator.model;

/**
 * Lifecycle of a {@link GenerationRun}.
 *
 *   QUEUED -> RUNNING -> SUCCEEDED | FAILED | CANCELLED
 *
 * A queued run that is superseded before a worker picks it up goes straight
 * to CANCELLED.
 */
public enum RunState {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
