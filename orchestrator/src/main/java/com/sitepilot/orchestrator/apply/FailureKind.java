package com.sitepilot.orchestrator.apply;

public enum FailureKind {
    /** The code was applied but is broken. Recoverable by correction. */
    VALIDATION_FAILED,
    /** The sandbox or executor failed. */
    INFRASTRUCTURE_ERROR,
    /** The request or payload was unusable (no baseline for an edit, bad paths, no files). */
    CONTRACT_VIOLATION
}
