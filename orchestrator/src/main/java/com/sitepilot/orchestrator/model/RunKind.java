package com.sitepilot.orchestrator.model;

public enum RunKind {
    /** Build an app from a prompt. */
    GENERATE,
    /** Change the session's current app. */
    EDIT,
    /** Re-apply the files of an earlier successful run. */
    RESTORE
}
