package com.sitepilot.orchestrator.apply;

/**
 * How a generated payload is applied to a sandbox.
 */
public enum ApplyMode {
    /** Fresh project: scaffold, install, write everything, start the server. */
    INITIAL_GENERATION,
    /** Targeted fix of files that failed validation; restart only. */
    CORRECTION,
    /** User-requested change on top of the last good code. */
    EDIT
}
