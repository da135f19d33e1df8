package com.sitepilot.orchestrator.sandbox;

import java.time.Duration;

/**
 * Capability to act on one remote execution environment.
 *
 * A handle is owned by exactly one session entry and is never shared
 * across sessions. All methods block on remote I/O; an interrupted caller
 * sees a {@link java.util.concurrent.CancellationException}.
 */
public interface EnvironmentHandle {

    /** Provider-assigned identifier, stable for the lifetime of the environment. */
    String id();

    /**
     * Read a file.
     *
     * @throws SandboxException if the file does not exist or the executor fails
     */
    String readFile(String path);

    void writeFile(String path, String content);

    /** Run a shell command with an explicit wall-clock limit. */
    CommandResult run(String command, Duration timeout);

    /** Public https URL routing to the given port inside the environment. */
    String resolvePublicUrl(int port);

    /** Kill the remote environment. Further calls on this handle fail. */
    void terminate();
}
