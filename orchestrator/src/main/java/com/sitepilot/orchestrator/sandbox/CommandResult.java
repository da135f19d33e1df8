package com.sitepilot.orchestrator.sandbox;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Output of one command run inside a sandbox.
 * Field names match the executor's JSON response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandResult(
        int exit_code,
        String stdout,
        String stderr
) {
    /** True if the command exited with status 0. */
    public boolean success() {
        return exit_code == 0;
    }

    public String stdoutOrEmpty() {
        return stdout == null ? "" : stdout;
    }

    /** Short human-readable summary used in log lines and error messages. */
    public String summary() {
        StringBuilder sb = new StringBuilder("exit_code=").append(exit_code);
        if (stderr != null && !stderr.isBlank()) {
            String s = stderr.strip();
            sb.append(" stderr=").append(s.length() > 300 ? s.substring(0, 300) + "..." : s);
        }
        return sb.toString();
    }
}
