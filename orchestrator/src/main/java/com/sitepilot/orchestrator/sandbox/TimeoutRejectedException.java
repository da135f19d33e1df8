package com.sitepilot.orchestrator.sandbox;

import java.time.Duration;

/**
 * The provider refused to create an environment because the requested
 * lifetime is outside the range it accepts.
 */
public class TimeoutRejectedException extends SandboxException {

    private final Duration requested;

    public TimeoutRejectedException(Duration requested, String detail) {
        super("Sandbox timeout " + requested.toSeconds() + "s rejected: " + detail);
        this.requested = requested;
    }

    public Duration requested() { return requested; }
}
