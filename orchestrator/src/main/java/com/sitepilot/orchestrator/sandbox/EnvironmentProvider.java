package com.sitepilot.orchestrator.sandbox;

import java.time.Duration;

/**
 * Creates remote execution environments.
 */
public interface EnvironmentProvider {

    /**
     * Create and start a new environment that lives for at most {@code timeout}.
     *
     * @throws TimeoutRejectedException if the provider does not accept the timeout
     * @throws SandboxException         on any other creation failure
     */
    EnvironmentHandle create(Duration timeout);

    /** Largest timeout the provider accepts. */
    Duration maxTimeout();
}
