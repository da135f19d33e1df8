package com.sitepilot.orchestrator.config;

import java.time.Duration;

/** Defaults with the waits taken out, for unit tests. */
public final class TestProperties {

    private TestProperties() {}

    public static OrchestratorProperties fast() {
        OrchestratorProperties props = new OrchestratorProperties();
        props.getServer().setReadinessAttempts(3);
        props.getServer().setReadinessBackoff(Duration.ZERO);
        return props;
    }
}
