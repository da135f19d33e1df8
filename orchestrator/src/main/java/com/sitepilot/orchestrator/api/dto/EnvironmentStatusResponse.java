package com.sitepilot.orchestrator.api.dto;

import com.sitepilot.orchestrator.session.SessionEnvironment;

import java.time.Instant;

/**
 * Response body for GET /sessions/{sessionId}/environment.
 */
public record EnvironmentStatusResponse(
        String  sessionId,
        String  sandboxId,
        Instant createdAt,
        boolean projectSetupDone,
        boolean hasBaseline,
        String  url,
        boolean busy
) {
    public static EnvironmentStatusResponse from(SessionEnvironment env, boolean busy) {
        return new EnvironmentStatusResponse(
                env.getSessionId(),
                env.getHandle().id(),
                env.getCreatedAt(),
                env.isProjectSetupDone(),
                env.hasBaseline(),
                env.getLastUrl(),
                busy
        );
    }
}
