package com.sitepilot.orchestrator.api.dto;

import com.sitepilot.orchestrator.model.GenerationRun;
import com.sitepilot.orchestrator.model.RunKind;
import com.sitepilot.orchestrator.model.RunState;

import java.time.Instant;
import java.util.UUID;

/**
 * A run as returned by the API. The file snapshot is left out; restore by id.
 */
public record GenerationRunResponse(
        UUID     id,
        String   sessionId,
        RunKind  kind,
        RunState state,
        Boolean  success,
        String   url,
        String   error,
        boolean  sandboxFailed,
        String   failureKind,
        int      attempts,
        UUID     restoredFrom,
        Instant  createdAt,
        Instant  startedAt,
        Instant  finishedAt
) {
    public static GenerationRunResponse from(GenerationRun r) {
        return new GenerationRunResponse(
                r.getId(),
                r.getSessionId(),
                r.getKind(),
                r.getState(),
                r.getSuccess(),
                r.getUrl(),
                r.getError(),
                r.isSandboxFailed(),
                r.getFailureKind(),
                r.getAttempts(),
                r.getRestoredFrom(),
                r.getCreatedAt(),
                r.getStartedAt(),
                r.getFinishedAt()
        );
    }
}
