package com.sitepilot.orchestrator.service;

import com.sitepilot.orchestrator.model.RunKind;

import java.util.Map;
import java.util.Objects;

/**
 * Input of one {@link GenerationOrchestrator#handle} call.
 *
 * @param restoreFiles files to re-apply for {@link RunKind#RESTORE}; empty otherwise
 */
public record GenerationRequest(
        String sessionId,
        RunKind kind,
        String prompt,
        Map<String, String> restoreFiles
) {
    public GenerationRequest {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(kind, "kind");
        restoreFiles = restoreFiles == null ? Map.of() : Map.copyOf(restoreFiles);
    }

    public static GenerationRequest generate(String sessionId, String prompt) {
        return new GenerationRequest(sessionId, RunKind.GENERATE, prompt, Map.of());
    }

    public static GenerationRequest edit(String sessionId, String prompt) {
        return new GenerationRequest(sessionId, RunKind.EDIT, prompt, Map.of());
    }

    public static GenerationRequest restore(String sessionId, Map<String, String> files) {
        return new GenerationRequest(sessionId, RunKind.RESTORE, null, files);
    }
}
