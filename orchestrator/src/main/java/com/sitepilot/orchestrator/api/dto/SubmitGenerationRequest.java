package com.sitepilot.orchestrator.api.dto;

import com.sitepilot.orchestrator.model.RunKind;

/**
 * Request body for POST /sessions/{sessionId}/generations.
 *
 * mode is GENERATE (default) or EDIT.
 */
public record SubmitGenerationRequest(String prompt, RunKind mode) {

    public SubmitGenerationRequest {
        if (mode == null) mode = RunKind.GENERATE;
    }
}
