package com.sitepilot.orchestrator.apply;

/**
 * A parsed generation ready to be applied.
 *
 * @param sourcePayload the raw generator output, kept for diagnostics
 * @param attempt       1-based attempt number within the request
 */
public record GenerationResult(
        String sourcePayload,
        ApplyMode mode,
        int attempt,
        GenerationPayload payload
) {}
