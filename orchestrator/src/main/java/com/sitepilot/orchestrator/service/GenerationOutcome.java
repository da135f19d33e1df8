package com.sitepilot.orchestrator.service;

import com.sitepilot.orchestrator.apply.FailureKind;
import com.sitepilot.orchestrator.validation.ValidationError;

import java.util.List;
import java.util.Map;

/**
 * Final result of a request.
 *
 * @param url           the app URL; on failure the last URL that came up, if any
 * @param sandboxFailed true when the sandbox could not be set up or the
 *                      correction budget ran out
 * @param files         the project as it stands after a successful run
 */
public record GenerationOutcome(
        boolean success,
        String url,
        String error,
        boolean sandboxFailed,
        FailureKind failureKind,
        int attempts,
        List<ValidationError> errors,
        Map<String, String> files
) {
    public GenerationOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
        files  = files == null ? Map.of() : files;
    }

    static GenerationOutcome succeeded(String url, int attempts, Map<String, String> files) {
        return new GenerationOutcome(true, url, null, false, null, attempts, List.of(), files);
    }

    static GenerationOutcome failed(FailureKind kind, String error, String url, boolean sandboxFailed,
                                    int attempts, List<ValidationError> errors) {
        return new GenerationOutcome(false, url, error, sandboxFailed, kind, attempts, errors, Map.of());
    }
}
