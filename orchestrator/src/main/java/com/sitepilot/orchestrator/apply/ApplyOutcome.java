package com.sitepilot.orchestrator.apply;

import com.sitepilot.orchestrator.validation.ValidationError;

import java.util.List;

/**
 * Result of one apply.
 *
 * @param url         public URL of the running app; null if no server came up
 *                    or the apply did not reach the start step
 * @param applyErrors defects found while applying (post-flight check, failed
 *                    writes); fed to the correction loop on RETRY_CYCLE
 */
public record ApplyOutcome(
        ApplyTransition transition,
        String url,
        List<ValidationError> applyErrors,
        FailureKind failureKind,
        String error
) {
    public ApplyOutcome {
        applyErrors = applyErrors == null ? List.of() : List.copyOf(applyErrors);
    }

    public static ApplyOutcome validate(String url) {
        return new ApplyOutcome(ApplyTransition.VALIDATE, url, List.of(), null, null);
    }

    public static ApplyOutcome retry(FailureKind kind, String error, List<ValidationError> applyErrors) {
        return new ApplyOutcome(ApplyTransition.RETRY_CYCLE, null, applyErrors, kind, error);
    }

    public static ApplyOutcome abort(FailureKind kind, String error) {
        return new ApplyOutcome(ApplyTransition.ABORT, null, List.of(), kind, error);
    }
}
