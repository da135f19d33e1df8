package com.sitepilot.orchestrator.validation;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one validation pass.
 *
 * @param fileContents the project files read during validation
 *                     (project-relative path to content), reused when
 *                     preparing targeted corrections
 */
public record ValidationReport(List<ValidationError> errors, Map<String, String> fileContents) {

    public ValidationReport {
        errors       = List.copyOf(errors);
        fileContents = Map.copyOf(fileContents);
    }

    public boolean isClean() {
        return errors.isEmpty();
    }

    /** One line per error, used as the failure summary. */
    public String summary() {
        if (errors.isEmpty()) return "no errors";
        StringBuilder sb = new StringBuilder();
        sb.append(errors.size()).append(" error(s)");
        for (ValidationError e : errors) {
            sb.append("\n- ").append(e.describe());
        }
        return sb.toString();
    }
}
