package com.sitepilot.orchestrator.correction;

import com.sitepilot.orchestrator.validation.ValidationError;

import java.util.List;

/**
 * One file the next targeted correction should rewrite.
 *
 * @param currentContent what the file holds now; empty for files to create
 * @param create         true when an import expects the file but it does not exist
 */
public record FileCorrection(
        String path,
        String currentContent,
        List<ValidationError> errors,
        boolean create
) {
    public FileCorrection {
        errors = List.copyOf(errors);
    }
}
