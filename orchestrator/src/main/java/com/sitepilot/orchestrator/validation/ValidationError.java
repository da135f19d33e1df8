package com.sitepilot.orchestrator.validation;

import java.util.Objects;

/**
 * One defect found by validation.
 *
 * @param file                 project-relative path, or null when the defect
 *                             could not be attributed to a file
 * @param line                 1-based, 0 when unknown
 * @param column               1-based, 0 when unknown
 * @param module               import specifier for unresolved imports
 * @param missingComponentPath project-relative path of a component file that
 *                             an import expects but that does not exist
 */
public record ValidationError(
        ErrorKind kind,
        String message,
        String file,
        int line,
        int column,
        Severity severity,
        String module,
        String missingComponentPath
) {
    public ValidationError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
    }

    public static ValidationError of(ErrorKind kind, Severity severity, String file, String message) {
        return new ValidationError(kind, message, file, 0, 0, severity, null, null);
    }

    public static ValidationError at(ErrorKind kind, Severity severity, String file,
                                     int line, int column, String message) {
        return new ValidationError(kind, message, file, line, column, severity, null, null);
    }

    public ErrorCategory category() {
        return kind.category();
    }

    public boolean hasLocation() {
        return file != null;
    }

    /** {@code src/App.jsx:4:25 [HIGH] message} */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(file == null ? "(unknown file)" : file);
        if (line > 0) {
            sb.append(':').append(line);
            if (column > 0) sb.append(':').append(column);
        }
        sb.append(" [").append(severity).append("] ").append(kind).append(": ").append(message);
        return sb.toString();
    }
}
