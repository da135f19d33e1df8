package com.sitepilot.orchestrator.validation;

/**
 * What kind of defect a {@link ValidationError} describes.
 */
public enum ErrorKind {

    // Structural pass
    UNBALANCED_BRACES(ErrorCategory.STRUCTURAL),
    MISSING_EXPORT(ErrorCategory.STRUCTURAL),
    INVALID_COMPONENT(ErrorCategory.STRUCTURAL),
    MALFORMED_CLASSNAME(ErrorCategory.STRUCTURAL),
    MISSING_IMPORT(ErrorCategory.DEPENDENCY),
    MISSING_FILE(ErrorCategory.STRUCTURAL),
    MISSING_STYLES(ErrorCategory.STRUCTURAL),

    // Build log pass
    BUILD_ERROR(ErrorCategory.BUILD),
    SYNTAX_ERROR(ErrorCategory.BUILD),
    UNDEFINED_SYMBOL(ErrorCategory.BUILD),
    MALFORMED_STYLE(ErrorCategory.BUILD),
    UNRESOLVED_IMPORT(ErrorCategory.DEPENDENCY),

    // Environment
    SERVER_UNREACHABLE(ErrorCategory.OTHER),
    FILE_ACCESS(ErrorCategory.OTHER),

    // Generator reply that held no usable files
    UNPARSEABLE_RESPONSE(ErrorCategory.OTHER);

    private final ErrorCategory category;

    ErrorKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
