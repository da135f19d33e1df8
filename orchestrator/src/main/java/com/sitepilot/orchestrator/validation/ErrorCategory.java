package com.sitepilot.orchestrator.validation;

public enum ErrorCategory {
    STRUCTURAL,
    BUILD,
    DEPENDENCY,
    OTHER
}
