package com.sitepilot.orchestrator.validation;

/** Ordered from most to least severe. Every severity fails validation. */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM
}
