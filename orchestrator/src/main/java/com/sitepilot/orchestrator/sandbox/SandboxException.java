package com.sitepilot.orchestrator.sandbox;

/**
 * Thrown when the sandbox executor returns an error or is unreachable.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
