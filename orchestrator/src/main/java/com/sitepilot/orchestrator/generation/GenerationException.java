package com.sitepilot.orchestrator.generation;

/**
 * Thrown when the code generation service cannot produce a reply.
 * {@code statusCode} is the HTTP status, or 0 for transport failures.
 */
public class GenerationException extends RuntimeException {

    private final int statusCode;

    public GenerationException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int statusCode() {
        return statusCode;
    }

    /** Rate limits and overload are worth another try; client errors are not. */
    public boolean isRetryable() {
        return statusCode == 429 || statusCode == 529 || statusCode >= 500 || statusCode == 0;
    }
}
