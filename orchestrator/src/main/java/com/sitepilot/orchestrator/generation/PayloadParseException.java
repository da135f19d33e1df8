package com.sitepilot.orchestrator.generation;

/** The generator's reply did not contain files in any accepted shape. */
public class PayloadParseException extends RuntimeException {

    public PayloadParseException(String message) {
        super(message);
    }

    public PayloadParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
