package com.sitepilot.orchestrator.sandbox.dto;

/**
 * Request body for POST /sandboxes/{id}/files/read.
 */
public record FileReadRequest(String path) {}
