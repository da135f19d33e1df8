package com.sitepilot.orchestrator.sandbox.dto;

/**
 * Request body for POST /sandboxes/{id}/files/write.
 */
public record FileWriteRequest(String path, String content) {}
