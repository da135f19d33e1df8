package com.sitepilot.orchestrator.sandbox.dto;

/**
 * Request body for POST /sandboxes on the sandbox executor.
 * template may be null to use the executor's default image.
 */
public record CreateSandboxRequest(long timeout_sec, String template) {}
