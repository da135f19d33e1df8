package com.sitepilot.orchestrator.sandbox.dto;

/**
 * Request body for POST /sandboxes/{id}/commands/run.
 * The executor kills the command after timeout_sec.
 */
public record RunCommandRequest(String command, long timeout_sec) {}
