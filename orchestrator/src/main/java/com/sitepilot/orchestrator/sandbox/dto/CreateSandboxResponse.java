package com.sitepilot.orchestrator.sandbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /sandboxes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateSandboxResponse(String sandbox_id) {}
