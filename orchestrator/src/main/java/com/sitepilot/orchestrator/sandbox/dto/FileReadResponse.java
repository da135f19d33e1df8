package com.sitepilot.orchestrator.sandbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /sandboxes/{id}/files/read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileReadResponse(String path, String content) {}
