package com.sitepilot.orchestrator.sandbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from GET /sandboxes/{id}/host?port=N.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HostResponse(String host) {}
