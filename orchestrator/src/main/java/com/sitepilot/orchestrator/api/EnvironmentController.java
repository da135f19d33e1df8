package com.sitepilot.orchestrator.api;

import com.sitepilot.orchestrator.api.dto.EnvironmentStatusResponse;
import com.sitepilot.orchestrator.service.GenerationService;
import com.sitepilot.orchestrator.session.SessionRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Inspect and release session sandboxes.
 *
 * GET    /sessions/{sessionId}/environment  : sandbox status
 * DELETE /sessions/{sessionId}/environment  : terminate the session's sandbox
 * DELETE /sessions/environments             : terminate every sandbox
 */
@RestController
@RequestMapping("/sessions")
public class EnvironmentController {

    private final SessionRegistry   registry;
    private final GenerationService generationService;

    public EnvironmentController(SessionRegistry registry, GenerationService generationService) {
        this.registry          = registry;
        this.generationService = generationService;
    }

    @GetMapping("/{sessionId}/environment")
    public EnvironmentStatusResponse status(@PathVariable String sessionId) {
        return registry.find(sessionId)
                .map(env -> EnvironmentStatusResponse.from(env, generationService.isBusy(sessionId)))
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No environment for session: " + sessionId));
    }

    @DeleteMapping("/{sessionId}/environment")
    public ResponseEntity<Void> release(@PathVariable String sessionId) {
        if (!registry.release(sessionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No environment for session: " + sessionId);
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/environments")
    public Map<String, Integer> releaseAll() {
        return Map.of("released", registry.releaseAll());
    }
}
