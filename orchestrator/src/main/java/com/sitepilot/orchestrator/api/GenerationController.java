package com.sitepilot.orchestrator.api;

import com.sitepilot.orchestrator.api.dto.GenerationRunResponse;
import com.sitepilot.orchestrator.api.dto.SubmitGenerationRequest;
import com.sitepilot.orchestrator.model.GenerationRun;
import com.sitepilot.orchestrator.model.RunKind;
import com.sitepilot.orchestrator.service.GenerationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * REST API for generation runs.
 *
 * POST /sessions/{sessionId}/generations                  : generate or edit an app
 * POST /sessions/{sessionId}/generations/{runId}/restore  : re-apply an earlier version
 * GET  /sessions/{sessionId}/generations                  : runs of a session, newest first
 * GET  /generations/{id}                                  : poll one run
 */
@RestController
public class GenerationController {

    private final GenerationService generationService;

    public GenerationController(GenerationService generationService) {
        this.generationService = generationService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/sessions/s-42/generations \
     *     -H "Content-Type: application/json" \
     *     -d '{"prompt":"A landing page for a coffee shop"}'
     */
    @PostMapping("/sessions/{sessionId}/generations")
    public ResponseEntity<GenerationRunResponse> submit(@PathVariable String sessionId,
                                                        @RequestBody SubmitGenerationRequest req) {
        if (req.prompt() == null || req.prompt().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "prompt is required");
        }
        if (req.mode() == RunKind.RESTORE) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Use POST /sessions/{sessionId}/generations/{runId}/restore");
        }
        GenerationRun run = generationService.submit(sessionId, req.mode(), req.prompt());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(GenerationRunResponse.from(run));
    }

    @PostMapping("/sessions/{sessionId}/generations/{runId}/restore")
    public ResponseEntity<GenerationRunResponse> restore(@PathVariable String sessionId,
                                                         @PathVariable UUID runId) {
        try {
            GenerationRun run = generationService.restore(sessionId, runId);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(GenerationRunResponse.from(run));
        } catch (NoSuchElementException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @GetMapping("/sessions/{sessionId}/generations")
    public List<GenerationRunResponse> list(@PathVariable String sessionId) {
        return generationService.listForSession(sessionId).stream()
                .map(GenerationRunResponse::from)
                .toList();
    }

    /**
     * Poll one run. Returns 404 if the id is not found.
     */
    @GetMapping("/generations/{id}")
    public GenerationRunResponse get(@PathVariable UUID id) {
        return generationService.findById(id)
                .map(GenerationRunResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
