package com.sitepilot.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepilot.orchestrator.config.OrchestratorProperties;
import com.sitepilot.orchestrator.model.GenerationRun;
import com.sitepilot.orchestrator.model.RunKind;
import com.sitepilot.orchestrator.model.RunState;
import com.sitepilot.orchestrator.repository.GenerationRunRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Accepts requests, records them as {@link GenerationRun}s and runs them on
 * a fixed worker pool.
 *
 * At most one run per session is live: a new request for a session cancels
 * the one in flight (interrupting its worker) before queueing itself. The
 * session lock inside {@link GenerationOrchestrator} keeps the two from
 * overlapping on the sandbox.
 */
@Service
public class GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    private static final String SUPERSEDED = "Superseded by a newer request";

    private record InFlight(UUID runId, Future<?> future) {}

    private final GenerationRunRepository runRepo;
    private final GenerationOrchestrator  orchestrator;
    private final ObjectMapper            objectMapper;
    private final ExecutorService         workers;

    private final ConcurrentHashMap<String, InFlight> inFlight = new ConcurrentHashMap<>();

    public GenerationService(GenerationRunRepository runRepo,
                             GenerationOrchestrator orchestrator,
                             ObjectMapper objectMapper,
                             OrchestratorProperties properties) {
        this.runRepo      = runRepo;
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
        this.workers      = Executors.newFixedThreadPool(properties.getWorkers());
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /** Queue a GENERATE or EDIT request. */
    public GenerationRun submit(String sessionId, RunKind kind, String prompt) {
        if (kind == RunKind.RESTORE) {
            throw new IllegalArgumentException("Use restore() for RESTORE runs");
        }
        GenerationRun run = runRepo.save(new GenerationRun(sessionId, kind, prompt));
        GenerationRequest request = kind == RunKind.EDIT
                ? GenerationRequest.edit(sessionId, prompt)
                : GenerationRequest.generate(sessionId, prompt);
        dispatch(run, request);
        return run;
    }

    /**
     * Queue a re-apply of the files of an earlier successful run of the
     * same session.
     *
     * @throws NoSuchElementException if the run does not exist in this session
     * @throws IllegalStateException  if the run has no files to restore
     */
    public GenerationRun restore(String sessionId, UUID sourceRunId) {
        GenerationRun source = runRepo.findById(sourceRunId)
                .filter(r -> r.getSessionId().equals(sessionId))
                .orElseThrow(() -> new NoSuchElementException("Run not found: " + sourceRunId));
        if (source.getState() != RunState.SUCCEEDED || source.getFilesJson() == null) {
            throw new IllegalStateException("Run " + sourceRunId + " has no successful version to restore");
        }

        Map<String, String> files = readFiles(source.getFilesJson());
        GenerationRun run = new GenerationRun(sessionId, RunKind.RESTORE, null);
        run.setRestoredFrom(sourceRunId);
        run = runRepo.save(run);
        dispatch(run, GenerationRequest.restore(sessionId, files));
        return run;
    }

    @Transactional(readOnly = true)
    public Optional<GenerationRun> findById(UUID id) {
        return runRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public List<GenerationRun> listForSession(String sessionId) {
        return runRepo.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    private void dispatch(GenerationRun run, GenerationRequest request) {
        UUID runId = run.getId();
        String sessionId = run.getSessionId();

        // Register before the task can finish, so its own clean-up finds the entry.
        synchronized (inFlight) {
            Future<?> future = workers.submit(() -> execute(runId, request));
            InFlight previous = inFlight.put(sessionId, new InFlight(runId, future));
            if (previous != null && !previous.future().isDone()) {
                log.info("Run {} supersedes run {} for session {}", runId, previous.runId(), sessionId);
                previous.future().cancel(true);
                runRepo.cancelIfQueued(previous.runId(), RunState.QUEUED, RunState.CANCELLED,
                        SUPERSEDED, Instant.now());
            }
        }
    }

    void execute(UUID runId, GenerationRequest request) {
        MDC.put("runId", runId.toString());
        try {
            GenerationRun run = runRepo.findById(runId).orElse(null);
            if (run == null || run.getState() != RunState.QUEUED) {
                log.info("Run {} no longer queued, skipping", runId);
                return;
            }
            run.markRunning();
            runRepo.save(run);

            try {
                GenerationOutcome outcome = orchestrator.handle(request);
                run.finish(outcome.success(), outcome.url(), outcome.error(), outcome.sandboxFailed(),
                        outcome.failureKind() == null ? null : outcome.failureKind().name(),
                        outcome.attempts(), outcome.success() ? writeFiles(outcome.files()) : null);
            } catch (CancellationException e) {
                // The run is over; clear the flag so the final save can use its connection.
                Thread.interrupted();
                run.markCancelled(SUPERSEDED);
            } catch (RuntimeException e) {
                log.error("Unhandled error in run {}: {}", runId, e.getMessage(), e);
                run.finish(false, null, "Unhandled exception: " + e.getMessage(), false, null, 0, null);
            }
            runRepo.save(run);
            log.info("Run {} {}", runId, run.getState());
        } finally {
            synchronized (inFlight) {
                inFlight.computeIfPresent(request.sessionId(),
                        (id, entry) -> entry.runId().equals(runId) ? null : entry);
            }
            MDC.remove("runId");
        }
    }

    /** True while a run for the session is queued or running. */
    public boolean isBusy(String sessionId) {
        InFlight entry = inFlight.get(sessionId);
        return entry != null && !entry.future().isDone();
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String writeFiles(Map<String, String> files) {
        if (files == null || files.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(files);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize file snapshot: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, String> readFiles(String filesJson) {
        try {
            return objectMapper.readValue(filesJson, new TypeReference<Map<String, String>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored file snapshot is unreadable", e);
        }
    }
}
