package com.sitepilot.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepilot.orchestrator.apply.FailureKind;
import com.sitepilot.orchestrator.config.OrchestratorProperties;
import com.sitepilot.orchestrator.model.GenerationRun;
import com.sitepilot.orchestrator.model.RunKind;
import com.sitepilot.orchestrator.model.RunState;
import com.sitepilot.orchestrator.repository.GenerationRunRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GenerationService.
 *
 * The repository and the orchestrator are mocked; no Spring context, no
 * database, no sandbox.
 */
@ExtendWith(MockitoExtension.class)
class GenerationServiceTest {

    @Mock GenerationRunRepository runRepo;
    @Mock GenerationOrchestrator  orchestrator;

    final ObjectMapper json = new ObjectMapper();
    final Map<UUID, GenerationRun> store = new ConcurrentHashMap<>();

    GenerationService service;

    @BeforeEach
    void setUp() {
        service = new GenerationService(runRepo, orchestrator, json, new OrchestratorProperties());
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    /** Repository backed by {@link #store}; save assigns ids like the database would. */
    private void inMemoryRepository() {
        when(runRepo.save(any())).thenAnswer(inv -> {
            GenerationRun r = inv.getArgument(0);
            if (r.getId() == null) r.setId(UUID.randomUUID());
            store.put(r.getId(), r);
            return r;
        });
        when(runRepo.findById(any())).thenAnswer(inv -> Optional.ofNullable(store.get(inv.<UUID>getArgument(0))));
    }

    private GenerationRun storedRun(String sessionId, RunKind kind) {
        GenerationRun run = new GenerationRun(sessionId, kind, "A bakery landing page");
        run.setId(UUID.randomUUID());
        store.put(run.getId(), run);
        return run;
    }

    private static GenerationOutcome success(Map<String, String> files) {
        return GenerationOutcome.succeeded("https://5173-sbx-1.sandbox.test", 1, files);
    }

    // ------------------------------------------------------------------
    // execute()
    // ------------------------------------------------------------------

    @Test
    void execute_success_storesUrlAndFiles() throws Exception {
        inMemoryRepository();
        GenerationRun run = storedRun("s1", RunKind.GENERATE);
        when(orchestrator.handle(any())).thenReturn(success(Map.of("src/App.jsx", "app")));

        service.execute(run.getId(), GenerationRequest.generate("s1", run.getPrompt()));

        assertThat(run.getState()).isEqualTo(RunState.SUCCEEDED);
        assertThat(run.getUrl()).isEqualTo("https://5173-sbx-1.sandbox.test");
        assertThat(run.getStartedAt()).isNotNull();
        assertThat(json.readTree(run.getFilesJson()).get("src/App.jsx").asText()).isEqualTo("app");
    }

    @Test
    void execute_failedOutcome_recordsKindWithoutFiles() {
        inMemoryRepository();
        GenerationRun run = storedRun("s1", RunKind.GENERATE);
        when(orchestrator.handle(any())).thenReturn(GenerationOutcome.failed(
                FailureKind.VALIDATION_FAILED, "still broken", "https://x", true, 5, List.of()));

        service.execute(run.getId(), GenerationRequest.generate("s1", run.getPrompt()));

        assertThat(run.getState()).isEqualTo(RunState.FAILED);
        assertThat(run.getFailureKind()).isEqualTo("VALIDATION_FAILED");
        assertThat(run.isSandboxFailed()).isTrue();
        assertThat(run.getAttempts()).isEqualTo(5);
        assertThat(run.getFilesJson()).isNull();
    }

    @Test
    void execute_cancelled_marksRunCancelled() {
        inMemoryRepository();
        GenerationRun run = storedRun("s1", RunKind.GENERATE);
        when(orchestrator.handle(any())).thenThrow(new CancellationException("Request cancelled"));

        service.execute(run.getId(), GenerationRequest.generate("s1", run.getPrompt()));

        assertThat(run.getState()).isEqualTo(RunState.CANCELLED);
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
    }

    @Test
    void execute_unexpectedException_marksRunFailed() {
        inMemoryRepository();
        GenerationRun run = storedRun("s1", RunKind.GENERATE);
        when(orchestrator.handle(any())).thenThrow(new IllegalStateException("boom"));

        service.execute(run.getId(), GenerationRequest.generate("s1", run.getPrompt()));

        assertThat(run.getState()).isEqualTo(RunState.FAILED);
        assertThat(run.getError()).contains("boom");
    }

    @Test
    void execute_runNoLongerQueued_skipped() {
        GenerationRun run = storedRun("s1", RunKind.GENERATE);
        run.markCancelled("Superseded by a newer request");
        when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));

        service.execute(run.getId(), GenerationRequest.generate("s1", run.getPrompt()));

        verify(orchestrator, never()).handle(any());
        verify(runRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // submit() / restore()
    // ------------------------------------------------------------------

    @Test
    void submit_edit_runsEditRequestOnWorker() {
        inMemoryRepository();
        when(orchestrator.handle(any())).thenReturn(success(Map.of()));

        GenerationRun run = service.submit("s1", RunKind.EDIT, "Make the title amber");

        verify(orchestrator, timeout(2000)).handle(argThat(r ->
                r.kind() == RunKind.EDIT && r.prompt().equals("Make the title amber")));
        verify(runRepo, timeout(2000).times(3)).save(any());
        assertThat(run.getState()).isEqualTo(RunState.SUCCEEDED);
    }

    @Test
    void submit_restoreKind_rejected() {
        assertThatThrownBy(() -> service.submit("s1", RunKind.RESTORE, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void submit_secondRequestForSession_cancelsFirst() throws Exception {
        inMemoryRepository();
        CountDownLatch firstStarted = new CountDownLatch(1);
        when(orchestrator.handle(any())).thenAnswer(inv -> {
            GenerationRequest request = inv.getArgument(0);
            if (request.prompt().equals("first")) {
                firstStarted.countDown();
                try {
                    new CountDownLatch(1).await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Request cancelled");
                }
            }
            return success(Map.of());
        });

        GenerationRun first = service.submit("s1", RunKind.GENERATE, "first");
        assertThat(firstStarted.await(5, TimeUnit.SECONDS)).isTrue();
        GenerationRun second = service.submit("s1", RunKind.GENERATE, "second");

        verify(runRepo, timeout(5000).times(6)).save(any());
        assertThat(first.getState()).isEqualTo(RunState.CANCELLED);
        assertThat(second.getState()).isEqualTo(RunState.SUCCEEDED);
        verify(runRepo).cancelIfQueued(eq(first.getId()), eq(RunState.QUEUED), eq(RunState.CANCELLED), any(), any());
    }

    @Test
    void restore_successfulRun_reappliesItsFiles() {
        inMemoryRepository();
        GenerationRun source = storedRun("s1", RunKind.GENERATE);
        source.finish(true, "https://x", null, false, null, 1, "{\"src/App.jsx\":\"v1\"}");
        when(orchestrator.handle(any())).thenReturn(success(Map.of("src/App.jsx", "v1")));

        GenerationRun run = service.restore("s1", source.getId());

        assertThat(run.getKind()).isEqualTo(RunKind.RESTORE);
        assertThat(run.getRestoredFrom()).isEqualTo(source.getId());
        verify(orchestrator, timeout(2000)).handle(argThat(r ->
                r.kind() == RunKind.RESTORE && r.restoreFiles().equals(Map.of("src/App.jsx", "v1"))));
    }

    @Test
    void restore_runOfAnotherSession_notFound() {
        GenerationRun source = storedRun("other", RunKind.GENERATE);
        when(runRepo.findById(source.getId())).thenReturn(Optional.of(source));

        assertThatThrownBy(() -> service.restore("s1", source.getId()))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void restore_failedRun_rejected() {
        GenerationRun source = storedRun("s1", RunKind.GENERATE);
        source.finish(false, null, "broken", true, "VALIDATION_FAILED", 5, null);
        when(runRepo.findById(source.getId())).thenReturn(Optional.of(source));

        assertThatThrownBy(() -> service.restore("s1", source.getId()))
                .isInstanceOf(IllegalStateException.class);
    }
}
