package com.sitepilot.orchestrator.service;

import com.sitepilot.orchestrator.apply.ApplyMode;
import com.sitepilot.orchestrator.apply.ApplyOutcome;
import com.sitepilot.orchestrator.apply.CodeApplicationStateMachine;
import com.sitepilot.orchestrator.apply.FailureKind;
import com.sitepilot.orchestrator.apply.GenerationPayload;
import com.sitepilot.orchestrator.apply.GenerationResult;
import com.sitepilot.orchestrator.correction.CorrectionAttemptCounter;
import com.sitepilot.orchestrator.correction.CorrectionLoopController;
import com.sitepilot.orchestrator.correction.CorrectionPlanner;
import com.sitepilot.orchestrator.correction.CorrectionRoute;
import com.sitepilot.orchestrator.correction.FileCorrection;
import com.sitepilot.orchestrator.generation.CodeGenerationClient;
import com.sitepilot.orchestrator.generation.GenerationException;
import com.sitepilot.orchestrator.generation.GenerationPayloadParser;
import com.sitepilot.orchestrator.generation.GenerationPrompts;
import com.sitepilot.orchestrator.generation.PayloadParseException;
import com.sitepilot.orchestrator.lifecycle.ProjectSnapshotter;
import com.sitepilot.orchestrator.model.RunKind;
import com.sitepilot.orchestrator.sandbox.SandboxException;
import com.sitepilot.orchestrator.session.Cancellation;
import com.sitepilot.orchestrator.session.SessionEnvironment;
import com.sitepilot.orchestrator.session.SessionLocks;
import com.sitepilot.orchestrator.session.SessionRegistry;
import com.sitepilot.orchestrator.validation.ErrorKind;
import com.sitepilot.orchestrator.validation.Severity;
import com.sitepilot.orchestrator.validation.ValidationError;
import com.sitepilot.orchestrator.validation.ValidationReport;
import com.sitepilot.orchestrator.validation.ValidationEngine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The generate, apply, validate, correct loop for one request.
 *
 * <pre>
 *   resolve sandbox
 *     -> generate (or take the restore files)
 *     -> apply -> validate -> route
 *          SUCCESS              done, project becomes the edit baseline
 *          TARGETED_CORRECTION  regenerate only the broken files
 *          FULL_REGENERATION    start over from the original request
 *          TERMINATE            give up, report the last errors
 * </pre>
 *
 * The session lock is held for the whole loop, so requests for one session
 * run one at a time while other sessions proceed in parallel. An interrupt
 * (a newer request superseded this one) surfaces as a
 * {@link CancellationException}.
 */
@Component
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private enum Stage { FIRST, CORRECT, REGENERATE }

    private final SessionLocks                locks;
    private final SessionRegistry             registry;
    private final CodeGenerationClient        generator;
    private final GenerationPayloadParser     parser;
    private final GenerationPrompts           prompts;
    private final CodeApplicationStateMachine applier;
    private final ValidationEngine            validator;
    private final CorrectionPlanner           planner;
    private final CorrectionLoopController    controller;
    private final ProjectSnapshotter          snapshotter;
    private final MeterRegistry               meters;

    public GenerationOrchestrator(SessionLocks locks,
                                  SessionRegistry registry,
                                  CodeGenerationClient generator,
                                  GenerationPayloadParser parser,
                                  GenerationPrompts prompts,
                                  CodeApplicationStateMachine applier,
                                  ValidationEngine validator,
                                  CorrectionPlanner planner,
                                  CorrectionLoopController controller,
                                  ProjectSnapshotter snapshotter,
                                  MeterRegistry meters) {
        this.locks       = locks;
        this.registry    = registry;
        this.generator   = generator;
        this.parser      = parser;
        this.prompts     = prompts;
        this.applier     = applier;
        this.validator   = validator;
        this.planner     = planner;
        this.controller  = controller;
        this.snapshotter = snapshotter;
        this.meters      = meters;
    }

    public GenerationOutcome handle(GenerationRequest request) {
        String sessionId = request.sessionId();
        ReentrantLock lock = locks.lockFor(sessionId);
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Cancelled while waiting for session " + sessionId);
        }

        MDC.put("sessionId", sessionId);
        Timer.Sample sample = Timer.start(meters);
        String status = "failure";
        try {
            GenerationOutcome outcome = runLoop(request);
            status = outcome.success() ? "success" : "failure";
            log.info("{} for session {} finished: success={} attempts={} url={}",
                    request.kind(), sessionId, outcome.success(), outcome.attempts(), outcome.url());
            return outcome;
        } catch (CancellationException e) {
            status = "cancelled";
            log.info("{} for session {} cancelled", request.kind(), sessionId);
            throw e;
        } finally {
            sample.stop(meters.timer("sitepilot.generation.duration", "kind", request.kind().name()));
            meters.counter("sitepilot.generation.outcomes", "status", status).increment();
            MDC.remove("attempt");
            MDC.remove("sessionId");
            lock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Loop
    // -------------------------------------------------------------------------

    private GenerationOutcome runLoop(GenerationRequest request) {
        SessionEnvironment environment;
        try {
            environment = registry.resolve(request.sessionId()).environment();
        } catch (SandboxException e) {
            log.error("No sandbox for session {}: {}", request.sessionId(), e.getMessage(), e);
            return GenerationOutcome.failed(FailureKind.INFRASTRUCTURE_ERROR,
                    "Could not create the app environment: " + e.getMessage(), null, true, 0, List.of());
        }

        if (request.kind() == RunKind.EDIT && !environment.hasBaseline()) {
            return GenerationOutcome.failed(FailureKind.CONTRACT_VIOLATION,
                    "There is no existing app to edit in this session", null, false, 0, List.of());
        }
        if (request.kind() == RunKind.RESTORE && request.restoreFiles().isEmpty()) {
            return GenerationOutcome.failed(FailureKind.CONTRACT_VIOLATION,
                    "Nothing to restore", null, false, 0, List.of());
        }

        CorrectionAttemptCounter counter    = new CorrectionAttemptCounter();
        Stage                    stage      = Stage.FIRST;
        List<ValidationError>    lastErrors = List.of();
        Map<String, String>      lastFiles  = Map.of();
        String                   bestUrl    = null;

        for (int attempt = 1; ; attempt++) {
            Cancellation.checkpoint();
            MDC.put("attempt", String.valueOf(attempt));

            CorrectionRoute route;
            GenerationResult result;
            try {
                result = produce(request, environment, stage, attempt, lastErrors, lastFiles);
            } catch (GenerationException e) {
                log.error("Code generation failed: {}", e.getMessage());
                return GenerationOutcome.failed(FailureKind.INFRASTRUCTURE_ERROR,
                        "Code generation failed: " + e.getMessage(), bestUrl, false, attempt, lastErrors);
            } catch (PayloadParseException e) {
                log.warn("Unusable generation response: {}", e.getMessage());
                result = null;
                lastErrors = List.of(ValidationError.of(ErrorKind.UNPARSEABLE_RESPONSE, Severity.CRITICAL,
                        null, e.getMessage()));
            }

            if (result == null) {
                route = controller.recordFailure(counter);
            } else {
                ApplyOutcome applied = applier.apply(environment, result);
                switch (applied.transition()) {
                    case ABORT -> {
                        return GenerationOutcome.failed(applied.failureKind(), applied.error(), bestUrl,
                                applied.failureKind() == FailureKind.INFRASTRUCTURE_ERROR, attempt, lastErrors);
                    }
                    case RETRY_CYCLE -> {
                        lastErrors = applied.applyErrors();
                        route = controller.recordFailure(counter);
                    }
                    case VALIDATE -> {
                        if (applied.url() != null) {
                            bestUrl = applied.url();
                        }
                        ValidationReport report = validator.validate(environment.getHandle(), applied.url());
                        lastErrors = report.errors();
                        lastFiles  = report.fileContents();
                        route = controller.route(report, counter);
                    }
                    default -> throw new IllegalStateException("Unknown transition " + applied.transition());
                }
            }

            meters.counter("sitepilot.correction.routes", "route", route.name()).increment();
            switch (route) {
                case SUCCESS -> {
                    return GenerationOutcome.succeeded(bestUrl, attempt, captureBaseline(environment));
                }
                case TERMINATE -> {
                    String summary = new ValidationReport(lastErrors, Map.of()).summary();
                    return GenerationOutcome.failed(FailureKind.VALIDATION_FAILED,
                            "App still has errors after " + counter.total() + " attempts: " + summary,
                            bestUrl, true, attempt, lastErrors);
                }
                case TARGETED_CORRECTION -> stage = Stage.CORRECT;
                case FULL_REGENERATION   -> stage = Stage.REGENERATE;
            }
        }
    }

    /**
     * Build the next payload to apply.
     *
     * @throws GenerationException   if the generator call fails
     * @throws PayloadParseException if its reply holds no files
     */
    private GenerationResult produce(GenerationRequest request, SessionEnvironment environment, Stage stage,
                                     int attempt, List<ValidationError> lastErrors,
                                     Map<String, String> lastFiles) {
        ApplyMode followUp = environment.isProjectSetupDone() ? ApplyMode.CORRECTION : ApplyMode.INITIAL_GENERATION;

        if (request.kind() == RunKind.RESTORE && stage != Stage.CORRECT) {
            log.info("Restoring {} file(s)", request.restoreFiles().size());
            return new GenerationResult(null, followUp, attempt, GenerationPayload.of(request.restoreFiles()));
        }

        String text;
        ApplyMode mode;
        switch (stage) {
            case FIRST -> {
                if (request.kind() == RunKind.EDIT) {
                    text = generator.generate(prompts.generateSystem(),
                            prompts.edit(request.prompt(), environment.getBaseline()));
                    mode = ApplyMode.EDIT;
                } else {
                    text = generator.generate(prompts.generateSystem(), prompts.initial(request.prompt()));
                    mode = ApplyMode.INITIAL_GENERATION;
                }
            }
            case CORRECT -> {
                List<FileCorrection> corrections = planner.prepareTargetedCorrections(lastErrors, lastFiles);
                log.info("Targeted correction of {} file(s), categories {}",
                        corrections.size(), planner.categorize(lastErrors).keySet());
                text = generator.generate(prompts.correctionSystem(),
                        prompts.correction(describe(request), corrections,
                                planner.errorReport(lastErrors), planner.fixSuggestions(lastErrors)));
                mode = followUp;
            }
            case REGENERATE -> {
                String errorReport = planner.errorReport(lastErrors);
                log.info("Regenerating from the original request");
                if (request.kind() == RunKind.EDIT) {
                    text = generator.generate(prompts.generateSystem(),
                            prompts.edit(request.prompt() + "\n\nA previous attempt failed with:\n" + errorReport,
                                    environment.getBaseline()));
                    mode = ApplyMode.EDIT;
                } else {
                    text = generator.generate(prompts.generateSystem(),
                            prompts.regeneration(request.prompt(), errorReport));
                    mode = followUp;
                }
            }
            default -> throw new IllegalStateException("Unknown stage " + stage);
        }
        return new GenerationResult(text, mode, attempt, parser.parse(text));
    }

    private static String describe(GenerationRequest request) {
        return request.prompt() != null ? request.prompt() : "Restore of a previous version of the app";
    }

    private Map<String, String> captureBaseline(SessionEnvironment environment) {
        try {
            Map<String, String> files = snapshotter.snapshot(environment.getHandle());
            environment.setBaseline(files);
            return files;
        } catch (SandboxException e) {
            log.warn("Could not snapshot project in sandbox '{}': {}",
                    environment.getHandle().id(), e.getMessage());
            return Map.of();
        }
    }
}
