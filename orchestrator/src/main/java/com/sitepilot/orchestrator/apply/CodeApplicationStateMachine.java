package com.sitepilot.orchestrator.apply;

import com.sitepilot.orchestrator.config.OrchestratorProperties;
import com.sitepilot.orchestrator.lifecycle.EnvironmentLifecycleManager;
import com.sitepilot.orchestrator.lifecycle.ProjectLayout;
import com.sitepilot.orchestrator.sandbox.EnvironmentHandle;
import com.sitepilot.orchestrator.sandbox.SandboxException;
import com.sitepilot.orchestrator.session.Cancellation;
import com.sitepilot.orchestrator.session.SessionEnvironment;
import com.sitepilot.orchestrator.session.SessionRegistry;
import com.sitepilot.orchestrator.validation.ErrorKind;
import com.sitepilot.orchestrator.validation.Severity;
import com.sitepilot.orchestrator.validation.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Writes a generated payload into a session's sandbox and gets the app
 * running, then says where the loop goes next.
 *
 * <pre>
 *   INITIAL_GENERATION  scaffold -> pre-flight check -> backup -> install -> write all
 *                       -> restore defaults -> post-flight check -> start (dev, then preview)
 *                       failed post-flight: restore the skeleton, RETRY_CYCLE
 *                       other failure or cancellation: tear down the sandbox
 *
 *   CORRECTION / EDIT   pre-flight check -> backup -> write (fail-fast) -> install new deps
 *                       -> restore defaults -> post-flight check -> restart (full start on failure)
 *                       failed write: restore that file, RETRY_CYCLE
 *                       failed post-flight: restore everything, RETRY_CYCLE
 * </pre>
 *
 * Must be called with the session lock held.
 */
@Component
public class CodeApplicationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(CodeApplicationStateMachine.class);

    private final EnvironmentLifecycleManager lifecycle;
    private final ProjectStructureValidator   structure;
    private final SessionRegistry             registry;
    private final OrchestratorProperties      properties;

    public CodeApplicationStateMachine(EnvironmentLifecycleManager lifecycle,
                                       ProjectStructureValidator structure,
                                       SessionRegistry registry,
                                       OrchestratorProperties properties) {
        this.lifecycle   = lifecycle;
        this.structure   = structure;
        this.registry    = registry;
        this.properties  = properties;
    }

    public ApplyOutcome apply(SessionEnvironment environment, GenerationResult result) {
        GenerationPayload payload = result.payload();
        if (payload == null || payload.isEmpty()) {
            return ApplyOutcome.retry(FailureKind.CONTRACT_VIOLATION, "Generation produced no files",
                    List.of(ValidationError.of(ErrorKind.MISSING_FILE, Severity.CRITICAL, null,
                            "The response contained no files")));
        }

        Map<String, String> files;
        try {
            files = resolvePaths(payload);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected payload for session {}: {}", environment.getSessionId(), e.getMessage());
            return ApplyOutcome.retry(FailureKind.CONTRACT_VIOLATION, e.getMessage(),
                    List.of(ValidationError.of(ErrorKind.FILE_ACCESS, Severity.CRITICAL, null, e.getMessage())));
        }

        log.info("Applying {} file(s) to sandbox '{}' (mode={}, attempt={})",
                files.size(), environment.getHandle().id(), result.mode(), result.attempt());

        if (result.mode() == ApplyMode.EDIT && !environment.hasBaseline()) {
            return ApplyOutcome.abort(FailureKind.CONTRACT_VIOLATION,
                    "Edit requested but the session has no existing code");
        }
        return switch (result.mode()) {
            case INITIAL_GENERATION -> applyInitial(environment, files);
            case CORRECTION, EDIT   -> applyIncremental(environment, files);
        };
    }

    // -------------------------------------------------------------------------
    // Initial generation
    // -------------------------------------------------------------------------

    private ApplyOutcome applyInitial(SessionEnvironment environment, Map<String, String> files) {
        EnvironmentHandle handle = environment.getHandle();
        Duration shortTimeout = properties.getServer().getShortCommandTimeout();
        try {
            lifecycle.scaffoldProject(environment);
            preflight(handle);

            CriticalFileBackup backup = CriticalFileBackup.capture(handle, files.keySet(), shortTimeout);
            lifecycle.installDependencies(handle, files.values());
            for (Map.Entry<String, String> file : files.entrySet()) {
                Cancellation.checkpoint();
                write(handle, file.getKey(), file.getValue());
            }
            lifecycle.ensureProjectDefaults(handle);

            List<ValidationError> postflight = structure.check(handle);
            if (!postflight.isEmpty()) {
                log.warn("Post-flight check failed in sandbox '{}', restoring the skeleton", handle.id());
                backup.restoreAll();
                return ApplyOutcome.retry(FailureKind.VALIDATION_FAILED,
                        "Generated code broke the project structure", postflight);
            }
            backup.discard();

            lifecycle.stopServer(handle);
            lifecycle.clearBuildCaches(handle);
            Optional<String> url = lifecycle.startWithFallback(handle);

            environment.setLastUrl(url.orElse(null));
            return ApplyOutcome.validate(url.orElse(null));
        } catch (CancellationException e) {
            log.info("Initial apply cancelled in sandbox '{}', tearing it down", handle.id());
            Cancellation.uninterruptibly(() -> tearDown(environment));
            throw e;
        } catch (RuntimeException e) {
            log.error("Initial apply failed in sandbox '{}', tearing it down: {}",
                    handle.id(), e.getMessage(), e);
            tearDown(environment);
            return ApplyOutcome.abort(FailureKind.INFRASTRUCTURE_ERROR,
                    "Failed to set up the app environment: " + e.getMessage());
        }
    }

    private void tearDown(SessionEnvironment environment) {
        registry.evict(environment.getSessionId(), environment);
        Cancellation.uninterruptibly(() -> {
            try {
                environment.getHandle().terminate();
            } catch (SandboxException e) {
                log.warn("Terminating sandbox '{}' failed: {}", environment.getHandle().id(), e.getMessage());
            }
        });
    }

    // -------------------------------------------------------------------------
    // Correction and edit
    // -------------------------------------------------------------------------

    private ApplyOutcome applyIncremental(SessionEnvironment environment, Map<String, String> files) {
        EnvironmentHandle handle = environment.getHandle();
        Duration shortTimeout = properties.getServer().getShortCommandTimeout();

        preflight(handle);

        CriticalFileBackup backup = CriticalFileBackup.capture(handle, files.keySet(), shortTimeout);
        try {
            for (Map.Entry<String, String> file : files.entrySet()) {
                Cancellation.checkpoint();
                String path = file.getKey();
                try {
                    write(handle, path, file.getValue());
                } catch (SandboxException e) {
                    log.warn("Write of {} failed in sandbox '{}', restoring it: {}", path, handle.id(), e.getMessage());
                    backup.restore(path);
                    return ApplyOutcome.retry(FailureKind.INFRASTRUCTURE_ERROR,
                            "Failed to write " + path + ": " + e.getMessage(),
                            List.of(ValidationError.of(ErrorKind.FILE_ACCESS, Severity.HIGH, path,
                                    "Write failed: " + e.getMessage())));
                }
            }

            lifecycle.installDependencies(handle, files.values());
            lifecycle.ensureProjectDefaults(handle);

            List<ValidationError> postflight = structure.check(handle);
            if (!postflight.isEmpty()) {
                log.warn("Post-flight check failed in sandbox '{}', restoring {} file(s)",
                        handle.id(), backup.paths().size());
                backup.restoreAll();
                return ApplyOutcome.retry(FailureKind.VALIDATION_FAILED,
                        "Applied code broke the project structure", postflight);
            }

            int port = properties.getServer().getPort();
            Optional<String> url = lifecycle.restartServer(handle, port);
            if (url.isEmpty()) {
                log.info("Restart did not come up in sandbox '{}', running full start", handle.id());
                lifecycle.stopServer(handle);
                url = lifecycle.startWithFallback(handle);
            }

            backup.discard();
            environment.setLastUrl(url.orElse(null));
            return ApplyOutcome.validate(url.orElse(null));
        } catch (CancellationException e) {
            log.info("Apply cancelled in sandbox '{}', restoring backup", handle.id());
            Cancellation.uninterruptibly(backup::restoreAll);
            throw e;
        } catch (SandboxException e) {
            log.error("Apply failed in sandbox '{}': {}", handle.id(), e.getMessage(), e);
            backup.restoreAll();
            return ApplyOutcome.abort(FailureKind.INFRASTRUCTURE_ERROR,
                    "Sandbox error while applying changes: " + e.getMessage());
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void preflight(EnvironmentHandle handle) {
        List<ValidationError> problems = structure.check(handle);
        if (!problems.isEmpty()) {
            // The payload may be exactly what repairs these.
            log.warn("Pre-flight check found {} problem(s) in sandbox '{}'", problems.size(), handle.id());
        }
    }

    private static Map<String, String> resolvePaths(GenerationPayload payload) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, String> file : payload.allFiles().entrySet()) {
            resolved.put(ProjectLayout.resolve(file.getKey()),
                    file.getValue() == null ? "" : file.getValue());
        }
        return resolved;
    }

    private void write(EnvironmentHandle handle, String path, String content) {
        String parent = ProjectLayout.parentOf(path);
        if (!parent.isEmpty()) {
            handle.run("mkdir -p " + ProjectLayout.remote(parent), properties.getServer().getShortCommandTimeout());
        }
        handle.writeFile(ProjectLayout.remote(path), content);
    }
}
