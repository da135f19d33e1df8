package com.sitepilot.orchestrator.validation;

import com.sitepilot.orchestrator.lifecycle.ProjectLayout;
import com.sitepilot.orchestrator.lifecycle.ProjectSnapshotter;
import com.sitepilot.orchestrator.sandbox.EnvironmentHandle;
import com.sitepilot.orchestrator.sandbox.SandboxException;
import com.sitepilot.orchestrator.session.Cancellation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates what is actually in the sandbox: the component sources, the base
 * stylesheet, the dev server log and whether a URL came up at all.
 *
 * Every problem, including failure to read a file, becomes a
 * {@link ValidationError}; nothing is thrown for expected failures.
 */
@Component
public class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    private final StructuralValidator structural;
    private final BuildLogParser      buildLog;
    private final ProjectSnapshotter  snapshotter;

    public ValidationEngine(StructuralValidator structural,
                            BuildLogParser buildLog,
                            ProjectSnapshotter snapshotter) {
        this.structural  = structural;
        this.buildLog    = buildLog;
        this.snapshotter = snapshotter;
    }

    /**
     * @param serverUrl URL produced by the apply step, or null if no server came up
     */
    public ValidationReport validate(EnvironmentHandle handle, String serverUrl) {
        List<ValidationError> errors   = new ArrayList<>();
        Map<String, String>   contents = new LinkedHashMap<>();

        List<String> components = listComponents(handle, errors);
        if (components == null) {
            components = List.of(ProjectLayout.ROOT_COMPONENT);
        } else if (!components.contains(ProjectLayout.ROOT_COMPONENT)) {
            errors.add(ValidationError.of(ErrorKind.MISSING_FILE, Severity.CRITICAL,
                    ProjectLayout.ROOT_COMPONENT, "Root component file not found"));
        }

        for (String path : components) {
            Cancellation.checkpoint();
            try {
                String content = handle.readFile(ProjectLayout.remote(path));
                contents.put(path, content);
                errors.addAll(structural.validate(path, content));
            } catch (SandboxException e) {
                errors.add(ValidationError.of(ErrorKind.FILE_ACCESS, Severity.HIGH, path,
                        "Could not read file: " + e.getMessage()));
            }
        }

        checkStyles(handle, errors, contents);

        try {
            String devLog = handle.readFile(ProjectLayout.remote(ProjectLayout.DEV_LOG));
            errors.addAll(buildLog.parse(devLog));
        } catch (SandboxException e) {
            // No log means no server output to inspect.
            log.debug("No dev log in sandbox '{}': {}", handle.id(), e.getMessage());
        }

        if (serverUrl == null) {
            errors.add(ValidationError.of(ErrorKind.SERVER_UNREACHABLE, Severity.CRITICAL, null,
                    "Development server did not become reachable"));
        }

        if (errors.isEmpty()) {
            log.info("Validation passed for sandbox '{}' ({} component files)", handle.id(), components.size());
        } else {
            log.info("Validation found {} error(s) in sandbox '{}'", errors.size(), handle.id());
        }
        return new ValidationReport(errors, contents);
    }

    /** Component sources under src/, or null if the listing failed. */
    private List<String> listComponents(EnvironmentHandle handle, List<ValidationError> errors) {
        List<String> jsx = new ArrayList<>();
        try {
            for (String path : snapshotter.listSourceFiles(handle)) {
                if (path.endsWith(".jsx")) {
                    jsx.add(path);
                }
            }
        } catch (SandboxException e) {
            errors.add(ValidationError.of(ErrorKind.FILE_ACCESS, Severity.HIGH, ProjectLayout.SOURCE_DIR,
                    "Could not list source files: " + e.getMessage()));
            return null;
        }
        return jsx;
    }

    private static void checkStyles(EnvironmentHandle handle, List<ValidationError> errors,
                                    Map<String, String> contents) {
        String path = ProjectLayout.BASE_STYLES;
        try {
            String css = handle.readFile(ProjectLayout.remote(path));
            contents.put(path, css);
            if (css.isBlank()) {
                errors.add(ValidationError.of(ErrorKind.MISSING_STYLES, Severity.MEDIUM, path,
                        "Base stylesheet is empty"));
            }
        } catch (SandboxException e) {
            errors.add(ValidationError.of(ErrorKind.MISSING_STYLES, Severity.MEDIUM, path,
                    "Base stylesheet not found"));
        }
    }
}
