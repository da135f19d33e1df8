package com.sitepilot.orchestrator.apply;

import com.sitepilot.orchestrator.lifecycle.ProjectLayout;
import com.sitepilot.orchestrator.sandbox.EnvironmentHandle;
import com.sitepilot.orchestrator.sandbox.SandboxException;
import com.sitepilot.orchestrator.validation.ErrorKind;
import com.sitepilot.orchestrator.validation.Severity;
import com.sitepilot.orchestrator.validation.ValidationError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks that the files the app cannot run without are present and sane:
 * manifest, entry point importing the root component, root component
 * exporting a component, non-empty base stylesheet.
 */
@Component
public class ProjectStructureValidator {

    private static final Pattern IMPORTS_ROOT = Pattern.compile(
            "import\\s+App\\s+from\\s+[\"']\\./App(\\.jsx)?[\"']");
    private static final Pattern COMPONENT = Pattern.compile(
            "function\\s+\\w+\\s*\\(|\\w+\\s*=\\s*\\(");
    private static final Pattern EXPORT = Pattern.compile("\\bexport\\b");

    /** @return one error per broken critical file; empty when the project is intact */
    public List<ValidationError> check(EnvironmentHandle handle) {
        List<ValidationError> problems = new ArrayList<>();

        String manifest = read(handle, ProjectLayout.MANIFEST, problems);
        if (manifest != null && !manifest.contains("\"react\"")) {
            problems.add(broken(ProjectLayout.MANIFEST, "package.json does not declare react"));
        }

        String entry = read(handle, ProjectLayout.ENTRY_POINT, problems);
        if (entry != null && !IMPORTS_ROOT.matcher(entry).find()) {
            problems.add(broken(ProjectLayout.ENTRY_POINT, "Entry point does not import App from ./App"));
        }

        String root = read(handle, ProjectLayout.ROOT_COMPONENT, problems);
        if (root != null && (!COMPONENT.matcher(root).find() || !EXPORT.matcher(root).find())) {
            problems.add(broken(ProjectLayout.ROOT_COMPONENT, "Root component does not export a component"));
        }

        read(handle, ProjectLayout.BASE_STYLES, problems);
        return problems;
    }

    private static String read(EnvironmentHandle handle, String path, List<ValidationError> problems) {
        try {
            String content = handle.readFile(ProjectLayout.remote(path));
            if (content.isBlank()) {
                problems.add(broken(path, path + " is empty"));
                return null;
            }
            return content;
        } catch (SandboxException e) {
            problems.add(ValidationError.of(ErrorKind.MISSING_FILE, Severity.CRITICAL, path,
                    path + " is missing"));
            return null;
        }
    }

    private static ValidationError broken(String path, String message) {
        return ValidationError.of(ErrorKind.INVALID_COMPONENT, Severity.CRITICAL, path, message);
    }
}
