package com.sitepilot.orchestrator.correction;

import com.sitepilot.orchestrator.lifecycle.ProjectLayout;
import com.sitepilot.orchestrator.validation.ErrorCategory;
import com.sitepilot.orchestrator.validation.ErrorKind;
import com.sitepilot.orchestrator.validation.ValidationError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns validation errors into the inputs of a targeted correction: which
 * files to rewrite, which to create, and what to tell the generator.
 */
@Component
public class CorrectionPlanner {

    public Map<ErrorCategory, List<ValidationError>> categorize(List<ValidationError> errors) {
        Map<ErrorCategory, List<ValidationError>> byCategory = new EnumMap<>(ErrorCategory.class);
        for (ValidationError e : errors) {
            byCategory.computeIfAbsent(e.category(), c -> new ArrayList<>()).add(e);
        }
        return byCategory;
    }

    /**
     * One correction per file the errors point at, in first-seen order.
     * Errors without a file are attributed to the root component. Every
     * missing component path adds an empty {@code create} entry.
     *
     * @param currentFiles project-relative path to current content
     */
    public List<FileCorrection> prepareTargetedCorrections(List<ValidationError> errors,
                                                           Map<String, String> currentFiles) {
        Map<String, List<ValidationError>> byFile = new LinkedHashMap<>();
        Set<String> missing = new LinkedHashSet<>();

        for (ValidationError e : errors) {
            String file = targetFile(e);
            byFile.computeIfAbsent(file, f -> new ArrayList<>()).add(e);
            if (e.missingComponentPath() != null) {
                missing.add(e.missingComponentPath());
            }
        }

        List<FileCorrection> corrections = new ArrayList<>();
        for (Map.Entry<String, List<ValidationError>> entry : byFile.entrySet()) {
            String path = entry.getKey();
            String content = currentFiles.get(path);
            corrections.add(new FileCorrection(path, content == null ? "" : content,
                    entry.getValue(), content == null && missing.contains(path)));
        }
        for (String path : missing) {
            if (byFile.containsKey(path) || currentFiles.containsKey(path)) {
                continue;
            }
            corrections.add(new FileCorrection(path, "", List.of(), true));
        }
        return corrections;
    }

    private static String targetFile(ValidationError e) {
        String file = e.file();
        if (file == null || !file.startsWith(ProjectLayout.SOURCE_DIR + "/")) {
            return ProjectLayout.ROOT_COMPONENT;
        }
        return file;
    }

    /** Numbered, human-readable list of errors for the correction prompt. */
    public String errorReport(List<ValidationError> errors) {
        StringBuilder sb = new StringBuilder();
        int i = 1;
        for (ValidationError e : errors) {
            sb.append(i++).append(". ").append(e.describe()).append('\n');
        }
        return sb.toString();
    }

    /** Fix hints, one per distinct error kind present. */
    public List<String> fixSuggestions(List<ValidationError> errors) {
        Set<ErrorKind> kinds = new LinkedHashSet<>();
        for (ValidationError e : errors) {
            kinds.add(e.kind());
        }
        List<String> hints = new ArrayList<>();
        for (ErrorKind kind : kinds) {
            String hint = hint(kind);
            if (hint != null) hints.add(hint);
        }
        for (ValidationError e : errors) {
            if (e.missingComponentPath() != null) {
                hints.add("Create " + e.missingComponentPath() + " with a default-exported component, "
                        + "or remove the import of \"" + e.module() + "\".");
            }
        }
        return hints;
    }

    private static String hint(ErrorKind kind) {
        return switch (kind) {
            case UNBALANCED_BRACES    -> "Balance every { with a matching }; check JSX expressions and object literals.";
            case MISSING_IMPORT       -> "Import React and every hook you call: import React, { useState } from 'react';";
            case MISSING_EXPORT       -> "Export each component: export default ComponentName;";
            case INVALID_COMPONENT    -> "Define the component as function ComponentName() { return (...); }";
            case MALFORMED_CLASSNAME  -> "Do not put unescaped double quotes inside className values.";
            case MISSING_STYLES       -> "Keep src/index.css with the three @tailwind directives.";
            case MISSING_FILE         -> "Provide every file that is imported, including src/App.jsx.";
            case BUILD_ERROR,
                 SYNTAX_ERROR         -> "Fix the syntax at the reported line; check quotes, JSX tags and braces.";
            case UNDEFINED_SYMBOL     -> "Declare or import every identifier before use.";
            case MALFORMED_STYLE      -> "Use style={{ key: 'value' }} with double braces.";
            case UNRESOLVED_IMPORT    -> "Only import relative files that exist or allow-listed packages.";
            case UNPARSEABLE_RESPONSE -> "Answer with the JSON object only, no prose around it.";
            case SERVER_UNREACHABLE,
                 FILE_ACCESS          -> null;
        };
    }
}
