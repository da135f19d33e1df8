package com.sitepilot.orchestrator.validation;

import com.sitepilot.orchestrator.lifecycle.ProjectLayout;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the dev server's log into {@link ValidationError}s.
 *
 * Three passes, in order:
 * <ol>
 *   <li>esbuild {@code my-app/src/X.jsx:L:C: ERROR: msg} lines</li>
 *   <li>Vite {@code Failed to resolve import "X"} lines, attributed to the
 *       nearest preceding {@code my-app/src/...:L:C} location line</li>
 *   <li>banner heuristics for failures that carry no location</li>
 * </ol>
 * Identical errors (Vite repeats itself on every page load) are reported once.
 */
@Component
public class BuildLogParser {

    private static final Pattern ESBUILD_ERROR = Pattern.compile(
            "my-app/(src/[^\\s:]+):(\\d+):(\\d+):\\s+ERROR:\\s+(.+)");
    private static final Pattern LOCATION = Pattern.compile(
            "my-app/(src/[^\\s:]+):(\\d+):(\\d+)");
    private static final Pattern UNRESOLVED = Pattern.compile(
            "Failed to resolve import\\s+\"([^\"]+)\"");
    private static final Pattern SYNTAX = Pattern.compile(
            "Unterminated string|Unexpected token", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNDEFINED = Pattern.compile("'([^']+)' is not defined");

    private static final String TRANSFORM_FAILED = "[plugin:vite:esbuild] Transform failed";

    public List<ValidationError> parse(String log) {
        Set<ValidationError> errors = new LinkedHashSet<>();
        if (log == null || log.isBlank()) {
            return new ArrayList<>();
        }

        Matcher m = ESBUILD_ERROR.matcher(log);
        while (m.find()) {
            errors.add(ValidationError.at(ErrorKind.BUILD_ERROR, Severity.CRITICAL, m.group(1),
                    Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)), m.group(4).strip()));
        }

        parseUnresolvedImports(log, errors);

        if (log.contains(TRANSFORM_FAILED) && errors.isEmpty()) {
            errors.add(ValidationError.of(ErrorKind.BUILD_ERROR, Severity.CRITICAL, null,
                    "Vite/esbuild transform failed (see dev.log for details)"));
        }
        if (SYNTAX.matcher(log).find()) {
            errors.add(ValidationError.of(ErrorKind.SYNTAX_ERROR, Severity.HIGH, null,
                    "Build failed on a string or JSX token; check quotes and JSX braces"));
        }
        if (log.contains("is not defined")) {
            Matcher undef = UNDEFINED.matcher(log);
            String symbol = undef.find() ? undef.group(1) : "variable";
            errors.add(ValidationError.of(ErrorKind.UNDEFINED_SYMBOL, Severity.HIGH, null,
                    "ReferenceError: " + symbol + " is not defined"));
        }
        if (log.contains("Expected \"}\"") && log.contains("style")) {
            errors.add(ValidationError.of(ErrorKind.MALFORMED_STYLE, Severity.HIGH, null,
                    "Invalid JSX style syntax; use style={{ ... }} and escape quotes in data URLs"));
        }
        return new ArrayList<>(errors);
    }

    private static void parseUnresolvedImports(String log, Set<ValidationError> errors) {
        String file = null;
        int line = 0;
        int column = 0;
        for (String text : log.split("\\R")) {
            Matcher loc = LOCATION.matcher(text);
            if (loc.find()) {
                file   = loc.group(1);
                line   = Integer.parseInt(loc.group(2));
                column = Integer.parseInt(loc.group(3));
                continue;
            }
            Matcher unresolved = UNRESOLVED.matcher(text);
            if (!unresolved.find()) {
                continue;
            }
            String module   = unresolved.group(1);
            String importer = file != null ? file : ProjectLayout.ROOT_COMPONENT;
            errors.add(new ValidationError(ErrorKind.UNRESOLVED_IMPORT,
                    "Failed to resolve import \"" + module + "\"",
                    importer, file != null ? line : 0, file != null ? column : 0,
                    Severity.CRITICAL, module, missingComponentPath(importer, module)));
        }
    }

    /**
     * Project-relative path of the file a relative import expects, resolved
     * against the importing file's directory. {@code .jsx} is appended when
     * the last segment of the specifier has no extension. Null for bare
     * package imports and for paths that leave {@code src/}.
     */
    static String missingComponentPath(String importer, String module) {
        boolean relative = module.startsWith("./") || module.startsWith("../")
                || module.startsWith("components/");
        if (!relative) {
            return null;
        }
        String lastSegment = module.substring(module.lastIndexOf('/') + 1);
        String rel = lastSegment.contains(".") ? module : module + ".jsx";
        String baseDir = module.startsWith("components/")
                ? ProjectLayout.SOURCE_DIR
                : ProjectLayout.parentOf(importer);
        String joined = baseDir.isEmpty() ? rel : baseDir + "/" + rel;
        String normalized = ProjectLayout.normalize(joined);
        if (normalized == null || !normalized.startsWith(ProjectLayout.SOURCE_DIR + "/")) {
            return null;
        }
        return normalized;
    }
}
