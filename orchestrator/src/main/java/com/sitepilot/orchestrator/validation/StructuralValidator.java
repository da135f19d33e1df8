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
 * Source-level checks that need no build: brace balance, React symbols used
 * without import, functions without an export, files without a component,
 * and broken quoting in {@code className}.
 *
 * Pure and stateless.
 */
@Component
public class StructuralValidator {

    private static final Pattern COMPONENT = Pattern.compile("function\\s+\\w+\\s*\\(|\\w+\\s*=\\s*\\(");
    private static final Pattern FUNCTION  = Pattern.compile("\\bfunction\\s+\\w+\\s*\\(");
    private static final Pattern EXPORT    = Pattern.compile("\\bexport\\b");

    private static final Pattern REACT_SYMBOL = Pattern.compile("\\bReact\\b");
    private static final Pattern REACT_IMPORT = Pattern.compile("\\bimport\\s+(?:\\*\\s+as\\s+)?React\\b");
    private static final Pattern REACT_NAMED_IMPORTS = Pattern.compile(
            "\\bimport\\s+([^;]+?)\\s+from\\s+[\"']react[\"']");

    private static final List<String> HOOKS = List.of(
            "useState", "useEffect", "useRef", "useMemo", "useCallback",
            "useContext", "useReducer", "useLayoutEffect");

    private static final List<Pattern> BAD_CLASSNAME = List.of(
            Pattern.compile("className=\"[^\"]*\\\\\"[^\"]*\""),   // className="a\"b"
            Pattern.compile("className=\"[^\"]*\"\"[^\"]*\""));    // className="a""b"

    /**
     * Check one file.
     *
     * @param path    project-relative path, used to attribute errors
     * @param content file content
     */
    public List<ValidationError> validate(String path, String content) {
        List<ValidationError> errors = new ArrayList<>();
        String src = content == null ? "" : content;

        checkBraces(path, src, errors);
        checkImports(path, src, errors);
        checkExport(path, src, errors);
        checkComponent(path, src, errors);
        checkClassNames(path, src, errors);
        return errors;
    }

    private static void checkBraces(String path, String src, List<ValidationError> errors) {
        long open  = src.chars().filter(c -> c == '{').count();
        long close = src.chars().filter(c -> c == '}').count();
        if (open != close) {
            errors.add(ValidationError.of(ErrorKind.UNBALANCED_BRACES, Severity.HIGH, path,
                    "Mismatched curly braces: " + open + " opening, " + close + " closing"));
        }
    }

    private static void checkImports(String path, String src, List<ValidationError> errors) {
        Set<String> missing = new LinkedHashSet<>();
        if (REACT_SYMBOL.matcher(src).find() && !REACT_IMPORT.matcher(src).find()) {
            // "from 'react'" itself mentions react in lower case only.
            missing.add("React");
        }

        String imported = importedFromReact(src);
        for (String hook : HOOKS) {
            // React.useState(...) is covered by the React import check.
            Pattern call = Pattern.compile("(?<![.\\w])" + hook + "\\s*\\(");
            if (call.matcher(src).find()
                    && !Pattern.compile("\\b" + hook + "\\b").matcher(imported).find()
                    && !Pattern.compile("function\\s+" + hook + "\\b").matcher(src).find()) {
                missing.add(hook);
            }
        }

        if (!missing.isEmpty()) {
            errors.add(ValidationError.of(ErrorKind.MISSING_IMPORT, Severity.HIGH, path,
                    String.join(", ", missing) + " used but not imported from 'react'"));
        }
    }

    private static String importedFromReact(String src) {
        StringBuilder sb = new StringBuilder();
        Matcher m = REACT_NAMED_IMPORTS.matcher(src);
        while (m.find()) {
            sb.append(m.group(1)).append(' ');
        }
        return sb.toString();
    }

    private static void checkExport(String path, String src, List<ValidationError> errors) {
        if (FUNCTION.matcher(src).find() && !EXPORT.matcher(src).find()) {
            errors.add(ValidationError.of(ErrorKind.MISSING_EXPORT, Severity.HIGH, path,
                    "Component defined but never exported; add 'export default <Name>;'"));
        }
    }

    private static void checkComponent(String path, String src, List<ValidationError> errors) {
        if (ProjectLayout.ENTRY_POINT.equals(path)) {
            return;
        }
        if (!COMPONENT.matcher(src).find()) {
            errors.add(ValidationError.of(ErrorKind.INVALID_COMPONENT, Severity.CRITICAL, path,
                    "No component function found; define one as 'function Name() { ... }'"));
        }
    }

    private static void checkClassNames(String path, String src, List<ValidationError> errors) {
        for (Pattern p : BAD_CLASSNAME) {
            if (p.matcher(src).find()) {
                errors.add(ValidationError.of(ErrorKind.MALFORMED_CLASSNAME, Severity.HIGH, path,
                        "Unescaped quotes in className attribute"));
                return;
            }
        }
    }
}
