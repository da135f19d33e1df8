package com.sitepilot.orchestrator.lifecycle;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Where things live inside a sandbox.
 *
 * Project-relative paths ({@code src/App.jsx}) are what payloads, validation
 * errors and snapshots use; {@link #remote(String)} turns them into the
 * path the executor understands.
 */
public final class ProjectLayout {

    public static final String PROJECT_DIR    = "my-app";
    public static final String MANIFEST       = "package.json";
    public static final String INDEX_HTML     = "index.html";
    public static final String VITE_CONFIG    = "vite.config.js";
    public static final String ENTRY_POINT    = "src/main.jsx";
    public static final String ROOT_COMPONENT = "src/App.jsx";
    public static final String BASE_STYLES    = "src/index.css";
    public static final String SOURCE_DIR     = "src";
    public static final String COMPONENTS_DIR = "src/components";
    public static final String DEV_LOG        = "dev.log";

    /** Files whose absence or corruption leaves the project non-functional. */
    public static final List<String> CRITICAL_FILES =
            List.of(MANIFEST, ENTRY_POINT, ROOT_COMPONENT, BASE_STYLES);

    /** Path segments reach shell commands unquoted, so only these characters pass. */
    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_.@-]+");

    private ProjectLayout() {}

    /** Executor path for a project-relative path. */
    public static String remote(String projectPath) {
        return PROJECT_DIR + "/" + projectPath;
    }

    /**
     * Normalize any payload path to a project-relative one.
     *
     * Accepts {@code src/App.jsx}, {@code ./src/App.jsx}, {@code /src/App.jsx}
     * and {@code my-app/src/App.jsx}; collapses {@code .} and {@code ..}
     * segments. Every remaining segment must consist of letters, digits and
     * {@code _ . @ -}.
     *
     * @throws IllegalArgumentException for blank paths, paths escaping the
     *         project, or segments with other characters
     */
    public static String resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Empty file path");
        }
        String p = path.strip().replace('\\', '/');
        while (p.startsWith("/")) p = p.substring(1);
        if (p.startsWith(PROJECT_DIR + "/")) p = p.substring(PROJECT_DIR.length() + 1);

        String normalized = normalize(p);
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException("Path escapes the project root: " + path);
        }
        for (String segment : normalized.split("/")) {
            if (!SEGMENT.matcher(segment).matches()) {
                throw new IllegalArgumentException("Unsupported characters in path: " + path);
            }
        }
        return normalized;
    }

    /** Parent directory of a project-relative path, or "" at the root. */
    public static String parentOf(String projectPath) {
        int idx = projectPath.lastIndexOf('/');
        return idx < 0 ? "" : projectPath.substring(0, idx);
    }

    /**
     * POSIX-style normalization of {@code a/./b/../c}. Returns null when a
     * {@code ..} segment would climb above the starting directory.
     */
    public static String normalize(String path) {
        Deque<String> parts = new ArrayDeque<>();
        for (String seg : path.split("/")) {
            if (seg.isEmpty() || seg.equals(".")) continue;
            if (seg.equals("..")) {
                if (parts.isEmpty()) return null;
                parts.removeLast();
            } else {
                parts.addLast(seg);
            }
        }
        return String.join("/", parts);
    }
}
