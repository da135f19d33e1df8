package com.sitepilot.orchestrator.lifecycle;

import com.sitepilot.orchestrator.config.OrchestratorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The versioned set of npm packages generated code may pull in, and the
 * import scanner that maps source text to package names.
 *
 * Anything outside the list is skipped, never installed.
 */
@Component
public class DependencyAllowList {

    private static final Pattern FROM_IMPORT = Pattern.compile(
            "\\bfrom\\s+[\"']([^\"']+)[\"']");
    private static final Pattern SIDE_EFFECT_IMPORT = Pattern.compile(
            "\\bimport\\s+[\"']([^\"']+)[\"']");
    private static final Pattern REQUIRE = Pattern.compile(
            "\\brequire\\(\\s*[\"']([^\"']+)[\"']\\s*\\)");

    // Always present in the scaffold or provided by the runtime.
    private static final Set<String> PROVIDED = Set.of(
            "react", "path", "fs", "os", "child_process", "url", "util");

    private final String      version;
    private final Set<String> allowed;

    @Autowired
    public DependencyAllowList(OrchestratorProperties properties) {
        this(properties.getDependencies().getAllowListVersion(),
             properties.getDependencies().getAllowList());
    }

    public DependencyAllowList(String version, Set<String> allowed) {
        this.version = version;
        this.allowed = Set.copyOf(allowed);
    }

    public String version()       { return version; }
    public Set<String> packages() { return allowed; }

    public boolean isAllowed(String packageName) {
        return allowed.contains(packageName);
    }

    /**
     * Every third-party package referenced by import, side-effect import or
     * require in {@code source}, in first-seen order. Relative and absolute
     * paths, node built-ins and {@code react} itself are excluded.
     */
    public Set<String> referencedPackages(String source) {
        Set<String> found = new LinkedHashSet<>();
        if (source == null || source.isEmpty()) return found;
        for (Pattern p : new Pattern[] { FROM_IMPORT, SIDE_EFFECT_IMPORT, REQUIRE }) {
            Matcher m = p.matcher(source);
            while (m.find()) {
                String pkg = packageName(m.group(1));
                if (pkg != null && !PROVIDED.contains(pkg)) {
                    found.add(pkg);
                }
            }
        }
        return found;
    }

    /**
     * Root package for a module specifier: {@code @scope/name/sub -> @scope/name},
     * {@code name/sub -> name}. Null for relative, absolute or node: specifiers.
     */
    static String packageName(String specifier) {
        if (specifier == null || specifier.isBlank()) return null;
        String s = specifier.strip();
        if (s.startsWith(".") || s.startsWith("/") || s.startsWith("node:")) return null;
        String[] parts = s.split("/");
        if (s.startsWith("@")) {
            return parts.length >= 2 ? parts[0] + "/" + parts[1] : null;
        }
        return parts[0];
    }
}
