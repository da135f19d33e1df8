package com.sitepilot.orchestrator.lifecycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepilot.orchestrator.config.OrchestratorProperties;
import com.sitepilot.orchestrator.sandbox.CommandResult;
import com.sitepilot.orchestrator.sandbox.EnvironmentHandle;
import com.sitepilot.orchestrator.sandbox.EnvironmentProvider;
import com.sitepilot.orchestrator.sandbox.SandboxException;
import com.sitepilot.orchestrator.sandbox.TimeoutRejectedException;
import com.sitepilot.orchestrator.session.Cancellation;
import com.sitepilot.orchestrator.session.SessionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Creates sandboxes, lays down the project skeleton, installs dependencies
 * and runs the dev server.
 *
 * Every remote call carries its own timeout from {@link OrchestratorProperties}.
 * Methods that start servers report "not reachable" as an empty Optional;
 * only creation and scaffolding failures are thrown.
 */
@Component
public class EnvironmentLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentLifecycleManager.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    private final EnvironmentProvider    provider;
    private final OrchestratorProperties properties;
    private final DependencyAllowList    allowList;

    public EnvironmentLifecycleManager(EnvironmentProvider provider,
                                       OrchestratorProperties properties,
                                       DependencyAllowList allowList) {
        this.provider   = provider;
        this.properties = properties;
        this.allowList  = allowList;
    }

    // -------------------------------------------------------------------------
    // Creation and health
    // -------------------------------------------------------------------------

    /**
     * Create a sandbox with the configured lifetime. If the provider rejects
     * that lifetime, retry exactly once with the provider's maximum.
     *
     * @throws SandboxException if creation fails
     */
    public EnvironmentHandle create() {
        Duration timeout = properties.getSandbox().getTimeout();
        try {
            EnvironmentHandle handle = provider.create(timeout);
            log.info("Created sandbox '{}' (timeout={}s)", handle.id(), timeout.toSeconds());
            return handle;
        } catch (TimeoutRejectedException e) {
            Duration max = provider.maxTimeout();
            log.warn("Sandbox timeout {}s rejected, retrying with {}s", timeout.toSeconds(), max.toSeconds());
            EnvironmentHandle handle = provider.create(max);
            log.info("Created sandbox '{}' (timeout={}s)", handle.id(), max.toSeconds());
            return handle;
        }
    }

    /**
     * Cheap liveness check: a trivial command, then the project marker file.
     * Any failure, including a remote error, counts as unhealthy.
     */
    public boolean isHealthy(EnvironmentHandle handle) {
        OrchestratorProperties.Sandbox cfg = properties.getSandbox();
        try {
            CommandResult ping = handle.run("echo ok", cfg.getPingTimeout());
            if (!ping.success() || !ping.stdoutOrEmpty().contains("ok")) {
                log.debug("Sandbox '{}' failed ping: {}", handle.id(), ping.summary());
                return false;
            }
            CommandResult marker = handle.run(
                    "test -f " + ProjectLayout.remote(ProjectLayout.MANIFEST), cfg.getMarkerTimeout());
            if (!marker.success()) {
                log.debug("Sandbox '{}' has no project marker", handle.id());
                return false;
            }
            return true;
        } catch (SandboxException e) {
            log.info("Sandbox '{}' health check failed: {}", handle.id(), e.getMessage());
            return false;
        }
    }

    // -------------------------------------------------------------------------
    // Project setup
    // -------------------------------------------------------------------------

    /**
     * Ensure the skeleton project exists and its base dependencies are
     * installed. Idempotent: a no-op when the session already recorded setup,
     * or when the sandbox already holds a Vite project with node_modules.
     *
     * @throws SandboxException if a write or {@code npm install} fails
     */
    public void scaffoldProject(SessionEnvironment environment) {
        EnvironmentHandle handle = environment.getHandle();
        if (environment.isProjectSetupDone()) {
            return;
        }
        if (isProjectReady(handle)) {
            log.info("Sandbox '{}' already has a project, skipping scaffold", handle.id());
            environment.markProjectSetupDone();
            return;
        }

        Duration shortTimeout = properties.getServer().getShortCommandTimeout();
        int port = properties.getServer().getPort();
        String host = hostOf(handle.resolvePublicUrl(port));

        log.info("Scaffolding project in sandbox '{}'", handle.id());
        handle.run("mkdir -p " + ProjectLayout.remote(ProjectLayout.COMPONENTS_DIR), shortTimeout);
        for (Map.Entry<String, String> file : ProjectTemplates.skeleton(host, port).entrySet()) {
            Cancellation.checkpoint();
            handle.writeFile(ProjectLayout.remote(file.getKey()), file.getValue());
        }

        CommandResult install = handle.run(inProject("npm install"),
                properties.getServer().getInstallTimeout());
        if (!install.success()) {
            throw new SandboxException("npm install failed in sandbox '"
                    + handle.id() + "': " + install.summary());
        }
        environment.markProjectSetupDone();
        log.info("Project scaffolded in sandbox '{}'", handle.id());
    }

    /** Manifest mentions vite and node_modules is present. */
    boolean isProjectReady(EnvironmentHandle handle) {
        Duration shortTimeout = properties.getServer().getShortCommandTimeout();
        try {
            CommandResult manifest = handle.run(
                    "cat " + ProjectLayout.remote(ProjectLayout.MANIFEST), shortTimeout);
            if (!manifest.success() || !manifest.stdoutOrEmpty().contains("vite")) {
                return false;
            }
            return handle.run("test -d " + ProjectLayout.remote("node_modules"), shortTimeout).success();
        } catch (SandboxException e) {
            log.debug("Project check failed in sandbox '{}': {}", handle.id(), e.getMessage());
            return false;
        }
    }

    /**
     * Install every allow-listed package referenced by the given sources that
     * the manifest does not already declare. Packages outside the allow-list
     * are logged and skipped. A package whose install or verification fails
     * is logged and left out of the result.
     *
     * @return packages installed and verified, in first-seen order
     */
    public List<String> installDependencies(EnvironmentHandle handle, Collection<String> sources) {
        Set<String> referenced = new LinkedHashSet<>();
        for (String source : sources) {
            referenced.addAll(allowList.referencedPackages(source));
        }

        if (referenced.isEmpty()) {
            return List.of();
        }

        OrchestratorProperties.Server cfg = properties.getServer();
        Set<String> declared = declaredPackages(handle);
        List<String> installed = new ArrayList<>();
        for (String pkg : referenced) {
            if (declared.contains(pkg)) {
                log.debug("Package '{}' already declared in sandbox '{}'", pkg, handle.id());
                continue;
            }
            if (!allowList.isAllowed(pkg)) {
                log.warn("Skipping package '{}': not on allow-list {}", pkg, allowList.version());
                continue;
            }
            Cancellation.checkpoint();
            CommandResult result = handle.run(inProject("npm install " + pkg + " --save"),
                    cfg.getPackageInstallTimeout());
            if (!result.success()) {
                log.warn("npm install {} failed in sandbox '{}': {}", pkg, handle.id(), result.summary());
                continue;
            }
            CommandResult verify = handle.run(inProject("npm ls " + pkg + " --depth=0"),
                    cfg.getVerifyTimeout());
            if (!verify.success() || !verify.stdoutOrEmpty().contains(pkg)) {
                log.warn("Package '{}' did not verify in sandbox '{}'", pkg, handle.id());
                continue;
            }
            installed.add(pkg);
        }
        if (!installed.isEmpty()) {
            log.info("Installed {} in sandbox '{}'", installed, handle.id());
        }
        return installed;
    }

    /**
     * Names under {@code dependencies} and {@code devDependencies} of the
     * manifest. Empty when the manifest is missing or unreadable, so every
     * referenced package gets installed.
     */
    Set<String> declaredPackages(EnvironmentHandle handle) {
        Set<String> declared = new HashSet<>();
        try {
            JsonNode manifest = JSON.readTree(handle.readFile(ProjectLayout.remote(ProjectLayout.MANIFEST)));
            for (String section : List.of("dependencies", "devDependencies")) {
                JsonNode deps = manifest.path(section);
                for (Iterator<String> names = deps.fieldNames(); names.hasNext(); ) {
                    declared.add(names.next());
                }
            }
        } catch (SandboxException | JsonProcessingException e) {
            log.warn("Could not read manifest in sandbox '{}': {}", handle.id(), e.getMessage());
        }
        return declared;
    }

    /**
     * Put back the project wiring generated code tends to drop: the Tailwind
     * directives in the base stylesheet, the stylesheet import in the entry
     * point and the Tailwind CDN bootstrap in index.html. Best-effort; a file
     * that cannot be read or written is logged and left as it is.
     *
     * @return project-relative paths that were rewritten
     */
    public List<String> ensureProjectDefaults(EnvironmentHandle handle) {
        List<String> repaired = new ArrayList<>();
        repair(handle, ProjectLayout.BASE_STYLES, ProjectTemplates::withTailwindDirectives, repaired);
        repair(handle, ProjectLayout.ENTRY_POINT, ProjectTemplates::withStylesheetImport, repaired);
        repair(handle, ProjectLayout.INDEX_HTML, ProjectTemplates::withTailwindBootstrap, repaired);
        if (!repaired.isEmpty()) {
            log.info("Restored project defaults in sandbox '{}': {}", handle.id(), repaired);
        }
        return repaired;
    }

    private void repair(EnvironmentHandle handle, String path, UnaryOperator<String> fix, List<String> repaired) {
        Cancellation.checkpoint();
        String remote = ProjectLayout.remote(path);
        String current;
        try {
            current = handle.readFile(remote);
        } catch (SandboxException e) {
            current = null;
        }
        String fixed = fix.apply(current);
        if (fixed == null || fixed.equals(current)) {
            return;
        }
        try {
            handle.writeFile(remote, fixed);
            repaired.add(path);
        } catch (SandboxException e) {
            log.warn("Could not repair {} in sandbox '{}': {}", path, handle.id(), e.getMessage());
        }
    }

    // -------------------------------------------------------------------------
    // Servers
    // -------------------------------------------------------------------------

    /**
     * Launch the dev server in the background and wait for it to answer.
     *
     * @return the public URL, or empty if the server never became reachable
     */
    public Optional<String> startServer(EnvironmentHandle handle, int port) {
        OrchestratorProperties.Server cfg = properties.getServer();
        try {
            String url = handle.resolvePublicUrl(port);
            handle.writeFile(ProjectLayout.remote(ProjectLayout.VITE_CONFIG),
                    ProjectTemplates.viteConfig(hostOf(url), port));
            handle.run("bash -lc \"cd " + ProjectLayout.PROJECT_DIR
                    + " && nohup npm run dev -- --host 0.0.0.0 --port " + port
                    + " > " + ProjectLayout.DEV_LOG + " 2>&1 &\"", cfg.getStartTimeout());
            if (waitUntilReady(handle, port)) {
                log.info("Dev server ready in sandbox '{}' at {}", handle.id(), url);
                return Optional.of(url);
            }
            log.warn("Dev server in sandbox '{}' not reachable on port {} after {} attempts",
                    handle.id(), port, cfg.getReadinessAttempts());
        } catch (SandboxException e) {
            log.warn("Dev server start failed in sandbox '{}': {}", handle.id(), e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Build the project and serve the output with {@code vite preview}, first
     * on {@code port}, then on {@code fallbackPort}.
     */
    public Optional<String> startPreviewServer(EnvironmentHandle handle, int port, int fallbackPort) {
        OrchestratorProperties.Server cfg = properties.getServer();
        try {
            CommandResult build = handle.run(inProject("npm run build"), cfg.getBuildTimeout());
            if (!build.success()) {
                log.warn("Build failed in sandbox '{}': {}", handle.id(), build.summary());
                return Optional.empty();
            }
        } catch (SandboxException e) {
            log.warn("Build failed in sandbox '{}': {}", handle.id(), e.getMessage());
            return Optional.empty();
        }
        for (int p : new int[] { port, fallbackPort }) {
            Optional<String> url = startPreviewOn(handle, p);
            if (url.isPresent()) {
                return url;
            }
        }
        return Optional.empty();
    }

    private Optional<String> startPreviewOn(EnvironmentHandle handle, int port) {
        try {
            String url = handle.resolvePublicUrl(port);
            handle.writeFile(ProjectLayout.remote(ProjectLayout.VITE_CONFIG),
                    ProjectTemplates.viteConfig(hostOf(url), port));
            handle.run("bash -lc \"cd " + ProjectLayout.PROJECT_DIR
                    + " && nohup npx vite preview --host 0.0.0.0 --port " + port + " --strictPort"
                    + " >> " + ProjectLayout.DEV_LOG + " 2>&1 &\"",
                    properties.getServer().getStartTimeout());
            if (waitUntilReady(handle, port)) {
                log.info("Preview server ready in sandbox '{}' at {}", handle.id(), url);
                return Optional.of(url);
            }
        } catch (SandboxException e) {
            log.warn("Preview server on port {} failed in sandbox '{}': {}", port, handle.id(), e.getMessage());
        }
        return Optional.empty();
    }

    /** Dev server first; if it never answers, a production preview. */
    public Optional<String> startWithFallback(EnvironmentHandle handle) {
        OrchestratorProperties.Server cfg = properties.getServer();
        Optional<String> url = startServer(handle, cfg.getPort());
        if (url.isPresent()) {
            return url;
        }
        log.info("Falling back to preview server in sandbox '{}'", handle.id());
        stopServer(handle);
        return startPreviewServer(handle, cfg.getPort(), cfg.getFallbackPort());
    }

    /** Stop, clear caches and the old log, start again. */
    public Optional<String> restartServer(EnvironmentHandle handle, int port) {
        stopServer(handle);
        clearBuildCaches(handle);
        try {
            handle.run("rm -f " + ProjectLayout.remote(ProjectLayout.DEV_LOG),
                    properties.getServer().getShortCommandTimeout());
        } catch (SandboxException e) {
            log.debug("Could not remove dev log in sandbox '{}': {}", handle.id(), e.getMessage());
        }
        return startServer(handle, port);
    }

    /** Kill any dev or preview server. Missing processes are not an error. */
    public void stopServer(EnvironmentHandle handle) {
        Duration timeout = properties.getServer().getShortCommandTimeout();
        try {
            handle.run("pkill -f 'npm run dev' || true", timeout);
            handle.run("pkill -f vite || true", timeout);
        } catch (SandboxException e) {
            log.warn("Stopping server in sandbox '{}' failed: {}", handle.id(), e.getMessage());
        }
    }

    public void clearBuildCaches(EnvironmentHandle handle) {
        try {
            handle.run(inProject("rm -rf .vite node_modules/.vite"),
                    properties.getServer().getShortCommandTimeout());
        } catch (SandboxException e) {
            log.warn("Clearing caches in sandbox '{}' failed: {}", handle.id(), e.getMessage());
        }
    }

    /**
     * Poll the port from inside the sandbox. Any HTTP status other than
     * {@code 000} (curl's "no connection") means the server is up.
     */
    boolean waitUntilReady(EnvironmentHandle handle, int port) {
        OrchestratorProperties.Server cfg = properties.getServer();
        String check = "curl -s -o /dev/null -w '%{http_code}' http://localhost:" + port;
        for (int attempt = 1; attempt <= cfg.getReadinessAttempts(); attempt++) {
            Cancellation.checkpoint();
            try {
                String code = handle.run(check, cfg.getReadinessCheckTimeout()).stdoutOrEmpty().strip();
                if (!code.isEmpty() && !code.equals("000")) {
                    log.debug("Port {} answered {} on attempt {}", port, code, attempt);
                    return true;
                }
            } catch (SandboxException e) {
                log.debug("Readiness check {} failed: {}", attempt, e.getMessage());
            }
            if (attempt < cfg.getReadinessAttempts()) {
                Cancellation.sleep(cfg.getReadinessBackoff());
            }
        }
        return false;
    }

    /** Host part of a public URL, for Vite's allowed-hosts and HMR settings. */
    static String hostOf(String url) {
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            throw new SandboxException("Sandbox returned an unusable public URL: " + url, e);
        }
        if (host == null) {
            throw new SandboxException("Sandbox returned an unusable public URL: " + url);
        }
        return host;
    }

    private static String inProject(String command) {
        return "cd " + ProjectLayout.PROJECT_DIR + " && " + command;
    }
}
