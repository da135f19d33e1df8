package com.sitepilot.orchestrator.lifecycle;

import com.sitepilot.orchestrator.config.OrchestratorProperties;
import com.sitepilot.orchestrator.sandbox.CommandResult;
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
 * Lists and reads the project's source tree.
 */
@Component
public class ProjectSnapshotter {

    private static final Logger log = LoggerFactory.getLogger(ProjectSnapshotter.class);

    private final OrchestratorProperties properties;

    public ProjectSnapshotter(OrchestratorProperties properties) {
        this.properties = properties;
    }

    /**
     * Project-relative paths of every file under {@code src/}, sorted. Names
     * that could not be written back through a payload are skipped.
     *
     * @throws SandboxException if the listing command fails
     */
    public List<String> listSourceFiles(EnvironmentHandle handle) {
        String dir = ProjectLayout.remote(ProjectLayout.SOURCE_DIR);
        CommandResult result = handle.run("find " + dir + " -type f",
                properties.getServer().getShortCommandTimeout());
        if (!result.success()) {
            throw new SandboxException("Listing " + dir + " failed: " + result.summary());
        }
        List<String> files = new ArrayList<>();
        for (String line : result.stdoutOrEmpty().split("\\R")) {
            String path = line.strip();
            if (path.isEmpty()) continue;
            try {
                files.add(ProjectLayout.resolve(path));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping {} in sandbox '{}': {}", path, handle.id(), e.getMessage());
            }
        }
        files.sort(null);
        return files;
    }

    /**
     * Every source file plus the manifest, keyed by project-relative path.
     *
     * @throws SandboxException if any file cannot be listed or read
     */
    public Map<String, String> snapshot(EnvironmentHandle handle) {
        Map<String, String> files = new LinkedHashMap<>();
        files.put(ProjectLayout.MANIFEST, handle.readFile(ProjectLayout.remote(ProjectLayout.MANIFEST)));
        for (String path : listSourceFiles(handle)) {
            Cancellation.checkpoint();
            files.put(path, handle.readFile(ProjectLayout.remote(path)));
        }
        return files;
    }
}
