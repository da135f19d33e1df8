package com.sitepilot.orchestrator.apply;

import com.sitepilot.orchestrator.lifecycle.ProjectLayout;
import com.sitepilot.orchestrator.sandbox.EnvironmentHandle;
import com.sitepilot.orchestrator.sandbox.SandboxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pre-write snapshot of the files an apply is about to touch.
 *
 * A file that did not exist at capture time is recorded as absent; restoring
 * it deletes whatever was written since.
 */
public class CriticalFileBackup {

    private static final Logger log = LoggerFactory.getLogger(CriticalFileBackup.class);

    private final EnvironmentHandle                 handle;
    private final Duration                          commandTimeout;
    private final Map<String, Optional<String>>     saved;

    private CriticalFileBackup(EnvironmentHandle handle, Duration commandTimeout,
                               Map<String, Optional<String>> saved) {
        this.handle         = handle;
        this.commandTimeout = commandTimeout;
        this.saved          = saved;
    }

    /**
     * Read the critical files plus {@code touched} (project-relative paths).
     */
    public static CriticalFileBackup capture(EnvironmentHandle handle, Collection<String> touched,
                                             Duration commandTimeout) {
        Set<String> paths = new LinkedHashSet<>(ProjectLayout.CRITICAL_FILES);
        paths.addAll(touched);

        Map<String, Optional<String>> saved = new LinkedHashMap<>();
        for (String path : paths) {
            try {
                saved.put(path, Optional.of(handle.readFile(ProjectLayout.remote(path))));
            } catch (SandboxException e) {
                saved.put(path, Optional.empty());
            }
        }
        log.debug("Backed up {} file(s) in sandbox '{}'", saved.size(), handle.id());
        return new CriticalFileBackup(handle, commandTimeout, saved);
    }

    public Set<String> paths() {
        return saved.keySet();
    }

    public boolean wasPresent(String path) {
        Optional<String> content = saved.get(path);
        return content != null && content.isPresent();
    }

    /**
     * Put one file back as it was at capture time. Paths that were not
     * captured are left alone.
     *
     * @throws SandboxException if the write or delete fails
     */
    public void restore(String path) {
        Optional<String> content = saved.get(path);
        if (content == null) {
            return;
        }
        if (content.isPresent()) {
            handle.writeFile(ProjectLayout.remote(path), content.get());
        } else {
            handle.run("rm -f " + ProjectLayout.remote(path), commandTimeout);
        }
        log.info("Restored {} in sandbox '{}'", path, handle.id());
    }

    /**
     * Restore every captured file. Keeps going past individual failures.
     *
     * @return paths that could not be restored
     */
    public List<String> restoreAll() {
        List<String> failed = new ArrayList<>();
        for (String path : saved.keySet()) {
            try {
                restore(path);
            } catch (SandboxException e) {
                log.error("Could not restore {} in sandbox '{}': {}", path, handle.id(), e.getMessage());
                failed.add(path);
            }
        }
        return failed;
    }

    /** Drop the snapshot once the new files are accepted. */
    public void discard() {
        saved.clear();
    }
}
