package com.sitepilot.orchestrator.session;

import com.sitepilot.orchestrator.sandbox.EnvironmentHandle;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One session's live sandbox.
 *
 * The handle is owned exclusively by this entry. Mutable fields are only
 * written while the caller holds the session's lock; they are volatile so
 * status reads from other threads see a consistent value.
 */
public class SessionEnvironment {

    private final String            sessionId;
    private final EnvironmentHandle handle;
    private final Instant           createdAt;

    private volatile boolean projectSetupDone;

    // Last known good project files (src-relative path -> content). Edits are
    // generated and applied against this snapshot.
    private volatile Map<String, String> baseline;

    private volatile String lastUrl;

    public SessionEnvironment(String sessionId, EnvironmentHandle handle, Instant createdAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.handle    = Objects.requireNonNull(handle, "handle");
        this.createdAt = createdAt;
    }

    public String            getSessionId() { return sessionId; }
    public EnvironmentHandle getHandle()    { return handle; }
    public Instant           getCreatedAt() { return createdAt; }

    public boolean isProjectSetupDone()               { return projectSetupDone; }
    public void    markProjectSetupDone()             { this.projectSetupDone = true; }

    public Map<String, String> getBaseline()           { return baseline; }
    public boolean hasBaseline()                       { return baseline != null && !baseline.isEmpty(); }
    public void setBaseline(Map<String, String> files) { this.baseline = files == null ? null : Map.copyOf(files); }

    public String getLastUrl()                         { return lastUrl; }
    public void   setLastUrl(String lastUrl)           { this.lastUrl = lastUrl; }
}
