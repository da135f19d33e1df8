package com.sitepilot.orchestrator.session;

import com.sitepilot.orchestrator.lifecycle.EnvironmentLifecycleManager;
import com.sitepilot.orchestrator.sandbox.EnvironmentHandle;
import com.sitepilot.orchestrator.sandbox.SandboxException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the session id to sandbox mapping.
 *
 * The map lock is only held for lookups and mutations, never across remote
 * I/O: health checks and creation run unlocked, so a slow sandbox for one
 * session does not stall the others. Two concurrent creations for the same
 * session resolve at registration time; the loser terminates its own handle.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    /** Result of {@link #resolve(String)}. {@code isNew} means the project still needs scaffolding. */
    public record Resolution(SessionEnvironment environment, boolean isNew) {}

    private final Map<String, SessionEnvironment> entries = new HashMap<>();
    private final ReentrantLock                   mapLock = new ReentrantLock();

    private final EnvironmentLifecycleManager lifecycle;
    private final Clock                       clock;

    @Autowired
    public SessionRegistry(EnvironmentLifecycleManager lifecycle) {
        this(lifecycle, Clock.systemUTC());
    }

    SessionRegistry(EnvironmentLifecycleManager lifecycle, Clock clock) {
        this.lifecycle = lifecycle;
        this.clock     = clock;
    }

    /**
     * Return the session's healthy sandbox, creating one if there is none or
     * the existing one failed its health check.
     *
     * @throws SandboxException if a new sandbox cannot be created
     */
    public Resolution resolve(String sessionId) {
        SessionEnvironment existing = find(sessionId).orElse(null);

        if (existing != null) {
            if (lifecycle.isHealthy(existing.getHandle())) {
                log.debug("Reusing sandbox '{}' for session {}", existing.getHandle().id(), sessionId);
                return new Resolution(existing, false);
            }
            log.warn("Sandbox '{}' for session {} is unhealthy, replacing it",
                    existing.getHandle().id(), sessionId);
            if (evict(sessionId, existing)) {
                terminateQuietly(existing.getHandle());
            }
        }

        Cancellation.checkpoint();
        EnvironmentHandle handle = lifecycle.create();
        SessionEnvironment created = new SessionEnvironment(sessionId, handle, Instant.now(clock));

        SessionEnvironment winner;
        mapLock.lock();
        try {
            winner = entries.putIfAbsent(sessionId, created);
        } finally {
            mapLock.unlock();
        }
        if (winner != null) {
            log.info("Session {} registered concurrently, discarding sandbox '{}'", sessionId, handle.id());
            terminateQuietly(handle);
            return new Resolution(winner, false);
        }
        log.info("Registered sandbox '{}' for session {}", handle.id(), sessionId);
        return new Resolution(created, true);
    }

    /** Current entry without any health check. */
    public Optional<SessionEnvironment> find(String sessionId) {
        mapLock.lock();
        try {
            return Optional.ofNullable(entries.get(sessionId));
        } finally {
            mapLock.unlock();
        }
    }

    /** Terminate and forget the session's sandbox. No-op if there is none. */
    public boolean release(String sessionId) {
        SessionEnvironment removed;
        mapLock.lock();
        try {
            removed = entries.remove(sessionId);
        } finally {
            mapLock.unlock();
        }
        if (removed == null) {
            return false;
        }
        log.info("Releasing sandbox '{}' for session {}", removed.getHandle().id(), sessionId);
        terminateQuietly(removed.getHandle());
        return true;
    }

    /**
     * Forget {@code expected} if it is still the session's entry. Used after a
     * failed initial apply, when the sandbox is torn down by the caller.
     */
    public boolean evict(String sessionId, SessionEnvironment expected) {
        mapLock.lock();
        try {
            return entries.remove(sessionId, expected);
        } finally {
            mapLock.unlock();
        }
    }

    /** Terminate every sandbox. Runs on shutdown. */
    @PreDestroy
    public int releaseAll() {
        List<SessionEnvironment> all;
        mapLock.lock();
        try {
            all = new ArrayList<>(entries.values());
            entries.clear();
        } finally {
            mapLock.unlock();
        }
        for (SessionEnvironment env : all) {
            terminateQuietly(env.getHandle());
        }
        if (!all.isEmpty()) {
            log.info("Released {} sandbox(es)", all.size());
        }
        return all.size();
    }

    public int size() {
        mapLock.lock();
        try {
            return entries.size();
        } finally {
            mapLock.unlock();
        }
    }

    private static void terminateQuietly(EnvironmentHandle handle) {
        Cancellation.uninterruptibly(() -> {
            try {
                handle.terminate();
            } catch (SandboxException e) {
                log.warn("Terminating sandbox '{}' failed: {}", handle.id(), e.getMessage());
            }
        });
    }
}
