package com.sitepilot.orchestrator.session;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session mutual exclusion for the whole generate, apply, validate,
 * correct cycle.
 *
 * Locks are created lazily and never removed; an idle lock is a few dozen
 * bytes. Locks for different sessions are independent.
 */
@Component
public class SessionLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String sessionId) {
        // Fair so queued requests for one session run in arrival order.
        return locks.computeIfAbsent(sessionId, id -> new ReentrantLock(true));
    }
}
