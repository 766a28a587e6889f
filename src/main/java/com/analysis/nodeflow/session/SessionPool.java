package com.analysis.nodeflow.session;

import com.analysis.nodeflow.api.RuntimeSession;
import com.analysis.nodeflow.api.SessionFactory;
import com.analysis.nodeflow.error.SessionLimitException;
import com.analysis.nodeflow.io.EngineConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Keeps at most one live session per project.
 *
 * <p>
 * Sessions are created on first use. A session is <i>in flight</i> while a
 * {@link Lease} on it is open; in-flight sessions are never reclaimed. When
 * the pool is full, sessions idle for longer than the idle timeout are closed
 * to make room before giving up with {@link SessionLimitException}.
 */
public final class SessionPool implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(SessionPool.class);

    private final SessionFactory factory;
    private final int maxSessions;
    private final Duration idleTimeout;
    private final Clock clock;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public SessionPool(SessionFactory factory, int maxSessions, Duration idleTimeout, Clock clock) {
        if (maxSessions < 1)
            throw new IllegalArgumentException("maxSessions must be positive: " + maxSessions);
        this.factory = Objects.requireNonNull(factory, "factory");
        this.maxSessions = maxSessions;
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SessionPool(SessionFactory factory, int maxSessions, Duration idleTimeout) {
        this(factory, maxSessions, idleTimeout, Clock.systemUTC());
    }

    /** Pool sized by {@code maxSessions} and {@code sessionIdleSeconds}. */
    public SessionPool(SessionFactory factory, EngineConfig config, Clock clock) {
        this(factory, config.getMaxSessions(), config.sessionIdleTimeout(), clock);
    }

    public SessionPool(SessionFactory factory, EngineConfig config) {
        this(factory, config, Clock.systemUTC());
    }

    /**
     * Returns a lease on the project's session, creating the session if needed.
     *
     * @throws SessionLimitException if the pool is full of sessions that cannot
     *                               be reclaimed
     */
    public synchronized Lease acquire(String projectId) {
        Entry entry = entries.get(projectId);
        if (entry == null) {
            if (entries.size() >= maxSessions)
                reclaimIdle();
            if (entries.size() >= maxSessions)
                throw new SessionLimitException(maxSessions);
            Instant now = clock.instant();
            entry = new Entry(projectId, factory.create(projectId), now);
            entries.put(projectId, entry);
            log.info("Started session for project {} ({} of {})", projectId, entries.size(), maxSessions);
        }
        entry.inFlight++;
        entry.lastActivity = clock.instant();
        return new Lease(entry);
    }

    /** Lease on an already running session; never creates one. */
    public synchronized Optional<Lease> acquireExisting(String projectId) {
        Entry entry = entries.get(projectId);
        if (entry == null)
            return Optional.empty();
        entry.inFlight++;
        entry.lastActivity = clock.instant();
        return Optional.of(new Lease(entry));
    }

    private synchronized void release(Entry entry) {
        entry.inFlight--;
        entry.lastActivity = clock.instant();
    }

    /**
     * Closes sessions that are not in flight and have been idle longer than the
     * idle timeout.
     *
     * @return number of sessions closed
     */
    public synchronized int reclaimIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int closed = 0;
        for (Iterator<Entry> it = entries.values().iterator(); it.hasNext();) {
            Entry entry = it.next();
            if (entry.inFlight == 0 && entry.lastActivity.isBefore(cutoff)) {
                it.remove();
                close(entry);
                closed++;
                log.warn("Reclaimed session of project {}, idle since {}", entry.projectId, entry.lastActivity);
            }
        }
        return closed;
    }

    /**
     * Closes one project's session.
     *
     * @return false if the project had no session
     * @throws IllegalStateException if the session is in flight
     */
    public synchronized boolean shutdown(String projectId) {
        Entry entry = entries.get(projectId);
        if (entry == null)
            return false;
        if (entry.inFlight > 0)
            throw new IllegalStateException("Session of project " + projectId + " is in use");
        entries.remove(projectId);
        close(entry);
        log.info("Shut down session of project {}", projectId);
        return true;
    }

    /** Closes every session, in flight or not. */
    public synchronized void shutdownAll() {
        for (Entry entry : entries.values())
            close(entry);
        log.info("Shut down {} sessions", entries.size());
        entries.clear();
    }

    @Override
    public void close() {
        shutdownAll();
    }

    public synchronized List<SessionInfo> sessions() {
        List<SessionInfo> out = new ArrayList<>(entries.size());
        for (Entry e : entries.values())
            out.add(new SessionInfo(e.projectId, e.createdAt, e.lastActivity, e.inFlight));
        return out;
    }

    public synchronized boolean hasSession(String projectId) {
        return entries.containsKey(projectId);
    }

    private static void close(Entry entry) {
        try {
            entry.session.close();
        } catch (RuntimeException e) {
            log.error("Failed to close session of project {}", entry.projectId, e);
        }
    }

    private static final class Entry {
        final String projectId;
        final RuntimeSession session;
        final Instant createdAt;
        Instant lastActivity;
        int inFlight;

        Entry(String projectId, RuntimeSession session, Instant createdAt) {
            this.projectId = projectId;
            this.session = session;
            this.createdAt = createdAt;
            this.lastActivity = createdAt;
        }
    }

    /** Use of a project's session; close it to mark the session idle again. */
    public final class Lease implements AutoCloseable {
        private final Entry entry;
        private boolean released;

        private Lease(Entry entry) {
            this.entry = entry;
        }

        public RuntimeSession session() {
            return entry.session;
        }

        public String projectId() {
            return entry.projectId;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                release(entry);
            }
        }
    }
}
