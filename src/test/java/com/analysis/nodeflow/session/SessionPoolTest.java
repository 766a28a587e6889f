package com.analysis.nodeflow.session;

import com.analysis.nodeflow.error.SessionLimitException;
import com.analysis.nodeflow.io.EngineConfig;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class SessionPoolTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final Map<String, FakeSession> created = new HashMap<>();

    private SessionPool pool(int max) {
        return new SessionPool(projectId -> {
            FakeSession session = new FakeSession();
            created.put(projectId, session);
            return session;
        }, max, Duration.ofSeconds(300), clock);
    }

    @Test
    public void testOneSessionPerProject() {
        SessionPool pool = pool(3);
        try (SessionPool.Lease first = pool.acquire("p1"); SessionPool.Lease second = pool.acquire("p1")) {
            assertSame(first.session(), second.session());
            assertEquals("p1", first.projectId());
            assertEquals(2, pool.sessions().get(0).inFlight());
        }
        assertEquals(1, created.size());
        assertEquals(0, pool.sessions().get(0).inFlight());
    }

    @Test
    public void testLimitWhenAllBusy() {
        SessionPool pool = pool(2);
        SessionPool.Lease a = pool.acquire("a");
        SessionPool.Lease b = pool.acquire("b");
        clock.advance(Duration.ofHours(1));
        try {
            pool.acquire("c");
            fail("Expected SessionLimitException");
        } catch (SessionLimitException e) {
            assertTrue(e.getMessage().contains("(2)"));
        }
        a.close();
        b.close();
    }

    @Test
    public void testFullPoolReclaimsIdleSessions() {
        SessionPool pool = pool(2);
        pool.acquire("a").close();
        clock.advance(Duration.ofSeconds(200));
        pool.acquire("b").close();
        clock.advance(Duration.ofSeconds(150));

        try (SessionPool.Lease c = pool.acquire("c")) {
            assertNotNull(c.session());
        }
        assertFalse(pool.hasSession("a"));
        assertTrue(created.get("a").isClosed());
        assertTrue("b is not idle long enough", pool.hasSession("b"));
        assertTrue(pool.hasSession("c"));
    }

    @Test
    public void testFullPoolWithoutIdleSessions() {
        SessionPool pool = pool(1);
        pool.acquire("a").close();
        clock.advance(Duration.ofSeconds(10));
        try {
            pool.acquire("b");
            fail("Expected SessionLimitException");
        } catch (SessionLimitException expected) {
            assertTrue(pool.hasSession("a"));
        }
    }

    @Test
    public void testInFlightSessionsAreNeverReclaimed() {
        SessionPool pool = pool(2);
        try (SessionPool.Lease lease = pool.acquire("a")) {
            clock.advance(Duration.ofHours(2));
            assertEquals(0, pool.reclaimIdle());
            assertFalse(created.get("a").isClosed());
        }
        clock.advance(Duration.ofHours(2));
        assertEquals(1, pool.reclaimIdle());
    }

    @Test
    public void testAcquireExistingNeverCreates() {
        SessionPool pool = pool(2);
        assertFalse(pool.acquireExisting("a").isPresent());
        assertTrue(created.isEmpty());

        pool.acquire("a").close();
        try (SessionPool.Lease lease = pool.acquireExisting("a").orElseThrow()) {
            assertSame(created.get("a"), lease.session());
        }
    }

    @Test
    public void testShutdown() {
        SessionPool pool = pool(2);
        SessionPool.Lease lease = pool.acquire("a");
        try {
            pool.shutdown("a");
            fail("Expected IllegalStateException");
        } catch (IllegalStateException expected) {
            assertTrue(pool.hasSession("a"));
        }
        lease.close();
        lease.close();
        assertTrue(pool.shutdown("a"));
        assertTrue(created.get("a").isClosed());
        assertFalse(pool.shutdown("a"));
    }

    @Test
    public void testCloseShutsDownEverything() {
        SessionPool pool = pool(3);
        pool.acquire("a").close();
        SessionPool.Lease busy = pool.acquire("b");

        pool.close();

        assertTrue(pool.sessions().isEmpty());
        assertTrue(created.get("a").isClosed());
        assertTrue(created.get("b").isClosed());
        busy.close();
    }

    @Test
    public void testSessionInfo() {
        SessionPool pool = pool(3);
        Instant start = clock.instant();
        pool.acquire("a").close();
        clock.advance(Duration.ofSeconds(5));
        SessionPool.Lease lease = pool.acquire("a");

        List<SessionInfo> infos = pool.sessions();
        assertEquals(1, infos.size());
        assertEquals("a", infos.get(0).projectId());
        assertEquals(start, infos.get(0).createdAt());
        assertEquals(start.plusSeconds(5), infos.get(0).lastActivity());
        assertEquals(1, infos.get(0).inFlight());
        lease.close();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPositiveLimit() {
        pool(0);
    }

    @Test
    public void testLimitsComeFromConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.setMaxSessions(1);
        config.setSessionIdleSeconds(60);
        SessionPool pool = new SessionPool(projectId -> new FakeSession(), config, clock);

        pool.acquire("a").close();
        clock.advance(Duration.ofSeconds(30));
        try {
            pool.acquire("b");
            fail("Expected SessionLimitException");
        } catch (SessionLimitException e) {
            assertTrue(e.getMessage().contains("(1)"));
        }

        clock.advance(Duration.ofSeconds(31));
        try (SessionPool.Lease b = pool.acquire("b")) {
            assertEquals("b", b.projectId());
        }
        assertEquals(1, pool.sessions().size());
    }
}
