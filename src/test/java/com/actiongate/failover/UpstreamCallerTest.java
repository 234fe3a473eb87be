package com.actiongate.failover;

import com.actiongate.driver.DriverException;
import com.actiongate.error.UpstreamOutcomeUnknownException;
import com.actiongate.error.UpstreamPermanentException;
import com.actiongate.error.UpstreamTransientException;
import com.actiongate.testing.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamCallerTest {

    private static final String POOL = "rpc";

    @TempDir
    Path stateDir;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private FailoverStateStore failover;
    private UpstreamCaller caller;

    @BeforeEach
    void setUp() {
        failover = new FailoverStateStore(stateDir, new ObjectMapper(),
            Map.of(POOL, List.of("https://a", "https://b", "https://c")),
            new MutableClock(Instant.parse("2026-01-10T12:00:00Z")));
        caller = new UpstreamCaller(failover, new UpstreamErrorClassifier(), executor,
            Duration.ofMillis(300), 3, Duration.ofMillis(1), 1.5);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("transient failures are retried on the next endpoint")
    void transientFailureRetriesWithRotation() {
        AtomicInteger attempts = new AtomicInteger();

        String result = caller.call(POOL, "build", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new UpstreamStatusException(503, "service unavailable");
            }
            return "built";
        });

        assertEquals("built", result);
        assertEquals(3, attempts.get());
        assertEquals("https://c", failover.activeEndpoint(POOL).orElseThrow());
        assertEquals("build: service unavailable", failover.snapshot(POOL).lastError());
    }

    @Test
    void exhaustedRetriesSurfaceAsTransient() {
        AtomicInteger attempts = new AtomicInteger();

        UpstreamTransientException ex = assertThrows(UpstreamTransientException.class,
            () -> caller.call(POOL, "simulate", () -> {
                attempts.incrementAndGet();
                throw new UpstreamStatusException(429, "rate limited");
            }));

        assertEquals("UPSTREAM_TRANSIENT", ex.getErrorCode());
        assertEquals(3, attempts.get());
        assertEquals(0, failover.snapshot(POOL).currentIndex());
    }

    @Test
    void permanentFailureIsNotRetriedAndKeepsDriverCode() {
        AtomicInteger attempts = new AtomicInteger();

        UpstreamPermanentException ex = assertThrows(UpstreamPermanentException.class,
            () -> caller.call(POOL, "build", () -> {
                attempts.incrementAndGet();
                throw new DriverException("BUILD_ERROR", "amount must be positive");
            }));

        assertEquals("BUILD_ERROR", ex.getErrorCode());
        assertEquals(1, attempts.get());
        assertEquals("https://a", failover.activeEndpoint(POOL).orElseThrow());
    }

    @Test
    void unclassifiedFailureIsPermanent() {
        UpstreamPermanentException ex = assertThrows(UpstreamPermanentException.class,
            () -> caller.call(POOL, "build", () -> {
                throw new IllegalStateException("invalid account data");
            }));
        assertEquals("UPSTREAM_PERMANENT", ex.getErrorCode());
    }

    @Test
    @DisplayName("callOnce never retries even transient failures")
    void callOnceDoesNotRetry() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(UpstreamTransientException.class, () -> caller.callOnce(POOL, "broadcast", () -> {
            attempts.incrementAndGet();
            throw new UpstreamStatusException(502, "bad gateway");
        }));

        assertEquals(1, attempts.get());
        assertEquals("https://b", failover.activeEndpoint(POOL).orElseThrow());
        assertEquals("UPSTREAM_TRANSIENT", assertThrows(UpstreamTransientException.class,
            () -> caller.callOnce(POOL, "broadcast", () -> {
                throw new UpstreamStatusException(503, "unavailable");
            })).getErrorCode());
    }

    @Test
    @DisplayName("a timed-out callOnce reports an unknown outcome")
    void slowCallOnceHasUnknownOutcome() {
        AtomicInteger attempts = new AtomicInteger();

        UpstreamOutcomeUnknownException ex = assertThrows(UpstreamOutcomeUnknownException.class,
            () -> caller.callOnce(POOL, "broadcast", () -> {
                attempts.incrementAndGet();
                Thread.sleep(5_000);
                return "late";
            }));

        assertEquals(1, attempts.get());
        assertEquals("UPSTREAM_OUTCOME_UNKNOWN", ex.getErrorCode());
    }

    @Test
    void slowCallTimesOut() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(UpstreamTransientException.class, () -> caller.call(POOL, "simulate", () -> {
            attempts.incrementAndGet();
            Thread.sleep(5_000);
            return "late";
        }));

        assertEquals(3, attempts.get());
    }
}
