package com.actiongate.trace;

import com.actiongate.audit.ArtifactHasher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class FileTraceStoreTest {

    @TempDir
    Path baseDir;

    private FileTraceStore store;

    @BeforeEach
    void setUp() {
        store = new FileTraceStore(baseDir, new ObjectMapper().findAndRegisterModules());
    }

    private static TraceEvent event(TraceEventType type, String runId, String step) {
        return TraceEvent.builder(type, runId)
            .at(Instant.parse("2026-01-10T12:00:00Z"))
            .step(step)
            .data("n", 1)
            .data("skipped", null)
            .build();
    }

    @Nested
    @DisplayName("Event log")
    class EventLog {

        @Test
        void eventsComeBackInAppendOrder() {
            store.emit(event(TraceEventType.RUN_STARTED, "run_a", null));
            store.emit(event(TraceEventType.STEP_STARTED, "run_a", "s1"));
            store.emit(event(TraceEventType.RUN_FINISHED, "run_a", null));

            List<TraceEvent> events = store.loadRunEvents("run_a");

            assertEquals(List.of(TraceEventType.RUN_STARTED, TraceEventType.STEP_STARTED, TraceEventType.RUN_FINISHED),
                events.stream().map(TraceEvent::type).toList());
            assertEquals("s1", events.get(1).stepId());
            assertEquals(Map.of("n", 1), events.get(0).data());
        }

        @Test
        void oneJsonObjectPerLineWithDottedTypes() throws Exception {
            store.emit(event(TraceEventType.TX_SUBMITTED, "run_b", "s1"));

            List<String> lines = Files.readAllLines(baseDir.resolve("runs/run_b/trace.jsonl"));

            assertEquals(1, lines.size());
            assertTrue(lines.get(0).contains("\"type\":\"tx.submitted\""));
            assertFalse(lines.get(0).contains("skipped"));
        }

        @Test
        void unreadableLinesAreSkipped() throws Exception {
            store.emit(event(TraceEventType.RUN_STARTED, "run_c", null));
            Files.writeString(baseDir.resolve("runs/run_c/trace.jsonl"), "{broken\n",
                StandardOpenOption.APPEND);
            store.emit(event(TraceEventType.RUN_FINISHED, "run_c", null));

            assertEquals(2, store.loadRunEvents("run_c").size());
        }

        @Test
        @DisplayName("concurrent appends to one run never interleave")
        void concurrentAppendsStayWholeLines() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String step = "s" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    store.emit(event(TraceEventType.TOOL_CALLED, "run_busy", step));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
            pool.shutdown();

            List<TraceEvent> events = store.loadRunEvents("run_busy");
            assertEquals(200, events.size());
            assertEquals(200, events.stream().map(TraceEvent::stepId).distinct().count());
        }

        @Test
        @DisplayName("more runs than lock stripes append concurrently without losing events")
        void manyRunsShareLocks() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int run = 0; run < 100; run++) {
                String runId = "run_" + run;
                for (int i = 0; i < 5; i++) {
                    String step = "s" + i;
                    futures.add(pool.submit(() -> {
                        start.await();
                        store.emit(event(TraceEventType.TOOL_CALLED, runId, step));
                        return null;
                    }));
                }
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
            pool.shutdown();

            for (int run = 0; run < 100; run++) {
                List<TraceEvent> events = store.loadRunEvents("run_" + run);
                assertEquals(5, events.size());
                assertEquals(5, events.stream().map(TraceEvent::stepId).distinct().count());
            }
        }

        @Test
        void unknownRunHasNoEvents() {
            assertFalse(store.runExists("run_nope"));
            assertTrue(store.loadRunEvents("run_nope").isEmpty());
        }
    }

    @Nested
    @DisplayName("Artifacts")
    class Artifacts {

        @Test
        void writeReturnsRelativePathAndContentHash() throws Exception {
            ArtifactRef ref = store.writeArtifact("run_d", "payload-1", Map.of("k", "v"));

            Path file = baseDir.resolve(ref.path());
            assertEquals("runs/run_d/artifacts/payload-1.json", ref.path());
            assertEquals(ArtifactHasher.sha256Hex(Files.readAllBytes(file)), ref.sha256());
            assertEquals(Files.size(file), ref.bytes());
        }

        @Test
        void loadAndListArtifacts() {
            store.writeArtifact("run_e", "simulation-1", Map.of("ok", true));
            store.writeArtifact("run_e", "payload-1", Map.of("k", "v"));

            Optional<JsonNode> loaded = store.loadArtifact("run_e", "payload-1");

            assertTrue(loaded.isPresent());
            assertEquals("v", loaded.get().get("k").asText());
            assertEquals(List.of("payload-1", "simulation-1"), store.listArtifacts("run_e"));
            assertTrue(store.loadArtifact("run_e", "missing").isEmpty());
        }

        @Test
        void rewriteReplacesContent() {
            store.writeArtifact("run_f", "a", Map.of("v", 1));
            store.writeArtifact("run_f", "a", Map.of("v", 2));

            assertEquals(2, store.loadArtifact("run_f", "a").orElseThrow().get("v").asInt());
            assertEquals(List.of("a"), store.listArtifacts("run_f"));
        }

        @Test
        void pathTraversalIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> store.writeArtifact("run_g", "../escape", Map.of()));
            assertThrows(IllegalArgumentException.class,
                () -> store.emit(event(TraceEventType.RUN_STARTED, "../run", null)));
            assertTrue(store.loadArtifact("..", "x").isEmpty());
        }
    }

    @Test
    void listRunsReturnsRunDirectories() {
        store.emit(event(TraceEventType.RUN_STARTED, "run_1", null));
        store.emit(event(TraceEventType.RUN_STARTED, "run_2", null));

        assertEquals(2, store.listRuns().size());
        assertTrue(store.listRuns().containsAll(List.of("run_1", "run_2")));
    }
}
